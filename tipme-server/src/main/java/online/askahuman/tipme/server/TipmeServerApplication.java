package online.askahuman.tipme.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Tip voucher service: issues voucher batches, funds them over LNURL-pay, redeems them
 * over LNURL-withdraw and refunds expired balances.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class TipmeServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TipmeServerApplication.class, args);
    }
}
