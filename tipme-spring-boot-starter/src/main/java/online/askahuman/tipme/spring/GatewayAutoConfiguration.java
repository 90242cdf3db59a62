package online.askahuman.tipme.spring;

import online.askahuman.tipme.gateway.LightningGateway;
import online.askahuman.tipme.gateway.blitzi.BlitziGateway;
import online.askahuman.tipme.gateway.lnd.LndGateway;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the {@link LightningGateway}.
 *
 * <p>{@code tipme.gateway.type} selects the backend: {@code lnd} (default) reads the
 * macaroon file and optional TLS certificate, {@code blitzi} talks to a Blitzi server.
 * There is no offline fallback; a misconfigured gateway fails startup.</p>
 */
@AutoConfiguration
@EnableConfigurationProperties(TipmeProperties.class)
public class GatewayAutoConfiguration {

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "tipme.gateway", name = "type", havingValue = "lnd", matchIfMissing = true)
    static class LndGatewayConfiguration {

        @Bean
        @ConditionalOnMissingBean(LightningGateway.class)
        public LndGateway lndGateway(TipmeProperties props) {
            TipmeProperties.Lnd lnd = props.getGateway().getLnd();
            return LndGateway.withMacaroonFile(
                    lnd.getHost(),
                    lnd.getRestPort(),
                    lnd.getMacaroonPath(),
                    lnd.getTlsCertPath(),
                    props.getGateway().getPollInterval()
            );
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "tipme.gateway", name = "type", havingValue = "blitzi")
    static class BlitziGatewayConfiguration {

        @Bean
        @ConditionalOnMissingBean(LightningGateway.class)
        public BlitziGateway blitziGateway(TipmeProperties props) {
            TipmeProperties.Blitzi blitzi = props.getGateway().getBlitzi();
            return BlitziGateway.create(blitzi.getUrl(), blitzi.getToken(), props.getGateway().getPollInterval());
        }
    }
}
