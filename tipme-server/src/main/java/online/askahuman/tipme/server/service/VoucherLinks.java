package online.askahuman.tipme.server.service;

import online.askahuman.tipme.lnurl.Bech32Utils;
import online.askahuman.tipme.server.config.VoucherProperties;
import org.springframework.stereotype.Component;

/**
 * Builds the public URLs of a voucher and their LNURL encodings.
 */
@Component
public class VoucherLinks {

    private final VoucherProperties properties;

    public VoucherLinks(VoucherProperties properties) {
        this.properties = properties;
    }

    public String payUrl(String payId) {
        return properties.getBaseUrl() + "/pay/" + payId;
    }

    public String payCallbackUrl(String payId) {
        return payUrl(payId) + "/callback";
    }

    public String withdrawUrl(String withdrawId) {
        return properties.getBaseUrl() + "/withdraw/" + withdrawId;
    }

    public String withdrawCallbackUrl(String withdrawId) {
        return withdrawUrl(withdrawId) + "/callback";
    }

    public String lnurlPay(String payId) {
        return Bech32Utils.encodeLnurl(payUrl(payId));
    }

    public String lnurlWithdraw(String withdrawId) {
        return Bech32Utils.encodeLnurl(withdrawUrl(withdrawId));
    }
}
