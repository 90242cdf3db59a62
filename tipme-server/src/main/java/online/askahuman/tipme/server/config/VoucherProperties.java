package online.askahuman.tipme.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Voucher economics and lifetimes.
 *
 * <p>Bind to {@code tipme.voucher.*} in application.yml.</p>
 */
@ConfigurationProperties(prefix = "tipme.voucher")
public class VoucherProperties {

    /** Public base URL used when building LNURL links and callbacks. */
    private String baseUrl = "http://localhost:8080";

    /** Creation fee charged per voucher (satoshis). */
    private long feePerVoucherSats = 10;

    /** Minimum fee retained from every funding payment (millisatoshis). */
    private long fundingFeeMinMsats = 2000;

    /** Proportional fee retained from every funding payment. */
    private double fundingFeePercent = 0.004;

    private int maxVouchersPerRequest = 10;

    /** Lifetime of a voucher counted from its creation. */
    private Duration absoluteExpiry = Duration.ofDays(365);

    /** Funding expiry window applied when a creation request does not name one. */
    private Duration defaultRelativeExpiry = Duration.ofDays(30);

    private long minPayAmountSats = 100;
    private long maxPayAmountSats = 200_000;

    /** How long background tasks wait for an invoice to settle. */
    private Duration confirmationTimeout = Duration.ofHours(1);

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public long getFeePerVoucherSats() { return feePerVoucherSats; }
    public void setFeePerVoucherSats(long feePerVoucherSats) { this.feePerVoucherSats = feePerVoucherSats; }

    public long getFundingFeeMinMsats() { return fundingFeeMinMsats; }
    public void setFundingFeeMinMsats(long fundingFeeMinMsats) { this.fundingFeeMinMsats = fundingFeeMinMsats; }

    public double getFundingFeePercent() { return fundingFeePercent; }
    public void setFundingFeePercent(double fundingFeePercent) { this.fundingFeePercent = fundingFeePercent; }

    public int getMaxVouchersPerRequest() { return maxVouchersPerRequest; }
    public void setMaxVouchersPerRequest(int maxVouchersPerRequest) { this.maxVouchersPerRequest = maxVouchersPerRequest; }

    public Duration getAbsoluteExpiry() { return absoluteExpiry; }
    public void setAbsoluteExpiry(Duration absoluteExpiry) { this.absoluteExpiry = absoluteExpiry; }

    public Duration getDefaultRelativeExpiry() { return defaultRelativeExpiry; }
    public void setDefaultRelativeExpiry(Duration defaultRelativeExpiry) { this.defaultRelativeExpiry = defaultRelativeExpiry; }

    public long getMinPayAmountSats() { return minPayAmountSats; }
    public void setMinPayAmountSats(long minPayAmountSats) { this.minPayAmountSats = minPayAmountSats; }

    public long getMaxPayAmountSats() { return maxPayAmountSats; }
    public void setMaxPayAmountSats(long maxPayAmountSats) { this.maxPayAmountSats = maxPayAmountSats; }

    public Duration getConfirmationTimeout() { return confirmationTimeout; }
    public void setConfirmationTimeout(Duration confirmationTimeout) { this.confirmationTimeout = confirmationTimeout; }
}
