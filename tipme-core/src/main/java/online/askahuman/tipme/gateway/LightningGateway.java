package online.askahuman.tipme.gateway;

import online.askahuman.tipme.lnurl.LnurlException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.OptionalLong;

/**
 * Client contract for the Lightning payment backend that issues invoices, reports
 * their settlement and pays outbound invoices.
 *
 * <p>Implementations must be thread-safe: a single instance is shared by every request
 * worker and background confirmation task.</p>
 */
public interface LightningGateway {

    System.Logger log = System.getLogger(LightningGateway.class.getName());

    /**
     * Create an invoice.
     *
     * @param amountMsats amount in millisatoshis
     * @param description invoice description shown by the payer's wallet
     * @return the payment hash and BOLT11 string
     * @throws LnurlException if the gateway is unavailable or answers malformed data
     */
    GatewayInvoice createInvoice(long amountMsats, String description);

    /**
     * Check once whether an invoice has settled.
     *
     * @param paymentHash hex payment hash from {@link #createInvoice}
     * @return true if paid
     * @throws LnurlException on transport or protocol errors
     */
    boolean isInvoicePaid(String paymentHash);

    /**
     * Pay a BOLT11 invoice. Never throws for payment outcomes; the result is classified
     * as succeeded, definitively failed or ambiguous.
     *
     * @param bolt11 the invoice to pay
     * @return the classified result
     */
    PaymentResult payInvoice(String bolt11);

    /**
     * Amount an invoice asks for. The default reads the invoice prefix; gateways that can
     * decode invoices themselves may ask the node instead.
     *
     * @param bolt11 the invoice
     * @return the amount in millisatoshis, or empty for an amountless invoice
     * @throws IllegalArgumentException if the invoice is malformed
     * @throws LnurlException           if the gateway cannot decode it
     */
    default OptionalLong decodeAmountMsats(String bolt11) {
        return Bolt11.amountMsats(bolt11);
    }

    /**
     * Interval between settlement checks in {@link #waitForPayment}.
     *
     * @return poll interval
     */
    Duration pollInterval();

    /**
     * Poll {@link #isInvoicePaid} until the invoice settles or {@code deadline} passes.
     * Transient errors are swallowed and retried up to the deadline.
     *
     * @param paymentHash hex payment hash
     * @param deadline    instant after which waiting stops
     * @param clock       time source
     * @return true if the invoice was paid, false on timeout or interruption
     */
    default boolean waitForPayment(String paymentHash, Instant deadline, Clock clock) {
        long intervalMillis = Math.max(1L, pollInterval().toMillis());
        while (true) {
            try {
                if (isInvoicePaid(paymentHash)) {
                    return true;
                }
            } catch (RuntimeException e) {
                log.log(System.Logger.Level.DEBUG,
                        "Settlement check for {0} failed, retrying: {1}", paymentHash, e.getMessage());
            }
            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                return false;
            }
            try {
                Thread.sleep(Math.min(intervalMillis, remaining.toMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }
}
