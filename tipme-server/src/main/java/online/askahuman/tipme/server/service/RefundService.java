package online.askahuman.tipme.server.service;

import online.askahuman.tipme.gateway.LightningGateway;
import online.askahuman.tipme.gateway.PaymentResult;
import online.askahuman.tipme.lnurl.LightningAddressResolver;
import online.askahuman.tipme.lnurl.LnurlException;
import online.askahuman.tipme.server.entity.Voucher;
import online.askahuman.tipme.server.store.VoucherStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.OptionalLong;

/**
 * Sends money back to a voucher's Lightning address: expired balances from the refund sweep
 * and funding payments that arrived after their voucher stopped being active.
 */
@Service
public class RefundService {

    private static final Logger log = LoggerFactory.getLogger(RefundService.class);

    private final LightningAddressResolver resolver;
    private final LightningGateway gateway;
    private final VoucherStore store;

    public RefundService(LightningAddressResolver resolver, LightningGateway gateway, VoucherStore store) {
        this.resolver = resolver;
        this.gateway = gateway;
        this.store = store;
    }

    /**
     * Resolves the address, clamps the amount to its sendable range rounded down to whole
     * satoshis, and pays the invoice it returns. Amounts below the minimum are dust and never
     * reach the gateway.
     *
     * @param lightningAddress recipient, {@code user@domain}
     * @param amountMsats      amount owed
     */
    public RefundResult refundToLightningAddress(String lightningAddress, long amountMsats) {
        LightningAddressResolver.PayParams params;
        try {
            params = resolver.resolve(lightningAddress);
        } catch (IllegalArgumentException | LnurlException e) {
            return RefundResult.failed("resolve " + lightningAddress + ": " + e.getMessage());
        }

        if (amountMsats < params.minSendable()) {
            return RefundResult.dust("refund amount " + amountMsats + " msats is below minSendable "
                    + params.minSendable() + " msats");
        }
        long amount = amountMsats;
        if (amount > params.maxSendable()) {
            log.warn("Refund to {} capped at maxSendable {} msats, {} msats not refunded",
                    lightningAddress, params.maxSendable(), amount - params.maxSendable());
            amount = params.maxSendable();
        }
        // some wallets reject sub-satoshi amounts
        amount = (amount / 1000) * 1000;
        if (amount <= 0 || amount < params.minSendable()) {
            return RefundResult.dust("refund amount rounds to " + amount + " msats");
        }

        String invoice;
        try {
            invoice = resolver.requestInvoice(params.callback(), amount);
        } catch (LnurlException e) {
            return RefundResult.failed("invoice from " + lightningAddress + ": " + e.getMessage());
        }

        PaymentResult payment = gateway.payInvoice(invoice);
        switch (payment.outcome()) {
            case SUCCEEDED:
                return RefundResult.refunded(amount);
            case FAILED:
                return RefundResult.failed(payment.reason());
            default:
                return RefundResult.ambiguous(amount, payment.reason());
        }
    }

    /**
     * Refunds one expired voucher. The voucher is deactivated before paying so a lost response
     * can never lead to a second refund; a definitive failure restores it for the next sweep.
     *
     * @return the result, or null if the voucher was already inactive
     */
    public RefundResult refundExpiredVoucher(Voucher voucher) {
        String payId = voucher.getPayId();
        String address = voucher.getLightningAddress();

        OptionalLong deactivated = store.deactivateForRefund(payId);
        if (deactivated.isEmpty()) {
            log.debug("Refund skipped for pay_id={}: already inactive", payId);
            return null;
        }
        long balance = deactivated.getAsLong();
        log.info("Refunding {} msats to {} (pay_id={})", balance, address, payId);

        RefundResult result = refundToLightningAddress(address, balance);
        switch (result.outcome()) {
            case REFUNDED:
                log.info("Refunded and deactivated pay_id={} ({} msats)", payId, result.amountMsats());
                break;
            case DUST:
                log.warn("Refund for pay_id={} dropped as dust: {}", payId, result.detail());
                break;
            case FAILED:
                log.warn("Refund payment failed for pay_id={}, re-activating: {}", payId, result.detail());
                try {
                    store.reactivateWithBalance(payId, balance);
                } catch (RuntimeException e) {
                    log.error("CRITICAL: failed to re-activate pay_id={} ({} msats owed to {})",
                            payId, balance, address, e);
                }
                break;
            default:
                log.error("CRITICAL: refund payment outcome unknown for pay_id={} ({} msats owed to {}): {}",
                        payId, balance, address, result.detail());
        }
        return result;
    }
}
