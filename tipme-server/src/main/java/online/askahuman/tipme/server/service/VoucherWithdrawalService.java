package online.askahuman.tipme.server.service;

import online.askahuman.tipme.gateway.LightningGateway;
import online.askahuman.tipme.gateway.PaymentResult;
import online.askahuman.tipme.lnurl.LnurlException;
import online.askahuman.tipme.server.config.VoucherProperties;
import online.askahuman.tipme.server.dto.LnurlResponse;
import online.askahuman.tipme.server.dto.LnurlStatusResponse;
import online.askahuman.tipme.server.dto.WithdrawRequestResponse;
import online.askahuman.tipme.server.entity.Voucher;
import online.askahuman.tipme.server.entity.WithdrawSession;
import online.askahuman.tipme.server.exception.WithdrawSessionException;
import online.askahuman.tipme.server.store.VoucherStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * LNURL-withdraw redemption of vouchers (LUD-03).
 *
 * <p>Payment outcomes decide the voucher's fate: success deactivates it, a definitive failure
 * leaves it funded for another try, and an ambiguous outcome deactivates it so it can never be
 * paid out twice.</p>
 */
@Service
public class VoucherWithdrawalService {

    private static final Logger log = LoggerFactory.getLogger(VoucherWithdrawalService.class);

    static final String DEFAULT_DESCRIPTION = "TipMe withdrawal";

    private final VoucherStore store;
    private final LightningGateway gateway;
    private final RefundService refundService;
    private final ConfirmationTaskRunner taskRunner;
    private final VoucherLinks links;
    private final VoucherProperties properties;
    private final Clock clock;

    /** Pay ids with a withdrawal payment in flight. */
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public VoucherWithdrawalService(VoucherStore store, LightningGateway gateway, RefundService refundService,
                                    ConfirmationTaskRunner taskRunner, VoucherLinks links,
                                    VoucherProperties properties, Clock clock) {
        this.store = store;
        this.gateway = gateway;
        this.refundService = refundService;
        this.taskRunner = taskRunner;
        this.links = links;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Step 1: mint a k1 for an active, funded voucher.
     */
    public LnurlResponse withdrawRequest(String withdrawId) {
        Optional<Voucher> found = store.findVoucherByWithdrawId(withdrawId);
        if (found.isEmpty()) {
            return LnurlStatusResponse.error("voucher not found");
        }
        LnurlStatusResponse refusal = checkWithdrawable(found.get());
        if (refusal != null) {
            return refusal;
        }
        WithdrawSession session = store.createWithdrawSession(withdrawId);
        log.debug("Withdraw session {}... issued for withdraw_id={}", shortK1(session.getK1()), withdrawId);
        return WithdrawRequestResponse.of(links.withdrawCallbackUrl(withdrawId), session.getK1(),
                DEFAULT_DESCRIPTION, found.get().getTotalPaidMsats());
    }

    /**
     * Step 2: consume the k1 and pay the holder's invoice with the whole balance.
     */
    public LnurlResponse withdrawCallback(String withdrawId, String k1, String pr) {
        if (k1 == null || k1.isBlank() || pr == null || pr.isBlank()) {
            return LnurlStatusResponse.error("missing k1 or pr parameter");
        }

        String payId;
        try {
            payId = store.consumeWithdrawSession(k1, withdrawId);
        } catch (WithdrawSessionException e) {
            log.warn("Withdraw callback for withdraw_id={} rejected ({}): k1={}...",
                    withdrawId, e.getReason(), shortK1(k1));
            return LnurlStatusResponse.error("invalid or already-used k1");
        }

        if (!inFlight.add(payId)) {
            log.warn("Withdraw callback for withdraw_id={} refused: payment already in flight", withdrawId);
            return LnurlStatusResponse.error("withdrawal already in progress");
        }
        try {
            return payOut(payId, withdrawId, pr);
        } finally {
            inFlight.remove(payId);
        }
    }

    private LnurlResponse payOut(String payId, String withdrawId, String pr) {
        Optional<Voucher> found = store.findVoucherByPayId(payId);
        if (found.isEmpty()) {
            return LnurlStatusResponse.error("voucher not found");
        }
        Voucher voucher = found.get();
        LnurlStatusResponse refusal = checkWithdrawable(voucher);
        if (refusal != null) {
            return refusal;
        }
        long balance = voucher.getTotalPaidMsats();

        OptionalLong invoiceAmount;
        try {
            invoiceAmount = gateway.decodeAmountMsats(pr);
        } catch (IllegalArgumentException e) {
            log.warn("Withdraw callback for withdraw_id={} carried a malformed invoice: {}", withdrawId, e.getMessage());
            return LnurlStatusResponse.error("invalid invoice");
        } catch (LnurlException e) {
            log.warn("Could not decode invoice for withdraw_id={}: {}", withdrawId, e.getMessage());
            return LnurlStatusResponse.error("failed to decode invoice");
        }
        if (invoiceAmount.isEmpty() || invoiceAmount.getAsLong() != balance) {
            log.warn("Withdraw invoice for withdraw_id={} asks {} msats, balance is {} msats",
                    withdrawId, invoiceAmount.isPresent() ? invoiceAmount.getAsLong() : "no amount", balance);
            return LnurlStatusResponse.error("invoice amount does not match balance");
        }

        PaymentResult payment = gateway.payInvoice(pr);
        switch (payment.outcome()) {
            case SUCCEEDED:
                onPaid(voucher, balance);
                return LnurlStatusResponse.ok();
            case FAILED:
                log.warn("Withdraw payment failed for withdraw_id={} ({} msats), voucher stays active: {}",
                        withdrawId, balance, payment.reason());
                return LnurlStatusResponse.error("payment failed");
            default:
                log.error("CRITICAL: withdraw payment outcome unknown for withdraw_id={} ({} msats), "
                        + "deactivating to prevent double-pay: {}", withdrawId, balance, payment.reason());
                long zeroed;
                try {
                    zeroed = store.deactivateForWithdrawal(payId);
                } catch (RuntimeException e) {
                    log.error("CRITICAL: failed to deactivate withdraw_id={} after ambiguous payment",
                            withdrawId, e);
                    return LnurlStatusResponse.error("payment timed out");
                }
                reconcile(voucher, balance, zeroed);
                return LnurlStatusResponse.error("payment timed out");
        }
    }

    /**
     * Funds are gone at this point; the wallet is told OK whatever happens here.
     */
    private void onPaid(Voucher voucher, long paidMsats) {
        String payId = voucher.getPayId();
        long zeroed;
        try {
            zeroed = store.deactivateForWithdrawal(payId);
        } catch (RuntimeException e) {
            log.error("CRITICAL: voucher pay_id={} paid out {} msats but not deactivated", payId, paidMsats, e);
            return;
        }
        log.info("Withdrawal of {} msats from pay_id={} complete", paidMsats, payId);
        reconcile(voucher, paidMsats, zeroed);
    }

    /**
     * Compares the balance the store zeroed with the amount that went out in the payment.
     */
    private void reconcile(Voucher voucher, long paidMsats, long zeroed) {
        String payId = voucher.getPayId();
        if (zeroed < paidMsats) {
            // the refund job swept the voucher while the payment was in flight
            log.error("CRITICAL: voucher pay_id={} paid out {} msats but only {} msats were left to zero; "
                    + "a concurrent refund already went out", payId, paidMsats, zeroed);
            return;
        }
        long surplus = zeroed - paidMsats;
        if (surplus > 0) {
            // a funding credit landed while the payment was in flight
            String address = voucher.getLightningAddress();
            log.warn("Voucher pay_id={} received {} msats during withdrawal; refunding to {}",
                    payId, surplus, address);
            taskRunner.submit("surplus refund pay_id=" + payId, () -> refundSurplus(payId, address, surplus));
        }
    }

    void refundSurplus(String payId, String address, long surplusMsats) {
        RefundResult result = refundService.refundToLightningAddress(address, surplusMsats);
        if (result.outcome() != RefundResult.Outcome.REFUNDED) {
            log.error("CRITICAL: surplus of {} msats for pay_id={} not refunded to {}: {} {}",
                    surplusMsats, payId, address, result.outcome(), result.detail());
        }
    }

    private LnurlStatusResponse checkWithdrawable(Voucher voucher) {
        if (!voucher.isActive(clock.instant(), properties.getAbsoluteExpiry())) {
            return LnurlStatusResponse.error("voucher is not active");
        }
        if (voucher.getTotalPaidMsats() <= 0) {
            return LnurlStatusResponse.error("voucher has no balance");
        }
        return null;
    }

    private static String shortK1(String k1) {
        return k1.length() > 8 ? k1.substring(0, 8) : k1;
    }
}
