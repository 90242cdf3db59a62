package online.askahuman.tipme.server.service;

import online.askahuman.tipme.gateway.GatewayInvoice;
import online.askahuman.tipme.gateway.LightningGateway;
import online.askahuman.tipme.server.config.VoucherProperties;
import online.askahuman.tipme.server.dto.LnurlResponse;
import online.askahuman.tipme.server.dto.LnurlStatusResponse;
import online.askahuman.tipme.server.dto.PayCallbackResponse;
import online.askahuman.tipme.server.dto.PayRequestResponse;
import online.askahuman.tipme.server.dto.VoucherSummaryResponse;
import online.askahuman.tipme.server.entity.Voucher;
import online.askahuman.tipme.server.exception.VoucherNotFoundException;
import online.askahuman.tipme.server.store.VoucherStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * LNURL-pay funding of vouchers (LUD-06).
 *
 * <p>The callback invoices the gross amount; once it settles the post-fee amount is credited
 * if the voucher is still active, otherwise it is refunded to the voucher's address.</p>
 */
@Service
public class VoucherFundingService {

    private static final Logger log = LoggerFactory.getLogger(VoucherFundingService.class);

    static final String METADATA = "[[\"text/plain\",\"Tip via TipMe\"]]";
    static final String INVOICE_DESCRIPTION = "TipMe voucher funding";

    private final VoucherStore store;
    private final LightningGateway gateway;
    private final RefundService refundService;
    private final ConfirmationTaskRunner taskRunner;
    private final VoucherLinks links;
    private final VoucherProperties properties;
    private final Clock clock;

    public VoucherFundingService(VoucherStore store, LightningGateway gateway, RefundService refundService,
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
     * Step 1: pay parameters of an active voucher.
     */
    public LnurlResponse payRequest(String payId) {
        Optional<Voucher> voucher = store.findVoucherByPayId(payId);
        if (voucher.isEmpty()) {
            return LnurlStatusResponse.error("voucher not found");
        }
        if (!isActive(voucher.get())) {
            return LnurlStatusResponse.error("voucher is not active");
        }
        return PayRequestResponse.of(links.payCallbackUrl(payId), minSendable(), maxSendable(), METADATA);
    }

    /**
     * Step 2: invoice a funding payment and start waiting for it.
     *
     * @param payId       voucher pay id
     * @param amountParam raw {@code amount} query parameter in millisatoshis, may be null
     */
    public LnurlResponse payCallback(String payId, String amountParam) {
        if (amountParam == null || amountParam.isBlank()) {
            return LnurlStatusResponse.error("missing amount parameter");
        }
        long amountMsats;
        try {
            amountMsats = Long.parseLong(amountParam.trim());
        } catch (NumberFormatException e) {
            return LnurlStatusResponse.error("invalid amount");
        }
        if (amountMsats <= 0) {
            return LnurlStatusResponse.error("invalid amount");
        }

        Optional<Voucher> voucher = store.findVoucherByPayId(payId);
        if (voucher.isEmpty()) {
            return LnurlStatusResponse.error("voucher not found");
        }
        if (!isActive(voucher.get())) {
            return LnurlStatusResponse.error("voucher is not active");
        }
        if (amountMsats < minSendable() || amountMsats > maxSendable()) {
            return LnurlStatusResponse.error("amount must be between " + minSendable()
                    + " and " + maxSendable() + " msats");
        }

        long creditedMsats = amountMsats - calculateFee(amountMsats);
        if (creditedMsats <= 0) {
            return LnurlStatusResponse.error("amount too small to cover fee");
        }

        GatewayInvoice invoice;
        try {
            invoice = gateway.createInvoice(amountMsats, INVOICE_DESCRIPTION);
        } catch (RuntimeException e) {
            log.warn("Funding invoice for pay_id={} failed: {}", payId, e.getMessage());
            return LnurlStatusResponse.error("failed to create invoice");
        }
        store.recordPayInvoice(payId, invoice.paymentHash(), amountMsats, creditedMsats);
        log.info("Funding invoice {} for pay_id={}: {} msats gross, {} msats to credit",
                invoice.paymentHash(), payId, amountMsats, creditedMsats);

        Instant deadline = clock.instant().plus(properties.getConfirmationTimeout());
        String paymentHash = invoice.paymentHash();
        taskRunner.submit("funding pay_id=" + payId,
                () -> awaitFunding(payId, paymentHash, creditedMsats, deadline));

        return PayCallbackResponse.of(invoice.invoice());
    }

    /**
     * Fee retained from a funding payment: {@code max(min, floor(amount * percent))}.
     */
    public long calculateFee(long amountMsats) {
        long proportional = (long) Math.floor(amountMsats * properties.getFundingFeePercent());
        return Math.max(properties.getFundingFeeMinMsats(), proportional);
    }

    /**
     * Background half of funding: credit on settlement, refund if the voucher went inactive.
     */
    void awaitFunding(String payId, String paymentHash, long creditedMsats, Instant deadline) {
        if (!gateway.waitForPayment(paymentHash, deadline, clock)) {
            log.info("Funding invoice {} for pay_id={} was not paid in time", paymentHash, payId);
            return;
        }
        if (store.creditIfActive(payId, creditedMsats, paymentHash)) {
            log.info("Credited {} msats to pay_id={}", creditedMsats, payId);
            return;
        }

        String address = store.findVoucherByPayId(payId)
                .map(Voucher::getLightningAddress)
                .orElseThrow(() -> new VoucherNotFoundException("voucher not found: " + payId));
        log.warn("Voucher pay_id={} became inactive after payment; refunding {} msats to {}",
                payId, creditedMsats, address);
        RefundResult result = refundService.refundToLightningAddress(address, creditedMsats);
        if (result.outcome() == RefundResult.Outcome.REFUNDED) {
            log.info("Late funding payment for pay_id={} refunded ({} msats)", payId, result.amountMsats());
        } else {
            log.error("CRITICAL: late funding payment for pay_id={} not refunded ({} msats owed to {}): {} {}",
                    payId, creditedMsats, address, result.outcome(), result.detail());
        }
    }

    /**
     * JSON summary of a voucher: state, balance, effective expiry and paid fundings.
     *
     * @throws VoucherNotFoundException if the pay id is unknown
     */
    public VoucherSummaryResponse summary(String payId) {
        Voucher voucher = store.findVoucherByPayId(payId)
                .orElseThrow(() -> new VoucherNotFoundException("voucher not found"));
        List<VoucherSummaryResponse.Funding> history = store.findPaidInvoices(payId).stream()
                .map(i -> new VoucherSummaryResponse.Funding(timestamp(i.getPaidAt()), i.getCreditedMsats() / 1000))
                .toList();
        return new VoucherSummaryResponse(
                isActive(voucher),
                voucher.getTotalPaidMsats() / 1000,
                timestamp(voucher.expiresAt(properties.getAbsoluteExpiry())),
                history);
    }

    private boolean isActive(Voucher voucher) {
        return voucher.isActive(clock.instant(), properties.getAbsoluteExpiry());
    }

    private long minSendable() {
        return properties.getMinPayAmountSats() * 1000;
    }

    private long maxSendable() {
        return properties.getMaxPayAmountSats() * 1000;
    }

    private static String timestamp(Instant instant) {
        return instant.truncatedTo(ChronoUnit.SECONDS).toString();
    }
}
