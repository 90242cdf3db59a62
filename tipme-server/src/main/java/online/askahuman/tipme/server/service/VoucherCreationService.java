package online.askahuman.tipme.server.service;

import online.askahuman.tipme.gateway.GatewayInvoice;
import online.askahuman.tipme.gateway.LightningGateway;
import online.askahuman.tipme.lnurl.LightningAddressResolver;
import online.askahuman.tipme.server.config.VoucherProperties;
import online.askahuman.tipme.server.dto.CreationInvoiceResponse;
import online.askahuman.tipme.server.dto.CreationStatusResponse;
import online.askahuman.tipme.server.entity.CreationStatus;
import online.askahuman.tipme.server.entity.Voucher;
import online.askahuman.tipme.server.entity.VoucherCreationRequest;
import online.askahuman.tipme.server.exception.GatewayUnavailableException;
import online.askahuman.tipme.server.exception.VoucherNotFoundException;
import online.askahuman.tipme.server.exception.VoucherValidationException;
import online.askahuman.tipme.server.store.VoucherStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Sells voucher batches: issues the creation invoice and, once it settles, inserts the batch.
 */
@Service
public class VoucherCreationService {

    private static final Logger log = LoggerFactory.getLogger(VoucherCreationService.class);

    private final VoucherStore store;
    private final LightningGateway gateway;
    private final ConfirmationTaskRunner taskRunner;
    private final VoucherLinks links;
    private final VoucherProperties properties;
    private final Clock clock;

    public VoucherCreationService(VoucherStore store, LightningGateway gateway, ConfirmationTaskRunner taskRunner,
                                  VoucherLinks links, VoucherProperties properties, Clock clock) {
        this.store = store;
        this.gateway = gateway;
        this.taskRunner = taskRunner;
        this.links = links;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Validates the request, invoices the creation fee and starts waiting for payment.
     *
     * @param lightningAddress owner address that receives refunds
     * @param count            number of vouchers, {@code 1..max-vouchers-per-request}
     * @param expirySeconds    funding window per voucher; non-positive selects the default
     * @throws VoucherValidationException  on a malformed address or count
     * @throws GatewayUnavailableException if the gateway cannot issue the invoice
     */
    public CreationInvoiceResponse createInvoice(String lightningAddress, int count, long expirySeconds) {
        if (!LightningAddressResolver.isValidAddress(lightningAddress)) {
            throw new VoucherValidationException("invalid lightning_address");
        }
        int max = properties.getMaxVouchersPerRequest();
        if (count < 1 || count > max) {
            throw new VoucherValidationException("count must be between 1 and " + max);
        }
        long effectiveExpiry = expirySeconds > 0
                ? expirySeconds
                : properties.getDefaultRelativeExpiry().getSeconds();

        long feeSats = properties.getFeePerVoucherSats() * count;
        long feeMsats = feeSats * 1000;

        GatewayInvoice invoice;
        try {
            invoice = gateway.createInvoice(feeMsats, String.format("TipMe: create %d voucher(s)", count));
        } catch (RuntimeException e) {
            log.warn("Creation invoice for {} voucher(s) failed: {}", count, e.getMessage());
            throw new GatewayUnavailableException("failed to create payment invoice", e);
        }

        store.createCreationRequest(invoice.paymentHash(), lightningAddress, count, effectiveExpiry, feeMsats);
        log.info("Creation request {}: {} voucher(s) for {}, fee {} sats",
                invoice.paymentHash(), count, lightningAddress, feeSats);

        Instant deadline = clock.instant().plus(properties.getConfirmationTimeout());
        String paymentHash = invoice.paymentHash();
        taskRunner.submit("creation " + paymentHash, () -> awaitCreationPayment(paymentHash, deadline));

        return new CreationInvoiceResponse(invoice.invoice(), paymentHash, feeSats);
    }

    /**
     * Background half of creation: inserts the batch once the invoice settles, or expires the
     * request on timeout, cancellation or insertion failure.
     */
    void awaitCreationPayment(String paymentHash, Instant deadline) {
        if (!gateway.waitForPayment(paymentHash, deadline, clock)) {
            if (store.markCreationExpired(paymentHash)) {
                log.info("Creation request {} expired unpaid", paymentHash);
            }
            return;
        }
        try {
            List<Voucher> batch = store.createBatch(paymentHash);
            log.info("Creation request {} complete: {} voucher(s) issued", paymentHash, batch.size());
        } catch (RuntimeException e) {
            log.error("Creation request {} paid but voucher insertion failed", paymentHash, e);
            store.markCreationExpired(paymentHash);
        }
    }

    /**
     * @throws VoucherNotFoundException if the payment hash names no creation request
     */
    public CreationStatusResponse getStatus(String paymentHash) {
        VoucherCreationRequest request = store.findCreationRequest(paymentHash)
                .orElseThrow(() -> new VoucherNotFoundException("not found"));
        if (request.getStatus() != CreationStatus.COMPLETE) {
            return new CreationStatusResponse(request.getStatus().wireName(), null);
        }

        List<CreationStatusResponse.VoucherLinksResponse> vouchers = store.findVouchersByCreationRequest(paymentHash)
                .stream()
                .map(v -> new CreationStatusResponse.VoucherLinksResponse(
                        links.lnurlPay(v.getPayId()),
                        links.lnurlWithdraw(v.getWithdrawId()),
                        v.getLightningAddress(),
                        v.absoluteExpiresAt(properties.getAbsoluteExpiry()).truncatedTo(ChronoUnit.SECONDS).toString(),
                        v.getExpirySeconds()))
                .toList();
        return new CreationStatusResponse(CreationStatus.COMPLETE.wireName(), vouchers);
    }
}
