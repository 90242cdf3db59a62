package online.askahuman.tipme.server.store;

import online.askahuman.tipme.server.config.VoucherProperties;
import online.askahuman.tipme.server.entity.CreationStatus;
import online.askahuman.tipme.server.entity.PayInvoice;
import online.askahuman.tipme.server.entity.Voucher;
import online.askahuman.tipme.server.entity.VoucherCreationRequest;
import online.askahuman.tipme.server.entity.WithdrawSession;
import online.askahuman.tipme.server.exception.VoucherNotFoundException;
import online.askahuman.tipme.server.exception.WithdrawSessionException;
import online.askahuman.tipme.server.repository.PayInvoiceRepository;
import online.askahuman.tipme.server.repository.VoucherCreationRequestRepository;
import online.askahuman.tipme.server.repository.VoucherRepository;
import online.askahuman.tipme.server.repository.WithdrawSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * Transactional access to vouchers, creation requests, pay invoices and withdraw sessions.
 *
 * <p>Every check-then-act sequence runs in one transaction and takes a pessimistic row lock on
 * the row it mutates, so concurrent credits, withdrawals and refunds of the same voucher are
 * serialized by the database while different vouchers proceed in parallel.</p>
 */
@Service
public class VoucherStore {

    private static final Logger log = LoggerFactory.getLogger(VoucherStore.class);

    private final VoucherRepository vouchers;
    private final VoucherCreationRequestRepository creationRequests;
    private final PayInvoiceRepository payInvoices;
    private final WithdrawSessionRepository withdrawSessions;
    private final VoucherProperties properties;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    public VoucherStore(VoucherRepository vouchers,
                        VoucherCreationRequestRepository creationRequests,
                        PayInvoiceRepository payInvoices,
                        WithdrawSessionRepository withdrawSessions,
                        VoucherProperties properties,
                        Clock clock) {
        this.vouchers = vouchers;
        this.creationRequests = creationRequests;
        this.payInvoices = payInvoices;
        this.withdrawSessions = withdrawSessions;
        this.properties = properties;
        this.clock = clock;
    }

    // ── Creation ────────────────────────────────────────────────────────────

    @Transactional
    public VoucherCreationRequest createCreationRequest(String paymentHash, String lightningAddress, int count,
                                                        long expirySeconds, long feeMsats) {
        requireUnusedPaymentHash(paymentHash);
        return creationRequests.save(new VoucherCreationRequest(
                paymentHash, lightningAddress, count, expirySeconds, feeMsats, clock.instant()));
    }

    /**
     * Inserts the batch of vouchers a settled creation request paid for and marks it complete.
     *
     * @param paymentHash payment hash of the creation invoice
     * @return the new vouchers in batch order
     * @throws VoucherNotFoundException if no such request exists
     * @throws IllegalStateException    if the request is no longer pending
     */
    @Transactional
    public List<Voucher> createBatch(String paymentHash) {
        VoucherCreationRequest request = creationRequests.findByPaymentHashWithLock(paymentHash)
                .orElseThrow(() -> new VoucherNotFoundException("creation request not found: " + paymentHash));
        if (!request.isPending()) {
            throw new IllegalStateException("Creation request " + paymentHash + " is already " + request.getStatus());
        }

        Instant now = clock.instant();
        List<Voucher> batch = new ArrayList<>(request.getCount());
        for (int i = 0; i < request.getCount(); i++) {
            batch.add(new Voucher(
                    UUID.randomUUID().toString(),
                    UUID.randomUUID().toString(),
                    request,
                    i,
                    request.getLightningAddress(),
                    request.getExpirySeconds(),
                    now));
        }
        List<Voucher> saved = vouchers.saveAll(batch);
        request.finish(CreationStatus.COMPLETE);
        return saved;
    }

    /**
     * Marks a pending creation request expired. A request that already reached a terminal
     * status is left untouched.
     *
     * @return true if the status changed
     */
    @Transactional
    public boolean markCreationExpired(String paymentHash) {
        Optional<VoucherCreationRequest> request = creationRequests.findByPaymentHashWithLock(paymentHash);
        if (request.isEmpty() || !request.get().isPending()) {
            return false;
        }
        request.get().finish(CreationStatus.EXPIRED);
        return true;
    }

    @Transactional(readOnly = true)
    public Optional<VoucherCreationRequest> findCreationRequest(String paymentHash) {
        return creationRequests.findById(paymentHash);
    }

    @Transactional(readOnly = true)
    public List<Voucher> findVouchersByCreationRequest(String paymentHash) {
        return vouchers.findByCreationRequestPaymentHashOrderByBatchIndexAsc(paymentHash);
    }

    // ── Funding ─────────────────────────────────────────────────────────────

    @Transactional
    public PayInvoice recordPayInvoice(String payId, String paymentHash, long amountMsats, long creditedMsats) {
        requireUnusedPaymentHash(paymentHash);
        Voucher voucher = vouchers.findById(payId)
                .orElseThrow(() -> new VoucherNotFoundException("voucher not found: " + payId));
        return payInvoices.save(new PayInvoice(
                UUID.randomUUID().toString(), voucher, paymentHash, amountMsats, creditedMsats, clock.instant()));
    }

    /**
     * Credits a settled funding payment if the voucher is still active. The voucher row is
     * locked and its effective state re-evaluated inside the transaction; an inactive voucher
     * is left untouched and the invoice stays unpaid.
     *
     * @return true if the balance was credited, or had already been credited for this invoice;
     *         false if the voucher is no longer active and the payer must be refunded
     */
    @Transactional
    public boolean creditIfActive(String payId, long creditedMsats, String paymentHash) {
        Voucher voucher = vouchers.findByPayIdWithLock(payId)
                .orElseThrow(() -> new VoucherNotFoundException("voucher not found: " + payId));
        PayInvoice invoice = payInvoices.findByPaymentHashWithLock(paymentHash)
                .orElseThrow(() -> new VoucherNotFoundException("pay invoice not found: " + paymentHash));
        if (!invoice.getVoucher().getPayId().equals(payId)) {
            throw new IllegalStateException("Pay invoice " + paymentHash + " does not belong to voucher " + payId);
        }
        if (invoice.isPaid()) {
            log.warn("Pay invoice {} already credited to pay_id={}, ignoring", paymentHash, payId);
            return true;
        }

        Instant now = clock.instant();
        if (!voucher.isActive(now, properties.getAbsoluteExpiry())) {
            return false;
        }
        voucher.credit(creditedMsats, now);
        invoice.markPaid(now);
        return true;
    }

    @Transactional(readOnly = true)
    public List<PayInvoice> findPaidInvoices(String payId) {
        return payInvoices.findByVoucherPayIdAndPaidTrueOrderByPaidAtAsc(payId);
    }

    // ── Withdrawal ──────────────────────────────────────────────────────────

    /**
     * Mints a fresh single-use k1 (32 random bytes, hex) for the voucher.
     */
    @Transactional
    public WithdrawSession createWithdrawSession(String withdrawId) {
        byte[] k1Bytes = new byte[32];
        secureRandom.nextBytes(k1Bytes);
        String k1 = HexFormat.of().formatHex(k1Bytes);
        return withdrawSessions.save(new WithdrawSession(k1, withdrawId, clock.instant()));
    }

    /**
     * Validates a k1 against its withdraw id, marks it used and returns the owning pay id.
     *
     * @throws WithdrawSessionException if the session is unknown, belongs to another voucher,
     *                                  or was already used
     */
    @Transactional(noRollbackFor = WithdrawSessionException.class)
    public String consumeWithdrawSession(String k1, String withdrawId) {
        WithdrawSession session = withdrawSessions.findByK1WithLock(k1)
                .orElseThrow(() -> new WithdrawSessionException(
                        WithdrawSessionException.Reason.NOT_FOUND, "unknown k1"));
        if (!session.getWithdrawId().equals(withdrawId)) {
            throw new WithdrawSessionException(WithdrawSessionException.Reason.MISMATCH,
                    "k1 belongs to a different voucher");
        }
        if (session.isUsed()) {
            throw new WithdrawSessionException(WithdrawSessionException.Reason.ALREADY_USED,
                    "k1 already used");
        }
        session.markUsed(clock.instant());
        return vouchers.findByWithdrawId(withdrawId)
                .map(Voucher::getPayId)
                .orElseThrow(() -> new VoucherNotFoundException("voucher not found for withdraw id"));
    }

    /**
     * Zeroes the balance and clears the flag after a withdrawal payment went out (or may have).
     *
     * @return the balance that was zeroed
     */
    @Transactional
    public long deactivateForWithdrawal(String payId) {
        Voucher voucher = vouchers.findByPayIdWithLock(payId)
                .orElseThrow(() -> new VoucherNotFoundException("voucher not found: " + payId));
        return voucher.deactivate();
    }

    // ── Refund ──────────────────────────────────────────────────────────────

    /**
     * Deactivates a voucher ahead of a refund payment. Only a voucher whose flag is still set
     * is deactivated, so a second sweep over the same voucher finds nothing to refund.
     *
     * @return the balance to refund, or empty if the voucher is already inactive
     */
    @Transactional
    public OptionalLong deactivateForRefund(String payId) {
        Voucher voucher = vouchers.findByPayIdWithLock(payId)
                .orElseThrow(() -> new VoucherNotFoundException("voucher not found: " + payId));
        if (!voucher.isActiveFlag()) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(voucher.deactivate());
    }

    /**
     * Restores a voucher whose refund payment definitively failed.
     */
    @Transactional
    public void reactivateWithBalance(String payId, long balanceMsats) {
        Voucher voucher = vouchers.findByPayIdWithLock(payId)
                .orElseThrow(() -> new VoucherNotFoundException("voucher not found: " + payId));
        voucher.reactivate(balanceMsats);
    }

    /**
     * Funded vouchers whose funding window or absolute lifetime has elapsed.
     */
    @Transactional(readOnly = true)
    public List<Voucher> findExpiredFundedVouchers() {
        Instant now = clock.instant();
        return vouchers.findActiveFunded().stream()
                .filter(v -> v.isDueForRefund(now, properties.getAbsoluteExpiry()))
                .toList();
    }

    // ── Queries ─────────────────────────────────────────────────────────────

    @Transactional(readOnly = true)
    public Optional<Voucher> findVoucherByPayId(String payId) {
        return vouchers.findById(payId);
    }

    @Transactional(readOnly = true)
    public Optional<Voucher> findVoucherByWithdrawId(String withdrawId) {
        return vouchers.findByWithdrawId(withdrawId);
    }

    /** Payment hashes identify gateway invoices across creation requests and pay invoices. */
    private void requireUnusedPaymentHash(String paymentHash) {
        if (creationRequests.existsById(paymentHash) || payInvoices.existsByPaymentHash(paymentHash)) {
            throw new DuplicateKeyException("payment hash already recorded: " + paymentHash);
        }
    }
}
