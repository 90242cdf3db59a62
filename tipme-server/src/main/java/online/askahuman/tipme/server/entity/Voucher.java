package online.askahuman.tipme.server.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import java.time.Duration;
import java.time.Instant;

/**
 * A redeemable voucher. Anyone holding the pay id can fund it; the holder of the withdraw id
 * can redeem the whole balance once.
 *
 * <p>The balance only changes through {@link #credit}, {@link #deactivate} and
 * {@link #reactivate}, and callers must hold the row lock while doing so.</p>
 */
@Entity
@Table(name = "vouchers")
public class Voucher {

    @Id
    @Column(name = "pay_id", length = 36, updatable = false)
    private String payId;

    @Column(name = "withdraw_id", length = 36, nullable = false, unique = true, updatable = false)
    private String withdrawId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "creation_payment_hash", updatable = false)
    private VoucherCreationRequest creationRequest;

    @Column(name = "batch_index", nullable = false, updatable = false)
    private int batchIndex;

    @Column(name = "lightning_address", nullable = false, updatable = false)
    private String lightningAddress;

    @Column(name = "total_paid_msats", nullable = false)
    private long totalPaidMsats;

    @Column(name = "last_funded_at")
    private Instant lastFundedAt;

    @Column(name = "expiry_seconds", nullable = false, updatable = false)
    private long expirySeconds;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected Voucher() {}

    public Voucher(String payId, String withdrawId, VoucherCreationRequest creationRequest, int batchIndex,
                   String lightningAddress, long expirySeconds, Instant createdAt) {
        this.payId = payId;
        this.withdrawId = withdrawId;
        this.creationRequest = creationRequest;
        this.batchIndex = batchIndex;
        this.lightningAddress = lightningAddress;
        this.expirySeconds = expirySeconds;
        this.createdAt = createdAt;
        this.totalPaidMsats = 0;
        this.active = true;
    }

    public String getPayId() { return payId; }
    public String getWithdrawId() { return withdrawId; }
    public VoucherCreationRequest getCreationRequest() { return creationRequest; }
    public int getBatchIndex() { return batchIndex; }
    public String getLightningAddress() { return lightningAddress; }
    public long getTotalPaidMsats() { return totalPaidMsats; }
    public Instant getLastFundedAt() { return lastFundedAt; }
    public long getExpirySeconds() { return expirySeconds; }
    public Instant getCreatedAt() { return createdAt; }

    /** Raw flag; use {@link #isActive(Instant, Duration)} for the effective state. */
    public boolean isActiveFlag() { return active; }

    /**
     * Effective state: the flag is set, the absolute lifetime has not passed and, once funded,
     * the funding window since the last credit has not passed. Both bounds are inclusive.
     *
     * @param now            current time
     * @param absoluteExpiry voucher lifetime counted from creation
     */
    public boolean isActive(Instant now, Duration absoluteExpiry) {
        if (!active) {
            return false;
        }
        if (now.isAfter(createdAt.plus(absoluteExpiry))) {
            return false;
        }
        return lastFundedAt == null || !now.isAfter(relativeExpiresAt());
    }

    /**
     * True when a funded voucher is due for refund: the funding window or the absolute
     * lifetime has fully elapsed.
     */
    public boolean isDueForRefund(Instant now, Duration absoluteExpiry) {
        if (!active || totalPaidMsats <= 0) {
            return false;
        }
        if (!now.isBefore(createdAt.plus(absoluteExpiry))) {
            return true;
        }
        return lastFundedAt != null && !now.isBefore(relativeExpiresAt());
    }

    /** Earliest of the absolute expiry and, once funded, the funding-window expiry. */
    public Instant expiresAt(Duration absoluteExpiry) {
        Instant absolute = createdAt.plus(absoluteExpiry);
        if (lastFundedAt == null) {
            return absolute;
        }
        Instant relative = relativeExpiresAt();
        return relative.isBefore(absolute) ? relative : absolute;
    }

    public Instant absoluteExpiresAt(Duration absoluteExpiry) {
        return createdAt.plus(absoluteExpiry);
    }

    private Instant relativeExpiresAt() {
        return lastFundedAt.plusSeconds(expirySeconds);
    }

    public void credit(long msats, Instant now) {
        if (msats <= 0) {
            throw new IllegalArgumentException("credit must be positive: " + msats);
        }
        this.totalPaidMsats = Math.addExact(totalPaidMsats, msats);
        this.lastFundedAt = now;
    }

    /**
     * Zeroes the balance and clears the flag.
     *
     * @return the balance before deactivation
     */
    public long deactivate() {
        long previous = totalPaidMsats;
        this.totalPaidMsats = 0;
        this.active = false;
        return previous;
    }

    public void reactivate(long balanceMsats) {
        this.totalPaidMsats = balanceMsats;
        this.active = true;
    }
}
