package online.askahuman.tipme.server.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * A paid-for batch of vouchers waiting for its creation invoice to settle.
 * Keyed by the gateway payment hash of that invoice.
 */
@Entity
@Table(name = "voucher_creation_requests")
public class VoucherCreationRequest {

    @Id
    @Column(name = "payment_hash", length = 128, updatable = false)
    private String paymentHash;

    @Column(name = "lightning_address", nullable = false, updatable = false)
    private String lightningAddress;

    @Column(nullable = false, updatable = false)
    private int count;

    @Column(name = "expiry_seconds", nullable = false, updatable = false)
    private long expirySeconds;

    @Column(name = "fee_msats", nullable = false, updatable = false)
    private long feeMsats;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private CreationStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected VoucherCreationRequest() {}

    public VoucherCreationRequest(String paymentHash, String lightningAddress, int count,
                                  long expirySeconds, long feeMsats, Instant createdAt) {
        this.paymentHash = paymentHash;
        this.lightningAddress = lightningAddress;
        this.count = count;
        this.expirySeconds = expirySeconds;
        this.feeMsats = feeMsats;
        this.status = CreationStatus.PENDING;
        this.createdAt = createdAt;
    }

    public String getPaymentHash() { return paymentHash; }
    public String getLightningAddress() { return lightningAddress; }
    public int getCount() { return count; }
    public long getExpirySeconds() { return expirySeconds; }
    public long getFeeMsats() { return feeMsats; }
    public CreationStatus getStatus() { return status; }
    public Instant getCreatedAt() { return createdAt; }

    public boolean isPending() {
        return status == CreationStatus.PENDING;
    }

    /**
     * Moves a pending request to a terminal status.
     *
     * @throws IllegalStateException if the request already reached a terminal status
     */
    public void finish(CreationStatus terminal) {
        if (terminal == CreationStatus.PENDING) {
            throw new IllegalArgumentException("PENDING is not a terminal status");
        }
        if (!isPending()) {
            throw new IllegalStateException("Creation request " + paymentHash + " is already " + status);
        }
        this.status = terminal;
    }
}
