package online.askahuman.tipme.server.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * One LNURL-pay funding attempt against a voucher.
 */
@Entity
@Table(name = "pay_invoices")
public class PayInvoice {

    @Id
    @Column(length = 36, updatable = false)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "pay_id", nullable = false, updatable = false)
    private Voucher voucher;

    @Column(name = "payment_hash", length = 128, nullable = false, unique = true, updatable = false)
    private String paymentHash;

    @Column(name = "amount_msats", nullable = false, updatable = false)
    private long amountMsats;

    @Column(name = "credited_msats", nullable = false, updatable = false)
    private long creditedMsats;

    @Column(nullable = false)
    private boolean paid;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "paid_at")
    private Instant paidAt;

    protected PayInvoice() {}

    public PayInvoice(String id, Voucher voucher, String paymentHash, long amountMsats,
                      long creditedMsats, Instant createdAt) {
        this.id = id;
        this.voucher = voucher;
        this.paymentHash = paymentHash;
        this.amountMsats = amountMsats;
        this.creditedMsats = creditedMsats;
        this.createdAt = createdAt;
    }

    public String getId() { return id; }
    public Voucher getVoucher() { return voucher; }
    public String getPaymentHash() { return paymentHash; }
    public long getAmountMsats() { return amountMsats; }
    public long getCreditedMsats() { return creditedMsats; }
    public boolean isPaid() { return paid; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getPaidAt() { return paidAt; }

    public void markPaid(Instant now) {
        if (paid) {
            throw new IllegalStateException("Pay invoice " + paymentHash + " is already paid");
        }
        this.paid = true;
        this.paidAt = now;
    }
}
