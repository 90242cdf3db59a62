package online.askahuman.tipme.server.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * Single-use LNURL-withdraw session bound to one voucher by its withdraw id.
 */
@Entity
@Table(name = "withdraw_sessions")
public class WithdrawSession {

    @Id
    @Column(length = 64, updatable = false)
    private String k1;

    @Column(name = "withdraw_id", length = 36, nullable = false, updatable = false)
    private String withdrawId;

    @Column(nullable = false)
    private boolean used;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "used_at")
    private Instant usedAt;

    protected WithdrawSession() {}

    public WithdrawSession(String k1, String withdrawId, Instant createdAt) {
        this.k1 = k1;
        this.withdrawId = withdrawId;
        this.createdAt = createdAt;
    }

    public String getK1() { return k1; }
    public String getWithdrawId() { return withdrawId; }
    public boolean isUsed() { return used; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUsedAt() { return usedAt; }

    public void markUsed(Instant now) {
        this.used = true;
        this.usedAt = now;
    }
}
