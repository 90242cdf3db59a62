package online.askahuman.tipme.server.repository;

import jakarta.persistence.LockModeType;
import online.askahuman.tipme.server.entity.Voucher;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface VoucherRepository extends JpaRepository<Voucher, String> {

    /**
     * Find voucher with pessimistic write lock. Must run inside a transaction.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT v FROM Voucher v WHERE v.payId = :payId")
    Optional<Voucher> findByPayIdWithLock(@Param("payId") String payId);

    Optional<Voucher> findByWithdrawId(String withdrawId);

    List<Voucher> findByCreationRequestPaymentHashOrderByBatchIndexAsc(String paymentHash);

    /** Candidates for the refund sweep; expiry itself is evaluated against the clock in Java. */
    @Query("SELECT v FROM Voucher v WHERE v.active = true AND v.totalPaidMsats > 0 ORDER BY v.createdAt")
    List<Voucher> findActiveFunded();
}
