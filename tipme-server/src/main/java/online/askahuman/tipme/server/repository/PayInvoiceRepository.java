package online.askahuman.tipme.server.repository;

import jakarta.persistence.LockModeType;
import online.askahuman.tipme.server.entity.PayInvoice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PayInvoiceRepository extends JpaRepository<PayInvoice, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM PayInvoice i WHERE i.paymentHash = :paymentHash")
    Optional<PayInvoice> findByPaymentHashWithLock(@Param("paymentHash") String paymentHash);

    boolean existsByPaymentHash(String paymentHash);

    List<PayInvoice> findByVoucherPayIdAndPaidTrueOrderByPaidAtAsc(String payId);
}
