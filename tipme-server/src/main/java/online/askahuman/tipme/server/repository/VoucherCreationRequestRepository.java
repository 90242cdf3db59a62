package online.askahuman.tipme.server.repository;

import jakarta.persistence.LockModeType;
import online.askahuman.tipme.server.entity.VoucherCreationRequest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface VoucherCreationRequestRepository extends JpaRepository<VoucherCreationRequest, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM VoucherCreationRequest r WHERE r.paymentHash = :paymentHash")
    Optional<VoucherCreationRequest> findByPaymentHashWithLock(@Param("paymentHash") String paymentHash);
}
