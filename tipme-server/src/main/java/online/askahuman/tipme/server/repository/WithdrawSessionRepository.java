package online.askahuman.tipme.server.repository;

import jakarta.persistence.LockModeType;
import online.askahuman.tipme.server.entity.WithdrawSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface WithdrawSessionRepository extends JpaRepository<WithdrawSession, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM WithdrawSession s WHERE s.k1 = :k1")
    Optional<WithdrawSession> findByK1WithLock(@Param("k1") String k1);
}
