package dustin.market.domains.reservation.repository;

import dustin.market.domains.reservation.model.entity.StorageDeposit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.Optional;

/**
 * 스토리지 예치금 Repository
 * Storage Deposit Repository
 */
@Repository
public interface StorageDepositRepository extends JpaRepository<StorageDeposit, Long> {

    Optional<StorageDeposit> findByAccountId(String accountId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM StorageDeposit d WHERE d.accountId = :accountId")
    Optional<StorageDeposit> findByAccountIdForUpdate(@Param("accountId") String accountId);
}
