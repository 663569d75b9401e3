package dustin.market.domains.balance.repository;

import dustin.market.domains.balance.model.entity.AccountBalance;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.Optional;

/**
 * 계정 잔고 리포지토리
 * Account Balance Repository
 *
 * 역할:
 * - 잔고 CRUD
 * - 비관적 락을 사용한 동시성 제어 (정산 해소와 사용자 호출이 같은 행을 갱신할 수 있음)
 */
@Repository
public interface AccountBalanceRepository extends JpaRepository<AccountBalance, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM AccountBalance b WHERE b.accountId = :accountId")
    Optional<AccountBalance> findByAccountIdForUpdate(@Param("accountId") String accountId);

    Optional<AccountBalance> findByAccountId(String accountId);
}
