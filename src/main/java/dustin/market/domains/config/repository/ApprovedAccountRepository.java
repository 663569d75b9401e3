package dustin.market.domains.config.repository;

import dustin.market.domains.config.model.entity.ApprovalKind;
import dustin.market.domains.config.model.entity.ApprovedAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * 승인 계정 Repository
 * Approved Account Repository
 */
@Repository
public interface ApprovedAccountRepository extends JpaRepository<ApprovedAccount, Long> {

    boolean existsByKindAndAccountId(ApprovalKind kind, String accountId);

    List<ApprovedAccount> findByKindOrderByIdAsc(ApprovalKind kind);

    long deleteByKindAndAccountId(ApprovalKind kind, String accountId);
}
