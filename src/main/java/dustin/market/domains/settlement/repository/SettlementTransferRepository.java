package dustin.market.domains.settlement.repository;

import dustin.market.domains.settlement.model.entity.SettlementTransfer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * 정산 지급 내역 Repository
 * Settlement Transfer Repository
 */
@Repository
public interface SettlementTransferRepository extends JpaRepository<SettlementTransfer, Long> {

    List<SettlementTransfer> findBySettlementIdOrderByIdAsc(Long settlementId);
}
