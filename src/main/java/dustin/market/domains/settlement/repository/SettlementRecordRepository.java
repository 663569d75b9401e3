package dustin.market.domains.settlement.repository;

import dustin.market.domains.settlement.model.entity.SettlementRecord;
import dustin.market.domains.settlement.model.entity.SettlementStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 정산 기록 Repository
 * Settlement Record Repository
 */
@Repository
public interface SettlementRecordRepository extends JpaRepository<SettlementRecord, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM SettlementRecord s WHERE s.id = :id")
    Optional<SettlementRecord> findByIdForUpdate(@Param("id") Long id);

    List<SettlementRecord> findByRegistryIdAndAssetIdOrderByIdDesc(String registryId, String assetId);

    /**
     * 오래 해소되지 않은 정산 조회 (모니터링)
     */
    List<SettlementRecord> findByStatusAndCreatedAtBefore(SettlementStatus status, LocalDateTime threshold);
}
