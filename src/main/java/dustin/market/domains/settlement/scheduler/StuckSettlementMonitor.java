package dustin.market.domains.settlement.scheduler;

import java.time.LocalDateTime;
import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import dustin.market.domains.settlement.model.entity.SettlementRecord;
import dustin.market.domains.settlement.model.entity.SettlementStatus;
import dustin.market.domains.settlement.repository.SettlementRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 미해소 정산 모니터
 * Stuck Settlement Monitor
 *
 * 역할:
 * - 일정 시간 이상 SCHEDULED 상태인 정산을 경고 로그로 남긴다
 * - 자동 재처리는 하지 않는다 (레지스트리 이전은 멱등하지 않음)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StuckSettlementMonitor {

    private final SettlementRecordRepository settlementRecordRepository;

    @Value("${marketplace.settlement.stuck-threshold-seconds:300}")
    private long stuckThresholdSeconds;

    @Scheduled(fixedDelayString = "${marketplace.settlement.monitor-interval-ms:60000}")
    public int reportStuckSettlements() {
        LocalDateTime threshold = LocalDateTime.now().minusSeconds(stuckThresholdSeconds);
        List<SettlementRecord> stuck = settlementRecordRepository
                .findByStatusAndCreatedAtBefore(SettlementStatus.SCHEDULED, threshold);

        for (SettlementRecord record : stuck) {
            log.warn("[StuckSettlementMonitor] 미해소 정산: id={}, registry={}, asset={}, buyer={}, createdAt={}",
                    record.getId(), record.getRegistryId(), record.getAssetId(), record.getBuyerId(),
                    record.getCreatedAt());
        }
        if (!stuck.isEmpty()) {
            log.warn("[StuckSettlementMonitor] 미해소 정산 {}건 (기준 {}초)", stuck.size(), stuckThresholdSeconds);
        }
        return stuck.size();
    }
}
