package dustin.market.domains.settlement.service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import dustin.market.domains.balance.service.NativeLedgerService;
import dustin.market.domains.config.service.MarketConfigService;
import dustin.market.domains.settlement.model.dto.SettlementSnapshot;
import dustin.market.domains.settlement.model.entity.SettlementKind;
import dustin.market.domains.settlement.model.entity.SettlementOutcome;
import dustin.market.domains.settlement.model.entity.SettlementRecord;
import dustin.market.domains.settlement.model.entity.SettlementStatus;
import dustin.market.domains.settlement.model.entity.SettlementTransfer;
import dustin.market.domains.settlement.model.entity.TransferType;
import dustin.market.domains.settlement.repository.SettlementRecordRepository;
import dustin.market.domains.settlement.repository.SettlementTransferRepository;
import dustin.market.shared.kafka.MarketEvent;
import dustin.market.shared.kafka.MarketEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 정산 해소기
 * Settlement Resolver
 *
 * 역할:
 * - 레지스트리 호출 결과를 받아 에스크로 금액을 분배
 * - 정산 1건당 정확히 한 번만 해소 (SCHEDULED 상태일 때만 처리)
 *
 * 분기:
 * 1. 호출 실패 → 구매자에게 전액 환불, 수수료 없음 (RESOLVED_REFUNDED)
 * 2. 성공 + 분배 내역 무효 → 판매자 = 가격 - 수수료, 재무 = 수수료 (RESOLVED_PAID)
 * 3. 성공 + 유효한 분배 내역 → 수신자별 지급, 판매자 몫에서 수수료 차감 (RESOLVED_PAID)
 *
 * 수수료 = 가격 × bps / 10000 (내림), 해소 시점의 설정값 사용
 *
 * 주의사항:
 * - 호출자 트랜잭션과 별개의 새 트랜잭션에서 실행된다
 * - 리스팅/오퍼를 다시 읽지 않는다 (스냅샷만 사용)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettlementResolver {

    private final SettlementRecordRepository settlementRecordRepository;
    private final SettlementTransferRepository settlementTransferRepository;
    private final NativeLedgerService nativeLedgerService;
    private final MarketConfigService marketConfigService;
    private final PayoutParser payoutParser;
    private final MarketEventPublisher eventPublisher;

    /**
     * 정산 해소
     * Resolve a scheduled settlement
     *
     * @return 처리 후 상태 (이미 해소된 정산이면 기존 상태)
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public SettlementStatus resolve(Long settlementId, SettlementSnapshot snapshot, RegistryOutcome outcome) {
        nativeLedgerService.lockEscrow();
        SettlementRecord record = settlementRecordRepository.findByIdForUpdate(settlementId)
                .orElseThrow(() -> new IllegalStateException("Settlement record not found: " + settlementId));

        if (record.getStatus() != SettlementStatus.SCHEDULED) {
            log.warn("[SettlementResolver] 이미 해소된 정산: id={}, status={}", settlementId, record.getStatus());
            return record.getStatus();
        }

        if (!outcome.isSuccess()) {
            refundBuyer(record, snapshot, outcome.getFailureReason());
        } else {
            BigDecimal fee = marketConfigService.calculateFee(snapshot.getPrice());
            Optional<Map<String, BigDecimal>> payout = payoutParser.parse(outcome.getPayload(), snapshot.getPrice());
            if (payout.isPresent()) {
                payRecipients(record, snapshot, payout.get(), fee);
            } else {
                paySellerWithoutRoyalties(record, snapshot, fee);
            }
        }

        record.setResolvedAt(LocalDateTime.now());
        settlementRecordRepository.save(record);
        return record.getStatus();
    }

    /**
     * 분기 1: 레지스트리 호출 실패
     */
    private void refundBuyer(SettlementRecord record, SettlementSnapshot snapshot, String reason) {
        transfer(record, snapshot.getBuyerId(), snapshot.getPrice(), TransferType.REFUND);

        record.setStatus(SettlementStatus.RESOLVED_REFUNDED);
        record.setOutcome(SettlementOutcome.REGISTRY_FAILED);
        record.setFeeAmount(BigDecimal.ZERO);
        record.setFailureReason(truncate(reason));

        eventPublisher.publish(settlementEvent(MarketEvent.RESOLVE_PURCHASE_FAIL, snapshot));
        log.warn("[SettlementResolver] 레지스트리 이전 실패, 구매자 환불: id={}, buyer={}, price={}, reason={}",
                record.getId(), snapshot.getBuyerId(), snapshot.getPrice().toPlainString(), reason);
    }

    /**
     * 분기 2: 분배 내역 없음/무효
     */
    private void paySellerWithoutRoyalties(SettlementRecord record, SettlementSnapshot snapshot, BigDecimal fee) {
        transfer(record, snapshot.getSellerId(), snapshot.getPrice().subtract(fee), TransferType.SELLER);
        if (fee.signum() > 0) {
            transfer(record, marketConfigService.getTreasuryId(), fee, TransferType.FEE);
        }

        record.setStatus(SettlementStatus.RESOLVED_PAID);
        record.setOutcome(SettlementOutcome.NO_ROYALTIES);
        record.setFeeAmount(fee);

        eventPublisher.publish(settlementEvent(MarketEvent.RESOLVE_PURCHASE, snapshot));
        log.info("[SettlementResolver] 정산 완료 (로열티 없음): id={}, seller={}, net={}, fee={}",
                record.getId(), snapshot.getSellerId(), snapshot.getPrice().subtract(fee).toPlainString(),
                fee.toPlainString());
    }

    /**
     * 분기 3: 유효한 분배 내역
     *
     * 판매자 항목에서만 수수료를 차감한다. 판매자가 내역에 없으면 수수료도 없다.
     */
    private void payRecipients(SettlementRecord record, SettlementSnapshot snapshot,
                               Map<String, BigDecimal> payout, BigDecimal fee) {
        BigDecimal charged = BigDecimal.ZERO;
        String treasuryId = marketConfigService.getTreasuryId();

        for (Map.Entry<String, BigDecimal> entry : payout.entrySet()) {
            String recipient = entry.getKey();
            BigDecimal amount = entry.getValue();
            if (recipient.equals(snapshot.getSellerId())) {
                BigDecimal deducted = fee.min(amount);
                transfer(record, recipient, amount.subtract(deducted), TransferType.SELLER);
                if (deducted.signum() > 0) {
                    transfer(record, treasuryId, deducted, TransferType.FEE);
                }
                charged = charged.add(deducted);
            } else {
                transfer(record, recipient, amount, TransferType.ROYALTY);
            }
        }

        record.setStatus(SettlementStatus.RESOLVED_PAID);
        record.setOutcome(SettlementOutcome.PAYOUT);
        record.setFeeAmount(charged);

        eventPublisher.publish(settlementEvent(MarketEvent.RESOLVE_PURCHASE, snapshot));
        log.info("[SettlementResolver] 정산 완료 (분배 내역): id={}, recipients={}, fee={}",
                record.getId(), payout.size(), charged.toPlainString());
    }

    private void transfer(SettlementRecord record, String recipientId, BigDecimal amount, TransferType type) {
        if (amount.signum() == 0) {
            return;
        }
        if (!nativeLedgerService.transfer(recipientId, amount)) {
            log.warn("[SettlementResolver] 수령자가 에스크로 계정, 지급 기록 생략: id={}, recipient={}, amount={}, type={}",
                    record.getId(), recipientId, amount.toPlainString(), type);
            return;
        }
        settlementTransferRepository.save(SettlementTransfer.builder()
                .settlementId(record.getId())
                .recipientId(recipientId)
                .amount(amount)
                .transferType(type)
                .build());
    }

    private MarketEvent settlementEvent(String name, SettlementSnapshot snapshot) {
        MarketEvent.Builder builder = MarketEvent.builder(name)
                .param("owner_id", snapshot.getSellerId())
                .param("registry_id", snapshot.getRegistryId())
                .param("asset_id", snapshot.getAssetId())
                .param("currency_id", snapshot.getCurrencyId())
                .param("price", snapshot.getPrice().toPlainString())
                .param("buyer_id", snapshot.getBuyerId());
        if (snapshot.getKind() == SettlementKind.OFFER) {
            builder.param("is_offer", true);
        }
        return builder.build();
    }

    private String truncate(String reason) {
        if (reason == null) {
            return null;
        }
        return reason.length() > 1000 ? reason.substring(0, 1000) : reason;
    }
}
