package dustin.market.domains.settlement.service;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import dustin.market.config.MarketplaceProperties;
import dustin.market.domains.settlement.model.dto.SettlementResponse;
import dustin.market.domains.settlement.model.dto.SettlementSnapshot;
import dustin.market.domains.settlement.model.dto.SettlementTransferResponse;
import dustin.market.domains.settlement.model.entity.SettlementRecord;
import dustin.market.domains.settlement.model.entity.SettlementStatus;
import dustin.market.domains.settlement.repository.SettlementRecordRepository;
import dustin.market.domains.settlement.repository.SettlementTransferRepository;
import dustin.market.shared.exception.MarketException;
import dustin.market.shared.registry.AssetRegistryClient;
import dustin.market.shared.registry.TransferPayoutRequest;
import lombok.extern.slf4j.Slf4j;

/**
 * 정산 서비스
 * Settlement Service
 *
 * 역할:
 * - 정산 예약 (스냅샷 저장 + 레지스트리 호출 예약)
 * - 레지스트리 호출 후 해소기(SettlementResolver) 호출
 * - 정산 기록 조회
 *
 * 처리 흐름:
 * 1. schedule: 호출자 트랜잭션 안에서 SCHEDULED 기록 저장
 * 2. 호출자 트랜잭션 커밋 후 settlementExecutor에 제출
 * 3. 레지스트리 nft_transfer_payout 호출 (실패도 결과로 취급)
 * 4. SettlementResolver.resolve (새 트랜잭션)
 *
 * 주의사항:
 * - 호출자 트랜잭션이 롤백되면 레지스트리 호출도 일어나지 않는다
 * - 레지스트리 호출은 취소/재시도하지 않는다
 */
@Slf4j
@Service
public class SettlementService {

    private final SettlementRecordRepository settlementRecordRepository;
    private final SettlementTransferRepository settlementTransferRepository;
    private final SettlementResolver settlementResolver;
    private final AssetRegistryClient assetRegistryClient;
    private final MarketplaceProperties marketplaceProperties;
    private final Executor settlementExecutor;

    public SettlementService(SettlementRecordRepository settlementRecordRepository,
                             SettlementTransferRepository settlementTransferRepository,
                             SettlementResolver settlementResolver,
                             AssetRegistryClient assetRegistryClient,
                             MarketplaceProperties marketplaceProperties,
                             @Qualifier("settlementExecutor") Executor settlementExecutor) {
        this.settlementRecordRepository = settlementRecordRepository;
        this.settlementTransferRepository = settlementTransferRepository;
        this.settlementResolver = settlementResolver;
        this.assetRegistryClient = assetRegistryClient;
        this.marketplaceProperties = marketplaceProperties;
        this.settlementExecutor = settlementExecutor;
    }

    /**
     * 정산 예약
     * Schedule a settlement for an already-deleted listing or offer
     *
     * @param snapshot 삭제된 리스팅/오퍼의 값 (해소 단계로 그대로 전달)
     * @return 저장된 정산 기록 ID
     */
    @Transactional
    public Long schedule(SettlementSnapshot snapshot) {
        SettlementRecord record = settlementRecordRepository.save(SettlementRecord.builder()
                .kind(snapshot.getKind())
                .status(SettlementStatus.SCHEDULED)
                .sellerId(snapshot.getSellerId())
                .buyerId(snapshot.getBuyerId())
                .registryId(snapshot.getRegistryId())
                .assetId(snapshot.getAssetId())
                .currencyId(snapshot.getCurrencyId())
                .approvalId(snapshot.getApprovalId())
                .price(snapshot.getPrice())
                .build());
        Long settlementId = record.getId();

        log.info("[SettlementService] 정산 예약: id={}, kind={}, registry={}, asset={}, buyer={}, price={}",
                settlementId, snapshot.getKind(), snapshot.getRegistryId(), snapshot.getAssetId(),
                snapshot.getBuyerId(), snapshot.getPrice().toPlainString());

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    dispatch(settlementId, snapshot);
                }
            });
        } else {
            dispatch(settlementId, snapshot);
        }
        return settlementId;
    }

    /**
     * 레지스트리 호출 + 해소를 실행기에 제출
     */
    private void dispatch(Long settlementId, SettlementSnapshot snapshot) {
        try {
            settlementExecutor.execute(() -> execute(settlementId, snapshot));
        } catch (RejectedExecutionException e) {
            log.error("[SettlementService] 정산 실행기 제출 실패, SCHEDULED 상태로 남음: id={}, error={}",
                    settlementId, e.getMessage());
        }
    }

    private void execute(Long settlementId, SettlementSnapshot snapshot) {
        RegistryOutcome outcome = transferAsset(snapshot);
        try {
            SettlementStatus status = settlementResolver.resolve(settlementId, snapshot, outcome);
            log.info("[SettlementService] 정산 해소: id={}, status={}", settlementId, status);
        } catch (RuntimeException e) {
            log.error("[SettlementService] 정산 해소 실패, SCHEDULED 상태로 남음: id={}, error={}",
                    settlementId, e.getMessage(), e);
        }
    }

    /**
     * 자산 이전 + 분배 내역 요청
     * 어떤 예외든 실패 결과로 바꾼다 (호출자에게 전파하지 않음)
     */
    private RegistryOutcome transferAsset(SettlementSnapshot snapshot) {
        TransferPayoutRequest request = TransferPayoutRequest.builder()
                .registryId(snapshot.getRegistryId())
                .receiverId(snapshot.getBuyerId())
                .assetId(snapshot.getAssetId())
                .approvalId(snapshot.getApprovalId())
                .balance(snapshot.getPrice())
                .maxLenPayout(marketplaceProperties.getMaxPayoutRecipients())
                .build();
        try {
            return RegistryOutcome.success(assetRegistryClient.transferPayout(request));
        } catch (RuntimeException e) {
            log.warn("[SettlementService] 레지스트리 이전 실패: registry={}, asset={}, error={}",
                    snapshot.getRegistryId(), snapshot.getAssetId(), e.getMessage());
            return RegistryOutcome.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    // ===== 조회 =====

    @Transactional(readOnly = true)
    public SettlementResponse get(Long settlementId) {
        return settlementRecordRepository.findById(settlementId)
                .map(this::toResponse)
                .orElseThrow(() -> MarketException.notFound("Error: Settlement does not exist"));
    }

    @Transactional(readOnly = true)
    public List<SettlementResponse> listByAsset(String registryId, String assetId) {
        return settlementRecordRepository.findByRegistryIdAndAssetIdOrderByIdDesc(registryId, assetId).stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    private SettlementResponse toResponse(SettlementRecord record) {
        List<SettlementTransferResponse> transfers = settlementTransferRepository
                .findBySettlementIdOrderByIdAsc(record.getId()).stream()
                .map(transfer -> SettlementTransferResponse.builder()
                        .recipientId(transfer.getRecipientId())
                        .amount(transfer.getAmount())
                        .transferType(transfer.getTransferType().name())
                        .build())
                .collect(Collectors.toList());
        return SettlementResponse.builder()
                .id(record.getId())
                .kind(record.getKind().name())
                .status(record.getStatus().name())
                .outcome(record.getOutcome() != null ? record.getOutcome().name() : null)
                .sellerId(record.getSellerId())
                .buyerId(record.getBuyerId())
                .registryId(record.getRegistryId())
                .assetId(record.getAssetId())
                .currencyId(record.getCurrencyId())
                .price(record.getPrice())
                .feeAmount(record.getFeeAmount())
                .failureReason(record.getFailureReason())
                .createdAt(record.getCreatedAt())
                .resolvedAt(record.getResolvedAt())
                .transfers(transfers)
                .build();
    }
}
