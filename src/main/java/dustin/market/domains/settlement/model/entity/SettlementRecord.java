package dustin.market.domains.settlement.model.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 정산 기록 엔티티
 * Settlement Record Entity
 *
 * 역할:
 * - 예약 시점의 스냅샷 (삭제된 리스팅/오퍼 값) 보관
 * - 해소 결과 (분기, 수수료, 실패 사유) 기록
 *
 * 해소는 이 행을 잠근 뒤 status가 SCHEDULED일 때만 수행된다 (중복 해소 방지).
 */
@Entity
@Table(name = "settlements",
       indexes = {
           @Index(name = "idx_settlements_status", columnList = "status"),
           @Index(name = "idx_settlements_asset", columnList = "registry_id,asset_id")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettlementRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 20)
    private SettlementKind kind;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private SettlementStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", length = 20)
    private SettlementOutcome outcome;

    @Column(name = "seller_id", nullable = false, length = 128)
    private String sellerId;

    @Column(name = "buyer_id", nullable = false, length = 128)
    private String buyerId;

    @Column(name = "registry_id", nullable = false, length = 128)
    private String registryId;

    @Column(name = "asset_id", nullable = false, length = 256)
    private String assetId;

    @Column(name = "currency_id", nullable = false, length = 128)
    private String currencyId;

    @Column(name = "approval_id", nullable = false)
    private Long approvalId;

    @Column(name = "price", nullable = false, precision = 40, scale = 0)
    private BigDecimal price;

    /**
     * 해소 시점에 적용된 수수료 (환불 분기는 0)
     */
    @Column(name = "fee_amount", precision = 40, scale = 0)
    private BigDecimal feeAmount;

    @Column(name = "failure_reason", length = 1000)
    private String failureReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
