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
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 정산 지급 내역 엔티티
 * Settlement Transfer Entity
 *
 * 해소 단계에서 에스크로가 내보낸 지급 한 건
 */
@Entity
@Table(name = "settlement_transfers",
       indexes = {
           @Index(name = "idx_settlement_transfers_settlement", columnList = "settlement_id")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettlementTransfer {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "settlement_id", nullable = false)
    private Long settlementId;

    @Column(name = "recipient_id", nullable = false, length = 128)
    private String recipientId;

    @Column(name = "amount", nullable = false, precision = 40, scale = 0)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "transfer_type", nullable = false, length = 20)
    private TransferType transferType;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
