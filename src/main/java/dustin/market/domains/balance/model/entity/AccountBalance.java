package dustin.market.domains.balance.model.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 계정 잔고 엔티티
 * Account Balance Entity
 *
 * 역할:
 * - 계정별 네이티브 통화 잔고 (최소 단위 정수)
 * - 마켓 에스크로 계정도 같은 테이블에 하나의 행으로 존재
 *
 * 예치금 수령: 호출자 → 에스크로
 * 환불/지급: 에스크로 → 수령자
 */
@Entity
@Table(name = "account_balances",
       uniqueConstraints = @UniqueConstraint(columnNames = {"account_id"}),
       indexes = {
           @Index(name = "idx_account_balances_account_id", columnList = "account_id")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountBalance {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * 계정 ID (예: alice.near)
     */
    @Column(name = "account_id", nullable = false, length = 128)
    private String accountId;

    /**
     * 잔고 (최소 단위)
     */
    @Column(name = "balance", nullable = false, precision = 40, scale = 0)
    @Builder.Default
    private BigDecimal balance = BigDecimal.ZERO;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

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
