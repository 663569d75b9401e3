package dustin.market.domains.config.model.entity;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 마켓 설정 엔티티
 * Market Config Entity
 *
 * 역할:
 * - 소유자, 재무 계정, 거래 수수료(bps)를 보관하는 단일 행
 * - 최초 기동 시 MarketplaceProperties 값으로 생성
 */
@Entity
@Table(name = "market_config")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketConfig {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    /**
     * 마켓 소유자 (설정 변경 권한)
     */
    @Column(name = "owner_id", nullable = false, length = 128)
    private String ownerId;

    /**
     * 재무 계정 (수수료 수령)
     */
    @Column(name = "treasury_id", nullable = false, length = 128)
    private String treasuryId;

    /**
     * 거래 수수료 (basis points, 0..9999)
     */
    @Column(name = "transaction_fee_bps", nullable = false)
    private Integer transactionFeeBps;

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
