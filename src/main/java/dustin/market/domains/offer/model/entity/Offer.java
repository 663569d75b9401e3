package dustin.market.domains.offer.model.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 오퍼 엔티티
 * Offer Entity
 *
 * 역할:
 * - 리스팅되지 않은 자산에 대한 구매 제안
 * - 제안가 전액이 에스크로에 보관됨
 *
 * 불변식:
 * - offer_key = registry||buyer||asset 유일 (같은 구매자의 재제안은 교체)
 */
@Entity
@Table(name = "offers",
       uniqueConstraints = @UniqueConstraint(columnNames = {"offer_key"}),
       indexes = {
           @Index(name = "idx_offers_buyer", columnList = "buyer_id")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Offer {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * 오퍼 키 (registry||buyer||asset)
     */
    @Column(name = "offer_key", nullable = false, length = 512)
    private String offerKey;

    @Column(name = "buyer_id", nullable = false, length = 128)
    private String buyerId;

    @Column(name = "registry_id", nullable = false, length = 128)
    private String registryId;

    @Column(name = "asset_id", nullable = false, length = 256)
    private String assetId;

    @Column(name = "currency_id", nullable = false, length = 128)
    private String currencyId;

    /**
     * 제안가 (에스크로 보관액)
     */
    @Column(name = "price", nullable = false, precision = 40, scale = 0)
    private BigDecimal price;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
