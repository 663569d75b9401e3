package dustin.market.domains.listing.model.entity;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 리스팅 엔티티
 * Listing Entity
 *
 * 역할:
 * - (registry, asset) 하나당 하나의 판매 등록 (고정가 또는 경매)
 * - 경매 리스팅이면 입찰 목록을 가진다 (마지막 항목이 최고가)
 *
 * 불변식:
 * - listing_key = registry||asset 유일
 * - isAuction이 true가 아니면 입찰 목록은 항상 비어 있음
 * - 입찰 가격은 목록 순서대로 엄격히 증가, 입찰자당 최대 1개
 */
@Entity
@Table(name = "listings",
       uniqueConstraints = @UniqueConstraint(columnNames = {"listing_key"}),
       indexes = {
           @Index(name = "idx_listings_owner", columnList = "owner_id")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Listing {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * 리스팅 키 (registry||asset)
     */
    @Column(name = "listing_key", nullable = false, length = 512)
    private String listingKey;

    /**
     * 판매자
     */
    @Column(name = "owner_id", nullable = false, length = 128)
    private String ownerId;

    /**
     * 레지스트리가 발급한 이전 승인 번호
     */
    @Column(name = "approval_id", nullable = false)
    private Long approvalId;

    @Column(name = "registry_id", nullable = false, length = 128)
    private String registryId;

    @Column(name = "asset_id", nullable = false, length = 256)
    private String assetId;

    @Column(name = "currency_id", nullable = false, length = 128)
    private String currencyId;

    /**
     * 판매가 (경매는 시작가)
     */
    @Column(name = "price", nullable = false, precision = 40, scale = 0)
    private BigDecimal price;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Column(name = "is_auction")
    private Boolean isAuction;

    @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @JoinColumn(name = "listing_id")
    @OrderColumn(name = "bid_order")
    @ToString.Exclude
    @Builder.Default
    private List<Bid> bids = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean auction() {
        return Boolean.TRUE.equals(isAuction);
    }

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
