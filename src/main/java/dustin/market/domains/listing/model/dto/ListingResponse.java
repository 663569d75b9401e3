package dustin.market.domains.listing.model.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 리스팅 응답 DTO
 * Listing Response DTO
 *
 * bids는 경매 리스팅일 때만 채워지고 고정가 리스팅이면 null
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "리스팅 정보")
public class ListingResponse {

    @Schema(description = "판매자", example = "alice.near")
    private String ownerId;

    @Schema(description = "이전 승인 번호", example = "3")
    private Long approvalId;

    @Schema(description = "자산 레지스트리", example = "nft.example.near")
    private String registryId;

    @Schema(description = "자산 ID", example = "token-1")
    private String assetId;

    @Schema(description = "통화", example = "near")
    private String currencyId;

    @Schema(description = "가격 (경매는 시작가)", example = "1000")
    private BigDecimal price;

    @Schema(description = "경매 시작 시각")
    private Instant startedAt;

    @Schema(description = "경매 종료 시각")
    private Instant endedAt;

    @Schema(description = "경매 여부")
    private Boolean isAuction;

    @Schema(description = "입찰 목록 (마지막이 최고가)")
    private List<BidResponse> bids;
}
