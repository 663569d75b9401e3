package dustin.market.domains.offer.model.dto;

import java.math.BigDecimal;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 오퍼 응답 DTO
 * Offer Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "오퍼 정보")
public class OfferResponse {

    @Schema(description = "구매 제안자", example = "bob.near")
    private String buyerId;

    @Schema(description = "자산 레지스트리", example = "nft.example.near")
    private String registryId;

    @Schema(description = "자산 ID", example = "token-1")
    private String assetId;

    @Schema(description = "통화", example = "near")
    private String currencyId;

    @Schema(description = "제안가 (에스크로 보관액)", example = "1000")
    private BigDecimal price;
}
