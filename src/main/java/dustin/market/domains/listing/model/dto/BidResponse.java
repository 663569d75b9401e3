package dustin.market.domains.listing.model.dto;

import java.math.BigDecimal;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 입찰 응답 DTO
 * Bid Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "입찰 정보")
public class BidResponse {

    @Schema(description = "입찰자", example = "bob.near")
    private String bidderId;

    @Schema(description = "입찰가 (최소 단위)", example = "150")
    private BigDecimal price;
}
