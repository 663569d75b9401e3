package dustin.market.domains.auction.model.dto;

import java.math.BigDecimal;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 입찰 요청 DTO
 * Place Bid Request DTO
 *
 * 입찰 금액 이상을 X-Attached-Deposit 헤더로 첨부한다 (초과분은 환불).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "입찰 요청")
public class PlaceBidRequest {

    @NotBlank(message = "registryId is required")
    @Schema(description = "자산 레지스트리", example = "nft.example.near", required = true)
    private String registryId;

    @NotBlank(message = "assetId is required")
    @Schema(description = "자산 ID", example = "token-1", required = true)
    private String assetId;

    @NotBlank(message = "currencyId is required")
    @Schema(description = "통화", example = "near", required = true)
    private String currencyId;

    @NotNull(message = "amount is required")
    @Schema(description = "입찰가", example = "150", required = true)
    private BigDecimal amount;
}
