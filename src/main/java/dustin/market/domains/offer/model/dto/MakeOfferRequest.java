package dustin.market.domains.offer.model.dto;

import java.math.BigDecimal;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 오퍼 제안 요청 DTO
 * Make Offer Request DTO
 *
 * 제안가와 정확히 같은 금액을 X-Attached-Deposit 헤더로 첨부한다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "오퍼 제안 요청")
public class MakeOfferRequest {

    @NotBlank(message = "registryId is required")
    @Schema(description = "자산 레지스트리", example = "nft.example.near", required = true)
    private String registryId;

    @NotBlank(message = "assetId is required")
    @Schema(description = "자산 ID", example = "token-1", required = true)
    private String assetId;

    @NotBlank(message = "currencyId is required")
    @Schema(description = "통화", example = "near", required = true)
    private String currencyId;

    @NotNull(message = "price is required")
    @Schema(description = "제안가", example = "1000", required = true)
    private BigDecimal price;
}
