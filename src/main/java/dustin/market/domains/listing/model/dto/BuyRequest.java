package dustin.market.domains.listing.model.dto;

import java.math.BigDecimal;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 구매 요청 DTO
 * Buy Request DTO
 *
 * currencyId/price는 선택값이며, 지정하면 리스팅과 일치해야 한다.
 * 가격 이상을 X-Attached-Deposit 헤더로 첨부한다 (초과분은 환불).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "고정가 리스팅 구매 요청")
public class BuyRequest {

    @NotBlank(message = "registryId is required")
    @Schema(description = "자산 레지스트리", example = "nft.example.near", required = true)
    private String registryId;

    @NotBlank(message = "assetId is required")
    @Schema(description = "자산 ID", example = "token-1", required = true)
    private String assetId;

    @Schema(description = "통화 (선택)", example = "near")
    private String currencyId;

    @Schema(description = "기대 가격 (선택)", example = "1000")
    private BigDecimal price;
}
