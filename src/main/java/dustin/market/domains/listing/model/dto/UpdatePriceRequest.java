package dustin.market.domains.listing.model.dto;

import java.math.BigDecimal;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 리스팅 가격 변경 요청 DTO
 * Update Price Request DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "리스팅 가격 변경 요청")
public class UpdatePriceRequest {

    @NotBlank(message = "registryId is required")
    @Schema(description = "자산 레지스트리", example = "nft.example.near", required = true)
    private String registryId;

    @NotBlank(message = "assetId is required")
    @Schema(description = "자산 ID", example = "token-1", required = true)
    private String assetId;

    @NotBlank(message = "currencyId is required")
    @Schema(description = "통화 (리스팅 통화와 같아야 함)", example = "near", required = true)
    private String currencyId;

    @NotNull(message = "price is required")
    @Schema(description = "새 가격", example = "1200", required = true)
    private BigDecimal price;
}
