package dustin.market.domains.listing.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 리스팅 지정 요청 DTO
 * Listing Key Request DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "리스팅 지정 요청 (registry, asset)")
public class ListingKeyRequest {

    @NotBlank(message = "registryId is required")
    @Schema(description = "자산 레지스트리", example = "nft.example.near", required = true)
    private String registryId;

    @NotBlank(message = "assetId is required")
    @Schema(description = "자산 ID", example = "token-1", required = true)
    private String assetId;
}
