package dustin.market.domains.auction.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 입찰 취소 요청 DTO
 * Cancel Bid Request DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "입찰 취소 요청")
public class CancelBidRequest {

    @NotBlank(message = "registryId is required")
    @Schema(description = "자산 레지스트리", example = "nft.example.near", required = true)
    private String registryId;

    @NotBlank(message = "assetId is required")
    @Schema(description = "자산 ID", example = "token-1", required = true)
    private String assetId;

    @NotBlank(message = "bidderId is required")
    @Schema(description = "취소할 입찰자", example = "bob.near", required = true)
    private String bidderId;
}
