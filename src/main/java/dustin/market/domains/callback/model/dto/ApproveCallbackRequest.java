package dustin.market.domains.callback.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 레지스트리 승인 콜백 요청 DTO
 * Approve Callback Request DTO
 *
 * 호출자(JWT 계정)가 레지스트리 자신이다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "레지스트리 승인 콜백 요청")
public class ApproveCallbackRequest {

    @NotBlank(message = "assetId is required")
    @Schema(description = "승인된 자산 ID", example = "token-1", required = true)
    private String assetId;

    @NotBlank(message = "ownerId is required")
    @Schema(description = "자산 소유자", example = "alice.near", required = true)
    private String ownerId;

    @NotNull(message = "approvalId is required")
    @Schema(description = "레지스트리가 발급한 승인 ID", example = "3", required = true)
    private Long approvalId;

    @NotBlank(message = "msg is required")
    @Schema(description = "승인 메시지 (JSON 문자열)",
            example = "{\"market_type\":\"sale\",\"price\":\"1000\",\"ft_token_id\":\"near\"}",
            required = true)
    private String msg;
}
