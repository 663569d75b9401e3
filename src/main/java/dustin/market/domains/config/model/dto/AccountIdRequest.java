package dustin.market.domains.config.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 계정 지정 요청 DTO (재무 계정 변경, 소유권 이전)
 * Account Id Request DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "계정 지정 요청")
public class AccountIdRequest {

    @NotBlank(message = "accountId is required")
    @Schema(description = "대상 계정", example = "treasury.near", required = true)
    private String accountId;
}
