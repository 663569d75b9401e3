package dustin.market.domains.config.model.dto;

import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 승인 목록 추가/제거 요청 DTO
 * Approved Accounts Request DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "승인 목록 추가/제거 요청")
public class ApprovedAccountsRequest {

    @NotEmpty(message = "accountIds must not be empty")
    @Schema(description = "계정 목록", example = "[\"nft.example.near\"]", required = true)
    private List<String> accountIds;
}
