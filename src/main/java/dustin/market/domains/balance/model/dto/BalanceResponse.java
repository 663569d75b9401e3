package dustin.market.domains.balance.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 잔고 응답 DTO
 * Balance Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "계정 잔고")
public class BalanceResponse {

    @Schema(description = "계정 ID", example = "alice.near")
    private String accountId;

    /**
     * 잔고 (최소 단위)
     */
    @Schema(description = "잔고 (최소 단위 정수)", example = "1000000000000000000000000")
    private BigDecimal balance;
}
