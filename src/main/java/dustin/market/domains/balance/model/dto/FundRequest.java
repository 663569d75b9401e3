package dustin.market.domains.balance.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 외부 입금 요청 DTO
 * Fund Request DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "외부 입금 요청")
public class FundRequest {

    @NotBlank(message = "accountId is required")
    @Schema(description = "입금 대상 계정", example = "alice.near", required = true)
    private String accountId;

    @NotNull(message = "amount is required")
    @PositiveOrZero(message = "amount must not be negative")
    @Schema(description = "입금액 (최소 단위)", example = "1000000", required = true)
    private BigDecimal amount;
}
