package dustin.market.domains.config.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 거래 수수료 변경 요청 DTO
 * Transaction Fee Request DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "거래 수수료 변경 요청")
public class TransactionFeeRequest {

    @NotNull(message = "feeBps is required")
    @PositiveOrZero(message = "feeBps must not be negative")
    @Schema(description = "수수료 (bps, 10000 미만)", example = "250", required = true)
    private Integer feeBps;
}
