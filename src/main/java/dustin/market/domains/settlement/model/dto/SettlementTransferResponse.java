package dustin.market.domains.settlement.model.dto;

import java.math.BigDecimal;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 정산 지급 내역 응답 DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "정산 지급 내역")
public class SettlementTransferResponse {

    @Schema(description = "수령자", example = "alice.near")
    private String recipientId;

    @Schema(description = "금액", example = "930")
    private BigDecimal amount;

    @Schema(description = "지급 유형 (REFUND, SELLER, ROYALTY, FEE)", example = "SELLER")
    private String transferType;
}
