package dustin.market.domains.config.model.dto;

import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 마켓 설정 응답 DTO
 * Market Config Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "마켓 설정")
public class MarketConfigResponse {

    @Schema(description = "마켓 소유자", example = "owner.near")
    private String ownerId;

    @Schema(description = "재무 계정 (수수료 수령)", example = "treasury.near")
    private String treasuryId;

    @Schema(description = "거래 수수료 (bps)", example = "200")
    private Integer transactionFeeBps;

    @Schema(description = "승인된 자산 레지스트리")
    private List<String> approvedRegistries;

    @Schema(description = "승인된 통화")
    private List<String> approvedCurrencies;
}
