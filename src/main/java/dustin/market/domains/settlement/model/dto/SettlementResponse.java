package dustin.market.domains.settlement.model.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 정산 응답 DTO
 * Settlement Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "정산 정보")
public class SettlementResponse {

    @Schema(description = "정산 ID", example = "1")
    private Long id;

    @Schema(description = "정산 경로 (PURCHASE, OFFER)", example = "PURCHASE")
    private String kind;

    @Schema(description = "상태 (SCHEDULED, RESOLVED_PAID, RESOLVED_REFUNDED)", example = "RESOLVED_PAID")
    private String status;

    @Schema(description = "해소 분기 (REGISTRY_FAILED, NO_ROYALTIES, PAYOUT)", example = "PAYOUT")
    private String outcome;

    @Schema(description = "판매자", example = "alice.near")
    private String sellerId;

    @Schema(description = "구매자", example = "bob.near")
    private String buyerId;

    @Schema(description = "자산 레지스트리", example = "nft.example.near")
    private String registryId;

    @Schema(description = "자산 ID", example = "token-1")
    private String assetId;

    @Schema(description = "통화", example = "near")
    private String currencyId;

    @Schema(description = "분배 총액", example = "1000")
    private BigDecimal price;

    @Schema(description = "수수료", example = "20")
    private BigDecimal feeAmount;

    @Schema(description = "실패 사유 (환불 분기)")
    private String failureReason;

    private LocalDateTime createdAt;

    private LocalDateTime resolvedAt;

    @Schema(description = "지급 내역")
    private List<SettlementTransferResponse> transfers;
}
