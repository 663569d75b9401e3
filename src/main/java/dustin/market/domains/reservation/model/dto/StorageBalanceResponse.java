package dustin.market.domains.reservation.model.dto;

import java.math.BigDecimal;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 스토리지 예치금 응답 DTO
 * Storage Balance Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "스토리지 예치금 정보")
public class StorageBalanceResponse {

    @Schema(description = "계정 ID", example = "alice.near")
    private String accountId;

    @Schema(description = "예치금 잔고", example = "8590000000000000000000")
    private BigDecimal balance;

    /**
     * 활성 예약 수 (리스팅 + 오퍼)
     */
    @Schema(description = "활성 리스팅/오퍼 수", example = "1")
    private Long supply;

    @Schema(description = "현재 예약을 유지하는 데 필요한 금액", example = "8590000000000000000000")
    private BigDecimal required;
}
