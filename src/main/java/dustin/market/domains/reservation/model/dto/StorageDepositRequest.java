package dustin.market.domains.reservation.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 스토리지 예치 요청 DTO
 * Storage Deposit Request DTO
 *
 * accountId가 없으면 호출자 계정에 적립된다. 금액은 X-Attached-Deposit 헤더.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "스토리지 예치 요청")
public class StorageDepositRequest {

    @Schema(description = "적립 대상 계정 (생략 시 호출자)", example = "alice.near")
    private String accountId;
}
