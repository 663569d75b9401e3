package dustin.market.domains.callback.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import dustin.market.domains.listing.model.dto.ListingResponse;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 승인 콜백 처리 결과
 * Approval Result
 *
 * sale이면 listing, accept_offer이면 settlementId가 채워진다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApprovalResult {

    private String marketType;
    private ListingResponse listing;
    private Long settlementId;
}
