package dustin.market.shared.registry;

import java.math.BigDecimal;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 자산 이전 + 분배 내역 요청
 * Transfer-and-report-payout request
 */
@Getter
@Builder
@ToString
public class TransferPayoutRequest {

    /** 호출 대상 레지스트리 */
    private final String registryId;

    /** 새 소유자 */
    private final String receiverId;

    private final String assetId;

    /** 레지스트리가 발급한 이전 승인 번호 */
    private final long approvalId;

    /** 분배할 총액 */
    private final BigDecimal balance;

    /** 분배 수신자 최대 수 */
    private final int maxLenPayout;
}
