package dustin.market.shared.context;

import java.math.BigDecimal;

import lombok.Getter;
import lombok.ToString;

/**
 * 호출 컨텍스트
 * Call Context
 *
 * 역할:
 * - 상태 변경 호출의 호출자 계정과 첨부 예치금(최소 단위)을 한 값으로 전달
 * - 컨트롤러가 JWT에서 추출한 계정으로 생성하여 서비스에 넘긴다
 */
@Getter
@ToString
public final class CallContext {

    private final String callerId;
    private final BigDecimal attachedDeposit;

    private CallContext(String callerId, BigDecimal attachedDeposit) {
        this.callerId = callerId;
        this.attachedDeposit = attachedDeposit;
    }

    public static CallContext of(String callerId, BigDecimal attachedDeposit) {
        if (callerId == null || callerId.isBlank()) {
            throw new IllegalArgumentException("callerId must not be blank");
        }
        return new CallContext(callerId, attachedDeposit == null ? BigDecimal.ZERO : attachedDeposit);
    }

    public static CallContext of(String callerId) {
        return of(callerId, BigDecimal.ZERO);
    }

    public static CallContext of(String callerId, long attachedDeposit) {
        return of(callerId, BigDecimal.valueOf(attachedDeposit));
    }
}
