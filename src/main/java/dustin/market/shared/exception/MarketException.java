package dustin.market.shared.exception;

import lombok.Getter;

/**
 * 마켓 선행 조건 위반 예외
 * Marketplace precondition violation
 *
 * 호출 전체가 중단되고 트랜잭션은 롤백된다 (상태 변경 없음).
 */
@Getter
public class MarketException extends RuntimeException {

    private final ErrorCode errorCode;

    public MarketException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public static MarketException badRequest(String message) {
        return new MarketException(ErrorCode.BAD_REQUEST, message);
    }

    public static MarketException forbidden(String message) {
        return new MarketException(ErrorCode.FORBIDDEN, message);
    }

    public static MarketException notFound(String message) {
        return new MarketException(ErrorCode.NOT_FOUND, message);
    }

    /**
     * 조건이 거짓이면 BAD_REQUEST로 중단
     */
    public static void check(boolean condition, String message) {
        if (!condition) {
            throw badRequest(message);
        }
    }
}
