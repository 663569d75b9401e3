package dustin.market.shared.context;

import java.math.BigDecimal;

import dustin.market.shared.exception.MarketException;

/**
 * 금액 상수 및 검증
 * Amount constants and checks
 *
 * 모든 금액은 네이티브 통화의 최소 단위(정수)이다.
 */
public final class Amounts {

    /** 10^9 * 10^24 */
    public static final BigDecimal MAX_PRICE = new BigDecimal("1000000000000000000000000000000000");

    public static final BigDecimal ONE_UNIT = BigDecimal.ONE;

    /** 로열티 분배 합계 허용 오차 */
    public static final BigDecimal PAYOUT_TOLERANCE = BigDecimal.valueOf(100);

    private Amounts() {
    }

    /**
     * 0 이상의 정수 금액인지 검증
     */
    public static BigDecimal requireWhole(BigDecimal amount, String field) {
        MarketException.check(amount != null, "Error: " + field + " is required");
        MarketException.check(amount.signum() >= 0, "Error: " + field + " must not be negative");
        MarketException.check(isWhole(amount), "Error: " + field + " must be a whole number of units");
        return amount;
    }

    public static boolean isWhole(BigDecimal amount) {
        return amount.signum() == 0 || amount.stripTrailingZeros().scale() <= 0;
    }

    /**
     * 가격 상한 검증
     */
    public static BigDecimal requireBelowMaxPrice(BigDecimal price) {
        requireWhole(price, "price");
        MarketException.check(price.compareTo(MAX_PRICE) < 0,
                "Error: price higher than " + MAX_PRICE.toPlainString());
        return price;
    }
}
