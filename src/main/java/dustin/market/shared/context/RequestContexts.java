package dustin.market.shared.context;

import java.math.BigDecimal;

import dustin.market.domains.auth.middleware.JwtAuthenticationFilter;
import dustin.market.shared.exception.ErrorCode;
import dustin.market.shared.exception.MarketException;
import jakarta.servlet.http.HttpServletRequest;

/**
 * HTTP 요청 → 호출 컨텍스트 변환
 * Builds a CallContext from an authenticated request
 *
 * - 호출자: JWT 필터가 넣은 "accountId" attribute
 * - 첨부 예치금: X-Attached-Deposit 헤더 (없으면 0)
 */
public final class RequestContexts {

    public static final String ATTACHED_DEPOSIT_HEADER = "X-Attached-Deposit";

    private RequestContexts() {
    }

    public static CallContext from(HttpServletRequest request) {
        Object accountId = request.getAttribute(JwtAuthenticationFilter.ACCOUNT_ID_ATTRIBUTE);
        if (!(accountId instanceof String) || ((String) accountId).isBlank()) {
            throw new MarketException(ErrorCode.UNAUTHORIZED, "Error: caller is not authenticated");
        }
        return CallContext.of((String) accountId, parseDeposit(request.getHeader(ATTACHED_DEPOSIT_HEADER)));
    }

    private static BigDecimal parseDeposit(String header) {
        if (header == null || header.isBlank()) {
            return BigDecimal.ZERO;
        }
        try {
            return Amounts.requireWhole(new BigDecimal(header.trim()), "attached deposit");
        } catch (NumberFormatException e) {
            throw MarketException.badRequest("Error: invalid " + ATTACHED_DEPOSIT_HEADER + " header: " + header);
        }
    }
}
