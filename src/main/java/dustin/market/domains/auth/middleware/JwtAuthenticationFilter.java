package dustin.market.domains.auth.middleware;

import dustin.market.domains.auth.service.JwtService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * JWT 인증 필터
 * JWT Authentication Filter
 *
 * 상태 변경 API는 호출자 계정이 필요하다. 조회(GET) API와 문서 경로는 통과.
 * 검증된 계정 ID는 request attribute "accountId"로 컨트롤러에 전달된다.
 */
@Component
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final String ACCOUNT_ID_ATTRIBUTE = "accountId";

    private final JwtService jwtService;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String path = request.getRequestURI();
        String method = request.getMethod();

        if (path.startsWith("/swagger-ui") ||
            path.startsWith("/swagger-ui.html") ||
            path.startsWith("/api-docs") ||
            path.startsWith("/v3/api-docs") ||
            path.startsWith("/swagger-resources") ||
            path.startsWith("/webjars") ||
            // 조회 API는 인증 불필요
            ("GET".equalsIgnoreCase(method) && path.startsWith("/api/market"))) {
            filterChain.doFilter(request, response);
            return;
        }

        String authHeader = request.getHeader("Authorization");

        if (authHeader == null || !authHeader.startsWith("Bearer ")) {
            writeError(response, HttpServletResponse.SC_UNAUTHORIZED, "Missing or invalid authorization header");
            return;
        }

        String token = authHeader.substring(7);

        String accountId;
        try {
            accountId = jwtService.extractAccountId(token);
        } catch (RuntimeException e) {
            writeError(response, HttpServletResponse.SC_UNAUTHORIZED,
                    "Invalid or expired token: " + (e.getMessage() != null ? e.getMessage() : "Unknown error"));
            return;
        }

        if (accountId == null || accountId.isBlank()) {
            writeError(response, HttpServletResponse.SC_UNAUTHORIZED, "Token has no subject");
            return;
        }

        request.setAttribute(ACCOUNT_ID_ATTRIBUTE, accountId);
        filterChain.doFilter(request, response);
    }

    private void writeError(HttpServletResponse response, int status, String message) throws IOException {
        if (response.isCommitted()) {
            return;
        }
        response.setStatus(status);
        response.setContentType("application/json; charset=UTF-8");
        response.getWriter().write("{\"error\":\"" + message.replace("\"", "'") + "\"}");
        response.getWriter().flush();
    }
}
