package dustin.market.domains.auth.service;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;

/**
 * JWT 서비스
 * JWT Service for token generation and verification
 *
 * subject = 호출자 계정 ID (예: alice.near, 레지스트리 콜백은 레지스트리 계정)
 */
@Service
public class JwtService {

    private final SecretKey secretKey;
    private final long accessTokenTtlMinutes;

    public JwtService(
            @Value("${jwt.secret:market-platform-jwt-secret-key-2024-production}") String secret,
            @Value("${jwt.access-token-ttl-minutes:60}") long accessTokenTtlMinutes) {
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.accessTokenTtlMinutes = accessTokenTtlMinutes;
    }

    /**
     * Access Token 발급
     * Generate Access Token
     */
    public String generateAccessToken(String accountId) {
        Instant now = Instant.now();
        Instant expiration = now.plus(accessTokenTtlMinutes, ChronoUnit.MINUTES);

        return Jwts.builder()
                .subject(accountId)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiration))
                .signWith(secretKey)
                .compact();
    }

    /**
     * Access Token 검증 및 Claims 추출
     * Verify Access Token and extract Claims
     */
    public Claims verifyAccessToken(String token) {
        try {
            return Jwts.parser()
                    .verifyWith(secretKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (Exception e) {
            throw new RuntimeException("Invalid or expired token", e);
        }
    }

    /**
     * Access Token에서 계정 ID 추출
     * Extract account ID from Access Token
     */
    public String extractAccountId(String token) {
        return verifyAccessToken(token).getSubject();
    }
}
