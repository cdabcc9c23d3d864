package com.deskhub.inbox.auth.service.jwt;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

/**
 * HS256 access tokens: subject is the user id, {@code tenant_id}, {@code role} and
 * {@code username} travel as claims. Tokens are issued by the identity service; this service
 * only needs {@link #issueAccessToken} for tooling and tests.
 */
@Service
public class JwtService {

    private final SecretKey key;
    private final Duration accessTtl;

    public JwtService(
            @Value("${app.jwt.secret:dev-secret-change-me-please-32bytes-min}") String secret,
            @Value("${app.jwt.access-ttl-seconds:7200}") long accessTtlSeconds
    ) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.accessTtl = Duration.ofSeconds(Math.max(60, accessTtlSeconds));
    }

    public String issueAccessToken(String userId, String tenantId, String role, String username) {
        var now = Instant.now();
        return Jwts.builder()
                .setSubject(userId)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plus(accessTtl)))
                .claim("tenant_id", tenantId)
                .claim("role", role)
                .claim("username", username == null ? "" : username)
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    public JwtClaims parse(String token) {
        Claims claims = Jwts.parserBuilder()
                .setSigningKey(key)
                .build()
                .parseClaimsJws(token)
                .getBody();

        var tenantId = claims.get("tenant_id", String.class);
        var role = claims.get("role", String.class);
        var username = String.valueOf(claims.getOrDefault("username", ""));
        return new JwtClaims(claims.getSubject(), tenantId, role, username);
    }

    public static Optional<String> extractBearerToken(String authorization) {
        if (authorization == null || authorization.isBlank()) return Optional.empty();
        var prefix = "Bearer ";
        if (!authorization.startsWith(prefix)) return Optional.empty();
        var token = authorization.substring(prefix.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
