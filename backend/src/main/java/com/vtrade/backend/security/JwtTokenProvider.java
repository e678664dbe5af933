package com.vtrade.backend.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.UUID;

/**
 * Verifies bearer tokens issued by the platform's auth service. Tokens carry the user id in {@code userId}
 * and the role in {@code role}; {@code ADMIN} unlocks the admin API.
 */
@Component
public class JwtTokenProvider {

    private static final Logger logger = LoggerFactory.getLogger(JwtTokenProvider.class);

    @Value("${jwt.secret}")
    private String jwtSecret;

    @Value("${jwt.expiration:3600000}")
    private long jwtExpirationMs;

    @PostConstruct
    public void validateSecret() {
        if (jwtSecret == null || jwtSecret.isBlank()) {
            logger.error("Missing JWT secret. Set JWT_SECRET environment variable; generated an ephemeral key");
            jwtSecret = UUID.randomUUID() + UUID.randomUUID().toString();
        }
        if (jwtSecret.length() < 32) {
            logger.error("JWT secret must be at least 32 characters; generated an ephemeral key");
            jwtSecret = UUID.randomUUID() + UUID.randomUUID().toString();
        }
    }

    private SecretKey getSigningKey() {
        return Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
    }

    public String generateToken(String username, Long userId, String role) {
        Date now = new Date();
        Date expiryDate = new Date(now.getTime() + jwtExpirationMs);

        return Jwts.builder()
                .subject(username)
                .claim("userId", userId)
                .claim("role", role)
                .issuedAt(now)
                .expiration(expiryDate)
                .signWith(getSigningKey(), Jwts.SIG.HS256)
                .compact();
    }

    public UserPrincipal parse(String token) {
        Claims claims = claims(token);
        return new UserPrincipal(claims.get("userId", Long.class), claims.getSubject(), claims.get("role", String.class));
    }

    public boolean validateToken(String authToken) {
        try {
            claims(authToken);
            return true;
        } catch (JwtException | IllegalArgumentException ex) {
            logger.warn("JWT validation error: {}", ex.getMessage());
        }
        return false;
    }

    private Claims claims(String token) {
        return Jwts.parser()
                .verifyWith(getSigningKey())
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}
