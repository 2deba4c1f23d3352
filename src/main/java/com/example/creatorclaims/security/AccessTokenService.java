package com.example.creatorclaims.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.SecretKey;
import java.util.Base64;
import java.util.Optional;

/**
 * Validates user access tokens issued by the external authentication service.
 * Tokens are HMAC-signed, carry the expected issuer, and use the platform user id as subject.
 */
@Component
public class AccessTokenService {
    private static final Logger log = LoggerFactory.getLogger(AccessTokenService.class);

    public static final String PREFIX = "Bearer ";

    private SecretKey key;
    private final String base64Secret;
    private final String issuer;

    public AccessTokenService(
            @Value("${jwt.secret.key.base64}") String base64Secret,
            @Value("${jwt.issuer}") String issuer) {
        this.base64Secret = base64Secret;
        if (issuer == null || issuer.trim().isEmpty()) {
            throw new IllegalArgumentException("JWT Issuer (jwt.issuer) must not be null or empty");
        }
        this.issuer = issuer;
        log.info("Access token validation initializing. Issuer: {}", issuer);
    }

    @PostConstruct
    void initializeKey() {
        if (!StringUtils.hasText(this.base64Secret)) {
            log.error("CRITICAL: JWT Secret Key (jwt.secret.key.base64 or JWT_SECRET_KEY_BASE64 env var) is missing or empty!");
            throw new IllegalArgumentException("JWT Secret Key (jwt.secret.key.base64) must be provided");
        }
        byte[] decodedKey;
        try {
            decodedKey = Base64.getDecoder().decode(this.base64Secret);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid Base64 encoding for JWT secret key (jwt.secret.key.base64)", e);
        }
        if (decodedKey.length < 32) {
            log.error("CRITICAL: Provided JWT secret key is too short ({} bytes). Must be at least 256 bits (32 bytes).", decodedKey.length);
            throw new IllegalArgumentException("JWT Secret key must be at least 256 bits (32 bytes)");
        }
        this.key = Keys.hmacShaKeyFor(decodedKey);
        log.info("JWT Secret Key initialized successfully.");
    }

    /**
     * @return the user id carried by a valid Bearer token, or null when the token is missing or invalid.
     */
    public Long validateTokenAndGetUserId(HttpServletRequest request) {
        Optional<String> tokenOpt = extractToken(request);
        if (tokenOpt.isEmpty()) {
            log.debug("Bearer token missing.");
            return null;
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(this.key)
                    .requireIssuer(this.issuer)
                    .build()
                    .parseSignedClaims(tokenOpt.get())
                    .getPayload();

            String subject = claims.getSubject();
            if (!StringUtils.hasText(subject)) {
                log.warn("Access token has no subject.");
                return null;
            }
            return Long.valueOf(subject);
        } catch (JwtException e) {
            log.warn("JWT validation failed: {}", e.getMessage());
            return null;
        } catch (IllegalArgumentException e) {
            // NumberFormatException included: subject is not a user id
            log.warn("Invalid token format or claim issue: {}", e.getMessage());
            return null;
        }
    }

    static Optional<String> extractToken(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(PREFIX)) {
            return Optional.of(header.substring(PREFIX.length()));
        }
        return Optional.empty();
    }
}
