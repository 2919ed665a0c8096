package com.bikerly.security;

import com.bikerly.shared.error.ApiException;
import com.bikerly.shared.model.Role;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.InvalidKeyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Issues and verifies signed, time-bound session tokens (HMAC-signed JWTs).
 * Tokens are not stored server-side; expiry is the only invalidation.
 */
@Service
public class TokenService {

    private static final Logger logger = LoggerFactory.getLogger(TokenService.class);

    static final String ROLE_CLAIM = "role";
    static final String UUID_CLAIM = "uuid";

    private static final String INVALID_TOKEN_MESSAGE = "Could not validate credentials";
    private static final String INVALID_TOKEN_DETAIL = "Invalid or expired token";

    private final SignatureAlgorithm algorithm;
    private final Key signingKey;
    private final Duration lifetime;
    private final Clock clock;
    private final JwtParser parser;

    public TokenService(
            @Value("${app.security.jwt.secret}") String secret,
            @Value("${app.security.jwt.algorithm:HS256}") String algorithmName,
            @Value("${app.security.jwt.expire-minutes:60}") long expireMinutes,
            Clock clock) {
        this.algorithm = resolveAlgorithm(algorithmName);
        this.signingKey = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), algorithm.getJcaName());
        try {
            algorithm.assertValidSigningKey(signingKey);
        } catch (InvalidKeyException e) {
            throw new IllegalStateException("JWT secret is too short for " + algorithm.getValue(), e);
        }
        this.lifetime = Duration.ofMinutes(expireMinutes);
        this.clock = clock;
        this.parser = Jwts.parserBuilder()
                .setSigningKey(signingKey)
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    /**
     * Signs the claim set plus an expiry of now + configured lifetime.
     * @param claims subject, role and uuid to embed
     * @return compact JWT string
     */
    public String issue(TokenClaims claims) {
        Instant expiresAt = clock.instant().plus(lifetime);
        String token = Jwts.builder()
                .setSubject(claims.getSubject())
                .claim(ROLE_CLAIM, claims.getRole() != null ? claims.getRole().getValue() : null)
                .claim(UUID_CLAIM, claims.getUuid())
                .setExpiration(Date.from(expiresAt))
                .signWith(signingKey, algorithm)
                .compact();
        logger.debug("Access token created for: {}", claims.getSubject());
        return token;
    }

    /**
     * Checks signature, algorithm and expiry and returns the embedded claims.
     * Every failure surfaces as the same AUTHENTICATION error; the cause is logged only.
     * @throws ApiException AUTHENTICATION on any invalid, expired or subject-less token
     */
    public TokenClaims verify(String token) {
        if (token == null || token.isBlank()) {
            logger.debug("Token verification failed: empty token");
            throw invalidToken();
        }

        Claims body;
        String roleValue;
        String uuid;
        try {
            Jws<Claims> jws = parser.parseClaimsJws(token);
            if (!algorithm.getValue().equals(jws.getHeader().getAlgorithm())) {
                logger.warn("Token verification failed: unexpected algorithm {}", jws.getHeader().getAlgorithm());
                throw invalidToken();
            }
            body = jws.getBody();
            // Typed reads throw RequiredTypeException, a JwtException, for non-string claims
            roleValue = body.get(ROLE_CLAIM, String.class);
            uuid = body.get(UUID_CLAIM, String.class);
        } catch (ExpiredJwtException e) {
            logger.info("Token verification failed: expired at {}", e.getClaims().getExpiration());
            throw invalidToken();
        } catch (JwtException | IllegalArgumentException e) {
            logger.warn("Token verification failed: {}", e.getMessage());
            throw invalidToken();
        }

        String subject = body.getSubject();
        if (subject == null || subject.isBlank()) {
            logger.warn("Token missing 'sub' claim");
            throw invalidToken();
        }

        Role role = null;
        if (roleValue != null) {
            try {
                role = Role.fromValue(roleValue);
            } catch (IllegalArgumentException e) {
                logger.warn("Token carries unknown role: {}", roleValue);
                throw invalidToken();
            }
        }

        Date expiration = body.getExpiration();
        return new TokenClaims(subject, role, uuid,
                expiration != null ? expiration.toInstant() : null);
    }

    public Duration getLifetime() {
        return lifetime;
    }

    static SignatureAlgorithm resolveAlgorithm(String name) {
        SignatureAlgorithm resolved;
        try {
            resolved = SignatureAlgorithm.forName(name);
        } catch (JwtException e) {
            throw new IllegalStateException("Unsupported JWT algorithm: " + name, e);
        }
        if (!resolved.isHmac()) {
            throw new IllegalStateException("JWT algorithm must be an HMAC algorithm (HS256, HS384, HS512): " + name);
        }
        return resolved;
    }

    private static ApiException invalidToken() {
        return ApiException.authentication(INVALID_TOKEN_MESSAGE, INVALID_TOKEN_DETAIL);
    }
}
