package com.bikerly.security;

import com.bikerly.observability.AuthMetricsServiceInterface;
import com.bikerly.shared.dto.UserPublic;
import com.bikerly.shared.error.ApiException;
import com.bikerly.shared.model.Role;
import com.bikerly.shared.model.User;
import com.bikerly.shared.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Resolves the caller behind a bearer token and enforces role requirements.
 *
 * <p>Invalid tokens and tokens whose subject no longer exists fail with the same error so callers
 * cannot tell them apart; the log records which one happened. A deactivated account is rejected
 * here on every request, whatever the token's remaining lifetime.
 */
@Service
public class AuthGate {

    private static final Logger logger = LoggerFactory.getLogger(AuthGate.class);

    private static final String BEARER_PREFIX = "bearer ";
    private static final String INVALID_CREDENTIALS_MESSAGE = "Could not validate credentials";

    private final TokenService tokenService;
    private final UserRepository userRepository;
    private final AuthMetricsServiceInterface metricsService;

    public AuthGate(TokenService tokenService, UserRepository userRepository, AuthMetricsServiceInterface metricsService) {
        this.tokenService = tokenService;
        this.userRepository = userRepository;
        this.metricsService = metricsService;
    }

    /**
     * Resolves the identity from an Authorization header value ("Bearer &lt;token&gt;").
     */
    public UserPublic authenticateBearer(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            logger.debug("Missing Authorization header");
            metricsService.recordAccessDenied("missing_token");
            throw ApiException.authentication("Not authenticated", "Missing bearer token");
        }
        String value = authorizationHeader.trim();
        if (value.length() <= BEARER_PREFIX.length()
                || !value.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            logger.debug("Authorization header is not a bearer credential");
            metricsService.recordAccessDenied("missing_token");
            throw ApiException.authentication("Not authenticated", "Missing bearer token");
        }
        return authenticate(value.substring(BEARER_PREFIX.length()).trim());
    }

    /**
     * Verifies the token and loads the live account it names.
     * @throws ApiException AUTHENTICATION for an invalid token, unknown subject or inactive account;
     *                      DATABASE if the lookup itself fails
     */
    public UserPublic authenticate(String token) {
        TokenClaims claims;
        try {
            claims = tokenService.verify(token);
        } catch (ApiException e) {
            metricsService.recordAccessDenied("invalid_token");
            throw e;
        }

        Optional<User> user;
        try {
            user = userRepository.findByEmail(claims.getSubject());
        } catch (DataAccessException e) {
            logger.error("User lookup failed for token subject: {}", claims.getSubject(), e);
            throw ApiException.database("Database operation failed",
                    "An error occurred while processing your request", e);
        }

        if (user.isEmpty()) {
            logger.warn("User not found for token email: {}", claims.getSubject());
            metricsService.recordAccessDenied("unknown_subject");
            throw ApiException.authentication(INVALID_CREDENTIALS_MESSAGE, "Invalid or expired token");
        }

        if (!user.get().isActive()) {
            logger.warn("Inactive user attempted access: {}", claims.getSubject());
            metricsService.recordAccessDenied("inactive");
            throw ApiException.authentication("Account is inactive", "Your account has been deactivated");
        }

        return UserPublic.from(user.get());
    }

    /**
     * Exact role match; there is no role hierarchy.
     * @return the same identity when it holds the required role
     * @throws ApiException AUTHORIZATION naming the required role otherwise
     */
    public UserPublic authorize(UserPublic identity, Role requiredRole) {
        if (identity.getRole() != requiredRole) {
            logger.warn("Authorization failed: User {} (role: {}) attempted to access {}-only endpoint",
                    identity.getEmail(), identity.getRole(), requiredRole);
            metricsService.recordAccessDenied("role");
            throw ApiException.authorization("Not enough permissions",
                    "This endpoint requires " + requiredRole.getValue() + " role");
        }
        return identity;
    }
}
