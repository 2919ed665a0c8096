package com.bikerly.security;

import com.bikerly.observability.AuthMetricsServiceInterface;
import com.bikerly.shared.dto.RegisterRequest;
import com.bikerly.shared.error.ApiException;
import com.bikerly.shared.model.User;
import com.bikerly.shared.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Registration and login flows.
 * Login gives the same error for an unknown email and a wrong password.
 */
@Service
public class AuthService {

    private static final Logger logger = LoggerFactory.getLogger(AuthService.class);

    // Verified against when the email is unknown so both login failures cost one BCrypt check
    private static final String UNKNOWN_USER_PASSWORD = "unknown-user-placeholder";

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final TokenService tokenService;
    private final AuthMetricsServiceInterface metricsService;
    private final String unknownUserDigest;

    public AuthService(
            UserRepository userRepository,
            PasswordHasher passwordHasher,
            TokenService tokenService,
            AuthMetricsServiceInterface metricsService) {
        this.userRepository = userRepository;
        this.passwordHasher = passwordHasher;
        this.tokenService = tokenService;
        this.metricsService = metricsService;
        this.unknownUserDigest = passwordHasher.hash(UNKNOWN_USER_PASSWORD);
    }

    /**
     * Creates a rider account, active and unverified, with a fresh uuid.
     * @throws ApiException CONFLICT if the email (or username) is taken, VALIDATION for an
     *                      unacceptable password, DATABASE if storage fails
     */
    public User register(RegisterRequest request) {
        logger.info("Registration attempt for email: {}", request.getEmail());
        try {
            if (userRepository.findByEmail(request.getEmail()).isPresent()) {
                logger.warn("Registration failed: Email already exists - {}", request.getEmail());
                throw ApiException.conflict("User with this email already exists",
                        "A user with this email address is already registered");
            }

            User user = new User(request.getEmail(), request.getUserName(), passwordHasher.hash(request.getPassword()));
            user.setPhoneNumber(request.getPhoneNumber());
            user.setCountryCode(request.getCountryCode());
            user.setName(request.getName());
            user.setDisplayName(request.getDisplayName());

            User saved = userRepository.insert(user);
            logger.info("User registered successfully: {} (ID: {})", saved.getEmail(), saved.getId());
            metricsService.recordRegistration();
            return saved;
        } catch (DuplicateKeyException e) {
            logger.warn("Registration failed: unique index violation for {}: {}", request.getEmail(), e.getMessage());
            throw ApiException.conflict("User with this email or username already exists",
                    "A user with this email address or username is already registered");
        } catch (DataAccessException e) {
            logger.error("Unexpected error during registration for {}", request.getEmail(), e);
            throw ApiException.database("Failed to create user",
                    "An error occurred while creating your account. Please try again later.", e);
        }
    }

    /**
     * Checks credentials and issues a session token.
     * @param email login identifier
     * @param password plain text password
     * @return signed bearer token
     * @throws ApiException AUTHENTICATION for bad credentials or an inactive account,
     *                      DATABASE if the lookup fails
     */
    public String login(String email, String password) {
        logger.info("Login attempt for email: {}", email);

        Optional<User> found;
        try {
            found = userRepository.findByEmail(email);
        } catch (DataAccessException e) {
            logger.error("Unexpected error during login for {}", email, e);
            throw ApiException.database("Login failed",
                    "An error occurred during login. Please try again later.", e);
        }

        if (found.isEmpty()) {
            passwordHasher.verify(password, unknownUserDigest);
            logger.warn("Login failed: User not found - {}", email);
            metricsService.recordLoginFailure("unknown_email");
            throw badCredentials();
        }

        User user = found.get();
        if (!passwordHasher.verify(password, user.getHashedPassword())) {
            logger.warn("Login failed: Invalid password for email - {}", email);
            metricsService.recordLoginFailure("bad_password");
            throw badCredentials();
        }

        if (!user.isActive()) {
            logger.warn("Login failed: Inactive user - {}", email);
            metricsService.recordLoginFailure("inactive");
            throw ApiException.authentication("Account is inactive",
                    "Your account has been deactivated. Please contact support.");
        }

        String token = tokenService.issue(new TokenClaims(user.getEmail(), user.getRole(), user.getUuid()));
        logger.info("User logged in successfully: {}", user.getEmail());
        metricsService.recordLoginSuccess();
        return token;
    }

    private static ApiException badCredentials() {
        return ApiException.authentication("Incorrect email or password", "Invalid credentials provided");
    }
}
