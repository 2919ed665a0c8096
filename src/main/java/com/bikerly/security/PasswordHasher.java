package com.bikerly.security;

import com.bikerly.shared.error.ApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;

/**
 * One-way BCrypt hashing and verification of account passwords.
 *
 * <p>BCrypt only reads the first 72 bytes of its input. Passwords whose UTF-8 encoding is longer
 * are truncated to at most 72 bytes before hashing and before verification, cutting on a character
 * boundary. This is lossy on purpose: two passwords that share their first 72 encoded bytes hash
 * and verify identically. Set {@code app.security.password.reject-oversize=true} to reject such
 * passwords with a validation error instead.
 */
@Service
public class PasswordHasher {

    private static final Logger logger = LoggerFactory.getLogger(PasswordHasher.class);

    public static final int MAX_PASSWORD_BYTES = 72;

    private final PasswordEncoder passwordEncoder;
    private final boolean rejectOversize;

    public PasswordHasher(
            @Value("${app.security.password.bcrypt-strength:12}") int strength,
            @Value("${app.security.password.reject-oversize:false}") boolean rejectOversize) {
        this.passwordEncoder = new BCryptPasswordEncoder(strength);
        this.rejectOversize = rejectOversize;
    }

    /**
     * Hashes a password with a fresh random salt.
     * @param password plain text password, must not be empty
     * @return BCrypt digest
     * @throws ApiException VALIDATION if the password is empty, or oversize while rejection is enabled
     */
    public String hash(String password) {
        if (password == null || password.isEmpty()) {
            throw ApiException.validation("Password processing failed", "Password must not be empty");
        }

        int length = password.getBytes(StandardCharsets.UTF_8).length;
        if (length > MAX_PASSWORD_BYTES) {
            if (rejectOversize) {
                logger.warn("Rejected password of {} bytes (limit {})", length, MAX_PASSWORD_BYTES);
                throw ApiException.validation("Password processing failed",
                        "Password is too long. Maximum " + MAX_PASSWORD_BYTES + " bytes allowed.");
            }
            logger.warn("Password exceeds {} bytes ({}), truncating", MAX_PASSWORD_BYTES, length);
        }

        return passwordEncoder.encode(truncateToMaxBytes(password));
    }

    /**
     * Checks a password against a stored digest. Never throws: malformed digests,
     * empty input and encoder failures all report false. While oversize rejection is enabled,
     * input over 72 bytes never matches.
     */
    public boolean verify(String password, String digest) {
        if (password == null || password.isEmpty() || digest == null || digest.isBlank()) {
            return false;
        }
        if (rejectOversize && password.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES) {
            logger.debug("Oversize password refused at verification");
            return false;
        }
        try {
            return passwordEncoder.matches(truncateToMaxBytes(password), digest);
        } catch (RuntimeException e) {
            logger.error("Error verifying password", e);
            return false;
        }
    }

    /**
     * Returns the longest prefix of the password whose UTF-8 encoding fits in 72 bytes.
     * A multi-byte character straddling the limit is dropped whole.
     */
    static String truncateToMaxBytes(String password) {
        byte[] bytes = password.getBytes(StandardCharsets.UTF_8);
        if (bytes.length <= MAX_PASSWORD_BYTES) {
            return password;
        }
        int cut = MAX_PASSWORD_BYTES;
        // bytes[cut] is the first excluded byte; a continuation byte there means its character began earlier
        while (cut > 0 && (bytes[cut] & 0xC0) == 0x80) {
            cut--;
        }
        return new String(bytes, 0, cut, StandardCharsets.UTF_8);
    }
}
