package com.bikerly.security;

import com.bikerly.shared.model.Role;

import java.time.Instant;
import java.util.Objects;

/**
 * Claim set carried by a session token. The expiry is absent until the token is issued.
 */
public final class TokenClaims {

    private final String subject;
    private final Role role;
    private final String uuid;
    private final Instant expiresAt;

    public TokenClaims(String subject, Role role, String uuid) {
        this(subject, role, uuid, null);
    }

    public TokenClaims(String subject, Role role, String uuid, Instant expiresAt) {
        this.subject = subject;
        this.role = role;
        this.uuid = uuid;
        this.expiresAt = expiresAt;
    }

    public String getSubject() {
        return subject;
    }

    public Role getRole() {
        return role;
    }

    public String getUuid() {
        return uuid;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    /**
     * True when subject, role and uuid match, ignoring expiry.
     */
    public boolean sameIdentityAs(TokenClaims other) {
        return other != null
                && Objects.equals(subject, other.subject)
                && role == other.role
                && Objects.equals(uuid, other.uuid);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TokenClaims)) {
            return false;
        }
        TokenClaims that = (TokenClaims) o;
        return sameIdentityAs(that) && Objects.equals(expiresAt, that.expiresAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subject, role, uuid, expiresAt);
    }

    @Override
    public String toString() {
        return "TokenClaims{subject=" + subject + ", role=" + role + ", uuid=" + uuid + ", expiresAt=" + expiresAt + "}";
    }
}
