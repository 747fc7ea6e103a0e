package com.orbital.authentication;

import lombok.Getter;

import java.io.Serializable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Copy of a session issued by the identity authority. Holders never mutate a session; a
 * refresh through the {@link IdentityAuthority} produces a new one. A session is never
 * proof of identity on its own, it must be validated with the authority first.
 */
@Getter
public class Session implements Serializable {

    private final AccessToken accessToken;
    private final RefreshToken refreshToken;
    private final Instant expiresAt;
    private final String subjectId;

    /**
     * Construct a new Session
     * @param accessToken Access token of the session
     * @param refreshToken Refresh token of the session (may be null when the authority issued none)
     * @param expiresAt Expiry of the access token
     * @param subjectId Subject the session was issued to (may be null until validated)
     */
    public Session(AccessToken accessToken, RefreshToken refreshToken, Instant expiresAt, String subjectId) {
        Objects.requireNonNull(accessToken, "Must provide an access token to construct a session");
        Objects.requireNonNull(expiresAt, "Must provide an expiry to construct a session");
        this.accessToken = accessToken;
        this.refreshToken = refreshToken;
        this.expiresAt = expiresAt;
        this.subjectId = subjectId;
    }

    /**
     * Returns a copy of this session bound to the provided <code>subjectId</code>
     * @param subjectId Validated subject identifier
     * @return Session with the subject set
     */
    public Session withSubject(String subjectId) {
        Objects.requireNonNull(subjectId, "Must provide a subject identifier to bind to the session");
        return new Session(this.accessToken, this.refreshToken, this.expiresAt, subjectId);
    }

    /**
     * Whether the access token has already expired
     * @param clock Clock to compare against
     * @return true when expired
     */
    public boolean isExpired(Clock clock) {
        return !clock.instant().isBefore(this.expiresAt);
    }

    /**
     * Whether the access token expires within <code>skew</code> of now
     * @param clock Clock to compare against
     * @param skew Window before expiry in which a refresh should happen
     * @return true when the access token is expired or about to expire
     */
    public boolean isNearExpiry(Clock clock, Duration skew) {
        return !clock.instant().plus(skew).isBefore(this.expiresAt);
    }

    public boolean isRefreshable() { return this.refreshToken != null; }

    @Override
    public boolean equals(Object o) {
        if (this == o) { return true; }
        if (o == null || getClass() != o.getClass()) { return false; }
        Session session = (Session) o;
        return this.accessToken.equals(session.accessToken)
                && Objects.equals(this.refreshToken, session.refreshToken)
                && this.expiresAt.equals(session.expiresAt)
                && Objects.equals(this.subjectId, session.subjectId);
    }

    @Override
    public int hashCode() { return Objects.hash(this.accessToken, this.refreshToken, this.expiresAt, this.subjectId); }

    @Override
    public String toString() { return "Session[subject=" + this.subjectId + ", expiresAt=" + this.expiresAt + "]"; }

}
