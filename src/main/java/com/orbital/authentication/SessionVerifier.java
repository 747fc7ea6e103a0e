package com.orbital.authentication;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

import static com.orbital.authentication.AuthFailure.TOKEN_ABSENT;

/**
 * Validate-and-possibly-refresh. Shared by the server gate, the exchange handler and the
 * client cache so all three ask the identity authority the same question the same way.
 * <p>
 * A session expiring within the refresh skew is refreshed first and the new access token is
 * validated. A session the authority rejects is treated as absent and never retried.
 */
@Slf4j
public class SessionVerifier {

    private final IdentityAuthority authority;
    private final Clock clock;
    private final Duration refreshSkew;

    public SessionVerifier(IdentityAuthority authority, Clock clock, Duration refreshSkew) {
        Objects.requireNonNull(authority, "Must provide an identity authority to verify sessions with");
        Objects.requireNonNull(clock, "Must provide a clock to verify sessions with");
        Objects.requireNonNull(refreshSkew, "Must provide a refresh skew to verify sessions with");
        this.authority = authority;
        this.clock = clock;
        this.refreshSkew = refreshSkew;
    }

    /**
     * Confirms <code>session</code> with the identity authority, refreshing it when needed
     * @param session Session presented by the caller
     * @return {@link VerifiedSession}
     * @throws IdentityException {@link AuthFailure#TOKEN_ABSENT} when the session has expired and
     * can't be refreshed, {@link AuthFailure#VALIDATION_FAILED} when the authority rejects it, or
     * {@link AuthFailure#AUTHORITY_UNREACHABLE}
     */
    public VerifiedSession verify(Session session) throws IdentityException {
        Objects.requireNonNull(session, "Must provide a session to verify");
        if (session.isNearExpiry(this.clock, this.refreshSkew)) {
            if (!session.isRefreshable()) {
                if (session.isExpired(this.clock)) { throw new IdentityException(TOKEN_ABSENT, "Session has expired and cannot be refreshed"); }
            } else {
                log.debug("Session for " + session.getSubjectId() + " expires at " + session.getExpiresAt() + ", refreshing");
                return refreshAndValidate(session);
            }
        }
        return new VerifiedSession(this.authority.validate(session.getAccessToken()), session, false);
    }

    private VerifiedSession refreshAndValidate(Session session) throws IdentityException {
        Session refreshed = this.authority.refresh(session.getRefreshToken());
        Identity identity = this.authority.validate(refreshed.getAccessToken());
        return new VerifiedSession(identity, refreshed, true);
    }

}
