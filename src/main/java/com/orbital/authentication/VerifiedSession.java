package com.orbital.authentication;

import lombok.Getter;

import java.util.Objects;

/**
 * A {@link Session} the identity authority has confirmed, along with the {@link Identity}
 * it was confirmed for. When <code>refreshed</code> is set, the session differs from the one
 * that was presented and must be handed back to whoever holds the token copy.
 */
@Getter
public class VerifiedSession {

    private final Identity identity;
    private final Session session;
    private final boolean refreshed;

    public VerifiedSession(Identity identity, Session session, boolean refreshed) {
        Objects.requireNonNull(identity, "Must provide an identity for a verified session");
        Objects.requireNonNull(session, "Must provide a session for a verified session");
        this.identity = identity;
        this.session = session.withSubject(identity.getSubjectId());
        this.refreshed = refreshed;
    }

}
