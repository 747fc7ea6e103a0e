package com.orbital.authentication;

import com.nimbusds.oauth2.sdk.id.State;
import com.nimbusds.oauth2.sdk.pkce.CodeVerifier;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * PKCE verifier created when a sign-in via the identity provider begins, keyed by the OAuth
 * <code>state</code> value. Consumed exactly once when the provider redirects back, and unusable
 * after its time to live.
 */
@Getter
public class PkceExchangeRecord {

    private final State state;
    private final CodeVerifier verifier;
    private final Instant createdAt;
    private final String redirectTarget;

    public PkceExchangeRecord(State state, CodeVerifier verifier, Instant createdAt, String redirectTarget) {
        Objects.requireNonNull(state, "Must provide a state value for a PKCE exchange record");
        Objects.requireNonNull(verifier, "Must provide a code verifier for a PKCE exchange record");
        Objects.requireNonNull(createdAt, "Must provide a creation time for a PKCE exchange record");
        Objects.requireNonNull(redirectTarget, "Must provide a redirect target for a PKCE exchange record");
        this.state = state;
        this.verifier = verifier;
        this.createdAt = createdAt;
        this.redirectTarget = redirectTarget;
    }

    public boolean isExpired(Instant now, Duration ttl) { return !now.isBefore(this.createdAt.plus(ttl)); }

    @Override
    public String toString() { return "PkceExchangeRecord[createdAt=" + this.createdAt + ", redirectTarget=" + this.redirectTarget + "]"; }

}
