package com.orbital.authentication;

import com.nimbusds.oauth2.sdk.id.State;
import lombok.Getter;

import java.net.URI;
import java.util.List;
import java.util.Objects;

/**
 * Result of beginning a sign-in via the identity provider: where to send the browser, and the
 * state value the callback must come back with. The trail runs from {@link ExchangeState#IDLE}
 * to {@link ExchangeState#AUTHORIZATION_REQUESTED}; the callback picks up from there.
 */
@Getter
public class AuthorizationRedirect {

    private final URI authorizationUrl;
    private final State state;
    private final List<ExchangeState> trail;

    public AuthorizationRedirect(URI authorizationUrl, State state) {
        Objects.requireNonNull(authorizationUrl, "Must provide an authorization URL");
        Objects.requireNonNull(state, "Must provide a state value");
        this.authorizationUrl = authorizationUrl;
        this.state = state;
        this.trail = List.of(ExchangeState.IDLE, ExchangeState.AUTHORIZATION_REQUESTED);
    }

    public ExchangeState getExchangeState() { return this.trail.get(this.trail.size() - 1); }

}
