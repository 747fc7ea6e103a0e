package com.orbital.authentication;

import com.nimbusds.oauth2.sdk.AuthorizationCode;
import com.nimbusds.oauth2.sdk.id.State;
import com.nimbusds.oauth2.sdk.pkce.CodeVerifier;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

import static com.orbital.authentication.ExchangeFailureReason.*;
import static com.orbital.authentication.ExchangeState.*;

/**
 * Turns an authorization code from the identity provider into a verified session using PKCE.
 * {@link #begin(String)} stores a {@link PkceExchangeRecord} and returns where to send the
 * browser; {@link #handleCallback(CallbackParameters)} consumes that record exactly once,
 * exchanges the code, re-validates the resulting identity with the authority, and attaches the
 * session to the redirect it returns.
 */
@Slf4j @Getter
public class OAuthExchangeHandler {

    static final String CACHE_CONTROL = "Cache-Control";
    static final String PRAGMA = "Pragma";
    static final String EXPIRES = "Expires";

    private final GateConfiguration configuration;
    private final IdentityAuthority authority;
    private final PkceRecordStore recordStore;
    private final URI callbackUri;
    private final BoundedCall boundedCall;
    private final Clock clock;
    private final SessionCookieCodec codec;

    /**
     * Construct a new OAuthExchangeHandler
     * @param configuration Gate configuration
     * @param authority Identity authority codes are exchanged with
     * @param recordStore Storage for PKCE records between sign-in and callback
     * @param callbackUri Absolute URI of the callback, as registered with the provider
     * @param executor Executor that authority calls run on, bounded by the validation timeout
     * @param clock Clock for record creation
     */
    public OAuthExchangeHandler(GateConfiguration configuration, IdentityAuthority authority, PkceRecordStore recordStore,
                                URI callbackUri, ExecutorService executor, Clock clock) {
        Objects.requireNonNull(configuration, "Must provide a gate configuration for the exchange handler");
        Objects.requireNonNull(authority, "Must provide an identity authority for the exchange handler");
        Objects.requireNonNull(recordStore, "Must provide a PKCE record store for the exchange handler");
        Objects.requireNonNull(callbackUri, "Must provide a callback URI for the exchange handler");
        Objects.requireNonNull(executor, "Must provide an executor for the exchange handler");
        Objects.requireNonNull(clock, "Must provide a clock for the exchange handler");
        this.configuration = configuration;
        this.authority = authority;
        this.recordStore = recordStore;
        this.callbackUri = callbackUri;
        this.boundedCall = new BoundedCall(executor, configuration.getValidationTimeout());
        this.clock = clock;
        this.codec = new SessionCookieCodec();
    }

    /**
     * Begins a sign-in via the identity provider
     * @param redirectTarget Local path to return to after sign-in (may be null)
     * @return {@link AuthorizationRedirect} to send the browser to
     */
    public AuthorizationRedirect begin(String redirectTarget) {
        State state = new State();
        CodeVerifier verifier = new CodeVerifier();
        String target = RedirectTargets.local(redirectTarget, this.configuration.getHomePath());
        this.recordStore.store(new PkceExchangeRecord(state, verifier, this.clock.instant(), target));
        URI authorizationUrl = this.authority.authorizationUrl(state, verifier, this.callbackUri);
        log.debug("Requested authorization, returning to " + target + " on success");
        return new AuthorizationRedirect(authorizationUrl, state);
    }

    /**
     * Handles the identity provider's redirect back to the callback. Always returns an outcome;
     * nothing here is thrown to the caller.
     * @param parameters Callback query parameters
     * @return {@link ExchangeOutcome}
     */
    public ExchangeOutcome handleCallback(CallbackParameters parameters) {
        Objects.requireNonNull(parameters, "Must provide callback parameters");
        List<ExchangeState> trail = new ArrayList<>(List.of(CODE_RECEIVED));
        GateResponse response = noCache(new GateResponse());

        if (parameters.getError() != null) {
            // The record for this state is dead either way
            this.recordStore.consume(parameters.getState() == null ? null : new State(parameters.getState()));
            String description = parameters.getErrorDescription() != null ? parameters.getErrorDescription() : parameters.getError();
            log.info("Identity provider returned " + parameters.getError() + " instead of an authorization code");
            return fail(PROVIDER_DENIED, ErrorDetails.sanitize(description), trail, response);
        }
        PkceExchangeRecord consumed = parameters.getState() == null ? null : this.recordStore.consume(new State(parameters.getState()));
        boolean expired = consumed != null && consumed.isExpired(this.clock.instant(), this.configuration.getPkceRecordTtl());
        if (expired) { log.debug("Sign-in request for " + consumed.getRedirectTarget() + " outlived its time to live"); }
        PkceExchangeRecord record = expired ? null : consumed;
        if (parameters.getCode() == null) {
            return fail(NO_CODE, null, trail, response);
        }
        if (record == null) {
            return fail(EXCHANGE_FAILED, "Sign-in request expired or was already used", trail, response);
        }

        trail.add(EXCHANGING);
        AuthorizationCode code = new AuthorizationCode(parameters.getCode());
        Session session;
        try {
            session = this.boundedCall.call(() -> this.authority.exchange(code, record.getVerifier(), this.callbackUri));
        } catch (IdentityException ex) {
            log.error("Failed to exchange authorization code: " + ex.getMessage());
            return fail(EXCHANGE_FAILED, ErrorDetails.sanitize(ex.getMessage()), trail, response);
        }

        Identity identity;
        try {
            identity = this.boundedCall.call(() -> this.authority.validate(session.getAccessToken()));
        } catch (IdentityException ex) {
            log.error("Failed to verify identity after code exchange: " + ex.getMessage());
            return fail(VERIFICATION_FAILED, null, trail, response);
        }
        if (session.getSubjectId() != null && !session.getSubjectId().equals(identity.getSubjectId())) {
            log.error("Identity authority validated subject " + identity.getSubjectId() + " but the exchange issued tokens for " + session.getSubjectId());
            return fail(VERIFICATION_FAILED, null, trail, response);
        }

        VerifiedSession verified = new VerifiedSession(identity, session, false);
        response.setIdentity(identity);
        response.attachSession(this.configuration.sessionCookie(this.codec.encode(verified.getSession())));
        response.redirect(GateDecision.REDIRECT, record.getRedirectTarget());
        trail.add(EXCHANGED);
        log.info("Signed in " + identity.getSubjectId() + " via identity provider");
        return ExchangeOutcome.exchanged(verified, trail, response);
    }

    /**
     * Location of the login page carrying the failure reason, and a message where the
     * reason has displayable detail
     * @param reason Failure reason
     * @param detail Sanitized detail (may be null)
     * @return Login location
     */
    public String failureLocation(ExchangeFailureReason reason, String detail) {
        StringBuilder location = new StringBuilder(this.configuration.getLoginPath())
                .append("?error=").append(reason.getCode());
        if (detail != null && (reason == EXCHANGE_FAILED || reason == PROVIDER_DENIED)) {
            location.append("&message=").append(URLEncoder.encode(detail, StandardCharsets.UTF_8));
        }
        return location.toString();
    }

    private ExchangeOutcome fail(ExchangeFailureReason reason, String detail, List<ExchangeState> trail, GateResponse response) {
        trail.add(FAILED);
        response.redirect(GateDecision.REDIRECT, failureLocation(reason, detail));
        log.debug("OAuth exchange failed with " + reason.getCode());
        return ExchangeOutcome.failed(reason, detail, trail, response);
    }

    private static GateResponse noCache(GateResponse response) {
        return response.setHeader(CACHE_CONTROL, "no-store, no-cache, must-revalidate")
                       .setHeader(PRAGMA, "no-cache")
                       .setHeader(EXPIRES, "0");
    }

}
