package com.orbital.authentication;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

import static com.orbital.authentication.AuthFailure.AUTHORITY_UNREACHABLE;

/**
 * Stateless per-request gatekeeper. Asks the identity authority to validate (and when close
 * to expiry, refresh) the presented session, then decides whether the request is allowed,
 * sent to the login page with its path preserved, or sent away from an auth entry page.
 * <p>
 * Only the {@link GateConfiguration} is shared between requests, and it is read-only.
 */
@Slf4j @Getter
public class SessionValidator {

    private final GateConfiguration configuration;
    private final SessionCookieCodec codec;
    private final SessionVerifier verifier;
    private final BoundedCall boundedCall;

    /**
     * Construct a new SessionValidator
     * @param configuration Gate configuration
     * @param authority Identity authority to validate sessions with
     * @param executor Executor that authority calls run on, bounded by the validation timeout
     * @param clock Clock used for expiry checks
     */
    public SessionValidator(GateConfiguration configuration, IdentityAuthority authority, ExecutorService executor, Clock clock) {
        Objects.requireNonNull(configuration, "Must provide a gate configuration for the session validator");
        Objects.requireNonNull(authority, "Must provide an identity authority for the session validator");
        Objects.requireNonNull(executor, "Must provide an executor for the session validator");
        Objects.requireNonNull(clock, "Must provide a clock for the session validator");
        this.configuration = configuration;
        this.codec = new SessionCookieCodec();
        this.verifier = new SessionVerifier(authority, clock, configuration.getRefreshSkew());
        this.boundedCall = new BoundedCall(executor, configuration.getValidationTimeout());
    }

    /**
     * Decide what happens to <code>request</code>. The returned {@link GateResponse} carries any
     * refreshed session cookie, and it is the only response the caller should send.
     * @param request Inbound request
     * @return GateResponse with the decision and any cookies to set
     */
    public GateResponse validate(GateRequest request) {
        Objects.requireNonNull(request, "Must provide a request to validate");
        GateResponse response = new GateResponse();
        PathPolicy policy = this.configuration.getPathPolicy();
        String path = request.getPath();

        VerifiedSession verified = null;
        AuthFailure failure = null;
        try {
            Session session = this.codec.decode(request.getSessionValue());
            verified = this.boundedCall.call(() -> this.verifier.verify(session));
        } catch (IdentityException ex) {
            failure = ex.getFailure();
            if (failure == AUTHORITY_UNREACHABLE && policy.isProtected(path)) {
                log.warn("Unable to validate session for " + path + ": " + ex.getMessage());
            } else {
                log.debug("No authenticated session for " + path + ": " + failure);
            }
        }

        if (verified != null) {
            response.setIdentity(verified.getIdentity());
            if (verified.isRefreshed()) {
                log.debug("Attaching refreshed session for " + verified.getIdentity().getSubjectId());
                response.attachSession(this.configuration.sessionCookie(this.codec.encode(verified.getSession())));
            }
        } else if (failure != AUTHORITY_UNREACHABLE && request.getSessionValue() != null) {
            // Rejected, malformed or expired sessions are gone; stop the browser presenting them
            response.clearSession(this.configuration.clearingCookie());
        }

        if (policy.isProtected(path) && verified == null) {
            if (failure == AUTHORITY_UNREACHABLE && this.configuration.getUnreachablePolicy() == UnreachablePolicy.FAIL_OPEN) {
                log.warn("Identity authority unreachable, allowing " + path + " without a confirmed identity");
                return response;
            }
            return response.redirect(GateDecision.REDIRECT_TO_LOGIN, loginLocation(path));
        }
        if (policy.isAuthEntry(path) && verified != null) {
            return response.redirect(GateDecision.REDIRECT_TO_HOME, this.configuration.getHomePath());
        }
        return response;
    }

    /**
     * Location of the login page with <code>path</code> as the return destination
     * @param path Requested path
     * @return Login location
     */
    public String loginLocation(String path) {
        return this.configuration.getLoginPath() + "?" + this.configuration.getRedirectParameter() + "=" + URLEncoder.encode(path, StandardCharsets.UTF_8);
    }

}
