package com.orbital.authentication;

import lombok.extern.slf4j.Slf4j;
import okhttp3.Authenticator;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.Route;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

import static com.orbital.authentication.IdentityAuthorityHelper.AUTHORIZATION;
import static com.orbital.authentication.IdentityAuthorityHelper.getAccessTokenFromRequest;

/**
 * Leverages the OkHttp
 * <a href="https://square.github.io/okhttp/4.x/okhttp/okhttp3/-authenticator/">Authenticator API</a>
 * to react to HTTP 401 Not Authorized responses from the profile service that may arise as a
 * result of an expired token. The locally held session is refreshed through the
 * {@link IdentityAuthority} and the request retried once.
 */
@Slf4j
public class ProfileRequestAuthenticator implements Authenticator {

    private final IdentityAuthority authority;
    private final LocalSessionStore sessionStore;

    /**
     * Construct a new ProfileRequestAuthenticator
     * @param authority {@link IdentityAuthority} to refresh sessions with
     * @param sessionStore {@link LocalSessionStore} holding the session tokens come from
     */
    public ProfileRequestAuthenticator(IdentityAuthority authority, LocalSessionStore sessionStore) {
        Objects.requireNonNull(authority, "Must supply an identity authority for the profile request authenticator");
        Objects.requireNonNull(sessionStore, "Must supply a local session store for the profile request authenticator");
        this.authority = authority;
        this.sessionStore = sessionStore;
    }

    /**
     * Called by the OkHttp client on a 401. If the request carried the access token of the
     * locally held session, that session is refreshed and the request retried with the new
     * token. A request that already was a retry isn't retried again.
     * @param route Optional OkHttp Route
     * @param response OkHttp Response
     * @return OkHttp Request with updated token in Authorization header, or null to give up
     */
    @Override
    public Request authenticate(Route route, @NotNull Response response) {
        if (response.priorResponse() != null) { return null; }
        AccessToken accessToken = getAccessTokenFromRequest(response.request());
        if (accessToken == null) { return null; }

        // Only one thread at a time will go through this to avoid refresh chaos
        synchronized (this) {
            Session current = this.sessionStore.get();
            if (current == null) { return null; }
            // Another request already refreshed it, retry with the newer token
            if (!current.getAccessToken().equals(accessToken)) { return withToken(response.request(), current.getAccessToken()); }
            if (!current.isRefreshable()) { return null; }
            Session refreshed;
            try {
                refreshed = this.authority.refresh(current.getRefreshToken());
            } catch (IdentityException ex) {
                log.error("Failed to refresh session for profile request: " + ex.getMessage());
                return null;
            }
            if (current.getSubjectId() != null) { refreshed = refreshed.withSubject(current.getSubjectId()); }
            if (!this.sessionStore.replace(current, refreshed)) { return null; }
            return withToken(response.request(), refreshed.getAccessToken());
        }
    }

    private static Request withToken(Request request, AccessToken accessToken) {
        return request.newBuilder().header(AUTHORIZATION, "Bearer " + accessToken.getValue()).build();
    }

}
