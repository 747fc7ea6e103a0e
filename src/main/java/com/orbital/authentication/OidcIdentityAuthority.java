package com.orbital.authentication;

import com.nimbusds.oauth2.sdk.*;
import com.nimbusds.oauth2.sdk.auth.ClientSecretBasic;
import com.nimbusds.oauth2.sdk.auth.Secret;
import com.nimbusds.oauth2.sdk.http.HTTPRequest;
import com.nimbusds.oauth2.sdk.http.HTTPResponse;
import com.nimbusds.oauth2.sdk.id.ClientID;
import com.nimbusds.oauth2.sdk.id.State;
import com.nimbusds.oauth2.sdk.pkce.CodeChallengeMethod;
import com.nimbusds.oauth2.sdk.pkce.CodeVerifier;
import com.nimbusds.oauth2.sdk.token.BearerAccessToken;
import com.nimbusds.oauth2.sdk.token.Token;
import com.nimbusds.openid.connect.sdk.OIDCTokenResponseParser;
import com.nimbusds.openid.connect.sdk.UserInfoRequest;
import com.nimbusds.openid.connect.sdk.UserInfoSuccessResponse;
import com.nimbusds.openid.connect.sdk.claims.UserInfo;
import com.nimbusds.openid.connect.sdk.op.OIDCProviderMetadata;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.orbital.authentication.AuthFailure.*;
import static com.orbital.authentication.IdentityAuthorityHelper.*;

/**
 * Implementation of {@link IdentityAuthority} for an
 * <a href="https://openid.net/specs/openid-connect-core-1_0.html">OpenID Connect</a> provider.
 * Validation goes to the userinfo endpoint, refresh and code exchange to the token endpoint,
 * and invalidation to the revocation endpoint. Every request carries connect and read timeouts.
 * Must use {@link Builder} for construction.
 */
@Slf4j @Getter
public class OidcIdentityAuthority implements IdentityAuthority {

    private final URI oidcProviderId;
    private final URI authorizationEndpoint;
    private final URI tokenEndpoint;
    private final URI userInfoEndpoint;
    private final URI revocationEndpoint;
    private final ClientID clientId;
    private final Secret clientSecret;
    private final Scope scope;
    private final Map<String, String> authorizationParameters;
    private final Duration connectTimeout;
    private final Duration readTimeout;
    private final Duration defaultLifetime;
    private final Clock clock;

    private OidcIdentityAuthority(Builder builder) {
        Objects.requireNonNull(builder.oidcProviderId, "Must provide an OIDC provider identifier to construct an identity authority");
        Objects.requireNonNull(builder.authorizationEndpoint, "Must provide an authorization endpoint to construct an identity authority");
        Objects.requireNonNull(builder.tokenEndpoint, "Must provide a token endpoint to construct an identity authority");
        Objects.requireNonNull(builder.userInfoEndpoint, "Must provide a userinfo endpoint to construct an identity authority");
        Objects.requireNonNull(builder.clientId, "Must provide a client identifier to construct an identity authority");
        Objects.requireNonNull(builder.scope, "Must provide scope to construct an identity authority");
        this.oidcProviderId = builder.oidcProviderId;
        this.authorizationEndpoint = builder.authorizationEndpoint;
        this.tokenEndpoint = builder.tokenEndpoint;
        this.userInfoEndpoint = builder.userInfoEndpoint;
        this.revocationEndpoint = builder.revocationEndpoint;
        this.clientId = builder.clientId;
        this.clientSecret = builder.clientSecret;
        this.scope = builder.scope;
        this.authorizationParameters = Map.copyOf(builder.authorizationParameters);
        this.connectTimeout = builder.connectTimeout;
        this.readTimeout = builder.readTimeout;
        this.defaultLifetime = builder.defaultLifetime;
        this.clock = builder.clock;
    }

    /**
     * Validates <code>accessToken</code> against the userinfo endpoint of the provider. A 401 or
     * 403 means the provider rejected the token; anything else that isn't a success means the
     * provider couldn't give an answer.
     * @param accessToken {@link AccessToken} to validate
     * @return {@link Identity} of the token's subject
     * @throws IdentityException
     */
    @Override
    public Identity validate(AccessToken accessToken) throws IdentityException {
        Objects.requireNonNull(accessToken, "Must provide an access token to validate");
        UserInfoRequest request = new UserInfoRequest(this.userInfoEndpoint, new BearerAccessToken(accessToken.getValue()));
        HTTPResponse response = send(request.toHTTPRequest(), "userinfo");
        int status = response.getStatusCode();
        if (status == 401 || status == 403) {
            throw new IdentityException(VALIDATION_FAILED, "Access token was rejected by " + this.oidcProviderId);
        }
        if (!response.indicatesSuccess()) {
            throw new IdentityException(AUTHORITY_UNREACHABLE, "Unexpected status " + status + " from userinfo endpoint " + this.userInfoEndpoint);
        }
        try {
            UserInfo userInfo = UserInfoSuccessResponse.parse(response).getUserInfo();
            return new Identity(userInfo.getSubject().getValue(), userInfo.getEmailAddress());
        } catch (ParseException ex) {
            throw new IdentityException(AUTHORITY_UNREACHABLE, "Failed to parse response from userinfo endpoint " + this.userInfoEndpoint, ex);
        }
    }

    /**
     * Refreshes a session via a refresh token grant. A refresh token the provider refuses
     * means the session is gone.
     * @param refreshToken {@link RefreshToken} to exchange
     * @return Refreshed {@link Session}
     * @throws IdentityException
     */
    @Override
    public Session refresh(RefreshToken refreshToken) throws IdentityException {
        Objects.requireNonNull(refreshToken, "Must provide a refresh token to refresh a session");
        com.nimbusds.oauth2.sdk.token.RefreshToken nimbusRefreshToken = new com.nimbusds.oauth2.sdk.token.RefreshToken(refreshToken.getValue());
        Session refreshed = obtainTokens(new RefreshTokenGrant(nimbusRefreshToken), VALIDATION_FAILED);
        // Providers may omit the refresh token on rotation, in which case the old one stays valid
        if (refreshed.getRefreshToken() == null) {
            return new Session(refreshed.getAccessToken(), refreshToken, refreshed.getExpiresAt(), refreshed.getSubjectId());
        }
        return refreshed;
    }

    @Override
    public URI authorizationUrl(State state, CodeVerifier codeVerifier, URI redirect) {
        Objects.requireNonNull(state, "Must provide a state value for the authorization request");
        Objects.requireNonNull(codeVerifier, "Must provide a code verifier for the authorization request");
        Objects.requireNonNull(redirect, "Must provide a redirect for the authorization request");
        AuthorizationRequest.Builder requestBuilder = new AuthorizationRequest.Builder(new ResponseType(ResponseType.Value.CODE), this.clientId);
        requestBuilder.scope(this.scope)
                      .state(state)
                      .codeChallenge(codeVerifier, CodeChallengeMethod.S256)
                      .redirectionURI(redirect)
                      .endpointURI(this.authorizationEndpoint);
        this.authorizationParameters.forEach((name, value) -> requestBuilder.customParameter(name, value));
        return requestBuilder.build().toURI();
    }

    @Override
    public Session exchange(AuthorizationCode code, CodeVerifier codeVerifier, URI redirect) throws IdentityException {
        Objects.requireNonNull(code, "Cannot request tokens without authorization code");
        Objects.requireNonNull(codeVerifier, "Must provide a code verifier for the token request");
        Objects.requireNonNull(redirect, "Must provide a redirect for the token request");
        return obtainTokens(new AuthorizationCodeGrant(code, redirect, codeVerifier), EXCHANGE_FAILED);
    }

    @Override
    public Session signIn(String username, Secret password) throws IdentityException {
        Objects.requireNonNull(username, "Must provide a username to sign in");
        Objects.requireNonNull(password, "Must provide a password to sign in");
        return obtainTokens(new ResourceOwnerPasswordCredentialsGrant(username, password), VALIDATION_FAILED);
    }

    /**
     * Revokes the session at the revocation endpoint of the provider. The refresh token is
     * revoked when there is one, since providers revoke the access tokens issued from it too.
     * A read timeout is reported as {@link AuthFailure#INVALIDATION_TIMEOUT}.
     * @param session {@link Session} to invalidate
     * @throws IdentityException
     */
    @Override
    public void invalidate(Session session) throws IdentityException {
        Objects.requireNonNull(session, "Must provide a session to invalidate");
        if (this.revocationEndpoint == null) {
            log.warn("OpenID Provider " + this.oidcProviderId + " has no revocation endpoint, session remains live until it expires");
            return;
        }
        Token token = session.getRefreshToken() != null
                ? new com.nimbusds.oauth2.sdk.token.RefreshToken(session.getRefreshToken().getValue())
                : new BearerAccessToken(session.getAccessToken().getValue());
        TokenRevocationRequest request = this.clientSecret == null
                ? new TokenRevocationRequest(this.revocationEndpoint, this.clientId, token)
                : new TokenRevocationRequest(this.revocationEndpoint, new ClientSecretBasic(this.clientId, this.clientSecret), token);
        HTTPResponse response;
        try {
            response = bounded(request.toHTTPRequest(), this.connectTimeout, this.readTimeout).send();
        } catch (SocketTimeoutException ex) {
            throw new IdentityException(INVALIDATION_TIMEOUT, "Timed out revoking session at " + this.revocationEndpoint, ex);
        } catch (IOException ex) {
            throw new IdentityException(AUTHORITY_UNREACHABLE, "Request failed to revocation endpoint " + this.revocationEndpoint, ex);
        }
        if (response.getStatusCode() == 401) {
            throw new IdentityException(VALIDATION_FAILED, "Session was already rejected by " + this.oidcProviderId);
        }
        if (!response.indicatesSuccess()) {
            throw new IdentityException(AUTHORITY_UNREACHABLE, "Unexpected status " + response.getStatusCode() + " from revocation endpoint " + this.revocationEndpoint);
        }
    }

    /**
     * Post a token request to the token endpoint of the provider. Used for code exchange,
     * refresh, and password sign in.
     * @param grant authorization grant
     * @param onRejection failure to report when the provider answers with an error response
     * @return {@link Session} translated from the token response
     * @throws IdentityException
     */
    protected Session obtainTokens(AuthorizationGrant grant, AuthFailure onRejection) throws IdentityException {
        TokenRequest request = this.clientSecret == null
                ? new TokenRequest(this.tokenEndpoint, this.clientId, grant, null)
                : new TokenRequest(this.tokenEndpoint, new ClientSecretBasic(this.clientId, this.clientSecret), grant, null);
        HTTPResponse httpResponse = send(request.toHTTPRequest(), "token");
        if (httpResponse.getStatusCode() >= 500) {
            throw new IdentityException(AUTHORITY_UNREACHABLE, "Token endpoint " + this.tokenEndpoint + " failed with status " + httpResponse.getStatusCode());
        }
        TokenResponse response;
        try {
            response = OIDCTokenResponseParser.parse(httpResponse);
        } catch (ParseException ex) {
            throw new IdentityException(onRejection, "Failed to parse response from token endpoint " + this.tokenEndpoint, ex);
        }
        if (!response.indicatesSuccess()) {
            throw new IdentityException(onRejection, describe(response.toErrorResponse().getErrorObject()));
        }
        return translateTokens(response.toSuccessResponse().getTokens(), this.clock.instant(), this.defaultLifetime);
    }

    private HTTPResponse send(HTTPRequest httpRequest, String endpointName) throws IdentityException {
        httpRequest.setAccept("application/json");
        try {
            return bounded(httpRequest, this.connectTimeout, this.readTimeout).send();
        } catch (IOException ex) {
            throw new IdentityException(AUTHORITY_UNREACHABLE, "Request failed to " + endpointName + " endpoint " + httpRequest.getURI(), ex);
        }
    }

    /**
     * Builder for {@link OidcIdentityAuthority} instances. Either call {@link #setProvider(URI)}
     * to discover endpoints from the provider's configuration, or {@link #setProviderId(URI)}
     * and {@link #setEndpoints(URI, URI, URI, URI)} for providers without discovery.<br>
     * <ol>
     *     <li>{@link #setTimeouts(Duration, Duration)} (optional)</li>
     *     <li>{@link #setProvider(URI)}</li>
     *     <li>{@link #setClientIdentifier(String)}</li>
     *     <li>{@link #setClientSecret(String)} (optional, public clients rely on PKCE)</li>
     *     <li>{@link #setScope(List)}</li>
     *     <li>{@link #build()}</li>
     * </ol>
     */
    @NoArgsConstructor @Getter
    public static class Builder {

        private URI oidcProviderId;
        private URI authorizationEndpoint;
        private URI tokenEndpoint;
        private URI userInfoEndpoint;
        private URI revocationEndpoint;
        private ClientID clientId;
        private Secret clientSecret;
        private Scope scope = new Scope("openid", "email", "profile");
        private final Map<String, String> authorizationParameters = new LinkedHashMap<>(Map.of("access_type", "offline", "prompt", "consent"));
        private Duration connectTimeout = Duration.ofSeconds(2);
        private Duration readTimeout = Duration.ofSeconds(3);
        private Duration defaultLifetime = Duration.ofHours(1);
        private Clock clock = Clock.systemUTC();

        /**
         * Sets the openid connect provider and discovers its endpoints via
         * .well-known/openid-configuration
         * @param oidcProviderId URI of the oidc provider
         * @return OidcIdentityAuthority.Builder
         * @throws IdentityException
         */
        public Builder setProvider(URI oidcProviderId) throws IdentityException {
            Objects.requireNonNull(oidcProviderId, "Must provide an oidc provider URI to build an identity authority");
            OIDCProviderMetadata metadata = getOIDCProviderConfiguration(oidcProviderId, this.connectTimeout, this.readTimeout);
            if (metadata.getUserInfoEndpointURI() == null) {
                throw new IdentityException(AUTHORITY_UNREACHABLE, "OpenID Provider " + oidcProviderId + " does not expose a userinfo endpoint to validate tokens with");
            }
            this.oidcProviderId = oidcProviderId;
            this.authorizationEndpoint = metadata.getAuthorizationEndpointURI();
            this.tokenEndpoint = metadata.getTokenEndpointURI();
            this.userInfoEndpoint = metadata.getUserInfoEndpointURI();
            this.revocationEndpoint = metadata.getRevocationEndpointURI();
            return this;
        }

        public Builder setProviderId(URI oidcProviderId) {
            Objects.requireNonNull(oidcProviderId, "Must provide an oidc provider URI to build an identity authority");
            this.oidcProviderId = oidcProviderId;
            return this;
        }

        /**
         * Sets the provider endpoints manually
         * @param authorizationEndpoint Authorization endpoint
         * @param tokenEndpoint Token endpoint
         * @param userInfoEndpoint Userinfo endpoint used for validation
         * @param revocationEndpoint Revocation endpoint (may be null)
         * @return OidcIdentityAuthority.Builder
         */
        public Builder setEndpoints(URI authorizationEndpoint, URI tokenEndpoint, URI userInfoEndpoint, URI revocationEndpoint) {
            Objects.requireNonNull(authorizationEndpoint, "Must provide an authorization endpoint");
            Objects.requireNonNull(tokenEndpoint, "Must provide a token endpoint");
            Objects.requireNonNull(userInfoEndpoint, "Must provide a userinfo endpoint");
            this.authorizationEndpoint = authorizationEndpoint;
            this.tokenEndpoint = tokenEndpoint;
            this.userInfoEndpoint = userInfoEndpoint;
            this.revocationEndpoint = revocationEndpoint;
            return this;
        }

        public Builder setClientIdentifier(String clientIdentifier) {
            Objects.requireNonNull(clientIdentifier, "Must provide a client identifier to build an identity authority");
            this.clientId = new ClientID(clientIdentifier);
            return this;
        }

        public Builder setClientSecret(String clientSecret) {
            Objects.requireNonNull(clientSecret, "Must provide a client secret");
            this.clientSecret = new Secret(clientSecret);
            return this;
        }

        /**
         * Sets the authorization scopes to use in authorization and token requests
         * @param scopes List of scopes to include in requests
         * @return OidcIdentityAuthority.Builder
         */
        public Builder setScope(List<String> scopes) {
            Objects.requireNonNull(scopes, "Must provide scopes to set authorization request scope");
            this.scope = new Scope(scopes.toArray(new String[0]));
            return this;
        }

        /**
         * Adds a custom parameter to every authorization request. Defaults ask for offline
         * access and consent.
         * @param name Parameter name
         * @param value Parameter value
         * @return OidcIdentityAuthority.Builder
         */
        public Builder addAuthorizationParameter(String name, String value) {
            Objects.requireNonNull(name, "Must provide a parameter name");
            Objects.requireNonNull(value, "Must provide a parameter value");
            this.authorizationParameters.put(name, value);
            return this;
        }

        public Builder setTimeouts(Duration connectTimeout, Duration readTimeout) {
            Objects.requireNonNull(connectTimeout, "Must provide a connect timeout");
            Objects.requireNonNull(readTimeout, "Must provide a read timeout");
            this.connectTimeout = connectTimeout;
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder setDefaultLifetime(Duration defaultLifetime) {
            Objects.requireNonNull(defaultLifetime, "Must provide a default token lifetime");
            this.defaultLifetime = defaultLifetime;
            return this;
        }

        public Builder setClock(Clock clock) {
            Objects.requireNonNull(clock, "Must provide a clock");
            this.clock = clock;
            return this;
        }

        /**
         * Constructs an {@link OidcIdentityAuthority} once the provider and client are set
         * @return {@link OidcIdentityAuthority}
         */
        public OidcIdentityAuthority build() {
            Objects.requireNonNull(this.oidcProviderId, "Must provide an OIDC provider id to build an identity authority");
            Objects.requireNonNull(this.tokenEndpoint, "Cannot build an identity authority without OIDC token endpoint");
            Objects.requireNonNull(this.clientId, "Cannot build an identity authority without a client identifier");
            return new OidcIdentityAuthority(this);
        }

    }

}
