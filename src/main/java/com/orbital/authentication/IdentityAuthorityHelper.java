package com.orbital.authentication;

import com.nimbusds.oauth2.sdk.ErrorObject;
import com.nimbusds.oauth2.sdk.ParseException;
import com.nimbusds.oauth2.sdk.http.HTTPRequest;
import com.nimbusds.oauth2.sdk.http.HTTPResponse;
import com.nimbusds.oauth2.sdk.id.Issuer;
import com.nimbusds.oauth2.sdk.token.Tokens;
import com.nimbusds.openid.connect.sdk.op.OIDCProviderConfigurationRequest;
import com.nimbusds.openid.connect.sdk.op.OIDCProviderMetadata;
import com.nimbusds.openid.connect.sdk.token.OIDCTokens;
import okhttp3.Request;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;

import static com.orbital.authentication.AuthFailure.AUTHORITY_UNREACHABLE;

/**
 * Assorted helper methods related to working with OAuth2 / OpenID Connect tokens and
 * authorization servers. Makes liberal use of the
 * <a href="https://connect2id.com/products/nimbus-oauth-openid-connect-sdk">Nimbus SDK</a>.
 */
public class IdentityAuthorityHelper {

    static final String AUTHORIZATION = "Authorization";
    private static final Set<String> AUTHORIZATION_HEADER_SCHEMES = Set.of("Bearer");

    private IdentityAuthorityHelper() { }

    /**
     * Get the configuration of an OpenID Provider based on the discovery and contents
     * of its .well-known/openid-configuration resource.
     * @param providerUri URI of the OpenID Provider
     * @param connectTimeout Connect timeout for the discovery request
     * @param readTimeout Read timeout for the discovery request
     * @return OIDCProviderMetadata
     * @throws IdentityException
     */
    public static OIDCProviderMetadata getOIDCProviderConfiguration(URI providerUri, Duration connectTimeout, Duration readTimeout) throws IdentityException {
        Objects.requireNonNull(providerUri, "Must provide an openid provider URI to discover provider metadata");
        Issuer issuer = new Issuer(providerUri.toString());
        OIDCProviderConfigurationRequest request = new OIDCProviderConfigurationRequest(issuer);
        HTTPRequest httpRequest = bounded(request.toHTTPRequest(), connectTimeout, readTimeout);
        OIDCProviderMetadata metadata;
        try {
            httpRequest.setAccept("*/*");
            HTTPResponse httpResponse = httpRequest.send();
            if (!httpResponse.indicatesSuccess()) { throw new IOException("Request failed to " + providerUri + " with status " + httpResponse.getStatusCode()); }
            metadata = OIDCProviderMetadata.parse(httpResponse.getContentAsJSONObject());
        } catch (IOException | ParseException ex) {
            throw new IdentityException(AUTHORITY_UNREACHABLE, "Unable to lookup OpenID Provider configuration for " + providerUri, ex);
        }
        if (!issuer.equals(metadata.getIssuer())) {
            throw new IdentityException(AUTHORITY_UNREACHABLE, "Issuer mismatch: Supplied issuer " + issuer.getValue() + " is a different value than that received from OP: " + metadata.getIssuer().getValue());
        }
        return metadata;
    }

    /**
     * Applies connect and read timeouts to a nimbus HTTP request so that no call to the
     * authority can block without bound
     * @param httpRequest Nimbus HTTPRequest
     * @param connectTimeout Connect timeout
     * @param readTimeout Read timeout
     * @return The same HTTPRequest
     */
    public static HTTPRequest bounded(HTTPRequest httpRequest, Duration connectTimeout, Duration readTimeout) {
        Objects.requireNonNull(httpRequest, "Must provide an HTTP request to bound");
        httpRequest.setConnectTimeout(Math.toIntExact(connectTimeout.toMillis()));
        httpRequest.setReadTimeout(Math.toIntExact(readTimeout.toMillis()));
        return httpRequest;
    }

    /**
     * Translates nimbus native tokens into a {@link Session}. The subject is taken from the
     * ID token when one was issued; it is only a hint until the session is validated.
     * @param tokens Nimbus Tokens from a token response
     * @param issuedAt Instant the token response was received
     * @param defaultLifetime Lifetime to assume when the authority doesn't state one
     * @return {@link Session}
     */
    public static Session translateTokens(Tokens tokens, Instant issuedAt, Duration defaultLifetime) {
        Objects.requireNonNull(tokens, "Must provide tokens to translate");
        AccessToken accessToken = translateAccessToken(tokens.getAccessToken());
        RefreshToken refreshToken = tokens.getRefreshToken() == null ? null : translateRefreshToken(tokens.getRefreshToken());
        long lifetime = tokens.getAccessToken().getLifetime();
        Instant expiresAt = lifetime > 0 ? issuedAt.plusSeconds(lifetime) : issuedAt.plus(defaultLifetime);
        return new Session(accessToken, refreshToken, expiresAt, getIdTokenSubject(tokens));
    }

    /**
     * Gets the subject of the ID token contained in <code>tokens</code>, if there is one
     * @param tokens Nimbus Tokens
     * @return subject or null
     */
    public static String getIdTokenSubject(Tokens tokens) {
        if (!(tokens instanceof OIDCTokens)) { return null; }
        OIDCTokens oidcTokens = (OIDCTokens) tokens;
        if (oidcTokens.getIDToken() == null) { return null; }
        try {
            return oidcTokens.getIDToken().getJWTClaimsSet().getSubject();
        } catch (java.text.ParseException ex) {
            return null;
        }
    }

    /**
     * Produces a short description of an OAuth error object suitable for logging and
     * (after sanitizing) for display
     * @param error Nimbus ErrorObject
     * @return Description of the error
     */
    public static String describe(ErrorObject error) {
        if (error == null) { return "unknown error"; }
        if (error.getDescription() == null) { return String.valueOf(error.getCode()); }
        return error.getCode() + ": " + error.getDescription();
    }

    /**
     * Extracts the value of an access token from the Authorization header of an HTTP request. Returns
     * null if no Authorization header exists or the token type isn't recognized.
     * @param request OkHttp Request
     * @return {@link AccessToken} or null
     */
    public static AccessToken getAccessTokenFromRequest(Request request) {
        Objects.requireNonNull(request, "Must provide an HTTP request to get token from");
        String value = request.header(AUTHORIZATION);
        if (value == null) { return null; }
        String[] split = value.trim().split("\\s+");
        if (split.length != 2 || !AUTHORIZATION_HEADER_SCHEMES.contains(split[0])) { return null; }
        return new AccessToken(split[1]);
    }

    /**
     * Translates a nimbus native AccessToken into the generic format
     * @param nimbusAccessToken Nimbus AccessToken
     * @return {@link AccessToken}
     */
    public static AccessToken translateAccessToken(com.nimbusds.oauth2.sdk.token.AccessToken nimbusAccessToken) {
        Objects.requireNonNull(nimbusAccessToken, "Must provide an access token to translate");
        return new AccessToken(nimbusAccessToken.getValue());
    }

    /**
     * Translates a nimbus native RefreshToken into the generic format
     * @param nimbusRefreshToken Nimbus RefreshToken
     * @return {@link RefreshToken}
     */
    public static RefreshToken translateRefreshToken(com.nimbusds.oauth2.sdk.token.RefreshToken nimbusRefreshToken) {
        Objects.requireNonNull(nimbusRefreshToken, "Must provide a refresh token to translate");
        return new RefreshToken(nimbusRefreshToken.getValue());
    }

}
