package com.orbital.authentication;

import com.nimbusds.oauth2.sdk.AuthorizationCode;
import com.nimbusds.oauth2.sdk.auth.Secret;
import com.nimbusds.oauth2.sdk.id.State;
import com.nimbusds.oauth2.sdk.pkce.CodeVerifier;

import java.net.URI;

/**
 * The external system of record that issues and validates sessions. Keeps the session
 * validator, the exchange handler, and the client cache from having to care about the
 * specifics of how the authority is reached. See {@link OidcIdentityAuthority} for the
 * OpenID Connect implementation.
 * <p>
 * Every operation either returns a definitive answer or throws an {@link IdentityException}
 * whose {@link AuthFailure} says why. Implementations must bound every network call.
 */
public interface IdentityAuthority {

    /**
     * Asks the authority who the holder of <code>accessToken</code> is. Never answered from
     * local claims.
     * @param accessToken {@link AccessToken} to validate
     * @return {@link Identity} of the token's subject
     * @throws IdentityException {@link AuthFailure#VALIDATION_FAILED} when rejected,
     * {@link AuthFailure#AUTHORITY_UNREACHABLE} when the authority could not answer
     */
    Identity validate(AccessToken accessToken) throws IdentityException;

    /**
     * Exchanges a refresh token for a new {@link Session}
     * @param refreshToken {@link RefreshToken} to exchange
     * @return Refreshed {@link Session}
     * @throws IdentityException
     */
    Session refresh(RefreshToken refreshToken) throws IdentityException;

    /**
     * Builds the URL of the authority's authorization endpoint for a PKCE authorization code flow
     * @param state OAuth state value correlating the callback with this request
     * @param codeVerifier PKCE verifier whose S256 challenge is sent
     * @param redirect Callback URI the authority returns the browser to
     * @return Authorization request URL
     */
    URI authorizationUrl(State state, CodeVerifier codeVerifier, URI redirect);

    /**
     * Exchanges an authorization code and its PKCE verifier for a {@link Session}, in one call
     * @param code Authorization code from the callback
     * @param codeVerifier PKCE verifier created when the flow began
     * @param redirect Callback URI used in the authorization request
     * @return {@link Session} as issued by the exchange (not yet re-validated)
     * @throws IdentityException {@link AuthFailure#EXCHANGE_FAILED} when the authority refuses the exchange
     */
    Session exchange(AuthorizationCode code, CodeVerifier codeVerifier, URI redirect) throws IdentityException;

    /**
     * Obtains a {@link Session} for a username and password
     * @param username Username known to the authority
     * @param password Password of the user
     * @return {@link Session}
     * @throws IdentityException
     */
    Session signIn(String username, Secret password) throws IdentityException;

    /**
     * Asks the authority to invalidate the session so that neither of its tokens is honored again
     * @param session {@link Session} to invalidate
     * @throws IdentityException
     */
    void invalidate(Session session) throws IdentityException;

}
