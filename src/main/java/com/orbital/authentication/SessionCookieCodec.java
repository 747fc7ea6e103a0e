package com.orbital.authentication;

import com.nimbusds.oauth2.sdk.ParseException;
import com.nimbusds.oauth2.sdk.util.JSONObjectUtils;
import net.minidev.json.JSONObject;

import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.Base64;
import java.util.Objects;

import static com.orbital.authentication.AuthFailure.TOKEN_ABSENT;
import static com.orbital.authentication.AuthFailure.TOKEN_MALFORMED;

/**
 * Encodes a {@link Session} into the value of the session cookie and back. The value is
 * base64url encoded JSON with the members <code>access_token</code>, <code>refresh_token</code>,
 * <code>expires_at</code> (epoch seconds) and <code>subject_id</code>.
 * <p>
 * Decoding is purely structural. A decoded session says nothing about who the caller is until
 * the identity authority has validated it.
 */
public class SessionCookieCodec {

    static final String ACCESS_TOKEN = "access_token";
    static final String REFRESH_TOKEN = "refresh_token";
    static final String EXPIRES_AT = "expires_at";
    static final String SUBJECT_ID = "subject_id";

    public String encode(Session session) {
        Objects.requireNonNull(session, "Must provide a session to encode");
        JSONObject json = new JSONObject();
        json.put(ACCESS_TOKEN, session.getAccessToken().getValue());
        if (session.getRefreshToken() != null) { json.put(REFRESH_TOKEN, session.getRefreshToken().getValue()); }
        json.put(EXPIRES_AT, session.getExpiresAt().getEpochSecond());
        if (session.getSubjectId() != null) { json.put(SUBJECT_ID, session.getSubjectId()); }
        return Base64.getUrlEncoder().withoutPadding().encodeToString(json.toJSONString().getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Decodes the value of a session cookie
     * @param value Cookie value (may be null)
     * @return Decoded {@link Session}
     * @throws IdentityException {@link AuthFailure#TOKEN_ABSENT} when there is no value,
     * {@link AuthFailure#TOKEN_MALFORMED} when the value isn't a well formed session
     */
    public Session decode(String value) throws IdentityException {
        if (value == null || value.isBlank()) { throw new IdentityException(TOKEN_ABSENT, "No session cookie was presented"); }
        try {
            String decoded = new String(Base64.getUrlDecoder().decode(value.trim()), StandardCharsets.UTF_8);
            JSONObject json = JSONObjectUtils.parse(decoded);
            AccessToken accessToken = new AccessToken(JSONObjectUtils.getString(json, ACCESS_TOKEN));
            String refreshValue = JSONObjectUtils.getString(json, REFRESH_TOKEN, null);
            RefreshToken refreshToken = refreshValue == null || refreshValue.isBlank() ? null : new RefreshToken(refreshValue);
            Instant expiresAt = Instant.ofEpochSecond(JSONObjectUtils.getLong(json, EXPIRES_AT));
            return new Session(accessToken, refreshToken, expiresAt, JSONObjectUtils.getString(json, SUBJECT_ID, null));
        } catch (ParseException | IllegalArgumentException | DateTimeException ex) {
            throw new IdentityException(TOKEN_MALFORMED, "Session cookie is malformed: " + ex.getMessage(), ex);
        }
    }

}
