package com.orbital.authentication;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;

import static com.orbital.authentication.AuthFailure.TOKEN_ABSENT;
import static com.orbital.authentication.AuthFailure.TOKEN_MALFORMED;
import static org.junit.jupiter.api.Assertions.*;

class SessionCookieCodecTests {

    private static final Instant EXPIRES = Instant.parse("2026-01-01T01:00:00Z");
    private final SessionCookieCodec codec = new SessionCookieCodec();

    @Test
    @DisplayName("Decode an encoded session")
    void decodeEncoded() throws IdentityException {
        Session session = new Session(new AccessToken("alice-access"), new RefreshToken("alice-refresh"), EXPIRES, "alice-subject");
        String value = codec.encode(session);
        assertFalse(value.contains("="));
        assertEquals(session, codec.decode(value));
    }

    @Test
    @DisplayName("Decode a session without a refresh token or subject")
    void decodeMinimal() throws IdentityException {
        Session decoded = codec.decode(encode("{\"access_token\":\"alice-access\",\"expires_at\":1767229200}"));
        assertEquals(new AccessToken("alice-access"), decoded.getAccessToken());
        assertNull(decoded.getRefreshToken());
        assertNull(decoded.getSubjectId());
        assertEquals(EXPIRES, decoded.getExpiresAt());
    }

    @Test
    @DisplayName("Report a missing session cookie as absent")
    void decodeAbsent() {
        assertEquals(TOKEN_ABSENT, assertThrows(IdentityException.class, () -> codec.decode(null)).getFailure());
        assertEquals(TOKEN_ABSENT, assertThrows(IdentityException.class, () -> codec.decode("  ")).getFailure());
    }

    @Test
    @DisplayName("Report a session cookie that isn't a session as malformed")
    void decodeMalformed() {
        assertMalformed("%%%");
        assertMalformed(encode("not json"));
        assertMalformed(encode("{\"expires_at\":1767229200}"));
        assertMalformed(encode("{\"access_token\":\"\",\"expires_at\":1767229200}"));
        assertMalformed(encode("{\"access_token\":\"alice-access\"}"));
        assertMalformed(encode("{\"access_token\":\"alice-access\",\"expires_at\":\"tomorrow\"}"));
    }

    @Test
    @DisplayName("Report a session cookie expiring outside the representable range as malformed")
    void decodeExpiryOutOfRange() {
        assertMalformed(encode("{\"access_token\":\"alice-access\",\"expires_at\":9223372036854775807}"));
        assertMalformed(encode("{\"access_token\":\"alice-access\",\"expires_at\":-9223372036854775808}"));
    }

    @Test
    @DisplayName("Render session cookies as Set-Cookie values")
    void renderCookies() {
        GateConfiguration configuration = new GateConfiguration.Builder().build();
        assertEquals("orbital-session=abc; Path=/; Max-Age=2592000; HttpOnly; Secure; SameSite=Lax", configuration.sessionCookie("abc").toHeaderValue());
        SessionCookie clearing = configuration.clearingCookie();
        assertTrue(clearing.isClearing());
        assertEquals("orbital-session=; Path=/; Max-Age=0; HttpOnly; Secure; SameSite=Lax", clearing.toHeaderValue());
        assertFalse(new SessionCookie("s", "", Duration.ofDays(1), "/", true, false, null).isClearing());
    }

    private void assertMalformed(String value) {
        IdentityException ex = assertThrows(IdentityException.class, () -> codec.decode(value));
        assertEquals(TOKEN_MALFORMED, ex.getFailure());
    }

    private static String encode(String json) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }

}
