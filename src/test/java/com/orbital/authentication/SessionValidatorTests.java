package com.orbital.authentication;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.orbital.authentication.AuthFailure.AUTHORITY_UNREACHABLE;
import static com.orbital.authentication.AuthFailure.VALIDATION_FAILED;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SessionValidatorTests {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private static final AccessToken ALICE_ACCESS = new AccessToken("alice-access");
    private static final Identity ALICE = new Identity("alice-subject", "alice@example.com");

    private final SessionCookieCodec codec = new SessionCookieCodec();
    private ExecutorService executor;
    private IdentityAuthority authority;
    private GateConfiguration configuration;
    private SessionValidator validator;

    @BeforeEach
    void beforeEach() {
        executor = Executors.newCachedThreadPool();
        authority = mock(IdentityAuthority.class);
        configuration = new GateConfiguration.Builder().setValidationTimeout(Duration.ofMillis(300)).build();
        validator = new SessionValidator(configuration, authority, executor, clock);
    }

    @AfterEach
    void afterEach() { executor.shutdownNow(); }

    @Test
    @DisplayName("Redirect a protected path without a session to login with the path preserved")
    void redirectProtectedWithoutSession() throws IdentityException {
        GateResponse response = validator.validate(new GateRequest("/dashboard", null));
        assertEquals(GateDecision.REDIRECT_TO_LOGIN, response.getDecision());
        assertEquals("/login?redirect=%2Fdashboard", response.getLocation());
        assertTrue(response.getCookies().isEmpty());
        verify(authority, never()).validate(any());
    }

    @Test
    @DisplayName("Preserve nested paths when redirecting to login")
    void redirectNestedProtectedPath() {
        GateResponse response = validator.validate(new GateRequest("/videos/42", null));
        assertEquals("/login?redirect=%2Fvideos%2F42", response.getLocation());
    }

    @Test
    @DisplayName("Allow a protected path with a valid session")
    void allowProtectedWithValidSession() throws IdentityException {
        when(authority.validate(ALICE_ACCESS)).thenReturn(ALICE);
        GateResponse response = validator.validate(new GateRequest("/dashboard", codec.encode(session(NOW.plusSeconds(3600)))));
        assertEquals(GateDecision.ALLOW, response.getDecision());
        assertEquals(ALICE, response.getIdentity());
        assertTrue(response.getCookies().isEmpty());
        verify(authority, never()).refresh(any());
    }

    @Test
    @DisplayName("Allow a public path without a session and without asking the authority")
    void allowPublicWithoutSession() throws IdentityException {
        GateResponse response = validator.validate(new GateRequest("/pricing", null));
        assertEquals(GateDecision.ALLOW, response.getDecision());
        assertNull(response.getIdentity());
        verify(authority, never()).validate(any());
    }

    @Test
    @DisplayName("Send an authenticated caller away from an auth entry path")
    void redirectAuthEntryToHome() throws IdentityException {
        when(authority.validate(ALICE_ACCESS)).thenReturn(ALICE);
        GateResponse response = validator.validate(new GateRequest("/login", codec.encode(session(NOW.plusSeconds(3600)))));
        assertEquals(GateDecision.REDIRECT_TO_HOME, response.getDecision());
        assertEquals("/dashboard", response.getLocation());
    }

    @Test
    @DisplayName("Allow an auth entry path without a session")
    void allowAuthEntryWithoutSession() {
        GateResponse response = validator.validate(new GateRequest("/signup", null));
        assertEquals(GateDecision.ALLOW, response.getDecision());
    }

    @Test
    @DisplayName("Treat a rejected session as absent and clear its cookie")
    void clearRejectedSession() throws IdentityException {
        when(authority.validate(ALICE_ACCESS)).thenThrow(new IdentityException(VALIDATION_FAILED, "Token revoked"));
        GateResponse response = validator.validate(new GateRequest("/settings", codec.encode(session(NOW.plusSeconds(3600)))));
        assertEquals(GateDecision.REDIRECT_TO_LOGIN, response.getDecision());
        SessionCookie cookie = response.getCookie(GateConfiguration.DEFAULT_COOKIE_NAME);
        assertNotNull(cookie);
        assertTrue(cookie.isClearing());
        verify(authority, never()).refresh(any());
    }

    @Test
    @DisplayName("Treat a malformed session cookie as absent and clear it")
    void clearMalformedSession() throws IdentityException {
        GateResponse response = validator.validate(new GateRequest("/purchases", "not!a*session"));
        assertEquals(GateDecision.REDIRECT_TO_LOGIN, response.getDecision());
        assertTrue(response.getCookie(GateConfiguration.DEFAULT_COOKIE_NAME).isClearing());
        verify(authority, never()).validate(any());
    }

    @Test
    @DisplayName("Redirect a cookie expiring outside the representable range to login and clear it")
    void clearOutOfRangeSession() throws IdentityException {
        String value = Base64.getUrlEncoder().withoutPadding()
                             .encodeToString("{\"access_token\":\"a\",\"expires_at\":9223372036854775807}".getBytes(StandardCharsets.UTF_8));
        GateResponse response = validator.validate(new GateRequest("/dashboard", value));
        assertEquals(GateDecision.REDIRECT_TO_LOGIN, response.getDecision());
        assertTrue(response.getCookie(GateConfiguration.DEFAULT_COOKIE_NAME).isClearing());
        verify(authority, never()).validate(any());
    }

    @Test
    @DisplayName("Allow a public path and keep the session when the authority is unreachable")
    void allowPublicWhenUnreachable() throws IdentityException {
        when(authority.validate(ALICE_ACCESS)).thenThrow(new IdentityException(AUTHORITY_UNREACHABLE, "Connection refused"));
        GateResponse response = validator.validate(new GateRequest("/pricing", codec.encode(session(NOW.plusSeconds(3600)))));
        assertEquals(GateDecision.ALLOW, response.getDecision());
        assertNull(response.getIdentity());
        assertTrue(response.getCookies().isEmpty());
    }

    @Test
    @DisplayName("Refresh a session close to expiry and attach it to the same response")
    void refreshNearExpiry() throws IdentityException {
        Session refreshed = new Session(new AccessToken("alice-access-2"), new RefreshToken("alice-refresh-2"), NOW.plusSeconds(3600), null);
        when(authority.refresh(new RefreshToken("alice-refresh"))).thenReturn(refreshed);
        when(authority.validate(new AccessToken("alice-access-2"))).thenReturn(ALICE);

        GateResponse response = validator.validate(new GateRequest("/dashboard", codec.encode(session(NOW.plusSeconds(30)))));
        assertEquals(GateDecision.ALLOW, response.getDecision());
        SessionCookie cookie = response.getCookie(GateConfiguration.DEFAULT_COOKIE_NAME);
        assertNotNull(cookie);
        assertFalse(cookie.isClearing());
        Session attached = codec.decode(cookie.getValue());
        assertEquals(new AccessToken("alice-access-2"), attached.getAccessToken());
        assertEquals("alice-subject", attached.getSubjectId());
        verify(authority, never()).validate(ALICE_ACCESS);

        // The refreshed session is accepted on the next request without another refresh
        GateResponse next = validator.validate(new GateRequest("/dashboard", cookie.getValue()));
        assertEquals(GateDecision.ALLOW, next.getDecision());
        assertTrue(next.getCookies().isEmpty());
        verify(authority, times(1)).refresh(any());
    }

    @Test
    @DisplayName("Treat an expired session that can't be refreshed as absent")
    void expiredWithoutRefreshToken() throws IdentityException {
        Session expired = new Session(ALICE_ACCESS, null, NOW.minusSeconds(10), "alice-subject");
        GateResponse response = validator.validate(new GateRequest("/dashboard", codec.encode(expired)));
        assertEquals(GateDecision.REDIRECT_TO_LOGIN, response.getDecision());
        assertTrue(response.getCookie(GateConfiguration.DEFAULT_COOKIE_NAME).isClearing());
        verify(authority, never()).validate(any());
    }

    @Test
    @DisplayName("Fail closed on a protected path when the authority is unreachable")
    void failClosedWhenUnreachable() throws IdentityException {
        when(authority.validate(ALICE_ACCESS)).thenThrow(new IdentityException(AUTHORITY_UNREACHABLE, "Connection refused"));
        GateResponse response = validator.validate(new GateRequest("/dashboard", codec.encode(session(NOW.plusSeconds(3600)))));
        assertEquals(GateDecision.REDIRECT_TO_LOGIN, response.getDecision());
        // An unreachable authority says nothing about the session, so it is kept
        assertTrue(response.getCookies().isEmpty());
    }

    @Test
    @DisplayName("Fail open on a protected path when configured to and the authority is unreachable")
    void failOpenWhenUnreachable() throws IdentityException {
        GateConfiguration failOpen = new GateConfiguration.Builder().setUnreachablePolicy(UnreachablePolicy.FAIL_OPEN).build();
        SessionValidator openValidator = new SessionValidator(failOpen, authority, executor, clock);
        when(authority.validate(ALICE_ACCESS)).thenThrow(new IdentityException(AUTHORITY_UNREACHABLE, "Connection refused"));
        GateResponse response = openValidator.validate(new GateRequest("/dashboard", codec.encode(session(NOW.plusSeconds(3600)))));
        assertEquals(GateDecision.ALLOW, response.getDecision());
        assertNull(response.getIdentity());
    }

    @Test
    @DisplayName("Bound validation by the configured timeout and treat it as unreachable")
    void timeoutWhenAuthorityHangs() throws IdentityException, InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        when(authority.validate(ALICE_ACCESS)).thenAnswer(invocation -> {
            release.await(10, TimeUnit.SECONDS);
            return ALICE;
        });
        long start = System.nanoTime();
        GateResponse response = validator.validate(new GateRequest("/dashboard", codec.encode(session(NOW.plusSeconds(3600)))));
        long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        release.countDown();
        assertEquals(GateDecision.REDIRECT_TO_LOGIN, response.getDecision());
        assertTrue(elapsed < 5000);
        assertTrue(response.getCookies().isEmpty());
    }

    @Test
    @DisplayName("Fail to construct a validator without an authority")
    void failConstructWithoutAuthority() {
        assertThrows(NullPointerException.class, () -> new SessionValidator(configuration, null, executor, clock));
    }

    private static Session session(Instant expiresAt) {
        return new Session(ALICE_ACCESS, new RefreshToken("alice-refresh"), expiresAt, "alice-subject");
    }

}
