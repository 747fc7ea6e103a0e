package com.orbital.authentication;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.orbital.authentication.AuthFailure.VALIDATION_FAILED;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class BrowserContextTests {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final AccessToken ALICE_ACCESS = new AccessToken("alice-access");
    private static final Session ALICE_SESSION = new Session(ALICE_ACCESS, new RefreshToken("alice-refresh"), NOW.plusSeconds(3600), "alice-subject");
    private static final IdentityResolutionState AUTHENTICATED = IdentityResolutionState.authenticated("alice-subject");

    private IdentityAuthority authority;
    private BrowserContext context;

    @BeforeEach
    void beforeEach() throws IOException {
        authority = mock(IdentityAuthority.class);
        ProfileSource profileSource = mock(ProfileSource.class);
        when(profileSource.fetch("alice-subject")).thenReturn(new Profile("alice-subject", Map.of("plan", "creator")));
        context = new BrowserContext(authority, new BasicLocalSessionStore(ALICE_SESSION), profileSource,
                                     CacheSettings.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void afterEach() { context.close(); }

    @Test
    @DisplayName("Resolve identity through the context's auth cache")
    void resolveThroughContext() throws Exception {
        when(authority.validate(ALICE_ACCESS)).thenReturn(new Identity("alice-subject", null));
        assertEquals(AUTHENTICATED, context.getAuthCache().resolve().get(2, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Notify listeners on the context's event loop")
    void notifyOnEventLoop() throws Exception {
        when(authority.validate(ALICE_ACCESS)).thenReturn(new Identity("alice-subject", null));
        CountDownLatch authenticated = new CountDownLatch(1);
        String[] threadName = new String[1];
        context.getAuthCache().subscribe(state -> {
            if (state.isAuthenticated()) {
                threadName[0] = Thread.currentThread().getName();
                authenticated.countDown();
            }
        });
        context.getAuthCache().resolve();
        assertTrue(authenticated.await(2, TimeUnit.SECONDS));
        assertTrue(threadName[0].startsWith("orbital-auth-events-"));
    }

    @Test
    @DisplayName("Resolve again when a page is shown after an external return")
    void reconcileOnExternalReturn() throws Exception {
        when(authority.validate(ALICE_ACCESS)).thenReturn(new Identity("alice-subject", null))
                                             .thenThrow(new IdentityException(VALIDATION_FAILED, "Token revoked"));
        assertEquals(AUTHENTICATED, context.getAuthCache().resolve().get(2, TimeUnit.SECONDS));

        assertFalse(context.onPageShow(URI.create("https://orbital.example/dashboard"), false));
        assertEquals(AUTHENTICATED, context.getAuthCache().getState());

        assertTrue(context.onPageShow(URI.create("https://orbital.example/purchases?success=true"), false));
        assertEquals(IdentityResolutionState.unauthenticated(), context.getAuthCache().resolve().get(2, TimeUnit.SECONDS));
        verify(authority, times(2)).validate(ALICE_ACCESS);
    }

    @Test
    @DisplayName("Stop the auth cache when the context closes")
    void closeContext() {
        context.close();
        assertFalse(context.getAuthCache().isLive());
        assertEquals(IdentityResolutionState.unknown(), context.getAuthCache().resolve().getNow(null));
    }

}
