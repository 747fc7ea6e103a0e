package com.orbital.authentication;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One browser tab. Owns exactly one {@link ClientAuthCache}, the single-threaded event loop its
 * listeners are notified on, and the executor its network calls run on. Closing the context
 * makes every completion still in flight a no-op.
 */
@Slf4j
public class BrowserContext implements AutoCloseable {

    private static final AtomicInteger CONTEXTS = new AtomicInteger();

    @Getter private final ClientAuthCache authCache;
    private final ExternalReturnDetector returnDetector;
    private final ExecutorService ioExecutor;
    private final ExecutorService eventLoop;

    /**
     * Construct a new BrowserContext
     * @param authority {@link IdentityAuthority} sessions are validated with
     * @param sessionStore {@link LocalSessionStore} holding this context's session
     * @param profileSource {@link ProfileSource} for profile hydration
     * @param settings {@link CacheSettings}
     * @param clock Clock used for expiry checks
     */
    public BrowserContext(IdentityAuthority authority, LocalSessionStore sessionStore, ProfileSource profileSource,
                          CacheSettings settings, Clock clock) {
        Objects.requireNonNull(settings, "Must provide cache settings for the browser context");
        int id = CONTEXTS.incrementAndGet();
        this.ioExecutor = Executors.newCachedThreadPool(daemon("orbital-auth-io-" + id));
        this.eventLoop = Executors.newSingleThreadExecutor(daemon("orbital-auth-events-" + id));
        this.authCache = new ClientAuthCache(authority, sessionStore, profileSource, settings, clock, this.ioExecutor, this.eventLoop);
        this.returnDetector = new ExternalReturnDetector(settings.getReturnMarkers());
    }

    /**
     * Called whenever a page of this context is shown. A return from an external domain, such
     * as the identity provider or a payment provider, makes the auth cache resolve again.
     * @param location Location of the page shown
     * @param restoredFromCache Whether the page came from the back/forward cache
     * @return true if identity state is being resolved again
     */
    public boolean onPageShow(URI location, boolean restoredFromCache) {
        if (!this.returnDetector.isExternalReturn(location, restoredFromCache)) { return false; }
        log.debug("Page shown after external navigation, restored from cache: " + restoredFromCache);
        this.authCache.reconcile();
        return true;
    }

    @Override
    public void close() {
        this.authCache.close();
        this.eventLoop.shutdown();
        this.ioExecutor.shutdownNow();
    }

    private static ThreadFactory daemon(String name) {
        AtomicInteger count = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, name + "-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

}
