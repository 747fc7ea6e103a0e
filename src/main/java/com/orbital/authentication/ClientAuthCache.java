package com.orbital.authentication;

import com.nimbusds.oauth2.sdk.auth.Secret;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.*;

/**
 * The one record of who is signed in for a {@link BrowserContext}. Every UI surface reads it
 * through {@link #getState()} or a subscription; nothing writes it except the resolution
 * protocol below. Obtain it from {@link BrowserContext#getAuthCache()}, never construct one.
 * <p>
 * A resolution cycle moves <code>UNKNOWN → RESOLVING → AUTHENTICATED | UNAUTHENTICATED</code>.
 * The locally held session is always validated with the identity authority; a local claim is
 * never enough. The cycle is bounded by the resolution timeout, after which it settles as
 * unauthenticated. Profile hydration starts once a cycle settles as authenticated and only ever
 * writes the separate profile field.
 * <p>
 * At most one cycle is live at a time. Concurrent triggers share the live cycle's future.
 * A re-arm (sign in, sign out, provider event, return from an external domain) starts a new
 * cycle; completions belonging to an older cycle, or arriving after the context closed, are
 * dropped.
 */
@Slf4j
public class ClientAuthCache {

    private final IdentityAuthority authority;
    private final LocalSessionStore sessionStore;
    private final ProfileSource profileSource;
    private final CacheSettings settings;
    private final SessionVerifier verifier;
    private final Executor ioExecutor;
    private final Executor eventLoop;
    private final List<AuthStateListener> listeners;

    // Guarded by this
    private IdentityResolutionState state;
    private Profile profile;
    private long generation;
    private CompletableFuture<IdentityResolutionState> inFlight;
    private CompletableFuture<Profile> profileHydration;
    private boolean live;

    ClientAuthCache(IdentityAuthority authority, LocalSessionStore sessionStore, ProfileSource profileSource, CacheSettings settings,
                    Clock clock, Executor ioExecutor, Executor eventLoop) {
        Objects.requireNonNull(authority, "Must provide an identity authority for the auth cache");
        Objects.requireNonNull(sessionStore, "Must provide a local session store for the auth cache");
        Objects.requireNonNull(profileSource, "Must provide a profile source for the auth cache");
        Objects.requireNonNull(settings, "Must provide cache settings for the auth cache");
        Objects.requireNonNull(clock, "Must provide a clock for the auth cache");
        Objects.requireNonNull(ioExecutor, "Must provide an I/O executor for the auth cache");
        Objects.requireNonNull(eventLoop, "Must provide an event loop for the auth cache");
        this.authority = authority;
        this.sessionStore = sessionStore;
        this.profileSource = profileSource;
        this.settings = settings;
        this.verifier = new SessionVerifier(authority, clock, settings.getRefreshSkew());
        this.ioExecutor = ioExecutor;
        this.eventLoop = eventLoop;
        this.listeners = new CopyOnWriteArrayList<>();
        this.state = IdentityResolutionState.unknown();
        this.live = true;
    }

    public synchronized IdentityResolutionState getState() { return this.state; }

    public synchronized Profile getProfile() { return this.profile; }

    /**
     * Resolves who is signed in. Starts a cycle if none has run yet, joins the live cycle if one
     * is in flight, and otherwise answers with the settled state.
     * @return Future of the settled {@link IdentityResolutionState}
     */
    public synchronized CompletableFuture<IdentityResolutionState> resolve() {
        if (!this.live) { return CompletableFuture.completedFuture(this.state); }
        if (this.inFlight != null && !this.inFlight.isDone()) { return this.inFlight; }
        if (this.state.getPhase().isSettled()) { return CompletableFuture.completedFuture(this.state); }
        return startCycle();
    }

    /**
     * Discards the in-memory state and starts a new resolution cycle. Anyone waiting on a cycle
     * that was still in flight gets this cycle's answer instead.
     * @return Future of the settled {@link IdentityResolutionState}
     */
    public synchronized CompletableFuture<IdentityResolutionState> rearm() {
        if (!this.live) { return CompletableFuture.completedFuture(this.state); }
        CompletableFuture<IdentityResolutionState> previous = this.inFlight;
        discardProfile();
        transition(IdentityResolutionState.unknown());
        CompletableFuture<IdentityResolutionState> attempt = startCycle();
        if (previous != null && !previous.isDone()) {
            attempt.whenComplete((settled, ex) -> {
                if (ex == null) { previous.complete(settled); } else { previous.completeExceptionally(ex); }
            });
        }
        return attempt;
    }

    /**
     * Called when the browser context came back from an external domain without the provider's
     * event stream having run. In-memory state can't be trusted, so it is resolved again.
     * @return Future of the settled {@link IdentityResolutionState}
     */
    public CompletableFuture<IdentityResolutionState> reconcile() {
        log.debug("Reconciling identity state after external navigation");
        return rearm();
    }

    /**
     * Applies an auth event from the identity provider's client
     * @param event {@link AuthEvent}
     * @return Future of the resulting {@link IdentityResolutionState}
     */
    public CompletableFuture<IdentityResolutionState> onAuthEvent(AuthEvent event) {
        Objects.requireNonNull(event, "Must provide an auth event");
        switch (event.getType()) {
            case SIGNED_IN:
                if (event.getSession() != null) { this.sessionStore.store(event.getSession()); }
                return rearm();
            case TOKEN_REFRESHED:
                if (event.getSession() != null) { storeRefreshed(event.getSession()); }
                if (holdsIdentityOf(this.sessionStore.get())) { return resolve(); }
                return rearm();
            case SIGNED_OUT:
                return CompletableFuture.completedFuture(clearLocal());
            case UNKNOWN:
            default:
                log.warn("Unrecognised auth event " + event.getName() + ", validating again");
                return rearm();
        }
    }

    /**
     * Signs in with a username and password, then resolves the new session
     * @param username Username known to the identity authority
     * @param password Password of the user
     * @return Future of the settled {@link IdentityResolutionState}, failing with an
     * {@link IdentityException} if the authority refuses the sign in
     */
    public CompletableFuture<IdentityResolutionState> signIn(String username, Secret password) {
        Objects.requireNonNull(username, "Must provide a username to sign in");
        Objects.requireNonNull(password, "Must provide a password to sign in");
        return CompletableFuture.supplyAsync(() -> {
                    try {
                        return this.authority.signIn(username, password);
                    } catch (IdentityException ex) {
                        throw new CompletionException(ex);
                    }
                }, this.ioExecutor)
                .orTimeout(this.settings.getSignInTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .thenCompose(session -> {
                    this.sessionStore.store(session);
                    log.info("Signed in with username and password");
                    return rearm();
                });
    }

    /**
     * Signs out in two phases. The identity authority is asked to invalidate the session first;
     * local state is only cleared once it confirms, or once the sign out timeout passes. If the
     * authority refuses, local state is kept because the session is still live.
     * @return Future of the {@link SignOutResult}
     */
    public CompletableFuture<SignOutResult> signOut() {
        Session session = this.sessionStore.get();
        if (session == null) {
            clearLocal();
            return CompletableFuture.completedFuture(SignOutResult.INVALIDATED);
        }
        return CompletableFuture.runAsync(() -> {
                    try {
                        this.authority.invalidate(session);
                    } catch (IdentityException ex) {
                        throw new CompletionException(ex);
                    }
                }, this.ioExecutor)
                .orTimeout(this.settings.getSignOutTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((ignored, ex) -> classifySignOut(ex))
                .thenApply(result -> {
                    if (result.isSignedOut()) { clearLocal(); }
                    return result;
                });
    }

    /**
     * Fetches the profile of the signed in subject again
     * @return Future of the {@link Profile}, or of null when nobody is signed in
     */
    public synchronized CompletableFuture<Profile> refreshProfile() {
        if (!this.live || !this.state.isAuthenticated()) { return CompletableFuture.completedFuture(null); }
        return hydrate(this.generation, this.state.getSubjectId());
    }

    /**
     * Registers a listener. It is sent the current state straight away, then every change.
     * @param listener {@link AuthStateListener}
     * @return {@link Subscription} to stop notifications
     */
    public synchronized Subscription subscribe(AuthStateListener listener) {
        Objects.requireNonNull(listener, "Must provide a listener to subscribe");
        this.listeners.add(listener);
        if (this.live) {
            IdentityResolutionState current = this.state;
            this.eventLoop.execute(() -> listener.onStateChanged(current));
        }
        return () -> this.listeners.remove(listener);
    }

    synchronized void close() {
        this.live = false;
        this.listeners.clear();
        if (this.inFlight != null && !this.inFlight.isDone()) { this.inFlight.cancel(false); }
    }

    synchronized boolean isLive() { return this.live; }

    synchronized CompletableFuture<Profile> profileHydration() { return this.profileHydration; }

    private CompletableFuture<IdentityResolutionState> startCycle() {
        long cycle = ++this.generation;
        CompletableFuture<IdentityResolutionState> attempt = new CompletableFuture<>();
        this.inFlight = attempt;
        transition(IdentityResolutionState.resolving());
        Session session = this.sessionStore.get();
        if (session == null) {
            settle(attempt, IdentityResolutionState.unauthenticated());
            return attempt;
        }
        CompletableFuture.supplyAsync(() -> {
                    try {
                        return this.verifier.verify(session);
                    } catch (IdentityException ex) {
                        throw new CompletionException(ex);
                    }
                }, this.ioExecutor)
                .orTimeout(this.settings.getResolutionTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((verified, ex) -> onResolved(cycle, session, verified, ex));
        return attempt;
    }

    private void onResolved(long cycle, Session presented, VerifiedSession verified, Throwable ex) {
        IdentityResolutionState settled;
        synchronized (this) {
            if (!this.live || cycle != this.generation || this.state.getPhase() != ResolutionPhase.RESOLVING) {
                log.debug("Dropping stale resolution from cycle " + cycle);
                return;
            }
            if (ex == null) {
                if (verified.isRefreshed()) { this.sessionStore.replace(presented, verified.getSession()); }
                settled = IdentityResolutionState.authenticated(verified.getIdentity().getSubjectId());
            } else {
                Throwable cause = unwrap(ex);
                if (cause instanceof TimeoutException) {
                    log.warn("Identity resolution timed out after " + this.settings.getResolutionTimeout().toMillis() + "ms");
                } else if (cause instanceof IdentityException && ((IdentityException) cause).getFailure().isUnauthenticated()) {
                    log.debug("Local session is no longer valid: " + cause.getMessage());
                    if (presented.equals(this.sessionStore.get())) { this.sessionStore.clear(); }
                } else {
                    log.warn("Identity resolution failed: " + cause.getMessage());
                }
                settled = IdentityResolutionState.unauthenticated();
            }
            settle(this.inFlight, settled);
            if (settled.isAuthenticated()) { hydrate(cycle, settled.getSubjectId()); }
        }
    }

    private CompletableFuture<Profile> hydrate(long cycle, String subjectId) {
        CompletableFuture<Profile> hydration = CompletableFuture.supplyAsync(() -> {
                    try {
                        return this.profileSource.fetch(subjectId);
                    } catch (java.io.IOException ex) {
                        throw new CompletionException(ex);
                    }
                }, this.ioExecutor)
                .orTimeout(this.settings.getProfileTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((fetched, ex) -> applyProfile(cycle, subjectId, fetched, ex));
        this.profileHydration = hydration;
        return hydration;
    }

    private synchronized void applyProfile(long cycle, String subjectId, Profile fetched, Throwable ex) {
        if (!this.live || cycle != this.generation || !subjectId.equals(this.state.getSubjectId())) { return; }
        if (ex != null) {
            log.warn("Profile hydration failed for " + subjectId + ": " + unwrap(ex).getMessage());
            return;
        }
        this.profile = fetched;
        notifyProfile(fetched);
    }

    private SignOutResult classifySignOut(Throwable ex) {
        if (ex == null) { return SignOutResult.INVALIDATED; }
        Throwable cause = unwrap(ex);
        if (cause instanceof TimeoutException) {
            log.warn("Identity authority did not confirm sign out in time, session may stay live until it expires");
            return SignOutResult.INVALIDATION_TIMED_OUT;
        }
        if (cause instanceof IdentityException) {
            AuthFailure failure = ((IdentityException) cause).getFailure();
            if (failure == AuthFailure.INVALIDATION_TIMEOUT) {
                log.warn("Sign out timed out at the identity authority, session may stay live until it expires");
                return SignOutResult.INVALIDATION_TIMED_OUT;
            }
            if (failure.isUnauthenticated()) { return SignOutResult.INVALIDATED; }
        }
        log.error("Identity authority refused to invalidate the session: " + cause.getMessage());
        return SignOutResult.REJECTED;
    }

    private synchronized IdentityResolutionState clearLocal() {
        if (!this.live) { return this.state; }
        this.generation++;
        this.sessionStore.clear();
        discardProfile();
        CompletableFuture<IdentityResolutionState> pending = this.inFlight;
        transition(IdentityResolutionState.unauthenticated());
        if (pending != null && !pending.isDone()) { pending.complete(this.state); }
        log.info("Signed out");
        return this.state;
    }

    // A refreshed session only skips validation when it belongs to the subject already authenticated
    private synchronized boolean holdsIdentityOf(Session session) {
        return session != null && this.state.isAuthenticated() && this.state.getSubjectId().equals(session.getSubjectId());
    }

    private synchronized void storeRefreshed(Session session) {
        Session current = this.sessionStore.get();
        if (current != null && current.getSubjectId() != null && session.getSubjectId() == null) {
            this.sessionStore.store(session.withSubject(current.getSubjectId()));
        } else {
            this.sessionStore.store(session);
        }
    }

    private void settle(CompletableFuture<IdentityResolutionState> attempt, IdentityResolutionState settled) {
        transition(settled);
        attempt.complete(settled);
    }

    private void discardProfile() {
        if (this.profile == null) { return; }
        this.profile = null;
        notifyProfile(null);
    }

    private void transition(IdentityResolutionState next) {
        this.state = next;
        log.debug("Identity resolution state is now " + next);
        for (AuthStateListener listener : this.listeners) { this.eventLoop.execute(() -> listener.onStateChanged(next)); }
    }

    private void notifyProfile(Profile next) {
        for (AuthStateListener listener : this.listeners) { this.eventLoop.execute(() -> listener.onProfileChanged(next)); }
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable cause = ex;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) { cause = cause.getCause(); }
        return cause;
    }

}
