package com.orbital.authentication;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Basic in-memory implementation of {@link LocalSessionStore} for when the consumer doesn't
 * provide their own (for example one backed by browser storage)
 */
public class BasicLocalSessionStore implements LocalSessionStore {

    private final AtomicReference<Session> session;

    public BasicLocalSessionStore() { this.session = new AtomicReference<>(); }

    /**
     * Initializes the store with a session that is already held locally
     * @param session {@link Session} to start with
     */
    public BasicLocalSessionStore(Session session) { this.session = new AtomicReference<>(session); }

    @Override
    public Session get() { return this.session.get(); }

    @Override
    public void store(Session session) {
        Objects.requireNonNull(session, "Must provide a session to store");
        this.session.set(session);
    }

    @Override
    public boolean replace(Session expected, Session session) {
        Objects.requireNonNull(session, "Must provide a replacement session");
        return this.session.compareAndSet(expected, session);
    }

    @Override
    public void clear() { this.session.set(null); }

}
