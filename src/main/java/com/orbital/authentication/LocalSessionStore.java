package com.orbital.authentication;

/**
 * Holds the browser context's local copy of its {@link Session}. Only the
 * {@link ClientAuthCache} and the {@link ProfileRequestAuthenticator} write to it, and only
 * with sessions the identity authority issued.
 */
public interface LocalSessionStore {

    /**
     * Get the locally held {@link Session}
     * @return {@link Session} or null if there is none
     */
    Session get();

    /**
     * Replace the locally held session
     * @param session {@link Session} to store
     */
    void store(Session session);

    /**
     * Replace the locally held session only if it is still <code>expected</code>
     * @param expected Session the caller last saw
     * @param session Replacement
     * @return true if the session was replaced
     */
    boolean replace(Session expected, Session session);

    /**
     * Discard the locally held session
     */
    void clear();

}
