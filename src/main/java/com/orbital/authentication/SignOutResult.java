package com.orbital.authentication;

/**
 * How a sign out ended
 */
public enum SignOutResult {

    /** The identity authority confirmed the session is invalid. Local state is cleared. */
    INVALIDATED,
    /**
     * The authority didn't answer in time. Local state is cleared anyway, but the session may
     * stay live at the authority until it expires.
     */
    INVALIDATION_TIMED_OUT,
    /** The authority refused or failed. Local state is kept, since the session is still live. */
    REJECTED;

    public boolean isSignedOut() { return this != REJECTED; }

}
