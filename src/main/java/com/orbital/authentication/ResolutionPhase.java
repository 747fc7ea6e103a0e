package com.orbital.authentication;

/**
 * Phases of client-side identity resolution. Within one resolution cycle the phase only moves
 * forward: {@link #UNKNOWN}, {@link #RESOLVING}, then {@link #AUTHENTICATED} or
 * {@link #UNAUTHENTICATED}.
 */
public enum ResolutionPhase {

    UNKNOWN,
    RESOLVING,
    AUTHENTICATED,
    UNAUTHENTICATED;

    public boolean isSettled() { return this == AUTHENTICATED || this == UNAUTHENTICATED; }

}
