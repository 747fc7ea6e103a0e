package com.orbital.authentication;

import java.util.Locale;

/**
 * Closed set of auth events the identity provider's client emits. Every event name maps to
 * exactly one of these; names nobody recognises map to {@link #UNKNOWN}, which the cache
 * answers by validating again.
 */
public enum AuthEventType {

    SIGNED_IN,
    SIGNED_OUT,
    TOKEN_REFRESHED,
    UNKNOWN;

    /**
     * Maps a provider event name to its type. <code>INITIAL_SESSION</code> and
     * <code>USER_UPDATED</code> carry a session just like a sign in does.
     * @param name Provider event name (may be null)
     * @return AuthEventType
     */
    public static AuthEventType fromName(String name) {
        if (name == null) { return UNKNOWN; }
        switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "SIGNED_IN":
            case "INITIAL_SESSION":
            case "USER_UPDATED":
                return SIGNED_IN;
            case "SIGNED_OUT":
                return SIGNED_OUT;
            case "TOKEN_REFRESHED":
                return TOKEN_REFRESHED;
            default:
                return UNKNOWN;
        }
    }

}
