package com.orbital.authentication;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.orbital.authentication.AuthEventType.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

class AuthEventTypeTests {

    @Test
    @DisplayName("Map provider event names to event types")
    void mapNames() {
        assertEquals(SIGNED_IN, fromName("SIGNED_IN"));
        assertEquals(SIGNED_IN, fromName("INITIAL_SESSION"));
        assertEquals(SIGNED_IN, fromName("user_updated"));
        assertEquals(SIGNED_OUT, fromName(" SIGNED_OUT "));
        assertEquals(TOKEN_REFRESHED, fromName("TOKEN_REFRESHED"));
    }

    @Test
    @DisplayName("Map names nobody recognises to unknown")
    void mapUnknown() {
        assertEquals(UNKNOWN, fromName("PASSWORD_RECOVERY"));
        assertEquals(UNKNOWN, fromName(""));
        assertEquals(UNKNOWN, fromName(null));
        assertEquals(UNKNOWN, AuthEvent.of("MFA_CHALLENGE_VERIFIED", null).getType());
    }

}
