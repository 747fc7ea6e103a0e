package com.orbital.authentication;

import lombok.Getter;

import java.util.Objects;

/**
 * An auth event from the identity provider's client, with the session it carried if any
 */
@Getter
public class AuthEvent {

    private final AuthEventType type;
    private final String name;
    private final Session session;

    public AuthEvent(AuthEventType type, String name, Session session) {
        Objects.requireNonNull(type, "Must provide an auth event type");
        this.type = type;
        this.name = name;
        this.session = session;
    }

    public static AuthEvent of(String name, Session session) { return new AuthEvent(AuthEventType.fromName(name), name, session); }

    @Override
    public String toString() { return "AuthEvent[" + this.type + (this.name == null ? "" : ", " + this.name) + "]"; }

}
