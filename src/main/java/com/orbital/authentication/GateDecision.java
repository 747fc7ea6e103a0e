package com.orbital.authentication;

/**
 * Decision carried by a {@link GateResponse}
 */
public enum GateDecision {

    ALLOW,
    REDIRECT_TO_LOGIN,
    REDIRECT_TO_HOME,
    /** Redirect to a location chosen by the OAuth exchange (its redirect target or the login page) */
    REDIRECT;

    public boolean isRedirect() { return this != ALLOW; }

}
