package com.orbital.authentication;

/**
 * States of a single provider round trip through the {@link OAuthExchangeHandler}. Each
 * round trip only moves forward; {@link #EXCHANGED} and {@link #FAILED} are terminal.
 */
public enum ExchangeState {

    IDLE,
    AUTHORIZATION_REQUESTED,
    CODE_RECEIVED,
    EXCHANGING,
    EXCHANGED,
    FAILED;

    public boolean isTerminal() { return this == EXCHANGED || this == FAILED; }

}
