package com.orbital.authentication;

import com.nimbusds.oauth2.sdk.id.State;

/**
 * Storage for {@link PkceExchangeRecord}s between the start of a sign-in and the provider's
 * callback. See {@link InMemoryPkceRecordStore} for the basic implementation.
 */
public interface PkceRecordStore {

    /**
     * Stores <code>record</code> under its state value
     * @param record {@link PkceExchangeRecord} to store
     */
    void store(PkceExchangeRecord record);

    /**
     * Atomically removes and returns the record stored under <code>state</code>. A second
     * consume of the same state, or a consume after the record expired, returns null.
     * @param state OAuth state value from the callback
     * @return {@link PkceExchangeRecord} or null
     */
    PkceExchangeRecord consume(State state);

}
