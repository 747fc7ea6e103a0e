package com.orbital.authentication;

import com.nimbusds.oauth2.sdk.id.State;
import com.nimbusds.oauth2.sdk.pkce.CodeVerifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryPkceRecordStoreTests {

    private MutableClock clock;
    private InMemoryPkceRecordStore store;

    @BeforeEach
    void beforeEach() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        store = new InMemoryPkceRecordStore(Duration.ofMinutes(10), clock);
    }

    @Test
    @DisplayName("Consume a stored record exactly once")
    void consumeOnce() {
        PkceExchangeRecord record = record();
        store.store(record);
        assertSame(record, store.consume(record.getState()));
        assertNull(store.consume(record.getState()));
        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("Refuse a record past its time to live")
    void refuseExpired() {
        PkceExchangeRecord record = record();
        store.store(record);
        clock.advance(Duration.ofMinutes(10));
        assertNull(store.consume(record.getState()));
        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("Return nothing for an unknown or missing state")
    void consumeUnknown() {
        store.store(record());
        assertNull(store.consume(new State()));
        assertNull(store.consume(null));
        assertEquals(1, store.size());
    }

    @Test
    @DisplayName("Evict expired records as new ones are stored")
    void evictExpired() {
        store.store(record());
        store.store(record());
        clock.advance(Duration.ofMinutes(11));
        PkceExchangeRecord fresh = record();
        store.store(fresh);
        assertEquals(1, store.size());
        assertSame(fresh, store.consume(fresh.getState()));
    }

    @Test
    @DisplayName("Keep records within their time to live when evicting")
    void keepLiveRecords() {
        PkceExchangeRecord first = record();
        store.store(first);
        clock.advance(Duration.ofMinutes(2));
        store.store(record());
        assertEquals(2, store.size());
        assertSame(first, store.consume(first.getState()));
    }

    private PkceExchangeRecord record() {
        return new PkceExchangeRecord(new State(), new CodeVerifier(), clock.instant(), "/dashboard");
    }

}
