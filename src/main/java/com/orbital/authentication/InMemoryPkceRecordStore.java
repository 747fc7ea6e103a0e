package com.orbital.authentication;

import com.nimbusds.oauth2.sdk.id.State;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory {@link PkceRecordStore} with a time to live and single-use consume. Expired records
 * are evicted at most once per minute, as records are stored. Suitable for a single server
 * instance; deployments behind a load balancer without sticky sessions need a shared store.
 */
@Slf4j
public class InMemoryPkceRecordStore implements PkceRecordStore {

    private static final long CLEANUP_INTERVAL_MS = 60_000;

    private final ConcurrentHashMap<String, PkceExchangeRecord> records;
    private final Duration ttl;
    private final Clock clock;
    private final AtomicLong lastCleanup;

    public InMemoryPkceRecordStore(Duration ttl, Clock clock) {
        Objects.requireNonNull(ttl, "Must provide a time to live for PKCE records");
        Objects.requireNonNull(clock, "Must provide a clock for PKCE records");
        this.records = new ConcurrentHashMap<>();
        this.ttl = ttl;
        this.clock = clock;
        this.lastCleanup = new AtomicLong(clock.millis());
    }

    @Override
    public void store(PkceExchangeRecord record) {
        Objects.requireNonNull(record, "Must provide a PKCE record to store");
        cleanupThrottled();
        this.records.put(record.getState().getValue(), record);
    }

    @Override
    public PkceExchangeRecord consume(State state) {
        if (state == null) { return null; }
        PkceExchangeRecord record = this.records.remove(state.getValue());
        if (record == null) { return null; }
        if (record.isExpired(this.clock.instant(), this.ttl)) {
            log.debug("PKCE record created at " + record.getCreatedAt() + " has expired");
            return null;
        }
        return record;
    }

    private void cleanupThrottled() {
        long now = this.clock.millis();
        long last = this.lastCleanup.get();
        if (now - last > CLEANUP_INTERVAL_MS && this.lastCleanup.compareAndSet(last, now)) {
            Instant current = this.clock.instant();
            this.records.values().removeIf(record -> record.isExpired(current, this.ttl));
        }
    }

    public int size() { return this.records.size(); }

}
