package org.relaybot.command.response;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Thread-safe {@link ResponseTracker} with optional time-based expiry.
 * <p>
 * Invocations are dropped once their last response is older than the TTL. A forgotten invocation leaves a
 * marker behind for {@link #FORGOTTEN_RETENTION} so replies still in flight at that moment are refused by
 * {@link #register} instead of being tracked forever.
 */
public class InMemoryResponseTracker implements ResponseTracker {

    private static final Logger log = LoggerFactory.getLogger(InMemoryResponseTracker.class);

    static final Duration FORGOTTEN_RETENTION = Duration.ofMinutes(5);

    // Shared by every tracker so tests creating many instances don't leak threads
    private static final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "ResponseTracker-Cleanup");
        t.setDaemon(true);
        return t;
    });

    private final Map<Long, Entry> responses = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    /**
     * Creates a tracker that never expires records.
     */
    public InMemoryResponseTracker() {
        this(Duration.ZERO, Clock.systemUTC(), false);
    }

    /**
     * Creates a tracker whose records expire after {@code ttl}. Cleanup runs at an interval equal to the TTL.
     *
     * @param ttl time to live, {@link Duration#ZERO} disables expiry
     */
    public InMemoryResponseTracker(Duration ttl) {
        this(ttl, Clock.systemUTC(), true);
    }

    InMemoryResponseTracker(Duration ttl, Clock clock, boolean scheduleCleanup) {
        this.ttl = ttl == null ? Duration.ZERO : ttl;
        this.clock = clock;
        if (scheduleCleanup) {
            long interval = expires() ? Math.min(this.ttl.toMillis(), FORGOTTEN_RETENTION.toMillis())
                    : FORGOTTEN_RETENTION.toMillis();
            scheduler.scheduleAtFixedRate(this::prune, interval, interval, TimeUnit.MILLISECONDS);
        }
    }

    @Override
    public boolean register(long invocationMessageId, long responseChannelId, long responseMessageId) {
        ResponseRecord record = new ResponseRecord(invocationMessageId, responseChannelId, responseMessageId);
        long now = clock.millis();
        boolean[] accepted = {false};
        responses.compute(invocationMessageId, (id, entry) -> {
            Entry target = entry == null ? new Entry() : entry;
            if (target.forgotten) {
                return target;
            }
            target.records.add(record);
            target.lastUpdated = now;
            accepted[0] = true;
            return target;
        });
        return accepted[0];
    }

    @Override
    public List<ResponseRecord> responsesFor(long invocationMessageId) {
        Entry entry = responses.get(invocationMessageId);
        return entry == null ? List.of() : List.copyOf(entry.records);
    }

    @Override
    public List<ResponseRecord> forget(long invocationMessageId) {
        long now = clock.millis();
        List<ResponseRecord> removed = new ArrayList<>();
        responses.compute(invocationMessageId, (id, entry) -> {
            if (entry != null) {
                removed.addAll(entry.records);
            }
            Entry marker = new Entry();
            marker.forgotten = true;
            marker.lastUpdated = now;
            return marker;
        });
        return removed;
    }

    /**
     * Removes every invocation whose latest response is older than the TTL, and the markers of forgotten
     * invocations once their retention is over.
     */
    public void prune() {
        long now = clock.millis();
        long liveCutoff = expires() ? now - ttl.toMillis() : Long.MIN_VALUE;
        long forgottenCutoff = now - FORGOTTEN_RETENTION.toMillis();
        int removed = 0;
        for (Long id : responses.keySet()) {
            boolean[] dropped = {false};
            // Checked and removed under the key's lock, so a concurrent register is never lost
            responses.computeIfPresent(id, (key, entry) -> {
                long cutoff = entry.forgotten ? forgottenCutoff : liveCutoff;
                dropped[0] = entry.lastUpdated < cutoff;
                return dropped[0] ? null : entry;
            });
            if (dropped[0]) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Purge des réponses suivies : {} invocation(s) expirée(s)", removed);
        }
    }

    /**
     * @return the number of invocations with tracked responses
     */
    public int size() {
        return (int) responses.values().stream().filter(entry -> !entry.forgotten).count();
    }

    private boolean expires() {
        return !ttl.isZero() && !ttl.isNegative();
    }

    private static class Entry {
        final Queue<ResponseRecord> records = new ConcurrentLinkedQueue<>();
        volatile long lastUpdated;
        volatile boolean forgotten;
    }
}
