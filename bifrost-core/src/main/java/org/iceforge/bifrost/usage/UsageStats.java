package org.iceforge.bifrost.usage;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/** In-memory request counters per connector or link id since process start. */
public final class UsageStats {

    public static final class Counters {
        final LongAdder succeeded = new LongAdder();
        final LongAdder rejected = new LongAdder();
        final LongAdder failed = new LongAdder();
        final LongAdder bytes = new LongAdder();
        final LongAdder latencyMillis = new LongAdder();
        volatile Instant lastAccess;

        Snapshot snapshot() {
            return new Snapshot(succeeded.sum(), rejected.sum(), failed.sum(), bytes.sum(), latencyMillis.sum(), lastAccess);
        }
    }

    public record Snapshot(long succeeded, long rejected, long failed, long bytes, long latencyMillisTotal,
                           Instant lastAccess) {
        public long total() {
            return succeeded + rejected + failed;
        }
    }

    private final ConcurrentHashMap<String, Counters> map = new ConcurrentHashMap<>();

    Counters counters(String id) {
        return map.computeIfAbsent(id, k -> new Counters());
    }

    public Snapshot get(String id) {
        Counters c = map.get(id);
        return c == null ? null : c.snapshot();
    }

    public List<Map.Entry<String, Snapshot>> topByRequests(int limit) {
        int lim = Math.max(1, Math.min(limit, 500));
        return map.entrySet().stream()
                .map(e -> Map.entry(e.getKey(), e.getValue().snapshot()))
                .sorted(Comparator.comparingLong((Map.Entry<String, Snapshot> e) -> e.getValue().total()).reversed())
                .limit(lim)
                .toList();
    }
}
