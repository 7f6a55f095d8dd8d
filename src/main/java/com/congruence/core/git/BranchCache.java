package com.congruence.core.git;

import com.congruence.core.model.BranchInfo;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Short-TTL branch listing cache keyed by project. Entries may be stale within
 * the TTL; a branch switch must call {@link #invalidate(long)}.
 */
public class BranchCache {

    private record Entry(List<BranchInfo> branches, Instant loadedAt) {}

    private final Map<Long, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public BranchCache(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    public List<BranchInfo> get(long projectId, Supplier<List<BranchInfo>> loader) {
        Instant now = clock.instant();
        Entry entry = entries.get(projectId);
        if (entry != null && now.isBefore(entry.loadedAt().plus(ttl))) {
            return entry.branches();
        }
        List<BranchInfo> fresh = List.copyOf(loader.get());
        entries.put(projectId, new Entry(fresh, now));
        return fresh;
    }

    public void invalidate(long projectId) {
        entries.remove(projectId);
    }
}
