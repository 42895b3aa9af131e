package com.geoledger.service.store;

import com.geoledger.core.model.GeocodeRecord;
import com.geoledger.stages.api.RecordLockedException;
import com.geoledger.stages.api.RecordQuery;
import com.geoledger.stages.api.RecordStore;
import com.geoledger.stages.api.StorageException;
import com.geoledger.stages.api.StoreStatistics;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;

/**
 * Record store held in memory. Each ticket key owns a lock and its version chain; changes to one
 * key never wait on another. Subclasses persist changes in {@link #beforeCommit(JournalEntry)},
 * which runs under the key lock before the change becomes visible. If it throws, nothing changes.
 * Writers share a store-wide read lock that {@link #clear()} takes exclusively, so a clear never
 * interleaves with a write.
 */
public class InMemoryRecordStore implements RecordStore {
    private static final Comparator<GeocodeRecord> BY_RECORD_ID = Comparator.comparing(GeocodeRecord::recordId);

    private final Map<String, Chain> chains = new ConcurrentHashMap<>();
    private final Set<Long> recordIds = ConcurrentHashMap.newKeySet();
    private final AtomicLong lastRecordId = new AtomicLong();
    private final ReentrantReadWriteLock clearLock = new ReentrantReadWriteLock();
    private final Clock clock;

    public InMemoryRecordStore() {
        this(Clock.systemUTC());
    }

    public InMemoryRecordStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    @Override
    public Optional<GeocodeRecord> getCurrent(String ticketKey) {
        Chain chain = chains.get(ticketKey);
        return chain == null ? Optional.empty() : Optional.ofNullable(chain.current);
    }

    @Override
    public List<GeocodeRecord> getHistory(String ticketKey) {
        Chain chain = chains.get(ticketKey);
        if (chain == null) {
            return List.of();
        }
        chain.lock.lock();
        try {
            List<GeocodeRecord> newestFirst = new ArrayList<>(chain.versions);
            Collections.reverse(newestFirst);
            return newestFirst;
        } finally {
            chain.lock.unlock();
        }
    }

    @Override
    public List<GeocodeRecord> findCurrentByRecordKey(String recordKey) {
        if (recordKey == null) {
            return List.of();
        }
        return currentRecords().stream()
                .filter(record -> recordKey.equals(record.recordKey()))
                .sorted(BY_RECORD_ID)
                .toList();
    }

    @Override
    public long append(GeocodeRecord record, String stageId) {
        Objects.requireNonNull(record, "record is required");
        Objects.requireNonNull(stageId, "stageId is required");
        clearLock.readLock().lock();
        Chain chain = chains.computeIfAbsent(record.ticketKey(), ignored -> new Chain());
        chain.lock.lock();
        try {
            GeocodeRecord previous = chain.current;
            if (previous != null && previous.locked()) {
                throw new RecordLockedException(record.ticketKey(), previous.lockReason());
            }
            long recordId = lastRecordId.incrementAndGet();
            GeocodeRecord stored = record.toBuilder()
                    .recordId(recordId)
                    .version(previous == null ? 1 : previous.version() + 1)
                    .supersedesRecordId(previous == null ? null : previous.recordId())
                    .createdByStage(stageId)
                    .createdAt(clock.instant())
                    .current(true)
                    .unlocked()
                    .build();
            beforeCommit(JournalEntry.put(stored));
            publish(chain, stored);
            return recordId;
        } finally {
            chain.lock.unlock();
            clearLock.readLock().unlock();
        }
    }

    @Override
    public boolean lock(String ticketKey, String reason, String actor) {
        return applyLock(ticketKey, reason, actor, clock.instant(), true);
    }

    @Override
    public boolean unlock(String ticketKey) {
        return applyUnlock(ticketKey, clock.instant(), true);
    }

    @Override
    public List<GeocodeRecord> query(RecordQuery query) {
        List<GeocodeRecord> matches = currentRecords().stream()
                .filter(query::matches)
                .sorted(BY_RECORD_ID)
                .toList();
        if (query.limit() != null && matches.size() > query.limit()) {
            return matches.subList(0, query.limit());
        }
        return matches;
    }

    @Override
    public StoreStatistics statistics() {
        long totalVersions = 0;
        for (Chain chain : chains.values()) {
            chain.lock.lock();
            try {
                totalVersions += chain.versions.size();
            } finally {
                chain.lock.unlock();
            }
        }
        return StoreStatistics.of(currentRecords(), totalVersions);
    }

    @Override
    public List<GeocodeRecord> allVersions() {
        List<GeocodeRecord> all = new ArrayList<>();
        for (Chain chain : chains.values()) {
            chain.lock.lock();
            try {
                all.addAll(chain.versions);
            } finally {
                chain.lock.unlock();
            }
        }
        all.sort(BY_RECORD_ID);
        return all;
    }

    @Override
    public void restore(GeocodeRecord record) {
        applyRestore(record, true);
    }

    @Override
    public void clear() {
        clearLock.writeLock().lock();
        try {
            beforeCommit(JournalEntry.clear(clock.instant()));
            chains.clear();
            recordIds.clear();
            lastRecordId.set(0);
        } finally {
            clearLock.writeLock().unlock();
        }
    }

    /**
     * Hook for persistent subclasses. Called with the ticket's lock held, or for CLEAR with every writer excluded.
     *
     * @throws StorageException when the change cannot be made durable
     */
    protected void beforeCommit(JournalEntry entry) {
    }

    protected final void applyRestore(GeocodeRecord record, boolean journal) {
        Objects.requireNonNull(record, "record is required");
        if (record.recordId() == null) {
            throw new StorageException("Restored record for " + record.ticketKey() + " has no record id");
        }
        clearLock.readLock().lock();
        Chain chain = chains.computeIfAbsent(record.ticketKey(), ignored -> new Chain());
        chain.lock.lock();
        try {
            GeocodeRecord previous = chain.current;
            int expectedVersion = chain.versions.size() + 1;
            if (record.version() != expectedVersion) {
                throw new StorageException("Version chain break for " + record.ticketKey()
                        + ": expected v" + expectedVersion + " but got v" + record.version());
            }
            Long expectedSupersedes = previous == null ? null : previous.recordId();
            if (!Objects.equals(expectedSupersedes, record.supersedesRecordId())) {
                throw new StorageException("Version v" + record.version() + " of " + record.ticketKey()
                        + " supersedes " + record.supersedesRecordId() + " but previous record is " + expectedSupersedes);
            }
            if (recordIds.contains(record.recordId())) {
                throw new StorageException("Duplicate record id " + record.recordId());
            }
            GeocodeRecord stored = record.toBuilder().current(true).build();
            if (journal) {
                beforeCommit(JournalEntry.put(stored));
            }
            publish(chain, stored);
            lastRecordId.accumulateAndGet(record.recordId(), Math::max);
        } finally {
            chain.lock.unlock();
            clearLock.readLock().unlock();
        }
    }

    protected final boolean applyLock(String ticketKey, String reason, String actor, Instant at, boolean journal) {
        return replaceCurrent(
                ticketKey,
                current -> current.toBuilder().lock(reason, at, actor).build(),
                JournalEntry.lock(ticketKey, reason, actor, at),
                journal
        );
    }

    protected final boolean applyUnlock(String ticketKey, Instant at, boolean journal) {
        return replaceCurrent(
                ticketKey,
                current -> current.toBuilder().unlocked().build(),
                JournalEntry.unlock(ticketKey, at),
                journal
        );
    }

    private boolean replaceCurrent(
            String ticketKey,
            UnaryOperator<GeocodeRecord> change,
            JournalEntry entry,
            boolean journal
    ) {
        clearLock.readLock().lock();
        try {
            Chain chain = chains.get(ticketKey);
            if (chain == null) {
                return false;
            }
            chain.lock.lock();
            try {
                GeocodeRecord current = chain.current;
                if (current == null) {
                    return false;
                }
                GeocodeRecord changed = change.apply(current);
                if (journal) {
                    beforeCommit(entry);
                }
                chain.versions.set(chain.versions.size() - 1, changed);
                chain.current = changed;
                return true;
            } finally {
                chain.lock.unlock();
            }
        } finally {
            clearLock.readLock().unlock();
        }
    }

    private void publish(Chain chain, GeocodeRecord stored) {
        GeocodeRecord previous = chain.current;
        if (previous != null) {
            chain.versions.set(chain.versions.size() - 1, previous.toBuilder().current(false).build());
        }
        chain.versions.add(stored);
        recordIds.add(stored.recordId());
        chain.current = stored;
    }

    private List<GeocodeRecord> currentRecords() {
        List<GeocodeRecord> current = new ArrayList<>();
        for (Chain chain : chains.values()) {
            GeocodeRecord record = chain.current;
            if (record != null) {
                current.add(record);
            }
        }
        return current;
    }

    private static final class Chain {
        private final ReentrantLock lock = new ReentrantLock();
        private final List<GeocodeRecord> versions = new ArrayList<>();
        private volatile GeocodeRecord current;
    }
}
