package com.di.adbatch.checkpoint;

import com.di.adbatch.model.TaskKey;
import com.di.adbatch.model.TaskStatus;
import com.di.adbatch.model.VariantTask;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * Shared record handling for checkpoint stores: read-through cache, task mutators,
 * shard merging. Subclasses only know how to read, write, enumerate and remove
 * whole records.
 */
@Slf4j
public abstract class AbstractCheckpointStore implements CheckpointStore {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, CheckpointRecord> cache = new HashMap<>();

    // ---- storage primitives ------------------------------------------------

    /** Reads a record; empty when none exists or it could not be parsed. */
    protected abstract Optional<CheckpointRecord> read(String sessionId);

    /** Replaces the stored record as one atomic step. */
    protected abstract void write(CheckpointRecord record);

    protected abstract void remove(String sessionId);

    /** Every stored session id, shards included. */
    protected abstract List<String> sessionIds();

    // ---- whole records -----------------------------------------------------

    @Override
    public Optional<CheckpointRecord> load(String sessionId) {
        requireValidSessionId(sessionId);
        lock.lock();
        try {
            return loadLocked(sessionId).map(CheckpointRecord::copy);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void save(CheckpointRecord record) {
        requireValidSessionId(record.getSessionId());
        lock.lock();
        try {
            saveLocked(record.copy());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<CheckpointRecord> loadMerged(String sessionId) {
        requireValidSessionId(sessionId);
        lock.lock();
        try {
            List<CheckpointRecord> parts = new ArrayList<>();
            loadLocked(sessionId).ifPresent(parts::add);
            for (String shardId : shardIdsOf(sessionId)) {
                loadLocked(shardId).ifPresent(parts::add);
            }
            if (parts.isEmpty()) {
                return Optional.empty();
            }
            CheckpointRecord merged = CheckpointRecord.fresh(sessionId, null, null);
            for (CheckpointRecord part : parts) {
                mergeInto(merged, part);
            }
            return Optional.of(merged);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void delete(String sessionId) {
        requireValidSessionId(sessionId);
        lock.lock();
        try {
            List<String> ids = new ArrayList<>(shardIdsOf(sessionId));
            ids.add(sessionId);
            for (String id : ids) {
                remove(id);
                cache.remove(id);
            }
            log.info("[CHECKPOINT] session={} deleted ({} file(s) considered)", sessionId, ids.size());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<CheckpointSummary> list() {
        lock.lock();
        try {
            List<CheckpointSummary> out = new ArrayList<>();
            for (String id : sessionIds()) {
                if (isShardId(id)) {
                    continue;
                }
                loadMerged(id).ifPresent(merged -> {
                    loadLocked(id).ifPresent(own -> {
                        merged.setInputFile(own.getInputFile());
                        merged.setStartedAt(own.getStartedAt());
                    });
                    out.add(CheckpointSummary.of(merged));
                });
            }
            out.sort(Comparator.comparing(CheckpointSummary::getLastUpdatedAt,
                    Comparator.nullsLast(Comparator.reverseOrder())));
            return out;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CheckpointRecord initialize(String sessionId, String inputFile, Collection<TaskKey> keys,
                                       CheckpointRecord seed) {
        requireValidSessionId(sessionId);
        lock.lock();
        try {
            Instant now = Instant.now();
            CheckpointRecord record = loadLocked(sessionId)
                    .orElseGet(() -> CheckpointRecord.fresh(sessionId, inputFile, now));
            int seeded = 0;
            int added  = 0;
            for (TaskKey key : keys) {
                String k = key.asString();
                VariantTaskSnapshot own      = record.getTasks().get(k);
                VariantTaskSnapshot fromSeed = seed == null ? null : seed.getTasks().get(k);
                if (own != null) {
                    // another shard may have finished this task more recently
                    if (fromSeed != null && newer(own, fromSeed) == fromSeed) {
                        record.getTasks().put(k, fromSeed.copy());
                        seeded++;
                    }
                    continue;
                }
                if (fromSeed != null) {
                    record.getTasks().put(k, fromSeed.copy());
                    seeded++;
                } else {
                    record.getTasks().put(k, VariantTaskSnapshot.pending(now));
                    added++;
                }
            }
            if (record.getInputFile() == null) {
                record.setInputFile(inputFile);
            }
            saveLocked(record);
            log.info("[CHECKPOINT] session={} initialized: {} tasks ({} new, {} carried over)",
                     sessionId, record.getTasks().size(), added, seeded);
            return record.copy();
        } finally {
            lock.unlock();
        }
    }

    // ---- task mutators -----------------------------------------------------

    @Override
    public void markStarted(String sessionId, VariantTask task) {
        update(sessionId, task, TaskStatus.IN_PROGRESS);
    }

    @Override
    public void markSucceeded(String sessionId, VariantTask task) {
        update(sessionId, task, TaskStatus.SUCCEEDED);
    }

    @Override
    public void markFailed(String sessionId, VariantTask task) {
        update(sessionId, task, TaskStatus.FAILED);
    }

    @Override
    public Optional<VariantTaskSnapshot> find(String sessionId, TaskKey key) {
        requireValidSessionId(sessionId);
        lock.lock();
        try {
            return loadLocked(sessionId).flatMap(r -> r.find(key)).map(VariantTaskSnapshot::copy);
        } finally {
            lock.unlock();
        }
    }

    private void update(String sessionId, VariantTask task, TaskStatus expected) {
        if (task.getStatus() != expected) {
            throw new IllegalStateException("Task " + task.getKey() + " is " + task.getStatus()
                    + ", cannot record it as " + expected);
        }
        requireValidSessionId(sessionId);
        lock.lock();
        try {
            Instant now = Instant.now();
            CheckpointRecord record = loadLocked(sessionId)
                    .orElseGet(() -> CheckpointRecord.fresh(sessionId, null, now));
            VariantTaskSnapshot snapshot = record.getTasks()
                    .computeIfAbsent(task.getKey().asString(), k -> VariantTaskSnapshot.pending(now));
            snapshot.applyFrom(task, now);
            saveLocked(record);
            log.debug("[CHECKPOINT] session={} {} → {}", sessionId, task.getKey(), expected);
        } finally {
            lock.unlock();
        }
    }

    // ---- internals ---------------------------------------------------------

    private Optional<CheckpointRecord> loadLocked(String sessionId) {
        CheckpointRecord cached = cache.get(sessionId);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<CheckpointRecord> read = read(sessionId);
        read.ifPresent(r -> {
            if (r.getTasks() == null) {
                r.setTasks(new LinkedHashMap<>());
            }
            cache.put(sessionId, r);
        });
        return read;
    }

    private void saveLocked(CheckpointRecord record) {
        record.setLastUpdatedAt(Instant.now());
        if (record.getStartedAt() == null) {
            record.setStartedAt(record.getLastUpdatedAt());
        }
        write(record);
        cache.put(record.getSessionId(), record);
    }

    private List<String> shardIdsOf(String sessionId) {
        Pattern shard = Pattern.compile(Pattern.quote(sessionId + SHARD_MARKER) + "\\d+");
        List<String> out = new ArrayList<>();
        for (String id : sessionIds()) {
            if (shard.matcher(id).matches()) {
                out.add(id);
            }
        }
        out.sort(Comparator.naturalOrder());
        return out;
    }

    private static boolean isShardId(String id) {
        return id.matches(".+" + Pattern.quote(SHARD_MARKER) + "\\d+");
    }

    private static void mergeInto(CheckpointRecord target, CheckpointRecord part) {
        if (target.getStartedAt() == null
                || (part.getStartedAt() != null && part.getStartedAt().isBefore(target.getStartedAt()))) {
            target.setStartedAt(part.getStartedAt());
        }
        if (target.getLastUpdatedAt() == null
                || (part.getLastUpdatedAt() != null && part.getLastUpdatedAt().isAfter(target.getLastUpdatedAt()))) {
            target.setLastUpdatedAt(part.getLastUpdatedAt());
        }
        if (target.getInputFile() == null) {
            target.setInputFile(part.getInputFile());
        }
        part.getTasks().forEach((key, snapshot) ->
                target.getTasks().merge(key, snapshot.copy(), AbstractCheckpointStore::newer));
    }

    private static VariantTaskSnapshot newer(VariantTaskSnapshot a, VariantTaskSnapshot b) {
        if (a.getUpdatedAt() == null) return b;
        if (b.getUpdatedAt() == null) return a;
        return b.getUpdatedAt().isAfter(a.getUpdatedAt()) ? b : a;
    }

    protected static void requireValidSessionId(String sessionId) {
        if (!CheckpointStore.isValidSessionId(sessionId)) {
            throw new IllegalArgumentException("Invalid session id '" + sessionId
                    + "': use letters, digits, '.', '_' or '-' (max 128)");
        }
    }
}
