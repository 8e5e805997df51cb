package com.di.adbatch.checkpoint;

import com.di.adbatch.model.TaskKey;
import com.di.adbatch.model.TaskStatus;
import com.di.adbatch.model.VariantTask;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Durable per-session record of variant task status; the single source of truth for
 * "has this already been done". Implementations are file-backed
 * ({@link FileCheckpointStore}) or in-memory ({@link InMemoryCheckpointStore}).
 *
 * <p>A parallel run writes one shard per worker, named {@code <sessionId>-w<N>};
 * {@link #loadMerged(String)} reads the session and all of its shards together.
 */
public interface CheckpointStore {

    /** Suffix that marks a worker shard of a session: {@code <sessionId>-w<N>}. */
    String SHARD_MARKER = "-w";

    /** Session ids become file names: letters, digits, {@code . _ -}, at most 128 chars. */
    Pattern SESSION_ID = Pattern.compile("[A-Za-z0-9._-]{1,128}");

    static String shardSessionId(String sessionId, int workerId) {
        return sessionId + SHARD_MARKER + workerId;
    }

    static boolean isValidSessionId(String sessionId) {
        return sessionId != null && SESSION_ID.matcher(sessionId).matches();
    }

    // --- Whole records ---
    Optional<CheckpointRecord> load(String sessionId);
    void save(CheckpointRecord record);
    /** The session's own record merged with every worker shard; per task the most recently updated snapshot wins. */
    Optional<CheckpointRecord> loadMerged(String sessionId);
    /** Removes the session record and all of its worker shards. */
    void delete(String sessionId);
    /** All sessions (shards excluded), newest first. */
    List<CheckpointSummary> list();

    /**
     * Creates or extends the record for {@code sessionId} so every key has a snapshot.
     * Missing keys are taken from {@code seed} when present there, otherwise start PENDING.
     */
    CheckpointRecord initialize(String sessionId, String inputFile, Collection<TaskKey> keys, CheckpointRecord seed);

    // --- Task mutators: load-modify-save under a process-local lock ---
    void markStarted(String sessionId, VariantTask task);
    void markSucceeded(String sessionId, VariantTask task);
    void markFailed(String sessionId, VariantTask task);

    Optional<VariantTaskSnapshot> find(String sessionId, TaskKey key);

    default boolean shouldSkip(String sessionId, TaskKey key, boolean retryFailed) {
        return find(sessionId, key).map(s -> shouldSkip(s, retryFailed)).orElse(false);
    }

    /**
     * SUCCEEDED is always skipped; FAILED is skipped unless the operator asked to retry failures.
     * PENDING and IN_PROGRESS (an interrupted attempt) are run again.
     */
    static boolean shouldSkip(VariantTaskSnapshot snapshot, boolean retryFailed) {
        TaskStatus status = snapshot.getStatus();
        return switch (status) {
            case SUCCEEDED -> true;
            case FAILED -> !retryFailed;
            case PENDING, IN_PROGRESS, SKIPPED -> false;
        };
    }
}
