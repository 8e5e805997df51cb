package com.di.adbatch.checkpoint;

import com.di.adbatch.model.TaskKey;
import com.di.adbatch.model.TaskStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Durable state of one run (or one worker shard of a run), persisted as
 * {@code checkpoint_<sessionId>.json}.
 *
 * <p>Task keys are {@link TaskKey#asString()} values so the JSON stays a flat object.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CheckpointRecord {

    public static final int FORMAT_VERSION = 1;

    @Builder.Default
    private int     formatVersion = FORMAT_VERSION;

    private String  sessionId;
    private String  inputFile;
    private Instant startedAt;
    private Instant lastUpdatedAt;

    @Builder.Default
    private Map<String, VariantTaskSnapshot> tasks = new LinkedHashMap<>();

    public static CheckpointRecord fresh(String sessionId, String inputFile, Instant now) {
        return CheckpointRecord.builder()
                .sessionId(sessionId)
                .inputFile(inputFile)
                .startedAt(now)
                .lastUpdatedAt(now)
                .build();
    }

    public Optional<VariantTaskSnapshot> find(TaskKey key) {
        return Optional.ofNullable(tasks.get(key.asString()));
    }

    @JsonIgnore
    public Map<TaskStatus, Integer> statusCounts() {
        Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
        for (VariantTaskSnapshot s : tasks.values()) {
            counts.merge(s.getStatus(), 1, Integer::sum);
        }
        return counts;
    }

    /** Copy whose task map and snapshots can be mutated without touching this record. */
    CheckpointRecord copy() {
        Map<String, VariantTaskSnapshot> copiedTasks = new LinkedHashMap<>();
        tasks.forEach((k, v) -> copiedTasks.put(k, v.copy()));
        return new CheckpointRecord(formatVersion, sessionId, inputFile, startedAt, lastUpdatedAt, copiedTasks);
    }
}
