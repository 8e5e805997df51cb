package com.di.adbatch.checkpoint;

import com.di.adbatch.model.FailureReason;
import com.di.adbatch.model.TaskStatus;
import com.di.adbatch.model.VariantTask;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable projection of one {@link VariantTask} inside a {@link CheckpointRecord}.
 *
 * <pre>Status flow: PENDING → IN_PROGRESS → SUCCEEDED | FAILED</pre>
 *
 * {@link TaskStatus#SKIPPED} is never stored: a skipped task keeps the snapshot
 * it was skipped on.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VariantTaskSnapshot {

    @Builder.Default
    private TaskStatus    status = TaskStatus.PENDING;

    // ---- outcome -----------------------------------------------------------
    private String        remoteEntityId;
    private int           artifactsCount;
    private String        error;
    private FailureReason failureReason;

    @Builder.Default
    private List<String>  strippedCreativeIds = new ArrayList<>();

    // ---- lifecycle ---------------------------------------------------------
    private int           attemptCount;
    private Instant       createdAt;
    private Instant       updatedAt;
    private Instant       completedAt;

    public static VariantTaskSnapshot pending(Instant now) {
        return VariantTaskSnapshot.builder()
                .status(TaskStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Copies the task's current state over this snapshot. {@code createdAt} is kept.
     */
    void applyFrom(VariantTask task, Instant now) {
        if (task.getStatus() == TaskStatus.SKIPPED) {
            throw new IllegalArgumentException("SKIPPED is run-local and never checkpointed: " + task.getKey());
        }
        this.status              = task.getStatus();
        this.remoteEntityId      = task.getRemoteEntityId();
        this.artifactsCount      = task.getArtifactsCount();
        this.error               = task.getError();
        this.failureReason       = task.getFailureReason();
        this.strippedCreativeIds = new ArrayList<>(task.getStrippedCreativeIds());
        this.attemptCount        = task.getAttemptCount();
        this.updatedAt           = now;
        if (createdAt == null) {
            this.createdAt = task.getCreatedAt();
        }
        this.completedAt = task.getStatus().isTerminal() ? now : null;
    }

    VariantTaskSnapshot copy() {
        return toBuilder().strippedCreativeIds(new ArrayList<>(strippedCreativeIds)).build();
    }
}
