package com.di.adbatch.model;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One schedulable unit of work: a campaign set × device variant.
 *
 * <p>Only the orchestrator mutates tasks. Every status change goes through
 * {@link TaskStatus#canTransitionTo(TaskStatus)}; an illegal transition is a
 * programming error and raises {@link IllegalStateException}.
 */
@Getter
public class VariantTask {

    private final TaskKey     key;
    private final CampaignSet campaignSet;
    private final VariantKind variant;
    private final Instant     createdAt;

    private TaskStatus    status = TaskStatus.PENDING;

    /** Checkpointed status this task was skipped on; {@code null} unless {@link TaskStatus#SKIPPED}. */
    private TaskStatus    priorStatus;

    private String        remoteEntityId;
    private String        error;
    private FailureReason failureReason;
    private int           attemptCount;
    private int           artifactsCount;
    private final List<String> strippedCreativeIds = new ArrayList<>();
    private Instant       updatedAt;

    public VariantTask(CampaignSet campaignSet, VariantKind variant) {
        this.campaignSet = Objects.requireNonNull(campaignSet, "campaignSet");
        this.variant     = Objects.requireNonNull(variant, "variant");
        this.key         = TaskKey.of(campaignSet.getName(), variant);
        this.createdAt   = Instant.now();
        this.updatedAt   = createdAt;
    }

    public String getCampaignSetName() {
        return key.campaignSetName();
    }

    public List<String> getStrippedCreativeIds() {
        return Collections.unmodifiableList(strippedCreativeIds);
    }

    /**
     * Carries the attempt count of earlier runs forward so reports show the total.
     */
    public void carryOverAttempts(int previousAttempts) {
        requireStatus(TaskStatus.PENDING);
        this.attemptCount = Math.max(0, previousAttempts);
    }

    // ---- transitions -------------------------------------------------------

    public void markSkipped(TaskStatus checkpointedStatus, String previousEntityId, int previousArtifacts,
                            String previousError) {
        transition(TaskStatus.SKIPPED);
        this.priorStatus    = checkpointedStatus;
        this.remoteEntityId = previousEntityId;
        this.artifactsCount = previousArtifacts;
        this.error          = previousError;
    }

    public void markInProgress() {
        transition(TaskStatus.IN_PROGRESS);
    }

    /** Counts one execution of this task; cleaning passes inside it are not counted. */
    public void recordAttempt() {
        requireStatus(TaskStatus.IN_PROGRESS);
        attemptCount++;
        touch();
    }

    public void addStrippedCreativeIds(Collection<String> creativeIds) {
        requireStatus(TaskStatus.IN_PROGRESS);
        for (String id : creativeIds) {
            if (!strippedCreativeIds.contains(id)) {
                strippedCreativeIds.add(id);
            }
        }
        touch();
    }

    public void markSucceeded(String entityId, int artifacts) {
        transition(TaskStatus.SUCCEEDED);
        this.remoteEntityId = entityId;
        this.artifactsCount = artifacts;
        this.error          = null;
        this.failureReason  = null;
    }

    public void markFailed(FailureReason reason, String errorDetail) {
        transition(TaskStatus.FAILED);
        this.failureReason = Objects.requireNonNull(reason, "reason");
        this.error         = errorDetail;
    }

    /**
     * Operator override: puts a failed task back to {@link TaskStatus#PENDING}.
     */
    public void resetForRetry() {
        if (status != TaskStatus.FAILED) {
            throw new IllegalStateException("Only FAILED tasks can be reset, " + key + " is " + status);
        }
        this.status        = TaskStatus.PENDING;
        this.failureReason = null;
        this.error         = null;
        this.strippedCreativeIds.clear();
        touch();
    }

    /**
     * Whether a dependent variant may clone from this task: it succeeded in this run,
     * or it was skipped because a previous run already succeeded.
     */
    public boolean isSatisfied() {
        return switch (status) {
            case SUCCEEDED -> true;
            case SKIPPED -> priorStatus == TaskStatus.SUCCEEDED && remoteEntityId != null;
            case PENDING, IN_PROGRESS, FAILED -> false;
        };
    }

    private void transition(TaskStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Illegal transition " + status + " → " + next + " for " + key);
        }
        this.status = next;
        touch();
    }

    private void requireStatus(TaskStatus expected) {
        if (status != expected) {
            throw new IllegalStateException(key + " is " + status + ", expected " + expected);
        }
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }

    @Override
    public String toString() {
        return "VariantTask{" + key + ", status=" + status
                + (remoteEntityId != null ? ", entity=" + remoteEntityId : "")
                + (failureReason != null ? ", reason=" + failureReason : "") + "}";
    }
}
