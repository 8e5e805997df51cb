package com.di.adbatch.orchestrator;

import com.di.adbatch.model.TaskStatus;
import com.di.adbatch.model.VariantTask;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Result of one run (or one worker's share of it). Tasks appear in expansion order;
 * tasks never reached because of an interrupt are still PENDING.
 */
@Value
@Builder
public class BatchSummary {

    String            sessionId;
    List<VariantTask> tasks;
    boolean           interrupted;
    Instant           startedAt;
    Instant           finishedAt;

    public long count(TaskStatus status) {
        return tasks.stream().filter(t -> t.getStatus() == status).count();
    }

    public long getSucceeded() {
        return count(TaskStatus.SUCCEEDED);
    }

    public long getFailed() {
        return count(TaskStatus.FAILED);
    }

    public long getSkipped() {
        return count(TaskStatus.SKIPPED);
    }

    /** Tasks that are done, whether in this run or an earlier one. */
    public long getSatisfied() {
        return tasks.stream().filter(VariantTask::isSatisfied).count();
    }

    /** Percentage of tasks that are done; 100 for an empty run. */
    public double getSuccessRate() {
        return tasks.isEmpty() ? 100.0 : getSatisfied() * 100.0 / tasks.size();
    }

    public boolean isAllSucceeded() {
        return !interrupted && getSatisfied() == tasks.size();
    }

    /** True when some task failed in this run or was skipped on a FAILED checkpoint. */
    public boolean hasFailures() {
        return tasks.stream().anyMatch(t -> t.getStatus() == TaskStatus.FAILED
                || (t.getStatus() == TaskStatus.SKIPPED && t.getPriorStatus() == TaskStatus.FAILED));
    }

    public Duration getElapsed() {
        return startedAt == null || finishedAt == null ? Duration.ZERO : Duration.between(startedAt, finishedAt);
    }
}
