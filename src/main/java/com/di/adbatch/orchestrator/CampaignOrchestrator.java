package com.di.adbatch.orchestrator;

import com.di.adbatch.checkpoint.CheckpointStore;
import com.di.adbatch.checkpoint.VariantTaskSnapshot;
import com.di.adbatch.model.CreativeSource;
import com.di.adbatch.model.FailureReason;
import com.di.adbatch.model.TaskStatus;
import com.di.adbatch.model.VariantKind;
import com.di.adbatch.model.VariantTask;
import com.di.adbatch.remote.ConfigureRequest;
import com.di.adbatch.remote.ConfigureResult;
import com.di.adbatch.validation.ValidationErrorExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs variant tasks against the remote campaign service, one at a time, in the order
 * the expander produced them.
 *
 * <pre>
 * per task:
 *   checkpoint says done        → SKIPPED (snapshot untouched)
 *   otherwise                   → IN_PROGRESS (persisted)
 *   predecessor not satisfied   → FAILED  PREDECESSOR_FAILED, no remote call
 *   configure:
 *     SUCCESS, artifacts &gt; 0    → SUCCEEDED
 *     SUCCESS, 0 artifacts      → FAILED  NO_ARTIFACTS_REMAINING
 *     FATAL_FAILURE             → FAILED  FATAL_FAILURE
 *     VALIDATION_FAILURE        → cleaning pass: strip the rejected creatives, configure again
 * </pre>
 *
 * A failed task never stops the batch. A {@link com.di.adbatch.exception.CheckpointException}
 * does. An interrupt stops the run before the next task; the task in flight stays
 * IN_PROGRESS in the checkpoint and is re-attempted on resume.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CampaignOrchestrator {

    private final ValidationErrorExtractor extractor;

    public BatchSummary run(List<VariantTask> tasks, OrchestratorContext ctx) {
        Instant startedAt = ctx.getClock().instant();
        log.info("[ORCHESTRATOR] worker={} starting {} task(s), checkpoint={}",
                 ctx.getWorkerId(), tasks.size(), ctx.getCheckpointSessionId());

        boolean interrupted = false;
        for (Map.Entry<String, List<VariantTask>> set : groupBySet(tasks).entrySet()) {
            if (!runCampaignSet(set.getKey(), set.getValue(), ctx)) {
                interrupted = true;
                break;
            }
        }

        BatchSummary summary = BatchSummary.builder()
                .sessionId(ctx.getSessionId())
                .tasks(tasks)
                .interrupted(interrupted)
                .startedAt(startedAt)
                .finishedAt(ctx.getClock().instant())
                .build();
        log.info("[ORCHESTRATOR] worker={} {}: {} succeeded, {} failed, {} skipped",
                 ctx.getWorkerId(), interrupted ? "interrupted" : "finished",
                 summary.getSucceeded(), summary.getFailed(), summary.getSkipped());
        return summary;
    }

    /**
     * @return {@code false} when the run was interrupted
     */
    private boolean runCampaignSet(String setName, List<VariantTask> variants, OrchestratorContext ctx) {
        log.info("[ORCHESTRATOR] campaign set '{}': {}", setName,
                 variants.stream().map(t -> t.getVariant().wireName()).toList());
        Map<VariantKind, VariantTask> byVariant = new EnumMap<>(VariantKind.class);
        for (VariantTask task : variants) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("[ORCHESTRATOR] interrupted before {}", task.getKey());
                return false;
            }
            byVariant.put(task.getVariant(), task);
            if (!runTask(task, byVariant, ctx)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return {@code false} when the run was interrupted while this task was in flight
     */
    private boolean runTask(VariantTask task, Map<VariantKind, VariantTask> byVariant, OrchestratorContext ctx) {
        CheckpointStore store = ctx.getCheckpointStore();
        String          cpId  = ctx.getCheckpointSessionId();

        // 1. already settled by an earlier run?
        Optional<VariantTaskSnapshot> snapshot = store.find(cpId, task.getKey());
        if (snapshot.isPresent() && CheckpointStore.shouldSkip(snapshot.get(), ctx.isRetryFailed())) {
            VariantTaskSnapshot s = snapshot.get();
            task.markSkipped(s.getStatus(), s.getRemoteEntityId(), s.getArtifactsCount(), s.getError());
            ctx.getProgressTracker().recordSkip();
            log.info("[ORCHESTRATOR] {} skipped: checkpoint says {}{}", task.getKey(), s.getStatus(),
                     s.getRemoteEntityId() != null ? " (entity " + s.getRemoteEntityId() + ")" : "");
            return true;
        }
        snapshot.ifPresent(s -> task.carryOverAttempts(s.getAttemptCount()));

        // 2. start
        Instant started = ctx.getClock().instant();
        task.markInProgress();
        task.recordAttempt();
        store.markStarted(cpId, task);
        log.info("[ORCHESTRATOR] {} started (attempt {})", task.getKey(), task.getAttemptCount());

        // 3. dependency
        Optional<VariantKind> predecessorKind = task.getVariant().predecessor();
        String predecessorEntityId = null;
        if (predecessorKind.isPresent()) {
            VariantTask predecessor = byVariant.get(predecessorKind.get());
            if (predecessor == null || !predecessor.isSatisfied()) {
                String detail = "Predecessor " + predecessorKind.get().wireName() + " is "
                        + (predecessor == null ? "missing" : describe(predecessor));
                fail(task, FailureReason.PREDECESSOR_FAILED, detail, started, ctx);
                return true;
            }
            predecessorEntityId = predecessor.getRemoteEntityId();
        }

        // 4-7. configure, with cleaning passes on validation failures
        boolean completed = configureWithCleaning(task, predecessorEntityId, ctx);
        if (!completed) {
            log.warn("[ORCHESTRATOR] {} interrupted in flight, left IN_PROGRESS for resume", task.getKey());
            return false;
        }
        if (task.getStatus() == TaskStatus.SUCCEEDED) {
            store.markSucceeded(cpId, task);
            log.info("[ORCHESTRATOR] ✓ {} → entity {} ({} creatives)", task.getKey(),
                     task.getRemoteEntityId(), task.getArtifactsCount());
        } else {
            store.markFailed(cpId, task);
            log.warn("[ORCHESTRATOR] ✗ {} failed [{}]: {}", task.getKey(), task.getFailureReason(), task.getError());
        }
        recordProgress(started, ctx);
        return true;
    }

    /**
     * Calls the remote service until the task reaches a terminal state.
     *
     * @return {@code false} if interrupted first; the task is then still IN_PROGRESS
     */
    private boolean configureWithCleaning(VariantTask task, String predecessorEntityId, OrchestratorContext ctx) {
        CreativeSource source = task.getCampaignSet().getCreativeSource().copy();
        int budget         = ctx.getValidationRetryBudget();
        int cleaningPasses = 0;
        int call           = 0;

        while (!task.getStatus().isTerminal()) {
            if (Thread.currentThread().isInterrupted()) {
                return false;
            }
            call++;
            ConfigureResult result = ctx.getRemote().configure(ConfigureRequest.builder()
                    .campaignSetName(task.getCampaignSetName())
                    .variant(task.getVariant())
                    .predecessorEntityId(predecessorEntityId)
                    .settings(task.getCampaignSet().getSettings())
                    .creativeSource(source)
                    .testNumber(task.getCampaignSet().getTestNumber())
                    .attempt(call)
                    .build());
            if (Thread.currentThread().isInterrupted()) {
                return false;
            }

            switch (result.getOutcome()) {
                case SUCCESS -> {
                    if (result.getArtifactsCount() <= 0) {
                        task.markFailed(FailureReason.NO_ARTIFACTS_REMAINING,
                                "Remote reported success with no creatives uploaded (entity "
                                        + result.getEntityId() + ")");
                    } else {
                        task.markSucceeded(result.getEntityId(), result.getArtifactsCount());
                    }
                }
                case FATAL_FAILURE -> task.markFailed(FailureReason.FATAL_FAILURE, result.getErrorText());
                case VALIDATION_FAILURE -> {
                    CreativeSource cleaned = cleaningPass(task, source, result.getErrorText(), cleaningPasses, budget);
                    if (cleaned != null) {
                        source = cleaned;
                        cleaningPasses++;
                        ctx.getCheckpointStore().markStarted(ctx.getCheckpointSessionId(), task);
                    }
                }
            }
        }
        return true;
    }

    /**
     * One step of the validation recovery loop.
     *
     * @return the creative source for the next call, or {@code null} when the task was failed
     */
    private CreativeSource cleaningPass(VariantTask task, CreativeSource source, String errorText,
                                        int passesDone, int budget) {
        Set<String> rejected = extractor.extractInvalidEntityIds(errorText);
        if (rejected.isEmpty()) {
            task.markFailed(FailureReason.UNRECOGNISED_VALIDATION_ERROR, errorText);
            return null;
        }
        if (passesDone >= budget) {
            task.markFailed(FailureReason.VALIDATION_RETRY_EXHAUSTED,
                    "Still rejected after " + passesDone + " cleaning pass(es): " + errorText);
            return null;
        }
        Set<String> present = new LinkedHashSet<>(source.creativeIds());
        present.retainAll(rejected);
        if (present.isEmpty()) {
            task.markFailed(FailureReason.VALIDATION_FAILURE,
                    "Rejected ids " + rejected + " are not in the creative source: " + errorText);
            return null;
        }
        CreativeSource cleaned = source.without(present);
        task.addStrippedCreativeIds(present);
        if (!cleaned.hasCreatives()) {
            task.markFailed(FailureReason.NO_ARTIFACTS_REMAINING,
                    "Every creative was rejected " + task.getStrippedCreativeIds() + ": " + errorText);
            return null;
        }
        log.info("[RETRY] {} pass {}/{}: stripped {} creative(s) {}, retrying with {}",
                 task.getKey(), passesDone + 1, budget, present.size(), present, cleaned.size());
        return cleaned;
    }

    private void fail(VariantTask task, FailureReason reason, String detail, Instant started, OrchestratorContext ctx) {
        task.markFailed(reason, detail);
        ctx.getCheckpointStore().markFailed(ctx.getCheckpointSessionId(), task);
        log.warn("[ORCHESTRATOR] ✗ {} failed [{}]: {}", task.getKey(), reason, detail);
        recordProgress(started, ctx);
    }

    private static void recordProgress(Instant started, OrchestratorContext ctx) {
        ctx.getProgressTracker().recordCompletion(Duration.between(started, ctx.getClock().instant()));
        ctx.getProgressTracker().logProgress();
    }

    private static String describe(VariantTask task) {
        StringBuilder sb = new StringBuilder(task.getStatus().name());
        if (task.getPriorStatus() != null) {
            sb.append(" (checkpoint: ").append(task.getPriorStatus()).append(')');
        }
        if (task.getFailureReason() != null) {
            sb.append(" [").append(task.getFailureReason()).append(']');
        }
        return sb.toString();
    }

    private static Map<String, List<VariantTask>> groupBySet(List<VariantTask> tasks) {
        Map<String, List<VariantTask>> grouped = new LinkedHashMap<>();
        for (VariantTask task : tasks) {
            grouped.computeIfAbsent(task.getCampaignSetName(), k -> new ArrayList<>()).add(task);
        }
        return grouped;
    }
}
