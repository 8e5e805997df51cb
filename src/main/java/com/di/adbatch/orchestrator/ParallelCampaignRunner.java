package com.di.adbatch.orchestrator;

import com.di.adbatch.checkpoint.CheckpointRecord;
import com.di.adbatch.checkpoint.CheckpointStore;
import com.di.adbatch.config.AdBatchProperties;
import com.di.adbatch.model.TaskKey;
import com.di.adbatch.model.VariantTask;
import com.di.adbatch.progress.ProgressTracker;
import com.di.adbatch.remote.GuardedRemoteCampaignService;
import com.di.adbatch.remote.RemoteCampaignSession;
import com.di.adbatch.remote.RemoteCampaignSessionFactory;
import com.di.adbatch.util.MdcPropagation;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Splits a run across workers and drives {@link CampaignOrchestrator} on each.
 *
 * <h3>Partitioning</h3>
 * Campaign sets are dealt round-robin: set {@code i} (in input order) goes to worker
 * {@code i mod N}. All variants of a set stay on one worker, so the ios → android
 * dependency never crosses threads.
 *
 * <h3>Checkpoints</h3>
 * With one worker the session's own checkpoint is used. With N workers each writes its
 * own shard {@code <sessionId>-w<k>}. Every checkpoint is seeded from the merged view of
 * the session taken before any worker starts, so a resume with a different worker count
 * still skips finished work.
 *
 * <h3>Sessions</h3>
 * Each worker opens its own remote session and wraps it in
 * {@link GuardedRemoteCampaignService} for the configured timeout.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ParallelCampaignRunner {

    private final CampaignOrchestrator         orchestrator;
    private final RemoteCampaignSessionFactory sessionFactory;
    private final AdBatchProperties            properties;

    /**
     * Everything about one run that the runner needs.
     */
    @Value
    @Builder
    public static class RunPlan {
        String            sessionId;
        String            inputFile;
        List<VariantTask> tasks;
        int               workers;
        boolean           retryFailed;
        CheckpointStore   checkpointStore;
        ProgressTracker   progressTracker;
        @Builder.Default
        Clock             clock = Clock.systemUTC();
    }

    public BatchSummary run(RunPlan plan) {
        List<List<VariantTask>> partitions = partition(plan.getTasks(), plan.getWorkers());
        CheckpointRecord seed = plan.getCheckpointStore().loadMerged(plan.getSessionId()).orElse(null);
        // the session's own record always exists, so the run shows up in listings
        plan.getCheckpointStore().initialize(plan.getSessionId(), plan.getInputFile(), keysOf(plan.getTasks()), seed);

        if (partitions.size() <= 1) {
            return runInline(plan, partitions.isEmpty() ? List.of() : partitions.get(0));
        }
        return runParallel(plan, partitions, seed);
    }

    private BatchSummary runInline(RunPlan plan, List<VariantTask> tasks) {
        String sessionId = plan.getSessionId();
        MDC.put(MdcPropagation.WORKER, "0");
        try (RemoteCampaignSession session = openGuarded(0)) {
            return orchestrator.run(tasks, contextFor(plan, sessionId, 0, session));
        } finally {
            MDC.remove(MdcPropagation.WORKER);
        }
    }

    private BatchSummary runParallel(RunPlan plan, List<List<VariantTask>> partitions, CheckpointRecord seed) {
        int workers = partitions.size();
        Instant startedAt = plan.getClock().instant();
        log.info("[PARALLEL] session={} {} task(s) across {} worker(s)",
                 plan.getSessionId(), plan.getTasks().size(), workers);

        AtomicInteger threadNo = new AtomicInteger();
        ThreadFactory tf = r -> {
            var t = new Thread(r, "campaign-worker-" + threadNo.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        ExecutorService executor = Executors.newFixedThreadPool(workers, tf);
        Map<String, String> parentMdc = MdcPropagation.copyMdc();

        List<Future<BatchSummary>> futures = new ArrayList<>(workers);
        for (int k = 0; k < workers; k++) {
            final int              workerId = k;
            final List<VariantTask> share   = partitions.get(k);
            Map<String, String> mdc = new HashMap<>(parentMdc);
            mdc.put(MdcPropagation.WORKER, String.valueOf(workerId));
            futures.add(executor.submit(() -> MdcPropagation.callWithMdcContext(mdc,
                    () -> runWorker(plan, workerId, share, seed))));
        }
        executor.shutdown();

        boolean interrupted = false;
        try {
            for (Future<BatchSummary> future : futures) {
                BatchSummary part = future.get();
                interrupted |= part.isInterrupted();
            }
        } catch (InterruptedException e) {
            log.warn("[PARALLEL] interrupted, stopping {} worker(s) after their current task", workers);
            interrupted = true;
            executor.shutdownNow();
            awaitWorkers(executor);
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            executor.shutdownNow();
            awaitWorkers(executor);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Campaign worker failed", cause);
        }

        return BatchSummary.builder()
                .sessionId(plan.getSessionId())
                .tasks(plan.getTasks())
                .interrupted(interrupted)
                .startedAt(startedAt)
                .finishedAt(plan.getClock().instant())
                .build();
    }

    private BatchSummary runWorker(RunPlan plan, int workerId, List<VariantTask> share, CheckpointRecord seed) {
        String shardId = CheckpointStore.shardSessionId(plan.getSessionId(), workerId);
        plan.getCheckpointStore().initialize(shardId, plan.getInputFile(), keysOf(share), seed);
        try (RemoteCampaignSession session = openGuarded(workerId)) {
            return orchestrator.run(share, contextFor(plan, shardId, workerId, session));
        }
    }

    private RemoteCampaignSession openGuarded(int workerId) {
        return new GuardedRemoteCampaignService(sessionFactory.openSession(workerId),
                                                properties.getRemoteTimeout(), workerId);
    }

    private OrchestratorContext contextFor(RunPlan plan, String checkpointSessionId, int workerId,
                                           RemoteCampaignSession session) {
        return OrchestratorContext.builder()
                .sessionId(plan.getSessionId())
                .checkpointSessionId(checkpointSessionId)
                .workerId(workerId)
                .checkpointStore(plan.getCheckpointStore())
                .progressTracker(plan.getProgressTracker())
                .remote(session)
                .retryFailed(plan.isRetryFailed())
                .validationRetryBudget(properties.getValidationRetryBudget())
                .clock(plan.getClock())
                .build();
    }

    /**
     * Round-robin by campaign set: set {@code i} → worker {@code i mod workers}.
     * Never returns more partitions than there are sets, nor empty partitions.
     */
    static List<List<VariantTask>> partition(List<VariantTask> tasks, int workers) {
        Map<String, List<VariantTask>> bySet = new LinkedHashMap<>();
        for (VariantTask task : tasks) {
            bySet.computeIfAbsent(task.getCampaignSetName(), k -> new ArrayList<>()).add(task);
        }
        int n = Math.max(1, Math.min(workers, bySet.size()));
        List<List<VariantTask>> partitions = new ArrayList<>(n);
        for (int k = 0; k < n; k++) {
            partitions.add(new ArrayList<>());
        }
        int i = 0;
        for (List<VariantTask> setTasks : bySet.values()) {
            partitions.get(i % n).addAll(setTasks);
            i++;
        }
        partitions.removeIf(List::isEmpty);
        return partitions;
    }

    private static List<TaskKey> keysOf(List<VariantTask> tasks) {
        return tasks.stream().map(VariantTask::getKey).toList();
    }

    private static void awaitWorkers(ExecutorService executor) {
        try {
            if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                log.warn("[PARALLEL] workers still running one minute after stop request");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
