package com.di.adbatch.runner;

import com.di.adbatch.checkpoint.CheckpointRecord;
import com.di.adbatch.checkpoint.CheckpointStore;
import com.di.adbatch.checkpoint.CheckpointSummary;
import com.di.adbatch.checkpoint.VariantTaskSnapshot;
import com.di.adbatch.config.AdBatchProperties;
import com.di.adbatch.exception.CheckpointException;
import com.di.adbatch.exception.ErrorCategory;
import com.di.adbatch.exception.InvalidDefinitionException;
import com.di.adbatch.expand.WorkItemExpander;
import com.di.adbatch.input.CampaignDefinitionReader;
import com.di.adbatch.model.CampaignSet;
import com.di.adbatch.model.VariantTask;
import com.di.adbatch.orchestrator.BatchSummary;
import com.di.adbatch.orchestrator.ParallelCampaignRunner;
import com.di.adbatch.progress.ProgressTracker;
import com.di.adbatch.remote.RemoteCampaignSessionFactory;
import com.di.adbatch.report.SummaryReporter;
import com.di.adbatch.util.MdcPropagation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.ApplicationArguments;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Drives one invocation: parse options, read and expand the campaign table, run it
 * against the checkpoint, report, and map the outcome to a process exit code.
 *
 * <ul>
 *   <li>{@value #EXIT_OK}: every task succeeded, now or in an earlier run</li>
 *   <li>{@value #EXIT_FAILED}: some task failed, or checkpoints could not be written</li>
 *   <li>{@value #EXIT_INVALID}: bad arguments or an invalid campaign definition</li>
 *   <li>{@value #EXIT_INTERRUPTED}: stopped by the operator; resume with {@code --resume}</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchRunnerService {

    public static final int EXIT_OK          = 0;
    public static final int EXIT_FAILED      = 1;
    public static final int EXIT_INVALID     = 2;
    public static final int EXIT_INTERRUPTED = 130;

    static final DateTimeFormatter SESSION_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    private final AdBatchProperties            properties;
    private final CampaignDefinitionReader     reader;
    private final WorkItemExpander             expander;
    private final CheckpointStore              checkpointStore;
    private final ParallelCampaignRunner       parallelRunner;
    private final SummaryReporter              reporter;
    private final RemoteCampaignSessionFactory sessionFactory;
    private final Clock                        clock;

    public int run(ApplicationArguments args) {
        BatchRunOptions options;
        try {
            options = BatchRunOptions.from(args);
        } catch (IllegalArgumentException e) {
            log.error("[RUNNER] {}", e.getMessage());
            log.error("[RUNNER] usage: --input=<file.json> [--resume=<sessionId>] [--retry-failed] [--fresh] "
                    + "[--workers=<n>] [--dry-run] | --list-checkpoints");
            return EXIT_INVALID;
        }
        if (options.isListCheckpoints()) {
            return listCheckpoints();
        }

        String sessionId = options.getResume().orElseGet(this::newSessionId);
        MDC.put(MdcPropagation.SESSION_ID, sessionId);
        try {
            List<CampaignSet> sets  = reader.read(options.getInput());
            List<VariantTask> tasks = expander.expand(sets);
            if (options.isDryRun()) {
                printPlan(sessionId, tasks, options);
                return EXIT_OK;
            }
            return execute(sessionId, tasks, options);
        } catch (InvalidDefinitionException e) {
            log.error("[RUNNER] [{}] {} problem(s) in {}:", ErrorCategory.categorize(e),
                      e.getProblems().size(), options.getInput());
            e.getProblems().forEach(p -> log.error("[RUNNER]   - {}", p));
            return EXIT_INVALID;
        } catch (CheckpointException e) {
            log.error("[RUNNER] [{}] run aborted, progress can no longer be saved: {}",
                      ErrorCategory.categorize(e), e.getMessage(), e);
            return EXIT_FAILED;
        } finally {
            MDC.remove(MdcPropagation.SESSION_ID);
        }
    }

    private int execute(String sessionId, List<VariantTask> tasks, BatchRunOptions options) {
        prepareCheckpoint(sessionId, options);

        int workers = options.getWorkerOverride().orElse(properties.getWorkers());
        log.info("[RUNNER] session={} input={} tasks={} workers={} remote={} retryFailed={}",
                 sessionId, options.getInput(), tasks.size(), workers, sessionFactory.mode(),
                 options.isRetryFailed());

        ParallelCampaignRunner.RunPlan plan = ParallelCampaignRunner.RunPlan.builder()
                .sessionId(sessionId)
                .inputFile(options.getInput().toString())
                .tasks(tasks)
                .workers(workers)
                .retryFailed(options.isRetryFailed())
                .checkpointStore(checkpointStore)
                .progressTracker(new ProgressTracker(tasks.size(), properties.getProgressWindow(), clock))
                .clock(clock)
                .build();

        Thread         runThread = Thread.currentThread();
        CountDownLatch finished  = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            log.warn("[RUNNER] shutdown requested, stopping after the current task");
            runThread.interrupt();
            try {
                finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "adbatch-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            BatchSummary summary     = parallelRunner.run(plan);
            boolean      interrupted = Thread.interrupted() | summary.isInterrupted();

            reporter.logSummary(summary);
            reporter.write(reporter.toReport(summary, plan.getInputFile(), sessionFactory.mode(), workers));

            if (interrupted) {
                log.warn("[RUNNER] interrupted; continue with --input={} --resume={}", options.getInput(), sessionId);
                return EXIT_INTERRUPTED;
            }
            if (summary.isAllSucceeded()) {
                return EXIT_OK;
            }
            log.warn("[RUNNER] some tasks failed; fix them and re-run with --input={} --resume={} --retry-failed",
                     options.getInput(), sessionId);
            return EXIT_FAILED;
        } finally {
            finished.countDown();
            removeShutdownHook(hook);
        }
    }

    private void prepareCheckpoint(String sessionId, BatchRunOptions options) {
        if (options.isFresh()) {
            if (options.getResume().isPresent()) {
                checkpointStore.delete(sessionId);
                log.info("[RUNNER] --fresh: discarded checkpoint of session {}", sessionId);
            } else {
                log.info("[RUNNER] --fresh: new session {}, nothing to discard", sessionId);
            }
            return;
        }
        if (options.getResume().isPresent() && checkpointStore.loadMerged(sessionId).isEmpty()) {
            log.warn("[RUNNER] checkpoint not found for session {}, starting fresh under that id", sessionId);
        }
    }

    private void printPlan(String sessionId, List<VariantTask> tasks, BatchRunOptions options) {
        Optional<CheckpointRecord> checkpoint = options.getResume().isPresent() && !options.isFresh()
                ? checkpointStore.loadMerged(sessionId)
                : Optional.empty();
        log.info("[PLAN] dry run, session={} {} task(s), no remote calls", sessionId, tasks.size());
        int toRun = 0;
        for (VariantTask task : tasks) {
            Optional<VariantTaskSnapshot> snapshot = checkpoint.flatMap(r -> r.find(task.getKey()));
            boolean skip = snapshot.map(s -> CheckpointStore.shouldSkip(s, options.isRetryFailed())).orElse(false);
            if (!skip) {
                toRun++;
            }
            log.info("[PLAN]   {} {}{}", skip ? "skip" : "run ", task.getKey(),
                     snapshot.map(s -> "  (checkpoint: " + s.getStatus() + ")").orElse(""));
        }
        log.info("[PLAN] {} to run, {} already settled", toRun, tasks.size() - toRun);
    }

    private int listCheckpoints() {
        List<CheckpointSummary> sessions;
        try {
            sessions = checkpointStore.list();
        } catch (CheckpointException e) {
            log.error("[CHECKPOINT] could not list checkpoints: {}", e.getMessage(), e);
            return EXIT_FAILED;
        }
        if (sessions.isEmpty()) {
            log.info("[CHECKPOINT] no checkpoints found");
            return EXIT_OK;
        }
        log.info("[CHECKPOINT] {} session(s), newest first:", sessions.size());
        for (CheckpointSummary s : sessions) {
            log.info("[CHECKPOINT]   {}  input={}  updated={}  tasks={}  {}",
                     s.getSessionId(), s.getInputFile(), s.getLastUpdatedAt(), s.getTaskCount(), s.getStatusCounts());
        }
        return EXIT_OK;
    }

    String newSessionId() {
        return LocalDateTime.now(clock).format(SESSION_ID_FORMAT);
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("[RUNNER] JVM already shutting down, shutdown hook stays registered");
        }
    }
}
