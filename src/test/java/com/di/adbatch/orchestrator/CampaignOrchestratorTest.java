package com.di.adbatch.orchestrator;

import com.di.adbatch.MutableClock;
import com.di.adbatch.TestCampaigns;
import com.di.adbatch.checkpoint.InMemoryCheckpointStore;
import com.di.adbatch.checkpoint.VariantTaskSnapshot;
import com.di.adbatch.expand.CampaignSetValidator;
import com.di.adbatch.expand.WorkItemExpander;
import com.di.adbatch.model.CampaignSet;
import com.di.adbatch.model.FailureReason;
import com.di.adbatch.model.TaskKey;
import com.di.adbatch.model.TaskStatus;
import com.di.adbatch.model.VariantKind;
import com.di.adbatch.model.VariantTask;
import com.di.adbatch.progress.ProgressTracker;
import com.di.adbatch.remote.ConfigureRequest;
import com.di.adbatch.remote.ConfigureResult;
import com.di.adbatch.remote.ScriptedRemote;
import com.di.adbatch.validation.ValidationErrorExtractor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CampaignOrchestrator Tests")
class CampaignOrchestratorTest {

    private static final String SESSION = "20240501_090000";

    private final InMemoryCheckpointStore store        = new InMemoryCheckpointStore();
    private final WorkItemExpander        expander     = new WorkItemExpander(new CampaignSetValidator());
    private final CampaignOrchestrator    orchestrator = new CampaignOrchestrator(new ValidationErrorExtractor(1));
    private final MutableClock            clock        = MutableClock.atEpochDay();

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private List<VariantTask> tasks(CampaignSet... sets) {
        return expander.expand(List.of(sets));
    }

    private BatchSummary run(List<VariantTask> tasks, ScriptedRemote remote, boolean retryFailed, int budget) {
        store.initialize(SESSION, "campaigns.json", tasks.stream().map(VariantTask::getKey).toList(), null);
        return orchestrator.run(tasks, OrchestratorContext.builder()
                .sessionId(SESSION)
                .checkpointSessionId(SESSION)
                .workerId(0)
                .checkpointStore(store)
                .progressTracker(new ProgressTracker(tasks.size(), 3, clock))
                .remote(remote)
                .retryFailed(retryFailed)
                .validationRetryBudget(budget)
                .clock(clock)
                .build());
    }

    private BatchSummary run(List<VariantTask> tasks, ScriptedRemote remote) {
        return run(tasks, remote, false, 1);
    }

    private VariantTaskSnapshot checkpoint(String set, VariantKind variant) {
        return store.find(SESSION, TaskKey.of(set, variant)).orElseThrow();
    }

    private static VariantTask task(List<VariantTask> tasks, String set, VariantKind variant) {
        return tasks.stream().filter(t -> t.getKey().equals(TaskKey.of(set, variant))).findFirst().orElseThrow();
    }

    // ============================================================================
    // Happy path and resume
    // ============================================================================

    @Test
    @DisplayName("All tasks succeed; android clones the ios entity of its own set")
    void testRun_AllSucceed() {
        ScriptedRemote remote = new ScriptedRemote();
        List<VariantTask> tasks = tasks(TestCampaigns.set("A", "desktop"), TestCampaigns.set("B", "ios", "android"));

        BatchSummary summary = run(tasks, remote);

        assertTrue(summary.isAllSucceeded());
        assertFalse(summary.hasFailures());
        assertEquals(3, summary.getSucceeded());
        assertEquals(3, remote.requests().size());
        assertNull(remote.requestsFor("A", VariantKind.DESKTOP).get(0).getPredecessorEntityId());
        assertNull(remote.requestsFor("B", VariantKind.IOS).get(0).getPredecessorEntityId());
        assertEquals(task(tasks, "B", VariantKind.IOS).getRemoteEntityId(),
                     remote.requestsFor("B", VariantKind.ANDROID).get(0).getPredecessorEntityId());

        VariantTaskSnapshot saved = checkpoint("B", VariantKind.ANDROID);
        assertEquals(TaskStatus.SUCCEEDED, saved.getStatus());
        assertEquals(1, saved.getAttemptCount());
        assertEquals(2, saved.getArtifactsCount());
    }

    @Test
    @DisplayName("Resuming a finished session makes no remote calls")
    void testRun_ResumeSkipsEverything() {
        run(tasks(TestCampaigns.set("A", "desktop"), TestCampaigns.set("B", "ios", "android")), new ScriptedRemote());

        ScriptedRemote second = new ScriptedRemote();
        List<VariantTask> again = tasks(TestCampaigns.set("A", "desktop"), TestCampaigns.set("B", "ios", "android"));
        BatchSummary summary = run(again, second);

        assertTrue(second.requests().isEmpty());
        assertEquals(3, summary.getSkipped());
        assertTrue(summary.isAllSucceeded());
        assertTrue(again.stream().allMatch(t -> t.getPriorStatus() == TaskStatus.SUCCEEDED));
        assertEquals(1, checkpoint("A", VariantKind.DESKTOP).getAttemptCount());
    }

    @Test
    @DisplayName("Deleting the checkpoint starts the session over")
    void testRun_FreshAfterDelete() {
        run(tasks(TestCampaigns.set("A", "desktop")), new ScriptedRemote());
        store.delete(SESSION);

        ScriptedRemote second = new ScriptedRemote();
        BatchSummary summary = run(tasks(TestCampaigns.set("A", "desktop")), second);

        assertEquals(1, second.requests().size());
        assertEquals(1, summary.getSucceeded());
    }

    // ============================================================================
    // Dependencies
    // ============================================================================

    @Test
    @DisplayName("android fails without a remote call when ios failed")
    void testRun_PredecessorFailed() {
        ScriptedRemote remote = new ScriptedRemote()
                .on("B", VariantKind.IOS, ConfigureResult.fatalFailure("page did not load"));
        List<VariantTask> tasks = tasks(TestCampaigns.set("B", "ios", "android"));

        BatchSummary summary = run(tasks, remote);

        assertEquals(1, remote.requests().size());
        assertTrue(remote.requestsFor("B", VariantKind.ANDROID).isEmpty());
        VariantTask android = task(tasks, "B", VariantKind.ANDROID);
        assertEquals(TaskStatus.FAILED, android.getStatus());
        assertEquals(FailureReason.PREDECESSOR_FAILED, android.getFailureReason());
        assertEquals(FailureReason.PREDECESSOR_FAILED, checkpoint("B", VariantKind.ANDROID).getFailureReason());
        assertEquals(2, summary.getFailed());
    }

    @Test
    @DisplayName("android clones an ios entity created by an earlier run")
    void testRun_PredecessorFromCheckpoint() {
        ScriptedRemote first = new ScriptedRemote()
                .on("B", VariantKind.ANDROID, ConfigureResult.fatalFailure("session lost"));
        List<VariantTask> firstTasks = tasks(TestCampaigns.set("B", "ios", "android"));
        run(firstTasks, first);
        String iosEntity = task(firstTasks, "B", VariantKind.IOS).getRemoteEntityId();

        ScriptedRemote second = new ScriptedRemote();
        List<VariantTask> again = tasks(TestCampaigns.set("B", "ios", "android"));
        BatchSummary summary = run(again, second, true, 1);

        assertEquals(TaskStatus.SKIPPED, task(again, "B", VariantKind.IOS).getStatus());
        assertEquals(1, second.requests().size());
        assertEquals(iosEntity, second.requests().get(0).getPredecessorEntityId());
        assertTrue(summary.isAllSucceeded());
        assertEquals(2, checkpoint("B", VariantKind.ANDROID).getAttemptCount());
    }

    // ============================================================================
    // Validation recovery
    // ============================================================================

    @Test
    @DisplayName("android keeps cloning the ios entity across a cleaning pass")
    void testRun_CleaningPassOnDependentVariant() {
        ScriptedRemote remote = new ScriptedRemote()
                .on("Milfs", VariantKind.DESKTOP, ConfigureResult.success("D1", 3))
                .on("Milfs", VariantKind.IOS, ConfigureResult.success("E1", 3))
                .on("Milfs", VariantKind.ANDROID,
                    ConfigureResult.validationFailure("creatives not valid: 77,88"),
                    ConfigureResult.success("A1", 1));
        List<VariantTask> tasks = tasks(TestCampaigns.set("Milfs", List.of("desktop", "ios", "android"),
                                                          "77", "88", "99"));

        BatchSummary summary = run(tasks, remote);

        List<ConfigureRequest> androidCalls = remote.requestsFor("Milfs", VariantKind.ANDROID);
        assertEquals(2, androidCalls.size());
        assertEquals("E1", androidCalls.get(0).getPredecessorEntityId());
        assertEquals("E1", androidCalls.get(1).getPredecessorEntityId());
        assertEquals(Set.of("77", "88", "99"), androidCalls.get(0).getCreativeSource().creativeIds());
        assertEquals(Set.of("99"), androidCalls.get(1).getCreativeSource().creativeIds());

        VariantTask android = task(tasks, "Milfs", VariantKind.ANDROID);
        assertEquals(TaskStatus.SUCCEEDED, android.getStatus());
        assertEquals("A1", android.getRemoteEntityId());
        assertEquals(1, android.getArtifactsCount());
        assertEquals(List.of("77", "88"), android.getStrippedCreativeIds());

        VariantTaskSnapshot saved = checkpoint("Milfs", VariantKind.ANDROID);
        assertEquals(TaskStatus.SUCCEEDED, saved.getStatus());
        assertEquals(1, saved.getArtifactsCount());
        assertTrue(summary.isAllSucceeded());
        assertEquals(3, summary.getSucceeded());
    }

    @Test
    @DisplayName("Rejected creatives are stripped and the call is retried without them")
    void testRun_CleaningPass() {
        ScriptedRemote remote = new ScriptedRemote().on("Milfs", VariantKind.IOS,
                ConfigureResult.validationFailure("Creative IDs 77, 88 are not valid for this campaign type"));
        List<VariantTask> tasks = tasks(TestCampaigns.set("Milfs", List.of("ios"), "77", "88", "99"));

        run(tasks, remote);

        List<ConfigureRequest> calls = remote.requestsFor("Milfs", VariantKind.IOS);
        assertEquals(2, calls.size());
        assertEquals(Set.of("77", "88", "99"), calls.get(0).getCreativeSource().creativeIds());
        assertEquals(Set.of("99"), calls.get(1).getCreativeSource().creativeIds());
        assertEquals(2, calls.get(1).getAttempt());

        VariantTask ios = task(tasks, "Milfs", VariantKind.IOS);
        assertEquals(TaskStatus.SUCCEEDED, ios.getStatus());
        assertEquals(1, ios.getArtifactsCount());
        assertEquals(List.of("77", "88"), ios.getStrippedCreativeIds());
        assertEquals(1, ios.getAttemptCount());
        assertEquals(List.of("77", "88"), checkpoint("Milfs", VariantKind.IOS).getStrippedCreativeIds());
    }

    @Test
    @DisplayName("A second rejection after the cleaning budget is spent fails the task")
    void testRun_RetryExhausted() {
        ScriptedRemote remote = new ScriptedRemote().on("A", VariantKind.DESKTOP,
                ConfigureResult.validationFailure("Creative 101 is not valid"),
                ConfigureResult.validationFailure("Creative 102 is not valid"));
        List<VariantTask> tasks = tasks(TestCampaigns.set("A", List.of("desktop"), "101", "102", "103"));

        run(tasks, remote);

        assertEquals(2, remote.requests().size());
        VariantTask desktop = task(tasks, "A", VariantKind.DESKTOP);
        assertEquals(FailureReason.VALIDATION_RETRY_EXHAUSTED, desktop.getFailureReason());
        assertEquals(List.of("101"), desktop.getStrippedCreativeIds());
    }

    @Test
    @DisplayName("With a zero budget the first rejection is final")
    void testRun_ZeroBudget() {
        ScriptedRemote remote = new ScriptedRemote().on("A", VariantKind.DESKTOP,
                ConfigureResult.validationFailure("Creative 101 is not valid"));
        List<VariantTask> tasks = tasks(TestCampaigns.set("A", "desktop"));

        run(tasks, remote, false, 0);

        assertEquals(1, remote.requests().size());
        assertEquals(FailureReason.VALIDATION_RETRY_EXHAUSTED, task(tasks, "A", VariantKind.DESKTOP).getFailureReason());
    }

    @Test
    @DisplayName("Validation errors without ids, or naming unknown ids, are not retried")
    void testRun_ValidationNotRecoverable() {
        ScriptedRemote remote = new ScriptedRemote()
                .on("A", VariantKind.DESKTOP, ConfigureResult.validationFailure("Daily budget is too low"))
                .on("B", VariantKind.DESKTOP, ConfigureResult.validationFailure("Creative 555 is not valid"));
        List<VariantTask> tasks = tasks(TestCampaigns.set("A", "desktop"), TestCampaigns.set("B", "desktop"));

        run(tasks, remote);

        assertEquals(2, remote.requests().size());
        assertEquals(FailureReason.UNRECOGNISED_VALIDATION_ERROR, task(tasks, "A", VariantKind.DESKTOP).getFailureReason());
        assertEquals(FailureReason.VALIDATION_FAILURE, task(tasks, "B", VariantKind.DESKTOP).getFailureReason());
    }

    @Test
    @DisplayName("Rejecting every creative, or uploading none, is NO_ARTIFACTS_REMAINING")
    void testRun_NoArtifactsRemaining() {
        ScriptedRemote remote = new ScriptedRemote()
                .on("A", VariantKind.DESKTOP, ConfigureResult.validationFailure("Creative IDs 101, 102 rejected"))
                .on("B", VariantKind.DESKTOP, ConfigureResult.success("9", 0));
        List<VariantTask> tasks = tasks(TestCampaigns.set("A", "desktop"), TestCampaigns.set("B", "desktop"));

        run(tasks, remote);

        assertEquals(2, remote.requests().size());
        assertEquals(FailureReason.NO_ARTIFACTS_REMAINING, task(tasks, "A", VariantKind.DESKTOP).getFailureReason());
        assertEquals(FailureReason.NO_ARTIFACTS_REMAINING, task(tasks, "B", VariantKind.DESKTOP).getFailureReason());
    }

    // ============================================================================
    // Failures and retry
    // ============================================================================

    @Test
    @DisplayName("A fatal failure does not stop the rest of the batch")
    void testRun_FatalFailureContinues() {
        ScriptedRemote remote = new ScriptedRemote()
                .on("A", VariantKind.DESKTOP, ConfigureResult.fatalFailure("[TIMEOUT_ERROR] remote call timed out"));
        List<VariantTask> tasks = tasks(TestCampaigns.set("A", "desktop"), TestCampaigns.set("B", "desktop"));

        BatchSummary summary = run(tasks, remote);

        assertEquals(1, summary.getFailed());
        assertEquals(1, summary.getSucceeded());
        assertTrue(summary.hasFailures());
        assertFalse(summary.isAllSucceeded());
        VariantTaskSnapshot failed = checkpoint("A", VariantKind.DESKTOP);
        assertEquals(FailureReason.FATAL_FAILURE, failed.getFailureReason());
        assertEquals("[TIMEOUT_ERROR] remote call timed out", failed.getError());
    }

    @Test
    @DisplayName("Failed tasks are skipped on resume unless retrying failures")
    void testRun_RetryFailed() {
        run(tasks(TestCampaigns.set("A", "desktop")),
            new ScriptedRemote().on("A", VariantKind.DESKTOP, ConfigureResult.fatalFailure("boom")));

        ScriptedRemote resume = new ScriptedRemote();
        BatchSummary skipped = run(tasks(TestCampaigns.set("A", "desktop")), resume);
        assertTrue(resume.requests().isEmpty());
        assertEquals(1, skipped.getSkipped());
        assertTrue(skipped.hasFailures());
        assertFalse(skipped.isAllSucceeded());

        ScriptedRemote retry = new ScriptedRemote();
        List<VariantTask> tasks = tasks(TestCampaigns.set("A", "desktop"));
        BatchSummary retried = run(tasks, retry, true, 1);
        assertEquals(1, retry.requests().size());
        assertTrue(retried.isAllSucceeded());
        assertEquals(2, task(tasks, "A", VariantKind.DESKTOP).getAttemptCount());
        assertEquals(2, checkpoint("A", VariantKind.DESKTOP).getAttemptCount());
        assertNull(checkpoint("A", VariantKind.DESKTOP).getFailureReason());
    }

    // ============================================================================
    // Interrupts
    // ============================================================================

    @Test
    @DisplayName("An interrupt leaves the task in flight IN_PROGRESS and later tasks PENDING")
    void testRun_Interrupted() {
        ScriptedRemote remote = new ScriptedRemote().then("B", VariantKind.IOS, req -> {
            Thread.currentThread().interrupt();
            return ConfigureResult.fatalFailure("interrupted");
        });
        List<VariantTask> tasks = tasks(TestCampaigns.set("B", "ios", "android"), TestCampaigns.set("C", "desktop"));

        BatchSummary summary = run(tasks, remote);
        assertTrue(Thread.interrupted());

        assertTrue(summary.isInterrupted());
        assertFalse(summary.isAllSucceeded());
        assertEquals(1, remote.requests().size());
        assertEquals(TaskStatus.IN_PROGRESS, task(tasks, "B", VariantKind.IOS).getStatus());
        assertEquals(TaskStatus.PENDING, task(tasks, "B", VariantKind.ANDROID).getStatus());
        assertEquals(TaskStatus.IN_PROGRESS, checkpoint("B", VariantKind.IOS).getStatus());
        assertEquals(TaskStatus.PENDING, checkpoint("B", VariantKind.ANDROID).getStatus());
        assertEquals(TaskStatus.PENDING, checkpoint("C", VariantKind.DESKTOP).getStatus());

        ScriptedRemote resume = new ScriptedRemote();
        List<VariantTask> again = tasks(TestCampaigns.set("B", "ios", "android"), TestCampaigns.set("C", "desktop"));
        assertTrue(run(again, resume).isAllSucceeded());
        assertEquals(3, resume.requests().size());
        assertEquals(2, checkpoint("B", VariantKind.IOS).getAttemptCount());
    }
}
