package com.di.adbatch.orchestrator;

import com.di.adbatch.checkpoint.CheckpointStore;
import com.di.adbatch.progress.ProgressTracker;
import com.di.adbatch.remote.RemoteCampaignService;
import lombok.Builder;
import lombok.Value;

import java.time.Clock;

/**
 * Everything one worker needs to run its campaign sets. Passed explicitly so the
 * orchestrator holds no per-run state.
 */
@Value
@Builder
public class OrchestratorContext {

    /** Run session id, as given by the operator or generated. */
    String                sessionId;

    /** Checkpoint this worker writes to: the session itself, or its {@code -w<N>} shard. */
    String                checkpointSessionId;

    int                   workerId;

    CheckpointStore       checkpointStore;
    ProgressTracker       progressTracker;
    RemoteCampaignService remote;

    /** Re-run tasks whose checkpoint says FAILED. */
    boolean               retryFailed;

    /** Creative-cleaning passes allowed per task. */
    @Builder.Default
    int                   validationRetryBudget = 1;

    @Builder.Default
    Clock                 clock = Clock.systemUTC();
}
