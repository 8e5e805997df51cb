package com.di.adbatch.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Orchestrator settings (application.yml → {@code adbatch.*}).
 */
@Validated
@ConfigurationProperties(prefix = "adbatch")
public class AdBatchProperties {

    /** Directory holding {@code checkpoint_<sessionId>.json} files. */
    @NotBlank
    private String checkpointDir = "data/checkpoints";

    /**
     * {@code file}, {@code memory}, or {@code auto}: memory when {@code remote.mode} is
     * {@code dry-run}, file otherwise.
     */
    @Pattern(regexp = "auto|file|memory")
    private String checkpointStore = "auto";

    /** Directory receiving {@code report_<sessionId>.json} summaries. */
    @NotBlank
    private String reportDir = "data/reports";

    /** Parallel workers; 1 runs every campaign set on the caller thread. */
    @Min(1)
    @Max(16)
    private int workers = 1;

    /** Upper bound for one remote configure call before it is treated as a fatal failure. */
    @NotNull
    private Duration remoteTimeout = Duration.ofMinutes(10);

    /** Creative-cleaning passes allowed per task after a validation failure. */
    @Min(0)
    @Max(5)
    private int validationRetryBudget = 1;

    /** Completed-task durations kept for the moving average; ETA needs a full window. */
    @Min(1)
    private int progressWindow = 10;

    /** Shortest numeric token treated as a creative id when parsing remote validation errors. */
    @Min(1)
    private int minIdDigits = 1;

    private Remote remote = new Remote();

    public static class Remote {

        /** {@code dry-run} logs requests and fabricates entity ids; other modes need a session factory bean. */
        private String mode = "dry-run";

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }
    }

    public String getCheckpointDir() {
        return checkpointDir;
    }

    public void setCheckpointDir(String checkpointDir) {
        this.checkpointDir = checkpointDir;
    }

    public String getCheckpointStore() {
        return checkpointStore;
    }

    public void setCheckpointStore(String checkpointStore) {
        this.checkpointStore = checkpointStore;
    }

    public String getReportDir() {
        return reportDir;
    }

    public void setReportDir(String reportDir) {
        this.reportDir = reportDir;
    }

    public int getWorkers() {
        return workers;
    }

    public void setWorkers(int workers) {
        this.workers = workers;
    }

    public Duration getRemoteTimeout() {
        return remoteTimeout;
    }

    public void setRemoteTimeout(Duration remoteTimeout) {
        this.remoteTimeout = remoteTimeout;
    }

    public int getValidationRetryBudget() {
        return validationRetryBudget;
    }

    public void setValidationRetryBudget(int validationRetryBudget) {
        this.validationRetryBudget = validationRetryBudget;
    }

    public int getProgressWindow() {
        return progressWindow;
    }

    public void setProgressWindow(int progressWindow) {
        this.progressWindow = progressWindow;
    }

    public int getMinIdDigits() {
        return minIdDigits;
    }

    public void setMinIdDigits(int minIdDigits) {
        this.minIdDigits = minIdDigits;
    }

    public Remote getRemote() {
        return remote;
    }

    public void setRemote(Remote remote) {
        this.remote = remote;
    }
}
