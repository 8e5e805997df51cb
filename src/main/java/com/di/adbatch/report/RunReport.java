package com.di.adbatch.report;

import com.di.adbatch.model.FailureReason;
import com.di.adbatch.model.TaskStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON document written as {@code report_<sessionId>.json} at the end of a run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunReport {

    private String  sessionId;
    private String  inputFile;
    private String  remoteMode;
    private int     workers;
    private Instant startedAt;
    private Instant finishedAt;
    private long    elapsedSeconds;
    private boolean interrupted;

    private int     total;
    private long    succeeded;
    private long    failed;
    private long    skipped;
    private double  successRate;

    @Builder.Default
    private List<TaskLine> tasks = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TaskLine {
        private String        campaignSet;
        private String        variant;
        private TaskStatus    status;
        /** Checkpointed status a skipped task was skipped on. */
        private TaskStatus    priorStatus;
        private String        remoteEntityId;
        private int           artifactsCount;
        private int           attemptCount;
        private FailureReason failureReason;
        private String        error;
        @Builder.Default
        private List<String>  strippedCreativeIds = new ArrayList<>();
    }
}
