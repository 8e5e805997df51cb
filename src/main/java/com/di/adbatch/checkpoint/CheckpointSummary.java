package com.di.adbatch.checkpoint;

import com.di.adbatch.model.TaskStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One line of {@code --list-checkpoints} output.
 */
@Value
@Builder
public class CheckpointSummary {

    String                   sessionId;
    String                   inputFile;
    Instant                  startedAt;
    Instant                  lastUpdatedAt;
    int                      taskCount;
    Map<TaskStatus, Integer> statusCounts;

    static CheckpointSummary of(CheckpointRecord record) {
        return CheckpointSummary.builder()
                .sessionId(record.getSessionId())
                .inputFile(record.getInputFile())
                .startedAt(record.getStartedAt())
                .lastUpdatedAt(record.getLastUpdatedAt())
                .taskCount(record.getTasks().size())
                .statusCounts(record.statusCounts())
                .build();
    }
}
