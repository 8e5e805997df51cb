package com.di.adbatch.report;

import com.di.adbatch.config.AdBatchProperties;
import com.di.adbatch.model.TaskStatus;
import com.di.adbatch.model.VariantTask;
import com.di.adbatch.orchestrator.BatchSummary;
import com.di.adbatch.progress.ProgressTracker;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Logs the end-of-run summary and writes it as {@code report_<sessionId>.json} to
 * {@code adbatch.report-dir}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SummaryReporter {

    private static final String RULE = "=".repeat(65);
    private static final String THIN = "-".repeat(65);

    private final ObjectMapper      objectMapper;
    private final AdBatchProperties properties;

    public RunReport toReport(BatchSummary summary, String inputFile, String remoteMode, int workers) {
        List<RunReport.TaskLine> lines = new ArrayList<>();
        for (VariantTask t : summary.getTasks()) {
            lines.add(RunReport.TaskLine.builder()
                    .campaignSet(t.getCampaignSetName())
                    .variant(t.getVariant().wireName())
                    .status(t.getStatus())
                    .priorStatus(t.getPriorStatus())
                    .remoteEntityId(t.getRemoteEntityId())
                    .artifactsCount(t.getArtifactsCount())
                    .attemptCount(t.getAttemptCount())
                    .failureReason(t.getFailureReason())
                    .error(t.getError())
                    .strippedCreativeIds(new ArrayList<>(t.getStrippedCreativeIds()))
                    .build());
        }
        return RunReport.builder()
                .sessionId(summary.getSessionId())
                .inputFile(inputFile)
                .remoteMode(remoteMode)
                .workers(workers)
                .startedAt(summary.getStartedAt())
                .finishedAt(summary.getFinishedAt())
                .elapsedSeconds(summary.getElapsed().getSeconds())
                .interrupted(summary.isInterrupted())
                .total(summary.getTasks().size())
                .succeeded(summary.getSucceeded())
                .failed(summary.getFailed())
                .skipped(summary.getSkipped())
                .successRate(Math.round(summary.getSuccessRate() * 10.0) / 10.0)
                .tasks(lines)
                .build();
    }

    /** Logs the summary block. */
    public void logSummary(BatchSummary summary) {
        log.info(RULE);
        log.info("CAMPAIGN CREATION SUMMARY  session={}{}", summary.getSessionId(),
                 summary.isInterrupted() ? "  (INTERRUPTED)" : "");
        log.info(RULE);
        log.info("Total time: {}", ProgressTracker.formatDuration(summary.getElapsed()));
        log.info("Variants: {}  ✓ created {}  ✗ failed {}  ⊗ skipped {}  pending {}",
                 summary.getTasks().size(), summary.getSucceeded(), summary.getFailed(), summary.getSkipped(),
                 summary.count(TaskStatus.PENDING) + summary.count(TaskStatus.IN_PROGRESS));
        log.info("Success rate: {}%", String.format(Locale.ROOT, "%.1f", summary.getSuccessRate()));

        if (summary.getFailed() > 0) {
            log.info(THIN);
            log.info("FAILED");
            for (VariantTask t : summary.getTasks()) {
                if (t.getStatus() == TaskStatus.FAILED) {
                    log.warn("  ✗ {} [{}] {}{}", t.getKey(), t.getFailureReason(), t.getError(),
                             t.getStrippedCreativeIds().isEmpty() ? "" : " stripped=" + t.getStrippedCreativeIds());
                }
            }
        }
        List<VariantTask> done = summary.getTasks().stream().filter(VariantTask::isSatisfied).toList();
        if (!done.isEmpty()) {
            log.info(THIN);
            log.info("CREATED");
            for (VariantTask t : done) {
                log.info("  ✓ {} entity={} creatives={}{}{}", t.getKey(), t.getRemoteEntityId(), t.getArtifactsCount(),
                         t.getStatus() == TaskStatus.SKIPPED ? " (earlier run)" : "",
                         t.getStrippedCreativeIds().isEmpty() ? "" : " stripped=" + t.getStrippedCreativeIds());
            }
        }
        log.info(RULE);
    }

    /**
     * Writes the report file. Failures are logged, not thrown.
     *
     * @return the written file, or empty if it could not be written
     */
    public Optional<Path> write(RunReport report) {
        Path file = Path.of(properties.getReportDir()).resolve("report_" + report.getSessionId() + ".json");
        try {
            Files.createDirectories(file.getParent());
            objectMapper.writeValue(file.toFile(), report);
            log.info("[REPORT] written {}", file);
            return Optional.of(file);
        } catch (IOException e) {
            log.error("[REPORT] failed to write {}: {}", file, e.getMessage(), e);
            return Optional.empty();
        }
    }
}
