package com.di.adbatch.progress;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;

/**
 * Tracks completed and skipped tasks of one run and estimates the time left.
 *
 * <p>The ETA is {@code remaining × average}, where the average is taken over the last
 * {@code windowSize} task durations only, so it follows the platform's current speed.
 * Until the window is full the ETA is reported as "insufficient data". Shared by all
 * workers of a run, so every method is synchronized.
 */
@Slf4j
public class ProgressTracker {

    static final String INSUFFICIENT_DATA = "insufficient data";
    private static final int BAR_WIDTH = 40;

    private final int    total;
    private final int    windowSize;
    private final Clock  clock;
    private final Instant startedAt;

    private final Deque<Duration> window = new ArrayDeque<>();
    private int completed;
    private int skipped;

    public ProgressTracker(int total, int windowSize, Clock clock) {
        if (total < 0) {
            throw new IllegalArgumentException("total must be >= 0, got " + total);
        }
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be >= 1, got " + windowSize);
        }
        this.total      = total;
        this.windowSize = windowSize;
        this.clock      = clock;
        this.startedAt  = clock.instant();
    }

    public synchronized void recordCompletion(Duration duration) {
        completed++;
        window.addLast(duration == null || duration.isNegative() ? Duration.ZERO : duration);
        while (window.size() > windowSize) {
            window.removeFirst();
        }
    }

    public synchronized void recordSkip() {
        skipped++;
    }

    public synchronized ProgressStats stats() {
        Duration elapsed   = Duration.between(startedAt, clock.instant());
        int      remaining = Math.max(0, total - completed - skipped);
        Duration average   = average();
        Duration eta       = window.size() >= windowSize ? average.multipliedBy(remaining) : null;
        double   minutes   = elapsed.toMillis() / 60_000.0;
        return ProgressStats.builder()
                .total(total)
                .completed(completed)
                .skipped(skipped)
                .remaining(remaining)
                .elapsedTotal(elapsed)
                .averageDuration(average)
                .eta(eta)
                .throughputPerMinute(minutes > 0 ? completed / minutes : 0.0)
                .build();
    }

    /**
     * Logs the one-line progress bar, e.g.
     * {@code [████████░░░░...] 3/10 (30.0%) | 2m 5s | ETA: 14m 35s}
     */
    public String logProgress() {
        String line = formatLine(stats());
        log.info("[PROGRESS] {}", line);
        return line;
    }

    static String formatLine(ProgressStats s) {
        int processed = s.getProcessed();
        int filled    = s.getTotal() > 0 ? (int) ((long) BAR_WIDTH * processed / s.getTotal()) : BAR_WIDTH;
        filled = Math.min(BAR_WIDTH, filled);
        StringBuilder sb = new StringBuilder("[")
                .append("█".repeat(filled))
                .append("░".repeat(BAR_WIDTH - filled))
                .append("] ")
                .append(processed).append('/').append(s.getTotal())
                .append(String.format(Locale.ROOT, " (%.1f%%)", s.getPercent()))
                .append(" | ").append(formatDuration(s.getElapsedTotal()));
        if (s.getRemaining() > 0) {
            sb.append(" | ETA: ")
              .append(s.getEtaRemaining().map(ProgressTracker::formatDuration).orElse(INSUFFICIENT_DATA));
        }
        return sb.toString();
    }

    /** {@code 45s}, {@code 2m 5s}, {@code 1h 12m}. */
    public static String formatDuration(Duration d) {
        long seconds = Math.max(0, d.getSeconds());
        if (seconds < 60) {
            return seconds + "s";
        }
        if (seconds < 3600) {
            return (seconds / 60) + "m " + (seconds % 60) + "s";
        }
        return (seconds / 3600) + "h " + ((seconds % 3600) / 60) + "m";
    }

    private Duration average() {
        if (window.isEmpty()) {
            return Duration.ZERO;
        }
        Duration sum = Duration.ZERO;
        for (Duration d : window) {
            sum = sum.plus(d);
        }
        return sum.dividedBy(window.size());
    }
}
