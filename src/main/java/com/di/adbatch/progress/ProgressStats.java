package com.di.adbatch.progress;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Optional;

/**
 * Point-in-time view of run progress.
 */
@Value
@Builder
public class ProgressStats {

    int      total;
    /** Tasks that were actually executed (succeeded or failed). */
    int      completed;
    /** Tasks skipped because a checkpoint already settled them. */
    int      skipped;
    int      remaining;
    Duration elapsedTotal;
    /** Moving average over the sample window; {@link Duration#ZERO} before the first sample. */
    Duration averageDuration;
    /** Absent until the sample window is full. */
    Duration eta;
    double   throughputPerMinute;

    public int getProcessed() {
        return completed + skipped;
    }

    public Optional<Duration> getEtaRemaining() {
        return Optional.ofNullable(eta);
    }

    public double getPercent() {
        return total == 0 ? 100.0 : getProcessed() * 100.0 / total;
    }
}
