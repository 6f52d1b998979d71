package com.lucsartech.tint.pipeline;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Aggregate outcome of one run. Immutable once built.
 */
public record RunReport(
        String mode,
        int workerCount,
        int discovered,
        int succeeded,
        int failed,
        Duration elapsed,
        List<ItemResult.Failure> failures
) {

    public RunReport {
        Objects.requireNonNull(mode, "Mode is required");
        Objects.requireNonNull(elapsed, "Elapsed time is required");
        failures = List.copyOf(failures);
        if (succeeded + failed != discovered) {
            throw new IllegalArgumentException(String.format(
                    "%s run accounted for %d of %d items (%d succeeded, %d failed)",
                    mode, succeeded + failed, discovered, succeeded, failed));
        }
    }

    public double itemsPerSecond() {
        double seconds = elapsed.toNanos() / 1_000_000_000.0;
        return seconds > 0 ? succeeded / seconds : 0.0;
    }

    /**
     * How many times faster this run was than {@code baseline}.
     */
    public double speedupOver(RunReport baseline) {
        long nanos = elapsed.toNanos();
        return nanos > 0 ? (double) baseline.elapsed().toNanos() / nanos : 0.0;
    }

    public String elapsedFormatted() {
        long millis = elapsed.toMillis();
        return millis < 1000
                ? millis + " ms"
                : String.format("%d.%03d s", millis / 1000, millis % 1000);
    }
}
