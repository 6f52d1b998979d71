package com.lucsartech.tint.pipeline;

import com.lucsartech.tint.imaging.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.LongAdder;

/**
 * Aggregates item outcomes of one run into a {@link RunReport}.
 * Logging of per-item failures happens here, as a side effect of recording them.
 */
public final class RunTracker {

    private static final Logger log = LoggerFactory.getLogger(RunTracker.class);

    private final String mode;

    private final LongAdder succeededCount = new LongAdder();
    private final LongAdder failedCount = new LongAdder();
    private final LongAdder processingTimeMs = new LongAdder();

    // first outcome wins; a source is never both succeeded and failed
    private final Set<Path> accounted = ConcurrentHashMap.newKeySet();
    private final List<ItemResult.Failure> failures = new CopyOnWriteArrayList<>();

    private volatile Instant startTime;
    private volatile Instant endTime;

    public RunTracker(String mode) {
        this.mode = mode;
    }

    public void markStarted() {
        startTime = Instant.now();
    }

    public void markCompleted() {
        endTime = Instant.now();
    }

    public void recordAll(Collection<? extends ItemResult> results) {
        results.forEach(this::recordResult);
    }

    public void recordResult(ItemResult result) {
        if (!accounted.add(result.source())) {
            log.error("[{}] Duplicate outcome ignored for {}", mode, result.sourceIdentifier());
            return;
        }

        if (result instanceof ItemResult.Success success) {
            succeededCount.increment();
            processingTimeMs.add(success.processingTime().toMillis());
            log.debug("[{}] {} -> {} in {} ms", mode, success.sourceIdentifier(), success.output(),
                    success.processingTime().toMillis());
        } else if (result instanceof ItemResult.Failure failure) {
            failedCount.increment();
            failures.add(failure);
            log.warn("[{}] {} failed ({}): {}", mode, failure.sourceIdentifier(), failure.kind(),
                    failure.errorMessage());
        }
    }

    /**
     * Record an {@link FailureKind#INTERNAL} failure for every source without an outcome.
     *
     * @return number of sources that had to be reconciled
     */
    public int reconcile(List<Path> discovered) {
        int missing = 0;
        for (Path source : discovered) {
            if (!accounted.contains(source)) {
                recordResult(ItemResult.Failure.of(source, FailureKind.INTERNAL, FailureKind.INTERNAL.description()));
                missing++;
            }
        }
        if (missing > 0) {
            log.error("[{}] {} items had no outcome and were marked failed", mode, missing);
        }
        return missing;
    }

    public Duration elapsedTime() {
        if (startTime == null) return Duration.ZERO;
        Instant end = endTime != null ? endTime : Instant.now();
        return Duration.between(startTime, end);
    }

    public long averageProcessingTimeMs() {
        long count = succeededCount.sum();
        return count > 0 ? processingTimeMs.sum() / count : 0;
    }

    public Map<FailureKind, Long> failuresByKind() {
        var byKind = new EnumMap<FailureKind, Long>(FailureKind.class);
        failures.forEach(failure -> byKind.merge(failure.kind(), 1L, Long::sum));
        return byKind;
    }

    public long succeededCount() { return succeededCount.sum(); }
    public long failedCount() { return failedCount.sum(); }
    public List<ItemResult.Failure> failures() { return List.copyOf(failures); }
    public String mode() { return mode; }

    public RunReport toReport(int workerCount, int discovered) {
        return new RunReport(
                mode,
                workerCount,
                discovered,
                (int) succeededCount.sum(),
                (int) failedCount.sum(),
                elapsedTime(),
                failures
        );
    }
}
