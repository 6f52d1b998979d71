package com.lucsartech.tint.config;

/**
 * Which runners execute, in order.
 */
public enum RunMode {
    SEQUENTIAL(true, false, "Baseline only, one item at a time"),
    PARALLEL(false, true, "Staged pipeline with a transform worker pool"),
    BOTH(true, true, "Baseline followed by the pipeline, with timing comparison");

    private final boolean sequential;
    private final boolean parallel;
    private final String description;

    RunMode(boolean sequential, boolean parallel, String description) {
        this.sequential = sequential;
        this.parallel = parallel;
        this.description = description;
    }

    public boolean runsSequential() {
        return sequential;
    }

    public boolean runsParallel() {
        return parallel;
    }

    public String description() {
        return description;
    }
}
