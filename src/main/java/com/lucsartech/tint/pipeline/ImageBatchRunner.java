package com.lucsartech.tint.pipeline;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs load, transform and save over a batch of source files.
 */
public interface ImageBatchRunner {

    /**
     * Label used in logs and reports.
     */
    String mode();

    /**
     * Process every source. Per-item failures are recorded in the report, never thrown.
     */
    RunReport run(List<Path> sources);
}
