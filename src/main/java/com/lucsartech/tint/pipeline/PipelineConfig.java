package com.lucsartech.tint.pipeline;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable settings for a single run.
 *
 * @param workerCount     number of transform workers, strictly positive
 * @param inputDirectory  directory the sources were discovered in
 * @param outputDirectory directory results are written to
 * @param jpegQuality     JPEG compression quality in (0, 1]
 */
public record PipelineConfig(int workerCount, Path inputDirectory, Path outputDirectory, float jpegQuality) {

    public static final float DEFAULT_JPEG_QUALITY = 0.75f;

    public PipelineConfig {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("Worker count must be positive: " + workerCount);
        }
        Objects.requireNonNull(inputDirectory, "Input directory is required");
        Objects.requireNonNull(outputDirectory, "Output directory is required");
        if (jpegQuality <= 0f || jpegQuality > 1f) {
            throw new IllegalArgumentException("JPEG quality must be in (0, 1]: " + jpegQuality);
        }
    }

    public PipelineConfig(int workerCount, Path inputDirectory, Path outputDirectory) {
        this(workerCount, inputDirectory, outputDirectory, DEFAULT_JPEG_QUALITY);
    }

    public static int defaultWorkerCount() {
        return Runtime.getRuntime().availableProcessors();
    }

    public PipelineConfig withWorkerCount(int count) {
        return new PipelineConfig(count, inputDirectory, outputDirectory, jpegQuality);
    }

    public PipelineConfig withOutputDirectory(Path directory) {
        return new PipelineConfig(workerCount, inputDirectory, directory, jpegQuality);
    }

    /**
     * Output location for a source: same base name, inside the output directory.
     */
    public Path outputFor(Path source) {
        return outputDirectory.resolve(source.getFileName().toString());
    }
}
