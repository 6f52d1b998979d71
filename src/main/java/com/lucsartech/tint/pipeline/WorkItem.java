package com.lucsartech.tint.pipeline;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * One image travelling through the pipeline.
 * The stage holding the item owns the image; handing it to a queue gives up that ownership.
 *
 * @param source     file the image was decoded from
 * @param image      current pixel buffer
 * @param startNanos {@link System#nanoTime()} when decoding started
 */
public record WorkItem(Path source, BufferedImage image, long startNanos) {

    public WorkItem {
        Objects.requireNonNull(source, "Source path is required");
        Objects.requireNonNull(image, "Image is required");
    }

    public String sourceIdentifier() {
        return source.getFileName().toString();
    }

    /**
     * New item for the same source carrying a replacement image.
     */
    public WorkItem withImage(BufferedImage replacement) {
        return new WorkItem(source, replacement, startNanos);
    }

    public Duration age() {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
