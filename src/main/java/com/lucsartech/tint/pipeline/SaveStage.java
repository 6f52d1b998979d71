package com.lucsartech.tint.pipeline;

import com.lucsartech.tint.imaging.FailureKind;
import com.lucsartech.tint.imaging.ImageCodec;
import com.lucsartech.tint.imaging.PersistException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Encodes finished items and writes them to the output directory.
 * Reports a success or a failure for every item it receives.
 */
final class SaveStage implements Callable<List<ItemResult>> {

    private static final Logger log = LoggerFactory.getLogger(SaveStage.class);

    private final WorkQueue<WorkItem> input;
    private final PipelineConfig config;
    private final ImageCodec codec;

    SaveStage(WorkQueue<WorkItem> input, PipelineConfig config, ImageCodec codec) {
        this.input = input;
        this.config = config;
        this.codec = codec;
    }

    @Override
    public List<ItemResult> call() throws InterruptedException {
        String threadName = Thread.currentThread().getName();
        prepareOutputDirectory(config.outputDirectory());

        var results = new ArrayList<ItemResult>();
        while (true) {
            Optional<WorkItem> next = input.receive();
            if (next.isEmpty()) {
                break;
            }
            results.add(save(next.get()));
        }

        log.debug("[{}] Save stage drained: {} items", threadName, results.size());
        return results;
    }

    private ItemResult save(WorkItem item) {
        Path target = config.outputFor(item.source());
        try {
            codec.write(item.image(), target);
            return new ItemResult.Success(item.source(), target, item.age());
        } catch (PersistException e) {
            return ItemResult.Failure.of(item.source(), e);
        } catch (RuntimeException e) {
            log.error("Unexpected error saving {}", item.sourceIdentifier(), e);
            return ItemResult.Failure.of(item.source(), FailureKind.PERSIST, e);
        }
    }

    /**
     * Create the output directory if needed. Failure is logged; each write then fails on its own.
     */
    static boolean prepareOutputDirectory(Path directory) {
        try {
            Files.createDirectories(directory);
            return true;
        } catch (IOException e) {
            log.warn("Cannot create output directory {}: {}", directory.toAbsolutePath(), e.getMessage());
            return false;
        }
    }
}
