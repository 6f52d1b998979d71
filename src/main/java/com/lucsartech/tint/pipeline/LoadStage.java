package com.lucsartech.tint.pipeline;

import com.lucsartech.tint.imaging.DecodeException;
import com.lucsartech.tint.imaging.FailureKind;
import com.lucsartech.tint.imaging.ImageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Decodes source paths into work items.
 * Returns the failures it recorded once the input queue is closed and drained.
 */
final class LoadStage implements Callable<List<ItemResult>> {

    private static final Logger log = LoggerFactory.getLogger(LoadStage.class);

    private final WorkQueue<Path> input;
    private final WorkQueue<WorkItem> output;
    private final ImageCodec codec;

    LoadStage(WorkQueue<Path> input, WorkQueue<WorkItem> output, ImageCodec codec) {
        this.input = input;
        this.output = output;
        this.codec = codec;
    }

    @Override
    public List<ItemResult> call() throws InterruptedException {
        String threadName = Thread.currentThread().getName();
        var results = new ArrayList<ItemResult>();
        int loaded = 0;

        while (true) {
            Optional<Path> next = input.receive();
            if (next.isEmpty()) {
                break;
            }

            Path source = next.get();
            long start = System.nanoTime();
            try {
                var image = codec.decode(source);
                output.send(new WorkItem(source, image, start));
                loaded++;
            } catch (DecodeException e) {
                results.add(ItemResult.Failure.of(source, e));
            } catch (RuntimeException e) {
                log.error("[{}] Unexpected error loading {}", threadName, source.getFileName(), e);
                results.add(ItemResult.Failure.of(source, FailureKind.DECODE, e));
            }
        }

        log.debug("[{}] Load stage drained: {} decoded, {} failed", threadName, loaded, results.size());
        return results;
    }
}
