package com.lucsartech.tint.pipeline;

import com.lucsartech.tint.transform.ImageTransform;
import com.lucsartech.tint.transform.TransformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * One worker of the transform pool. Several instances share the same input queue.
 */
final class TransformStage implements Callable<List<ItemResult>> {

    private static final Logger log = LoggerFactory.getLogger(TransformStage.class);

    private final WorkQueue<WorkItem> input;
    private final WorkQueue<WorkItem> output;
    private final ImageTransform transform;

    TransformStage(WorkQueue<WorkItem> input, WorkQueue<WorkItem> output, ImageTransform transform) {
        this.input = input;
        this.output = output;
        this.transform = transform;
    }

    @Override
    public List<ItemResult> call() throws InterruptedException {
        String threadName = Thread.currentThread().getName();
        var results = new ArrayList<ItemResult>();
        int transformed = 0;

        while (true) {
            Optional<WorkItem> next = input.receive();
            if (next.isEmpty()) {
                break;
            }

            WorkItem item = next.get();
            try {
                log.trace("[{}] Transforming {}", threadName, item.sourceIdentifier());
                output.send(item.withImage(apply(transform, item.image())));
                transformed++;
            } catch (TransformException e) {
                results.add(ItemResult.Failure.of(item.source(), e));
            }
        }

        log.debug("[{}] Transform worker drained: {} transformed, {} failed", threadName, transformed, results.size());
        return results;
    }

    /**
     * Apply {@code transform}, reporting any unchecked error from a step as a transform failure.
     */
    static BufferedImage apply(ImageTransform transform, BufferedImage image) throws TransformException {
        try {
            return transform.apply(image);
        } catch (RuntimeException e) {
            throw new TransformException("Transform failed: " + e, e);
        }
    }
}
