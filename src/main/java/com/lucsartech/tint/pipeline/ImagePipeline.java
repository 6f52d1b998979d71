package com.lucsartech.tint.pipeline;

import com.lucsartech.tint.imaging.ImageCodec;
import com.lucsartech.tint.transform.ImageTransform;
import com.lucsartech.tint.transform.TransformChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Parallel image pipeline.
 *
 * Architecture:
 * <pre>
 * paths
 *     ↓ WorkQueue&lt;Path&gt;       (capacity = item count)
 * Load stage (1 thread)
 *     ↓ WorkQueue&lt;WorkItem&gt;   (capacity = worker count)
 * Transform pool (N threads)
 *     ↓ WorkQueue&lt;WorkItem&gt;   (capacity = worker count)
 * Save stage (1 thread)
 * </pre>
 *
 * <p>Every queue is closed by this class, and only after all of its senders have been joined:
 * input after the last path, transform queue after the load stage, save queue after the whole pool.
 */
public final class ImagePipeline implements ImageBatchRunner, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ImagePipeline.class);

    public static final String MODE = "parallel";

    private final PipelineConfig config;
    private final ImageCodec codec;
    private final ImageTransform transform;
    private final ExecutorService executor;

    public ImagePipeline(PipelineConfig config) {
        this(config, new ImageCodec(config.jpegQuality()), TransformChain.grayscaleSepia());
    }

    public ImagePipeline(PipelineConfig config, ImageCodec codec, ImageTransform transform) {
        this.config = config;
        this.codec = codec;
        this.transform = transform;

        // load + save + transform workers, all long-lived for the duration of a run
        this.executor = Executors.newFixedThreadPool(config.workerCount() + 2,
                new CustomizableThreadFactory("tint-" + MODE + "-"));

        log.info("Pipeline initialized with {} transform workers, output: {}",
                config.workerCount(), config.outputDirectory());
    }

    @Override
    public String mode() {
        return MODE;
    }

    /**
     * Run the complete pipeline over {@code sources} and wait for it to drain.
     */
    @Override
    public RunReport run(List<Path> sources) {
        var tracker = new RunTracker(MODE);
        tracker.markStarted();
        log.info("Starting {} run: {} files, {} workers", MODE, sources.size(), config.workerCount());

        var inputQueue = new WorkQueue<Path>("input", Math.max(1, sources.size()));
        var transformQueue = new WorkQueue<WorkItem>("transform", config.workerCount());
        var saveQueue = new WorkQueue<WorkItem>("save", config.workerCount());

        var saveFuture = executor.submit(new SaveStage(saveQueue, config, codec));
        var transformFutures = new ArrayList<Future<List<ItemResult>>>();
        for (int i = 0; i < config.workerCount(); i++) {
            transformFutures.add(executor.submit(new TransformStage(transformQueue, saveQueue, transform)));
        }
        var loadFuture = executor.submit(new LoadStage(inputQueue, transformQueue, codec));

        var allFutures = new ArrayList<Future<List<ItemResult>>>(transformFutures);
        allFutures.add(loadFuture);
        allFutures.add(saveFuture);

        try {
            for (Path source : sources) {
                inputQueue.send(source);
            }
            inputQueue.close();

            tracker.recordAll(await("load", loadFuture));
            transformQueue.close();
            log.debug("Load stage completed");

            for (var future : transformFutures) {
                tracker.recordAll(await("transform", future));
            }
            saveQueue.close();
            log.debug("Transform workers completed");

            tracker.recordAll(await("save", saveFuture));
            log.debug("Save stage completed");

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} run interrupted, cancelling stages", MODE);
            allFutures.forEach(future -> future.cancel(true));
        }

        tracker.reconcile(sources);
        tracker.markCompleted();

        var report = tracker.toReport(config.workerCount(), sources.size());
        log.info("{} run completed in {}: {} succeeded, {} failed",
                MODE, report.elapsedFormatted(), report.succeeded(), report.failed());
        return report;
    }

    /**
     * Join a stage. A stage that died unexpectedly contributes no outcomes; its items are reconciled later.
     */
    private List<ItemResult> await(String stage, Future<List<ItemResult>> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.error("{} stage terminated abnormally", stage, e.getCause());
            return List.of();
        }
    }

    public PipelineConfig config() {
        return config;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        log.info("Pipeline resources released");
    }
}
