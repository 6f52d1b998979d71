package com.lucsartech.tint.pipeline;

import com.lucsartech.tint.imaging.FailureKind;
import com.lucsartech.tint.imaging.ImageCodec;
import com.lucsartech.tint.imaging.ImageProcessingException;
import com.lucsartech.tint.transform.ImageTransform;
import com.lucsartech.tint.transform.TransformChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Baseline: load, transform and save each source in turn on the calling thread.
 * Produces the same files as {@link ImagePipeline} for the same input.
 */
public final class SequentialRunner implements ImageBatchRunner {

    private static final Logger log = LoggerFactory.getLogger(SequentialRunner.class);

    public static final String MODE = "sequential";

    private final PipelineConfig config;
    private final ImageCodec codec;
    private final ImageTransform transform;

    public SequentialRunner(PipelineConfig config) {
        this(config, new ImageCodec(config.jpegQuality()), TransformChain.grayscaleSepia());
    }

    public SequentialRunner(PipelineConfig config, ImageCodec codec, ImageTransform transform) {
        this.config = config;
        this.codec = codec;
        this.transform = transform;
    }

    @Override
    public String mode() {
        return MODE;
    }

    @Override
    public RunReport run(List<Path> sources) {
        var tracker = new RunTracker(MODE);
        tracker.markStarted();
        log.info("Starting {} run: {} files", MODE, sources.size());

        SaveStage.prepareOutputDirectory(config.outputDirectory());

        for (Path source : sources) {
            tracker.recordResult(process(source));
        }

        tracker.markCompleted();

        var report = tracker.toReport(1, sources.size());
        log.info("{} run completed in {}: {} succeeded, {} failed",
                MODE, report.elapsedFormatted(), report.succeeded(), report.failed());
        return report;
    }

    private ItemResult process(Path source) {
        long start = System.nanoTime();
        try {
            var decoded = codec.decode(source);
            var transformed = TransformStage.apply(transform, decoded);
            Path target = config.outputFor(source);
            codec.write(transformed, target);
            return new ItemResult.Success(source, target, Duration.ofNanos(System.nanoTime() - start));
        } catch (ImageProcessingException e) {
            return ItemResult.Failure.of(source, e);
        } catch (RuntimeException e) {
            log.error("Unexpected error processing {}", source.getFileName(), e);
            return ItemResult.Failure.of(source, FailureKind.INTERNAL, e);
        }
    }
}
