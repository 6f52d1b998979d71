package com.lucsartech.tint.pipeline;

import com.lucsartech.tint.TestImages;
import com.lucsartech.tint.imaging.FailureKind;
import com.lucsartech.tint.imaging.ImageCodec;
import com.lucsartech.tint.transform.ImageTransform;
import com.lucsartech.tint.transform.TransformChain;
import com.lucsartech.tint.transform.TransformException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class ImagePipelineTest {

    private static final Duration RUN_LIMIT = Duration.ofSeconds(60);

    @TempDir
    Path tempDir;

    private Path input;

    @BeforeEach
    void setUp() throws IOException {
        input = Files.createDirectory(tempDir.resolve("input"));
    }

    private List<Path> writeImages(int count) throws IOException {
        var sources = new ArrayList<Path>();
        for (int i = 0; i < count; i++) {
            sources.add(TestImages.writeJpeg(input, String.format("img_%02d.jpg", i), 24 + i, 16 + (i % 5), i));
        }
        return sources;
    }

    private PipelineConfig config(int workers, String output) {
        return new PipelineConfig(workers, input, tempDir.resolve(output));
    }

    private RunReport runParallel(PipelineConfig config, List<Path> sources) {
        return assertTimeoutPreemptively(RUN_LIMIT, () -> {
            try (var pipeline = new ImagePipeline(config)) {
                return pipeline.run(sources);
            }
        });
    }

    @Nested
    @DisplayName("accounting")
    class Accounting {

        @Test
        @DisplayName("should persist every valid image")
        void shouldPersistAllValidImages() throws IOException {
            var sources = writeImages(12);

            var report = runParallel(config(4, "out"), sources);

            assertThat(report.mode()).isEqualTo(ImagePipeline.MODE);
            assertThat(report.discovered()).isEqualTo(12);
            assertThat(report.succeeded()).isEqualTo(12);
            assertThat(report.failed()).isZero();
            assertThat(TestImages.contents(tempDir.resolve("out")))
                    .containsOnlyKeys(sources.stream().map(p -> p.getFileName().toString()).toArray(String[]::new));
        }

        @Test
        @DisplayName("should count one corrupt and one valid file separately")
        void shouldCountCorruptAndValid() throws IOException {
            var sources = List.of(
                    TestImages.writeCorrupt(input, "broken.jpg"),
                    TestImages.writeJpeg(input, "good.jpg", 16, 16, 1));

            var report = runParallel(config(2, "out"), sources);

            assertThat(report.succeeded()).isEqualTo(1);
            assertThat(report.failed()).isEqualTo(1);
            assertThat(report.failures()).singleElement()
                    .satisfies(f -> {
                        assertThat(f.sourceIdentifier()).isEqualTo("broken.jpg");
                        assertThat(f.kind()).isEqualTo(FailureKind.DECODE);
                    });
            assertThat(TestImages.contents(tempDir.resolve("out"))).containsOnlyKeys("good.jpg");
        }

        @Test
        @DisplayName("should handle an empty batch without writing anything")
        void shouldHandleEmptyBatch() throws IOException {
            var report = runParallel(config(3, "out"), List.of());

            assertThat(report.discovered()).isZero();
            assertThat(report.succeeded()).isZero();
            assertThat(report.failed()).isZero();
            assertThat(TestImages.contents(tempDir.resolve("out"))).isEmpty();
        }

        @ParameterizedTest(name = "workers={0}")
        @ValueSource(ints = {1, 2, 3, 8})
        @DisplayName("should account for every item with a mix of valid and corrupt files")
        void shouldAccountForEveryItem(int workers) throws IOException {
            var sources = new ArrayList<>(writeImages(15));
            for (int i = 0; i < 5; i++) {
                sources.add(i * 3, TestImages.writeCorrupt(input, "corrupt_" + i + ".jpg"));
            }

            var report = runParallel(config(workers, "out"), sources);

            assertThat(report.succeeded() + report.failed()).isEqualTo(report.discovered()).isEqualTo(20);
            assertThat(report.failed()).isEqualTo(5);
            assertThat(TestImages.contents(tempDir.resolve("out"))).hasSize(15);
        }
    }

    @Nested
    @DisplayName("failure containment")
    class FailureContainment {

        @Test
        @DisplayName("should drop an item whose transform fails and keep the pool running")
        void shouldContainTransformFailure() throws IOException {
            var sources = writeImages(6);
            var chain = TransformChain.grayscaleSepia();
            // img_02 is 26 pixels wide
            ImageTransform failingOnOne = image -> {
                if (image.getWidth() == 26) {
                    throw new TransformException("malformed buffer");
                }
                return chain.apply(image);
            };

            var config = config(2, "out");
            var report = assertTimeoutPreemptively(RUN_LIMIT, () -> {
                try (var pipeline = new ImagePipeline(config, new ImageCodec(config.jpegQuality()), failingOnOne)) {
                    return pipeline.run(sources);
                }
            });

            assertThat(report.succeeded()).isEqualTo(5);
            assertThat(report.failures()).singleElement()
                    .satisfies(f -> {
                        assertThat(f.sourceIdentifier()).isEqualTo("img_02.jpg");
                        assertThat(f.kind()).isEqualTo(FailureKind.TRANSFORM);
                    });
        }

        @Test
        @DisplayName("should report unchecked transform errors as transform failures")
        void shouldContainUncheckedTransformError() throws IOException {
            var sources = writeImages(3);
            var config = config(2, "out");

            var report = assertTimeoutPreemptively(RUN_LIMIT, () -> {
                try (var pipeline = new ImagePipeline(config, new ImageCodec(config.jpegQuality()), image -> {
                    throw new IllegalStateException("boom");
                })) {
                    return pipeline.run(sources);
                }
            });

            assertThat(report.succeeded()).isZero();
            assertThat(report.failed()).isEqualTo(3);
            assertThat(report.failures()).allMatch(f -> f.kind() == FailureKind.TRANSFORM);
        }

        @Test
        @DisplayName("should record persist failures when the output directory cannot be created")
        void shouldContainPersistFailure() throws IOException {
            var sources = writeImages(4);
            Path blocker = Files.writeString(tempDir.resolve("blocked"), "file in the way");

            var report = runParallel(new PipelineConfig(2, input, blocker.resolve("out")), sources);

            assertThat(report.discovered()).isEqualTo(4);
            assertThat(report.failed()).isEqualTo(4);
            assertThat(report.failures()).allMatch(f -> f.kind() == FailureKind.PERSIST);
        }
    }

    @Nested
    @DisplayName("determinism")
    class Determinism {

        @ParameterizedTest(name = "workers={0}")
        @ValueSource(ints = {1, 4})
        @DisplayName("should produce byte-identical output to the sequential runner")
        void shouldMatchSequentialOutput(int workers) throws IOException {
            var sources = writeImages(10);
            sources.add(TestImages.writeCorrupt(input, "zz_bad.jpg"));

            var sequential = new SequentialRunner(config(1, "sequential")).run(sources);
            var parallel = runParallel(config(workers, "parallel"), sources);

            assertThat(parallel.succeeded()).isEqualTo(sequential.succeeded()).isEqualTo(10);
            assertThat(parallel.failed()).isEqualTo(sequential.failed()).isEqualTo(1);

            var parity = ParityChecker.compare(tempDir.resolve("sequential"), tempDir.resolve("parallel"));
            assertThat(parity.identical()).isTrue();
            assertThat(parity.compared()).isEqualTo(10);
        }

        @Test
        @DisplayName("should overwrite rather than accumulate on a second run")
        void shouldBeIdempotent() throws IOException {
            var sources = writeImages(8);
            var config = config(3, "out");

            var first = assertTimeoutPreemptively(RUN_LIMIT, () -> {
                try (var pipeline = new ImagePipeline(config)) {
                    var report = pipeline.run(sources);
                    var afterFirst = TestImages.contents(tempDir.resolve("out"));

                    var second = pipeline.run(sources);
                    var afterSecond = TestImages.contents(tempDir.resolve("out"));

                    assertThat(second.succeeded()).isEqualTo(report.succeeded());
                    assertThat(afterSecond).hasSameSizeAs(afterFirst);
                    afterFirst.forEach((name, bytes) -> assertThat(afterSecond.get(name)).isEqualTo(bytes));
                    return report;
                }
            });

            assertThat(first.succeeded()).isEqualTo(8);
        }
    }

    @Test
    @DisplayName("should finish a large batch with a single worker without deadlock")
    void shouldNotDeadlockWithSingleWorker() throws IOException {
        var sources = writeImages(40);

        var report = runParallel(config(1, "out"), sources);

        assertThat(report.succeeded()).isEqualTo(40);
        assertThat(report.workerCount()).isEqualTo(1);
    }
}
