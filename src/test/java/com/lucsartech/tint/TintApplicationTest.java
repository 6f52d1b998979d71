package com.lucsartech.tint;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class TintApplicationTest {

    @TempDir
    Path tempDir;

    private int runApplication(String... args) {
        var context = new SpringApplicationBuilder(TintApplication.class).run(args);
        return SpringApplication.exit(context);
    }

    private String[] argsFor(Path input, String... extra) {
        var base = new String[] {
                "--tint.input-directory=" + input,
                "--tint.output.sequential-directory=" + tempDir.resolve("seq"),
                "--tint.output.parallel-directory=" + tempDir.resolve("par"),
                "--tint.report.directory=" + tempDir.resolve("reports"),
                "--tint.pipeline.worker-threads=2"
        };
        var all = new String[base.length + extra.length];
        System.arraycopy(base, 0, all, 0, base.length);
        System.arraycopy(extra, 0, all, base.length, extra.length);
        return all;
    }

    @Test
    @DisplayName("should process both modes and exit normally despite a corrupt file")
    void shouldRunBothModes() throws Exception {
        Path input = tempDir.resolve("in");
        Files.createDirectories(input);
        TestImages.writeJpeg(input, "a.jpg", 24, 16, 1);
        TestImages.writeJpeg(input, "b.jpg", 16, 24, 2);
        TestImages.writeCorrupt(input, "broken.jpg");

        int exitCode = assertTimeoutPreemptively(Duration.ofSeconds(60),
                () -> runApplication(argsFor(input, "--tint.report.enabled=true")));

        assertThat(exitCode).isEqualTo(TintApplication.EXIT_OK);
        assertThat(TestImages.contents(tempDir.resolve("seq"))).containsOnlyKeys("a.jpg", "b.jpg");
        assertThat(TestImages.contents(tempDir.resolve("par"))).containsOnlyKeys("a.jpg", "b.jpg");
        assertThat(tempDir.resolve("reports").resolve("run-summary.json")).exists();
    }

    @Test
    @DisplayName("should exit with a start failure when the input directory is missing")
    void shouldFailWhenInputMissing() {
        int exitCode = runApplication(argsFor(tempDir.resolve("absent"),
                "--tint.create-input-directory=false"));

        assertThat(exitCode).isEqualTo(TintApplication.EXIT_CANNOT_START);
        assertThat(tempDir.resolve("seq")).doesNotExist();
    }
}
