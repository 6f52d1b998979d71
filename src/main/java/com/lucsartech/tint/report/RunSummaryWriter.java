package com.lucsartech.tint.report;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.lucsartech.tint.pipeline.ParityChecker;
import com.lucsartech.tint.pipeline.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Machine-readable run summary written next to the PDF report.
 */
public final class RunSummaryWriter {

    private static final Logger log = LoggerFactory.getLogger(RunSummaryWriter.class);
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    public static final String FILE_NAME = "run-summary.json";

    private RunSummaryWriter() {}

    record Summary(String generatedAt, String inputDirectory, List<Run> runs, Parity parity) {}

    record Run(String mode, int workerCount, int discovered, int succeeded, int failed,
               long elapsedMillis, List<Failure> failures) {}

    record Failure(String source, String kind, String message) {}

    record Parity(int compared, List<String> mismatched, List<String> onlyInFirst, List<String> onlyInSecond) {}

    public static Path write(Path directory, String inputDirectory, List<RunReport> runs,
                             ParityChecker.ParityResult parity) throws IOException {
        Files.createDirectories(directory);
        Path target = directory.resolve(FILE_NAME);
        Files.writeString(target, toJson(inputDirectory, runs, parity), StandardCharsets.UTF_8);
        log.info("Run summary written: {}", target.toAbsolutePath());
        return target;
    }

    static String toJson(String inputDirectory, List<RunReport> runs, ParityChecker.ParityResult parity) {
        var summary = new Summary(
                Instant.now().toString(),
                inputDirectory,
                runs.stream().map(RunSummaryWriter::toRun).toList(),
                parity == null ? null : new Parity(parity.compared(), parity.mismatched(),
                        parity.onlyInFirst(), parity.onlyInSecond()));
        return GSON.toJson(summary);
    }

    private static Run toRun(RunReport report) {
        return new Run(
                report.mode(),
                report.workerCount(),
                report.discovered(),
                report.succeeded(),
                report.failed(),
                report.elapsed().toMillis(),
                report.failures().stream()
                        .map(f -> new Failure(f.sourceIdentifier(), f.kind().name(), f.errorMessage()))
                        .toList());
    }
}
