package com.lucsartech.tint;

import com.lucsartech.tint.config.TintProperties;
import com.lucsartech.tint.imaging.DiscoveryException;
import com.lucsartech.tint.imaging.ImageDiscovery;
import com.lucsartech.tint.pipeline.ImagePipeline;
import com.lucsartech.tint.pipeline.ParityChecker;
import com.lucsartech.tint.pipeline.RunReport;
import com.lucsartech.tint.pipeline.SequentialRunner;
import com.lucsartech.tint.report.ReportGenerator;
import com.lucsartech.tint.report.RunSummaryWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Tint - Spring Boot command line application.
 *
 * <p>Discovers the images of the input directory, runs the sequential baseline and/or the
 * parallel pipeline over them, and prints a timing comparison.
 * Individual file failures never change the exit code; only a run that cannot start does.
 */
@SpringBootApplication
@EnableConfigurationProperties(TintProperties.class)
public class TintApplication implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(TintApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_CANNOT_START = 1;

    private static final String RULE = "═══════════════════════════════════════════════════════════════";
    private static final String THIN_RULE = "───────────────────────────────────────────────────────────────";

    private final TintProperties properties;
    private final ImageDiscovery discovery;
    private final SequentialRunner sequentialRunner;
    private final ImagePipeline pipeline;

    private int exitCode = EXIT_OK;

    public TintApplication(
            TintProperties properties,
            ImageDiscovery discovery,
            SequentialRunner sequentialRunner,
            ImagePipeline pipeline) {
        this.properties = properties;
        this.discovery = discovery;
        this.sequentialRunner = sequentialRunner;
        this.pipeline = pipeline;
    }

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TintApplication.class, args)));
    }

    @Override
    public void run(String... args) {
        var mode = properties.getMode();
        log.info("Starting Tint");
        log.info("Mode: {} | Workers: {} | Input: {} | Extensions: {}",
                mode,
                pipeline.config().workerCount(),
                properties.getInputDirectory(),
                discovery.extensions());

        List<Path> sources;
        try {
            sources = discovery.discover(Path.of(properties.getInputDirectory()));
        } catch (DiscoveryException e) {
            log.error("Cannot start: {}", e.getMessage(), e);
            exitCode = EXIT_CANNOT_START;
            return;
        }

        if (sources.isEmpty()) {
            log.warn("No images found in '{}'", properties.getInputDirectory());
        }
        log.info("Found {} files to process", sources.size());

        var reports = new ArrayList<RunReport>();
        if (mode.runsSequential()) {
            reports.add(sequentialRunner.run(sources));
        }
        if (mode.runsParallel()) {
            reports.add(pipeline.run(sources));
        }

        ParityChecker.ParityResult parity = null;
        if (mode.runsSequential() && mode.runsParallel() && properties.isVerifyParity()) {
            parity = checkParity();
        }

        writeReports(reports, parity);
        printSummary(sources.size(), reports, parity);

        log.info("Tint completed");
    }

    private ParityChecker.ParityResult checkParity() {
        try {
            return ParityChecker.compare(
                    Path.of(properties.getOutput().getSequentialDirectory()),
                    Path.of(properties.getOutput().getParallelDirectory()));
        } catch (IOException e) {
            log.warn("Parity check skipped: {}", e.getMessage());
            return null;
        }
    }

    private void writeReports(List<RunReport> reports, ParityChecker.ParityResult parity) {
        if (!properties.getReport().isEnabled()) {
            log.debug("Report generation is disabled");
            return;
        }

        Path directory = Path.of(properties.getReport().getDirectory());
        try {
            ReportGenerator.generate(directory, properties.getInputDirectory(), reports, parity);
            RunSummaryWriter.write(directory, properties.getInputDirectory(), reports, parity);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to generate report", e);
        }
    }

    private void printSummary(int discovered, List<RunReport> reports, ParityChecker.ParityResult parity) {
        System.out.println();
        System.out.println(RULE);
        System.out.println("                          RUN SUMMARY                           ");
        System.out.println(RULE);
        System.out.printf("  Discovered:       %,d files%n", discovered);

        for (RunReport report : reports) {
            System.out.println(THIN_RULE);
            System.out.printf("  Mode:             %s (%d worker%s)%n",
                    report.mode(), report.workerCount(), report.workerCount() == 1 ? "" : "s");
            System.out.printf("  Elapsed:          %s%n", report.elapsedFormatted());
            System.out.printf("  Succeeded:        %,d%n", report.succeeded());
            System.out.printf("  Failed:           %,d%n", report.failed());
        }

        if (reports.size() == 2) {
            System.out.println(THIN_RULE);
            System.out.printf("  Speedup:          %.2fx%n", reports.get(1).speedupOver(reports.get(0)));
        }
        if (parity != null) {
            System.out.printf("  Output parity:    %s%n", parity.identical()
                    ? "identical (" + parity.compared() + " files)"
                    : parity.mismatched().size() + " of " + parity.compared() + " files differ");
        }
        System.out.println(RULE);
        System.out.println();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
