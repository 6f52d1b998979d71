package com.lucsartech.tint.report;

import com.itextpdf.kernel.colors.ColorConstants;
import com.itextpdf.kernel.colors.DeviceRgb;
import com.itextpdf.kernel.geom.PageSize;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.layout.Document;
import com.itextpdf.layout.borders.Border;
import com.itextpdf.layout.borders.SolidBorder;
import com.itextpdf.layout.element.Cell;
import com.itextpdf.layout.element.Paragraph;
import com.itextpdf.layout.element.Table;
import com.itextpdf.layout.properties.BorderRadius;
import com.itextpdf.layout.properties.TextAlignment;
import com.itextpdf.layout.properties.UnitValue;
import com.itextpdf.layout.properties.VerticalAlignment;
import com.lucsartech.tint.pipeline.ItemResult;
import com.lucsartech.tint.pipeline.ParityChecker;
import com.lucsartech.tint.pipeline.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * PDF report comparing the runs of one invocation.
 */
public final class ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(ReportGenerator.class);

    // Color palette
    private static final DeviceRgb PRIMARY = new DeviceRgb(59, 130, 246);      // Blue
    private static final DeviceRgb SUCCESS = new DeviceRgb(34, 197, 94);       // Green
    private static final DeviceRgb WARNING = new DeviceRgb(245, 158, 11);      // Orange
    private static final DeviceRgb DANGER = new DeviceRgb(239, 68, 68);        // Red
    private static final DeviceRgb DARK = new DeviceRgb(15, 23, 42);           // Slate 900
    private static final DeviceRgb LIGHT = new DeviceRgb(241, 245, 249);       // Slate 100
    private static final DeviceRgb MUTED = new DeviceRgb(100, 116, 139);       // Slate 500
    private static final DeviceRgb RULE = new DeviceRgb(226, 232, 240);        // Slate 200

    private static final int MAX_FAILURES_SHOWN = 50;

    private static final DateTimeFormatter DTF = DateTimeFormatter
            .ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneId.systemDefault());

    private ReportGenerator() {}

    /**
     * Write a PDF report into {@code directory}.
     *
     * @param parity result of the output comparison, or {@code null} when it was not performed
     * @return the report file
     */
    public static Path generate(Path directory, String inputDirectory, List<RunReport> runs,
                                ParityChecker.ParityResult parity) throws IOException {
        Files.createDirectories(directory);
        Path outputPath = directory.resolve("tint_report_" + System.currentTimeMillis() + ".pdf");

        try (var writer = new PdfWriter(outputPath.toFile());
             var pdf = new PdfDocument(writer);
             var doc = new Document(pdf, PageSize.A4)) {

            doc.setMargins(25, 30, 25, 30);

            addHeader(doc, inputDirectory);
            addRunTable(doc, runs);
            if (runs.size() == 2) {
                addComparison(doc, runs.get(0), runs.get(1), parity);
            }
            for (RunReport run : runs) {
                if (!run.failures().isEmpty()) {
                    addFailures(doc, run);
                }
            }
        }

        log.info("Report generated: {}", outputPath.toAbsolutePath());
        return outputPath;
    }

    private static void addHeader(Document doc, String inputDirectory) {
        doc.add(new Paragraph("Tint Run Report")
                .setFontSize(22)
                .setBold()
                .setFontColor(DARK)
                .setTextAlignment(TextAlignment.CENTER)
                .setMarginBottom(3));

        doc.add(new Paragraph(inputDirectory + "  |  " + DTF.format(Instant.now()))
                .setFontSize(9)
                .setFontColor(MUTED)
                .setTextAlignment(TextAlignment.CENTER)
                .setMarginBottom(12));
    }

    private static void addRunTable(Document doc, List<RunReport> runs) {
        addSectionTitle(doc, "Runs", DARK);

        var table = new Table(UnitValue.createPercentArray(new float[]{1.5f, 1, 1, 1, 1, 1.2f}))
                .useAllAvailableWidth()
                .setMarginBottom(12);

        addHeaderCell(table, "Mode");
        addHeaderCell(table, "Workers");
        addHeaderCell(table, "Discovered");
        addHeaderCell(table, "Succeeded");
        addHeaderCell(table, "Failed");
        addHeaderCell(table, "Elapsed");

        for (RunReport run : runs) {
            addDataCell(table, run.mode(), DARK);
            addDataCell(table, String.valueOf(run.workerCount()), DARK);
            addDataCell(table, String.valueOf(run.discovered()), PRIMARY);
            addDataCell(table, String.valueOf(run.succeeded()), SUCCESS);
            addDataCell(table, String.valueOf(run.failed()), run.failed() > 0 ? DANGER : MUTED);
            addDataCell(table, run.elapsedFormatted(), DARK);
        }

        doc.add(table);
    }

    private static void addComparison(Document doc, RunReport baseline, RunReport candidate,
                                      ParityChecker.ParityResult parity) {
        addSectionTitle(doc, "Comparison", DARK);

        var table = new Table(UnitValue.createPercentArray(new float[]{1, 1, 1}))
                .useAllAvailableWidth()
                .setMarginBottom(12);

        addStatCard(table, "Speedup", String.format("%.2fx", candidate.speedupOver(baseline)), PRIMARY);
        addStatCard(table, "Items/sec (" + candidate.mode() + ")",
                String.format("%.2f", candidate.itemsPerSecond()), SUCCESS);
        if (parity == null) {
            addStatCard(table, "Output parity", "not checked", MUTED);
        } else {
            addStatCard(table, "Output parity",
                    parity.identical() ? "identical" : parity.mismatched().size() + " differ",
                    parity.identical() ? SUCCESS : WARNING);
        }

        doc.add(table);
    }

    private static void addFailures(Document doc, RunReport run) {
        addSectionTitle(doc, "Failed items (" + run.mode() + ")", DANGER);

        var table = new Table(UnitValue.createPercentArray(new float[]{1.5f, 0.8f, 3}))
                .useAllAvailableWidth()
                .setMarginBottom(10);

        List<ItemResult.Failure> failures = run.failures();
        int shown = Math.min(failures.size(), MAX_FAILURES_SHOWN);
        for (int i = 0; i < shown; i++) {
            var failure = failures.get(i);
            addInfoCell(table, failure.sourceIdentifier(), true);
            addInfoCell(table, failure.kind().name(), false);
            addInfoCell(table, String.valueOf(failure.errorMessage()), false);
        }
        doc.add(table);

        if (failures.size() > shown) {
            doc.add(new Paragraph("... and " + (failures.size() - shown) + " more")
                    .setFontSize(8)
                    .setFontColor(MUTED));
        }
    }

    // ========== Helper Methods ==========

    private static void addSectionTitle(Document doc, String title, DeviceRgb color) {
        doc.add(new Paragraph(title)
                .setFontSize(11)
                .setBold()
                .setFontColor(color)
                .setMarginTop(8)
                .setMarginBottom(6));
    }

    private static void addHeaderCell(Table table, String text) {
        table.addHeaderCell(new Cell()
                .add(new Paragraph(text).setFontSize(9).setBold().setFontColor(ColorConstants.WHITE))
                .setBackgroundColor(DARK)
                .setTextAlignment(TextAlignment.CENTER)
                .setPadding(6));
    }

    private static void addDataCell(Table table, String text, DeviceRgb color) {
        table.addCell(new Cell()
                .add(new Paragraph(text).setFontSize(9).setFontColor(color))
                .setTextAlignment(TextAlignment.CENTER)
                .setBorder(new SolidBorder(RULE, 1))
                .setPadding(5));
    }

    private static void addInfoCell(Table table, String text, boolean label) {
        var paragraph = new Paragraph(text).setFontSize(8).setFontColor(label ? DARK : MUTED);
        if (label) {
            paragraph.setBold();
        }
        table.addCell(new Cell()
                .add(paragraph)
                .setBackgroundColor(label ? LIGHT : ColorConstants.WHITE)
                .setBorder(Border.NO_BORDER)
                .setBorderBottom(new SolidBorder(RULE, 1))
                .setPadding(4));
    }

    private static void addStatCard(Table table, String label, String value, DeviceRgb color) {
        var cell = new Cell()
                .setBackgroundColor(new DeviceRgb(248, 250, 252))
                .setBorder(new SolidBorder(RULE, 1))
                .setBorderRadius(new BorderRadius(6))
                .setPadding(8)
                .setTextAlignment(TextAlignment.CENTER)
                .setVerticalAlignment(VerticalAlignment.MIDDLE);

        cell.add(new Paragraph(label)
                .setFontSize(8)
                .setFontColor(MUTED)
                .setMarginBottom(2));

        cell.add(new Paragraph(value)
                .setFontSize(14)
                .setBold()
                .setFontColor(color));

        table.addCell(cell);
    }
}
