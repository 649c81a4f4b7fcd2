package co.fanki.qualityhub.report.domain;

import co.fanki.qualityhub.report.domain.ActivityReport.DailyActivity;
import co.fanki.qualityhub.report.domain.ActivityReport.TesterActivity;
import co.fanki.qualityhub.report.domain.CoverageReport.RequirementLine;
import co.fanki.qualityhub.report.domain.DefectsReport.DefectLine;
import co.fanki.qualityhub.report.domain.TrendsReport.DefectPoint;
import co.fanki.qualityhub.report.domain.TrendsReport.ExecutionPoint;
import co.fanki.qualityhub.requirement.domain.CoverageStatistics;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.PDPageContentStream.AppendMode;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders the project reports as A4 PDF documents.
 *
 * <p>Every document starts with a centered title and a generated-at line,
 * continues with key/value sections and detail tables, and closes each
 * page with a "Page n of m" footer. Detail tables repeat their header on
 * every page they span.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class PdfReportGenerator {

    private static final DateTimeFormatter FILENAME_STAMP = DateTimeFormatter
            .ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private static final DateTimeFormatter GENERATED_AT = DateTimeFormatter
            .ofPattern("MMMM d, yyyy HH:mm 'UTC'", Locale.US)
            .withZone(ZoneOffset.UTC);

    public ReportExport summary(final ProjectSummary report) {
        return render("summary", report.generatedAt(), canvas -> {
            canvas.title("Project Summary Report");
            canvas.generatedAt(report.generatedAt());

            canvas.heading("Test Execution Summary");
            final ProjectSummary.TestExecutionSummary execution =
                    report.testExecution();
            canvas.keyValues(List.of(
                    pair("Total Test Cases", execution.totalTestCases()),
                    pair("Total Test Results", execution.totalTestResults()),
                    pair("Passed", execution.passed()),
                    pair("Failed", execution.failed()),
                    pair("Blocked", execution.blocked()),
                    pair("Skipped", execution.skipped()),
                    pair("Retest", execution.retest()),
                    pair("Untested", execution.untested()),
                    percent("Pass Rate", execution.passRate()),
                    percent("Execution Progress",
                            execution.executionProgress())));

            canvas.heading("Test Run Summary");
            final ProjectSummary.TestRunSummary runs = report.testRuns();
            canvas.keyValues(List.of(
                    pair("Total Test Runs", runs.total()),
                    pair("Not Started", runs.notStarted()),
                    pair("In Progress", runs.inProgress()),
                    pair("Completed", runs.completed()),
                    pair("Aborted", runs.aborted())));

            canvas.heading("Requirement Coverage Summary");
            canvas.keyValues(coverageRows(report.requirementCoverage()));
        });
    }

    public ReportExport coverage(final CoverageReport report) {
        return render("coverage", report.generatedAt(), canvas -> {
            canvas.title("Requirement Coverage Report");
            canvas.generatedAt(report.generatedAt());

            canvas.heading("Coverage Summary");
            canvas.keyValues(coverageRows(new CoverageStatistics(
                    report.totalRequirements(),
                    report.coveredRequirements(),
                    report.uncoveredRequirements(),
                    report.coveragePercentage())));

            if (!report.requirements().isEmpty()) {
                canvas.heading("Requirements Detail");
                final List<String[]> rows = new ArrayList<>();
                for (RequirementLine line : report.requirements()) {
                    rows.add(new String[] {
                            line.externalId() != null
                                    ? line.externalId() : "-",
                            line.title(),
                            line.status().value(),
                            String.valueOf(line.linkedTestCases()),
                            line.isCovered() ? "Yes" : "No"});
                }
                canvas.table(new String[] {"External ID", "Title", "Status",
                        "Test Cases", "Covered"}, rows);
            }
        });
    }

    public ReportExport defects(final DefectsReport report) {
        return render("defects", report.generatedAt(), canvas -> {
            canvas.title("Defects Report");
            canvas.generatedAt(report.generatedAt());

            canvas.heading("Defects Summary");
            canvas.keyValues(List.of(
                    pair("Total Unique Defects", report.totalDefects()),
                    pair("Total Failed Tests", report.totalFailedTests()),
                    pair("Failed Tests with Defects",
                            report.failedTestsWithDefects()),
                    pair("Failed Tests without Defects",
                            report.failedTestsWithoutDefects())));

            if (!report.defects().isEmpty()) {
                canvas.heading("Defects Detail");
                final List<String[]> rows = new ArrayList<>();
                for (DefectLine defect : report.defects()) {
                    rows.add(new String[] {defect.defectId(),
                            String.valueOf(defect.linkedTestResults()),
                            String.valueOf(defect.affectedTestCases())});
                }
                canvas.table(new String[] {"Defect ID",
                        "Linked Test Results", "Affected Test Cases"}, rows);
            }
        });
    }

    public ReportExport activity(final ActivityReport report) {
        return render("activity", report.generatedAt(), canvas -> {
            canvas.title("Activity Report");
            canvas.generatedAt(report.generatedAt());

            canvas.heading("Report Period");
            canvas.keyValues(List.of(
                    new String[] {"Period Start",
                            report.periodStart().toString()},
                    new String[] {"Period End", report.periodEnd().toString()},
                    pair("Total Tests Executed",
                            report.totalTestsExecuted())));

            if (!report.dailyActivity().isEmpty()) {
                canvas.heading("Daily Activity");
                final List<String[]> rows = new ArrayList<>();
                for (DailyActivity day : report.dailyActivity()) {
                    rows.add(new String[] {day.date().toString(),
                            String.valueOf(day.testsExecuted()),
                            String.valueOf(day.passed()),
                            String.valueOf(day.failed())});
                }
                canvas.table(new String[] {"Date", "Tests Executed", "Passed",
                        "Failed"}, rows);
            }

            if (!report.testerActivity().isEmpty()) {
                canvas.heading("Tester Activity");
                final List<String[]> rows = new ArrayList<>();
                for (TesterActivity tester : report.testerActivity()) {
                    rows.add(new String[] {
                            tester.userId() != null
                                    ? tester.userId() : "Unknown",
                            String.valueOf(tester.testsExecuted()),
                            String.valueOf(tester.passed()),
                            String.valueOf(tester.failed()),
                            tester.passRate() + "%"});
                }
                canvas.table(new String[] {"User ID", "Tests Executed",
                        "Passed", "Failed", "Pass Rate"}, rows);
            }
        });
    }

    public ReportExport trends(final TrendsReport report) {
        return render("trends", report.generatedAt(), canvas -> {
            canvas.title("Trends Report");
            canvas.generatedAt(report.generatedAt());

            canvas.heading("Report Summary");
            canvas.keyValues(List.of(
                    new String[] {"Period Start",
                            report.periodStart().toString()},
                    new String[] {"Period End", report.periodEnd().toString()},
                    percent("Average Pass Rate", report.averagePassRate()),
                    new String[] {"Pass Rate Trend",
                            formatTrend(report.passRateTrend())}));

            if (!report.executionTrends().isEmpty()) {
                canvas.heading("Execution Trends");
                final List<String[]> rows = new ArrayList<>();
                for (ExecutionPoint point : report.executionTrends()) {
                    rows.add(new String[] {point.date().toString(),
                            String.valueOf(point.testsExecuted()),
                            String.valueOf(point.passed()),
                            String.valueOf(point.failed()),
                            point.passRate() + "%"});
                }
                canvas.table(new String[] {"Date", "Tests Executed", "Passed",
                        "Failed", "Pass Rate"}, rows);
            }

            if (!report.defectTrends().isEmpty()) {
                canvas.heading("Defect Trends");
                final List<String[]> rows = new ArrayList<>();
                for (DefectPoint point : report.defectTrends()) {
                    rows.add(new String[] {point.date().toString(),
                            String.valueOf(point.newDefects()),
                            String.valueOf(point.cumulativeDefects())});
                }
                canvas.table(new String[] {"Date", "New Defects",
                        "Cumulative Defects"}, rows);
            }
        });
    }

    /**
     * Builds the download filename of a report.
     *
     * @param report the report name, e.g. "summary"
     * @param generatedAt when the report was generated
     * @return e.g. {@code summary-report-20260117-093000.pdf}
     */
    static String filename(final String report, final Instant generatedAt) {
        return report + "-report-" + FILENAME_STAMP.format(generatedAt)
                + ".pdf";
    }

    static String formatTrend(final int value) {
        if (value > 0) {
            return "+" + value + "% (improving)";
        }
        if (value < 0) {
            return value + "% (declining)";
        }
        return "0% (stable)";
    }

    private static List<String[]> coverageRows(
            final CoverageStatistics coverage) {
        return List.of(
                pair("Total Requirements", coverage.totalRequirements()),
                pair("Covered Requirements", coverage.coveredRequirements()),
                pair("Uncovered Requirements",
                        coverage.uncoveredRequirements()),
                percent("Coverage Percentage",
                        coverage.coveragePercentage()));
    }

    private static String[] pair(final String label, final long value) {
        return new String[] {label, String.valueOf(value)};
    }

    private static String[] percent(final String label, final int value) {
        return new String[] {label, value + "%"};
    }

    private ReportExport render(final String report, final Instant generatedAt,
            final Layout layout) {
        try (Canvas canvas = new Canvas()) {
            canvas.newPage();
            layout.draw(canvas);
            return new ReportExport(canvas.finish(),
                    filename(report, generatedAt), ReportExport.PDF);
        } catch (final IOException e) {
            throw new IllegalStateException("Failed to render the " + report
                    + " report", e);
        }
    }

    /** Content of one report. */
    @FunctionalInterface
    private interface Layout {
        void draw(Canvas canvas) throws IOException;
    }

    /**
     * A document being drawn top to bottom. Tracks the current page and the
     * vertical cursor, adding pages as content runs out of room.
     */
    private static final class Canvas implements Closeable {

        private static final PDRectangle PAGE_SIZE = PDRectangle.A4;
        private static final float MARGIN = 50;
        private static final float FOOTER_ZONE = 80;
        private static final float CONTENT_WIDTH =
                PAGE_SIZE.getWidth() - 2 * MARGIN;

        private static final float TITLE = 24;
        private static final float HEADING = 16;
        private static final float BODY = 11;
        private static final float SMALL = 9;

        private static final float KEY_VALUE_ROW = 22;
        private static final float TABLE_HEADER = 25;
        private static final float TABLE_ROW = 20;
        private static final float CELL_PADDING = 5;

        private static final float[] PRIMARY = {0.118f, 0.251f, 0.686f};
        private static final float[] SECONDARY = {0.420f, 0.447f, 0.502f};
        private static final float[] BORDER = {0.898f, 0.906f, 0.922f};
        private static final float[] BACKGROUND = {0.953f, 0.957f, 0.965f};
        private static final float[] TEXT = {0f, 0f, 0f};

        private final PDDocument document = new PDDocument();
        private final PDFont regular = new PDType1Font(
                Standard14Fonts.FontName.HELVETICA);
        private final PDFont bold = new PDType1Font(
                Standard14Fonts.FontName.HELVETICA_BOLD);

        private PDPageContentStream stream;
        private float y;

        void newPage() throws IOException {
            if (stream != null) {
                stream.close();
            }
            final PDPage page = new PDPage(PAGE_SIZE);
            document.addPage(page);
            stream = new PDPageContentStream(document, page);
            y = PAGE_SIZE.getHeight() - MARGIN;
        }

        void title(final String title) throws IOException {
            y -= TITLE;
            final float width = width(bold, TITLE, title);
            text(title, bold, TITLE, (PAGE_SIZE.getWidth() - width) / 2,
                    PRIMARY);
            y -= 12;
            line(MARGIN, PAGE_SIZE.getWidth() - MARGIN, 1f);
            y -= 14;
        }

        void generatedAt(final Instant instant) throws IOException {
            final String text = "Generated: " + GENERATED_AT.format(instant);
            y -= SMALL;
            text(text, regular, SMALL, PAGE_SIZE.getWidth() - MARGIN
                    - width(regular, SMALL, text), SECONDARY);
            y -= 16;
        }

        void heading(final String heading) throws IOException {
            ensureRoom(HEADING + 8 + TABLE_HEADER + TABLE_ROW);
            y -= 10 + HEADING;
            text(heading, bold, HEADING, MARGIN, PRIMARY);
            y -= 8;
        }

        void keyValues(final List<String[]> rows) throws IOException {
            final float column = 200;
            for (String[] row : rows) {
                ensureRoom(KEY_VALUE_ROW);
                final float baseline = y - 15;
                final float saved = y;
                y = baseline;
                text(fit(row[0], regular, BODY, column - 2 * 8), regular,
                        BODY, MARGIN + 8, SECONDARY);
                text(fit(row[1], regular, BODY, column - 2 * 8), regular,
                        BODY, MARGIN + column + 8, TEXT);
                y = saved - KEY_VALUE_ROW;
            }
        }

        void table(final String[] headers, final List<String[]> rows)
                throws IOException {
            final float column = CONTENT_WIDTH / headers.length;
            tableHeader(headers, column);
            for (String[] row : rows) {
                if (y - TABLE_ROW < FOOTER_ZONE) {
                    newPage();
                    tableHeader(headers, column);
                }
                final float top = y;
                y = top - 14;
                for (int i = 0; i < row.length; i++) {
                    text(fit(row[i], regular, SMALL,
                            column - 2 * CELL_PADDING), regular, SMALL,
                            MARGIN + i * column + CELL_PADDING, TEXT);
                }
                y = top - TABLE_ROW;
                line(MARGIN, MARGIN + CONTENT_WIDTH, 0.5f);
            }
        }

        private void tableHeader(final String[] headers, final float column)
                throws IOException {
            stream.setNonStrokingColor(BACKGROUND[0], BACKGROUND[1],
                    BACKGROUND[2]);
            stream.addRect(MARGIN, y - TABLE_HEADER, CONTENT_WIDTH,
                    TABLE_HEADER);
            stream.fill();
            final float top = y;
            y = top - 16;
            for (int i = 0; i < headers.length; i++) {
                text(fit(headers[i], bold, SMALL, column - 2 * CELL_PADDING),
                        bold, SMALL, MARGIN + i * column + CELL_PADDING,
                        PRIMARY);
            }
            y = top - TABLE_HEADER;
        }

        /**
         * Stamps the footer on every page and serializes the document.
         *
         * @return the PDF bytes
         * @throws IOException if the document cannot be written
         */
        byte[] finish() throws IOException {
            stream.close();
            stream = null;
            final int pages = document.getNumberOfPages();
            for (int i = 0; i < pages; i++) {
                final PDPage page = document.getPage(i);
                try (PDPageContentStream footer = new PDPageContentStream(
                        document, page, AppendMode.APPEND, true, true)) {
                    centered(footer, "Page " + (i + 1) + " of " + pages, 50);
                    centered(footer, "Generated by QualityHub", 35);
                }
            }
            final ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        }

        @Override
        public void close() throws IOException {
            if (stream != null) {
                stream.close();
            }
            document.close();
        }

        private void centered(final PDPageContentStream target,
                final String text, final float baseline) throws IOException {
            final float x = (PAGE_SIZE.getWidth()
                    - width(regular, SMALL, text)) / 2;
            target.beginText();
            target.setFont(regular, SMALL);
            target.setNonStrokingColor(SECONDARY[0], SECONDARY[1],
                    SECONDARY[2]);
            target.newLineAtOffset(x, baseline);
            target.showText(text);
            target.endText();
        }

        private void ensureRoom(final float height) throws IOException {
            if (y - height < FOOTER_ZONE) {
                newPage();
            }
        }

        private void text(final String text, final PDFont font,
                final float size, final float x, final float[] color)
                throws IOException {
            stream.beginText();
            stream.setFont(font, size);
            stream.setNonStrokingColor(color[0], color[1], color[2]);
            stream.newLineAtOffset(x, y);
            stream.showText(printable(text));
            stream.endText();
        }

        private void line(final float fromX, final float toX,
                final float lineWidth) throws IOException {
            stream.setStrokingColor(BORDER[0], BORDER[1], BORDER[2]);
            stream.setLineWidth(lineWidth);
            stream.moveTo(fromX, y);
            stream.lineTo(toX, y);
            stream.stroke();
        }

        private String fit(final String text, final PDFont font,
                final float size, final float maxWidth) throws IOException {
            final String value = printable(text);
            if (width(font, size, value) <= maxWidth) {
                return value;
            }
            String cut = value;
            while (!cut.isEmpty()
                    && width(font, size, cut + "...") > maxWidth) {
                cut = cut.substring(0, cut.length() - 1);
            }
            return cut + "...";
        }

        private static float width(final PDFont font, final float size,
                final String text) throws IOException {
            return font.getStringWidth(printable(text)) / 1000f * size;
        }

        /**
         * Replaces what the standard fonts cannot encode.
         *
         * @param text the text, may be null
         * @return the text restricted to Latin-1 printable characters
         */
        static String printable(final String text) {
            if (text == null) {
                return "";
            }
            final StringBuilder out = new StringBuilder(text.length());
            for (int i = 0; i < text.length(); i++) {
                final char c = text.charAt(i);
                if (Character.isWhitespace(c)) {
                    out.append(' ');
                } else if ((c >= 0x20 && c < 0x7F)
                        || (c >= 0xA0 && c <= 0xFF)) {
                    out.append(c);
                } else {
                    out.append('?');
                }
            }
            return out.toString();
        }
    }

}
