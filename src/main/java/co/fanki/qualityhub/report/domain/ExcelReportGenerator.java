package co.fanki.qualityhub.report.domain;

import co.fanki.qualityhub.report.domain.ActivityReport.DailyActivity;
import co.fanki.qualityhub.report.domain.ActivityReport.TesterActivity;
import co.fanki.qualityhub.report.domain.CoverageReport.RequirementLine;
import co.fanki.qualityhub.report.domain.DefectsReport.DefectLine;
import co.fanki.qualityhub.report.domain.TrendsReport.DefectPoint;
import co.fanki.qualityhub.report.domain.TrendsReport.ExecutionPoint;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders the project reports as Excel workbooks.
 *
 * <p>The first sheet of every workbook holds the title, the generated-at
 * line and the key/value sections. Each detail table gets its own sheet
 * with a styled header row, and only when it has rows. Counts are written
 * as numeric cells, percentages as text.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class ExcelReportGenerator {

    private static final DateTimeFormatter FILENAME_STAMP = DateTimeFormatter
            .ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private static final DateTimeFormatter GENERATED_AT = DateTimeFormatter
            .ofPattern("MMMM d, yyyy HH:mm 'UTC'", Locale.US)
            .withZone(ZoneOffset.UTC);

    /** Column width unit of a character, in 1/256 of a character. */
    private static final int CHAR_WIDTH = 256;

    private static final int MIN_COLUMN_CHARS = 12;

    private static final int MAX_COLUMN_CHARS = 60;

    public ReportExport summary(final ProjectSummary report) {
        return render("summary", report.generatedAt(), book -> {
            final Sheet sheet = book.summarySheet("Summary",
                    "Project Summary Report");

            final ProjectSummary.TestExecutionSummary execution =
                    report.testExecution();
            book.section(sheet, "Test Execution Summary", List.of(
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

            final ProjectSummary.TestRunSummary runs = report.testRuns();
            book.section(sheet, "Test Run Summary", List.of(
                    pair("Total Test Runs", runs.total()),
                    pair("Not Started", runs.notStarted()),
                    pair("In Progress", runs.inProgress()),
                    pair("Completed", runs.completed()),
                    pair("Aborted", runs.aborted())));

            book.section(sheet, "Requirement Coverage Summary", List.of(
                    pair("Total Requirements",
                            report.requirementCoverage().totalRequirements()),
                    pair("Covered Requirements",
                            report.requirementCoverage()
                                    .coveredRequirements()),
                    pair("Uncovered Requirements",
                            report.requirementCoverage()
                                    .uncoveredRequirements()),
                    percent("Coverage Percentage",
                            report.requirementCoverage()
                                    .coveragePercentage())));
        });
    }

    public ReportExport coverage(final CoverageReport report) {
        return render("coverage", report.generatedAt(), book -> {
            final Sheet sheet = book.summarySheet("Coverage Summary",
                    "Requirement Coverage Report");
            book.section(sheet, "Coverage Summary", List.of(
                    pair("Total Requirements", report.totalRequirements()),
                    pair("Covered Requirements", report.coveredRequirements()),
                    pair("Uncovered Requirements",
                            report.uncoveredRequirements()),
                    percent("Coverage Percentage",
                            report.coveragePercentage())));

            if (!report.requirements().isEmpty()) {
                final List<Object[]> rows = new ArrayList<>();
                for (RequirementLine line : report.requirements()) {
                    rows.add(new Object[] {
                            line.externalId() != null
                                    ? line.externalId() : "-",
                            line.title(),
                            line.status().value(),
                            line.linkedTestCases(),
                            line.isCovered() ? "Yes" : "No"});
                }
                book.table("Requirements Detail", new String[] {
                        "External ID", "Title", "Status",
                        "Linked Test Cases", "Covered"}, rows);
            }
        });
    }

    public ReportExport defects(final DefectsReport report) {
        return render("defects", report.generatedAt(), book -> {
            final Sheet sheet = book.summarySheet("Defects Summary",
                    "Defects Report");
            book.section(sheet, "Defects Summary", List.of(
                    pair("Total Unique Defects", report.totalDefects()),
                    pair("Total Failed Tests", report.totalFailedTests()),
                    pair("Failed Tests with Defects",
                            report.failedTestsWithDefects()),
                    pair("Failed Tests without Defects",
                            report.failedTestsWithoutDefects())));

            if (!report.defects().isEmpty()) {
                final List<Object[]> rows = new ArrayList<>();
                for (DefectLine defect : report.defects()) {
                    rows.add(new Object[] {defect.defectId(),
                            defect.linkedTestResults(),
                            defect.affectedTestCases()});
                }
                book.table("Defects Detail", new String[] {"Defect ID",
                        "Linked Test Results", "Affected Test Cases"}, rows);
            }
        });
    }

    public ReportExport activity(final ActivityReport report) {
        return render("activity", report.generatedAt(), book -> {
            final Sheet sheet = book.summarySheet("Activity Summary",
                    "Activity Report");
            book.section(sheet, "Report Period", List.of(
                    new Object[] {"Period Start",
                            report.periodStart().toString()},
                    new Object[] {"Period End", report.periodEnd().toString()},
                    pair("Total Tests Executed",
                            report.totalTestsExecuted())));

            if (!report.dailyActivity().isEmpty()) {
                final List<Object[]> rows = new ArrayList<>();
                for (DailyActivity day : report.dailyActivity()) {
                    rows.add(new Object[] {day.date().toString(),
                            day.testsExecuted(), day.passed(), day.failed()});
                }
                book.table("Daily Activity", new String[] {"Date",
                        "Tests Executed", "Passed", "Failed"}, rows);
            }

            if (!report.testerActivity().isEmpty()) {
                final List<Object[]> rows = new ArrayList<>();
                for (TesterActivity tester : report.testerActivity()) {
                    rows.add(new Object[] {
                            tester.userId() != null
                                    ? tester.userId() : "Unknown",
                            tester.testsExecuted(), tester.passed(),
                            tester.failed(), tester.passRate() + "%"});
                }
                book.table("Tester Activity", new String[] {"User ID",
                        "Tests Executed", "Passed", "Failed", "Pass Rate"},
                        rows);
            }
        });
    }

    public ReportExport trends(final TrendsReport report) {
        return render("trends", report.generatedAt(), book -> {
            final Sheet sheet = book.summarySheet("Trends Summary",
                    "Trends Report");
            book.section(sheet, "Report Summary", List.of(
                    new Object[] {"Period Start",
                            report.periodStart().toString()},
                    new Object[] {"Period End", report.periodEnd().toString()},
                    percent("Average Pass Rate", report.averagePassRate()),
                    new Object[] {"Pass Rate Trend",
                            PdfReportGenerator.formatTrend(
                                    report.passRateTrend())}));

            if (!report.executionTrends().isEmpty()) {
                final List<Object[]> rows = new ArrayList<>();
                for (ExecutionPoint point : report.executionTrends()) {
                    rows.add(new Object[] {point.date().toString(),
                            point.testsExecuted(), point.passed(),
                            point.failed(), point.passRate() + "%"});
                }
                book.table("Execution Trends", new String[] {"Date",
                        "Tests Executed", "Passed", "Failed", "Pass Rate"},
                        rows);
            }

            if (!report.defectTrends().isEmpty()) {
                final List<Object[]> rows = new ArrayList<>();
                for (DefectPoint point : report.defectTrends()) {
                    rows.add(new Object[] {point.date().toString(),
                            point.newDefects(), point.cumulativeDefects()});
                }
                book.table("Defect Trends", new String[] {"Date",
                        "New Defects", "Cumulative Defects"}, rows);
            }
        });
    }

    /**
     * Builds the download filename of a report.
     *
     * @param report the report name, e.g. "summary"
     * @param generatedAt when the report was generated
     * @return e.g. {@code summary-report-20260117-093000.xlsx}
     */
    static String filename(final String report, final Instant generatedAt) {
        return report + "-report-" + FILENAME_STAMP.format(generatedAt)
                + ".xlsx";
    }

    private static Object[] pair(final String label, final long value) {
        return new Object[] {label, value};
    }

    private static Object[] percent(final String label, final int value) {
        return new Object[] {label, value + "%"};
    }

    private ReportExport render(final String report, final Instant generatedAt,
            final Layout layout) {
        try (Book book = new Book(generatedAt)) {
            layout.fill(book);
            return new ReportExport(book.finish(),
                    filename(report, generatedAt), ReportExport.XLSX);
        } catch (final IOException e) {
            throw new IllegalStateException("Failed to render the " + report
                    + " report", e);
        }
    }

    /** Content of one report. */
    @FunctionalInterface
    private interface Layout {
        void fill(Book book);
    }

    /** A workbook being filled, with the styles its sheets share. */
    private static final class Book implements AutoCloseable {

        private final XSSFWorkbook workbook = new XSSFWorkbook();
        private final Instant generatedAt;
        private final CellStyle titleStyle;
        private final CellStyle sectionStyle;
        private final CellStyle headerStyle;
        private final CellStyle labelStyle;

        Book(final Instant theGeneratedAt) {
            this.generatedAt = theGeneratedAt;
            titleStyle = style(16, true, null, null);
            sectionStyle = style(12, true, IndexedColors.DARK_BLUE, null);
            headerStyle = style(11, true, IndexedColors.WHITE,
                    IndexedColors.DARK_BLUE);
            labelStyle = style(11, true, null, null);
        }

        Sheet summarySheet(final String name, final String title) {
            final Sheet sheet = workbook.createSheet(name);
            text(sheet.createRow(0), 0, title, titleStyle);
            text(sheet.createRow(1), 0, "Generated: "
                    + GENERATED_AT.format(generatedAt), null);
            return sheet;
        }

        /** Appends a heading and its label/value rows after a blank row. */
        void section(final Sheet sheet, final String heading,
                final List<Object[]> rows) {
            int next = sheet.getLastRowNum() + 2;
            text(sheet.createRow(next++), 0, heading, sectionStyle);
            for (Object[] values : rows) {
                final Row row = sheet.createRow(next++);
                text(row, 0, String.valueOf(values[0]), labelStyle);
                value(row, 1, values[1]);
            }
            fitColumns(sheet, 2);
        }

        void table(final String name, final String[] headers,
                final List<Object[]> rows) {
            final Sheet sheet = workbook.createSheet(name);
            final Row header = sheet.createRow(0);
            for (int i = 0; i < headers.length; i++) {
                text(header, i, headers[i], headerStyle);
            }
            int next = 1;
            for (Object[] values : rows) {
                final Row row = sheet.createRow(next++);
                for (int i = 0; i < values.length; i++) {
                    value(row, i, values[i]);
                }
            }
            sheet.createFreezePane(0, 1);
            fitColumns(sheet, headers.length);
        }

        byte[] finish() throws IOException {
            final ByteArrayOutputStream out = new ByteArrayOutputStream();
            workbook.write(out);
            return out.toByteArray();
        }

        @Override
        public void close() throws IOException {
            workbook.close();
        }

        private void value(final Row row, final int column,
                final Object value) {
            if (value instanceof Number number) {
                row.createCell(column).setCellValue(number.doubleValue());
            } else {
                text(row, column, value != null ? value.toString() : "",
                        null);
            }
        }

        private static void text(final Row row, final int column,
                final String value, final CellStyle style) {
            final Cell cell = row.createCell(column);
            cell.setCellValue(value);
            if (style != null) {
                cell.setCellStyle(style);
            }
        }

        /** Sizes columns from the longest text they hold, within bounds. */
        private static void fitColumns(final Sheet sheet, final int columns) {
            for (int column = 0; column < columns; column++) {
                int longest = MIN_COLUMN_CHARS;
                for (Row row : sheet) {
                    final Cell cell = row.getCell(column);
                    if (cell != null) {
                        longest = Math.max(longest,
                                cell.toString().length() + 2);
                    }
                }
                sheet.setColumnWidth(column,
                        Math.min(longest, MAX_COLUMN_CHARS) * CHAR_WIDTH);
            }
        }

        private CellStyle style(final int points, final boolean bold,
                final IndexedColors color, final IndexedColors fill) {
            final Font font = workbook.createFont();
            font.setFontHeightInPoints((short) points);
            font.setBold(bold);
            if (color != null) {
                font.setColor(color.getIndex());
            }
            final CellStyle style = workbook.createCellStyle();
            style.setFont(font);
            if (fill != null) {
                style.setFillForegroundColor(fill.getIndex());
                style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
            }
            return style;
        }
    }

}
