package co.fanki.qualityhub.report.domain;

import co.fanki.qualityhub.report.domain.ActivityReport.DailyActivity;
import co.fanki.qualityhub.report.domain.ActivityReport.TesterActivity;
import co.fanki.qualityhub.report.domain.CoverageReport.RequirementLine;
import co.fanki.qualityhub.report.domain.DefectsReport.DefectLine;
import co.fanki.qualityhub.report.domain.ProjectSummary.TestExecutionSummary;
import co.fanki.qualityhub.report.domain.ProjectSummary.TestRunSummary;
import co.fanki.qualityhub.report.domain.TrendsReport.DefectPoint;
import co.fanki.qualityhub.report.domain.TrendsReport.ExecutionPoint;
import co.fanki.qualityhub.requirement.domain.CoverageStatistics;
import co.fanki.qualityhub.requirement.domain.RequirementStatus;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Unit tests for {@link ExcelReportGenerator}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ExcelReportGeneratorTest {

    private static final Instant GENERATED_AT =
            Instant.parse("2026-01-17T09:30:00Z");

    private final ExcelReportGenerator generator = new ExcelReportGenerator();

    @Test
    void whenNamingFile_givenReportAndInstant_shouldStampUtcTime() {
        assertEquals("defects-report-20260117-093000.xlsx",
                ExcelReportGenerator.filename("defects", GENERATED_AT));
    }

    @Test
    void whenRenderingSummary_givenReport_shouldWriteSectionsAsCells()
            throws IOException {
        final ProjectSummary report = new ProjectSummary("project-1",
                new TestExecutionSummary(12, 10, 6, 2, 1, 0, 0, 1, 67, 90),
                new TestRunSummary(3, 1, 1, 1, 0),
                CoverageStatistics.of(4, 3), GENERATED_AT);

        final ReportExport export = generator.summary(report);

        assertEquals("summary-report-20260117-093000.xlsx", export.filename());
        assertEquals(ReportExport.XLSX, export.contentType());
        try (XSSFWorkbook workbook = read(export)) {
            assertEquals(1, workbook.getNumberOfSheets());
            final Sheet sheet = workbook.getSheet("Summary");
            assertEquals("Project Summary Report",
                    sheet.getRow(0).getCell(0).getStringCellValue());
            assertEquals("Generated: January 17, 2026 09:30 UTC",
                    sheet.getRow(1).getCell(0).getStringCellValue());
            assertNull(sheet.getRow(2));
            assertEquals("Test Execution Summary",
                    sheet.getRow(3).getCell(0).getStringCellValue());
            assertEquals("Total Test Cases",
                    sheet.getRow(4).getCell(0).getStringCellValue());
            assertEquals(12, sheet.getRow(4).getCell(1).getNumericCellValue());
            assertEquals("67%", valueOf(sheet, "Pass Rate"));
            assertEquals("75%", valueOf(sheet, "Coverage Percentage"));
        }
    }

    @Test
    void whenRenderingCoverage_givenRequirements_shouldAddDetailSheet()
            throws IOException {
        final CoverageReport report = new CoverageReport("project-1", 2, 1, 1,
                50, List.of(
                        new RequirementLine("req-1", null, "Password reset",
                                RequirementStatus.APPROVED, 2),
                        new RequirementLine("req-2", "REQ-2", "Audit log",
                                RequirementStatus.DRAFT, 0)),
                GENERATED_AT);

        try (XSSFWorkbook workbook = read(generator.coverage(report))) {
            assertEquals(2, workbook.getNumberOfSheets());
            final Sheet detail = workbook.getSheet("Requirements Detail");
            assertEquals("External ID",
                    detail.getRow(0).getCell(0).getStringCellValue());
            assertEquals("-", detail.getRow(1).getCell(0)
                    .getStringCellValue());
            assertEquals(2, detail.getRow(1).getCell(3)
                    .getNumericCellValue());
            assertEquals("Yes", detail.getRow(1).getCell(4)
                    .getStringCellValue());
            assertEquals("No", detail.getRow(2).getCell(4)
                    .getStringCellValue());
        }
    }

    @Test
    void whenRenderingDefects_givenNoDefects_shouldSkipDetailSheet()
            throws IOException {
        final DefectsReport report = new DefectsReport("project-1", 0, 3, 0,
                3, List.<DefectLine>of(), GENERATED_AT);

        try (XSSFWorkbook workbook = read(generator.defects(report))) {
            assertEquals(1, workbook.getNumberOfSheets());
            assertNull(workbook.getSheet("Defects Detail"));
            assertEquals(3.0, Double.parseDouble(valueOf(
                    workbook.getSheet("Defects Summary"),
                    "Failed Tests without Defects")));
        }
    }

    @Test
    void whenRenderingActivity_givenUnknownTester_shouldLabelIt()
            throws IOException {
        final ActivityReport report = new ActivityReport("project-1",
                LocalDate.of(2026, 1, 1), LocalDate.of(2026, 1, 17), 5,
                List.of(new DailyActivity(LocalDate.of(2026, 1, 2), 5, 4, 1)),
                List.of(new TesterActivity(null, 5, 4, 1, 80)),
                GENERATED_AT);

        try (XSSFWorkbook workbook = read(generator.activity(report))) {
            assertEquals(3, workbook.getNumberOfSheets());
            final Sheet testers = workbook.getSheet("Tester Activity");
            assertEquals("Unknown", testers.getRow(1).getCell(0)
                    .getStringCellValue());
            assertEquals("80%", testers.getRow(1).getCell(4)
                    .getStringCellValue());
            assertEquals("2026-01-02", workbook.getSheet("Daily Activity")
                    .getRow(1).getCell(0).getStringCellValue());
        }
    }

    @Test
    void whenRenderingTrends_givenPoints_shouldDescribeTrend()
            throws IOException {
        final TrendsReport report = new TrendsReport("project-1",
                LocalDate.of(2026, 1, 1), LocalDate.of(2026, 1, 17),
                List.of(new ExecutionPoint(LocalDate.of(2026, 1, 2), 80, 5, 4,
                        1)),
                List.of(new DefectPoint(LocalDate.of(2026, 1, 2), 2, 2)),
                80, -5, GENERATED_AT);

        try (XSSFWorkbook workbook = read(generator.trends(report))) {
            assertNotNull(workbook.getSheet("Execution Trends"));
            assertNotNull(workbook.getSheet("Defect Trends"));
            assertEquals("-5% (declining)", valueOf(
                    workbook.getSheet("Trends Summary"), "Pass Rate Trend"));
        }
    }

    private static XSSFWorkbook read(final ReportExport export)
            throws IOException {
        return new XSSFWorkbook(new ByteArrayInputStream(export.content()));
    }

    private static String valueOf(final Sheet sheet, final String label) {
        for (Row row : sheet) {
            if (row.getCell(0) != null && row.getCell(1) != null
                    && label.equals(row.getCell(0).getStringCellValue())) {
                return row.getCell(1).toString();
            }
        }
        throw new AssertionError("No row labelled " + label);
    }

}
