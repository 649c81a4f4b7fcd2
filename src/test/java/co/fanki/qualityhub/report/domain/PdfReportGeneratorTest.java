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

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link PdfReportGenerator}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PdfReportGeneratorTest {

    private static final Instant GENERATED_AT =
            Instant.parse("2026-01-17T09:30:00Z");

    private final PdfReportGenerator generator = new PdfReportGenerator();

    @Test
    void whenNamingFile_givenReportAndInstant_shouldStampUtcTime() {
        assertEquals("summary-report-20260117-093000.pdf",
                PdfReportGenerator.filename("summary", GENERATED_AT));
    }

    @Test
    void whenFormattingTrend_givenSign_shouldDescribeDirection() {
        assertEquals("+5% (improving)", PdfReportGenerator.formatTrend(5));
        assertEquals("-3% (declining)", PdfReportGenerator.formatTrend(-3));
        assertEquals("0% (stable)", PdfReportGenerator.formatTrend(0));
    }

    @Test
    void whenRenderingSummary_givenReport_shouldProducePdfWithFooter()
            throws IOException {
        final ProjectSummary report = new ProjectSummary("project-1",
                new TestExecutionSummary(12, 10, 6, 2, 1, 0, 0, 1, 67, 90),
                new TestRunSummary(3, 1, 1, 1, 0),
                CoverageStatistics.of(4, 3), GENERATED_AT);

        final ReportExport export = generator.summary(report);

        assertEquals("summary-report-20260117-093000.pdf", export.filename());
        assertPdf(export.content());
        final String text = textOf(export.content());
        assertTrue(text.contains("Page 1 of 1"), text);
        assertTrue(text.contains("Generated by QualityHub"), text);
    }

    @Test
    void whenRenderingCoverage_givenManyRequirements_shouldSpanPages()
            throws IOException {
        final List<RequirementLine> lines = new ArrayList<>();
        for (int i = 0; i < 80; i++) {
            lines.add(new RequirementLine("req-" + i, "REQ-" + i,
                    "Requirement number " + i, RequirementStatus.APPROVED,
                    i % 2));
        }
        final CoverageReport report = new CoverageReport("project-1", 80, 40,
                40, 50, lines, GENERATED_AT);

        final ReportExport export = generator.coverage(report);

        assertPdf(export.content());
        try (PDDocument document = Loader.loadPDF(export.content())) {
            assertTrue(document.getNumberOfPages() > 1);
        }
    }

    @Test
    void whenRenderingDefects_givenNonLatinText_shouldStillRender() {
        final DefectsReport report = new DefectsReport("project-1", 1, 2, 1,
                1, List.of(new DefectLine("BUG-☃-1", 2, 1)),
                GENERATED_AT);

        assertPdf(generator.defects(report).content());
    }

    @Test
    void whenRenderingActivity_givenPeriod_shouldProducePdf() {
        final ActivityReport report = new ActivityReport("project-1",
                LocalDate.of(2026, 1, 1), LocalDate.of(2026, 1, 17), 5,
                List.of(new DailyActivity(LocalDate.of(2026, 1, 2), 5, 4, 1)),
                List.of(new TesterActivity("user-1", 5, 4, 1, 80)),
                GENERATED_AT);

        final ReportExport export = generator.activity(report);

        assertEquals("activity-report-20260117-093000.pdf", export.filename());
        assertPdf(export.content());
    }

    @Test
    void whenRenderingTrends_givenEmptyPeriod_shouldProducePdf() {
        final TrendsReport report = new TrendsReport("project-1",
                LocalDate.of(2026, 1, 1), LocalDate.of(2026, 1, 17),
                List.<ExecutionPoint>of(), List.<DefectPoint>of(), 0, 0,
                GENERATED_AT);

        assertPdf(generator.trends(report).content());
    }

    private static void assertPdf(final byte[] content) {
        assertTrue(content.length > 4);
        assertEquals("%PDF", new String(content, 0, 4,
                StandardCharsets.US_ASCII));
    }

    private static String textOf(final byte[] content) throws IOException {
        try (PDDocument document = Loader.loadPDF(content)) {
            return new PDFTextStripper().getText(document);
        }
    }

}
