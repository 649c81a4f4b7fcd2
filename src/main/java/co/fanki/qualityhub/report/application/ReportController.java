package co.fanki.qualityhub.report.application;

import co.fanki.qualityhub.report.domain.ActivityReport;
import co.fanki.qualityhub.report.domain.CoverageReport;
import co.fanki.qualityhub.report.domain.DefectsReport;
import co.fanki.qualityhub.report.domain.ExcelReportGenerator;
import co.fanki.qualityhub.report.domain.PdfReportGenerator;
import co.fanki.qualityhub.report.domain.ProjectSummary;
import co.fanki.qualityhub.report.domain.ReportExport;
import co.fanki.qualityhub.report.domain.TrendsReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

/**
 * REST controller for project reports, as JSON or as PDF and Excel
 * downloads.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/v1/projects/{projectId}/reports")
@Tag(name = "Reports", description = "Project reports, PDF and Excel exports")
@SecurityRequirement(name = "bearerAuth")
public class ReportController {

    private final ReportService reportService;
    private final PdfReportGenerator pdfReportGenerator;
    private final ExcelReportGenerator excelReportGenerator;

    /**
     * Creates a new ReportController.
     *
     * @param theReportService builds the reports
     * @param thePdfReportGenerator renders them as PDF
     * @param theExcelReportGenerator renders them as Excel workbooks
     */
    public ReportController(final ReportService theReportService,
            final PdfReportGenerator thePdfReportGenerator,
            final ExcelReportGenerator theExcelReportGenerator) {
        this.reportService = theReportService;
        this.pdfReportGenerator = thePdfReportGenerator;
        this.excelReportGenerator = theExcelReportGenerator;
    }

    @Operation(summary = "Execution, run and coverage summary")
    @GetMapping("/summary")
    @PreAuthorize("hasAuthority('view_reports')")
    public ResponseEntity<ProjectSummary> summary(
            @PathVariable("projectId") final String projectId) {
        return ResponseEntity.ok(reportService.summary(projectId));
    }

    @Operation(summary = "Requirement coverage report")
    @GetMapping("/coverage")
    @PreAuthorize("hasAuthority('view_reports')")
    public ResponseEntity<CoverageReport> coverage(
            @PathVariable("projectId") final String projectId) {
        return ResponseEntity.ok(reportService.coverage(projectId));
    }

    @Operation(summary = "Defects linked to results")
    @GetMapping("/defects")
    @PreAuthorize("hasAuthority('view_reports')")
    public ResponseEntity<DefectsReport> defects(
            @PathVariable("projectId") final String projectId) {
        return ResponseEntity.ok(reportService.defects(projectId));
    }

    @Operation(summary = "Daily and per-tester activity in a period")
    @GetMapping("/activity")
    @PreAuthorize("hasAuthority('view_reports')")
    public ResponseEntity<ActivityReport> activity(
            @PathVariable("projectId") final String projectId,
            @Parameter(description = "First day, defaults to 30 days "
                    + "before the end", example = "2024-01-01")
            @RequestParam(name = "startDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
            final LocalDate startDate,
            @Parameter(description = "Last day, defaults to today",
                    example = "2024-01-31")
            @RequestParam(name = "endDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
            final LocalDate endDate) {
        return ResponseEntity.ok(reportService.activity(projectId, startDate,
                endDate));
    }

    @Operation(summary = "Pass rate and defect trends in a period")
    @GetMapping("/trends")
    @PreAuthorize("hasAuthority('view_reports')")
    public ResponseEntity<TrendsReport> trends(
            @PathVariable("projectId") final String projectId,
            @RequestParam(name = "startDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
            final LocalDate startDate,
            @RequestParam(name = "endDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
            final LocalDate endDate) {
        return ResponseEntity.ok(reportService.trends(projectId, startDate,
                endDate));
    }

    @Operation(summary = "Summary report as PDF")
    @GetMapping("/summary/pdf")
    @PreAuthorize("hasAuthority('export_reports')")
    public ResponseEntity<byte[]> summaryPdf(
            @PathVariable("projectId") final String projectId) {
        return download(pdfReportGenerator.summary(
                reportService.summary(projectId)));
    }

    @Operation(summary = "Coverage report as PDF")
    @GetMapping("/coverage/pdf")
    @PreAuthorize("hasAuthority('export_reports')")
    public ResponseEntity<byte[]> coveragePdf(
            @PathVariable("projectId") final String projectId) {
        return download(pdfReportGenerator.coverage(
                reportService.coverage(projectId)));
    }

    @Operation(summary = "Defects report as PDF")
    @GetMapping("/defects/pdf")
    @PreAuthorize("hasAuthority('export_reports')")
    public ResponseEntity<byte[]> defectsPdf(
            @PathVariable("projectId") final String projectId) {
        return download(pdfReportGenerator.defects(
                reportService.defects(projectId)));
    }

    @Operation(summary = "Activity report as PDF")
    @GetMapping("/activity/pdf")
    @PreAuthorize("hasAuthority('export_reports')")
    public ResponseEntity<byte[]> activityPdf(
            @PathVariable("projectId") final String projectId,
            @RequestParam(name = "startDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
            final LocalDate startDate,
            @RequestParam(name = "endDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
            final LocalDate endDate) {
        return download(pdfReportGenerator.activity(
                reportService.activity(projectId, startDate, endDate)));
    }

    @Operation(summary = "Trends report as PDF")
    @GetMapping("/trends/pdf")
    @PreAuthorize("hasAuthority('export_reports')")
    public ResponseEntity<byte[]> trendsPdf(
            @PathVariable("projectId") final String projectId,
            @RequestParam(name = "startDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
            final LocalDate startDate,
            @RequestParam(name = "endDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
            final LocalDate endDate) {
        return download(pdfReportGenerator.trends(
                reportService.trends(projectId, startDate, endDate)));
    }

    @Operation(summary = "Summary report as Excel")
    @GetMapping("/summary/excel")
    @PreAuthorize("hasAuthority('export_reports')")
    public ResponseEntity<byte[]> summaryExcel(
            @PathVariable("projectId") final String projectId) {
        return download(excelReportGenerator.summary(
                reportService.summary(projectId)));
    }

    @Operation(summary = "Coverage report as Excel")
    @GetMapping("/coverage/excel")
    @PreAuthorize("hasAuthority('export_reports')")
    public ResponseEntity<byte[]> coverageExcel(
            @PathVariable("projectId") final String projectId) {
        return download(excelReportGenerator.coverage(
                reportService.coverage(projectId)));
    }

    @Operation(summary = "Defects report as Excel")
    @GetMapping("/defects/excel")
    @PreAuthorize("hasAuthority('export_reports')")
    public ResponseEntity<byte[]> defectsExcel(
            @PathVariable("projectId") final String projectId) {
        return download(excelReportGenerator.defects(
                reportService.defects(projectId)));
    }

    @Operation(summary = "Activity report as Excel")
    @GetMapping("/activity/excel")
    @PreAuthorize("hasAuthority('export_reports')")
    public ResponseEntity<byte[]> activityExcel(
            @PathVariable("projectId") final String projectId,
            @RequestParam(name = "startDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
            final LocalDate startDate,
            @RequestParam(name = "endDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
            final LocalDate endDate) {
        return download(excelReportGenerator.activity(
                reportService.activity(projectId, startDate, endDate)));
    }

    @Operation(summary = "Trends report as Excel")
    @GetMapping("/trends/excel")
    @PreAuthorize("hasAuthority('export_reports')")
    public ResponseEntity<byte[]> trendsExcel(
            @PathVariable("projectId") final String projectId,
            @RequestParam(name = "startDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
            final LocalDate startDate,
            @RequestParam(name = "endDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
            final LocalDate endDate) {
        return download(excelReportGenerator.trends(
                reportService.trends(projectId, startDate, endDate)));
    }

    private static ResponseEntity<byte[]> download(final ReportExport export) {
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(export.contentType()))
                .contentLength(export.content().length)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition
                        .attachment()
                        .filename(export.filename())
                        .build()
                        .toString())
                .body(export.content());
    }

}
