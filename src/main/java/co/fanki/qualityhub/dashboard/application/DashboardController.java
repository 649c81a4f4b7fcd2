package co.fanki.qualityhub.dashboard.application;

import co.fanki.qualityhub.auth.domain.AuthenticatedUser;
import co.fanki.qualityhub.dashboard.domain.ActivityFeed;
import co.fanki.qualityhub.dashboard.domain.DashboardStats;
import co.fanki.qualityhub.dashboard.domain.ProjectDashboard;
import co.fanki.qualityhub.dashboard.domain.ProjectDashboard.CoverageWidget;
import co.fanki.qualityhub.dashboard.domain.ProjectDashboard.DefectsWidget;
import co.fanki.qualityhub.dashboard.domain.ProjectDashboard.RecentActivityWidget;
import co.fanki.qualityhub.dashboard.domain.ProjectDashboard.TestExecutionWidget;
import co.fanki.qualityhub.dashboard.domain.ProjectDashboard.TestRunsWidget;
import co.fanki.qualityhub.dashboard.domain.ProjectDashboard.TrendsWidget;
import co.fanki.qualityhub.dashboard.domain.TodoList;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the project dashboard and its widgets.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/v1/projects/{projectId}/dashboard")
@Tag(name = "Dashboard", description = "Project dashboard widgets")
@SecurityRequirement(name = "bearerAuth")
public class DashboardController {

    private final DashboardService dashboardService;

    /**
     * Creates a new DashboardController.
     *
     * @param theDashboardService computes the widgets
     */
    public DashboardController(final DashboardService theDashboardService) {
        this.dashboardService = theDashboardService;
    }

    @Operation(summary = "Every dashboard widget at once")
    @GetMapping
    @PreAuthorize("hasAuthority('view_project')")
    public ResponseEntity<ProjectDashboard> dashboard(
            @PathVariable("projectId") final String projectId) {
        return ResponseEntity.ok(dashboardService.dashboard(projectId));
    }

    @Operation(summary = "Headline numbers of the project")
    @GetMapping("/stats")
    @PreAuthorize("hasAuthority('view_project')")
    public ResponseEntity<DashboardStats> stats(
            @PathVariable("projectId") final String projectId) {
        return ResponseEntity.ok(dashboardService.stats(projectId));
    }

    @Operation(summary = "Latest executions, runs and milestones")
    @GetMapping("/activity")
    @PreAuthorize("hasAuthority('view_project')")
    public ResponseEntity<ActivityFeed> activity(
            @PathVariable("projectId") final String projectId,
            @Parameter(description = "Maximum number of events")
            @RequestParam(name = "limit", defaultValue = "20")
            final int limit) {
        return ResponseEntity.ok(dashboardService.activity(projectId, limit));
    }

    @Operation(summary = "Pending work, most urgent first")
    @GetMapping("/todo")
    @PreAuthorize("hasAuthority('view_project')")
    public ResponseEntity<TodoList> todo(
            @PathVariable("projectId") final String projectId,
            @Parameter(description = "Only runs assigned to the caller")
            @RequestParam(name = "mine", defaultValue = "false")
            final boolean mine,
            @AuthenticationPrincipal final AuthenticatedUser caller) {
        return ResponseEntity.ok(dashboardService.todo(projectId,
                mine ? caller.userId() : null));
    }

    @Operation(summary = "Test execution widget")
    @GetMapping("/widgets/test-execution")
    @PreAuthorize("hasAuthority('view_project')")
    public ResponseEntity<TestExecutionWidget> testExecution(
            @PathVariable("projectId") final String projectId) {
        return ResponseEntity.ok(dashboardService.testExecution(projectId));
    }

    @Operation(summary = "Test runs widget")
    @GetMapping("/widgets/test-runs")
    @PreAuthorize("hasAuthority('view_project')")
    public ResponseEntity<TestRunsWidget> testRuns(
            @PathVariable("projectId") final String projectId) {
        return ResponseEntity.ok(dashboardService.testRuns(projectId));
    }

    @Operation(summary = "Recent activity widget")
    @GetMapping("/widgets/recent-activity")
    @PreAuthorize("hasAuthority('view_project')")
    public ResponseEntity<RecentActivityWidget> recentActivity(
            @PathVariable("projectId") final String projectId) {
        return ResponseEntity.ok(dashboardService.recentActivity(projectId));
    }

    @Operation(summary = "Requirement coverage widget")
    @GetMapping("/widgets/coverage")
    @PreAuthorize("hasAuthority('view_project')")
    public ResponseEntity<CoverageWidget> coverage(
            @PathVariable("projectId") final String projectId) {
        return ResponseEntity.ok(dashboardService.coverage(projectId));
    }

    @Operation(summary = "Defects widget")
    @GetMapping("/widgets/defects")
    @PreAuthorize("hasAuthority('view_project')")
    public ResponseEntity<DefectsWidget> defects(
            @PathVariable("projectId") final String projectId) {
        return ResponseEntity.ok(dashboardService.defects(projectId));
    }

    @Operation(summary = "Pass rate trends widget")
    @GetMapping("/widgets/trends")
    @PreAuthorize("hasAuthority('view_project')")
    public ResponseEntity<TrendsWidget> trends(
            @PathVariable("projectId") final String projectId,
            @Parameter(description = "Days to look back, 1 to 365")
            @RequestParam(name = "periodDays", defaultValue = "7")
            final int periodDays) {
        return ResponseEntity.ok(dashboardService.trends(projectId,
                periodDays));
    }

}
