package co.fanki.qualityhub.run.application;

import co.fanki.qualityhub.auth.domain.AuthenticatedUser;
import co.fanki.qualityhub.run.application.TestRunService.RunProgress;
import co.fanki.qualityhub.run.application.TestRunService.RunStatistics;
import co.fanki.qualityhub.run.domain.TestResult;
import co.fanki.qualityhub.run.domain.TestResultStatus;
import co.fanki.qualityhub.run.domain.TestRun;
import co.fanki.qualityhub.run.domain.TestRunStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST controller for test runs and their results.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/v1/projects/{projectId}/runs")
@Tag(name = "Test Runs", description = "Executions of test cases")
@SecurityRequirement(name = "bearerAuth")
public class TestRunController {

    private final TestRunService runService;

    /**
     * Creates a new TestRunController.
     *
     * @param theRunService the test run service
     */
    public TestRunController(final TestRunService theRunService) {
        this.runService = theRunService;
    }

    @Operation(summary = "Create a test run")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "404", description = "Test plan not found")
    })
    @PostMapping
    @PreAuthorize("hasAuthority('create_test_run')")
    public ResponseEntity<RunResponse> create(
            @PathVariable("projectId") final String projectId,
            @Valid @RequestBody final CreateRunRequest request) {
        final TestRun run = runService.create(projectId, request.testPlanId(),
                request.name(), request.description(), request.config(),
                request.assigneeId());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(RunResponse.from(run));
    }

    @Operation(summary = "List the project's test runs")
    @GetMapping
    @PreAuthorize("hasAuthority('view_test_run')")
    public ResponseEntity<List<RunResponse>> list(
            @PathVariable("projectId") final String projectId) {
        return ResponseEntity.ok(runService.findByProject(projectId).stream()
                .map(RunResponse::from)
                .toList());
    }

    @Operation(summary = "Get a test run")
    @GetMapping("/{runId}")
    @PreAuthorize("hasAuthority('view_test_run')")
    public ResponseEntity<RunResponse> get(
            @PathVariable("projectId") final String projectId,
            @PathVariable("runId") final String runId) {
        return ResponseEntity.ok(RunResponse.from(
                runService.getById(projectId, runId)));
    }

    @Operation(summary = "Update a test run")
    @PatchMapping("/{runId}")
    @PreAuthorize("hasAuthority('update_test_run')")
    public ResponseEntity<RunResponse> update(
            @PathVariable("projectId") final String projectId,
            @PathVariable("runId") final String runId,
            @Valid @RequestBody final UpdateRunRequest request) {
        return ResponseEntity.ok(RunResponse.from(runService.update(
                projectId, runId, request.name(), request.description(),
                request.config(), request.assigneeId(), request.status())));
    }

    @Operation(summary = "Soft delete a test run")
    @DeleteMapping("/{runId}")
    @PreAuthorize("hasAuthority('delete_test_run')")
    public ResponseEntity<Void> delete(
            @PathVariable("projectId") final String projectId,
            @PathVariable("runId") final String runId) {
        runService.delete(projectId, runId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Start a test run")
    @PostMapping("/{runId}/start")
    @PreAuthorize("hasAuthority('execute_test_run')")
    public ResponseEntity<RunResponse> start(
            @PathVariable("projectId") final String projectId,
            @PathVariable("runId") final String runId) {
        return ResponseEntity.ok(RunResponse.from(
                runService.start(projectId, runId)));
    }

    @Operation(summary = "Complete a test run")
    @PostMapping("/{runId}/complete")
    @PreAuthorize("hasAuthority('execute_test_run')")
    public ResponseEntity<RunResponse> complete(
            @PathVariable("projectId") final String projectId,
            @PathVariable("runId") final String runId) {
        return ResponseEntity.ok(RunResponse.from(
                runService.complete(projectId, runId)));
    }

    @Operation(summary = "Close a test run without completing it")
    @PostMapping("/{runId}/close")
    @PreAuthorize("hasAuthority('execute_test_run')")
    public ResponseEntity<RunResponse> close(
            @PathVariable("projectId") final String projectId,
            @PathVariable("runId") final String runId) {
        return ResponseEntity.ok(RunResponse.from(
                runService.close(projectId, runId)));
    }

    @Operation(summary = "Execution progress of a test run")
    @GetMapping("/{runId}/progress")
    @PreAuthorize("hasAuthority('view_test_run')")
    public ResponseEntity<RunProgress> progress(
            @PathVariable("projectId") final String projectId,
            @PathVariable("runId") final String runId) {
        return ResponseEntity.ok(runService.progress(projectId, runId));
    }

    @Operation(summary = "Result statistics of a test run")
    @GetMapping("/{runId}/statistics")
    @PreAuthorize("hasAuthority('view_test_run')")
    public ResponseEntity<RunStatistics> statistics(
            @PathVariable("projectId") final String projectId,
            @PathVariable("runId") final String runId) {
        return ResponseEntity.ok(runService.statistics(projectId, runId));
    }

    @Operation(summary = "List the results of a test run")
    @GetMapping("/{runId}/results")
    @PreAuthorize("hasAuthority('view_test_run')")
    public ResponseEntity<List<ResultResponse>> results(
            @PathVariable("projectId") final String projectId,
            @PathVariable("runId") final String runId) {
        return ResponseEntity.ok(runService.results(projectId, runId).stream()
                .map(ResultResponse::from)
                .toList());
    }

    @Operation(summary = "Record the result of a test case")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Recorded"),
            @ApiResponse(responseCode = "409",
                    description = "The case already has a result in this run")
    })
    @PostMapping("/{runId}/results")
    @PreAuthorize("hasAuthority('add_test_result')")
    public ResponseEntity<ResultResponse> addResult(
            @AuthenticationPrincipal final AuthenticatedUser caller,
            @PathVariable("projectId") final String projectId,
            @PathVariable("runId") final String runId,
            @Valid @RequestBody final AddResultRequest request) {
        final TestResult result = runService.addResult(projectId, runId,
                request.testCaseId(), request.status(), request.comment(),
                request.elapsed(), request.defects(), caller.userId());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ResultResponse.from(result));
    }

    @Operation(summary = "Add untested results for several test cases")
    @PostMapping("/{runId}/results/bulk")
    @PreAuthorize("hasAuthority('add_test_result')")
    public ResponseEntity<List<ResultResponse>> addResults(
            @PathVariable("projectId") final String projectId,
            @PathVariable("runId") final String runId,
            @Valid @RequestBody final AddResultsRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(runService
                .addResults(projectId, runId, request.testCaseIds()).stream()
                .map(ResultResponse::from)
                .toList());
    }

    @Operation(summary = "Get a result")
    @GetMapping("/{runId}/results/{resultId}")
    @PreAuthorize("hasAuthority('view_test_run')")
    public ResponseEntity<ResultResponse> result(
            @PathVariable("projectId") final String projectId,
            @PathVariable("runId") final String runId,
            @PathVariable("resultId") final String resultId) {
        return ResponseEntity.ok(ResultResponse.from(
                runService.getResult(projectId, runId, resultId)));
    }

    @Operation(summary = "Update a result")
    @PatchMapping("/{runId}/results/{resultId}")
    @PreAuthorize("hasAuthority('add_test_result')")
    public ResponseEntity<ResultResponse> updateResult(
            @AuthenticationPrincipal final AuthenticatedUser caller,
            @PathVariable("projectId") final String projectId,
            @PathVariable("runId") final String runId,
            @PathVariable("resultId") final String resultId,
            @Valid @RequestBody final UpdateResultRequest request) {
        return ResponseEntity.ok(ResultResponse.from(runService.updateResult(
                projectId, runId, resultId, request.status(),
                request.comment(), request.elapsed(), request.defects(),
                caller.userId())));
    }

    @Operation(summary = "Delete a result")
    @DeleteMapping("/{runId}/results/{resultId}")
    @PreAuthorize("hasAuthority('update_test_run')")
    public ResponseEntity<Void> deleteResult(
            @PathVariable("projectId") final String projectId,
            @PathVariable("runId") final String runId,
            @PathVariable("resultId") final String resultId) {
        runService.deleteResult(projectId, runId, resultId);
        return ResponseEntity.noContent().build();
    }

    /** Request to create a run. */
    public record CreateRunRequest(
            @NotBlank @Size(max = 255) String name,
            String description,
            String testPlanId,
            Map<String, Object> config,
            String assigneeId
    ) {}

    /** Partial update of a run. */
    public record UpdateRunRequest(
            @Size(min = 1, max = 255) String name,
            String description,
            Map<String, Object> config,
            String assigneeId,
            TestRunStatus status
    ) {}

    /** Request to record a result. */
    public record AddResultRequest(
            @NotBlank String testCaseId,
            TestResultStatus status,
            String comment,
            @Min(0) Integer elapsed,
            List<@NotBlank String> defects
    ) {}

    /** Request to add pending results. */
    public record AddResultsRequest(
            @NotEmpty @Size(max = 500) List<@NotBlank String> testCaseIds
    ) {}

    /** Partial update of a result. */
    public record UpdateResultRequest(
            TestResultStatus status,
            String comment,
            @Min(0) Integer elapsed,
            List<@NotBlank String> defects
    ) {}

    /** Run as returned by the API. */
    public record RunResponse(
            String id,
            String projectId,
            String testPlanId,
            String name,
            String description,
            TestRunStatus status,
            Map<String, Object> config,
            String assigneeId,
            Instant startedAt,
            Instant completedAt,
            Instant createdAt,
            Instant updatedAt
    ) {
        static RunResponse from(final TestRun run) {
            return new RunResponse(run.id(), run.projectId(), run.planId(),
                    run.name(), run.description(), run.status(), run.config(),
                    run.assigneeId(), run.startedAt(), run.completedAt(),
                    run.createdAt(), run.updatedAt());
        }
    }

    /** Result as returned by the API. */
    public record ResultResponse(
            String id,
            String testRunId,
            String testCaseId,
            int testCaseVersion,
            TestResultStatus status,
            String comment,
            Integer elapsed,
            List<String> defects,
            String executedBy,
            Instant executedAt,
            Instant createdAt,
            Instant updatedAt
    ) {
        static ResultResponse from(final TestResult result) {
            return new ResultResponse(result.id(), result.runId(),
                    result.caseId(), result.caseVersion(), result.status(),
                    result.comment(), result.elapsedSeconds(),
                    result.defects(), result.executedBy(),
                    result.executedAt(), result.createdAt(),
                    result.updatedAt());
        }
    }

}
