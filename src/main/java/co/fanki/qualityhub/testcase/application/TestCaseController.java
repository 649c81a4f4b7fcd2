package co.fanki.qualityhub.testcase.application;

import co.fanki.qualityhub.auth.domain.AuthenticatedUser;
import co.fanki.qualityhub.testcase.application.TestCaseService.CaseChange;
import co.fanki.qualityhub.testcase.domain.TestCase;
import co.fanki.qualityhub.testcase.domain.TestCaseDetails;
import co.fanki.qualityhub.testcase.domain.TestCasePriority;
import co.fanki.qualityhub.testcase.domain.TestCaseTemplate;
import co.fanki.qualityhub.testcase.domain.TestCaseVersion;
import co.fanki.qualityhub.testcase.domain.TestStep;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST controller for test cases.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/v1/projects/{projectId}/cases")
@Tag(name = "Test Cases", description = "Versioned test cases of a project")
@SecurityRequirement(name = "bearerAuth")
public class TestCaseController {

    private final TestCaseService caseService;

    /**
     * Creates a new TestCaseController.
     *
     * @param theCaseService the test case service
     */
    public TestCaseController(final TestCaseService theCaseService) {
        this.caseService = theCaseService;
    }

    @Operation(summary = "Create a test case")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "400", description = "Invalid input"),
            @ApiResponse(responseCode = "404", description = "Section not found")
    })
    @PostMapping
    @PreAuthorize("hasAuthority('create_test_case')")
    public ResponseEntity<TestCaseResponse> create(
            @AuthenticationPrincipal final AuthenticatedUser caller,
            @PathVariable("projectId") final String projectId,
            @Valid @RequestBody final CreateTestCaseRequest request) {
        final TestCase testCase = caseService.create(projectId,
                request.toDetails(), caller.userId());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(TestCaseResponse.from(testCase));
    }

    @Operation(summary = "List test cases, optionally by section or priority")
    @GetMapping
    @PreAuthorize("hasAuthority('view_test_case')")
    public ResponseEntity<List<TestCaseResponse>> list(
            @PathVariable("projectId") final String projectId,
            @RequestParam(value = "sectionId", required = false)
            final String sectionId,
            @RequestParam(value = "priority", required = false)
            final String priority) {
        final TestCasePriority priorityFilter = priority != null
                ? TestCasePriority.fromValue(priority) : null;
        return ResponseEntity.ok(caseService
                .findByProject(projectId, sectionId, priorityFilter).stream()
                .map(TestCaseResponse::from)
                .toList());
    }

    @Operation(summary = "Get a test case")
    @GetMapping("/{caseId}")
    @PreAuthorize("hasAuthority('view_test_case')")
    public ResponseEntity<TestCaseResponse> get(
            @PathVariable("projectId") final String projectId,
            @PathVariable("caseId") final String caseId) {
        return ResponseEntity.ok(TestCaseResponse.from(
                caseService.getById(projectId, caseId)));
    }

    @Operation(summary = "Update a test case, creating a new version")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated"),
            @ApiResponse(responseCode = "404", description = "Not found"),
            @ApiResponse(responseCode = "409",
                    description = "Modified by another request")
    })
    @PatchMapping("/{caseId}")
    @PreAuthorize("hasAuthority('update_test_case')")
    public ResponseEntity<TestCaseResponse> update(
            @AuthenticationPrincipal final AuthenticatedUser caller,
            @PathVariable("projectId") final String projectId,
            @PathVariable("caseId") final String caseId,
            @Valid @RequestBody final UpdateTestCaseRequest request) {
        return ResponseEntity.ok(TestCaseResponse.from(caseService.update(
                projectId, caseId, request.toDetails(), request.version(),
                caller.userId())));
    }

    @Operation(summary = "Soft delete a test case")
    @DeleteMapping("/{caseId}")
    @PreAuthorize("hasAuthority('delete_test_case')")
    public ResponseEntity<Void> delete(
            @PathVariable("projectId") final String projectId,
            @PathVariable("caseId") final String caseId) {
        caseService.delete(projectId, caseId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Version history of a test case, newest first")
    @GetMapping("/{caseId}/history")
    @PreAuthorize("hasAuthority('view_test_case')")
    public ResponseEntity<List<VersionResponse>> history(
            @PathVariable("projectId") final String projectId,
            @PathVariable("caseId") final String caseId) {
        return ResponseEntity.ok(caseService.history(projectId, caseId)
                .stream()
                .map(VersionResponse::from)
                .toList());
    }

    @Operation(summary = "Create several test cases")
    @PostMapping("/bulk")
    @PreAuthorize("hasAuthority('create_test_case')")
    public ResponseEntity<List<TestCaseResponse>> bulkCreate(
            @AuthenticationPrincipal final AuthenticatedUser caller,
            @PathVariable("projectId") final String projectId,
            @Valid @RequestBody final BulkCreateRequest request) {
        final List<TestCaseDetails> details = request.testCases().stream()
                .map(CreateTestCaseRequest::toDetails)
                .toList();
        return ResponseEntity.status(HttpStatus.CREATED).body(caseService
                .bulkCreate(projectId, details, caller.userId()).stream()
                .map(TestCaseResponse::from)
                .toList());
    }

    @Operation(summary = "Update several test cases")
    @PatchMapping("/bulk")
    @PreAuthorize("hasAuthority('update_test_case')")
    public ResponseEntity<List<TestCaseResponse>> bulkUpdate(
            @AuthenticationPrincipal final AuthenticatedUser caller,
            @PathVariable("projectId") final String projectId,
            @Valid @RequestBody final BulkUpdateRequest request) {
        final List<CaseChange> changes = request.testCases().stream()
                .map(each -> new CaseChange(each.id(), each.toDetails()))
                .toList();
        return ResponseEntity.ok(caseService
                .bulkUpdate(projectId, changes, caller.userId()).stream()
                .map(TestCaseResponse::from)
                .toList());
    }

    @Operation(summary = "Soft delete several test cases")
    @DeleteMapping("/bulk")
    @PreAuthorize("hasAuthority('delete_test_case')")
    public ResponseEntity<BulkDeleteResponse> bulkDelete(
            @PathVariable("projectId") final String projectId,
            @Valid @RequestBody final BulkIdsRequest request) {
        return ResponseEntity.ok(new BulkDeleteResponse(
                caseService.bulkDelete(projectId, request.ids())));
    }

    @Operation(summary = "Move several test cases to a section")
    @PostMapping("/bulk/move")
    @PreAuthorize("hasAuthority('update_test_case')")
    public ResponseEntity<List<TestCaseResponse>> bulkMove(
            @AuthenticationPrincipal final AuthenticatedUser caller,
            @PathVariable("projectId") final String projectId,
            @Valid @RequestBody final BulkMoveRequest request) {
        return ResponseEntity.ok(caseService
                .bulkMove(projectId, request.ids(), request.targetSectionId(),
                        caller.userId()).stream()
                .map(TestCaseResponse::from)
                .toList());
    }

    /** One step as sent by clients. */
    public record StepRequest(
            @NotNull @Min(1) Integer stepNumber,
            @NotBlank @Size(max = 2000) String action,
            @Size(max = 2000) String expectedResult,
            @Size(max = 2000) String data
    ) {
        TestStep toStep() {
            return new TestStep(stepNumber, action, expectedResult, data);
        }
    }

    /** Request to create a test case. */
    public record CreateTestCaseRequest(
            @NotBlank @Size(min = 3, max = 500) String title,
            String sectionId,
            TestCaseTemplate templateType,
            String preconditions,
            @Size(max = 100) List<@Valid StepRequest> steps,
            String expectedResult,
            TestCasePriority priority,
            @Min(0) Integer estimate,
            Map<String, Object> customFields
    ) {
        TestCaseDetails toDetails() {
            return new TestCaseDetails(sectionId, title, templateType,
                    preconditions, toSteps(steps), expectedResult, priority,
                    estimate, customFields);
        }
    }

    /** Partial update of a test case. */
    public record UpdateTestCaseRequest(
            @Size(min = 3, max = 500) String title,
            String sectionId,
            TestCaseTemplate templateType,
            String preconditions,
            @Size(max = 100) List<@Valid StepRequest> steps,
            String expectedResult,
            TestCasePriority priority,
            @Min(0) Integer estimate,
            Map<String, Object> customFields,
            @Min(1) Integer version
    ) {
        TestCaseDetails toDetails() {
            return new TestCaseDetails(sectionId, title, templateType,
                    preconditions, toSteps(steps), expectedResult, priority,
                    estimate, customFields);
        }
    }

    /** One entry of a bulk update. */
    public record BulkUpdateItem(
            @NotBlank String id,
            @Size(min = 3, max = 500) String title,
            String sectionId,
            TestCaseTemplate templateType,
            String preconditions,
            @Size(max = 100) List<@Valid StepRequest> steps,
            String expectedResult,
            TestCasePriority priority,
            @Min(0) Integer estimate,
            Map<String, Object> customFields
    ) {
        TestCaseDetails toDetails() {
            return new TestCaseDetails(sectionId, title, templateType,
                    preconditions, toSteps(steps), expectedResult, priority,
                    estimate, customFields);
        }
    }

    /** Request to create several cases. */
    public record BulkCreateRequest(
            @NotEmpty @Size(max = 100) List<@Valid CreateTestCaseRequest> testCases
    ) {}

    /** Request to update several cases. */
    public record BulkUpdateRequest(
            @NotEmpty @Size(max = 100) List<@Valid BulkUpdateItem> testCases
    ) {}

    /** Request naming several cases. */
    public record BulkIdsRequest(
            @NotEmpty @Size(max = 100) List<@NotBlank String> ids
    ) {}

    /** Request to move several cases; a null section detaches them. */
    public record BulkMoveRequest(
            @NotEmpty @Size(max = 100) List<@NotBlank String> ids,
            String targetSectionId
    ) {}

    /** Outcome of a bulk delete. */
    public record BulkDeleteResponse(int deleted) {}

    /** Test case as returned by the API. */
    public record TestCaseResponse(
            String id,
            String projectId,
            String sectionId,
            String title,
            TestCaseTemplate templateType,
            String preconditions,
            List<TestStep> steps,
            String expectedResult,
            TestCasePriority priority,
            Integer estimate,
            Map<String, Object> customFields,
            int version,
            String createdBy,
            Instant createdAt,
            Instant updatedAt
    ) {
        static TestCaseResponse from(final TestCase testCase) {
            return new TestCaseResponse(
                    testCase.id(),
                    testCase.projectId(),
                    testCase.sectionId(),
                    testCase.title(),
                    testCase.templateType(),
                    testCase.preconditions(),
                    testCase.steps(),
                    testCase.expectedResult(),
                    testCase.priority(),
                    testCase.estimate(),
                    testCase.customFields(),
                    testCase.version(),
                    testCase.createdBy(),
                    testCase.createdAt(),
                    testCase.updatedAt());
        }
    }

    /** Version snapshot as returned by the API. */
    public record VersionResponse(
            String id,
            String testCaseId,
            int version,
            Map<String, Object> data,
            String changedBy,
            Instant createdAt
    ) {
        static VersionResponse from(final TestCaseVersion version) {
            return new VersionResponse(version.id(), version.caseId(),
                    version.version(), version.data(), version.changedBy(),
                    version.createdAt());
        }
    }

    private static List<TestStep> toSteps(final List<StepRequest> steps) {
        if (steps == null) {
            return null;
        }
        return steps.stream().map(StepRequest::toStep).toList();
    }

}
