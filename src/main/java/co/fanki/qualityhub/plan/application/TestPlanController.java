package co.fanki.qualityhub.plan.application;

import co.fanki.qualityhub.milestone.application.MilestoneController.MilestoneResponse;
import co.fanki.qualityhub.plan.domain.TestPlan;
import co.fanki.qualityhub.plan.domain.TestPlanEntry;
import co.fanki.qualityhub.shared.DomainException;
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

/**
 * REST controller for test plans and their entries.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/v1/projects/{projectId}/plans")
@Tag(name = "Test Plans", description = "Ordered selections of test cases")
@SecurityRequirement(name = "bearerAuth")
public class TestPlanController {

    private final TestPlanService planService;

    /**
     * Creates a new TestPlanController.
     *
     * @param thePlanService the test plan service
     */
    public TestPlanController(final TestPlanService thePlanService) {
        this.planService = thePlanService;
    }

    @Operation(summary = "Create a test plan")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "404", description = "Milestone not found")
    })
    @PostMapping
    @PreAuthorize("hasAuthority('create_test_plan')")
    public ResponseEntity<PlanResponse> create(
            @PathVariable("projectId") final String projectId,
            @Valid @RequestBody final CreatePlanRequest request) {
        final TestPlan plan = planService.create(projectId,
                request.milestoneId(), request.name(), request.description());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(PlanResponse.from(plan));
    }

    @Operation(summary = "List the project's test plans")
    @GetMapping
    @PreAuthorize("hasAuthority('view_test_plan')")
    public ResponseEntity<List<PlanResponse>> list(
            @PathVariable("projectId") final String projectId) {
        return ResponseEntity.ok(planService.findByProject(projectId).stream()
                .map(PlanResponse::from)
                .toList());
    }

    @Operation(summary = "Get a test plan")
    @GetMapping("/{planId}")
    @PreAuthorize("hasAuthority('view_test_plan')")
    public ResponseEntity<PlanResponse> get(
            @PathVariable("projectId") final String projectId,
            @PathVariable("planId") final String planId) {
        return ResponseEntity.ok(PlanResponse.from(
                planService.getById(projectId, planId)));
    }

    @Operation(summary = "Update a test plan")
    @PatchMapping("/{planId}")
    @PreAuthorize("hasAuthority('update_test_plan')")
    public ResponseEntity<PlanResponse> update(
            @PathVariable("projectId") final String projectId,
            @PathVariable("planId") final String planId,
            @Valid @RequestBody final UpdatePlanRequest request) {
        return ResponseEntity.ok(PlanResponse.from(planService.update(
                projectId, planId, request.milestoneId(), request.name(),
                request.description())));
    }

    @Operation(summary = "Soft delete a test plan")
    @DeleteMapping("/{planId}")
    @PreAuthorize("hasAuthority('delete_test_plan')")
    public ResponseEntity<Void> delete(
            @PathVariable("projectId") final String projectId,
            @PathVariable("planId") final String planId) {
        planService.delete(projectId, planId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Get the milestone a test plan is aimed at")
    @GetMapping("/{planId}/milestone")
    @PreAuthorize("hasAuthority('view_test_plan')")
    public ResponseEntity<MilestoneResponse> milestone(
            @PathVariable("projectId") final String projectId,
            @PathVariable("planId") final String planId) {
        return ResponseEntity.ok(planService.milestone(projectId, planId)
                .map(MilestoneResponse::from)
                .orElseThrow(() -> new DomainException(
                        "Test plan " + planId + " has no milestone",
                        "MILESTONE_NOT_FOUND")));
    }

    @Operation(summary = "List the entries of a test plan in order")
    @GetMapping("/{planId}/entries")
    @PreAuthorize("hasAuthority('view_test_plan')")
    public ResponseEntity<List<EntryResponse>> entries(
            @PathVariable("projectId") final String projectId,
            @PathVariable("planId") final String planId) {
        return ResponseEntity.ok(planService.entries(projectId, planId)
                .stream()
                .map(EntryResponse::from)
                .toList());
    }

    @Operation(summary = "Add a test case to a plan")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Added"),
            @ApiResponse(responseCode = "409",
                    description = "Test case already in the plan")
    })
    @PostMapping("/{planId}/entries")
    @PreAuthorize("hasAuthority('update_test_plan')")
    public ResponseEntity<EntryResponse> addEntry(
            @PathVariable("projectId") final String projectId,
            @PathVariable("planId") final String planId,
            @Valid @RequestBody final AddEntryRequest request) {
        final TestPlanEntry entry = planService.addEntry(projectId, planId,
                request.testCaseId(), request.position());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(EntryResponse.from(entry));
    }

    @Operation(summary = "Append several test cases to a plan")
    @PostMapping("/{planId}/entries/bulk")
    @PreAuthorize("hasAuthority('update_test_plan')")
    public ResponseEntity<List<EntryResponse>> addEntries(
            @PathVariable("projectId") final String projectId,
            @PathVariable("planId") final String planId,
            @Valid @RequestBody final AddEntriesRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(planService
                .addEntries(projectId, planId, request.testCaseIds()).stream()
                .map(EntryResponse::from)
                .toList());
    }

    @Operation(summary = "Move an entry")
    @PatchMapping("/{planId}/entries/{entryId}")
    @PreAuthorize("hasAuthority('update_test_plan')")
    public ResponseEntity<EntryResponse> updateEntry(
            @PathVariable("projectId") final String projectId,
            @PathVariable("planId") final String planId,
            @PathVariable("entryId") final String entryId,
            @Valid @RequestBody final UpdateEntryRequest request) {
        return ResponseEntity.ok(EntryResponse.from(planService.updateEntry(
                projectId, planId, entryId, request.position())));
    }

    @Operation(summary = "Remove an entry")
    @DeleteMapping("/{planId}/entries/{entryId}")
    @PreAuthorize("hasAuthority('update_test_plan')")
    public ResponseEntity<Void> removeEntry(
            @PathVariable("projectId") final String projectId,
            @PathVariable("planId") final String planId,
            @PathVariable("entryId") final String entryId) {
        planService.removeEntry(projectId, planId, entryId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Remove several entries")
    @DeleteMapping("/{planId}/entries")
    @PreAuthorize("hasAuthority('update_test_plan')")
    public ResponseEntity<Void> removeEntries(
            @PathVariable("projectId") final String projectId,
            @PathVariable("planId") final String planId,
            @Valid @RequestBody final RemoveEntriesRequest request) {
        planService.removeEntries(projectId, planId, request.entryIds());
        return ResponseEntity.noContent().build();
    }

    /** Request to create a plan. */
    public record CreatePlanRequest(
            @NotBlank @Size(max = 255) String name,
            String description,
            String milestoneId
    ) {}

    /** Partial update of a plan. */
    public record UpdatePlanRequest(
            @Size(min = 1, max = 255) String name,
            String description,
            String milestoneId
    ) {}

    /** Request to add one case. */
    public record AddEntryRequest(
            @NotBlank String testCaseId,
            @Min(0) Integer position
    ) {}

    /** Request to append several cases. */
    public record AddEntriesRequest(
            @NotEmpty @Size(max = 500) List<@NotBlank String> testCaseIds
    ) {}

    /** Request to move an entry. */
    public record UpdateEntryRequest(
            @NotNull @Min(0) Integer position
    ) {}

    /** Request to remove several entries. */
    public record RemoveEntriesRequest(
            @NotEmpty List<@NotBlank String> entryIds
    ) {}

    /** Plan as returned by the API. */
    public record PlanResponse(
            String id,
            String projectId,
            String milestoneId,
            String name,
            String description,
            Instant createdAt,
            Instant updatedAt
    ) {
        public static PlanResponse from(final TestPlan plan) {
            return new PlanResponse(plan.id(), plan.projectId(),
                    plan.milestoneId(), plan.name(), plan.description(),
                    plan.createdAt(), plan.updatedAt());
        }
    }

    /** Entry as returned by the API. */
    public record EntryResponse(
            String id,
            String testPlanId,
            String testCaseId,
            int position,
            Instant createdAt
    ) {
        static EntryResponse from(final TestPlanEntry entry) {
            return new EntryResponse(entry.id(), entry.planId(),
                    entry.caseId(), entry.position(), entry.createdAt());
        }
    }

}
