package co.fanki.qualityhub.milestone.application;

import co.fanki.qualityhub.milestone.application.MilestoneService.MilestoneProgress;
import co.fanki.qualityhub.milestone.domain.Milestone;
import co.fanki.qualityhub.plan.application.TestPlanController.PlanResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
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
 * REST controller for milestones.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/v1/projects/{projectId}/milestones")
@Tag(name = "Milestones", description = "Release targets of a project")
@SecurityRequirement(name = "bearerAuth")
public class MilestoneController {

    private final MilestoneService milestoneService;

    /**
     * Creates a new MilestoneController.
     *
     * @param theMilestoneService the milestone service
     */
    public MilestoneController(final MilestoneService theMilestoneService) {
        this.milestoneService = theMilestoneService;
    }

    @Operation(summary = "Create a milestone")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "400", description = "Invalid input")
    })
    @PostMapping
    @PreAuthorize("hasAuthority('create_milestone')")
    public ResponseEntity<MilestoneResponse> create(
            @PathVariable("projectId") final String projectId,
            @Valid @RequestBody final CreateMilestoneRequest request) {
        final Milestone milestone = milestoneService.create(projectId,
                request.name(), request.description(), request.dueDate());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(MilestoneResponse.from(milestone));
    }

    @Operation(summary = "List the project's milestones")
    @GetMapping
    @PreAuthorize("hasAuthority('view_milestone')")
    public ResponseEntity<List<MilestoneResponse>> list(
            @PathVariable("projectId") final String projectId) {
        return ResponseEntity.ok(milestoneService.findByProject(projectId)
                .stream()
                .map(MilestoneResponse::from)
                .toList());
    }

    @Operation(summary = "Get a milestone")
    @GetMapping("/{milestoneId}")
    @PreAuthorize("hasAuthority('view_milestone')")
    public ResponseEntity<MilestoneResponse> get(
            @PathVariable("projectId") final String projectId,
            @PathVariable("milestoneId") final String milestoneId) {
        return ResponseEntity.ok(MilestoneResponse.from(
                milestoneService.getById(projectId, milestoneId)));
    }

    @Operation(summary = "Update a milestone")
    @PatchMapping("/{milestoneId}")
    @PreAuthorize("hasAuthority('update_milestone')")
    public ResponseEntity<MilestoneResponse> update(
            @PathVariable("projectId") final String projectId,
            @PathVariable("milestoneId") final String milestoneId,
            @Valid @RequestBody final UpdateMilestoneRequest request) {
        return ResponseEntity.ok(MilestoneResponse.from(
                milestoneService.update(projectId, milestoneId,
                        request.name(), request.description(),
                        request.dueDate(), request.isCompleted())));
    }

    @Operation(summary = "Soft delete a milestone")
    @DeleteMapping("/{milestoneId}")
    @PreAuthorize("hasAuthority('delete_milestone')")
    public ResponseEntity<Void> delete(
            @PathVariable("projectId") final String projectId,
            @PathVariable("milestoneId") final String milestoneId) {
        milestoneService.delete(projectId, milestoneId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Progress of a milestone")
    @GetMapping("/{milestoneId}/progress")
    @PreAuthorize("hasAuthority('view_milestone')")
    public ResponseEntity<MilestoneProgress> progress(
            @PathVariable("projectId") final String projectId,
            @PathVariable("milestoneId") final String milestoneId) {
        return ResponseEntity.ok(milestoneService.progress(projectId,
                milestoneId));
    }

    @Operation(summary = "Test plans aimed at a milestone")
    @GetMapping("/{milestoneId}/test-plans")
    @PreAuthorize("hasAuthority('view_milestone')")
    public ResponseEntity<List<PlanResponse>> plans(
            @PathVariable("projectId") final String projectId,
            @PathVariable("milestoneId") final String milestoneId) {
        return ResponseEntity.ok(milestoneService.plans(projectId, milestoneId)
                .stream()
                .map(PlanResponse::from)
                .toList());
    }

    /** Request to create a milestone. */
    public record CreateMilestoneRequest(
            @NotBlank @Size(max = 255) String name,
            String description,
            Instant dueDate
    ) {}

    /** Partial update of a milestone. */
    public record UpdateMilestoneRequest(
            @Size(min = 1, max = 255) String name,
            String description,
            Instant dueDate,
            Boolean isCompleted
    ) {}

    /** Milestone as returned by the API. */
    public record MilestoneResponse(
            String id,
            String projectId,
            String name,
            String description,
            Instant dueDate,
            boolean isCompleted,
            Instant createdAt,
            Instant updatedAt
    ) {
        public static MilestoneResponse from(final Milestone milestone) {
            return new MilestoneResponse(milestone.id(),
                    milestone.projectId(), milestone.name(),
                    milestone.description(), milestone.dueDate(),
                    milestone.isCompleted(), milestone.createdAt(),
                    milestone.updatedAt());
        }
    }

}
