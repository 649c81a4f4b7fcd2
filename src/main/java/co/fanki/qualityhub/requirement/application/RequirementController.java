package co.fanki.qualityhub.requirement.application;

import co.fanki.qualityhub.auth.domain.AuthenticatedUser;
import co.fanki.qualityhub.requirement.application.RequirementService.RequirementStatistics;
import co.fanki.qualityhub.requirement.domain.CoverageStatistics;
import co.fanki.qualityhub.requirement.domain.Requirement;
import co.fanki.qualityhub.requirement.domain.RequirementCoverage;
import co.fanki.qualityhub.requirement.domain.RequirementSource;
import co.fanki.qualityhub.requirement.domain.RequirementStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
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
 * REST controller for requirements and the test cases covering them.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/v1/projects/{projectId}/requirements")
@Tag(name = "Requirements", description = "Requirements and test coverage")
@SecurityRequirement(name = "bearerAuth")
public class RequirementController {

    private final RequirementService requirementService;

    /**
     * Creates a new RequirementController.
     *
     * @param theRequirementService the requirement service
     */
    public RequirementController(
            final RequirementService theRequirementService) {
        this.requirementService = theRequirementService;
    }

    @Operation(summary = "Create a requirement")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "400", description = "Invalid input")
    })
    @PostMapping
    @PreAuthorize("hasAuthority('create_requirement')")
    public ResponseEntity<RequirementResponse> create(
            @AuthenticationPrincipal final AuthenticatedUser caller,
            @PathVariable("projectId") final String projectId,
            @Valid @RequestBody final CreateRequirementRequest request) {
        final Requirement requirement = requirementService.create(projectId,
                request.externalId(), request.title(), request.description(),
                request.source(), request.status(), request.customFields(),
                caller.userId());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(RequirementResponse.from(requirement));
    }

    @Operation(summary = "List the project's requirements")
    @GetMapping
    @PreAuthorize("hasAuthority('view_requirement')")
    public ResponseEntity<List<RequirementResponse>> list(
            @PathVariable("projectId") final String projectId) {
        return ResponseEntity.ok(requirementService.findByProject(projectId)
                .stream()
                .map(RequirementResponse::from)
                .toList());
    }

    @Operation(summary = "Requirement coverage of the project")
    @GetMapping("/statistics")
    @PreAuthorize("hasAuthority('view_requirement')")
    public ResponseEntity<CoverageStatistics> projectStatistics(
            @PathVariable("projectId") final String projectId) {
        return ResponseEntity.ok(
                requirementService.projectStatistics(projectId));
    }

    @Operation(summary = "Get a requirement")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Found"),
            @ApiResponse(responseCode = "404", description = "Not found")
    })
    @GetMapping("/{requirementId}")
    @PreAuthorize("hasAuthority('view_requirement')")
    public ResponseEntity<RequirementResponse> get(
            @PathVariable("projectId") final String projectId,
            @PathVariable("requirementId") final String requirementId) {
        return ResponseEntity.ok(RequirementResponse.from(
                requirementService.getById(projectId, requirementId)));
    }

    @Operation(summary = "Update a requirement")
    @PatchMapping("/{requirementId}")
    @PreAuthorize("hasAuthority('update_requirement')")
    public ResponseEntity<RequirementResponse> update(
            @PathVariable("projectId") final String projectId,
            @PathVariable("requirementId") final String requirementId,
            @Valid @RequestBody final UpdateRequirementRequest request) {
        return ResponseEntity.ok(RequirementResponse.from(
                requirementService.update(projectId, requirementId,
                        request.externalId(), request.title(),
                        request.description(), request.source(),
                        request.status(), request.customFields())));
    }

    @Operation(summary = "Soft delete a requirement")
    @DeleteMapping("/{requirementId}")
    @PreAuthorize("hasAuthority('delete_requirement')")
    public ResponseEntity<Void> delete(
            @PathVariable("projectId") final String projectId,
            @PathVariable("requirementId") final String requirementId) {
        requirementService.delete(projectId, requirementId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Test cases covering a requirement")
    @GetMapping("/{requirementId}/coverage")
    @PreAuthorize("hasAuthority('view_requirement')")
    public ResponseEntity<List<CoverageResponse>> coverage(
            @PathVariable("projectId") final String projectId,
            @PathVariable("requirementId") final String requirementId) {
        return ResponseEntity.ok(requirementService.coverage(projectId,
                requirementId).stream()
                .map(CoverageResponse::from)
                .toList());
    }

    @Operation(summary = "Link test cases to a requirement",
            description = "Cases already linked are skipped; only the new "
                    + "links are returned")
    @PostMapping("/{requirementId}/coverage")
    @PreAuthorize("hasAuthority('update_requirement')")
    public ResponseEntity<List<CoverageResponse>> addCoverage(
            @AuthenticationPrincipal final AuthenticatedUser caller,
            @PathVariable("projectId") final String projectId,
            @PathVariable("requirementId") final String requirementId,
            @Valid @RequestBody final AddCoverageRequest request) {
        final List<RequirementCoverage> added = requirementService
                .addCoverage(projectId, requirementId, request.testCaseIds(),
                        caller.userId());
        return ResponseEntity.status(HttpStatus.CREATED).body(added.stream()
                .map(CoverageResponse::from)
                .toList());
    }

    @Operation(summary = "Unlink a test case from a requirement")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Unlinked"),
            @ApiResponse(responseCode = "404", description = "Not linked")
    })
    @DeleteMapping("/{requirementId}/coverage/{testCaseId}")
    @PreAuthorize("hasAuthority('update_requirement')")
    public ResponseEntity<Void> removeCoverage(
            @PathVariable("projectId") final String projectId,
            @PathVariable("requirementId") final String requirementId,
            @PathVariable("testCaseId") final String testCaseId) {
        requirementService.removeCoverage(projectId, requirementId,
                testCaseId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Coverage of a single requirement")
    @GetMapping("/{requirementId}/statistics")
    @PreAuthorize("hasAuthority('view_requirement')")
    public ResponseEntity<RequirementStatistics> statistics(
            @PathVariable("projectId") final String projectId,
            @PathVariable("requirementId") final String requirementId) {
        return ResponseEntity.ok(requirementService.statistics(projectId,
                requirementId));
    }

    /** Request to create a requirement. */
    public record CreateRequirementRequest(
            @Size(max = 255) String externalId,
            @NotBlank @Size(min = 3, max = 500) String title,
            String description,
            RequirementSource source,
            RequirementStatus status,
            Map<String, Object> customFields
    ) {}

    /** Partial update of a requirement. */
    public record UpdateRequirementRequest(
            @Size(max = 255) String externalId,
            @Size(min = 3, max = 500) String title,
            String description,
            RequirementSource source,
            RequirementStatus status,
            Map<String, Object> customFields
    ) {}

    /** Cases to link. */
    public record AddCoverageRequest(
            @NotEmpty List<@NotBlank String> testCaseIds
    ) {}

    /** Requirement as returned by the API. */
    public record RequirementResponse(
            String id,
            String projectId,
            String externalId,
            String title,
            String description,
            RequirementSource source,
            RequirementStatus status,
            Map<String, Object> customFields,
            String createdBy,
            Instant createdAt,
            Instant updatedAt
    ) {
        static RequirementResponse from(final Requirement requirement) {
            return new RequirementResponse(requirement.id(),
                    requirement.projectId(), requirement.externalId(),
                    requirement.title(), requirement.description(),
                    requirement.source(), requirement.status(),
                    requirement.customFields(), requirement.createdBy(),
                    requirement.createdAt(), requirement.updatedAt());
        }
    }

    /** Link between a requirement and a test case. */
    public record CoverageResponse(
            String id,
            String requirementId,
            String testCaseId,
            String createdBy,
            Instant createdAt
    ) {
        static CoverageResponse from(final RequirementCoverage coverage) {
            return new CoverageResponse(coverage.id(),
                    coverage.requirementId(), coverage.caseId(),
                    coverage.createdBy(), coverage.createdAt());
        }
    }

}
