package co.fanki.qualityhub.project.application;

import co.fanki.qualityhub.auth.domain.AuthenticatedUser;
import co.fanki.qualityhub.project.domain.Project;
import co.fanki.qualityhub.project.domain.ProjectMember;
import co.fanki.qualityhub.project.domain.ProjectMemberRole;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
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
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST controller for projects and their members.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/v1/projects")
@Tag(name = "Projects", description = "Projects of the caller's organization")
@SecurityRequirement(name = "bearerAuth")
public class ProjectController {

    private final ProjectService projectService;

    /**
     * Creates a new ProjectController.
     *
     * @param theProjectService the project service
     */
    public ProjectController(final ProjectService theProjectService) {
        this.projectService = theProjectService;
    }

    @Operation(summary = "Create a project")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "400", description = "Invalid input")
    })
    @PostMapping
    @PreAuthorize("hasAuthority('create_project')")
    public ResponseEntity<ProjectResponse> create(
            @AuthenticationPrincipal final AuthenticatedUser caller,
            @Valid @RequestBody final CreateProjectRequest request) {
        final Project project = projectService.create(
                caller.organizationId(), request.name(),
                request.description(), request.settings());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ProjectResponse.from(project));
    }

    @Operation(summary = "List the organization's projects")
    @GetMapping
    @PreAuthorize("hasAuthority('view_project')")
    public ResponseEntity<List<ProjectResponse>> list(
            @AuthenticationPrincipal final AuthenticatedUser caller) {
        return ResponseEntity.ok(projectService
                .findByOrganization(caller.organizationId()).stream()
                .map(ProjectResponse::from)
                .toList());
    }

    @Operation(summary = "Get a project")
    @GetMapping("/{projectId}")
    @PreAuthorize("hasAuthority('view_project')")
    public ResponseEntity<ProjectResponse> get(
            @PathVariable("projectId") final String projectId) {
        return ResponseEntity.ok(ProjectResponse.from(
                projectService.getById(projectId)));
    }

    @Operation(summary = "Update a project")
    @PatchMapping("/{projectId}")
    @PreAuthorize("hasAuthority('update_project')")
    public ResponseEntity<ProjectResponse> update(
            @PathVariable("projectId") final String projectId,
            @Valid @RequestBody final UpdateProjectRequest request) {
        return ResponseEntity.ok(ProjectResponse.from(projectService.update(
                projectId, request.name(), request.description(),
                request.settings())));
    }

    @Operation(summary = "Soft delete a project")
    @DeleteMapping("/{projectId}")
    @PreAuthorize("hasAuthority('delete_project')")
    public ResponseEntity<Void> delete(
            @PathVariable("projectId") final String projectId) {
        projectService.delete(projectId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Add a member to a project")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Added"),
            @ApiResponse(responseCode = "409", description = "Already a member")
    })
    @PostMapping("/{projectId}/members")
    @PreAuthorize("hasAuthority('manage_project_settings')")
    public ResponseEntity<MemberResponse> addMember(
            @PathVariable("projectId") final String projectId,
            @Valid @RequestBody final AddMemberRequest request) {
        final ProjectMember member = projectService.addMember(projectId,
                request.userId(), request.role());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(MemberResponse.from(member));
    }

    @Operation(summary = "List project members")
    @GetMapping("/{projectId}/members")
    @PreAuthorize("hasAuthority('view_project')")
    public ResponseEntity<List<MemberResponse>> members(
            @PathVariable("projectId") final String projectId) {
        return ResponseEntity.ok(projectService.members(projectId).stream()
                .map(MemberResponse::from)
                .toList());
    }

    @Operation(summary = "Get a project member")
    @GetMapping("/{projectId}/members/{userId}")
    @PreAuthorize("hasAuthority('view_project')")
    public ResponseEntity<MemberResponse> member(
            @PathVariable("projectId") final String projectId,
            @PathVariable("userId") final String userId) {
        return ResponseEntity.ok(MemberResponse.from(
                projectService.getMember(projectId, userId)));
    }

    @Operation(summary = "Change a member's role")
    @PatchMapping("/{projectId}/members/{userId}")
    @PreAuthorize("hasAuthority('manage_project_settings')")
    public ResponseEntity<MemberResponse> updateMember(
            @PathVariable("projectId") final String projectId,
            @PathVariable("userId") final String userId,
            @Valid @RequestBody final UpdateMemberRequest request) {
        return ResponseEntity.ok(MemberResponse.from(
                projectService.updateMember(projectId, userId,
                        request.role())));
    }

    @Operation(summary = "Remove a member")
    @DeleteMapping("/{projectId}/members/{userId}")
    @PreAuthorize("hasAuthority('manage_project_settings')")
    public ResponseEntity<Void> removeMember(
            @PathVariable("projectId") final String projectId,
            @PathVariable("userId") final String userId) {
        projectService.removeMember(projectId, userId);
        return ResponseEntity.noContent().build();
    }

    /** Request to create a project. */
    public record CreateProjectRequest(
            @NotBlank @Size(max = 255) String name,
            String description,
            Map<String, Object> settings
    ) {}

    /** Partial update of a project. */
    public record UpdateProjectRequest(
            @Size(min = 1, max = 255) String name,
            String description,
            Map<String, Object> settings
    ) {}

    /** Request to add a member. */
    public record AddMemberRequest(
            @NotBlank String userId,
            ProjectMemberRole role
    ) {}

    /** Request to change a member's role. */
    public record UpdateMemberRequest(
            @NotNull ProjectMemberRole role
    ) {}

    /** Project as returned by the API. */
    public record ProjectResponse(
            String id,
            String orgId,
            String name,
            String description,
            Map<String, Object> settings,
            Instant createdAt,
            Instant updatedAt
    ) {
        static ProjectResponse from(final Project project) {
            return new ProjectResponse(
                    project.id(),
                    project.organizationId(),
                    project.name(),
                    project.description(),
                    project.settings(),
                    project.createdAt(),
                    project.updatedAt());
        }
    }

    /** Project membership as returned by the API. */
    public record MemberResponse(
            String id,
            String projectId,
            String userId,
            ProjectMemberRole role,
            Instant createdAt
    ) {
        static MemberResponse from(final ProjectMember member) {
            return new MemberResponse(
                    member.id(),
                    member.projectId(),
                    member.userId(),
                    member.role(),
                    member.createdAt());
        }
    }

}
