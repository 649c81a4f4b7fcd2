package co.fanki.qualityhub.organization.application;

import co.fanki.qualityhub.auth.domain.AuthenticatedUser;
import co.fanki.qualityhub.organization.domain.Organization;
import co.fanki.qualityhub.organization.domain.OrganizationPlan;
import co.fanki.qualityhub.user.application.UserController.UserResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
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
 * REST controller for organizations.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/v1/organizations")
@Tag(name = "Organizations", description = "Tenant management")
@SecurityRequirement(name = "bearerAuth")
public class OrganizationController {

    private final OrganizationService organizationService;

    /**
     * Creates a new OrganizationController.
     *
     * @param theOrganizationService the organization service
     */
    public OrganizationController(
            final OrganizationService theOrganizationService) {
        this.organizationService = theOrganizationService;
    }

    @Operation(summary = "Get the caller's organization")
    @GetMapping("/current")
    public ResponseEntity<OrganizationResponse> current(
            @AuthenticationPrincipal final AuthenticatedUser caller) {
        return ResponseEntity.ok(OrganizationResponse.from(
                organizationService.getById(caller.organizationId())));
    }

    @Operation(summary = "Update the caller's organization")
    @PatchMapping("/current")
    @PreAuthorize("hasAuthority('manage_organization')")
    public ResponseEntity<OrganizationResponse> updateCurrent(
            @AuthenticationPrincipal final AuthenticatedUser caller,
            @Valid @RequestBody final UpdateOrganizationRequest request) {
        return ResponseEntity.ok(OrganizationResponse.from(
                organizationService.update(caller.organizationId(),
                        request.name(), request.slug(), request.plan(),
                        request.settings())));
    }

    @Operation(summary = "List the members of the caller's organization")
    @GetMapping("/current/members")
    @PreAuthorize("hasAuthority('view_user')")
    public ResponseEntity<List<UserResponse>> currentMembers(
            @AuthenticationPrincipal final AuthenticatedUser caller) {
        return ResponseEntity.ok(organizationService
                .members(caller.organizationId()).stream()
                .map(UserResponse::from)
                .toList());
    }

    @Operation(summary = "Create an organization")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "409", description = "Slug taken")
    })
    @PostMapping
    @PreAuthorize("hasAuthority('manage_organization')")
    public ResponseEntity<OrganizationResponse> create(
            @Valid @RequestBody final CreateOrganizationRequest request) {
        final Organization organization = organizationService.create(
                request.name(), request.slug(), request.plan(),
                request.settings());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(OrganizationResponse.from(organization));
    }

    @Operation(summary = "List organizations")
    @GetMapping
    @PreAuthorize("hasAuthority('manage_organization')")
    public ResponseEntity<List<OrganizationResponse>> list() {
        return ResponseEntity.ok(organizationService.findAll().stream()
                .map(OrganizationResponse::from)
                .toList());
    }

    @Operation(summary = "Get an organization by ID")
    @GetMapping("/{id}")
    public ResponseEntity<OrganizationResponse> get(
            @PathVariable("id") final String id) {
        return ResponseEntity.ok(OrganizationResponse.from(
                organizationService.getById(id)));
    }

    @Operation(summary = "Get an organization by slug")
    @GetMapping("/slug/{slug}")
    public ResponseEntity<OrganizationResponse> getBySlug(
            @PathVariable("slug") final String slug) {
        return ResponseEntity.ok(OrganizationResponse.from(
                organizationService.getBySlug(slug)));
    }

    @Operation(summary = "Update an organization")
    @PatchMapping("/{id}")
    @PreAuthorize("hasAuthority('manage_organization')")
    public ResponseEntity<OrganizationResponse> update(
            @PathVariable("id") final String id,
            @Valid @RequestBody final UpdateOrganizationRequest request) {
        return ResponseEntity.ok(OrganizationResponse.from(
                organizationService.update(id, request.name(),
                        request.slug(), request.plan(), request.settings())));
    }

    @Operation(summary = "Delete an organization")
    @DeleteMapping("/{id}")
    @PreAuthorize("hasAuthority('manage_organization')")
    public ResponseEntity<Void> delete(@PathVariable("id") final String id) {
        organizationService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "List the members of an organization")
    @GetMapping("/{id}/members")
    @PreAuthorize("hasAuthority('view_user')")
    public ResponseEntity<List<UserResponse>> members(
            @PathVariable("id") final String id) {
        return ResponseEntity.ok(organizationService.members(id).stream()
                .map(UserResponse::from)
                .toList());
    }

    /** Request to create an organization. */
    public record CreateOrganizationRequest(
            @NotBlank @Size(max = 255) String name,
            @NotBlank @Size(min = 2, max = 100)
            @Pattern(regexp = "^[a-z0-9]+(?:-[a-z0-9]+)*$",
                    message = "must contain only lowercase letters, numbers"
                            + " and hyphens")
            String slug,
            OrganizationPlan plan,
            Map<String, Object> settings
    ) {}

    /** Partial update of an organization. */
    public record UpdateOrganizationRequest(
            @Size(min = 1, max = 255) String name,
            @Size(min = 2, max = 100) String slug,
            OrganizationPlan plan,
            Map<String, Object> settings
    ) {}

    /** Organization as returned by the API. */
    public record OrganizationResponse(
            String id,
            String name,
            String slug,
            OrganizationPlan plan,
            Map<String, Object> settings,
            Instant createdAt
    ) {
        static OrganizationResponse from(final Organization organization) {
            return new OrganizationResponse(
                    organization.id(),
                    organization.name(),
                    organization.slug().value(),
                    organization.plan(),
                    organization.settings(),
                    organization.createdAt());
        }
    }

}
