package co.fanki.qualityhub.user.application;

import co.fanki.qualityhub.auth.domain.AuthenticatedUser;
import co.fanki.qualityhub.auth.domain.Permission;
import co.fanki.qualityhub.auth.domain.RolePermissions;
import co.fanki.qualityhub.shared.DomainException;
import co.fanki.qualityhub.user.domain.User;
import co.fanki.qualityhub.user.domain.UserRole;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
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

/**
 * REST controller for the users of the caller's organization.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/v1/users")
@Tag(name = "Users", description = "Organization members")
@SecurityRequirement(name = "bearerAuth")
public class UserController {

    private final UserService userService;

    /**
     * Creates a new UserController.
     *
     * @param theUserService the user service
     */
    public UserController(final UserService theUserService) {
        this.userService = theUserService;
    }

    @Operation(summary = "Create a user in the caller's organization")
    @PostMapping
    @PreAuthorize("hasAuthority('create_user')")
    public ResponseEntity<UserResponse> create(
            @AuthenticationPrincipal final AuthenticatedUser caller,
            @Valid @RequestBody final CreateUserRequest request) {
        requireRoleManagement(caller, request.role());
        final User user = userService.create(caller.organizationId(),
                request.email(), request.password(), request.name(),
                request.role());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(UserResponse.from(user));
    }

    @Operation(summary = "List users")
    @GetMapping
    @PreAuthorize("hasAuthority('view_user')")
    public ResponseEntity<List<UserResponse>> list(
            @AuthenticationPrincipal final AuthenticatedUser caller) {
        return ResponseEntity.ok(userService.findAll(caller.organizationId())
                .stream()
                .map(UserResponse::from)
                .toList());
    }

    @Operation(summary = "Get a user")
    @GetMapping("/{id}")
    @PreAuthorize("hasAuthority('view_user')")
    public ResponseEntity<UserResponse> get(
            @AuthenticationPrincipal final AuthenticatedUser caller,
            @PathVariable("id") final String id) {
        return ResponseEntity.ok(UserResponse.from(
                userService.getById(caller.organizationId(), id)));
    }

    @Operation(summary = "Update a user")
    @PatchMapping("/{id}")
    @PreAuthorize("hasAuthority('update_user')")
    public ResponseEntity<UserResponse> update(
            @AuthenticationPrincipal final AuthenticatedUser caller,
            @PathVariable("id") final String id,
            @Valid @RequestBody final UpdateUserRequest request) {
        requireRoleManagement(caller, request.role());
        return ResponseEntity.ok(UserResponse.from(userService.update(
                caller.organizationId(), id, request.name(), request.role())));
    }

    @Operation(summary = "Delete a user")
    @DeleteMapping("/{id}")
    @PreAuthorize("hasAuthority('delete_user')")
    public ResponseEntity<Void> delete(
            @AuthenticationPrincipal final AuthenticatedUser caller,
            @PathVariable("id") final String id) {
        userService.delete(caller.organizationId(), id);
        return ResponseEntity.noContent().build();
    }

    // Assigning any role other than the default needs manage_user_roles.
    private void requireRoleManagement(final AuthenticatedUser caller,
            final UserRole requested) {
        if (requested != null && requested != UserRole.TESTER
                && !RolePermissions.hasPermission(caller.role(),
                        Permission.MANAGE_USER_ROLES)) {
            throw new DomainException(
                    "Access denied: Insufficient permissions",
                    "ACCESS_DENIED");
        }
    }

    /** Request to create a user. */
    public record CreateUserRequest(
            @NotBlank @Email String email,
            @NotBlank @Size(min = 8, max = 128) String password,
            @NotBlank @Size(max = 255) String name,
            UserRole role
    ) {}

    /** Partial update of a user. */
    public record UpdateUserRequest(
            @Size(min = 1, max = 255) String name,
            UserRole role
    ) {}

    /** User as returned by the API, without the password hash. */
    public record UserResponse(
            String id,
            String email,
            String name,
            UserRole role,
            String orgId,
            Instant createdAt
    ) {
        /**
         * Builds the response from a user.
         *
         * @param user the user
         * @return the response
         */
        public static UserResponse from(final User user) {
            return new UserResponse(
                    user.id(),
                    user.email().value(),
                    user.name(),
                    user.role(),
                    user.organizationId(),
                    user.createdAt());
        }
    }

}
