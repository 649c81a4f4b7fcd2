package co.fanki.qualityhub.auth.application;

import co.fanki.qualityhub.auth.application.AuthService.LoginResult;
import co.fanki.qualityhub.auth.application.AuthService.TokenPair;
import co.fanki.qualityhub.auth.domain.AuthenticatedUser;
import co.fanki.qualityhub.user.application.UserController.UserResponse;
import co.fanki.qualityhub.user.domain.User;
import co.fanki.qualityhub.user.domain.UserRole;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for authentication.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/v1/auth")
@Tag(name = "Authentication", description = "Sign up, login and tokens")
public class AuthController {

    private final AuthService authService;

    /**
     * Creates a new AuthController.
     *
     * @param theAuthService the auth service
     */
    public AuthController(final AuthService theAuthService) {
        this.authService = theAuthService;
    }

    @Operation(summary = "Register a user and their organization")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Registered"),
            @ApiResponse(responseCode = "409",
                    description = "Email already registered")
    })
    @PostMapping("/register")
    public ResponseEntity<UserResponse> register(
            @Valid @RequestBody final RegisterRequest request) {
        final User user = authService.register(request.email(),
                request.password(), request.name(),
                request.organizationName());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(UserResponse.from(user));
    }

    @Operation(summary = "Log in with e-mail and password")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Logged in"),
            @ApiResponse(responseCode = "401",
                    description = "Invalid credentials")
    })
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(
            @Valid @RequestBody final LoginRequest request) {
        final LoginResult result = authService.login(request.email(),
                request.password());
        final User user = result.user();
        return ResponseEntity.ok(new LoginResponse(
                result.tokens().accessToken(),
                result.tokens().refreshToken(),
                result.tokens().expiresIn(),
                new LoginUser(user.id(), user.email().value(), user.name(),
                        user.role(), user.organizationId())));
    }

    @Operation(summary = "Exchange a refresh token for a new pair")
    @PostMapping("/refresh")
    public ResponseEntity<TokenPair> refresh(
            @Valid @RequestBody final RefreshRequest request) {
        return ResponseEntity.ok(authService.refresh(request.refreshToken()));
    }

    @Operation(summary = "Revoke a refresh token")
    @PostMapping("/logout")
    @SecurityRequirement(name = "bearerAuth")
    public ResponseEntity<Map<String, String>> logout(
            @Valid @RequestBody final RefreshRequest request) {
        authService.logout(request.refreshToken());
        return ResponseEntity.ok(Map.of("message", "Logged out successfully"));
    }

    @Operation(summary = "Revoke every refresh token of the caller")
    @PostMapping("/logout-all")
    @SecurityRequirement(name = "bearerAuth")
    public ResponseEntity<Map<String, String>> logoutAll(
            @AuthenticationPrincipal final AuthenticatedUser caller) {
        authService.logoutEverywhere(caller.userId());
        return ResponseEntity.ok(Map.of("message",
                "Logged out from every session"));
    }

    @Operation(summary = "Get the authenticated user")
    @GetMapping("/me")
    @SecurityRequirement(name = "bearerAuth")
    public ResponseEntity<UserResponse> me(
            @AuthenticationPrincipal final AuthenticatedUser caller) {
        return ResponseEntity.ok(UserResponse.from(
                authService.me(caller.userId())));
    }

    /** Sign up request. */
    public record RegisterRequest(
            @NotBlank @Email String email,
            @NotBlank @Size(min = 8, max = 128) String password,
            @NotBlank @Size(max = 255) String name,
            @Size(max = 255) String organizationName
    ) {}

    /** Login request. */
    public record LoginRequest(
            @NotBlank @Email String email,
            @NotBlank String password
    ) {}

    /** Refresh or logout request. */
    public record RefreshRequest(
            @NotBlank String refreshToken
    ) {}

    /** Login response. */
    public record LoginResponse(
            String accessToken,
            String refreshToken,
            long expiresIn,
            LoginUser user
    ) {}

    /** User summary embedded in the login response. */
    public record LoginUser(
            String id,
            String email,
            String name,
            UserRole role,
            String orgId
    ) {}

}
