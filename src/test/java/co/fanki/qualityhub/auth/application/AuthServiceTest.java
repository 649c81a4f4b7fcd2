package co.fanki.qualityhub.auth.application;

import co.fanki.qualityhub.auth.application.AuthService.LoginResult;
import co.fanki.qualityhub.auth.application.AuthService.TokenPair;
import co.fanki.qualityhub.auth.domain.JwtTokenProvider;
import co.fanki.qualityhub.auth.domain.PasswordHasher;
import co.fanki.qualityhub.auth.domain.RefreshToken;
import co.fanki.qualityhub.auth.domain.RefreshTokenRepository;
import co.fanki.qualityhub.organization.application.OrganizationService;
import co.fanki.qualityhub.organization.domain.Organization;
import co.fanki.qualityhub.organization.domain.OrganizationPlan;
import co.fanki.qualityhub.organization.domain.OrganizationSlug;
import co.fanki.qualityhub.shared.DomainException;
import co.fanki.qualityhub.user.domain.Email;
import co.fanki.qualityhub.user.domain.User;
import co.fanki.qualityhub.user.domain.UserRepository;
import co.fanki.qualityhub.user.domain.UserRole;

import org.easymock.Capture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.capture;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.newCapture;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link AuthService}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AuthServiceTest {

    private UserRepository userRepository;
    private RefreshTokenRepository refreshTokenRepository;
    private OrganizationService organizationService;
    private PasswordHasher passwordHasher;
    private JwtTokenProvider tokenProvider;

    private AuthService service;

    @BeforeEach
    void setUp() {
        userRepository = createMock(UserRepository.class);
        refreshTokenRepository = createMock(RefreshTokenRepository.class);
        organizationService = createMock(OrganizationService.class);
        passwordHasher = new PasswordHasher(4);
        tokenProvider = new JwtTokenProvider(
                "auth-service-test-secret-0123456789abcdef", 900, 3600);

        service = new AuthService(userRepository, refreshTokenRepository,
                organizationService, passwordHasher, tokenProvider);
    }

    @Test
    void whenRegistering_givenNewEmail_shouldCreateOrgAdminWithOrganization() {
        final Organization organization = Organization.create("Jane's Organization",
                OrganizationSlug.of("jane-s-organization"),
                OrganizationPlan.FREE, null);
        final Capture<User> saved = newCapture();

        expect(userRepository.existsByEmail(Email.of("jane@acme.io")))
                .andReturn(false);
        expect(organizationService.createFromName("Jane's Organization"))
                .andReturn(organization);
        userRepository.save(capture(saved));
        expectLastCall();
        replay(userRepository, organizationService);

        final User user = service.register("Jane@Acme.io", "s3cret-pass",
                "Jane", null);

        verify(userRepository, organizationService);
        assertEquals(UserRole.ORG_ADMIN, user.role());
        assertEquals(organization.id(), user.organizationId());
        assertEquals("jane@acme.io", user.email().value());
        assertEquals(user, saved.getValue());
    }

    @Test
    void whenRegistering_givenTakenEmail_shouldThrowConflict() {
        expect(userRepository.existsByEmail(Email.of("jane@acme.io")))
                .andReturn(true);
        replay(userRepository, organizationService);

        final DomainException error = assertThrows(DomainException.class,
                () -> service.register("jane@acme.io", "s3cret-pass",
                        "Jane", "Acme"));

        verify(userRepository, organizationService);
        assertEquals("EMAIL_ALREADY_EXISTS", error.getErrorCode());
    }

    @Test
    void whenLoggingIn_givenValidCredentials_shouldIssueTokens() {
        final User user = existingUser("s3cret-pass");

        expect(userRepository.findByEmail(Email.of("jane@acme.io")))
                .andReturn(Optional.of(user));
        refreshTokenRepository.save(anyObject(RefreshToken.class));
        expectLastCall();
        replay(userRepository, refreshTokenRepository);

        final LoginResult result = service.login("jane@acme.io",
                "s3cret-pass");

        verify(userRepository, refreshTokenRepository);
        assertEquals(user, result.user());
        assertEquals(900, result.tokens().expiresIn());
        assertEquals(user.id(), tokenProvider.parseAccessToken(
                result.tokens().accessToken()).userId());
    }

    @Test
    void whenLoggingIn_givenWrongPassword_shouldRejectCredentials() {
        final User user = existingUser("s3cret-pass");

        expect(userRepository.findByEmail(Email.of("jane@acme.io")))
                .andReturn(Optional.of(user));
        replay(userRepository, refreshTokenRepository);

        final DomainException error = assertThrows(DomainException.class,
                () -> service.login("jane@acme.io", "wrong-pass"));

        verify(userRepository, refreshTokenRepository);
        assertEquals("INVALID_CREDENTIALS", error.getErrorCode());
    }

    @Test
    void whenLoggingIn_givenUnknownEmail_shouldRejectCredentials() {
        expect(userRepository.findByEmail(Email.of("ghost@acme.io")))
                .andReturn(Optional.empty());
        replay(userRepository, refreshTokenRepository);

        final DomainException error = assertThrows(DomainException.class,
                () -> service.login("ghost@acme.io", "whatever"));

        assertEquals("INVALID_CREDENTIALS", error.getErrorCode());
    }

    @Test
    void whenRefreshing_givenUsableToken_shouldRotatePair() {
        final User user = existingUser("s3cret-pass");
        final RefreshToken record = RefreshToken.issue(user.id(),
                Instant.now().plusSeconds(600));
        final String token = tokenProvider.createRefreshToken(record);

        expect(refreshTokenRepository.findById(record.id()))
                .andReturn(Optional.of(record));
        expect(refreshTokenRepository.revoke(record.id())).andReturn(true);
        expect(userRepository.findById(user.id()))
                .andReturn(Optional.of(user));
        refreshTokenRepository.save(anyObject(RefreshToken.class));
        expectLastCall();
        replay(userRepository, refreshTokenRepository);

        final TokenPair pair = service.refresh(token);

        verify(userRepository, refreshTokenRepository);
        assertNotNull(pair.accessToken());
        assertEquals(user.id(),
                tokenProvider.parseAccessToken(pair.accessToken()).userId());
    }

    @Test
    void whenRefreshing_givenRevokedToken_shouldRejectToken() {
        final RefreshToken record = RefreshToken.reconstitute("rt-1",
                "user-1", Instant.now().plusSeconds(600),
                Instant.now().minusSeconds(5), Instant.now().minusSeconds(60));
        final String token = tokenProvider.createRefreshToken(record);

        expect(refreshTokenRepository.findById("rt-1"))
                .andReturn(Optional.of(record));
        replay(userRepository, refreshTokenRepository);

        final DomainException error = assertThrows(DomainException.class,
                () -> service.refresh(token));

        verify(userRepository, refreshTokenRepository);
        assertEquals("INVALID_TOKEN", error.getErrorCode());
    }

    @Test
    void whenRefreshing_givenConcurrentRevocation_shouldRejectToken() {
        final RefreshToken record = RefreshToken.issue("user-1",
                Instant.now().plusSeconds(600));
        final String token = tokenProvider.createRefreshToken(record);

        expect(refreshTokenRepository.findById(record.id()))
                .andReturn(Optional.of(record));
        expect(refreshTokenRepository.revoke(record.id())).andReturn(false);
        replay(userRepository, refreshTokenRepository);

        assertThrows(DomainException.class, () -> service.refresh(token));

        verify(userRepository, refreshTokenRepository);
    }

    @Test
    void whenLoggingOut_givenRefreshToken_shouldRevokeIt() {
        final RefreshToken record = RefreshToken.issue("user-1",
                Instant.now().plusSeconds(600));

        expect(refreshTokenRepository.revoke(record.id())).andReturn(true);
        replay(refreshTokenRepository);

        service.logout(tokenProvider.createRefreshToken(record));

        verify(refreshTokenRepository);
    }

    @Test
    void whenLoggingOutEverywhere_givenUser_shouldRevokeAllTokens() {
        expect(refreshTokenRepository.revokeAllForUser("user-1")).andReturn(3);
        replay(refreshTokenRepository);

        service.logoutEverywhere("user-1");

        verify(refreshTokenRepository);
    }

    private User existingUser(final String password) {
        return User.create("org-1", Email.of("jane@acme.io"),
                passwordHasher.hash(password), "Jane", UserRole.TESTER);
    }

}
