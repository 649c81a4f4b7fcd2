package co.fanki.qualityhub.auth.application;

import co.fanki.qualityhub.auth.domain.JwtTokenProvider;
import co.fanki.qualityhub.auth.domain.PasswordHasher;
import co.fanki.qualityhub.auth.domain.RefreshToken;
import co.fanki.qualityhub.auth.domain.RefreshTokenRepository;
import co.fanki.qualityhub.organization.application.OrganizationService;
import co.fanki.qualityhub.organization.domain.Organization;
import co.fanki.qualityhub.shared.DomainException;
import co.fanki.qualityhub.user.domain.Email;
import co.fanki.qualityhub.user.domain.User;
import co.fanki.qualityhub.user.domain.UserRepository;
import co.fanki.qualityhub.user.domain.UserRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Application service for registration, login and token rotation.
 *
 * <p>Refresh tokens are single use: exchanging one revokes it and issues a
 * new pair. Logging out revokes the presented refresh token.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class AuthService {

    private static final Logger LOG = LoggerFactory.getLogger(
            AuthService.class);

    private static final String INVALID_CREDENTIALS = "Invalid credentials";

    private final UserRepository userRepository;
    private final RefreshTokenRepository refreshTokenRepository;
    private final OrganizationService organizationService;
    private final PasswordHasher passwordHasher;
    private final JwtTokenProvider tokenProvider;

    /**
     * Creates a new AuthService.
     *
     * @param theUserRepository the user repository
     * @param theRefreshTokenRepository the refresh token repository
     * @param theOrganizationService creates the tenant of new sign ups
     * @param thePasswordHasher the password hasher
     * @param theTokenProvider the token provider
     */
    public AuthService(final UserRepository theUserRepository,
            final RefreshTokenRepository theRefreshTokenRepository,
            final OrganizationService theOrganizationService,
            final PasswordHasher thePasswordHasher,
            final JwtTokenProvider theTokenProvider) {
        this.userRepository = theUserRepository;
        this.refreshTokenRepository = theRefreshTokenRepository;
        this.organizationService = theOrganizationService;
        this.passwordHasher = thePasswordHasher;
        this.tokenProvider = theTokenProvider;
    }

    /**
     * Signs up a user together with a fresh organization they administer.
     *
     * @param email the login e-mail
     * @param password the plain password
     * @param name the display name
     * @param organizationName the organization name, defaults to one
     *        derived from the user's name
     * @return the created user
     * @throws DomainException if the e-mail is already registered
     */
    @Transactional
    public User register(final String email, final String password,
            final String name, final String organizationName) {
        final Email userEmail = Email.of(email);
        if (userRepository.existsByEmail(userEmail)) {
            throw new DomainException("Email already registered",
                    "EMAIL_ALREADY_EXISTS");
        }

        final String orgName = organizationName != null
                && !organizationName.isBlank()
                ? organizationName : name + "'s Organization";
        final Organization organization =
                organizationService.createFromName(orgName);

        final User user = User.create(organization.id(), userEmail,
                passwordHasher.hash(password), name, UserRole.ORG_ADMIN);
        userRepository.save(user);

        LOG.info("Registered user {} with organization {}", user.id(),
                organization.id());
        return user;
    }

    /**
     * Verifies credentials and issues a token pair.
     *
     * @param email the login e-mail
     * @param password the plain password
     * @return the tokens and the user
     * @throws DomainException with code {@code INVALID_CREDENTIALS} when the
     *         e-mail is unknown or the password does not match
     */
    @Transactional
    public LoginResult login(final String email, final String password) {
        final User user = userRepository.findByEmail(Email.of(email))
                .filter(u -> passwordHasher.matches(password,
                        u.passwordHash()))
                .orElseThrow(() -> {
                    LOG.warn("Failed login attempt for {}", email);
                    return new DomainException(INVALID_CREDENTIALS,
                            "INVALID_CREDENTIALS");
                });

        LOG.info("User {} logged in", user.id());
        return new LoginResult(issueTokens(user), user);
    }

    /**
     * Exchanges a refresh token for a new pair, revoking the old one.
     *
     * @param refreshToken the refresh JWT
     * @return the new token pair
     * @throws DomainException with code {@code INVALID_TOKEN} if the token
     *         is invalid, expired, revoked, or its user is gone
     */
    @Transactional
    public TokenPair refresh(final String refreshToken) {
        final String tokenId = tokenProvider.parseRefreshTokenId(refreshToken);

        final RefreshToken record = refreshTokenRepository.findById(tokenId)
                .filter(token -> token.isUsable(Instant.now()))
                .orElseThrow(() -> new DomainException(
                        "Invalid or expired refresh token", "INVALID_TOKEN"));

        if (!refreshTokenRepository.revoke(record.id())) {
            throw new DomainException("Token has been invalidated",
                    "INVALID_TOKEN");
        }

        final User user = userRepository.findById(record.userId())
                .orElseThrow(() -> new DomainException("User not found",
                        "INVALID_TOKEN"));

        LOG.debug("Rotated refresh token {} for user {}", tokenId, user.id());
        return issueTokens(user);
    }

    /**
     * Revokes a refresh token.
     *
     * @param refreshToken the refresh JWT
     * @throws DomainException with code {@code INVALID_TOKEN} if the token
     *         cannot be verified
     */
    @Transactional
    public void logout(final String refreshToken) {
        final String tokenId = tokenProvider.parseRefreshTokenId(refreshToken);
        refreshTokenRepository.revoke(tokenId);
        LOG.info("Revoked refresh token {}", tokenId);
    }

    /**
     * Revokes every refresh token of a user.
     *
     * @param userId the user ID
     */
    @Transactional
    public void logoutEverywhere(final String userId) {
        final int revoked = refreshTokenRepository.revokeAllForUser(userId);
        LOG.info("Revoked {} refresh tokens of user {}", revoked, userId);
    }

    /**
     * Returns the user behind a verified access token.
     *
     * @param userId the token subject
     * @return the user
     * @throws DomainException if the user no longer exists
     */
    public User me(final String userId) {
        final Optional<User> user = userRepository.findById(userId);
        return user.orElseThrow(() -> DomainException.notFound(
                "User", userId));
    }

    private TokenPair issueTokens(final User user) {
        final RefreshToken record = RefreshToken.issue(user.id(),
                tokenProvider.refreshTokenExpiration());
        refreshTokenRepository.save(record);
        return new TokenPair(
                tokenProvider.createAccessToken(user),
                tokenProvider.createRefreshToken(record),
                tokenProvider.accessTokenExpirySeconds());
    }

    /**
     * An access and refresh token pair.
     *
     * @param accessToken the short lived access JWT
     * @param refreshToken the single use refresh JWT
     * @param expiresIn access token lifetime in seconds
     */
    public record TokenPair(
            String accessToken,
            String refreshToken,
            long expiresIn
    ) {}

    /**
     * Outcome of a successful login.
     *
     * @param tokens the issued tokens
     * @param user the logged in user
     */
    public record LoginResult(
            TokenPair tokens,
            User user
    ) {}

}
