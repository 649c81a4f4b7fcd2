package co.fanki.qualityhub.auth.domain;

import co.fanki.qualityhub.shared.DomainException;
import co.fanki.qualityhub.shared.Preconditions;
import co.fanki.qualityhub.user.domain.User;
import co.fanki.qualityhub.user.domain.UserRole;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;

/**
 * Issues and verifies the HS256 signed tokens of the API.
 *
 * <p>Access tokens carry {@code sub}, {@code email}, {@code orgId} and
 * {@code role}. Refresh tokens carry only {@code sub} and a {@code jti}
 * pointing at a {@link RefreshToken} record. Both carry a {@code type}
 * claim so one can never be used in place of the other.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class JwtTokenProvider {

    private static final Logger LOG = LoggerFactory.getLogger(
            JwtTokenProvider.class);

    private static final String TYPE_CLAIM = "type";
    private static final String ACCESS_TYPE = "access";
    private static final String REFRESH_TYPE = "refresh";

    private final SecretKey key;
    private final long accessTokenExpirySeconds;
    private final long refreshTokenExpirySeconds;

    /**
     * Creates a new JwtTokenProvider.
     *
     * @param secret the HMAC secret, at least 32 characters
     * @param theAccessTokenExpirySeconds access token lifetime
     * @param theRefreshTokenExpirySeconds refresh token lifetime
     */
    public JwtTokenProvider(
            @Value("${auth.jwt.secret}") final String secret,
            @Value("${auth.jwt.access-token-expiry:900}")
            final long theAccessTokenExpirySeconds,
            @Value("${auth.jwt.refresh-token-expiry:604800}")
            final long theRefreshTokenExpirySeconds) {
        Preconditions.requireNonBlank(secret, "JWT secret is required");
        Preconditions.require(secret.length() >= 32,
                "JWT secret must be at least 32 characters");
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.accessTokenExpirySeconds = theAccessTokenExpirySeconds;
        this.refreshTokenExpirySeconds = theRefreshTokenExpirySeconds;
    }

    /**
     * Signs an access token for a user.
     *
     * @param user the user
     * @return the compact JWT
     */
    public String createAccessToken(final User user) {
        final Instant now = Instant.now();
        return Jwts.builder()
                .subject(user.id())
                .claim("email", user.email().value())
                .claim("orgId", user.organizationId())
                .claim("role", user.role().value())
                .claim(TYPE_CLAIM, ACCESS_TYPE)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusSeconds(accessTokenExpirySeconds)))
                .signWith(key)
                .compact();
    }

    /**
     * Signs a refresh token bound to a stored record.
     *
     * @param record the persisted refresh token record
     * @return the compact JWT
     */
    public String createRefreshToken(final RefreshToken record) {
        return Jwts.builder()
                .subject(record.userId())
                .id(record.id())
                .claim(TYPE_CLAIM, REFRESH_TYPE)
                .issuedAt(Date.from(record.createdAt()))
                .expiration(Date.from(record.expiresAt()))
                .signWith(key)
                .compact();
    }

    /**
     * Computes when a refresh token issued now expires.
     *
     * @return the expiration instant
     */
    public Instant refreshTokenExpiration() {
        return Instant.now().plusSeconds(refreshTokenExpirySeconds);
    }

    /**
     * Verifies an access token and extracts the caller.
     *
     * @param token the compact JWT
     * @return the authenticated user
     * @throws DomainException with code {@code INVALID_TOKEN} if the token
     *         is malformed, expired, badly signed or not an access token
     */
    public AuthenticatedUser parseAccessToken(final String token) {
        final Claims claims = parse(token, ACCESS_TYPE);
        try {
            return new AuthenticatedUser(
                    claims.getSubject(),
                    claims.get("email", String.class),
                    claims.get("orgId", String.class),
                    UserRole.fromValue(claims.get("role", String.class)));
        } catch (final IllegalArgumentException e) {
            throw new DomainException("Invalid token", "INVALID_TOKEN", e);
        }
    }

    /**
     * Verifies a refresh token and returns its record ID.
     *
     * @param token the compact JWT
     * @return the {@code jti} claim
     * @throws DomainException with code {@code INVALID_TOKEN} if invalid
     */
    public String parseRefreshTokenId(final String token) {
        final Claims claims = parse(token, REFRESH_TYPE);
        if (claims.getId() == null) {
            throw new DomainException("Invalid refresh token",
                    "INVALID_TOKEN");
        }
        return claims.getId();
    }

    public long accessTokenExpirySeconds() {
        return accessTokenExpirySeconds;
    }

    private Claims parse(final String token, final String expectedType) {
        if (token == null || token.isBlank()) {
            throw new DomainException("Token is required", "INVALID_TOKEN");
        }
        final Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(key)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (final JwtException | IllegalArgumentException e) {
            LOG.debug("Rejected {} token: {}", expectedType, e.getMessage());
            throw new DomainException("Invalid or expired token",
                    "INVALID_TOKEN", e);
        }
        if (!expectedType.equals(claims.get(TYPE_CLAIM, String.class))) {
            throw new DomainException("Invalid token type", "INVALID_TOKEN");
        }
        return claims;
    }

}
