package co.fanki.qualityhub.auth.application;

import co.fanki.qualityhub.auth.domain.AuthenticatedUser;
import co.fanki.qualityhub.auth.domain.JwtTokenProvider;
import co.fanki.qualityhub.auth.domain.Permission;
import co.fanki.qualityhub.auth.domain.RolePermissions;
import co.fanki.qualityhub.shared.DomainException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Authenticates requests carrying an {@code Authorization: Bearer} access
 * token.
 *
 * <p>A valid token populates the security context with an
 * {@link AuthenticatedUser} principal whose authorities are the role's
 * permissions. An invalid token leaves the context empty, so protected
 * routes answer 401 through the entry point.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger LOG = LoggerFactory.getLogger(
            JwtAuthenticationFilter.class);

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenProvider tokenProvider;

    /**
     * Creates a new JwtAuthenticationFilter.
     *
     * @param theTokenProvider the token provider
     */
    public JwtAuthenticationFilter(final JwtTokenProvider theTokenProvider) {
        this.tokenProvider = theTokenProvider;
    }

    @Override
    protected void doFilterInternal(final HttpServletRequest request,
            final HttpServletResponse response, final FilterChain chain)
            throws ServletException, IOException {

        final String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            authenticate(header.substring(BEARER_PREFIX.length()).trim(),
                    request);
        }
        chain.doFilter(request, response);
    }

    private void authenticate(final String token,
            final HttpServletRequest request) {
        try {
            final AuthenticatedUser user = tokenProvider.parseAccessToken(token);
            final List<GrantedAuthority> authorities = RolePermissions
                    .of(user.role()).stream()
                    .map(Permission::authority)
                    .<GrantedAuthority>map(SimpleGrantedAuthority::new)
                    .toList();
            SecurityContextHolder.getContext().setAuthentication(
                    new UsernamePasswordAuthenticationToken(
                            user, null, authorities));
        } catch (final DomainException e) {
            LOG.debug("Rejected bearer token on {} {}: {}",
                    request.getMethod(), request.getRequestURI(),
                    e.getMessage());
            SecurityContextHolder.clearContext();
        }
    }

}
