package co.fanki.qualityhub.project.application;

import co.fanki.qualityhub.auth.domain.AuthenticatedUser;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

import java.util.Map;

/**
 * Rejects requests that address a project of another organization.
 *
 * <p>Runs for every route with a {@code projectId} path variable. The
 * project must exist, must not be deleted and must belong to the caller's
 * organization; otherwise the request fails with 404 before the
 * controller runs.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class ProjectAccessInterceptor implements HandlerInterceptor {

    private final ProjectService projectService;

    /**
     * Creates a new ProjectAccessInterceptor.
     *
     * @param theProjectService the project service
     */
    public ProjectAccessInterceptor(final ProjectService theProjectService) {
        this.projectService = theProjectService;
    }

    @Override
    public boolean preHandle(final HttpServletRequest request,
            final HttpServletResponse response, final Object handler) {

        @SuppressWarnings("unchecked")
        final Map<String, String> pathVariables = (Map<String, String>)
                request.getAttribute(
                        HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (pathVariables == null || !pathVariables.containsKey("projectId")) {
            return true;
        }

        final Authentication authentication = SecurityContextHolder
                .getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal()
                instanceof AuthenticatedUser)) {
            return true;
        }

        final AuthenticatedUser caller =
                (AuthenticatedUser) authentication.getPrincipal();
        projectService.getForOrganization(pathVariables.get("projectId"),
                caller.organizationId());
        return true;
    }

}
