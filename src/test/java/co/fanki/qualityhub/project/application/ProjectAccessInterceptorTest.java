package co.fanki.qualityhub.project.application;

import co.fanki.qualityhub.auth.domain.AuthenticatedUser;
import co.fanki.qualityhub.project.domain.Project;
import co.fanki.qualityhub.shared.DomainException;
import co.fanki.qualityhub.user.domain.UserRole;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.servlet.HandlerMapping;

import java.util.List;
import java.util.Map;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ProjectAccessInterceptor}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ProjectAccessInterceptorTest {

    private ProjectService projectService;
    private ProjectAccessInterceptor interceptor;

    @BeforeEach
    void setUp() {
        projectService = createMock(ProjectService.class);
        interceptor = new ProjectAccessInterceptor(projectService);
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void whenHandling_givenRouteWithoutProject_shouldPassThrough() {
        replay(projectService);
        authenticate("org-1");

        assertTrue(interceptor.preHandle(request(Map.of("userId", "u-1")),
                new MockHttpServletResponse(), new Object()));

        verify(projectService);
    }

    @Test
    void whenHandling_givenProjectOfCallerOrganization_shouldPassThrough() {
        expect(projectService.getForOrganization("project-1", "org-1"))
                .andReturn(Project.create("org-1", "Checkout", null, null));
        replay(projectService);
        authenticate("org-1");

        assertTrue(interceptor.preHandle(
                request(Map.of("projectId", "project-1")),
                new MockHttpServletResponse(), new Object()));

        verify(projectService);
    }

    @Test
    void whenHandling_givenProjectOfAnotherOrganization_shouldThrowNotFound() {
        expect(projectService.getForOrganization("project-1", "org-2"))
                .andThrow(DomainException.notFound("Project", "project-1"));
        replay(projectService);
        authenticate("org-2");

        final DomainException error = assertThrows(DomainException.class,
                () -> interceptor.preHandle(
                        request(Map.of("projectId", "project-1")),
                        new MockHttpServletResponse(), new Object()));

        verify(projectService);
        assertEquals("PROJECT_NOT_FOUND", error.getErrorCode());
    }

    @Test
    void whenHandling_givenAnonymousCaller_shouldLeaveItToSecurity() {
        replay(projectService);

        assertTrue(interceptor.preHandle(
                request(Map.of("projectId", "project-1")),
                new MockHttpServletResponse(), new Object()));

        verify(projectService);
    }

    private static MockHttpServletRequest request(
            final Map<String, String> pathVariables) {
        final MockHttpServletRequest request = new MockHttpServletRequest();
        request.setAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE,
                pathVariables);
        return request;
    }

    private static void authenticate(final String organizationId) {
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken(new AuthenticatedUser(
                        "user-1", "tester@acme.io", organizationId,
                        UserRole.TESTER), null, List.of()));
    }

}
