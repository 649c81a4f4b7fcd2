package co.fanki.qualityhub.requirement.application;

import co.fanki.qualityhub.auth.domain.AuthenticatedUser;
import co.fanki.qualityhub.config.GlobalExceptionHandler;
import co.fanki.qualityhub.requirement.domain.CoverageStatistics;
import co.fanki.qualityhub.requirement.domain.Requirement;
import co.fanki.qualityhub.requirement.domain.RequirementCoverage;
import co.fanki.qualityhub.requirement.domain.RequirementSource;
import co.fanki.qualityhub.requirement.domain.RequirementStatus;
import co.fanki.qualityhub.shared.DomainException;
import co.fanki.qualityhub.user.domain.UserRole;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.method.annotation.AuthenticationPrincipalArgumentResolver;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.isNull;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Unit tests for {@link RequirementController}, wired with the
 * {@link GlobalExceptionHandler} so error bodies are checked too.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class RequirementControllerTest {

    private static final String PROJECT_ID = "project-1";

    private static final AuthenticatedUser CALLER = new AuthenticatedUser(
            "user-1", "lead@acme.io", "org-1", UserRole.LEAD);

    private RequirementService requirementService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        requirementService = createMock(RequirementService.class);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new RequirementController(requirementService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .setCustomArgumentResolvers(
                        new AuthenticationPrincipalArgumentResolver())
                .build();
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken(CALLER, null,
                        List.of()));
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void whenCreating_givenValidBody_shouldAnswerCreatedWithWireValues()
            throws Exception {
        final Requirement requirement = Requirement.create(PROJECT_ID,
                "JIRA-42", "Users can reset their password", null,
                RequirementSource.JIRA, RequirementStatus.APPROVED, null,
                CALLER.userId());
        expect(requirementService.create(eq(PROJECT_ID), eq("JIRA-42"),
                eq("Users can reset their password"), isNull(),
                eq(RequirementSource.JIRA), eq(RequirementStatus.APPROVED),
                isNull(), eq("user-1"))).andReturn(requirement);
        replay(requirementService);

        mockMvc.perform(post("/api/v1/projects/{projectId}/requirements",
                        PROJECT_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"externalId":"JIRA-42",
                                 "title":"Users can reset their password",
                                 "source":"jira","status":"approved"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(requirement.id()))
                .andExpect(jsonPath("$.source").value("jira"))
                .andExpect(jsonPath("$.status").value("approved"))
                .andExpect(jsonPath("$.createdBy").value("user-1"));

        verify(requirementService);
    }

    @Test
    void whenCreating_givenBlankTitle_shouldAnswerValidationError()
            throws Exception {
        replay(requirementService);

        mockMvc.perform(post("/api/v1/projects/{projectId}/requirements",
                        PROJECT_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.statusCode").value(400))
                .andExpect(jsonPath("$.message").value("Validation failed"))
                .andExpect(jsonPath("$.details").isArray());

        verify(requirementService);
    }

    @Test
    void whenGetting_givenUnknownRequirement_shouldAnswerNotFound()
            throws Exception {
        expect(requirementService.getById(PROJECT_ID, "missing"))
                .andThrow(DomainException.notFound("Requirement", "missing"));
        replay(requirementService);

        mockMvc.perform(get(
                        "/api/v1/projects/{projectId}/requirements/{id}",
                        PROJECT_ID, "missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value(
                        "Requirement with ID missing not found"))
                .andExpect(jsonPath("$.error").value("Not Found"))
                .andExpect(jsonPath("$.method").value("GET"))
                .andExpect(jsonPath("$.path").value(
                        "/api/v1/projects/project-1/requirements/missing"))
                .andExpect(jsonPath("$.details").doesNotExist());

        verify(requirementService);
    }

    @Test
    void whenAddingCoverage_givenCases_shouldAnswerNewLinksOnly()
            throws Exception {
        final RequirementCoverage link = RequirementCoverage.reconstitute(
                "link-1", "req-1", "case-2", "user-1",
                Instant.parse("2026-01-10T10:00:00Z"));
        expect(requirementService.addCoverage(PROJECT_ID, "req-1",
                List.of("case-1", "case-2"), "user-1"))
                .andReturn(List.of(link));
        replay(requirementService);

        mockMvc.perform(post(
                        "/api/v1/projects/{projectId}/requirements/{id}/coverage",
                        PROJECT_ID, "req-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"testCaseIds\":[\"case-1\",\"case-2\"]}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].testCaseId").value("case-2"));

        verify(requirementService);
    }

    @Test
    void whenAddingCoverage_givenEmptyList_shouldAnswerBadRequest()
            throws Exception {
        replay(requirementService);

        mockMvc.perform(post(
                        "/api/v1/projects/{projectId}/requirements/{id}/coverage",
                        PROJECT_ID, "req-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"testCaseIds\":[]}"))
                .andExpect(status().isBadRequest());

        verify(requirementService);
    }

    @Test
    void whenRemovingCoverage_givenMissingLink_shouldAnswerNotFound()
            throws Exception {
        requirementService.removeCoverage(PROJECT_ID, "req-1", "case-9");
        expectLastCall().andThrow(new DomainException(
                "Test case is not linked to this requirement",
                "COVERAGE_NOT_FOUND"));
        replay(requirementService);

        mockMvc.perform(delete(
                        "/api/v1/projects/{projectId}/requirements/{id}"
                                + "/coverage/{caseId}",
                        PROJECT_ID, "req-1", "case-9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value(
                        "Test case is not linked to this requirement"));

        verify(requirementService);
    }

    @Test
    void whenReadingProjectStatistics_givenCoverage_shouldRenderPercentage()
            throws Exception {
        expect(requirementService.projectStatistics(PROJECT_ID))
                .andReturn(CoverageStatistics.of(3, 2));
        replay(requirementService);

        mockMvc.perform(get(
                        "/api/v1/projects/{projectId}/requirements/statistics",
                        PROJECT_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.coveragePercentage").value(67));

        verify(requirementService);
    }

}
