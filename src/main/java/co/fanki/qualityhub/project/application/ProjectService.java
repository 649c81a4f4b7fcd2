package co.fanki.qualityhub.project.application;

import co.fanki.qualityhub.project.domain.Project;
import co.fanki.qualityhub.project.domain.ProjectMember;
import co.fanki.qualityhub.project.domain.ProjectMemberRepository;
import co.fanki.qualityhub.project.domain.ProjectMemberRole;
import co.fanki.qualityhub.project.domain.ProjectRepository;
import co.fanki.qualityhub.shared.DomainException;
import co.fanki.qualityhub.user.domain.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

/**
 * Application service for project operations.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ProjectService {

    private static final Logger LOG = LoggerFactory.getLogger(
            ProjectService.class);

    private final ProjectRepository projectRepository;
    private final ProjectMemberRepository memberRepository;
    private final UserRepository userRepository;

    /**
     * Creates a new ProjectService.
     *
     * @param theProjectRepository the project repository
     * @param theMemberRepository the membership repository
     * @param theUserRepository the user repository
     */
    public ProjectService(final ProjectRepository theProjectRepository,
            final ProjectMemberRepository theMemberRepository,
            final UserRepository theUserRepository) {
        this.projectRepository = theProjectRepository;
        this.memberRepository = theMemberRepository;
        this.userRepository = theUserRepository;
    }

    /**
     * Creates a project in an organization.
     *
     * @param organizationId the organization
     * @param name the project name
     * @param description the description, may be null
     * @param settings the settings, may be null
     * @return the created project
     */
    @Transactional
    public Project create(final String organizationId, final String name,
            final String description, final Map<String, Object> settings) {
        final Project project = Project.create(organizationId, name,
                description, settings);
        projectRepository.save(project);

        LOG.info("Project created with ID: {}", project.id());
        return project;
    }

    /**
     * Lists the live projects of an organization.
     *
     * @param organizationId the organization
     * @return the projects
     */
    public List<Project> findByOrganization(final String organizationId) {
        return projectRepository.findByOrganization(organizationId);
    }

    /**
     * Finds a project by ID, throwing if not found.
     *
     * @param projectId the project ID
     * @return the project
     * @throws DomainException if the project is not found or deleted
     */
    public Project getById(final String projectId) {
        return projectRepository.findById(projectId)
                .orElseThrow(() -> DomainException.notFound(
                        "Project", projectId));
    }

    /**
     * Finds a project of an organization. A project of another tenant is
     * reported as not found.
     *
     * @param projectId the project ID
     * @param organizationId the caller's organization
     * @return the project
     * @throws DomainException if not found or owned by another tenant
     */
    public Project getForOrganization(final String projectId,
            final String organizationId) {
        final Project project = getById(projectId);
        if (!project.belongsTo(organizationId)) {
            LOG.warn("Organization {} tried to reach project {}",
                    organizationId, projectId);
            throw DomainException.notFound("Project", projectId);
        }
        return project;
    }

    /**
     * Updates a project. Null arguments are left untouched.
     *
     * @param projectId the project ID
     * @param name the new name
     * @param description the new description
     * @param settings the new settings
     * @return the updated project
     */
    @Transactional
    public Project update(final String projectId, final String name,
            final String description, final Map<String, Object> settings) {
        final Project project = getById(projectId);
        project.update(name, description, settings);
        projectRepository.update(project);

        LOG.info("Updated project {}", projectId);
        return project;
    }

    /**
     * Soft deletes a project.
     *
     * @param projectId the project ID
     * @throws DomainException if not found
     */
    @Transactional
    public void delete(final String projectId) {
        if (!projectRepository.softDelete(projectId)) {
            throw DomainException.notFound("Project", projectId);
        }
        LOG.info("Deleted project {}", projectId);
    }

    /**
     * Adds a user of the project's organization as a member.
     *
     * @param projectId the project ID
     * @param userId the user ID
     * @param role the member role, defaults to tester
     * @return the membership
     * @throws DomainException if the user is unknown or already a member
     */
    @Transactional
    public ProjectMember addMember(final String projectId,
            final String userId, final ProjectMemberRole role) {
        final Project project = getById(projectId);
        userRepository.findById(userId)
                .filter(user -> project.belongsTo(user.organizationId()))
                .orElseThrow(() -> DomainException.notFound("User", userId));

        if (memberRepository.findByProjectAndUser(projectId, userId)
                .isPresent()) {
            throw new DomainException(
                    "User is already a member of this project",
                    "PROJECT_MEMBER_ALREADY_EXISTS");
        }

        final ProjectMember member = ProjectMember.create(projectId, userId,
                role);
        memberRepository.save(member);

        LOG.info("Added user {} to project {} as {}", userId, projectId,
                member.role());
        return member;
    }

    /**
     * Lists the members of a project.
     *
     * @param projectId the project ID
     * @return the memberships
     */
    public List<ProjectMember> members(final String projectId) {
        getById(projectId);
        return memberRepository.findByProject(projectId);
    }

    /**
     * Gets the membership of a user.
     *
     * @param projectId the project ID
     * @param userId the user ID
     * @return the membership
     * @throws DomainException if the user is not a member
     */
    public ProjectMember getMember(final String projectId,
            final String userId) {
        return memberRepository.findByProjectAndUser(projectId, userId)
                .orElseThrow(() -> new DomainException(
                        "Member " + userId + " not found in project "
                                + projectId, "PROJECT_MEMBER_NOT_FOUND"));
    }

    /**
     * Changes the role of a member.
     *
     * @param projectId the project ID
     * @param userId the user ID
     * @param role the new role
     * @return the updated membership
     */
    @Transactional
    public ProjectMember updateMember(final String projectId,
            final String userId, final ProjectMemberRole role) {
        final ProjectMember member = getMember(projectId, userId);
        member.changeRole(role);
        memberRepository.updateRole(member);

        LOG.info("Changed role of user {} in project {} to {}", userId,
                projectId, role);
        return member;
    }

    /**
     * Removes a member from a project.
     *
     * @param projectId the project ID
     * @param userId the user ID
     */
    @Transactional
    public void removeMember(final String projectId, final String userId) {
        final ProjectMember member = getMember(projectId, userId);
        memberRepository.delete(member.id());
        LOG.info("Removed user {} from project {}", userId, projectId);
    }

}
