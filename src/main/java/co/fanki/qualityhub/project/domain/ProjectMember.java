package co.fanki.qualityhub.project.domain;

import co.fanki.qualityhub.shared.Preconditions;

import java.time.Instant;
import java.util.UUID;

/**
 * Membership of a user in a project.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ProjectMember {

    private final String id;
    private final String projectId;
    private final String userId;
    private ProjectMemberRole role;
    private final Instant createdAt;

    private ProjectMember(final String theId, final String theProjectId,
            final String theUserId, final ProjectMemberRole theRole,
            final Instant theCreatedAt) {
        this.id = Preconditions.requireNonBlank(theId, "Member ID is required");
        this.projectId = Preconditions.requireNonBlank(theProjectId,
                "Project ID is required");
        this.userId = Preconditions.requireNonBlank(theUserId,
                "User ID is required");
        this.role = theRole != null ? theRole : ProjectMemberRole.TESTER;
        this.createdAt = theCreatedAt != null ? theCreatedAt : Instant.now();
    }

    /**
     * Adds a user to a project.
     *
     * @param projectId the project
     * @param userId the user
     * @param role the role, defaults to tester
     * @return a new membership
     */
    public static ProjectMember create(final String projectId,
            final String userId, final ProjectMemberRole role) {
        return new ProjectMember(UUID.randomUUID().toString(), projectId,
                userId, role, Instant.now());
    }

    /**
     * Reconstitutes a membership from persistence.
     *
     * @param id the membership ID
     * @param projectId the project
     * @param userId the user
     * @param role the role
     * @param createdAt when added
     * @return the reconstituted membership
     */
    public static ProjectMember reconstitute(final String id,
            final String projectId, final String userId,
            final ProjectMemberRole role, final Instant createdAt) {
        return new ProjectMember(id, projectId, userId, role, createdAt);
    }

    /**
     * Changes the member's role.
     *
     * @param newRole the new role
     */
    public void changeRole(final ProjectMemberRole newRole) {
        this.role = Preconditions.requireNonNull(newRole, "Role is required");
    }

    public String id() {
        return id;
    }

    public String projectId() {
        return projectId;
    }

    public String userId() {
        return userId;
    }

    public ProjectMemberRole role() {
        return role;
    }

    public Instant createdAt() {
        return createdAt;
    }

}
