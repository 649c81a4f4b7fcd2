package co.fanki.qualityhub.project.domain;

import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * Repository for project memberships.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class ProjectMemberRepository {

    /** Find members of a project. Uses: uq_project_members_project_user. */
    public static final String FIND_BY_PROJECT = """
            SELECT * FROM project_members
            WHERE project_id = :projectId
            ORDER BY created_at
            """;

    /** Find one membership. Uses: uq_project_members_project_user. */
    public static final String FIND_BY_PROJECT_AND_USER = """
            SELECT * FROM project_members
            WHERE project_id = :projectId AND user_id = :userId
            """;

    private final Jdbi jdbi;

    /**
     * Creates a new ProjectMemberRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public ProjectMemberRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    /**
     * Saves a new membership.
     *
     * @param member the membership
     */
    public void save(final ProjectMember member) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO project_members (id, project_id, user_id, role,
                    created_at)
                VALUES (:id, :projectId, :userId, :role, :createdAt)
                """)
                .bind("id", member.id())
                .bind("projectId", member.projectId())
                .bind("userId", member.userId())
                .bind("role", member.role().value())
                .bind("createdAt", Timestamp.from(member.createdAt()))
                .execute());
    }

    /**
     * Persists a role change.
     *
     * @param member the membership
     */
    public void updateRole(final ProjectMember member) {
        jdbi.useHandle(handle -> handle.createUpdate(
                        "UPDATE project_members SET role = :role WHERE id = :id")
                .bind("id", member.id())
                .bind("role", member.role().value())
                .execute());
    }

    /**
     * Lists the members of a project, oldest first.
     *
     * @param projectId the project
     * @return the memberships
     */
    public List<ProjectMember> findByProject(final String projectId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_PROJECT)
                .bind("projectId", projectId)
                .map(new ProjectMemberRowMapper())
                .list());
    }

    /**
     * Finds the membership of a user in a project.
     *
     * @param projectId the project
     * @param userId the user
     * @return the membership if any
     */
    public Optional<ProjectMember> findByProjectAndUser(final String projectId,
            final String userId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_PROJECT_AND_USER)
                .bind("projectId", projectId)
                .bind("userId", userId)
                .map(new ProjectMemberRowMapper())
                .findOne());
    }

    /**
     * Removes a membership.
     *
     * @param id the membership ID
     */
    public void delete(final String id) {
        jdbi.useHandle(handle -> handle
                .createUpdate("DELETE FROM project_members WHERE id = :id")
                .bind("id", id)
                .execute());
    }

    private static final class ProjectMemberRowMapper
            implements RowMapper<ProjectMember> {

        @Override
        public ProjectMember map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            return ProjectMember.reconstitute(
                    rs.getString("id"),
                    rs.getString("project_id"),
                    rs.getString("user_id"),
                    ProjectMemberRole.fromValue(rs.getString("role")),
                    rs.getTimestamp("created_at").toInstant());
        }
    }

}
