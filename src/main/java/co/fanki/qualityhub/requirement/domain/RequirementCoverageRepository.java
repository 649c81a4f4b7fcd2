package co.fanki.qualityhub.requirement.domain;

import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Repository for requirement to test case links.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class RequirementCoverageRepository {

    /** Links of a requirement. Uses: uq_requirement_coverage_requirement_case. */
    public static final String FIND_BY_REQUIREMENT = """
            SELECT * FROM requirement_coverage
            WHERE requirement_id = :requirementId
            ORDER BY created_at
            """;

    /**
     * Live requirements of a project with at least one link.
     * Uses: idx_requirements_project_id, uq_requirement_coverage_requirement_case.
     */
    public static final String COUNT_COVERED_REQUIREMENTS = """
            SELECT COUNT(DISTINCT rc.requirement_id)
            FROM requirement_coverage rc
            JOIN requirements r ON r.id = rc.requirement_id
            WHERE r.project_id = :projectId AND r.deleted_at IS NULL
            """;

    private final Jdbi jdbi;

    /**
     * Creates a new RequirementCoverageRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public RequirementCoverageRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    public void save(final RequirementCoverage coverage) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO requirement_coverage (
                    id, requirement_id, case_id, created_by, created_at
                ) VALUES (
                    :id, :requirementId, :caseId, :createdBy, :createdAt
                )
                """)
                .bind("id", coverage.id())
                .bind("requirementId", coverage.requirementId())
                .bind("caseId", coverage.caseId())
                .bind("createdBy", coverage.createdBy())
                .bind("createdAt", Timestamp.from(coverage.createdAt()))
                .execute());
    }

    public List<RequirementCoverage> findByRequirement(
            final String requirementId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_REQUIREMENT)
                .bind("requirementId", requirementId)
                .map(new CoverageRowMapper())
                .list());
    }

    /**
     * Returns which of the given cases are already linked to a requirement.
     *
     * @param requirementId the requirement ID
     * @param caseIds the candidate case IDs
     * @return the subset already linked
     */
    public Set<String> caseIdsIn(final String requirementId,
            final Collection<String> caseIds) {
        if (caseIds.isEmpty()) {
            return Set.of();
        }
        return jdbi.withHandle(handle -> handle
                .createQuery("""
                        SELECT case_id FROM requirement_coverage
                        WHERE requirement_id = :requirementId
                          AND case_id IN (<caseIds>)
                        """)
                .bind("requirementId", requirementId)
                .bindList("caseIds", caseIds)
                .mapTo(String.class)
                .collect(Collectors.toCollection(HashSet::new)));
    }

    public long countByRequirement(final String requirementId) {
        return jdbi.withHandle(handle -> handle
                .createQuery("""
                        SELECT COUNT(*) FROM requirement_coverage
                        WHERE requirement_id = :requirementId
                        """)
                .bind("requirementId", requirementId)
                .mapTo(Long.class)
                .one());
    }

    public long countCoveredRequirements(final String projectId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(COUNT_COVERED_REQUIREMENTS)
                .bind("projectId", projectId)
                .mapTo(Long.class)
                .one());
    }

    /**
     * Removes the link between a requirement and a case.
     *
     * @param requirementId the requirement ID
     * @param caseId the case ID
     * @return true if a link was removed
     */
    public boolean delete(final String requirementId, final String caseId) {
        return jdbi.withHandle(handle -> handle.createUpdate("""
                DELETE FROM requirement_coverage
                WHERE requirement_id = :requirementId AND case_id = :caseId
                """)
                .bind("requirementId", requirementId)
                .bind("caseId", caseId)
                .execute()) > 0;
    }

    private static final class CoverageRowMapper
            implements RowMapper<RequirementCoverage> {

        @Override
        public RequirementCoverage map(final ResultSet rs,
                final StatementContext ctx) throws SQLException {
            return RequirementCoverage.reconstitute(
                    rs.getString("id"),
                    rs.getString("requirement_id"),
                    rs.getString("case_id"),
                    rs.getString("created_by"),
                    rs.getTimestamp("created_at").toInstant());
        }
    }

}
