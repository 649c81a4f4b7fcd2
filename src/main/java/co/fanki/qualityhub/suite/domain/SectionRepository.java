package co.fanki.qualityhub.suite.domain;

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
 * Repository for suite sections.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class SectionRepository {

    /** Find a section of a suite. Uses: PK index. */
    public static final String FIND_BY_ID = """
            SELECT * FROM sections
            WHERE id = :id AND suite_id = :suiteId
            """;

    /** Find the sections of a suite in display order. Uses: idx_sections_suite_id. */
    public static final String FIND_BY_SUITE = """
            SELECT * FROM sections
            WHERE suite_id = :suiteId
            ORDER BY position, created_at
            """;

    /** Check that a section belongs to a project. Uses: PK indexes. */
    public static final String EXISTS_IN_PROJECT = """
            SELECT COUNT(*) FROM sections s
            JOIN test_suites ts ON ts.id = s.suite_id
            WHERE s.id = :id AND ts.project_id = :projectId
            """;

    private final Jdbi jdbi;

    /**
     * Creates a new SectionRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public SectionRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    public void save(final Section section) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO sections (id, suite_id, parent_id, name, position,
                    created_at)
                VALUES (:id, :suiteId, :parentId, :name, :position, :createdAt)
                """)
                .bind("id", section.id())
                .bind("suiteId", section.suiteId())
                .bind("parentId", section.parentId())
                .bind("name", section.name())
                .bind("position", section.position())
                .bind("createdAt", Timestamp.from(section.createdAt()))
                .execute());
    }

    public void update(final Section section) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                UPDATE sections SET
                    parent_id = :parentId,
                    name = :name,
                    position = :position
                WHERE id = :id
                """)
                .bind("id", section.id())
                .bind("parentId", section.parentId())
                .bind("name", section.name())
                .bind("position", section.position())
                .execute());
    }

    public Optional<Section> findById(final String suiteId, final String id) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_ID)
                .bind("id", id)
                .bind("suiteId", suiteId)
                .map(new SectionRowMapper())
                .findOne());
    }

    public List<Section> findBySuite(final String suiteId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_SUITE)
                .bind("suiteId", suiteId)
                .map(new SectionRowMapper())
                .list());
    }

    /**
     * Checks that a section lives in one of the project's suites.
     *
     * @param projectId the project ID
     * @param id the section ID
     * @return true if it does
     */
    public boolean existsInProject(final String projectId, final String id) {
        return jdbi.withHandle(handle -> handle
                .createQuery(EXISTS_IN_PROJECT)
                .bind("id", id)
                .bind("projectId", projectId)
                .mapTo(Long.class)
                .one() > 0);
    }

    /**
     * Deletes a section. Child sections go with it; test cases in it are
     * detached.
     *
     * @param id the section ID
     */
    public void delete(final String id) {
        jdbi.useHandle(handle -> handle
                .createUpdate("DELETE FROM sections WHERE id = :id")
                .bind("id", id)
                .execute());
    }

    private static final class SectionRowMapper implements RowMapper<Section> {

        @Override
        public Section map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            return Section.reconstitute(
                    rs.getString("id"),
                    rs.getString("suite_id"),
                    rs.getString("parent_id"),
                    rs.getString("name"),
                    rs.getInt("position"),
                    rs.getTimestamp("created_at").toInstant());
        }
    }

}
