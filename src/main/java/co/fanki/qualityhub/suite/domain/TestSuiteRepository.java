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
 * Repository for test suites.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class TestSuiteRepository {

    /** Find a suite of a project. Uses: PK index. */
    public static final String FIND_BY_ID = """
            SELECT * FROM test_suites
            WHERE id = :id AND project_id = :projectId
            """;

    /** Find suites of a project. Uses: idx_test_suites_project_id. */
    public static final String FIND_BY_PROJECT = """
            SELECT * FROM test_suites
            WHERE project_id = :projectId
            ORDER BY created_at
            """;

    private final Jdbi jdbi;

    /**
     * Creates a new TestSuiteRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public TestSuiteRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    public void save(final TestSuite suite) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO test_suites (id, project_id, name, description,
                    created_at)
                VALUES (:id, :projectId, :name, :description, :createdAt)
                """)
                .bind("id", suite.id())
                .bind("projectId", suite.projectId())
                .bind("name", suite.name())
                .bind("description", suite.description())
                .bind("createdAt", Timestamp.from(suite.createdAt()))
                .execute());
    }

    public void update(final TestSuite suite) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                UPDATE test_suites SET name = :name, description = :description
                WHERE id = :id
                """)
                .bind("id", suite.id())
                .bind("name", suite.name())
                .bind("description", suite.description())
                .execute());
    }

    public Optional<TestSuite> findById(final String projectId,
            final String id) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_ID)
                .bind("id", id)
                .bind("projectId", projectId)
                .map(new TestSuiteRowMapper())
                .findOne());
    }

    public List<TestSuite> findByProject(final String projectId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_PROJECT)
                .bind("projectId", projectId)
                .map(new TestSuiteRowMapper())
                .list());
    }

    /**
     * Deletes a suite. Its sections go with it.
     *
     * @param id the suite ID
     */
    public void delete(final String id) {
        jdbi.useHandle(handle -> handle
                .createUpdate("DELETE FROM test_suites WHERE id = :id")
                .bind("id", id)
                .execute());
    }

    private static final class TestSuiteRowMapper
            implements RowMapper<TestSuite> {

        @Override
        public TestSuite map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            return TestSuite.reconstitute(
                    rs.getString("id"),
                    rs.getString("project_id"),
                    rs.getString("name"),
                    rs.getString("description"),
                    rs.getTimestamp("created_at").toInstant());
        }
    }

}
