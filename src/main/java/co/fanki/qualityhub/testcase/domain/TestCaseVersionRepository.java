package co.fanki.qualityhub.testcase.domain;

import co.fanki.qualityhub.shared.JsonColumns;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;

/**
 * Repository for test case version snapshots. Snapshots are append only.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class TestCaseVersionRepository {

    /** History of a case, newest first. Uses: uq_test_case_versions_case_version. */
    public static final String FIND_BY_CASE = """
            SELECT * FROM test_case_versions
            WHERE case_id = :caseId
            ORDER BY version DESC
            """;

    private final Jdbi jdbi;

    /**
     * Creates a new TestCaseVersionRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public TestCaseVersionRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    public void save(final TestCaseVersion version) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO test_case_versions (
                    id, case_id, version, data, changed_by, created_at
                ) VALUES (
                    :id, :caseId, :version, CAST(:data AS JSONB), :changedBy,
                    :createdAt
                )
                """)
                .bind("id", version.id())
                .bind("caseId", version.caseId())
                .bind("version", version.version())
                .bind("data", JsonColumns.toJson(version.data()))
                .bind("changedBy", version.changedBy())
                .bind("createdAt", Timestamp.from(version.createdAt()))
                .execute());
    }

    public List<TestCaseVersion> findByCase(final String caseId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_CASE)
                .bind("caseId", caseId)
                .map(new VersionRowMapper())
                .list());
    }

    private static final class VersionRowMapper
            implements RowMapper<TestCaseVersion> {

        @Override
        public TestCaseVersion map(final ResultSet rs,
                final StatementContext ctx) throws SQLException {
            return TestCaseVersion.reconstitute(
                    rs.getString("id"),
                    rs.getString("case_id"),
                    rs.getInt("version"),
                    JsonColumns.fromJson(rs.getString("data"),
                            JsonColumns.OBJECT),
                    rs.getString("changed_by"),
                    rs.getTimestamp("created_at").toInstant());
        }
    }

}
