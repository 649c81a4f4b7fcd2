package co.fanki.qualityhub.testcase.domain;

import co.fanki.qualityhub.shared.JsonColumns;
import com.fasterxml.jackson.core.type.TypeReference;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for persisting and retrieving test cases.
 *
 * <p>Soft deleted cases are invisible to every finder. Updates are guarded
 * by the version the caller loaded.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class TestCaseRepository {

    private static final TypeReference<List<TestStep>> STEPS =
            new TypeReference<>() { };

    /** Find a live case of a project. Uses: PK index. */
    public static final String FIND_BY_ID = """
            SELECT * FROM test_cases
            WHERE id = :id AND project_id = :projectId
              AND deleted_at IS NULL
            """;

    /**
     * Find live cases of a project, optionally narrowed by section and
     * priority. Uses: idx_test_cases_project_id,
     * idx_test_cases_section_priority.
     */
    public static final String FIND_BY_PROJECT = """
            SELECT * FROM test_cases
            WHERE project_id = :projectId
              AND deleted_at IS NULL
              AND (CAST(:sectionId AS VARCHAR) IS NULL
                   OR section_id = :sectionId)
              AND (CAST(:priority AS VARCHAR) IS NULL
                   OR priority = :priority)
            ORDER BY created_at
            """;

    /** Find live cases of a project by IDs. Uses: PK index. */
    public static final String FIND_BY_IDS = """
            SELECT * FROM test_cases
            WHERE project_id = :projectId
              AND id IN (<ids>)
              AND deleted_at IS NULL
            """;

    private final Jdbi jdbi;

    /**
     * Creates a new TestCaseRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public TestCaseRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    /**
     * Saves a new test case.
     *
     * @param testCase the case to save
     */
    public void save(final TestCase testCase) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO test_cases (
                    id, project_id, section_id, title, template_type,
                    preconditions, steps, expected_result, priority, estimate,
                    custom_fields, version, created_by, created_at, updated_at
                ) VALUES (
                    :id, :projectId, :sectionId, :title, :templateType,
                    :preconditions, CAST(:steps AS JSONB), :expectedResult,
                    :priority, :estimate, CAST(:customFields AS JSONB),
                    :version, :createdBy, :createdAt, :updatedAt
                )
                """)
                .bind("id", testCase.id())
                .bind("projectId", testCase.projectId())
                .bind("sectionId", testCase.sectionId())
                .bind("title", testCase.title())
                .bind("templateType", testCase.templateType().value())
                .bind("preconditions", testCase.preconditions())
                .bind("steps", JsonColumns.toJson(testCase.steps()))
                .bind("expectedResult", testCase.expectedResult())
                .bind("priority", testCase.priority().value())
                .bind("estimate", testCase.estimate())
                .bind("customFields", JsonColumns.toJson(
                        testCase.customFields()))
                .bind("version", testCase.version())
                .bind("createdBy", testCase.createdBy())
                .bind("createdAt", toTimestamp(testCase.createdAt()))
                .bind("updatedAt", toTimestamp(testCase.updatedAt()))
                .execute());
    }

    /**
     * Writes the new state of a case if nobody else changed it since it was
     * loaded.
     *
     * @param testCase the case, already moved to its next version
     * @param loadedVersion the version the case had when it was loaded
     * @return false if the stored version is no longer loadedVersion
     */
    public boolean update(final TestCase testCase, final int loadedVersion) {
        return jdbi.withHandle(handle -> handle.createUpdate("""
                UPDATE test_cases SET
                    section_id = :sectionId,
                    title = :title,
                    template_type = :templateType,
                    preconditions = :preconditions,
                    steps = CAST(:steps AS JSONB),
                    expected_result = :expectedResult,
                    priority = :priority,
                    estimate = :estimate,
                    custom_fields = CAST(:customFields AS JSONB),
                    version = :version,
                    updated_at = :updatedAt
                WHERE id = :id AND version = :loadedVersion
                  AND deleted_at IS NULL
                """)
                .bind("id", testCase.id())
                .bind("sectionId", testCase.sectionId())
                .bind("title", testCase.title())
                .bind("templateType", testCase.templateType().value())
                .bind("preconditions", testCase.preconditions())
                .bind("steps", JsonColumns.toJson(testCase.steps()))
                .bind("expectedResult", testCase.expectedResult())
                .bind("priority", testCase.priority().value())
                .bind("estimate", testCase.estimate())
                .bind("customFields", JsonColumns.toJson(
                        testCase.customFields()))
                .bind("version", testCase.version())
                .bind("updatedAt", toTimestamp(testCase.updatedAt()))
                .bind("loadedVersion", loadedVersion)
                .execute()) > 0;
    }

    public Optional<TestCase> findById(final String projectId,
            final String id) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_ID)
                .bind("id", id)
                .bind("projectId", projectId)
                .map(new TestCaseRowMapper())
                .findOne());
    }

    /**
     * Lists the live cases of a project.
     *
     * @param projectId the project ID
     * @param sectionId only cases of this section, null for all
     * @param priority only cases of this priority, null for all
     * @return the cases, oldest first
     */
    public List<TestCase> findByProject(final String projectId,
            final String sectionId, final TestCasePriority priority) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_PROJECT)
                .bind("projectId", projectId)
                .bind("sectionId", sectionId)
                .bind("priority", priority != null ? priority.value() : null)
                .map(new TestCaseRowMapper())
                .list());
    }

    public List<TestCase> findByIds(final String projectId,
            final Collection<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_IDS)
                .bind("projectId", projectId)
                .bindList("ids", ids)
                .map(new TestCaseRowMapper())
                .list());
    }

    /**
     * Soft deletes cases of a project.
     *
     * @param projectId the project ID
     * @param ids the case IDs
     * @return how many live cases were deleted
     */
    public int softDelete(final String projectId,
            final Collection<String> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        return jdbi.withHandle(handle -> handle.createUpdate("""
                UPDATE test_cases SET deleted_at = :now
                WHERE project_id = :projectId AND id IN (<ids>)
                  AND deleted_at IS NULL
                """)
                .bind("projectId", projectId)
                .bindList("ids", ids)
                .bind("now", toTimestamp(Instant.now()))
                .execute());
    }

    private static Timestamp toTimestamp(final Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static final class TestCaseRowMapper
            implements RowMapper<TestCase> {

        @Override
        public TestCase map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            final int estimate = rs.getInt("estimate");
            final boolean hasEstimate = !rs.wasNull();
            final Timestamp deletedTs = rs.getTimestamp("deleted_at");

            final TestCaseDetails details = new TestCaseDetails(
                    rs.getString("section_id"),
                    rs.getString("title"),
                    TestCaseTemplate.fromValue(rs.getString("template_type")),
                    rs.getString("preconditions"),
                    JsonColumns.fromJson(rs.getString("steps"), STEPS),
                    rs.getString("expected_result"),
                    TestCasePriority.fromValue(rs.getString("priority")),
                    hasEstimate ? estimate : null,
                    JsonColumns.fromJson(rs.getString("custom_fields"),
                            JsonColumns.OBJECT));

            return TestCase.reconstitute(
                    rs.getString("id"),
                    rs.getString("project_id"),
                    details,
                    rs.getInt("version"),
                    rs.getString("created_by"),
                    rs.getTimestamp("created_at").toInstant(),
                    rs.getTimestamp("updated_at").toInstant(),
                    deletedTs != null ? deletedTs.toInstant() : null);
        }
    }

}
