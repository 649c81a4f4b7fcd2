package co.fanki.qualityhub.attachment.domain;

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
 * Repository for attachment records.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class AttachmentRepository {

    /** Attachments of a project, newest first. Uses: idx_attachments_project_id. */
    public static final String FIND_BY_PROJECT = """
            SELECT * FROM attachments
            WHERE project_id = :projectId
            ORDER BY created_at DESC
            """;

    /** Attachments of one entity, newest first. Uses: idx_attachments_entity. */
    public static final String FIND_BY_ENTITY = """
            SELECT * FROM attachments
            WHERE project_id = :projectId
              AND entity_type = :entityType
              AND entity_id = :entityId
            ORDER BY created_at DESC
            """;

    private final Jdbi jdbi;

    /**
     * Creates a new AttachmentRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public AttachmentRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    public void save(final Attachment attachment) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO attachments (
                    id, project_id, entity_type, entity_id, filename, path,
                    size, mime_type, created_at
                ) VALUES (
                    :id, :projectId, :entityType, :entityId, :filename,
                    :path, :size, :mimeType, :createdAt
                )
                """)
                .bind("id", attachment.id())
                .bind("projectId", attachment.projectId())
                .bind("entityType", attachment.entityType().value())
                .bind("entityId", attachment.entityId())
                .bind("filename", attachment.filename())
                .bind("path", attachment.path())
                .bind("size", attachment.size())
                .bind("mimeType", attachment.mimeType())
                .bind("createdAt", Timestamp.from(attachment.createdAt()))
                .execute());
    }

    public void updateFilename(final Attachment attachment) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                UPDATE attachments SET filename = :filename WHERE id = :id
                """)
                .bind("id", attachment.id())
                .bind("filename", attachment.filename())
                .execute());
    }

    public Optional<Attachment> findById(final String projectId,
            final String id) {
        return jdbi.withHandle(handle -> handle.createQuery("""
                        SELECT * FROM attachments
                        WHERE id = :id AND project_id = :projectId
                        """)
                .bind("id", id)
                .bind("projectId", projectId)
                .map(new AttachmentRowMapper())
                .findOne());
    }

    public List<Attachment> findByProject(final String projectId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_PROJECT)
                .bind("projectId", projectId)
                .map(new AttachmentRowMapper())
                .list());
    }

    public List<Attachment> findByEntity(final String projectId,
            final AttachmentEntityType entityType, final String entityId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_ENTITY)
                .bind("projectId", projectId)
                .bind("entityType", entityType.value())
                .bind("entityId", entityId)
                .map(new AttachmentRowMapper())
                .list());
    }

    public void delete(final String id) {
        jdbi.useHandle(handle -> handle
                .createUpdate("DELETE FROM attachments WHERE id = :id")
                .bind("id", id)
                .execute());
    }

    private static final class AttachmentRowMapper
            implements RowMapper<Attachment> {

        @Override
        public Attachment map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            return Attachment.reconstitute(
                    rs.getString("id"),
                    rs.getString("project_id"),
                    AttachmentEntityType.fromValue(
                            rs.getString("entity_type")),
                    rs.getString("entity_id"),
                    rs.getString("filename"),
                    rs.getString("path"),
                    rs.getLong("size"),
                    rs.getString("mime_type"),
                    rs.getTimestamp("created_at").toInstant());
        }
    }

}
