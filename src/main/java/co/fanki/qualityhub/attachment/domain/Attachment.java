package co.fanki.qualityhub.attachment.domain;

import co.fanki.qualityhub.shared.Preconditions;

import java.time.Instant;
import java.util.UUID;

/**
 * A file stored for a test case, result, run or requirement.
 *
 * <p>The {@code path} is relative to the storage root and is never shown
 * to clients as a filesystem location.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Attachment {

    private final String id;
    private final String projectId;
    private final AttachmentEntityType entityType;
    private final String entityId;
    private String filename;
    private final String path;
    private final long size;
    private final String mimeType;
    private final Instant createdAt;

    private Attachment(final String theId, final String theProjectId,
            final AttachmentEntityType theEntityType, final String theEntityId,
            final String theFilename, final String thePath, final long theSize,
            final String theMimeType, final Instant theCreatedAt) {
        this.id = Preconditions.requireNonBlank(theId,
                "Attachment ID is required");
        this.projectId = Preconditions.requireNonBlank(theProjectId,
                "Project ID is required");
        this.entityType = Preconditions.requireNonNull(theEntityType,
                "Entity type is required");
        this.entityId = Preconditions.requireNonBlank(theEntityId,
                "Entity ID is required");
        this.filename = validFilename(theFilename);
        this.path = Preconditions.requireNonBlank(thePath,
                "Attachment path is required");
        Preconditions.require(theSize >= 0, "Attachment size must not be negative");
        this.size = theSize;
        this.mimeType = Preconditions.requireNonBlank(theMimeType,
                "MIME type is required");
        this.createdAt = theCreatedAt != null ? theCreatedAt : Instant.now();
    }

    /**
     * Creates the attachment record of a file that was just stored.
     *
     * @param projectId the owning project
     * @param entityType the kind of entity the file belongs to
     * @param entityId the entity ID
     * @param stored the stored file
     * @return a new Attachment
     */
    public static Attachment create(final String projectId,
            final AttachmentEntityType entityType, final String entityId,
            final StoredFile stored) {
        return new Attachment(UUID.randomUUID().toString(), projectId,
                entityType, entityId, stored.originalFilename(),
                stored.path(), stored.size(), stored.mimeType(),
                Instant.now());
    }

    public static Attachment reconstitute(final String id,
            final String projectId, final AttachmentEntityType entityType,
            final String entityId, final String filename, final String path,
            final long size, final String mimeType, final Instant createdAt) {
        return new Attachment(id, projectId, entityType, entityId, filename,
                path, size, mimeType, createdAt);
    }

    /**
     * Changes the name the file is downloaded with. The stored file keeps
     * its generated name.
     *
     * @param newFilename the new filename
     */
    public void rename(final String newFilename) {
        this.filename = validFilename(newFilename);
    }

    private static String validFilename(final String value) {
        return Preconditions.requireLength(value, 1, 255, "Filename");
    }

    public String id() {
        return id;
    }

    public String projectId() {
        return projectId;
    }

    public AttachmentEntityType entityType() {
        return entityType;
    }

    public String entityId() {
        return entityId;
    }

    public String filename() {
        return filename;
    }

    public String path() {
        return path;
    }

    public long size() {
        return size;
    }

    public String mimeType() {
        return mimeType;
    }

    public Instant createdAt() {
        return createdAt;
    }

}
