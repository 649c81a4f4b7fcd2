package co.fanki.qualityhub.attachment.application;

import co.fanki.qualityhub.attachment.domain.Attachment;
import co.fanki.qualityhub.attachment.domain.AttachmentEntityType;
import co.fanki.qualityhub.attachment.domain.AttachmentRepository;
import co.fanki.qualityhub.attachment.domain.StorageProvider;
import co.fanki.qualityhub.attachment.domain.StoredFile;
import co.fanki.qualityhub.shared.DomainException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.InputStream;
import java.util.List;

/**
 * Application service for attachments.
 *
 * <p>Uploads write the file first and the record second; a failed insert
 * removes the orphaned file.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class AttachmentService {

    private static final Logger LOG = LoggerFactory.getLogger(
            AttachmentService.class);

    private final AttachmentRepository attachmentRepository;
    private final StorageProvider storageProvider;

    /**
     * Creates a new AttachmentService.
     *
     * @param theAttachmentRepository the attachment repository
     * @param theStorageProvider where file contents live
     */
    public AttachmentService(
            final AttachmentRepository theAttachmentRepository,
            final StorageProvider theStorageProvider) {
        this.attachmentRepository = theAttachmentRepository;
        this.storageProvider = theStorageProvider;
    }

    /**
     * Stores an uploaded file and records it against an entity.
     *
     * @param projectId the project ID
     * @param entityType the kind of entity
     * @param entityId the entity ID
     * @param filename the client filename
     * @param mimeType the content type
     * @param size the declared size
     * @param content the file contents
     * @return the new attachment
     */
    @Transactional
    public Attachment upload(final String projectId,
            final AttachmentEntityType entityType, final String entityId,
            final String filename, final String mimeType, final long size,
            final InputStream content) {
        final StoredFile stored = storageProvider.store(filename, mimeType,
                size, content);
        final Attachment attachment = Attachment.create(projectId,
                entityType, entityId, stored);
        try {
            attachmentRepository.save(attachment);
        } catch (final RuntimeException e) {
            storageProvider.delete(stored.path());
            throw e;
        }
        LOG.info("Attachment {} uploaded for {} {}", attachment.id(),
                entityType.value(), entityId);
        return attachment;
    }

    public List<Attachment> findByProject(final String projectId) {
        return attachmentRepository.findByProject(projectId);
    }

    public List<Attachment> findByEntity(final String projectId,
            final AttachmentEntityType entityType, final String entityId) {
        return attachmentRepository.findByEntity(projectId, entityType,
                entityId);
    }

    public Attachment getById(final String projectId,
            final String attachmentId) {
        return attachmentRepository.findById(projectId, attachmentId)
                .orElseThrow(() -> DomainException.notFound("Attachment",
                        attachmentId));
    }

    /**
     * Loads an attachment together with its contents.
     *
     * @param projectId the project ID
     * @param attachmentId the attachment ID
     * @return the attachment and its bytes
     */
    public Download download(final String projectId,
            final String attachmentId) {
        final Attachment attachment = getById(projectId, attachmentId);
        return new Download(attachment,
                storageProvider.load(attachment.path()));
    }

    @Transactional
    public Attachment rename(final String projectId,
            final String attachmentId, final String filename) {
        final Attachment attachment = getById(projectId, attachmentId);
        attachment.rename(filename);
        attachmentRepository.updateFilename(attachment);
        return attachment;
    }

    /**
     * Deletes an attachment record and its stored file.
     *
     * @param projectId the project ID
     * @param attachmentId the attachment ID
     */
    @Transactional
    public void delete(final String projectId, final String attachmentId) {
        final Attachment attachment = getById(projectId, attachmentId);
        storageProvider.delete(attachment.path());
        attachmentRepository.delete(attachment.id());
        LOG.info("Attachment {} deleted", attachmentId);
    }

    /**
     * An attachment ready to be streamed to a client.
     *
     * @param attachment the attachment
     * @param content the file contents
     */
    public record Download(Attachment attachment, byte[] content) {}

}
