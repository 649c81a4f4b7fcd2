package co.fanki.qualityhub.attachment.application;

import co.fanki.qualityhub.attachment.application.AttachmentService.Download;
import co.fanki.qualityhub.attachment.domain.Attachment;
import co.fanki.qualityhub.attachment.domain.AttachmentEntityType;
import co.fanki.qualityhub.attachment.domain.AttachmentRepository;
import co.fanki.qualityhub.attachment.domain.StorageProvider;
import co.fanki.qualityhub.attachment.domain.StoredFile;
import co.fanki.qualityhub.shared.DomainException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.Optional;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link AttachmentService}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AttachmentServiceTest {

    private static final String PROJECT = "project-1";

    private static final StoredFile STORED = new StoredFile(
            "2026/01/4b1f.png", 3, "image/png", "screen.png");

    private AttachmentRepository attachmentRepository;
    private StorageProvider storageProvider;

    private AttachmentService service;

    @BeforeEach
    void setUp() {
        attachmentRepository = createMock(AttachmentRepository.class);
        storageProvider = createMock(StorageProvider.class);
        service = new AttachmentService(attachmentRepository,
                storageProvider);
    }

    @Test
    void whenUploading_givenValidFile_shouldStoreThenRecord() {
        final InputStream content = new ByteArrayInputStream(new byte[3]);
        expect(storageProvider.store("screen.png", "image/png", 3, content))
                .andReturn(STORED);
        attachmentRepository.save(anyObject(Attachment.class));
        expectLastCall();
        replay(attachmentRepository, storageProvider);

        final Attachment attachment = service.upload(PROJECT,
                AttachmentEntityType.TEST_RESULT, "result-1", "screen.png",
                "image/png", 3, content);

        verify(attachmentRepository, storageProvider);
        assertEquals("screen.png", attachment.filename());
        assertEquals(STORED.path(), attachment.path());
        assertEquals(AttachmentEntityType.TEST_RESULT, attachment.entityType());
    }

    @Test
    void whenUploading_givenRecordFails_shouldRemoveStoredFile() {
        final InputStream content = new ByteArrayInputStream(new byte[3]);
        expect(storageProvider.store(eq("screen.png"), eq("image/png"),
                eq(3L), anyObject(InputStream.class))).andReturn(STORED);
        attachmentRepository.save(anyObject(Attachment.class));
        expectLastCall().andThrow(new IllegalStateException("db down"));
        storageProvider.delete(STORED.path());
        expectLastCall();
        replay(attachmentRepository, storageProvider);

        assertThrows(IllegalStateException.class,
                () -> service.upload(PROJECT, AttachmentEntityType.TEST_CASE,
                        "case-1", "screen.png", "image/png", 3, content));

        verify(attachmentRepository, storageProvider);
    }

    @Test
    void whenDownloading_givenAttachment_shouldReturnContent() {
        final Attachment attachment = existing();
        final byte[] bytes = {1, 2, 3};
        expect(attachmentRepository.findById(PROJECT, attachment.id()))
                .andReturn(Optional.of(attachment));
        expect(storageProvider.load(STORED.path())).andReturn(bytes);
        replay(attachmentRepository, storageProvider);

        final Download download = service.download(PROJECT, attachment.id());

        verify(attachmentRepository, storageProvider);
        assertSame(attachment, download.attachment());
        assertArrayEquals(bytes, download.content());
    }

    @Test
    void whenDeleting_givenAttachment_shouldRemoveFileAndRecord() {
        final Attachment attachment = existing();
        expect(attachmentRepository.findById(PROJECT, attachment.id()))
                .andReturn(Optional.of(attachment));
        storageProvider.delete(STORED.path());
        expectLastCall();
        attachmentRepository.delete(attachment.id());
        expectLastCall();
        replay(attachmentRepository, storageProvider);

        service.delete(PROJECT, attachment.id());

        verify(attachmentRepository, storageProvider);
    }

    @Test
    void whenRenaming_givenUnknownAttachment_shouldThrowNotFound() {
        expect(attachmentRepository.findById(PROJECT, "ghost"))
                .andReturn(Optional.empty());
        replay(attachmentRepository, storageProvider);

        final DomainException error = assertThrows(DomainException.class,
                () -> service.rename(PROJECT, "ghost", "new.png"));

        assertEquals("ATTACHMENT_NOT_FOUND", error.getErrorCode());
    }

    private static Attachment existing() {
        return Attachment.create(PROJECT, AttachmentEntityType.TEST_CASE,
                "case-1", STORED);
    }

}
