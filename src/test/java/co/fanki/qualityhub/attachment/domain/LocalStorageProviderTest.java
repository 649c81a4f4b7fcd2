package co.fanki.qualityhub.attachment.domain;

import co.fanki.qualityhub.shared.DomainException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link LocalStorageProvider}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class LocalStorageProviderTest {

    private static final byte[] CONTENT =
            "expected vs actual".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path root;

    private LocalStorageProvider provider;

    @BeforeEach
    void setUp() {
        provider = new LocalStorageProvider(root.toString(), 1024);
    }

    @Test
    void whenStoring_givenAllowedFile_shouldWriteUnderDatedFolder() {
        final StoredFile stored = store("Failure Log.TXT", "text/plain");

        assertTrue(stored.path().matches("\\d{4}/\\d{2}/[0-9a-f-]{36}\\.txt"),
                stored.path());
        assertEquals(CONTENT.length, stored.size());
        assertEquals("Failure Log.TXT", stored.originalFilename());
        assertTrue(Files.isRegularFile(root.resolve(stored.path())));
    }

    @Test
    void whenStoring_givenTraversalInFilename_shouldKeepOnlyExtension() {
        final StoredFile stored = store("../../etc/passwd.png", "image/png");

        assertTrue(stored.path().endsWith(".png"));
        assertFalse(stored.path().contains(".."));
    }

    @Test
    void whenStoring_givenFilenameWithoutExtension_shouldStoreBareName() {
        final StoredFile stored = store("README", "text/plain");

        assertFalse(stored.path().substring(8).contains("."));
    }

    @Test
    void whenStoring_givenTooLargeFile_shouldRejectSize() {
        final DomainException error = assertThrows(DomainException.class,
                () -> provider.store("big.pdf", "application/pdf", 2048,
                        new ByteArrayInputStream(new byte[0])));

        assertEquals("FILE_TOO_LARGE", error.getErrorCode());
    }

    @Test
    void whenStoring_givenDisallowedType_shouldRejectType() {
        final DomainException error = assertThrows(DomainException.class,
                () -> store("run.sh", "application/x-sh"));

        assertEquals("FILE_TYPE_NOT_ALLOWED", error.getErrorCode());
    }

    @Test
    void whenLoading_givenStoredFile_shouldReturnContent() {
        final StoredFile stored = store("log.txt", "text/plain");

        assertArrayEquals(CONTENT, provider.load(stored.path()));
    }

    @Test
    void whenLoading_givenMissingFile_shouldThrowNotFound() {
        final DomainException error = assertThrows(DomainException.class,
                () -> provider.load("2024/01/missing.txt"));

        assertEquals("FILE_NOT_FOUND", error.getErrorCode());
    }

    @Test
    void whenLoading_givenPathOutsideRoot_shouldRejectPath() {
        final DomainException error = assertThrows(DomainException.class,
                () -> provider.load("../outside.txt"));

        assertEquals("INVALID_FILE_PATH", error.getErrorCode());
    }

    @Test
    void whenDeleting_givenStoredFile_shouldRemoveIt() {
        final StoredFile stored = store("log.txt", "text/plain");

        provider.delete(stored.path());

        assertFalse(Files.exists(root.resolve(stored.path())));
    }

    @Test
    void whenDeleting_givenMissingFile_shouldNotFail() {
        provider.delete("2024/01/missing.txt");
    }

    @Test
    void whenCheckingAvailability_givenWritableRoot_shouldBeAvailable() {
        assertTrue(provider.isAvailable());
    }

    private StoredFile store(final String filename, final String mimeType) {
        return provider.store(filename, mimeType, CONTENT.length,
                new ByteArrayInputStream(CONTENT));
    }

}
