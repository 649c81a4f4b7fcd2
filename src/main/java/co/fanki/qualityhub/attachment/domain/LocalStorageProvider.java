package co.fanki.qualityhub.attachment.domain;

import co.fanki.qualityhub.shared.DomainException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;

/**
 * Stores attachments on the local filesystem.
 *
 * <p>Files land under the root at the path {@link UploadPolicy} picks.
 * Every path handed back to {@link #load} or {@link #delete} must resolve
 * inside the root. Active unless {@code storage.type} names another
 * backend.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
@ConditionalOnProperty(name = "storage.type", havingValue = "local",
        matchIfMissing = true)
public class LocalStorageProvider implements StorageProvider {

    private static final Logger LOG = LoggerFactory.getLogger(
            LocalStorageProvider.class);

    private final Path root;
    private final UploadPolicy uploadPolicy;

    /**
     * Creates a new LocalStorageProvider.
     *
     * @param rootPath the directory files are stored under
     * @param theMaxFileSize the largest accepted file, in bytes
     */
    public LocalStorageProvider(
            @Value("${storage.local.path:./uploads}") final String rootPath,
            @Value("${storage.max-file-size:10485760}")
            final long theMaxFileSize) {
        this.root = Paths.get(rootPath).toAbsolutePath().normalize();
        this.uploadPolicy = new UploadPolicy(theMaxFileSize);
    }

    @Override
    public StoredFile store(final String originalFilename,
            final String mimeType, final long size,
            final InputStream content) {
        uploadPolicy.check(mimeType, size);

        final String relative = UploadPolicy.pathFor(originalFilename,
                LocalDate.now());
        final Path target = resolve(relative);

        try {
            Files.createDirectories(target.getParent());
            final long written = Files.copy(content, target,
                    StandardCopyOption.REPLACE_EXISTING);
            LOG.debug("Stored {} ({} bytes) at {}", originalFilename,
                    written, relative);
            return new StoredFile(relative, written, mimeType,
                    originalFilename);
        } catch (final IOException e) {
            throw new StorageException("Failed to store file "
                    + originalFilename, e);
        }
    }

    @Override
    public byte[] load(final String path) {
        final Path file = resolve(path);
        if (!Files.isRegularFile(file)) {
            throw new DomainException("Stored file " + path + " not found",
                    "FILE_NOT_FOUND");
        }
        try {
            return Files.readAllBytes(file);
        } catch (final IOException e) {
            throw new StorageException("Failed to read file " + path, e);
        }
    }

    @Override
    public void delete(final String path) {
        try {
            if (Files.deleteIfExists(resolve(path))) {
                LOG.debug("Deleted stored file {}", path);
            }
        } catch (final IOException e) {
            throw new StorageException("Failed to delete file " + path, e);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            Files.createDirectories(root);
            return Files.isWritable(root);
        } catch (final IOException e) {
            LOG.warn("Storage root {} is not usable: {}", root,
                    e.getMessage());
            return false;
        }
    }

    /**
     * Resolves a stored path against the root.
     *
     * @param relative the stored path
     * @return the absolute path
     * @throws DomainException if the path escapes the root
     */
    Path resolve(final String relative) {
        final Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root)) {
            throw new DomainException("Invalid file path: " + relative,
                    "INVALID_FILE_PATH");
        }
        return resolved;
    }

}
