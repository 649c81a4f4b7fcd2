package co.fanki.qualityhub.attachment.domain;

import java.io.InputStream;

/**
 * Where attachment contents live.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface StorageProvider {

    /**
     * Stores a file under a generated unique name.
     *
     * @param originalFilename the name the client uploaded the file with
     * @param mimeType the content type
     * @param size the declared size in bytes
     * @param content the file contents, not closed by this method
     * @return where and how the file was stored
     * @throws co.fanki.qualityhub.shared.DomainException if the file is
     *         rejected
     * @throws StorageException if the file cannot be written
     */
    StoredFile store(String originalFilename, String mimeType, long size,
            InputStream content);

    /**
     * Reads a stored file.
     *
     * @param path the path returned by {@link #store}
     * @return the file contents
     * @throws co.fanki.qualityhub.shared.DomainException if there is no
     *         such file
     */
    byte[] load(String path);

    /**
     * Deletes a stored file. Missing files are ignored.
     *
     * @param path the path returned by {@link #store}
     */
    void delete(String path);

    /**
     * Whether files can currently be written.
     *
     * @return true when the storage is usable
     */
    boolean isAvailable();

}
