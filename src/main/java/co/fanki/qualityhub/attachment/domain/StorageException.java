package co.fanki.qualityhub.attachment.domain;

/**
 * Raised when the storage backend fails to read or write a file.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class StorageException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public StorageException(final String message, final Throwable cause) {
        super(message, cause);
    }

}
