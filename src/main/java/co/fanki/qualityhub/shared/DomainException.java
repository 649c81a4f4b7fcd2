package co.fanki.qualityhub.shared;

/**
 * Base exception for domain-level errors.
 *
 * <p>The error code drives the HTTP status the API answers with: codes
 * ending in {@code _NOT_FOUND} become 404, codes ending in
 * {@code _ALREADY_EXISTS} or {@code _CONFLICT} become 409. Everything else
 * is a 400 unless listed in the exception handler.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String errorCode;

    /**
     * Creates a new domain exception with a message.
     *
     * @param message the error message
     */
    public DomainException(final String message) {
        super(message);
        this.errorCode = "DOMAIN_ERROR";
    }

    /**
     * Creates a new domain exception with a message and error code.
     *
     * @param message the error message
     * @param errorCode the specific error code
     */
    public DomainException(final String message, final String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * Creates a new domain exception with message, error code, and cause.
     *
     * @param message the error message
     * @param errorCode the specific error code
     * @param cause the underlying cause
     */
    public DomainException(final String message, final String errorCode,
            final Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Builds the exception raised when an entity cannot be found.
     *
     * <p>The error code is derived from the entity name, so "Test case"
     * becomes {@code TEST_CASE_NOT_FOUND}.</p>
     *
     * @param entity the human readable entity name
     * @param id the identifier that was looked up
     * @return the exception, never null
     */
    public static DomainException notFound(final String entity,
            final String id) {
        final String code = entity.trim().toUpperCase()
                .replace(' ', '_') + "_NOT_FOUND";
        return new DomainException(
                entity + " with ID " + id + " not found", code);
    }

    /**
     * Returns the error code for this exception.
     *
     * @return the error code
     */
    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Whether this error means the addressed resource does not exist.
     *
     * @return true for not-found codes
     */
    public boolean isNotFound() {
        return errorCode.endsWith("_NOT_FOUND");
    }

    /**
     * Whether this error means the request clashes with existing state.
     *
     * @return true for conflict codes
     */
    public boolean isConflict() {
        return errorCode.endsWith("_ALREADY_EXISTS")
                || errorCode.endsWith("_CONFLICT");
    }

}
