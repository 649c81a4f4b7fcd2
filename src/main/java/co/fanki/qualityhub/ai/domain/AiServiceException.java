package co.fanki.qualityhub.ai.domain;

import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * Raised when the AI generation service cannot serve a request. Carries
 * the status the API answers with.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class AiServiceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final HttpStatus status;
    private final List<String> details;

    public AiServiceException(final HttpStatus theStatus,
            final String message, final Throwable cause) {
        this(theStatus, message, null, cause);
    }

    /**
     * Creates a new AiServiceException.
     *
     * @param theStatus the status to answer with
     * @param message the client facing message
     * @param theDetails extra information for the client, may be null
     * @param cause the underlying failure
     */
    public AiServiceException(final HttpStatus theStatus,
            final String message, final List<String> theDetails,
            final Throwable cause) {
        super(message, cause);
        this.status = theStatus;
        this.details = theDetails;
    }

    public HttpStatus status() {
        return status;
    }

    public List<String> details() {
        return details;
    }

}
