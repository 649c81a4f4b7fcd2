package co.fanki.qualityhub.config;

import co.fanki.qualityhub.ai.domain.AiServiceException;
import co.fanki.qualityhub.shared.DomainException;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.servlet.http.HttpServletRequest;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Renders every error of the API with the same JSON shape.
 *
 * <p>Client errors are logged at warn, server errors at error with their
 * stack trace.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(
            GlobalExceptionHandler.class);

    private static final Set<String> UNAUTHORIZED_CODES = Set.of(
            "INVALID_CREDENTIALS", "INVALID_TOKEN");

    /** PostgreSQL SQLState of a unique constraint violation. */
    static final String UNIQUE_VIOLATION = "23505";

    private static final String ACCESS_DENIED_MESSAGE =
            "Access denied: Insufficient permissions";

    /**
     * Maps domain errors to a status derived from their error code.
     *
     * @param e the exception
     * @param request the current request
     * @return the error response
     */
    @ExceptionHandler(DomainException.class)
    public ResponseEntity<ErrorResponse> handleDomain(final DomainException e,
            final HttpServletRequest request) {
        return respond(statusOf(e), e.getMessage(), null, request, e);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            final IllegalArgumentException e,
            final HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage(), null, request,
                e);
    }

    /**
     * Maps bean validation failures of request bodies to 400, one detail
     * entry per rejected field.
     *
     * @param e the exception
     * @param request the current request
     * @return the error response
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            final MethodArgumentNotValidException e,
            final HttpServletRequest request) {
        final List<String> details = e.getBindingResult().getFieldErrors()
                .stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .toList();
        return respond(HttpStatus.BAD_REQUEST, "Validation failed", details,
                request, e);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleMethodValidation(
            final HandlerMethodValidationException e,
            final HttpServletRequest request) {
        final List<String> details = e.getAllErrors().stream()
                .map(error -> String.valueOf(error.getDefaultMessage()))
                .toList();
        return respond(HttpStatus.BAD_REQUEST, "Validation failed", details,
                request, e);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(
            final Exception e, final HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "Malformed request: "
                + e.getMessage(), null, request, e);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadTooLarge(
            final MaxUploadSizeExceededException e,
            final HttpServletRequest request) {
        return respond(HttpStatus.PAYLOAD_TOO_LARGE,
                "File exceeds the maximum allowed size", null, request, e);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(
            final HttpRequestMethodNotSupportedException e,
            final HttpServletRequest request) {
        return respond(HttpStatus.METHOD_NOT_ALLOWED, e.getMessage(), null,
                request, e);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResource(
            final NoResourceFoundException e,
            final HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "Cannot " + request.getMethod()
                + " " + request.getRequestURI(), null, request, e);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(
            final AccessDeniedException e, final HttpServletRequest request) {
        return respond(HttpStatus.FORBIDDEN, ACCESS_DENIED_MESSAGE, null,
                request, e);
    }

    /**
     * Maps AI service failures to the status the client computed from the
     * upstream error.
     *
     * @param e the exception
     * @param request the current request
     * @return the error response
     */
    @ExceptionHandler(AiServiceException.class)
    public ResponseEntity<ErrorResponse> handleAiService(
            final AiServiceException e, final HttpServletRequest request) {
        return respond(e.status(), e.getMessage(), e.details(), request, e);
    }

    /**
     * Maps a statement rejected by a unique constraint to 409. A concurrent
     * insert can pass the service's existence check and still lose on the
     * constraint. Any other statement failure is a 500.
     *
     * @param e the exception
     * @param request the current request
     * @return the error response
     */
    @ExceptionHandler(UnableToExecuteStatementException.class)
    public ResponseEntity<ErrorResponse> handleStatement(
            final UnableToExecuteStatementException e,
            final HttpServletRequest request) {
        if (UNIQUE_VIOLATION.equals(sqlStateOf(e))) {
            return respond(HttpStatus.CONFLICT, "Resource already exists",
                    null, request, e);
        }
        return handleUnexpected(e, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(final Exception e,
            final HttpServletRequest request) {
        return respond(HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal server error", null, request, e);
    }

    static HttpStatus statusOf(final DomainException e) {
        if (e.isNotFound()) {
            return HttpStatus.NOT_FOUND;
        }
        if (e.isConflict()) {
            return HttpStatus.CONFLICT;
        }
        if (UNAUTHORIZED_CODES.contains(e.getErrorCode())) {
            return HttpStatus.UNAUTHORIZED;
        }
        if ("ACCESS_DENIED".equals(e.getErrorCode())) {
            return HttpStatus.FORBIDDEN;
        }
        return HttpStatus.BAD_REQUEST;
    }

    static String sqlStateOf(final Throwable error) {
        for (Throwable cause = error; cause != null;
                cause = cause.getCause()) {
            if (cause instanceof SQLException sql && sql.getSQLState() != null) {
                return sql.getSQLState();
            }
        }
        return null;
    }

    private ResponseEntity<ErrorResponse> respond(final HttpStatus status,
            final String message, final List<String> details,
            final HttpServletRequest request, final Exception e) {

        if (status.is5xxServerError()) {
            LOG.error("{} {} failed with {}: {}", request.getMethod(),
                    request.getRequestURI(), status.value(), e.getMessage(),
                    e);
        } else {
            LOG.warn("{} {} rejected with {}: {}", request.getMethod(),
                    request.getRequestURI(), status.value(), message);
        }

        return ResponseEntity.status(status).body(new ErrorResponse(
                status.value(),
                message,
                status.getReasonPhrase(),
                Instant.now(),
                request.getRequestURI(),
                request.getMethod(),
                details));
    }

    /**
     * Error body of every failed request.
     *
     * @param statusCode the HTTP status code
     * @param message the human readable message
     * @param error the HTTP reason phrase
     * @param timestamp when the error was produced
     * @param path the request path
     * @param method the request method
     * @param details per-field validation messages, omitted when empty
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorResponse(
            int statusCode,
            String message,
            String error,
            Instant timestamp,
            String path,
            String method,
            List<String> details
    ) {}

}
