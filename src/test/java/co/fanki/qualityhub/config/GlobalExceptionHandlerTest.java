package co.fanki.qualityhub.config;

import co.fanki.qualityhub.config.GlobalExceptionHandler.ErrorResponse;
import co.fanki.qualityhub.shared.DomainException;

import org.jdbi.v3.core.statement.UnableToExecuteStatementException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Unit tests for {@link GlobalExceptionHandler}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    private final MockHttpServletRequest request = new MockHttpServletRequest(
            "POST", "/api/v1/organizations");

    @Test
    void whenHandlingStatement_givenUniqueViolation_shouldAnswerConflict() {
        final UnableToExecuteStatementException e =
                new UnableToExecuteStatementException(new SQLException(
                        "duplicate key value violates unique constraint",
                        "23505"), null);

        final ResponseEntity<ErrorResponse> response = handler
                .handleStatement(e, request);

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertEquals(409, response.getBody().statusCode());
        assertEquals("Resource already exists", response.getBody().message());
        assertEquals("/api/v1/organizations", response.getBody().path());
    }

    @Test
    void whenHandlingStatement_givenOtherSqlState_shouldAnswerServerError() {
        final UnableToExecuteStatementException e =
                new UnableToExecuteStatementException(new SQLException(
                        "value too long for type character varying(36)",
                        "22001"), null);

        final ResponseEntity<ErrorResponse> response = handler
                .handleStatement(e, request);

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR,
                response.getStatusCode());
        assertEquals("Internal server error", response.getBody().message());
    }

    @Test
    void whenReadingSqlState_givenWrappedSqlException_shouldFindIt() {
        final RuntimeException wrapped = new RuntimeException(
                new IllegalStateException(new SQLException("dup", "23505")));

        assertEquals("23505", GlobalExceptionHandler.sqlStateOf(wrapped));
        assertNull(GlobalExceptionHandler.sqlStateOf(
                new RuntimeException("no sql")));
    }

    @Test
    void whenMappingDomainErrors_givenCodes_shouldPickStatus() {
        assertEquals(HttpStatus.NOT_FOUND, GlobalExceptionHandler.statusOf(
                DomainException.notFound("Project", "p-1")));
        assertEquals(HttpStatus.UNAUTHORIZED, GlobalExceptionHandler.statusOf(
                new DomainException("bad", "INVALID_CREDENTIALS")));
        assertEquals(HttpStatus.FORBIDDEN, GlobalExceptionHandler.statusOf(
                new DomainException("no", "ACCESS_DENIED")));
        assertEquals(HttpStatus.BAD_REQUEST, GlobalExceptionHandler.statusOf(
                new DomainException("bad", "INVALID_STATE")));
    }

}
