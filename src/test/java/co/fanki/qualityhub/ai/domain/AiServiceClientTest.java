package co.fanki.qualityhub.ai.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * Unit tests for {@link AiServiceClient}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AiServiceClientTest {

    private MockRestServiceServer server;

    private AiServiceClient client;

    @BeforeEach
    void setUp() {
        final RestClient.Builder builder = RestClient.builder()
                .baseUrl("http://ai.local");
        server = MockRestServiceServer.bindTo(builder).build();
        client = new AiServiceClient(builder.build(), new ObjectMapper());
    }

    @Test
    void whenGeneratingTests_givenServiceAnswer_shouldRelayBody() {
        server.expect(requestTo("http://ai.local/generate/tests"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.test_type").value("negative"))
                .andExpect(jsonPath("$.max_tests").value(2))
                .andRespond(withSuccess(
                        "{\"test_cases\":[{\"title\":\"Rejects empty\"}]}",
                        MediaType.APPLICATION_JSON));

        final JsonNode answer = client.generateTests(new TestGenerationRequest(
                "Login form validation rules", null, "negative", 2, "high"));

        server.verify();
        assertEquals("Rejects empty",
                answer.get("test_cases").get(0).get("title").asText());
    }

    @Test
    void whenGeneratingBdd_givenServerError_shouldAnswerBadGatewayWithDetail() {
        server.expect(requestTo("http://ai.local/generate/bdd"))
                .andRespond(withServerError()
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"detail\":\"model overloaded\"}"));

        final AiServiceException error = assertThrows(AiServiceException.class,
                () -> client.generateBdd(new BddGenerationRequest(
                        "Checkout with saved cards", null, 2, true)));

        assertEquals(HttpStatus.BAD_GATEWAY, error.status());
        assertEquals("model overloaded", error.getMessage());
    }

    @Test
    void whenGeneratingTests_givenValidationError_shouldAnswerBadRequest() {
        server.expect(requestTo("http://ai.local/generate/tests"))
                .andRespond(withStatus(HttpStatus.UNPROCESSABLE_ENTITY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"detail\":[{\"msg\":\"too short\"}]}"));

        final AiServiceException error = assertThrows(AiServiceException.class,
                () -> client.generateTests(new TestGenerationRequest(
                        "Login form validation rules", null, null, null,
                        null)));

        assertEquals(HttpStatus.BAD_REQUEST, error.status());
        assertEquals("Invalid request to AI service", error.getMessage());
        assertEquals(List.of("{\"detail\":[{\"msg\":\"too short\"}]}"),
                error.details());
    }

    @Test
    void whenTranslating_givenClientError_shouldKeepStatus() {
        final AiServiceException error = client.translate(
                HttpClientErrorException.create(HttpStatus.TOO_MANY_REQUESTS,
                        "Too Many Requests", HttpHeaders.EMPTY,
                        "rate limited".getBytes(StandardCharsets.UTF_8),
                        StandardCharsets.UTF_8));

        assertEquals(HttpStatus.TOO_MANY_REQUESTS, error.status());
        assertEquals("AI service error", error.getMessage());
    }

    @Test
    void whenTranslating_givenServerErrorWithoutBody_shouldUseGenericMessage() {
        final AiServiceException error = client.translate(
                HttpServerErrorException.create(HttpStatus.SERVICE_UNAVAILABLE,
                        "Unavailable", HttpHeaders.EMPTY, new byte[0],
                        StandardCharsets.UTF_8));

        assertEquals(HttpStatus.BAD_GATEWAY, error.status());
        assertEquals("AI service error", error.getMessage());
        assertNull(error.details());
    }

    @Test
    void whenTranslating_givenConnectionRefused_shouldAnswerUnavailable() {
        final AiServiceException error = client.translate(
                new ResourceAccessException("I/O error",
                        new ConnectException("Connection refused")));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, error.status());
    }

    @Test
    void whenTranslating_givenReadTimeout_shouldAnswerGatewayTimeout() {
        final AiServiceException error = client.translate(
                new ResourceAccessException("I/O error",
                        new SocketTimeoutException("Read timed out")));

        assertEquals(HttpStatus.GATEWAY_TIMEOUT, error.status());
    }

}
