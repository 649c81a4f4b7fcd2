package co.fanki.qualityhub.ai.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;

/**
 * HTTP client of the AI generation service.
 *
 * <p>Requests are forwarded as JSON and the service's answer is handed
 * back untouched. Failures become {@link AiServiceException}s: an upstream
 * 422 is a bad request, upstream 5xx a bad gateway, other upstream 4xx keep
 * their status, a refused connection means the service is unavailable and
 * a timeout a gateway timeout.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class AiServiceClient {

    private static final Logger LOG = LoggerFactory.getLogger(
            AiServiceClient.class);

    private final RestClient restClient;

    private final ObjectMapper objectMapper;

    /**
     * Creates a new AiServiceClient.
     *
     * @param baseUrl the AI service base URL
     * @param timeoutMillis connect and read timeout in milliseconds
     * @param theObjectMapper the application object mapper, reads error
     * bodies
     */
    @Autowired
    public AiServiceClient(
            @Value("${ai.service.url:http://localhost:8000}")
            final String baseUrl,
            @Value("${ai.service.timeout:30000}") final long timeoutMillis,
            final ObjectMapper theObjectMapper) {
        this(RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory(timeoutMillis))
                .build(), theObjectMapper);
    }

    AiServiceClient(final RestClient theRestClient,
            final ObjectMapper theObjectMapper) {
        this.restClient = theRestClient;
        this.objectMapper = theObjectMapper;
    }

    /**
     * Generates test cases.
     *
     * @param request the generation request
     * @return the service's answer
     * @throws AiServiceException if the service fails
     */
    public JsonNode generateTests(final TestGenerationRequest request) {
        return post("/generate/tests", request);
    }

    /**
     * Generates BDD scenarios.
     *
     * @param request the generation request
     * @return the service's answer
     * @throws AiServiceException if the service fails
     */
    public JsonNode generateBdd(final BddGenerationRequest request) {
        return post("/generate/bdd", request);
    }

    private JsonNode post(final String path, final Object body) {
        try {
            return restClient.post()
                    .uri(path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (final RestClientException e) {
            LOG.error("AI service call to {} failed: {}", path,
                    e.getMessage());
            throw translate(e);
        }
    }

    /**
     * Maps a failed call to the status the API answers with.
     *
     * @param e the failure
     * @return the exception to raise
     */
    AiServiceException translate(final RestClientException e) {
        if (e instanceof RestClientResponseException response) {
            final HttpStatusCode status = response.getStatusCode();
            final String body = response.getResponseBodyAsString();
            if (status.value() == HttpStatus.UNPROCESSABLE_ENTITY.value()) {
                return new AiServiceException(HttpStatus.BAD_REQUEST,
                        "Invalid request to AI service",
                        body.isBlank() ? null : List.of(body), e);
            }
            final HttpStatus mapped = status.is5xxServerError()
                    ? HttpStatus.BAD_GATEWAY
                    : HttpStatus.resolve(status.value());
            return new AiServiceException(
                    mapped != null ? mapped : HttpStatus.BAD_GATEWAY,
                    detailOf(body), e);
        }
        if (e instanceof ResourceAccessException) {
            if (hasCause(e, ConnectException.class)) {
                return new AiServiceException(HttpStatus.SERVICE_UNAVAILABLE,
                        "AI service is unavailable", e);
            }
            if (hasCause(e, SocketTimeoutException.class)
                    || hasCause(e, HttpTimeoutException.class)) {
                return new AiServiceException(HttpStatus.GATEWAY_TIMEOUT,
                        "AI service request timed out", e);
            }
        }
        return new AiServiceException(HttpStatus.BAD_GATEWAY,
                "Failed to communicate with AI service", e);
    }

    private String detailOf(final String body) {
        if (body != null && !body.isBlank()) {
            try {
                final JsonNode detail = objectMapper.readTree(body)
                        .get("detail");
                if (detail != null && detail.isTextual()) {
                    return detail.asText();
                }
            } catch (final IOException e) {
                LOG.debug("AI service error body is not JSON: {}",
                        e.getMessage());
            }
        }
        return "AI service error";
    }

    private static boolean hasCause(final Throwable error,
            final Class<? extends Throwable> type) {
        for (Throwable cause = error; cause != null;
                cause = cause.getCause()) {
            if (type.isInstance(cause)) {
                return true;
            }
        }
        return false;
    }

    private static SimpleClientHttpRequestFactory requestFactory(
            final long timeoutMillis) {
        final SimpleClientHttpRequestFactory factory =
                new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(Duration.ofMillis(timeoutMillis));
        factory.setReadTimeout(Duration.ofMillis(timeoutMillis));
        return factory;
    }

}
