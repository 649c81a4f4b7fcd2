package co.fanki.qualityhub.ai.application;

import co.fanki.qualityhub.ai.domain.AiServiceClient;
import co.fanki.qualityhub.ai.domain.BddGenerationRequest;
import co.fanki.qualityhub.ai.domain.TestGenerationRequest;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Generates test cases and BDD scenarios through the AI service.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class AiGenerationService {

    private static final Logger LOG = LoggerFactory.getLogger(
            AiGenerationService.class);

    private static final int PREVIEW_LENGTH = 50;

    private final AiServiceClient aiServiceClient;

    /**
     * Creates a new AiGenerationService.
     *
     * @param theAiServiceClient the AI service client
     */
    public AiGenerationService(final AiServiceClient theAiServiceClient) {
        this.aiServiceClient = theAiServiceClient;
    }

    public JsonNode generateTests(final TestGenerationRequest request) {
        LOG.info("Generating tests for description: {}...",
                preview(request.description()));
        final JsonNode response = aiServiceClient.generateTests(request);
        LOG.info("Generated {} test cases", sizeOf(response, "test_cases"));
        return response;
    }

    public JsonNode generateBdd(final BddGenerationRequest request) {
        LOG.info("Generating BDD scenarios for: {}...",
                preview(request.featureDescription()));
        final JsonNode response = aiServiceClient.generateBdd(request);
        LOG.info("Generated {} BDD scenarios", sizeOf(response, "scenarios"));
        return response;
    }

    private static String preview(final String text) {
        return text.length() <= PREVIEW_LENGTH
                ? text : text.substring(0, PREVIEW_LENGTH);
    }

    private static int sizeOf(final JsonNode response, final String field) {
        if (response == null || !response.path(field).isArray()) {
            return 0;
        }
        return response.get(field).size();
    }

}
