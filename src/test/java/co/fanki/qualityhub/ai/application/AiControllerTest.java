package co.fanki.qualityhub.ai.application;

import co.fanki.qualityhub.ai.domain.AiServiceException;
import co.fanki.qualityhub.ai.domain.BddGenerationRequest;
import co.fanki.qualityhub.ai.domain.TestGenerationRequest;
import co.fanki.qualityhub.config.GlobalExceptionHandler;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.easymock.Capture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.capture;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.newCapture;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Unit tests for {@link AiController}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AiControllerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private AiGenerationService aiGenerationService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        aiGenerationService = createMock(AiGenerationService.class);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new AiController(aiGenerationService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void whenGeneratingTests_givenMinimalBody_shouldApplyDefaults()
            throws Exception {
        final Capture<TestGenerationRequest> request = newCapture();
        expect(aiGenerationService.generateTests(capture(request)))
                .andReturn(MAPPER.readTree("{\"test_cases\":[]}"));
        replay(aiGenerationService);

        mockMvc.perform(post("/api/v1/ai/generate-tests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\":\"Password reset by e-mail\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.test_cases").isArray());

        verify(aiGenerationService);
        assertEquals("all", request.getValue().testType());
        assertEquals(5, request.getValue().maxTests());
    }

    @Test
    void whenGeneratingTests_givenTooManyTests_shouldAnswerValidationError()
            throws Exception {
        replay(aiGenerationService);

        mockMvc.perform(post("/api/v1/ai/generate-tests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"description":"Password reset by e-mail",
                                 "max_tests":21}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation failed"));

        verify(aiGenerationService);
    }

    @Test
    void whenGeneratingBdd_givenServiceDown_shouldAnswerUnavailable()
            throws Exception {
        expect(aiGenerationService.generateBdd(
                anyObject(BddGenerationRequest.class)))
                .andThrow(new AiServiceException(
                        HttpStatus.SERVICE_UNAVAILABLE,
                        "AI service is unavailable", null));
        replay(aiGenerationService);

        mockMvc.perform(post("/api/v1/ai/generate-bdd")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"feature_description":"Checkout with saved cards"}
                                """))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.statusCode").value(503))
                .andExpect(jsonPath("$.message")
                        .value("AI service is unavailable"));

        verify(aiGenerationService);
    }

    @Test
    void whenGeneratingBdd_givenRejectedUpstream_shouldRelayDetails()
            throws Exception {
        final Capture<BddGenerationRequest> request = newCapture();
        expect(aiGenerationService.generateBdd(capture(request)))
                .andThrow(new AiServiceException(HttpStatus.BAD_REQUEST,
                        "Invalid request to AI service",
                        List.of("max_scenarios too high"), null));
        replay(aiGenerationService);

        mockMvc.perform(post("/api/v1/ai/generate-bdd")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"feature_description":"Checkout with saved cards",
                                 "include_examples":false}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0]")
                        .value("max_scenarios too high"));

        verify(aiGenerationService);
        assertEquals(3, request.getValue().maxScenarios());
        assertFalse(request.getValue().includeExamples());
    }

}
