package co.fanki.qualityhub.ai.application;

import co.fanki.qualityhub.ai.domain.BddGenerationRequest;
import co.fanki.qualityhub.ai.domain.TestGenerationRequest;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller proxying test generation to the AI service.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/v1/ai")
@Tag(name = "AI", description = "AI assisted test design")
@SecurityRequirement(name = "bearerAuth")
public class AiController {

    private final AiGenerationService aiGenerationService;

    /**
     * Creates a new AiController.
     *
     * @param theAiGenerationService the generation service
     */
    public AiController(final AiGenerationService theAiGenerationService) {
        this.aiGenerationService = theAiGenerationService;
    }

    @Operation(summary = "Generate test cases from a description",
            description = "Structured test cases with steps, expected "
                    + "results and metadata")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Generated"),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "502", description = "AI service error"),
            @ApiResponse(responseCode = "503",
                    description = "AI service unavailable"),
            @ApiResponse(responseCode = "504",
                    description = "AI service timeout")
    })
    @PostMapping("/generate-tests")
    @PreAuthorize("hasAuthority('create_test_case')")
    public ResponseEntity<JsonNode> generateTests(
            @Valid @RequestBody final TestGenerationRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(aiGenerationService.generateTests(request));
    }

    @Operation(summary = "Generate BDD scenarios in Gherkin format")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Generated"),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "502", description = "AI service error"),
            @ApiResponse(responseCode = "503",
                    description = "AI service unavailable"),
            @ApiResponse(responseCode = "504",
                    description = "AI service timeout")
    })
    @PostMapping("/generate-bdd")
    @PreAuthorize("hasAuthority('create_test_case')")
    public ResponseEntity<JsonNode> generateBdd(
            @Valid @RequestBody final BddGenerationRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(aiGenerationService.generateBdd(request));
    }

}
