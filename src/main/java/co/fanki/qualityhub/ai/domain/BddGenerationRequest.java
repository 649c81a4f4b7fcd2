package co.fanki.qualityhub.ai.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Asks the AI service for Gherkin scenarios of a feature.
 *
 * @param featureDescription the feature to describe
 * @param context extra information about the application, may be null
 * @param maxScenarios how many scenarios to generate, 1 to 10; defaults
 *        to 3
 * @param includeExamples whether to add Scenario Outline examples;
 *        defaults to true
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record BddGenerationRequest(
        @JsonProperty("feature_description")
        @NotBlank @Size(min = 10, max = 10000)
        String featureDescription,

        @Size(max = 5000)
        String context,

        @JsonProperty("max_scenarios")
        @Min(1) @Max(10)
        Integer maxScenarios,

        @JsonProperty("include_examples")
        Boolean includeExamples
) {

    public BddGenerationRequest {
        if (maxScenarios == null) {
            maxScenarios = 3;
        }
        if (includeExamples == null) {
            includeExamples = true;
        }
    }

}
