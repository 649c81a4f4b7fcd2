package co.fanki.qualityhub.ai.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Asks the AI service for test cases derived from a feature description.
 * Serialized as is to the service, hence the snake case names.
 *
 * @param description the requirement or feature to derive tests from
 * @param context extra information about the application, may be null
 * @param testType functional, edge_case, negative or all; defaults to all
 * @param maxTests how many cases to generate, 1 to 20; defaults to 5
 * @param priority priority of the generated cases, may be null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record TestGenerationRequest(
        @NotBlank @Size(min = 10, max = 10000)
        String description,

        @Size(max = 5000)
        String context,

        @JsonProperty("test_type")
        @Pattern(regexp = "functional|edge_case|negative|all")
        String testType,

        @JsonProperty("max_tests")
        @Min(1) @Max(20)
        Integer maxTests,

        @Pattern(regexp = "critical|high|medium|low")
        String priority
) {

    public TestGenerationRequest {
        if (testType == null) {
            testType = "all";
        }
        if (maxTests == null) {
            maxTests = 5;
        }
    }

}
