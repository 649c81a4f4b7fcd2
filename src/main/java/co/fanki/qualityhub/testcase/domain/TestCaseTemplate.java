package co.fanki.qualityhub.testcase.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Shape of a test case body: numbered steps, free text, Gherkin or an exploratory charter.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum TestCaseTemplate {

    STEPS("steps"),
    TEXT("text"),
    BDD("bdd"),
    EXPLORATORY("exploratory");

    private final String value;

    TestCaseTemplate(final String theValue) {
        this.value = theValue;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static TestCaseTemplate fromValue(final String value) {
        for (final TestCaseTemplate each : values()) {
            if (each.value.equalsIgnoreCase(value)) {
                return each;
            }
        }
        throw new IllegalArgumentException("Unknown template type: " + value);
    }

}
