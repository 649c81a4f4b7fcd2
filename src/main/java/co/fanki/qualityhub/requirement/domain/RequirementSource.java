package co.fanki.qualityhub.requirement.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * System a requirement was imported from.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum RequirementSource {

    JIRA("jira"),
    GITHUB("github"),
    AZURE_DEVOPS("azure_devops"),
    MANUAL("manual"),
    CONFLUENCE("confluence"),
    OTHER("other");

    private final String value;

    RequirementSource(final String theValue) {
        this.value = theValue;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static RequirementSource fromValue(final String value) {
        for (final RequirementSource each : values()) {
            if (each.value.equalsIgnoreCase(value)) {
                return each;
            }
        }
        throw new IllegalArgumentException("Unknown requirement source: " + value);
    }

}
