package co.fanki.qualityhub.requirement.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle state of a requirement.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum RequirementStatus {

    DRAFT("draft"),
    APPROVED("approved"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    DEPRECATED("deprecated");

    private final String value;

    RequirementStatus(final String theValue) {
        this.value = theValue;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static RequirementStatus fromValue(final String value) {
        for (final RequirementStatus each : values()) {
            if (each.value.equalsIgnoreCase(value)) {
                return each;
            }
        }
        throw new IllegalArgumentException("Unknown requirement status: " + value);
    }

}
