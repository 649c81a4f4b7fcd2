package co.fanki.qualityhub.organization.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Subscription plan of an organization.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum OrganizationPlan {

    FREE("free"),
    PRO("pro"),
    ENTERPRISE("enterprise");

    private final String value;

    OrganizationPlan(final String theValue) {
        this.value = theValue;
    }

    /**
     * Returns the value stored in the database and sent over the wire.
     *
     * @return the lowercase plan name
     */
    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Resolves a plan from its stored value.
     *
     * @param value the lowercase plan name
     * @return the plan
     * @throws IllegalArgumentException if the value is unknown
     */
    @JsonCreator
    public static OrganizationPlan fromValue(final String value) {
        for (final OrganizationPlan plan : values()) {
            if (plan.value.equalsIgnoreCase(value)) {
                return plan;
            }
        }
        throw new IllegalArgumentException("Unknown organization plan: "
                + value);
    }

}
