package co.fanki.qualityhub.user.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Organization-wide role of a user, from read-only to full access.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum UserRole {

    VIEWER("viewer"),
    TESTER("tester"),
    LEAD("lead"),
    PROJECT_ADMIN("project_admin"),
    ORG_ADMIN("org_admin");

    private final String value;

    UserRole(final String theValue) {
        this.value = theValue;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Resolves a role from its stored value.
     *
     * @param value the lowercase role name
     * @return the role
     * @throws IllegalArgumentException if the value is unknown
     */
    @JsonCreator
    public static UserRole fromValue(final String value) {
        for (final UserRole role : values()) {
            if (role.value.equalsIgnoreCase(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown user role: " + value);
    }

}
