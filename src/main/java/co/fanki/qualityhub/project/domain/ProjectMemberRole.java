package co.fanki.qualityhub.project.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Role of a user inside a single project.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ProjectMemberRole {

    VIEWER("viewer"),
    TESTER("tester"),
    LEAD("lead"),
    ADMIN("admin");

    private final String value;

    ProjectMemberRole(final String theValue) {
        this.value = theValue;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Resolves a member role from its stored value.
     *
     * @param value the lowercase role name
     * @return the role
     * @throws IllegalArgumentException if the value is unknown
     */
    @JsonCreator
    public static ProjectMemberRole fromValue(final String value) {
        for (final ProjectMemberRole role : values()) {
            if (role.value.equalsIgnoreCase(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown project member role: "
                + value);
    }

}
