package co.fanki.qualityhub.auth.domain;

import java.util.Locale;

/**
 * Fine grained permissions checked by the API.
 *
 * <p>The {@link #authority()} string is what ends up in the Spring
 * Security context and what {@code @PreAuthorize} expressions test for,
 * e.g. {@code hasAuthority('create_test_case')}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum Permission {

    VIEW_PROJECT,
    CREATE_PROJECT,
    UPDATE_PROJECT,
    DELETE_PROJECT,
    MANAGE_PROJECT_SETTINGS,

    VIEW_TEST_CASE,
    CREATE_TEST_CASE,
    UPDATE_TEST_CASE,
    DELETE_TEST_CASE,

    VIEW_TEST_RUN,
    CREATE_TEST_RUN,
    UPDATE_TEST_RUN,
    DELETE_TEST_RUN,
    EXECUTE_TEST_RUN,
    ADD_TEST_RESULT,

    VIEW_TEST_PLAN,
    CREATE_TEST_PLAN,
    UPDATE_TEST_PLAN,
    DELETE_TEST_PLAN,

    VIEW_MILESTONE,
    CREATE_MILESTONE,
    UPDATE_MILESTONE,
    DELETE_MILESTONE,

    VIEW_REQUIREMENT,
    CREATE_REQUIREMENT,
    UPDATE_REQUIREMENT,
    DELETE_REQUIREMENT,

    VIEW_USER,
    CREATE_USER,
    UPDATE_USER,
    DELETE_USER,
    MANAGE_USER_ROLES,

    MANAGE_ORGANIZATION,

    VIEW_REPORTS,
    EXPORT_REPORTS,

    VIEW_INTEGRATIONS,
    MANAGE_INTEGRATIONS;

    /**
     * Returns the granted authority name, the lowercase enum name.
     *
     * @return the authority string
     */
    public String authority() {
        return name().toLowerCase(Locale.ROOT);
    }

}
