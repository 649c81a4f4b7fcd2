package co.fanki.qualityhub.auth.domain;

import co.fanki.qualityhub.user.domain.UserRole;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static co.fanki.qualityhub.auth.domain.Permission.ADD_TEST_RESULT;
import static co.fanki.qualityhub.auth.domain.Permission.CREATE_MILESTONE;
import static co.fanki.qualityhub.auth.domain.Permission.CREATE_PROJECT;
import static co.fanki.qualityhub.auth.domain.Permission.CREATE_REQUIREMENT;
import static co.fanki.qualityhub.auth.domain.Permission.CREATE_TEST_CASE;
import static co.fanki.qualityhub.auth.domain.Permission.CREATE_TEST_PLAN;
import static co.fanki.qualityhub.auth.domain.Permission.CREATE_TEST_RUN;
import static co.fanki.qualityhub.auth.domain.Permission.CREATE_USER;
import static co.fanki.qualityhub.auth.domain.Permission.DELETE_MILESTONE;
import static co.fanki.qualityhub.auth.domain.Permission.DELETE_REQUIREMENT;
import static co.fanki.qualityhub.auth.domain.Permission.DELETE_TEST_CASE;
import static co.fanki.qualityhub.auth.domain.Permission.DELETE_TEST_PLAN;
import static co.fanki.qualityhub.auth.domain.Permission.DELETE_TEST_RUN;
import static co.fanki.qualityhub.auth.domain.Permission.EXECUTE_TEST_RUN;
import static co.fanki.qualityhub.auth.domain.Permission.EXPORT_REPORTS;
import static co.fanki.qualityhub.auth.domain.Permission.MANAGE_INTEGRATIONS;
import static co.fanki.qualityhub.auth.domain.Permission.MANAGE_PROJECT_SETTINGS;
import static co.fanki.qualityhub.auth.domain.Permission.UPDATE_MILESTONE;
import static co.fanki.qualityhub.auth.domain.Permission.UPDATE_PROJECT;
import static co.fanki.qualityhub.auth.domain.Permission.UPDATE_REQUIREMENT;
import static co.fanki.qualityhub.auth.domain.Permission.UPDATE_TEST_CASE;
import static co.fanki.qualityhub.auth.domain.Permission.UPDATE_TEST_PLAN;
import static co.fanki.qualityhub.auth.domain.Permission.UPDATE_TEST_RUN;
import static co.fanki.qualityhub.auth.domain.Permission.UPDATE_USER;
import static co.fanki.qualityhub.auth.domain.Permission.VIEW_INTEGRATIONS;
import static co.fanki.qualityhub.auth.domain.Permission.VIEW_MILESTONE;
import static co.fanki.qualityhub.auth.domain.Permission.VIEW_PROJECT;
import static co.fanki.qualityhub.auth.domain.Permission.VIEW_REPORTS;
import static co.fanki.qualityhub.auth.domain.Permission.VIEW_REQUIREMENT;
import static co.fanki.qualityhub.auth.domain.Permission.VIEW_TEST_CASE;
import static co.fanki.qualityhub.auth.domain.Permission.VIEW_TEST_PLAN;
import static co.fanki.qualityhub.auth.domain.Permission.VIEW_TEST_RUN;
import static co.fanki.qualityhub.auth.domain.Permission.VIEW_USER;

/**
 * Maps each role to the permissions it grants.
 *
 * <p>Roles are cumulative: a tester can do everything a viewer can, a lead
 * everything a tester can, and so on. The organization admin holds every
 * permission.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class RolePermissions {

    private static final Map<UserRole, Set<Permission>> PERMISSIONS =
            buildPermissions();

    private RolePermissions() {
    }

    private static Map<UserRole, Set<Permission>> buildPermissions() {
        final Set<Permission> viewer = EnumSet.of(
                VIEW_PROJECT, VIEW_TEST_CASE, VIEW_TEST_RUN, VIEW_TEST_PLAN,
                VIEW_MILESTONE, VIEW_REQUIREMENT, VIEW_USER, VIEW_REPORTS,
                VIEW_INTEGRATIONS);

        final Set<Permission> tester = EnumSet.copyOf(viewer);
        tester.addAll(EnumSet.of(EXECUTE_TEST_RUN, ADD_TEST_RESULT));

        final Set<Permission> lead = EnumSet.copyOf(tester);
        lead.addAll(EnumSet.of(
                CREATE_TEST_CASE, UPDATE_TEST_CASE, DELETE_TEST_CASE,
                CREATE_TEST_RUN, UPDATE_TEST_RUN, DELETE_TEST_RUN,
                CREATE_TEST_PLAN, UPDATE_TEST_PLAN, DELETE_TEST_PLAN,
                CREATE_MILESTONE, UPDATE_MILESTONE, DELETE_MILESTONE,
                CREATE_REQUIREMENT, UPDATE_REQUIREMENT, DELETE_REQUIREMENT,
                EXPORT_REPORTS));

        final Set<Permission> projectAdmin = EnumSet.copyOf(lead);
        projectAdmin.addAll(EnumSet.of(
                CREATE_PROJECT, UPDATE_PROJECT, MANAGE_PROJECT_SETTINGS,
                CREATE_USER, UPDATE_USER, MANAGE_INTEGRATIONS));

        final Map<UserRole, Set<Permission>> permissions =
                new EnumMap<>(UserRole.class);
        permissions.put(UserRole.VIEWER, Collections.unmodifiableSet(viewer));
        permissions.put(UserRole.TESTER, Collections.unmodifiableSet(tester));
        permissions.put(UserRole.LEAD, Collections.unmodifiableSet(lead));
        permissions.put(UserRole.PROJECT_ADMIN,
                Collections.unmodifiableSet(projectAdmin));
        permissions.put(UserRole.ORG_ADMIN, Collections.unmodifiableSet(
                EnumSet.allOf(Permission.class)));
        return Collections.unmodifiableMap(permissions);
    }

    /**
     * Returns every permission the role grants.
     *
     * @param role the role, may be null
     * @return the permissions, empty for a null role
     */
    public static Set<Permission> of(final UserRole role) {
        if (role == null) {
            return Set.of();
        }
        return PERMISSIONS.get(role);
    }

    /**
     * Checks a single permission.
     *
     * @param role the role
     * @param permission the permission
     * @return true if granted
     */
    public static boolean hasPermission(final UserRole role,
            final Permission permission) {
        return of(role).contains(permission);
    }

    /**
     * Checks that every permission is granted.
     *
     * @param role the role
     * @param permissions the permissions
     * @return true if all are granted, also for an empty collection
     */
    public static boolean hasAll(final UserRole role,
            final Collection<Permission> permissions) {
        return of(role).containsAll(permissions);
    }

    /**
     * Checks that at least one permission is granted.
     *
     * @param role the role
     * @param permissions the permissions
     * @return true if any is granted
     */
    public static boolean hasAny(final UserRole role,
            final Collection<Permission> permissions) {
        final Set<Permission> granted = of(role);
        return permissions.stream().anyMatch(granted::contains);
    }

}
