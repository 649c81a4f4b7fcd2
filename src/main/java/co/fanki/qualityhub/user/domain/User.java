package co.fanki.qualityhub.user.domain;

import co.fanki.qualityhub.shared.Preconditions;

import java.time.Instant;
import java.util.UUID;

/**
 * Aggregate root for a person who can log in to an organization.
 *
 * <p>The password hash never leaves the auth flow; API responses are built
 * from the other accessors only.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class User {

    private final String id;
    private final String organizationId;
    private final Email email;
    private String passwordHash;
    private String name;
    private UserRole role;
    private final Instant createdAt;

    private User(
            final String theId,
            final String theOrganizationId,
            final Email theEmail,
            final String thePasswordHash,
            final String theName,
            final UserRole theRole,
            final Instant theCreatedAt) {
        this.id = Preconditions.requireNonBlank(theId, "User ID is required");
        this.organizationId = Preconditions.requireNonBlank(theOrganizationId,
                "Organization ID is required");
        this.email = Preconditions.requireNonNull(theEmail,
                "Email is required");
        this.passwordHash = Preconditions.requireNonBlank(thePasswordHash,
                "Password hash is required");
        this.name = Preconditions.requireLength(theName, 1, 255, "Name");
        this.role = theRole != null ? theRole : UserRole.TESTER;
        this.createdAt = theCreatedAt != null ? theCreatedAt : Instant.now();
    }

    /**
     * Creates a new user.
     *
     * @param organizationId the owning organization
     * @param email the login e-mail
     * @param passwordHash the bcrypt hash of the password
     * @param name the display name
     * @param role the role, defaults to tester when null
     * @return a new User instance
     */
    public static User create(final String organizationId, final Email email,
            final String passwordHash, final String name,
            final UserRole role) {
        return new User(UUID.randomUUID().toString(), organizationId, email,
                passwordHash, name, role, Instant.now());
    }

    /**
     * Reconstitutes a user from persistence.
     *
     * @param id the user ID
     * @param organizationId the owning organization
     * @param email the login e-mail
     * @param passwordHash the stored hash
     * @param name the display name
     * @param role the role
     * @param createdAt when created
     * @return the reconstituted User
     */
    public static User reconstitute(final String id,
            final String organizationId, final Email email,
            final String passwordHash, final String name, final UserRole role,
            final Instant createdAt) {
        return new User(id, organizationId, email, passwordHash, name, role,
                createdAt);
    }

    /**
     * Changes the display name.
     *
     * @param newName the new name
     */
    public void rename(final String newName) {
        this.name = Preconditions.requireLength(newName, 1, 255, "Name");
    }

    /**
     * Assigns a new role.
     *
     * @param newRole the new role
     */
    public void changeRole(final UserRole newRole) {
        this.role = Preconditions.requireNonNull(newRole, "Role is required");
    }

    /**
     * Replaces the stored password hash.
     *
     * @param newPasswordHash the new bcrypt hash
     */
    public void changePasswordHash(final String newPasswordHash) {
        this.passwordHash = Preconditions.requireNonBlank(newPasswordHash,
                "Password hash is required");
    }

    public String id() {
        return id;
    }

    public String organizationId() {
        return organizationId;
    }

    public Email email() {
        return email;
    }

    public String passwordHash() {
        return passwordHash;
    }

    public String name() {
        return name;
    }

    public UserRole role() {
        return role;
    }

    public Instant createdAt() {
        return createdAt;
    }

}
