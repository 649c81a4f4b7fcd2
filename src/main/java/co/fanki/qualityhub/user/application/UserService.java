package co.fanki.qualityhub.user.application;

import co.fanki.qualityhub.auth.domain.PasswordHasher;
import co.fanki.qualityhub.shared.DomainException;
import co.fanki.qualityhub.user.domain.Email;
import co.fanki.qualityhub.user.domain.User;
import co.fanki.qualityhub.user.domain.UserRepository;
import co.fanki.qualityhub.user.domain.UserRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Application service for user management inside an organization.
 *
 * <p>Every lookup is scoped to the caller's organization: a user of another
 * tenant is reported as not found.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class UserService {

    private static final Logger LOG = LoggerFactory.getLogger(
            UserService.class);

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;

    /**
     * Creates a new UserService.
     *
     * @param theUserRepository the user repository
     * @param thePasswordHasher the password hasher
     */
    public UserService(final UserRepository theUserRepository,
            final PasswordHasher thePasswordHasher) {
        this.userRepository = theUserRepository;
        this.passwordHasher = thePasswordHasher;
    }

    /**
     * Creates a user in an organization.
     *
     * @param organizationId the organization
     * @param email the login e-mail
     * @param password the plain password
     * @param name the display name
     * @param role the role, defaults to tester
     * @return the created user
     * @throws DomainException if the e-mail is already registered
     */
    @Transactional
    public User create(final String organizationId, final String email,
            final String password, final String name, final UserRole role) {
        final Email userEmail = Email.of(email);
        if (userRepository.existsByEmail(userEmail)) {
            throw new DomainException("Email already registered",
                    "EMAIL_ALREADY_EXISTS");
        }
        final User user = User.create(organizationId, userEmail,
                passwordHasher.hash(password), name, role);
        userRepository.save(user);

        LOG.info("Created user {} in organization {}", user.id(),
                organizationId);
        return user;
    }

    /**
     * Lists the users of an organization.
     *
     * @param organizationId the organization
     * @return the users
     */
    public List<User> findAll(final String organizationId) {
        return userRepository.findByOrganization(organizationId);
    }

    /**
     * Gets a user of an organization.
     *
     * @param organizationId the caller's organization
     * @param id the user ID
     * @return the user
     * @throws DomainException if absent or in another organization
     */
    public User getById(final String organizationId, final String id) {
        return userRepository.findById(id)
                .filter(user -> user.organizationId().equals(organizationId))
                .orElseThrow(() -> DomainException.notFound("User", id));
    }

    /**
     * Updates name and role of a user. Null arguments are left untouched.
     *
     * @param organizationId the caller's organization
     * @param id the user ID
     * @param name the new name
     * @param role the new role
     * @return the updated user
     */
    @Transactional
    public User update(final String organizationId, final String id,
            final String name, final UserRole role) {
        final User user = getById(organizationId, id);
        if (name != null) {
            user.rename(name);
        }
        if (role != null) {
            user.changeRole(role);
        }
        userRepository.update(user);

        LOG.info("Updated user {}", id);
        return user;
    }

    /**
     * Deletes a user.
     *
     * @param organizationId the caller's organization
     * @param id the user ID
     */
    @Transactional
    public void delete(final String organizationId, final String id) {
        getById(organizationId, id);
        userRepository.delete(id);
        LOG.info("Deleted user {}", id);
    }

}
