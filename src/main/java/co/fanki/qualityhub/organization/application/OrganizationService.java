package co.fanki.qualityhub.organization.application;

import co.fanki.qualityhub.organization.domain.Organization;
import co.fanki.qualityhub.organization.domain.OrganizationPlan;
import co.fanki.qualityhub.organization.domain.OrganizationRepository;
import co.fanki.qualityhub.organization.domain.OrganizationSlug;
import co.fanki.qualityhub.shared.DomainException;
import co.fanki.qualityhub.user.domain.User;
import co.fanki.qualityhub.user.domain.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Application service for organization management.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class OrganizationService {

    private static final Logger LOG = LoggerFactory.getLogger(
            OrganizationService.class);

    private final OrganizationRepository organizationRepository;
    private final UserRepository userRepository;

    /**
     * Creates a new OrganizationService.
     *
     * @param theOrganizationRepository the organization repository
     * @param theUserRepository the user repository, for member listings
     */
    public OrganizationService(
            final OrganizationRepository theOrganizationRepository,
            final UserRepository theUserRepository) {
        this.organizationRepository = theOrganizationRepository;
        this.userRepository = theUserRepository;
    }

    /**
     * Creates an organization with an explicit slug.
     *
     * @param name the display name
     * @param slug the requested slug
     * @param plan the plan, may be null
     * @param settings the settings, may be null
     * @return the created organization
     * @throws DomainException if the slug is taken
     */
    @Transactional
    public Organization create(final String name, final String slug,
            final OrganizationPlan plan, final Map<String, Object> settings) {
        final OrganizationSlug organizationSlug = OrganizationSlug.of(slug);
        requireSlugAvailable(organizationSlug);

        final Organization organization = Organization.create(
                name, organizationSlug, plan, settings);
        organizationRepository.save(organization);

        LOG.info("Created organization {} ({})", organization.id(), slug);
        return organization;
    }

    /**
     * Creates an organization whose slug is derived from its name.
     *
     * <p>When the derived slug is taken, a short random suffix is
     * appended.</p>
     *
     * @param name the display name
     * @return the created organization
     */
    @Transactional
    public Organization createFromName(final String name) {
        OrganizationSlug slug = OrganizationSlug.fromName(name);
        if (organizationRepository.existsBySlug(slug)) {
            final String base = slug.value().length() > 90
                    ? slug.value().substring(0, 90) : slug.value();
            slug = OrganizationSlug.of(base + "-"
                    + UUID.randomUUID().toString().substring(0, 8));
        }
        final Organization organization = Organization.create(
                name, slug, OrganizationPlan.FREE, null);
        organizationRepository.save(organization);

        LOG.info("Created organization {} ({})", organization.id(), slug);
        return organization;
    }

    /**
     * Lists every organization.
     *
     * @return the organizations, newest first
     */
    public List<Organization> findAll() {
        return organizationRepository.findAll();
    }

    /**
     * Gets an organization by ID.
     *
     * @param id the organization ID
     * @return the organization
     * @throws DomainException if not found
     */
    public Organization getById(final String id) {
        return organizationRepository.findById(id)
                .orElseThrow(() -> DomainException.notFound(
                        "Organization", id));
    }

    /**
     * Gets an organization by slug.
     *
     * @param slug the slug
     * @return the organization
     * @throws DomainException if not found
     */
    public Organization getBySlug(final String slug) {
        return organizationRepository.findBySlug(OrganizationSlug.of(slug))
                .orElseThrow(() -> new DomainException(
                        "Organization with slug " + slug + " not found",
                        "ORGANIZATION_NOT_FOUND"));
    }

    /**
     * Updates an organization. Null arguments are left untouched.
     *
     * @param id the organization ID
     * @param name the new name
     * @param slug the new slug
     * @param plan the new plan
     * @param settings the new settings
     * @return the updated organization
     * @throws DomainException if not found or the new slug is taken
     */
    @Transactional
    public Organization update(final String id, final String name,
            final String slug, final OrganizationPlan plan,
            final Map<String, Object> settings) {
        final Organization organization = getById(id);

        OrganizationSlug newSlug = null;
        if (slug != null) {
            newSlug = OrganizationSlug.of(slug);
            if (!newSlug.equals(organization.slug())) {
                requireSlugAvailable(newSlug);
            }
        }

        organization.update(name, newSlug, plan, settings);
        organizationRepository.update(organization);

        LOG.info("Updated organization {}", id);
        return organization;
    }

    /**
     * Deletes an organization along with its users and projects.
     *
     * @param id the organization ID
     * @throws DomainException if not found
     */
    @Transactional
    public void delete(final String id) {
        getById(id);
        organizationRepository.delete(id);
        LOG.info("Deleted organization {}", id);
    }

    /**
     * Lists the users of an organization.
     *
     * @param id the organization ID
     * @return the members
     * @throws DomainException if not found
     */
    public List<User> members(final String id) {
        getById(id);
        return userRepository.findByOrganization(id);
    }

    private void requireSlugAvailable(final OrganizationSlug slug) {
        if (organizationRepository.existsBySlug(slug)) {
            throw new DomainException("Organization with slug '"
                    + slug.value() + "' already exists",
                    "ORGANIZATION_SLUG_ALREADY_EXISTS");
        }
    }

}
