package co.fanki.qualityhub.organization.domain;

import co.fanki.qualityhub.shared.Preconditions;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Aggregate root representing a tenant. Every user and project belongs to
 * exactly one organization.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Organization {

    private final String id;
    private String name;
    private OrganizationSlug slug;
    private OrganizationPlan plan;
    private Map<String, Object> settings;
    private final Instant createdAt;

    private Organization(
            final String theId,
            final String theName,
            final OrganizationSlug theSlug,
            final OrganizationPlan thePlan,
            final Map<String, Object> theSettings,
            final Instant theCreatedAt) {
        this.id = Preconditions.requireNonBlank(theId,
                "Organization ID is required");
        this.name = Preconditions.requireLength(theName, 1, 255, "Name");
        this.slug = Preconditions.requireNonNull(theSlug, "Slug is required");
        this.plan = thePlan != null ? thePlan : OrganizationPlan.FREE;
        this.settings = theSettings;
        this.createdAt = theCreatedAt != null ? theCreatedAt : Instant.now();
    }

    /**
     * Creates a new organization.
     *
     * @param name the display name
     * @param slug the unique handle
     * @param plan the plan, defaults to free when null
     * @param settings free-form settings, may be null
     * @return a new Organization instance
     */
    public static Organization create(final String name,
            final OrganizationSlug slug, final OrganizationPlan plan,
            final Map<String, Object> settings) {
        return new Organization(UUID.randomUUID().toString(), name, slug,
                plan, settings, Instant.now());
    }

    /**
     * Reconstitutes an organization from persistence.
     *
     * @param id the organization ID
     * @param name the display name
     * @param slug the unique handle
     * @param plan the plan
     * @param settings the settings
     * @param createdAt when created
     * @return the reconstituted Organization
     */
    public static Organization reconstitute(final String id,
            final String name, final OrganizationSlug slug,
            final OrganizationPlan plan, final Map<String, Object> settings,
            final Instant createdAt) {
        return new Organization(id, name, slug, plan, settings, createdAt);
    }

    /**
     * Applies a partial update. Null arguments leave the field untouched.
     *
     * @param newName the new name
     * @param newSlug the new slug
     * @param newPlan the new plan
     * @param newSettings the new settings
     */
    public void update(final String newName, final OrganizationSlug newSlug,
            final OrganizationPlan newPlan,
            final Map<String, Object> newSettings) {
        if (newName != null) {
            this.name = Preconditions.requireLength(newName, 1, 255, "Name");
        }
        if (newSlug != null) {
            this.slug = newSlug;
        }
        if (newPlan != null) {
            this.plan = newPlan;
        }
        if (newSettings != null) {
            this.settings = newSettings;
        }
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public OrganizationSlug slug() {
        return slug;
    }

    public OrganizationPlan plan() {
        return plan;
    }

    public Map<String, Object> settings() {
        return settings;
    }

    public Instant createdAt() {
        return createdAt;
    }

}
