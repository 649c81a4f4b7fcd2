package co.fanki.qualityhub.suite.domain;

import co.fanki.qualityhub.shared.Preconditions;

import java.time.Instant;
import java.util.UUID;

/**
 * A folder inside a suite. Sections nest through {@code parentId} and are
 * ordered by {@code position} among their siblings.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Section {

    private final String id;
    private final String suiteId;
    private String parentId;
    private String name;
    private int position;
    private final Instant createdAt;

    private Section(final String theId, final String theSuiteId,
            final String theParentId, final String theName,
            final int thePosition, final Instant theCreatedAt) {
        this.id = Preconditions.requireNonBlank(theId,
                "Section ID is required");
        this.suiteId = Preconditions.requireNonBlank(theSuiteId,
                "Suite ID is required");
        this.name = Preconditions.requireLength(theName, 1, 255,
                "Section name");
        this.position = Preconditions.requireNonNegative(thePosition,
                "Position must not be negative");
        this.createdAt = theCreatedAt != null ? theCreatedAt : Instant.now();
        changeParent(theParentId);
    }

    /**
     * Creates a new section.
     *
     * @param suiteId the owning suite
     * @param parentId the parent section, null for a top level section
     * @param name the name
     * @param position the position, defaults to 0 when null
     * @return a new Section
     */
    public static Section create(final String suiteId, final String parentId,
            final String name, final Integer position) {
        return new Section(UUID.randomUUID().toString(), suiteId, parentId,
                name, position != null ? position : 0, Instant.now());
    }

    /**
     * Reconstitutes a section from persistence.
     *
     * @param id the section ID
     * @param suiteId the owning suite
     * @param parentId the parent section
     * @param name the name
     * @param position the position
     * @param createdAt when created
     * @return the reconstituted Section
     */
    public static Section reconstitute(final String id, final String suiteId,
            final String parentId, final String name, final int position,
            final Instant createdAt) {
        return new Section(id, suiteId, parentId, name, position, createdAt);
    }

    public void rename(final String newName) {
        this.name = Preconditions.requireLength(newName, 1, 255,
                "Section name");
    }

    public void moveTo(final int newPosition) {
        this.position = Preconditions.requireNonNegative(newPosition,
                "Position must not be negative");
    }

    /**
     * Re-parents the section.
     *
     * @param newParentId the new parent, null to move to the top level
     * @throws IllegalArgumentException if the section would be its own parent
     */
    public void changeParent(final String newParentId) {
        Preconditions.require(newParentId == null || !newParentId.equals(id),
                "A section cannot be its own parent");
        this.parentId = newParentId;
    }

    public String id() {
        return id;
    }

    public String suiteId() {
        return suiteId;
    }

    public String parentId() {
        return parentId;
    }

    public String name() {
        return name;
    }

    public int position() {
        return position;
    }

    public Instant createdAt() {
        return createdAt;
    }

}
