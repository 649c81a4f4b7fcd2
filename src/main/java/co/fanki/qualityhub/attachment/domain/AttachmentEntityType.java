package co.fanki.qualityhub.attachment.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of entity an attachment hangs from.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum AttachmentEntityType {

    TEST_CASE("test_case"),
    TEST_RESULT("test_result"),
    TEST_RUN("test_run"),
    REQUIREMENT("requirement");

    private final String value;

    AttachmentEntityType(final String theValue) {
        this.value = theValue;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static AttachmentEntityType fromValue(final String value) {
        for (final AttachmentEntityType each : values()) {
            if (each.value.equalsIgnoreCase(value)) {
                return each;
            }
        }
        throw new IllegalArgumentException("Unknown attachment entity type: " + value);
    }

}
