package co.fanki.qualityhub.shared;

import java.io.Serializable;

/**
 * A single-valued domain concept such as an e-mail address or an
 * organization slug.
 *
 * <p>Implementations normalize and validate on construction, so holding an
 * instance means holding a valid value. Equality is by {@link #value()}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

    /**
     * Returns the normalized value, as stored in the database.
     *
     * @return the value, never null
     */
    String value();

}
