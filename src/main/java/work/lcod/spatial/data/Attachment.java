package work.lcod.spatial.data;

import work.lcod.spatial.validation.Validatable;

/**
 * Anything that can sit in an element's {@code data} list.
 */
public interface Attachment extends Validatable {
    /**
     * Location-bound attachments are checked against the element's node or cell count.
     */
    boolean isLocationBound();
}
