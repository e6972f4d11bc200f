package org.ngengine.platformcolor;

/** Container format recognised from the leading bytes of a screenshot. */
public enum SourceFormat {
    PNG,
    /** Recognised by its start-of-image marker but never decoded. */
    JPEG,
    UNKNOWN
}
