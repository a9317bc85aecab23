package com.vidnyan.introspect.domain.conflict;

/**
 * How the rendering stage is told to handle a conflicting member.
 */
public enum ConflictResolution {
    /** Member type replaced by a {@link com.vidnyan.introspect.domain.type.ConflictMarker}. */
    WRAP_TYPE,
    /** Member kept, followed by a synthetic {@code (...args: never[]) => any} overload. */
    KEEP_WITH_NEVER_OVERLOAD,
    /** Member removed from the annotated class. */
    OMIT,
    /** Member kept with its overload tag set. */
    EMIT_OVERLOADS
}
