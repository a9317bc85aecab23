package com.vidnyan.introspect.domain.module;

/**
 * How a namespace discovered in several versions is disambiguated.
 */
public enum VersionPolicy {
    /** Never pick; the group is reported as conflicting. */
    NONE,
    /** The highest version wins. */
    HIGHEST_VERSION,
    /** The version matching an explicitly requested, non-glob version prefix wins. */
    EXPLICIT_PREFIX
}
