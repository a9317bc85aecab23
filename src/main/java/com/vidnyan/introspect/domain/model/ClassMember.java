package com.vidnyan.introspect.domain.model;

/**
 * A member of a class, interface or record. Identity for conflict purposes is the
 * name together with the owning class.
 */
public sealed interface ClassMember permits FunctionMember, Property, Field {

    String name();

    MemberKind memberKind();

    enum MemberKind {
        FUNCTION,
        PROPERTY,
        FIELD
    }
}
