package com.vidnyan.introspect.domain.conflict;

import com.vidnyan.introspect.domain.model.ClassMember;
import com.vidnyan.introspect.domain.type.Identifier;

import java.util.Objects;

/**
 * One classified conflict.
 *
 * @param ancestor declaration the member collides with; null when the conflict was forced
 *                 by the reserved or known-conflict lists
 */
public record ConflictRecord(
    Identifier owner,
    String member,
    ClassMember.MemberKind memberKind,
    ConflictKind kind,
    ConflictResolution resolution,
    Identifier ancestor
) {

    public ConflictRecord {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(member, "member");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(resolution, "resolution");
    }

    public boolean isForced() {
        return ancestor == null;
    }

    public String subject() {
        return owner.name() + "." + member;
    }
}
