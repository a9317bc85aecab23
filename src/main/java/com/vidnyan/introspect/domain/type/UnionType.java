package com.vidnyan.introspect.domain.type;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Union of member types. Member order is irrelevant for equality.
 */
public record UnionType(Set<TypeExpression> members) implements TypeExpression {

    public UnionType {
        // insertion order for display, set semantics for equality
        members = Collections.unmodifiableSet(new LinkedHashSet<>(members));
        if (members.isEmpty()) {
            throw new IllegalArgumentException("Union must have at least one member");
        }
    }

    public static UnionType of(List<TypeExpression> members) {
        return new UnionType(new LinkedHashSet<>(members));
    }

    @Override
    public String display() {
        return members.stream()
                .map(TypeExpression::display)
                .collect(Collectors.joining(" | "));
    }
}
