package com.e2eq.relations.model;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Resolved join columns of a relation. {@code through} is only set for
 * {@link RelationKind#OWNS_MANY_THROUGH_JOIN}.
 */
@RegisterForReflection
public record JoinSpec(ColumnRef from, ColumnRef to, ThroughSpec through) {

    public JoinSpec {
        if (from == null || to == null) {
            throw new IllegalArgumentException("join requires both from and to columns");
        }
    }

    public JoinSpec(ColumnRef from, ColumnRef to) {
        this(from, to, null);
    }

    public boolean isThrough() {
        return through != null;
    }
}
