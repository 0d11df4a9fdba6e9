package com.e2eq.relations.model;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;
import java.util.Optional;

/**
 * Join table half of a many-to-many relation.
 *
 * @param joinTableName the intermediate table
 * @param from join table column pointing at the owner
 * @param to join table column pointing at the target
 * @param extraColumns additional join table columns to load with the target, in declaration order
 * @param filter constraint on the join table rows, may be null
 * @param throughTarget record-kind mapped onto the join table, may be null
 */
@RegisterForReflection
public record ThroughSpec(String joinTableName,
                          ColumnRef from,
                          ColumnRef to,
                          List<String> extraColumns,
                          RelationFilter filter,
                          RecordKind throughTarget) {

    public ThroughSpec {
        extraColumns = extraColumns == null ? List.of() : List.copyOf(extraColumns);
    }

    public Optional<RelationFilter> filterOptional() {
        return Optional.ofNullable(filter);
    }

    public Optional<RecordKind> throughTargetOptional() {
        return Optional.ofNullable(throughTarget);
    }
}
