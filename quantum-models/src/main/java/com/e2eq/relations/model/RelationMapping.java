package com.e2eq.relations.model;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.Optional;

/**
 * One resolved relation of a record-kind. Instances are immutable snapshots handed to the
 * persistence engine to plan joins and eager loads.
 *
 * @param kind the relation shape
 * @param name relation name, unique within the owner's graph
 * @param owner the declaring record-kind
 * @param target the related record-kind
 * @param filter extra constraint on the relation's query scope, may be null
 * @param join resolved join columns
 */
@RegisterForReflection
public record RelationMapping(RelationKind kind,
                              String name,
                              RecordKind owner,
                              RecordKind target,
                              RelationFilter filter,
                              JoinSpec join) {

    public RelationMapping {
        if (kind == null || name == null || owner == null || target == null || join == null) {
            throw new IllegalArgumentException("kind, name, owner, target and join are required");
        }
        if (kind == RelationKind.OWNS_MANY_THROUGH_JOIN && !join.isThrough()) {
            throw new IllegalArgumentException("relation '" + name + "' needs a through spec");
        }
    }

    public Optional<RelationFilter> filterOptional() {
        return Optional.ofNullable(filter);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder()
                .append(owner.getName()).append('.').append(name)
                .append(" [").append(kind).append(" -> ").append(target.getName()).append("] ")
                .append(join.from()).append(" = ").append(join.to());
        if (join.isThrough()) {
            sb.append(" through ").append(join.through().from()).append(", ").append(join.through().to());
        }
        return sb.toString();
    }
}
