package com.e2eq.relations.model;

/**
 * The four relation shapes a record-kind can declare.
 */
public enum RelationKind {
    /** owner belongs to target, accessible as a single target */
    REFERENCE_TO_ONE(false),
    /** owner has one target */
    OWNS_ONE(false),
    /** owner has many targets, the foreign key lives on the target's table */
    OWNS_MANY(true),
    /** owner has many targets through a join table */
    OWNS_MANY_THROUGH_JOIN(true);

    private final boolean toMany;

    RelationKind(boolean toMany) {
        this.toMany = toMany;
    }

    public boolean isToMany() {
        return toMany;
    }
}
