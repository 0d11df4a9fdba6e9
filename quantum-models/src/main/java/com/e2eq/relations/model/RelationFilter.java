package com.e2eq.relations.model;

/**
 * Additional constraint applied to a relation's query scope, e.g.
 * {@code q -> q.where("archived", false).orderBy("name", true)}.
 */
@FunctionalInterface
public interface RelationFilter {
    void apply(RelationQuery query);
}
