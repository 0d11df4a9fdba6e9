package com.e2eq.relations.model;

import java.util.Collection;

/**
 * Query scope of a relation as seen by a {@link RelationFilter}. Implemented by the persistence engine.
 */
public interface RelationQuery {
    RelationQuery where(String column, Object value);

    RelationQuery whereNot(String column, Object value);

    RelationQuery whereIn(String column, Collection<?> values);

    RelationQuery whereNull(String column);

    RelationQuery whereNotNull(String column);

    RelationQuery orderBy(String column, boolean ascending);
}
