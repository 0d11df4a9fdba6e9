package com.e2eq.relations.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Explicit overrides for a relation declaration. A null field means "use the convention"; blank
 * strings are rejected.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelationOptions {
    /** relation name */
    private String name;
    /** {@code table.column} */
    private String joinFrom;
    /** {@code table.column} */
    private String joinTo;
    private RelationFilter filter;
    /** only read by hasManyThrough */
    private ThroughOptions through;

    public static RelationOptions none() {
        return new RelationOptions();
    }
}
