package com.e2eq.relations.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Join table overrides for hasManyThrough. Set at most one of {@code model} and {@code modelName}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThroughOptions {
    private String table;
    /** record-kind mapped onto the join table, its table is used when {@code table} is not set */
    private RecordKind model;
    /** identifier of the join table record-kind */
    private String modelName;
    /** {@code table.column} */
    private String from;
    /** {@code table.column} */
    private String to;
    private List<String> extra;
    private RelationFilter filter;
}
