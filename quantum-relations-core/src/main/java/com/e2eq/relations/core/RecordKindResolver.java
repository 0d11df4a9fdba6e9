package com.e2eq.relations.core;

import com.e2eq.relations.exceptions.UnresolvedRecordKindException;
import com.e2eq.relations.model.RecordKind;

/**
 * Turns a relation target into a concrete descriptor.
 */
public interface RecordKindResolver {

    /**
     * Direct references resolve to themselves.
     *
     * @throws UnresolvedRecordKindException if {@code kind} is null
     */
    default RecordKind resolve(RecordKind kind) {
        if (kind == null) {
            throw new UnresolvedRecordKindException(null, null);
        }
        return kind;
    }

    /**
     * Resolves a location ({@code ./Person}, {@code /com/acme/models/Person}) or a bare record-kind name.
     *
     * @throws UnresolvedRecordKindException if nothing can be found
     */
    RecordKind resolve(String identifier);
}
