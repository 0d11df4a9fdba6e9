package com.e2eq.relations.core;

import com.e2eq.relations.model.RecordKind;

import java.util.Optional;

/**
 * Loads a record-kind descriptor from a location such as {@code /models/Person} or {@code ./Person}.
 */
@FunctionalInterface
public interface RecordKindLoader {

    /**
     * @param location where the record-kind lives
     * @return the descriptor, or empty when nothing exists at that location
     */
    Optional<RecordKind> load(String location);
}
