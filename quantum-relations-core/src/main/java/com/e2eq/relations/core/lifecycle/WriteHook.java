package com.e2eq.relations.core.lifecycle;

import com.e2eq.relations.model.RecordKind;
import com.e2eq.relations.model.WriteContext;

/**
 * A named step of the write pipeline, invoked by the persistence engine before a record is sent.
 * Steps run in ascending {@link #order()}; steps with the same order run in registration order.
 */
public interface WriteHook {

    String name();

    default int order() {
        return 0;
    }

    default void beforeInsert(RecordKind kind, Object record, WriteContext context) {
    }

    default void beforeUpdate(RecordKind kind, Object record, WriteContext context) {
    }
}
