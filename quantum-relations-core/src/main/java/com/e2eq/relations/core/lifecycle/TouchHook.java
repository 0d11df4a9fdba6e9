package com.e2eq.relations.core.lifecycle;

import com.e2eq.relations.model.RecordKind;
import com.e2eq.relations.model.Timestamped;
import com.e2eq.relations.model.WriteContext;
import io.quarkus.logging.Log;

import java.time.Clock;
import java.util.Date;

/**
 * Stamps {@code createdAt} and {@code updatedAt}. Inserts get both set to the same instant, updates
 * only move {@code updatedAt}.
 *
 * <p>Nothing is stamped when the record-kind has timestamps disabled, the write context asks to skip
 * the touch, the step is switched off, or the record is not {@link Timestamped}. The step never throws,
 * a failing setter is logged and the write goes on.</p>
 */
public class TouchHook implements WriteHook {
    public static final String NAME = "touch";
    public static final int DEFAULT_ORDER = 1000;

    private final Clock clock;
    private final boolean enabled;
    private final int order;

    public TouchHook() {
        this(Clock.systemUTC());
    }

    public TouchHook(Clock clock) {
        this(clock, true, DEFAULT_ORDER);
    }

    public TouchHook(Clock clock, boolean enabled, int order) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.enabled = enabled;
        this.order = order;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int order() {
        return order;
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void beforeInsert(RecordKind kind, Object record, WriteContext context) {
        Timestamped t = touchable(kind, record, context);
        if (t == null) {
            return;
        }
        try {
            long now = clock.millis();
            t.setCreatedAt(new Date(now));
            t.setUpdatedAt(new Date(now));
        } catch (RuntimeException e) {
            Log.warnf(e, "Could not stamp timestamps on %s record before insert", kind.getName());
        }
    }

    @Override
    public void beforeUpdate(RecordKind kind, Object record, WriteContext context) {
        Timestamped t = touchable(kind, record, context);
        if (t == null) {
            return;
        }
        try {
            t.setUpdatedAt(new Date(clock.millis()));
        } catch (RuntimeException e) {
            Log.warnf(e, "Could not stamp updatedAt on %s record before update", kind.getName());
        }
    }

    private Timestamped touchable(RecordKind kind, Object record, WriteContext context) {
        if (!enabled || kind == null || record == null || !kind.isTimestampsEnabled()) {
            return null;
        }
        if (context != null && context.isSkipTouch()) {
            return null;
        }
        if (!(record instanceof Timestamped)) {
            Log.debugf("Record-kind %s has timestamps enabled but %s is not Timestamped, not touching it",
                    kind.getName(), record.getClass().getName());
            return null;
        }
        return (Timestamped) record;
    }
}
