package com.e2eq.relations.core.lifecycle;

import com.e2eq.relations.model.RecordKind;
import com.e2eq.relations.model.WriteContext;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Entry point of the persistence engine's write path. Runs every registered {@link WriteHook} in a fixed
 * order before an insert or update, the engine's own hooks (default values and the like) first and the
 * {@link TouchHook} after them.
 * <p>
 * Exceptions thrown by a hook propagate to the engine and abort the write.
 * </p>
 */
public class LifecycleHookMediator {

    private final List<WriteHook> hooks;

    public LifecycleHookMediator(Collection<? extends WriteHook> hooks) {
        List<WriteHook> sorted = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (WriteHook hook : hooks) {
            if (hook == null) {
                continue;
            }
            if (!names.add(hook.name())) {
                throw new IllegalArgumentException("Duplicate write hook name: " + hook.name());
            }
            sorted.add(hook);
        }
        // List.sort is stable, registration order breaks ties
        sorted.sort(Comparator.comparingInt(WriteHook::order));
        this.hooks = List.copyOf(sorted);
    }

    /**
     * A mediator running {@code baseHooks} followed by a default {@link TouchHook}.
     */
    public static LifecycleHookMediator withTouch(WriteHook... baseHooks) {
        List<WriteHook> all = new ArrayList<>(Arrays.asList(baseHooks));
        all.add(new TouchHook());
        return new LifecycleHookMediator(all);
    }

    public void beforeInsert(RecordKind kind, Object record, WriteContext context) {
        WriteContext ctx = context == null ? WriteContext.DEFAULT : context;
        for (WriteHook hook : hooks) {
            hook.beforeInsert(kind, record, ctx);
        }
    }

    public void beforeUpdate(RecordKind kind, Object record, WriteContext context) {
        WriteContext ctx = context == null ? WriteContext.DEFAULT : context;
        for (WriteHook hook : hooks) {
            hook.beforeUpdate(kind, record, ctx);
        }
    }

    public List<WriteHook> getHooks() {
        return hooks;
    }

    public List<String> getHookNames() {
        return hooks.stream().map(WriteHook::name).toList();
    }
}
