package com.e2eq.relations.morphia;

import com.e2eq.relations.model.WriteContext;

import java.util.function.Supplier;

/**
 * Carries the {@link WriteContext} of the current thread into {@link TouchInterceptor}, Morphia's
 * save calls have no room for it.
 * <pre>{@code
 * WriteContexts.runWithoutTouch(() -> datastore.save(importedPet));
 * }</pre>
 */
public final class WriteContexts {
    private static final ThreadLocal<WriteContext> current = new ThreadLocal<>();

    private WriteContexts() {
    }

    public static WriteContext current() {
        WriteContext ctx = current.get();
        return ctx == null ? WriteContext.DEFAULT : ctx;
    }

    public static void runWith(WriteContext context, Runnable action) {
        callWith(context, () -> {
            action.run();
            return null;
        });
    }

    public static <T> T callWith(WriteContext context, Supplier<T> action) {
        WriteContext previous = current.get();
        current.set(context);
        try {
            return action.get();
        } finally {
            if (previous == null) {
                current.remove();
            } else {
                current.set(previous);
            }
        }
    }

    public static void runWithoutTouch(Runnable action) {
        runWith(current().toBuilder().skipTouch(true).build(), action);
    }

    public static <T> T callWithoutTouch(Supplier<T> action) {
        return callWith(current().toBuilder().skipTouch(true).build(), action);
    }
}
