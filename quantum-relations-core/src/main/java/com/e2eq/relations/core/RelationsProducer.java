package com.e2eq.relations.core;

import com.e2eq.relations.core.lifecycle.LifecycleHookMediator;
import com.e2eq.relations.core.lifecycle.TouchHook;
import com.e2eq.relations.core.lifecycle.WriteHook;
import com.e2eq.relations.model.RecordKind;
import io.quarkus.arc.DefaultBean;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * CDI wiring of the relation layer. Record-kinds declared as beans (use {@code @Singleton}, a client
 * proxy would break identity based caching) are registered up front; anything else is loaded from the
 * class path on first reference.
 */
@ApplicationScoped
public class RelationsProducer {

    @Produces
    @Singleton
    @DefaultBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    @DefaultBean
    public RecordKindRegistry recordKindRegistry(RelationsConfig config, @Any Instance<RecordKind> kinds) {
        return registry(config, kinds);
    }

    @Produces
    @Singleton
    @DefaultBean
    public RecordKindResolver recordKindResolver(RelationsConfig config, RecordKindRegistry registry) {
        return new DefaultRecordKindResolver(registry, config.recordKindLocation());
    }

    @Produces
    @Singleton
    @DefaultBean
    public RelationMappingStore relationMappingStore(RecordKindResolver resolver) {
        return new RelationMappingStore(resolver);
    }

    @Produces
    @Singleton
    @DefaultBean
    public TouchHook touchHook(RelationsConfig config, Clock clock) {
        return touch(config, clock);
    }

    @Produces
    @Singleton
    @DefaultBean
    public LifecycleHookMediator lifecycleHookMediator(@Any Instance<WriteHook> hooks) {
        return mediator(hooks);
    }

    RecordKindRegistry registry(RelationsConfig config, Iterable<? extends RecordKind> kinds) {
        RecordKindRegistry registry = new RecordKindRegistry(new ClassPathRecordKindLoader(config.recordKindLocation()));
        int count = 0;
        for (RecordKind kind : kinds) {
            registry.register(kind);
            count++;
        }
        Log.debugf("Registered %d record-kind bean(s), bare names resolve under %s", count, config.recordKindLocation());
        return registry;
    }

    TouchHook touch(RelationsConfig config, Clock clock) {
        if (!config.touch().enabled()) {
            Log.info("Timestamp touch step disabled by quantum.relations.touch.enabled");
        }
        return new TouchHook(clock, config.touch().enabled(), config.touch().order());
    }

    LifecycleHookMediator mediator(Iterable<? extends WriteHook> hooks) {
        List<WriteHook> all = new ArrayList<>();
        hooks.forEach(all::add);
        return new LifecycleHookMediator(all);
    }
}
