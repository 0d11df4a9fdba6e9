package com.e2eq.relations.morphia;

import com.e2eq.relations.core.RecordKindRegistry;
import com.e2eq.relations.core.lifecycle.LifecycleHookMediator;
import com.e2eq.relations.model.RecordKind;
import com.e2eq.relations.model.Timestamped;
import dev.morphia.Datastore;
import dev.morphia.EntityListener;
import dev.morphia.annotations.Entity;
import dev.morphia.annotations.PrePersist;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.bson.Document;

import java.lang.annotation.Annotation;
import java.util.Optional;

/**
 * Runs the write hooks for every entity Morphia persists. An entity without {@code createdAt} is
 * treated as an insert, anything else as an update.
 */
@ApplicationScoped
public class TouchInterceptor implements EntityListener<Object> {

    private final RecordKindRegistry registry;
    private final LifecycleHookMediator mediator;

    @Inject
    public TouchInterceptor(RecordKindRegistry registry, LifecycleHookMediator mediator) {
        this.registry = registry;
        this.mediator = mediator;
    }

    @Override
    @PrePersist
    public void prePersist(Object ent, Document document, Datastore datastore) {
        if (ent == null) {
            return;
        }
        Optional<RecordKind> kind = kindOf(ent.getClass());
        if (kind.isEmpty()) {
            Log.debugf("No record-kind for %s, skipping write hooks", ent.getClass().getName());
            return;
        }
        if (isInsert(ent)) {
            mediator.beforeInsert(kind.get(), ent, WriteContexts.current());
        } else {
            mediator.beforeUpdate(kind.get(), ent, WriteContexts.current());
        }
    }

    @Override
    public boolean hasAnnotation(Class<? extends Annotation> type) {
        return false;
    }

    public void installOn(Datastore datastore) {
        datastore.getMapper().addInterceptor(this);
        Log.infof("Installed %s on datastore %s", getClass().getSimpleName(), datastore.getDatabase().getName());
    }

    /**
     * Registered kinds win, matched by record type first and then by the class simple name. An
     * unregistered {@code @Entity} class gets a {@link MorphiaRecordKind}; a kind already registered
     * under that name is never replaced.
     */
    Optional<RecordKind> kindOf(Class<?> type) {
        Optional<RecordKind> registered = registry.findByRecordType(type).or(() -> byName(type));
        if (registered.isPresent() || !type.isAnnotationPresent(Entity.class)) {
            return registered;
        }
        MorphiaRecordKind created = new MorphiaRecordKind(type);
        RecordKind kind = registry.registerIfAbsent(created);
        if (kind != created && kind.getRecordType() != null && kind.getRecordType() != type) {
            Log.warnf("Record-kind %s is registered for %s, %s is touched with an unregistered kind",
                    kind.getName(), kind.getRecordType().getName(), type.getName());
            return Optional.of(created);
        }
        return Optional.of(kind);
    }

    private Optional<RecordKind> byName(Class<?> type) {
        return registry.byName(type.getSimpleName())
                .filter(k -> k.getRecordType() == null || k.getRecordType() == type);
    }

    static boolean isInsert(Object ent) {
        return !(ent instanceof Timestamped) || ((Timestamped) ent).getCreatedAt() == null;
    }
}
