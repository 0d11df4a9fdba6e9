package com.e2eq.relations.core;

import com.e2eq.relations.exceptions.RelationMappingException;
import com.e2eq.relations.model.RecordKind;
import com.e2eq.relations.model.RelationMapping;
import io.quarkus.logging.Log;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per record-kind cache of resolved relation graphs.
 *
 * <p>The first {@link #getRelationMappings(RecordKind)} for a kind runs its declare-relations hook and
 * installs the result; every later call returns that same immutable map. Slots are keyed by descriptor
 * identity and are never shared between a kind and the kind it specializes.</p>
 *
 * <p>First access is serialized with a lock per kind, unrelated kinds never wait on each other. When the
 * hook throws, nothing is installed and the exception propagates, so the next access runs the hook again.</p>
 */
public class RelationMappingStore {

    private final RecordKindResolver resolver;
    private final Map<RecordKind, Map<String, RelationMapping>> graphs = new ConcurrentHashMap<>();
    private final Map<RecordKind, Object> locks = new ConcurrentHashMap<>();
    private final ThreadLocal<Set<RecordKind>> building =
            ThreadLocal.withInitial(() -> Collections.newSetFromMap(new IdentityHashMap<>()));

    public RelationMappingStore(RecordKindResolver resolver) {
        if (resolver == null) {
            throw new IllegalArgumentException("resolver is required");
        }
        this.resolver = resolver;
    }

    /**
     * @return the relation graph of {@code kind}, relation name to mapping, in declaration order
     * @throws RelationMappingException or one of its subclasses when a declaration fails
     */
    public Map<String, RelationMapping> getRelationMappings(RecordKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind can not be null");
        }
        Map<String, RelationMapping> graph = graphs.get(kind);
        if (graph != null) {
            return graph;
        }
        synchronized (lockFor(kind)) {
            graph = graphs.get(kind);
            if (graph != null) {
                return graph;
            }
            Set<RecordKind> inProgress = building.get();
            if (!inProgress.add(kind)) {
                throw new RelationMappingException("Relation graph of record-kind " + kind.getName()
                        + " requested while it is being declared, check for cyclic inheritFrom calls");
            }
            try {
                RelationDeclarationResolver declarations = new RelationDeclarationResolver(kind, resolver, this);
                kind.declareRelations(declarations);
                graph = declarations.snapshot();
                graphs.put(kind, graph);
                Log.debugf("Resolved %d relation(s) for record-kind %s", graph.size(), kind.getName());
                return graph;
            } finally {
                inProgress.remove(kind);
                if (inProgress.isEmpty()) {
                    building.remove();
                }
            }
        }
    }

    public Optional<RelationMapping> getRelationMapping(RecordKind kind, String name) {
        return Optional.ofNullable(getRelationMappings(kind).get(name));
    }

    /**
     * Installs an explicit graph for {@code kind}. Its declare-relations hook will not run afterwards.
     */
    public void setRelationMappings(RecordKind kind, Map<String, RelationMapping> mappings) {
        if (kind == null || mappings == null) {
            throw new IllegalArgumentException("kind and mappings are required");
        }
        Map<String, RelationMapping> copy = new LinkedHashMap<>();
        for (Map.Entry<String, RelationMapping> e : mappings.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) {
                throw new IllegalArgumentException("relation names and mappings can not be null");
            }
            copy.put(e.getKey(), e.getValue());
        }
        synchronized (lockFor(kind)) {
            graphs.put(kind, Collections.unmodifiableMap(copy));
        }
    }

    public boolean isResolved(RecordKind kind) {
        return kind != null && graphs.containsKey(kind);
    }

    /**
     * Drops the cached graph of {@code kind}; the next access runs its hook again.
     *
     * @return true if a graph was cached
     */
    public boolean evict(RecordKind kind) {
        if (kind == null) {
            return false;
        }
        synchronized (lockFor(kind)) {
            return graphs.remove(kind) != null;
        }
    }

    public int size() {
        return graphs.size();
    }

    private Object lockFor(RecordKind kind) {
        return locks.computeIfAbsent(kind, k -> new Object());
    }
}
