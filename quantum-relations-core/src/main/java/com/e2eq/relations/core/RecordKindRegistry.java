package com.e2eq.relations.core;

import com.e2eq.relations.model.RecordKind;
import io.quarkus.logging.Log;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory record-kind loader, keyed by record-kind name.
 *
 * <p>{@link #load(String)} matches the last segment of the location, so {@code /models/Pet} and
 * {@code ./Pet} both find the kind registered as {@code Pet}. Misses go to the fallback loader and
 * whatever it returns is registered, so a name resolves to the same descriptor from then on.</p>
 */
public class RecordKindRegistry implements RecordKindLoader {

    private final Map<String, RecordKind> byName = new ConcurrentHashMap<>();
    private final Map<Class<?>, RecordKind> byRecordType = new ConcurrentHashMap<>();
    private final RecordKindLoader fallback;

    public RecordKindRegistry() {
        this(null);
    }

    public RecordKindRegistry(RecordKindLoader fallback) {
        this.fallback = fallback;
    }

    /**
     * Registers a kind under its name and, when set, its record type. Replaces any earlier kind of
     * the same name.
     */
    public RecordKind register(RecordKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind can not be null");
        }
        RecordKind previous = byName.put(kind.getName(), kind);
        if (previous != null && previous != kind) {
            Log.warnf("Record-kind %s registered twice, %s replaces %s", kind.getName(),
                    kind.getClass().getName(), previous.getClass().getName());
        }
        if (kind.getRecordType() != null) {
            byRecordType.put(kind.getRecordType(), kind);
        }
        return kind;
    }

    /**
     * Registers {@code kind} unless a kind of the same name is already present.
     *
     * @return the kind registered under that name afterwards
     */
    public RecordKind registerIfAbsent(RecordKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind can not be null");
        }
        RecordKind existing = byName.putIfAbsent(kind.getName(), kind);
        if (existing != null) {
            return existing;
        }
        if (kind.getRecordType() != null) {
            byRecordType.putIfAbsent(kind.getRecordType(), kind);
        }
        return kind;
    }

    public Optional<RecordKind> byName(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(byName.get(name));
    }

    /**
     * Exact match on the record type, subclasses of a registered type are not matched.
     */
    public Optional<RecordKind> findByRecordType(Class<?> recordType) {
        return recordType == null ? Optional.empty() : Optional.ofNullable(byRecordType.get(recordType));
    }

    public Collection<RecordKind> all() {
        return Collections.unmodifiableCollection(byName.values());
    }

    @Override
    public Optional<RecordKind> load(String location) {
        Optional<RecordKind> hit = byName(lastSegment(location));
        if (hit.isPresent() || fallback == null) {
            return hit;
        }
        return fallback.load(location).map(this::registerIfAbsent);
    }

    static String lastSegment(String location) {
        if (location == null) {
            return null;
        }
        int slash = location.lastIndexOf('/');
        return slash < 0 ? location : location.substring(slash + 1);
    }
}
