package com.e2eq.relations.core;

import com.e2eq.relations.exceptions.UnresolvedRecordKindException;
import com.e2eq.relations.model.RecordKind;
import io.quarkus.logging.Log;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads record-kinds from classes. A location maps onto a class name, {@code /com/acme/models/Pet}
 * is {@code com.acme.models.Pet}; relative locations are taken from the base location.
 * <p>
 * The class is either a {@link RecordKind} subclass with a no-arg constructor, instantiated once and
 * reused, or any class exposing a {@code public static} field holding its descriptor.
 * </p>
 */
public class ClassPathRecordKindLoader implements RecordKindLoader {

    private final String baseLocation;
    private final ClassLoader classLoader;
    private final Map<Class<?>, RecordKind> instances = new ConcurrentHashMap<>();

    public ClassPathRecordKindLoader(String baseLocation) {
        this(baseLocation, Thread.currentThread().getContextClassLoader());
    }

    public ClassPathRecordKindLoader(String baseLocation, ClassLoader classLoader) {
        this.baseLocation = baseLocation == null ? "/" : baseLocation;
        this.classLoader = classLoader != null ? classLoader : ClassPathRecordKindLoader.class.getClassLoader();
    }

    @Override
    public Optional<RecordKind> load(String location) {
        String className = toClassName(location);
        Class<?> type;
        try {
            type = Class.forName(className, true, classLoader);
        } catch (ClassNotFoundException | NoClassDefFoundError e) {
            Log.debugf("No record-kind class %s for location %s", className, location);
            return Optional.empty();
        }
        if (RecordKind.class.isAssignableFrom(type)) {
            return Optional.of(instances.computeIfAbsent(type, t -> instantiate(t, location)));
        }
        return Optional.of(exportedKind(type, location));
    }

    String toClassName(String location) {
        if (location == null || location.isBlank()) {
            throw new UnresolvedRecordKindException(location, location);
        }
        Deque<String> segments = new ArrayDeque<>();
        if (!location.startsWith("/")) {
            append(segments, baseLocation, location);
        }
        append(segments, location, location);
        if (segments.isEmpty()) {
            throw new UnresolvedRecordKindException(location, location);
        }
        return String.join(".", segments);
    }

    private static void append(Deque<String> segments, String path, String location) {
        for (String s : path.split("/")) {
            if (s.isEmpty() || s.equals(".")) {
                continue;
            }
            if (s.equals("..")) {
                if (segments.isEmpty()) {
                    throw new UnresolvedRecordKindException(location, location);
                }
                segments.removeLast();
            } else {
                segments.addLast(s);
            }
        }
    }

    private RecordKind instantiate(Class<?> type, String location) {
        try {
            RecordKind kind = (RecordKind) type.getDeclaredConstructor().newInstance();
            Log.debugf("Loaded record-kind %s from %s", kind.getName(), type.getName());
            return kind;
        } catch (NoSuchMethodException | InstantiationException | IllegalAccessException e) {
            throw new UnresolvedRecordKindException(type.getName(), location, e);
        } catch (InvocationTargetException e) {
            throw new UnresolvedRecordKindException(type.getName(), location, e.getCause());
        }
    }

    private RecordKind exportedKind(Class<?> type, String location) {
        for (Field f : type.getFields()) {
            if (Modifier.isStatic(f.getModifiers()) && RecordKind.class.isAssignableFrom(f.getType())) {
                try {
                    RecordKind kind = (RecordKind) f.get(null);
                    if (kind != null) {
                        return kind;
                    }
                } catch (IllegalAccessException e) {
                    throw new UnresolvedRecordKindException(type.getName(), location, e);
                }
            }
        }
        throw new UnresolvedRecordKindException(type.getName(), location);
    }
}
