package com.e2eq.relations.morphia;

import com.e2eq.relations.exceptions.RelationMappingException;
import com.e2eq.relations.model.RecordKind;
import com.e2eq.relations.model.RelationDeclarer;
import dev.morphia.annotations.Entity;
import dev.morphia.annotations.Id;

import java.lang.reflect.Field;

/**
 * Record-kind of a Morphia {@link Entity} class.
 * <ul>
 *   <li>name: the class simple name</li>
 *   <li>table: the {@code @Entity} collection when set, otherwise the name</li>
 *   <li>id column: the name of the {@code @Id} field</li>
 * </ul>
 */
public class MorphiaRecordKind extends RecordKind {
    static final String ENTITY_DEFAULT_VALUE = ".";

    public MorphiaRecordKind(Class<?> entityClass) {
        this(entityClass, null);
    }

    public MorphiaRecordKind(Class<?> entityClass, RelationDeclarer relations) {
        super(requireEntity(entityClass).getSimpleName(), collectionOf(entityClass), idFieldOf(entityClass),
                null, entityClass, relations);
    }

    static Class<?> requireEntity(Class<?> entityClass) {
        if (entityClass == null) {
            throw new IllegalArgumentException("entityClass can not be null");
        }
        if (entityClass.getAnnotation(Entity.class) == null) {
            throw new RelationMappingException(entityClass.getName() + " is not annotated with @Entity");
        }
        return entityClass;
    }

    static String collectionOf(Class<?> entityClass) {
        Entity e = entityClass.getAnnotation(Entity.class);
        if (e != null && e.value() != null && !e.value().isBlank() && !ENTITY_DEFAULT_VALUE.equals(e.value())) {
            return e.value();
        }
        return entityClass.getSimpleName();
    }

    static String idFieldOf(Class<?> entityClass) {
        for (Class<?> c = entityClass; c != null && c != Object.class; c = c.getSuperclass()) {
            for (Field f : c.getDeclaredFields()) {
                if (f.isAnnotationPresent(Id.class)) {
                    return f.getName();
                }
            }
        }
        return DEFAULT_ID_COLUMN;
    }
}
