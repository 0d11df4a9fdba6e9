package com.e2eq.relations.model;

/**
 * Relation declaration calls available inside {@link RecordKind#declareRelations(RelationDeclarations)}.
 *
 * <p>Each call resolves the target, fills anything not given in {@link RelationOptions} from the naming
 * conventions and records one {@link RelationMapping} in the owner's graph under construction. A later
 * declaration with the same name replaces the earlier one.</p>
 *
 * <p>Targets are either a descriptor or a string identifier. Identifiers starting with {@code .} or
 * {@code /} are locations, anything else is a record-kind name looked up in the conventional
 * record-kind location.</p>
 */
public interface RelationDeclarations {

    /**
     * The record-kind whose relations are being declared.
     */
    RecordKind owner();

    /**
     * Owner belongs to target. With owner Pet and target Person: name {@code person},
     * {@code Person.petId = Pet.id}.
     */
    RelationMapping belongsTo(RecordKind target, RelationOptions options);

    RelationMapping belongsTo(String target, RelationOptions options);

    default RelationMapping belongsTo(RecordKind target) {
        return belongsTo(target, RelationOptions.none());
    }

    default RelationMapping belongsTo(String target) {
        return belongsTo(target, RelationOptions.none());
    }

    /**
     * Owner has one target. With owner Person and target Pet: name {@code pet},
     * {@code Person.petId = Pet.id}.
     */
    RelationMapping hasOne(RecordKind target, RelationOptions options);

    RelationMapping hasOne(String target, RelationOptions options);

    default RelationMapping hasOne(RecordKind target) {
        return hasOne(target, RelationOptions.none());
    }

    default RelationMapping hasOne(String target) {
        return hasOne(target, RelationOptions.none());
    }

    /**
     * Owner has many targets. With owner Person and target Pet: name {@code pets},
     * {@code Pet.personId = Person.id}.
     */
    RelationMapping hasMany(RecordKind target, RelationOptions options);

    RelationMapping hasMany(String target, RelationOptions options);

    default RelationMapping hasMany(RecordKind target) {
        return hasMany(target, RelationOptions.none());
    }

    default RelationMapping hasMany(String target) {
        return hasMany(target, RelationOptions.none());
    }

    /**
     * Owner has many targets through a join table. With owner Person and target Pet: name {@code pets},
     * {@code Person.id = Person_Pet.personId} and {@code Person_Pet.petId = Pet.id}.
     */
    RelationMapping hasManyThrough(RecordKind target, RelationOptions options);

    RelationMapping hasManyThrough(String target, RelationOptions options);

    default RelationMapping hasManyThrough(RecordKind target) {
        return hasManyThrough(target, RelationOptions.none());
    }

    default RelationMapping hasManyThrough(String target) {
        return hasManyThrough(target, RelationOptions.none());
    }

    /**
     * Copies the resolved relations of {@code parent} into this graph unchanged. Join columns keep
     * pointing at the parent's tables.
     */
    void inheritFrom(RecordKind parent);
}
