package com.e2eq.relations.core;

import com.e2eq.relations.exceptions.InvalidJoinSpecException;
import com.e2eq.relations.model.ColumnRef;
import com.e2eq.relations.model.JoinSpec;
import com.e2eq.relations.model.RecordKind;
import com.e2eq.relations.model.RelationDeclarations;
import com.e2eq.relations.model.RelationKind;
import com.e2eq.relations.model.RelationMapping;
import com.e2eq.relations.model.RelationOptions;
import com.e2eq.relations.model.ThroughOptions;
import com.e2eq.relations.model.ThroughSpec;
import io.quarkus.logging.Log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.e2eq.relations.naming.NamingConventions.foreignKeyColumnOf;
import static com.e2eq.relations.naming.NamingConventions.relationNamePlural;
import static com.e2eq.relations.naming.NamingConventions.relationNameSingular;

/**
 * Builds the relation graph of one record-kind during a single invocation of its
 * {@link RecordKind#declareRelations(RelationDeclarations)} hook.
 *
 * <p>Convention defaults, where {@code fk(k)} is {@code camelCase(k.name) + UpperFirst(k.idColumn)}:</p>
 * <pre>
 *   kind                    from                         to
 *   REFERENCE_TO_ONE        target.table . fk(owner)     owner.table . owner.idColumn
 *   OWNS_ONE                owner.table  . fk(target)    target.table . target.idColumn
 *   OWNS_MANY               target.table . fk(owner)     owner.table . owner.idColumn
 *   OWNS_MANY_THROUGH_JOIN  owner.table  . owner.idColumn target.table . target.idColumn
 *                           through: joinTable . fk(owner) / joinTable . fk(target)
 * </pre>
 * Not thread safe; the mapping store confines each instance to the thread building the graph.
 */
public class RelationDeclarationResolver implements RelationDeclarations {

    private final RecordKind owner;
    private final RecordKindResolver resolver;
    private final RelationMappingStore store;
    private final Map<String, RelationMapping> mappings = new LinkedHashMap<>();

    RelationDeclarationResolver(RecordKind owner, RecordKindResolver resolver, RelationMappingStore store) {
        this.owner = owner;
        this.resolver = resolver;
        this.store = store;
    }

    @Override
    public RecordKind owner() {
        return owner;
    }

    @Override
    public RelationMapping belongsTo(RecordKind target, RelationOptions options) {
        return declare(RelationKind.REFERENCE_TO_ONE, resolver.resolve(target), options);
    }

    @Override
    public RelationMapping belongsTo(String target, RelationOptions options) {
        return declare(RelationKind.REFERENCE_TO_ONE, resolver.resolve(target), options);
    }

    @Override
    public RelationMapping hasOne(RecordKind target, RelationOptions options) {
        return declare(RelationKind.OWNS_ONE, resolver.resolve(target), options);
    }

    @Override
    public RelationMapping hasOne(String target, RelationOptions options) {
        return declare(RelationKind.OWNS_ONE, resolver.resolve(target), options);
    }

    @Override
    public RelationMapping hasMany(RecordKind target, RelationOptions options) {
        return declare(RelationKind.OWNS_MANY, resolver.resolve(target), options);
    }

    @Override
    public RelationMapping hasMany(String target, RelationOptions options) {
        return declare(RelationKind.OWNS_MANY, resolver.resolve(target), options);
    }

    @Override
    public RelationMapping hasManyThrough(RecordKind target, RelationOptions options) {
        return declare(RelationKind.OWNS_MANY_THROUGH_JOIN, resolver.resolve(target), options);
    }

    @Override
    public RelationMapping hasManyThrough(String target, RelationOptions options) {
        return declare(RelationKind.OWNS_MANY_THROUGH_JOIN, resolver.resolve(target), options);
    }

    @Override
    public void inheritFrom(RecordKind parent) {
        for (RelationMapping mapping : store.getRelationMappings(resolver.resolve(parent)).values()) {
            put(mapping);
        }
    }

    Map<String, RelationMapping> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(mappings));
    }

    private RelationMapping declare(RelationKind kind, RecordKind target, RelationOptions options) {
        RelationOptions opts = options == null ? RelationOptions.none() : options;

        String name = override("name", opts.getName())
                .orElseGet(() -> kind.isToMany() ? relationNamePlural(target.getName()) : relationNameSingular(target.getName()));
        ColumnRef from = column("joinFrom", opts.getJoinFrom()).orElseGet(() -> defaultFrom(kind, target));
        ColumnRef to = column("joinTo", opts.getJoinTo()).orElseGet(() -> defaultTo(kind, target));
        ThroughSpec through = kind == RelationKind.OWNS_MANY_THROUGH_JOIN ? through(target, opts.getThrough()) : null;

        RelationMapping mapping = new RelationMapping(kind, name, owner, target, opts.getFilter(), new JoinSpec(from, to, through));
        put(mapping);
        return mapping;
    }

    private ColumnRef defaultFrom(RelationKind kind, RecordKind target) {
        switch (kind) {
            case REFERENCE_TO_ONE:
            case OWNS_MANY:
                // Pet.personId for Person hasMany Pet
                return ColumnRef.of(target.getTableName(), fk(owner));
            case OWNS_ONE:
                // Person.petId for Person hasOne Pet
                return ColumnRef.of(owner.getTableName(), fk(target));
            case OWNS_MANY_THROUGH_JOIN:
                return ColumnRef.of(owner.getTableName(), owner.getIdColumn());
            default:
                throw new IllegalStateException("Unhandled relation kind " + kind);
        }
    }

    private ColumnRef defaultTo(RelationKind kind, RecordKind target) {
        switch (kind) {
            case REFERENCE_TO_ONE:
            case OWNS_MANY:
                return ColumnRef.of(owner.getTableName(), owner.getIdColumn());
            case OWNS_ONE:
            case OWNS_MANY_THROUGH_JOIN:
                return ColumnRef.of(target.getTableName(), target.getIdColumn());
            default:
                throw new IllegalStateException("Unhandled relation kind " + kind);
        }
    }

    private ThroughSpec through(RecordKind target, ThroughOptions options) {
        ThroughOptions t = options == null ? new ThroughOptions() : options;
        if (t.getModel() != null && t.getModelName() != null) {
            throw new InvalidJoinSpecException(owner.getName() + ": set either through.model or through.modelName, not both");
        }
        RecordKind throughKind = t.getModel() != null
                ? resolver.resolve(t.getModel())
                : override("through.modelName", t.getModelName()).map(resolver::resolve).orElse(null);

        // Person_Pet unless the join table is named or modelled
        String table = override("through.table", t.getTable())
                .orElseGet(() -> throughKind != null ? throughKind.getTableName() : owner.getName() + "_" + target.getName());
        ColumnRef from = column("through.from", t.getFrom()).orElseGet(() -> ColumnRef.of(table, fk(owner)));
        ColumnRef to = column("through.to", t.getTo()).orElseGet(() -> ColumnRef.of(table, fk(target)));

        List<String> extra = new ArrayList<>();
        if (t.getExtra() != null) {
            for (String column : t.getExtra()) {
                extra.add(override("through.extra", column)
                        .orElseThrow(() -> new InvalidJoinSpecException(owner.getName() + ": through.extra can not contain null")));
            }
        }
        return new ThroughSpec(table, from, to, extra, t.getFilter(), throughKind);
    }

    private void put(RelationMapping mapping) {
        RelationMapping previous = mappings.put(mapping.name(), mapping);
        if (previous != null) {
            Log.debugf("Relation %s.%s declared again, replacing %s", owner.getName(), mapping.name(), previous);
        }
    }

    private Optional<String> override(String what, String value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value.isBlank()) {
            throw new InvalidJoinSpecException(owner.getName() + ": explicit " + what + " must not be blank");
        }
        return Optional.of(value.trim());
    }

    private Optional<ColumnRef> column(String what, String value) {
        return override(what, value).map(v -> {
            try {
                return ColumnRef.parse(v);
            } catch (InvalidJoinSpecException e) {
                throw new InvalidJoinSpecException(owner.getName() + ": explicit " + what + " is invalid, " + e.getMessage(), e);
            }
        });
    }

    private static String fk(RecordKind kind) {
        return foreignKeyColumnOf(kind.getName(), kind.getIdColumn());
    }
}
