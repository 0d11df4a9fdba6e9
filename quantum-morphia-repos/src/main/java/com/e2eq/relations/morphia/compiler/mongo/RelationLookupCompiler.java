package com.e2eq.relations.morphia.compiler.mongo;

import com.e2eq.relations.core.RelationMappingStore;
import com.e2eq.relations.exceptions.InvalidJoinSpecException;
import com.e2eq.relations.model.ColumnRef;
import com.e2eq.relations.model.RecordKind;
import com.e2eq.relations.model.RelationKind;
import com.e2eq.relations.model.RelationMapping;
import com.e2eq.relations.model.ThroughSpec;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.bson.Document;
import org.bson.conversions.Bson;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Compiles eager loads of resolved relations into MongoDB aggregation stages:
 * - direct relations: one $lookup, to-one relations flattened with $set/$first
 * - through relations: $lookup of the join collection into a temp array, $lookup of the targets with $in,
 *   optional $set copying extra join columns onto each target, $project dropping the temp array
 */
@ApplicationScoped
public class RelationLookupCompiler {
    static final String TEMP_PREFIX = "__rel_";
    static final String MONGO_ID = "_id";

    private final RelationMappingStore store;

    @Inject
    public RelationLookupCompiler(RelationMappingStore store) {
        this.store = store;
    }

    public List<Bson> compile(RecordKind owner, String... relationNames) {
        return compile(owner, Arrays.asList(relationNames));
    }

    public List<Bson> compile(RecordKind owner, Collection<String> relationNames) {
        List<Bson> pipeline = new ArrayList<>();
        for (String name : relationNames) {
            RelationMapping mapping = store.getRelationMapping(owner, name)
                    .orElseThrow(() -> new InvalidJoinSpecException("Record-kind " + owner.getName()
                            + " has no relation named '" + name + "'"));
            if (mapping.join().isThrough()) {
                compileThrough(mapping, pipeline);
            } else {
                compileDirect(mapping, pipeline);
            }
        }
        Log.debugf("Compiled %d stage(s) for %s relations %s", pipeline.size(), owner.getName(), relationNames);
        return pipeline;
    }

    private void compileDirect(RelationMapping m, List<Bson> pipeline) {
        ColumnRef[] sides = ownerSideFirst(m);
        String localField = documentField(m.owner(), sides[0].column());
        String foreignField = documentField(m.target(), sides[1].column());

        List<Bson> lookupPipeline = new ArrayList<>();
        lookupPipeline.add(matchExpr(new Document("$eq", List.of("$" + foreignField, "$$key"))));
        lookupPipeline.addAll(MongoRelationQuery.stagesOf(m.target(), m.filter()));

        pipeline.add(lookup(m.target().getTableName(), new Document("key", "$" + localField), lookupPipeline, m.name()));
        if (!m.kind().isToMany()) {
            pipeline.add(new Document("$set", new Document(m.name(), new Document("$first", "$" + m.name()))));
        }
    }

    private void compileThrough(RelationMapping m, List<Bson> pipeline) {
        ColumnRef[] sides = ownerSideFirst(m);
        ThroughSpec through = m.join().through();
        requireJoinTable(m, through.from());
        requireJoinTable(m, through.to());

        String temp = TEMP_PREFIX + m.name();
        String localField = documentField(m.owner(), sides[0].column());
        String targetField = documentField(m.target(), sides[1].column());
        String joinFromField = documentField(through.throughTarget(), through.from().column());
        String joinToField = documentField(through.throughTarget(), through.to().column());

        // Person.id -> Person_Pet.personId
        List<Bson> joinPipeline = new ArrayList<>();
        joinPipeline.add(matchExpr(new Document("$eq", List.of("$" + joinFromField, "$$key"))));
        joinPipeline.addAll(MongoRelationQuery.stagesOf(through.throughTarget(), through.filter()));
        pipeline.add(lookup(through.joinTableName(), new Document("key", "$" + localField), joinPipeline, temp));

        // Person_Pet.petId -> Pet.id
        List<Bson> targetPipeline = new ArrayList<>();
        targetPipeline.add(matchExpr(new Document("$in", List.of("$" + targetField, "$$keys"))));
        targetPipeline.addAll(MongoRelationQuery.stagesOf(m.target(), m.filter()));
        pipeline.add(lookup(m.target().getTableName(), new Document("keys", "$" + temp + "." + joinToField), targetPipeline, m.name()));

        if (!through.extraColumns().isEmpty()) {
            Document extras = new Document();
            for (String column : through.extraColumns()) {
                extras.append(column, new Document("$arrayElemAt", List.of(
                        "$" + temp + "." + column,
                        new Document("$indexOfArray", List.of("$" + temp + "." + joinToField, "$$it." + targetField)))));
            }
            pipeline.add(new Document("$set", new Document(m.name(), new Document("$map", new Document()
                    .append("input", "$" + m.name())
                    .append("as", "it")
                    .append("in", new Document("$mergeObjects", List.of("$$it", extras)))))));
        }
        pipeline.add(new Document("$project", new Document(temp, 0)));
    }

    /**
     * @return the join column on the owner's collection followed by the one on the target's
     */
    static ColumnRef[] ownerSideFirst(RelationMapping m) {
        ColumnRef from = m.join().from();
        ColumnRef to = m.join().to();
        // belongsTo and hasMany keep the owner's column in "to"
        boolean ownerInTo = m.kind() == RelationKind.REFERENCE_TO_ONE || m.kind() == RelationKind.OWNS_MANY;
        ColumnRef ownerSide = ownerInTo ? to : from;
        ColumnRef targetSide = ownerInTo ? from : to;
        String ownerTable = m.owner().getTableName();
        if (!ownerSide.table().equals(ownerTable)) {
            if (!targetSide.table().equals(ownerTable)) {
                throw new InvalidJoinSpecException("Relation " + m.owner().getName() + "." + m.name()
                        + " has no join column on " + ownerTable + ": " + from + " = " + to);
            }
            ColumnRef swap = ownerSide;
            ownerSide = targetSide;
            targetSide = swap;
        }
        return new ColumnRef[]{ownerSide, targetSide};
    }

    static String documentField(RecordKind kind, String column) {
        if (kind != null && column.equals(kind.getIdColumn())) {
            return MONGO_ID;
        }
        return column;
    }

    private static void requireJoinTable(RelationMapping m, ColumnRef column) {
        if (!column.table().equals(m.join().through().joinTableName())) {
            throw new InvalidJoinSpecException("Relation " + m.owner().getName() + "." + m.name() + " joins through "
                    + m.join().through().joinTableName() + " but references " + column);
        }
    }

    private static Document matchExpr(Document expr) {
        return new Document("$match", new Document("$expr", expr));
    }

    private static Document lookup(String from, Document let, List<Bson> pipeline, String as) {
        return new Document("$lookup", new Document()
                .append("from", from)
                .append("let", let)
                .append("pipeline", pipeline)
                .append("as", as));
    }
}
