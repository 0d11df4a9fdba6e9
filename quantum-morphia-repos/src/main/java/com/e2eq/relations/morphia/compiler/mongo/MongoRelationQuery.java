package com.e2eq.relations.morphia.compiler.mongo;

import com.e2eq.relations.model.RecordKind;
import com.e2eq.relations.model.RelationFilter;
import com.e2eq.relations.model.RelationQuery;
import org.bson.Document;
import org.bson.conversions.Bson;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Collects the conditions of a {@link RelationFilter} as MongoDB stages for a {@code $lookup} pipeline.
 * Column names are document fields, except the id column of the queried kind which maps to {@code _id}.
 */
public class MongoRelationQuery implements RelationQuery {

    private final RecordKind kind;
    private final List<Document> conditions = new ArrayList<>();
    private final Document sort = new Document();

    public MongoRelationQuery(RecordKind kind) {
        this.kind = kind;
    }

    public static List<Bson> stagesOf(RecordKind kind, RelationFilter filter) {
        if (filter == null) {
            return List.of();
        }
        MongoRelationQuery query = new MongoRelationQuery(kind);
        filter.apply(query);
        return query.toStages();
    }

    @Override
    public RelationQuery where(String column, Object value) {
        conditions.add(new Document(field(column), value));
        return this;
    }

    @Override
    public RelationQuery whereNot(String column, Object value) {
        conditions.add(new Document(field(column), new Document("$ne", value)));
        return this;
    }

    @Override
    public RelationQuery whereIn(String column, Collection<?> values) {
        conditions.add(new Document(field(column), new Document("$in", values == null ? List.of() : new ArrayList<>(values))));
        return this;
    }

    @Override
    public RelationQuery whereNull(String column) {
        // matches both null and missing fields
        conditions.add(new Document(field(column), null));
        return this;
    }

    @Override
    public RelationQuery whereNotNull(String column) {
        conditions.add(new Document(field(column), new Document("$ne", null)));
        return this;
    }

    @Override
    public RelationQuery orderBy(String column, boolean ascending) {
        sort.append(field(column), ascending ? 1 : -1);
        return this;
    }

    /**
     * @return a {@code $match} stage when any condition was added, then a {@code $sort} stage when any
     * ordering was added
     */
    public List<Bson> toStages() {
        List<Bson> stages = new ArrayList<>();
        if (conditions.size() == 1) {
            stages.add(new Document("$match", conditions.get(0)));
        } else if (!conditions.isEmpty()) {
            stages.add(new Document("$match", new Document("$and", new ArrayList<>(conditions))));
        }
        if (!sort.isEmpty()) {
            stages.add(new Document("$sort", sort));
        }
        return stages;
    }

    private String field(String column) {
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("column can not be blank");
        }
        return RelationLookupCompiler.documentField(kind, column);
    }
}
