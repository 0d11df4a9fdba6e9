package com.e2eq.relations.morphia.compiler.mongo;

import com.e2eq.relations.model.RecordKind;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class MongoRelationQueryTest {

    private final RecordKind pet = new RecordKind("Pet");

    @Test
    public void singleCondition_isMatchedDirectly() {
        List<Bson> stages = MongoRelationQuery.stagesOf(pet, q -> q.where("archived", false));
        assertEquals(List.of(new Document("$match", new Document("archived", false))), stages);
    }

    @Test
    public void severalConditions_areAndedThenSorted() {
        List<Bson> stages = MongoRelationQuery.stagesOf(pet, q -> q
            .whereNot("status", "lost")
            .whereIn("species", Set.of("cat"))
            .whereNull("deletedAt")
            .whereNotNull("name")
            .orderBy("name", true)
            .orderBy("id", false));

        assertEquals(2, stages.size());
        Document match = (Document) ((Document) stages.get(0)).get("$match");
        List<?> and = (List<?>) match.get("$and");
        assertEquals(4, and.size());
        assertEquals(new Document("status", new Document("$ne", "lost")), and.get(0));
        assertEquals(new Document("species", new Document("$in", List.of("cat"))), and.get(1));
        assertEquals(new Document("deletedAt", null), and.get(2));
        assertEquals(new Document("name", new Document("$ne", null)), and.get(3));

        Document sort = (Document) ((Document) stages.get(1)).get("$sort");
        assertEquals(new Document("name", 1).append("_id", -1), sort);
    }

    @Test
    public void noFilter_meansNoStages() {
        assertTrue(MongoRelationQuery.stagesOf(pet, null).isEmpty());
        assertTrue(new MongoRelationQuery(pet).toStages().isEmpty());
    }

    @Test
    public void blankColumn_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new MongoRelationQuery(pet).where(" ", 1));
    }
}
