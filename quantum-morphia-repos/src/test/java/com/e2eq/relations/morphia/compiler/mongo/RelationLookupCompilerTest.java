package com.e2eq.relations.morphia.compiler.mongo;

import com.e2eq.relations.core.DefaultRecordKindResolver;
import com.e2eq.relations.core.RecordKindRegistry;
import com.e2eq.relations.core.RelationMappingStore;
import com.e2eq.relations.exceptions.InvalidJoinSpecException;
import com.e2eq.relations.model.ColumnRef;
import com.e2eq.relations.model.JoinSpec;
import com.e2eq.relations.model.RecordKind;
import com.e2eq.relations.model.RelationKind;
import com.e2eq.relations.model.RelationMapping;
import com.e2eq.relations.model.RelationOptions;
import com.e2eq.relations.model.ThroughOptions;
import com.e2eq.relations.morphia.MorphiaRecordKind;
import dev.morphia.annotations.Entity;
import dev.morphia.annotations.Id;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RelationLookupCompilerTest {

    @Entity("pets")
    static class Pet {
        @Id
        ObjectId id;
    }

    private RecordKindRegistry registry;
    private RelationMappingStore store;
    private RelationLookupCompiler compiler;
    private RecordKind pet;

    @BeforeEach
    public void setUp() {
        registry = new RecordKindRegistry();
        store = new RelationMappingStore(new DefaultRecordKindResolver(registry));
        compiler = new RelationLookupCompiler(store);
        pet = registry.register(new MorphiaRecordKind(Pet.class));
    }

    private static Document stage(List<Bson> pipeline, int i, String op) {
        Document d = (Document) pipeline.get(i);
        assertTrue(d.containsKey(op), "stage " + i + " should be " + op + " but was " + d.keySet());
        return (Document) d.get(op);
    }

    @Test
    public void hasMany_lookupOnTheForeignKey() {
        RecordKind person = registry.register(new RecordKind("Person", r -> r.hasMany(pet)));

        List<Bson> pipeline = compiler.compile(person, "pets");

        assertEquals(1, pipeline.size());
        Document lookup = stage(pipeline, 0, "$lookup");
        assertEquals("pets", lookup.get("from"));
        assertEquals(new Document("key", "$_id"), lookup.get("let"));
        assertEquals("pets", lookup.get("as"));
        assertEquals(List.of(new Document("$match", new Document("$expr",
            new Document("$eq", List.of("$personId", "$$key"))))), lookup.get("pipeline"));
    }

    @Test
    public void hasOne_isFlattenedToASingleDocument() {
        RecordKind person = registry.register(new RecordKind("Person", r -> r.hasOne(pet)));

        List<Bson> pipeline = compiler.compile(person, "pet");

        assertEquals(2, pipeline.size());
        Document lookup = stage(pipeline, 0, "$lookup");
        assertEquals(new Document("key", "$petId"), lookup.get("let"));
        assertEquals(List.of(new Document("$match", new Document("$expr",
            new Document("$eq", List.of("$_id", "$$key"))))), lookup.get("pipeline"));
        assertEquals(new Document("pet", new Document("$first", "$pet")), stage(pipeline, 1, "$set"));
    }

    @Test
    public void belongsTo_readsTheOwnerColumnFromTo() {
        RecordKind person = registry.register(new RecordKind("Person"));
        RecordKind petWithOwner = new RecordKind("Pet", r -> r.belongsTo(person));

        List<Bson> pipeline = compiler.compile(petWithOwner, "person");

        Document lookup = stage(pipeline, 0, "$lookup");
        assertEquals("Person", lookup.get("from"));
        assertEquals(new Document("key", "$_id"), lookup.get("let"));
        assertEquals(List.of(new Document("$match", new Document("$expr",
            new Document("$eq", List.of("$petId", "$$key"))))), lookup.get("pipeline"));
        stage(pipeline, 1, "$set");
    }

    @Test
    public void swappedOverrides_areNormalized() {
        RecordKind person = registry.register(new RecordKind("Person", r -> r.hasMany(pet, RelationOptions.builder()
            .joinFrom("Person.id")
            .joinTo("pets.keeperId")
            .build())));

        Document lookup = stage(compiler.compile(person, "pets"), 0, "$lookup");
        assertEquals(new Document("key", "$_id"), lookup.get("let"));
        assertEquals(List.of(new Document("$match", new Document("$expr",
            new Document("$eq", List.of("$keeperId", "$$key"))))), lookup.get("pipeline"));
    }

    @Test
    public void filterStages_followTheJoinMatch() {
        RecordKind person = registry.register(new RecordKind("Person", r -> r.hasMany(pet, RelationOptions.builder()
            .filter(q -> q.where("archived", false).orderBy("name", true))
            .build())));

        Document lookup = stage(compiler.compile(person, "pets"), 0, "$lookup");
        List<?> stages = (List<?>) lookup.get("pipeline");
        assertEquals(3, stages.size());
        assertEquals(new Document("$match", new Document("archived", false)), stages.get(1));
        assertEquals(new Document("$sort", new Document("name", 1)), stages.get(2));
    }

    @Test
    public void through_joinsViaTheJoinCollection() {
        RecordKind person = registry.register(new RecordKind("Person", r -> r.hasManyThrough(pet)));

        List<Bson> pipeline = compiler.compile(person, "pets");

        assertEquals(3, pipeline.size());
        Document joinLookup = stage(pipeline, 0, "$lookup");
        assertEquals("Person_Pet", joinLookup.get("from"));
        assertEquals(new Document("key", "$_id"), joinLookup.get("let"));
        assertEquals("__rel_pets", joinLookup.get("as"));
        assertEquals(List.of(new Document("$match", new Document("$expr",
            new Document("$eq", List.of("$personId", "$$key"))))), joinLookup.get("pipeline"));

        Document targetLookup = stage(pipeline, 1, "$lookup");
        assertEquals("pets", targetLookup.get("from"));
        assertEquals(new Document("keys", "$__rel_pets.petId"), targetLookup.get("let"));
        assertEquals(List.of(new Document("$match", new Document("$expr",
            new Document("$in", List.of("$_id", "$$keys"))))), targetLookup.get("pipeline"));

        assertEquals(new Document("__rel_pets", 0), stage(pipeline, 2, "$project"));
    }

    @Test
    public void through_copiesExtraColumnsOntoTargets() {
        RecordKind person = registry.register(new RecordKind("Person", r -> r.hasManyThrough(pet, RelationOptions.builder()
            .through(ThroughOptions.builder().table("adoptions").extra(List.of("since")).build())
            .build())));

        List<Bson> pipeline = compiler.compile(person, "pets");

        assertEquals(4, pipeline.size());
        Document map = (Document) ((Document) stage(pipeline, 2, "$set").get("pets")).get("$map");
        assertEquals("$pets", map.get("input"));
        assertEquals("it", map.get("as"));
        Document merge = (Document) map.get("in");
        List<?> merged = (List<?>) merge.get("$mergeObjects");
        assertEquals("$$it", merged.get(0));
        Document extras = (Document) merged.get(1);
        assertEquals(new Document("$arrayElemAt", List.of("$__rel_pets.since",
            new Document("$indexOfArray", List.of("$__rel_pets.petId", "$$it._id")))), extras.get("since"));
        stage(pipeline, 3, "$project");
    }

    @Test
    public void severalRelations_compileInRequestOrder() {
        RecordKind household = registry.register(new RecordKind("Household"));
        RecordKind person = registry.register(new RecordKind("Person", r -> {
            r.hasMany(pet);
            r.belongsTo(household);
        }));

        List<Bson> pipeline = compiler.compile(person, List.of("household", "pets"));
        assertEquals("Household", stage(pipeline, 0, "$lookup").get("from"));
        stage(pipeline, 1, "$set");
        assertEquals("pets", stage(pipeline, 2, "$lookup").get("from"));
    }

    @Test
    public void unknownRelation_fails() {
        RecordKind person = registry.register(new RecordKind("Person", r -> r.hasMany(pet)));
        assertThrows(InvalidJoinSpecException.class, () -> compiler.compile(person, "toys"));
    }

    @Test
    public void joinWithoutOwnerColumn_fails() {
        RecordKind person = registry.register(new RecordKind("Person"));
        RelationMapping detached = new RelationMapping(RelationKind.OWNS_MANY, "pets", person, pet, null,
            new JoinSpec(ColumnRef.of("pets", "keeperId"), ColumnRef.of("Keeper", "id")));
        store.setRelationMappings(person, Map.of("pets", detached));

        assertThrows(InvalidJoinSpecException.class, () -> compiler.compile(person, "pets"));
    }
}
