package com.e2eq.relations.morphia;

import com.e2eq.relations.exceptions.RelationMappingException;
import dev.morphia.annotations.Entity;
import dev.morphia.annotations.Id;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MorphiaRecordKindTest {

    @Entity("pets")
    static class Pet {
        @Id
        ObjectId refId;
        String name;
    }

    @Entity
    static class Household {
        @Id
        ObjectId id;
    }

    static class Base {
        @Id
        String code;
    }

    @Entity
    static class Vet extends Base {
    }

    static class Plain {
    }

    @Test
    public void namesTableAndIdComeFromTheEntity() {
        MorphiaRecordKind pet = new MorphiaRecordKind(Pet.class);
        assertEquals("Pet", pet.getName());
        assertEquals("pets", pet.getTableName());
        assertEquals("refId", pet.getIdColumn());
        assertSame(Pet.class, pet.getRecordType());
        assertTrue(pet.isTimestampsEnabled());
    }

    @Test
    public void defaultEntityValue_fallsBackToTheClassName() {
        MorphiaRecordKind household = new MorphiaRecordKind(Household.class);
        assertEquals("Household", household.getTableName());
        assertEquals("id", household.getIdColumn());
    }

    @Test
    public void idFieldIsFoundOnSuperclasses() {
        assertEquals("code", new MorphiaRecordKind(Vet.class).getIdColumn());
    }

    @Test
    public void nonEntityClass_isRejected() {
        assertThrows(RelationMappingException.class, () -> new MorphiaRecordKind(Plain.class));
        assertThrows(IllegalArgumentException.class, () -> new MorphiaRecordKind(null));
    }
}
