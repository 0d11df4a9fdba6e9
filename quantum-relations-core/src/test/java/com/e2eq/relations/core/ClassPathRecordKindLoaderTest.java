package com.e2eq.relations.core;

import com.e2eq.relations.core.fixtures.Household;
import com.e2eq.relations.core.fixtures.PetKind;
import com.e2eq.relations.exceptions.UnresolvedRecordKindException;
import com.e2eq.relations.model.RecordKind;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ClassPathRecordKindLoaderTest {

    private static final String FIXTURES = "/com/e2eq/relations/core/fixtures";

    private final ClassPathRecordKindLoader loader = new ClassPathRecordKindLoader(FIXTURES);

    @Test
    public void toClassName_absoluteAndRelative() {
        assertEquals("com.acme.models.Pet", loader.toClassName("/com/acme/models/Pet"));
        assertEquals("com.e2eq.relations.core.fixtures.Pet", loader.toClassName("./Pet"));
        assertEquals("com.e2eq.relations.core.fixtures.Pet", loader.toClassName("Pet"));
        assertEquals("com.e2eq.relations.core.shared.Pet", loader.toClassName("../shared/Pet"));
        assertThrows(UnresolvedRecordKindException.class, () -> loader.toClassName("/../Pet"));
    }

    @Test
    public void load_instantiatesRecordKindSubclassesOnce() {
        RecordKind first = loader.load(FIXTURES + "/PetKind").orElseThrow();
        RecordKind second = loader.load("./PetKind").orElseThrow();
        assertTrue(first instanceof PetKind);
        assertSame(first, second);
        assertEquals("Pet", first.getName());
    }

    @Test
    public void load_usesStaticDescriptorField() {
        Optional<RecordKind> kind = loader.load("./Household");
        assertTrue(kind.isPresent());
        assertSame(Household.KIND, kind.get());
    }

    @Test
    public void load_missingClassIsEmpty() {
        assertTrue(loader.load("./DoesNotExist").isEmpty());
    }

    @Test
    public void load_classWithoutDescriptorFails() {
        UnresolvedRecordKindException ex = assertThrows(UnresolvedRecordKindException.class,
            () -> loader.load("./NotAKind"));
        assertEquals("com.e2eq.relations.core.fixtures.NotAKind", ex.getIdentifier());
    }
}
