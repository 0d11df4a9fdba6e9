package com.e2eq.relations.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InflectorTest {

    @Test
    public void camelCase_handlesPascalSnakeAndAcronyms() {
        assertEquals("person", Inflector.camelCase("Person"));
        assertEquals("userProfile", Inflector.camelCase("UserProfile"));
        assertEquals("userProfile", Inflector.camelCase("user_profile"));
        assertEquals("userProfile", Inflector.camelCase("user-profile"));
        assertEquals("httpServer", Inflector.camelCase("HTTPServer"));
        assertEquals("", Inflector.camelCase(""));
        assertEquals("", Inflector.camelCase(null));
    }

    @Test
    public void words_dropsSeparators() {
        assertEquals(List.of("Person", "Pet"), Inflector.words("Person_Pet"));
        assertTrue(Inflector.words("__").isEmpty());
    }

    @Test
    public void upperFirst_onlyTouchesFirstCharacter() {
        assertEquals("Id", Inflector.upperFirst("id"));
        assertEquals("ID", Inflector.upperFirst("ID"));
        assertEquals("RefName", Inflector.upperFirst("refName"));
    }

    @Test
    public void pluralize_regularSuffixRules() {
        assertEquals("pets", Inflector.pluralize("pet"));
        assertEquals("categories", Inflector.pluralize("category"));
        assertEquals("days", Inflector.pluralize("day"));
        assertEquals("boxes", Inflector.pluralize("box"));
        assertEquals("buses", Inflector.pluralize("bus"));
        assertEquals("matches", Inflector.pluralize("match"));
        assertEquals("knives", Inflector.pluralize("knife"));
        assertEquals("heroes", Inflector.pluralize("hero"));
    }

    @Test
    public void pluralize_onlyTheLastWordOfACamelName() {
        assertEquals("userCategories", Inflector.pluralize("userCategory"));
        assertEquals("salesPeople", Inflector.pluralize("salesPerson"));
    }

    @Test
    public void pluralize_irregularAndUncountable() {
        assertEquals("people", Inflector.pluralize("person"));
        assertEquals("children", Inflector.pluralize("child"));
        assertEquals("sheep", Inflector.pluralize("sheep"));
        assertEquals("metadata", Inflector.pluralize("metadata"));
    }

    @Test
    public void pluralize_isBestEffortForUnknownIrregulars() {
        // not in the irregular table, falls through to the suffix rules
        assertEquals("criterions", Inflector.pluralize("criterion"));
    }
}
