package com.e2eq.relations.naming;

import com.e2eq.relations.exceptions.InvalidNameException;
import com.e2eq.relations.util.Inflector;

/**
 * Convention defaults derived from record-kind names.
 *
 * <pre>
 *   tableNameOf("Person")              = "Person"
 *   foreignKeyColumnOf("Person", "id") = "personId"
 *   relationNameSingular("UserProfile") = "userProfile"
 *   relationNamePlural("Pet")          = "pets"
 * </pre>
 *
 * All functions are pure. Plural names come from {@link Inflector#pluralize(String)} and are only
 * as good as its heuristic.
 */
public final class NamingConventions {

    private NamingConventions() {
    }

    public static String tableNameOf(String recordKindName) {
        return requireValidName("record-kind", recordKindName);
    }

    public static String foreignKeyColumnOf(String ownerName, String idColumnName) {
        requireValidName("record-kind", ownerName);
        requireValidName("id column", idColumnName);
        return Inflector.camelCase(ownerName) + Inflector.upperFirst(idColumnName);
    }

    public static String relationNameSingular(String targetName) {
        requireValidName("record-kind", targetName);
        return Inflector.camelCase(targetName);
    }

    public static String relationNamePlural(String targetName) {
        return Inflector.pluralize(relationNameSingular(targetName));
    }

    /**
     * @param subject what the name is for, used in the error message
     * @param name the name to check
     * @return the name, unchanged
     * @throws InvalidNameException if the name is null, blank or has no letter or digit
     */
    public static String requireValidName(String subject, String name) {
        if (name == null || name.isBlank() || Inflector.words(name).isEmpty()) {
            throw new InvalidNameException(subject, name);
        }
        return name;
    }
}
