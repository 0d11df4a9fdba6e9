package com.e2eq.relations.exceptions;

/**
 * Thrown when a relation target can not be located.
 * <p>
 * Raised at declaration time so a missing record-kind fails the owner's relation graph immediately
 * instead of surfacing later while a query is planned.
 * </p>
 */
public class UnresolvedRecordKindException extends RelationMappingException {
    private static final long serialVersionUID = 1L;

    private final String identifier;
    private final String location;

    public UnresolvedRecordKindException(String identifier, String location) {
        super(buildMessage(identifier, location));
        this.identifier = identifier;
        this.location = location;
    }

    public UnresolvedRecordKindException(String identifier, String location, Throwable cause) {
        super(buildMessage(identifier, location), cause);
        this.identifier = identifier;
        this.location = location;
    }

    private static String buildMessage(String identifier, String location) {
        if (location == null || location.equals(identifier)) {
            return String.format("Record-kind '%s' could not be resolved", identifier);
        }
        return String.format("Record-kind '%s' could not be resolved at location '%s'", identifier, location);
    }

    /**
     * The identifier as written in the relation declaration.
     */
    public String getIdentifier() {
        return identifier;
    }

    /**
     * The location handed to the loader, null when resolution failed before loading.
     */
    public String getLocation() {
        return location;
    }
}
