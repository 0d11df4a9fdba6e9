package com.e2eq.relations.exceptions;

/**
 * Thrown when an explicit join override is blank or malformed, e.g. a column reference without a table.
 */
public class InvalidJoinSpecException extends RelationMappingException {
    private static final long serialVersionUID = 1L;

    public InvalidJoinSpecException(String message) {
        super(message);
    }

    public InvalidJoinSpecException(String message, Throwable cause) {
        super(message, cause);
    }
}
