package com.e2eq.relations.exceptions;

/**
 * Base class of every error raised while declaring or resolving relation mappings.
 * <p>
 * Declaration-time errors are never recoverable inside the declaring hook, they abort the
 * construction of the owning record-kind's relation graph and leave its cache slot empty.
 * </p>
 */
public class RelationMappingException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public RelationMappingException(String message) {
        super(message);
    }

    public RelationMappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
