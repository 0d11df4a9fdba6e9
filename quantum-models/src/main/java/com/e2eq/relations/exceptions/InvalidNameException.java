package com.e2eq.relations.exceptions;

/**
 * Thrown when an empty or malformed record-kind, table or column name reaches the naming conventions.
 */
public class InvalidNameException extends RelationMappingException {
    private static final long serialVersionUID = 1L;

    private final String subject;
    private final String value;

    public InvalidNameException(String subject, String value) {
        super(buildMessage(subject, value));
        this.subject = subject;
        this.value = value;
    }

    private static String buildMessage(String subject, String value) {
        return String.format("Invalid %s name: '%s' must contain at least one letter or digit",
            subject != null ? subject : "record-kind", value);
    }

    /**
     * What the name was for, e.g. "record-kind" or "id column".
     */
    public String getSubject() {
        return subject;
    }

    /**
     * The rejected value, may be null.
     */
    public String getValue() {
        return value;
    }
}
