package com.e2eq.relations.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.Map;
import java.util.Optional;

/**
 * Per-write options passed by the persistence engine to the lifecycle hooks.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class WriteContext {
    public static final WriteContext DEFAULT = WriteContext.builder().build();

    /** leave createdAt / updatedAt untouched for this write */
    private final boolean skipTouch;

    @Singular
    private final Map<String, Object> attributes;

    public static WriteContext skippingTouch() {
        return WriteContext.builder().skipTouch(true).build();
    }

    public Optional<Object> getAttribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }
}
