package com.e2eq.relations.core;

import com.e2eq.relations.exceptions.RelationMappingException;
import com.e2eq.relations.exceptions.UnresolvedRecordKindException;
import com.e2eq.relations.model.RecordKind;

/**
 * Resolves string targets through a {@link RecordKindLoader}.
 * <ul>
 *   <li>{@code ./Pet}, {@code ../shared/Pet}, {@code /com/acme/models/Pet} are handed to the loader as is</li>
 *   <li>a bare name such as {@code Pet} is looked up under the conventional record-kind location,
 *   {@code /models/Pet} by default</li>
 * </ul>
 */
public class DefaultRecordKindResolver implements RecordKindResolver {
    public static final String DEFAULT_RECORD_KIND_LOCATION = "/models";

    private final RecordKindLoader loader;
    private final String recordKindLocation;

    public DefaultRecordKindResolver(RecordKindLoader loader) {
        this(loader, DEFAULT_RECORD_KIND_LOCATION);
    }

    public DefaultRecordKindResolver(RecordKindLoader loader, String recordKindLocation) {
        if (loader == null) {
            throw new IllegalArgumentException("loader is required");
        }
        this.loader = loader;
        this.recordKindLocation = (recordKindLocation == null || recordKindLocation.isBlank())
                ? DEFAULT_RECORD_KIND_LOCATION : recordKindLocation;
    }

    @Override
    public RecordKind resolve(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new UnresolvedRecordKindException(identifier, null);
        }
        String location = isLocation(identifier) ? identifier : conventionalLocationOf(identifier);
        try {
            return loader.load(location)
                    .orElseThrow(() -> new UnresolvedRecordKindException(identifier, location));
        } catch (RelationMappingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new UnresolvedRecordKindException(identifier, location, e);
        }
    }

    public String getRecordKindLocation() {
        return recordKindLocation;
    }

    String conventionalLocationOf(String name) {
        return recordKindLocation.endsWith("/") ? recordKindLocation + name : recordKindLocation + "/" + name;
    }

    static boolean isLocation(String identifier) {
        return identifier.startsWith(".") || identifier.startsWith("/");
    }
}
