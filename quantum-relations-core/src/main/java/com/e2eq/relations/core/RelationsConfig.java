package com.e2eq.relations.core;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Maps the {@code quantum.relations.*} properties.
 */
@ConfigMapping(prefix = "quantum.relations")
public interface RelationsConfig {

    /**
     * Where bare record-kind names are looked up, {@code Pet} resolves to {@code <location>/Pet}.
     * @return the conventional record-kind location
     */
    @WithDefault(DefaultRecordKindResolver.DEFAULT_RECORD_KIND_LOCATION)
    String recordKindLocation();

    Touch touch();

    interface Touch {
        /**
         * @return false to stop stamping createdAt / updatedAt globally
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * @return position of the touch step among the write hooks
         */
        @WithDefault("1000")
        int order();
    }
}
