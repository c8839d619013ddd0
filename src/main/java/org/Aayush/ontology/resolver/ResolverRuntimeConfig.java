package org.Aayush.ontology.resolver;

import lombok.Builder;
import lombok.Value;

/**
 * Runtime configuration bound once at startup by {@link ResolverRuntimeBinder}.
 */
@Value
@Builder
public class ResolverRuntimeConfig {

    /**
     * Zone id contexts are expressed in, or {@code null} for the system default zone.
     */
    String zoneId;

    /**
     * Admissible window on both sides of the reference, in years; {@code null} for the default.
     */
    Integer windowYears;

    /**
     * Returns convenience runtime config for the system zone and default window.
     */
    public static ResolverRuntimeConfig defaults() {
        return ResolverRuntimeConfig.builder().build();
    }

    /**
     * Returns convenience runtime config for UTC and default window.
     */
    public static ResolverRuntimeConfig utc() {
        return ResolverRuntimeConfig.builder()
                .zoneId("UTC")
                .build();
    }
}
