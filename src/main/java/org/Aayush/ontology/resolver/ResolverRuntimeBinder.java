package org.Aayush.ontology.resolver;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.core.time.Interval;
import org.Aayush.core.time.MomentContext;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Startup-only resolver runtime binder.
 *
 * <p>This component validates one runtime config and produces an immutable binding that creates
 * per-request {@link ResolverContext} instances.</p>
 */
@Slf4j
public final class ResolverRuntimeBinder {

    /**
     * Binds one runtime config.
     *
     * @param runtimeConfig resolver runtime configuration.
     * @return immutable binding.
     * @throws ResolutionException when the config is missing or invalid.
     */
    public Binding bind(ResolverRuntimeConfig runtimeConfig) {
        if (runtimeConfig == null) {
            throw new ResolutionException(
                    ResolverContext.REASON_CONFIG_REQUIRED,
                    "resolverRuntimeConfig must be provided at startup"
            );
        }
        ZoneId zoneId = resolveZoneId(runtimeConfig.getZoneId());
        int windowYears = resolveWindowYears(runtimeConfig.getWindowYears());
        Binding binding = Binding.builder()
                .zoneId(zoneId)
                .windowYears(windowYears)
                .build();
        log.debug("Bound resolver runtime: zone={}, windowYears={}", zoneId, windowYears);
        return binding;
    }

    private static ZoneId resolveZoneId(String zoneId) {
        if (zoneId == null) {
            return ZoneId.systemDefault();
        }
        String normalized = zoneId.trim();
        if (normalized.isEmpty()) {
            throw new ResolutionException(ResolverContext.REASON_ZONE_INVALID, "zoneId must be non-blank when provided");
        }
        try {
            return ZoneId.of(normalized);
        } catch (DateTimeException ex) {
            throw new ResolutionException(
                    ResolverContext.REASON_ZONE_INVALID,
                    "unknown zone id: " + normalized,
                    ex
            );
        }
    }

    private static int resolveWindowYears(Integer windowYears) {
        if (windowYears == null) {
            return MomentContext.DEFAULT_WINDOW_YEARS;
        }
        if (windowYears <= 0) {
            throw new ResolutionException(
                    ResolverContext.REASON_WINDOW_INVALID,
                    "windowYears must be positive, got " + windowYears
            );
        }
        return windowYears;
    }

    /**
     * Immutable resolver runtime binding output.
     */
    @Value
    @Builder
    public static class Binding {
        /**
         * Zone every context created by this binding is expressed in.
         */
        ZoneId zoneId;

        /**
         * Admissible window on both sides of the reference, in years.
         */
        int windowYears;

        /**
         * Creates a context anchored at {@code epochSeconds}.
         */
        public ResolverContext contextAt(long epochSeconds) {
            return contextFor(ResolverContext.referenceAt(epochSeconds, zoneId));
        }

        /**
         * Creates a context anchored at {@code reference}.
         */
        public ResolverContext contextFor(Interval reference) {
            return ResolverContext.forReference(reference, windowYears);
        }
    }
}
