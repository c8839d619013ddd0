package org.Aayush.core.time;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Shared deterministic helpers for turning caller timestamps into epoch seconds.
 *
 * <p>All methods are safe for negative timestamps.</p>
 */
public final class TimeUtils {
    /** Earliest epoch second that maps to a local date-time in every zone. */
    public static final long MIN_EPOCH_SECOND = LocalDateTime.MIN.toEpochSecond(ZoneOffset.MIN);
    /** Latest epoch second that maps to a local date-time in every zone. */
    public static final long MAX_EPOCH_SECOND = LocalDateTime.MAX.toEpochSecond(ZoneOffset.MAX);

    /**
     * Timestamp units accepted at the resolver boundary.
     */
    @Getter
    @Accessors(fluent = true)
    @RequiredArgsConstructor
    public enum EngineTimeUnit {
        SECONDS(1L),
        MILLISECONDS(1_000L);

        /** Number of ticks that represent one second in this unit. */
        private final long ticksPerSecond;
    }

    /**
     * Prevents instantiation of this utility class.
     */
    private TimeUtils() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Converts a timestamp in the given unit into epoch seconds (floor for milliseconds).
     *
     * @param timestamp input timestamp value.
     * @param unit unit used by {@code timestamp}.
     * @return epoch seconds.
     */
    public static long toEpochSeconds(long timestamp, EngineTimeUnit unit) {
        if (unit == null) {
            throw new IllegalArgumentException("Engine unit cannot be null");
        }
        if (unit == EngineTimeUnit.SECONDS) {
            return timestamp;
        }
        // Floor division keeps pre-1970 millisecond values on the correct second.
        return Math.floorDiv(timestamp, unit.ticksPerSecond());
    }

    /**
     * Returns whether {@code epochSeconds} can be expressed as a zoned date-time in any zone.
     *
     * <p>The range is the {@link LocalDateTime} range narrowed by the largest zone offset on each
     * side (years -999999999 to 999999999), which includes 1970-2038.</p>
     */
    public static boolean isRepresentableEpochSecond(long epochSeconds) {
        return epochSeconds >= MIN_EPOCH_SECOND && epochSeconds <= MAX_EPOCH_SECOND;
    }

    /**
     * Validates and returns {@code epochSeconds}.
     *
     * @param epochSeconds candidate epoch seconds.
     * @return the same value.
     * @throws IllegalArgumentException when the value is outside {@link #MIN_EPOCH_SECOND}..{@link #MAX_EPOCH_SECOND}.
     */
    public static long requireRepresentableEpochSecond(long epochSeconds) {
        if (!isRepresentableEpochSecond(epochSeconds)) {
            throw new IllegalArgumentException("epoch second out of representable range: " + epochSeconds);
        }
        return epochSeconds;
    }
}
