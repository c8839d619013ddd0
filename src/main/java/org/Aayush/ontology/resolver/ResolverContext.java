package org.Aayush.ontology.resolver;

import org.Aayush.core.time.Grain;
import org.Aayush.core.time.Interval;
import org.Aayush.core.time.Moment;
import org.Aayush.core.time.MomentContext;
import org.Aayush.core.time.TimeUtils;
import org.Aayush.ontology.dimension.AmountOfMoneyValue;
import org.Aayush.ontology.dimension.DatetimeValue;
import org.Aayush.ontology.dimension.Dimension;
import org.Aayush.ontology.dimension.DurationValue;
import org.Aayush.ontology.dimension.FloatValue;
import org.Aayush.ontology.dimension.IntegerValue;
import org.Aayush.ontology.dimension.OrdinalValue;
import org.Aayush.ontology.dimension.PercentageValue;
import org.Aayush.ontology.dimension.TemperatureValue;
import org.Aayush.ontology.output.AmountOfMoneyOutput;
import org.Aayush.ontology.output.DurationOutput;
import org.Aayush.ontology.output.FloatOutput;
import org.Aayush.ontology.output.IntegerOutput;
import org.Aayush.ontology.output.OrdinalOutput;
import org.Aayush.ontology.output.Output;
import org.Aayush.ontology.output.PercentageOutput;
import org.Aayush.ontology.output.TemperatureOutput;

import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable per-request resolver anchored at a reference instant.
 *
 * <p>Build one context per request and call {@link #resolve(Dimension)} for every recognized value.
 * The context holds no mutable state and may be shared across threads.</p>
 */
public final class ResolverContext implements ParsingContext<Dimension, Output> {
    public static final String REASON_CONTEXT_WINDOW_INVALID = "RESOLVER_CONTEXT_WINDOW_INVALID";
    public static final String REASON_EPOCH_OUT_OF_RANGE = "RESOLVER_EPOCH_OUT_OF_RANGE";
    public static final String REASON_CONFIG_REQUIRED = "RESOLVER_CONFIG_REQUIRED";
    public static final String REASON_ZONE_INVALID = "RESOLVER_ZONE_INVALID";
    public static final String REASON_WINDOW_INVALID = "RESOLVER_WINDOW_INVALID";

    private final MomentContext momentContext;

    private ResolverContext(MomentContext momentContext) {
        this.momentContext = momentContext;
    }

    /**
     * Creates a context anchored at {@code epochSeconds} in the system default zone.
     */
    public static ResolverContext fromSecs(long epochSeconds) {
        return fromSecs(epochSeconds, ZoneId.systemDefault());
    }

    /**
     * Creates a context anchored at {@code epochSeconds} in {@code zoneId}.
     *
     * <p>The reference is a second-grain interval. Epoch seconds in
     * {@link TimeUtils#MIN_EPOCH_SECOND}..{@link TimeUtils#MAX_EPOCH_SECOND}, which includes the
     * full 1970-2038 range, are accepted as long as the window around them stays representable.</p>
     *
     * @param epochSeconds Unix timestamp in seconds.
     * @param zoneId zone the reference is expressed in.
     * @return context with the default window.
     * @throws ResolutionException {@code RESOLVER_EPOCH_OUT_OF_RANGE} when {@code epochSeconds} or
     *                             its window is not representable.
     */
    public static ResolverContext fromSecs(long epochSeconds, ZoneId zoneId) {
        return forReference(referenceAt(epochSeconds, zoneId));
    }

    /**
     * Creates a context from a timestamp in seconds or milliseconds.
     */
    public static ResolverContext fromTicks(long ticks, TimeUtils.EngineTimeUnit unit, ZoneId zoneId) {
        return fromSecs(TimeUtils.toEpochSeconds(ticks, unit), zoneId);
    }

    /**
     * Creates a context for {@code now} with the default window.
     */
    public static ResolverContext forReference(Interval now) {
        return forReference(now, MomentContext.DEFAULT_WINDOW_YEARS);
    }

    /**
     * Creates a context for {@code now} with a window of {@code windowYears} on both sides.
     *
     * @throws ResolutionException {@code RESOLVER_WINDOW_INVALID} for a non-positive window,
     *                             {@code RESOLVER_EPOCH_OUT_OF_RANGE} when {@code now} is too close
     *                             to the representable limits for the window.
     */
    public static ResolverContext forReference(Interval now, int windowYears) {
        Objects.requireNonNull(now, "now");
        if (windowYears <= 0) {
            throw new ResolutionException(REASON_WINDOW_INVALID, "windowYears must be positive, got " + windowYears);
        }
        try {
            return new ResolverContext(MomentContext.forReference(now, windowYears));
        } catch (IllegalArgumentException ex) {
            throw new ResolutionException(REASON_EPOCH_OUT_OF_RANGE, ex.getMessage(), ex);
        }
    }

    /**
     * Creates a context with an explicit window.
     *
     * @param now reference interval.
     * @param min earliest admissible interval.
     * @param max latest admissible interval.
     * @return context over the given window.
     * @throws ResolutionException unless {@code min.start <= now.start <= max.start} with
     *                             {@link MomentContext#EDGE_HEADROOM_YEARS} representable years beyond each edge.
     */
    public static ResolverContext create(Interval now, Interval min, Interval max) {
        try {
            return new ResolverContext(new MomentContext(now, min, max));
        } catch (IllegalArgumentException ex) {
            throw new ResolutionException(REASON_CONTEXT_WINDOW_INVALID, ex.getMessage(), ex);
        }
    }

    static Interval referenceAt(long epochSeconds, ZoneId zoneId) {
        Objects.requireNonNull(zoneId, "zoneId");
        if (!TimeUtils.isRepresentableEpochSecond(epochSeconds)) {
            throw new ResolutionException(
                    REASON_EPOCH_OUT_OF_RANGE,
                    "epoch second out of representable range: " + epochSeconds
            );
        }
        return Interval.startingAt(Moment.ofEpochSeconds(epochSeconds, zoneId), Grain.SECOND);
    }

    /**
     * Returns the reference interval ("now").
     */
    public Interval reference() {
        return momentContext.reference();
    }

    /**
     * Returns the underlying reference and window.
     */
    public MomentContext momentContext() {
        return momentContext;
    }

    /**
     * Resolves one recognized value.
     *
     * @param dimension recognized value.
     * @return concrete output, or empty for kinds without output and temporal values without candidates.
     */
    @Override
    public Optional<Output> resolve(Dimension dimension) {
        Objects.requireNonNull(dimension, "dimension");
        return switch (dimension.kind()) {
            case DATETIME -> DatetimeResolution.resolve((DatetimeValue) dimension, momentContext);
            case NUMBER -> resolveNumber(dimension);
            case ORDINAL -> Optional.of(new OrdinalOutput(((OrdinalValue) dimension).value()));
            case AMOUNT_OF_MONEY -> Optional.of(resolveAmountOfMoney((AmountOfMoneyValue) dimension));
            case TEMPERATURE -> Optional.of(resolveTemperature((TemperatureValue) dimension));
            case DURATION -> Optional.of(resolveDuration((DurationValue) dimension));
            case PERCENTAGE -> Optional.of(new PercentageOutput(((PercentageValue) dimension).value()));
            case MONEY_UNIT, CYCLE, UNIT_OF_DURATION, RELATIVE_MINUTE -> Optional.empty();
        };
    }

    private static Optional<Output> resolveNumber(Dimension dimension) {
        if (dimension instanceof IntegerValue) {
            return Optional.of(new IntegerOutput(((IntegerValue) dimension).value()));
        }
        if (dimension instanceof FloatValue) {
            return Optional.of(new FloatOutput(((FloatValue) dimension).value()));
        }
        return Optional.empty();
    }

    private static Output resolveAmountOfMoney(AmountOfMoneyValue value) {
        return new AmountOfMoneyOutput(value.value(), value.precision(), value.unit());
    }

    private static Output resolveTemperature(TemperatureValue value) {
        return new TemperatureOutput(value.value(), value.unit(), value.latent());
    }

    private static Output resolveDuration(DurationValue value) {
        return new DurationOutput(value.period(), value.precision());
    }

    @Override
    public String toString() {
        return "ResolverContext[reference=" + momentContext.reference() + "]";
    }
}
