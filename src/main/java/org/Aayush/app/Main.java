package org.Aayush.app;

import org.Aayush.core.time.Grain;
import org.Aayush.core.time.Period;
import org.Aayush.ontology.constraint.TimeConstraints;
import org.Aayush.ontology.dimension.AmountOfMoneyValue;
import org.Aayush.ontology.dimension.Bound;
import org.Aayush.ontology.dimension.BoundedDirection;
import org.Aayush.ontology.dimension.DatetimeKind;
import org.Aayush.ontology.dimension.DatetimeValue;
import org.Aayush.ontology.dimension.Dimension;
import org.Aayush.ontology.dimension.DurationValue;
import org.Aayush.ontology.dimension.Form;
import org.Aayush.ontology.dimension.Precision;
import org.Aayush.ontology.resolver.ResolverContext;
import org.Aayush.ontology.resolver.ResolverRuntimeBinder;
import org.Aayush.ontology.resolver.ResolverRuntimeConfig;

import java.time.DayOfWeek;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Minimal application entry point used for local smoke runs.
 *
 * <p>Usage: {@code Main [epochSeconds] [zoneId]}. Defaults to the current time in UTC.</p>
 */
public class Main {
    /**
     * Resolves a fixed set of sample values against the given reference and prints them.
     *
     * @param args optional epoch seconds and zone id.
     */
    public static void main(String[] args) {
        long epochSeconds = args.length > 0 ? Long.parseLong(args[0]) : System.currentTimeMillis() / 1_000L;
        String zoneId = args.length > 1 ? args[1] : "UTC";

        ResolverContext context = new ResolverRuntimeBinder()
                .bind(ResolverRuntimeConfig.builder().zoneId(zoneId).build())
                .contextAt(epochSeconds);

        System.out.println("reference = " + context.reference().start());
        for (Map.Entry<String, Dimension> sample : samples().entrySet()) {
            String resolved = context.resolve(sample.getValue())
                    .map(Object::toString)
                    .orElse("<unresolved>");
            System.out.println(sample.getKey() + " -> " + resolved);
        }
    }

    private static Map<String, Dimension> samples() {
        Map<String, Dimension> samples = new LinkedHashMap<>();
        samples.put("monday", DatetimeValue.builder()
                .constraint(TimeConstraints.dayOfWeek(DayOfWeek.MONDAY))
                .form(Form.dayOfWeek(false))
                .datetimeKind(DatetimeKind.DATE)
                .build());
        samples.put("next monday", DatetimeValue.builder()
                .constraint(TimeConstraints.dayOfWeek(DayOfWeek.MONDAY))
                .form(Form.dayOfWeek(true))
                .datetimeKind(DatetimeKind.DATE)
                .build());
        samples.put("after 5pm", DatetimeValue.builder()
                .constraint(TimeConstraints.hour(17, false))
                .direction(BoundedDirection.after(Bound.start()))
                .datetimeKind(DatetimeKind.TIME)
                .build());
        samples.put("from monday to wednesday", DatetimeValue.builder()
                .constraint(TimeConstraints.dayOfWeek(DayOfWeek.MONDAY)
                        .spanTo(TimeConstraints.dayOfWeek(DayOfWeek.WEDNESDAY), true))
                .datetimeKind(DatetimeKind.DATE_PERIOD)
                .build());
        samples.put("february 30th", DatetimeValue.of(
                TimeConstraints.month(2).intersect(TimeConstraints.dayOfMonth(30))));
        samples.put("about 42.5 dollars", new AmountOfMoneyValue(42.5d, Precision.APPROXIMATE, "USD", false));
        samples.put("for two and a half hours", new DurationValue(
                Period.of(Grain.HOUR, 2).plus(Period.of(Grain.MINUTE, 30)), Precision.EXACT, true, false));
        return samples;
    }
}
