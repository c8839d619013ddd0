package org.Aayush.ontology.resolver;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.Aayush.core.time.Grain;
import org.Aayush.core.time.Interval;
import org.Aayush.ontology.dimension.DatetimeKind;
import org.Aayush.ontology.dimension.DatetimeValue;
import org.Aayush.ontology.output.DatetimeIntervalKind;
import org.Aayush.ontology.output.DatetimeIntervalOutput;
import org.Aayush.ontology.testutil.ScriptedConstraint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.slf4j.LoggerFactory;

import java.time.ZoneOffset;
import java.util.List;

import static org.Aayush.ontology.testutil.TestMoments.utc;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Span anomaly warning Tests")
class SpanAnomalyLoggingTest {
    private static final Interval SPAN =
            Interval.of(utc(1970, 1, 5, 9, 0, 0), utc(1970, 1, 5, 17, 0, 0), Grain.HOUR);

    private final ResolverContext context = ResolverContext.fromSecs(0L, ZoneOffset.UTC);
    private final Logger logger = (Logger) LoggerFactory.getLogger(DatetimeResolution.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attachAppender() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        logger.detachAppender(appender);
        appender.stop();
    }

    @ParameterizedTest
    @EnumSource(value = DatetimeKind.class, names = {"DATE", "TIME"})
    @DisplayName("Point-like kinds resolving to a span log one warning and still return Between")
    void testPointLikeKindWarns(DatetimeKind kind) {
        DatetimeValue value = DatetimeValue.builder()
                .constraint(ScriptedConstraint.forward(SPAN))
                .datetimeKind(kind)
                .build();

        DatetimeIntervalOutput output = (DatetimeIntervalOutput) context.resolve(value).orElseThrow();

        assertInstanceOf(DatetimeIntervalKind.Between.class, output.intervalKind());
        assertEquals(kind, output.datetimeKind());
        List<ILoggingEvent> warnings = appender.list.stream()
                .filter(event -> event.getLevel() == Level.WARN)
                .toList();
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).getFormattedMessage().startsWith(kind + " kind with an interval"));
    }

    @ParameterizedTest
    @EnumSource(value = DatetimeKind.class, names = {"DATE_TIME", "DATE_PERIOD", "TIME_PERIOD"})
    @DisplayName("Span kinds resolving to a span do not warn")
    void testSpanKindDoesNotWarn(DatetimeKind kind) {
        DatetimeValue value = DatetimeValue.builder()
                .constraint(ScriptedConstraint.forward(SPAN))
                .datetimeKind(kind)
                .build();

        context.resolve(value).orElseThrow();

        assertTrue(appender.list.stream().noneMatch(event -> event.getLevel() == Level.WARN));
    }
}
