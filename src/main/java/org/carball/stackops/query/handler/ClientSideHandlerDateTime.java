package org.carball.stackops.query.handler;

import lombok.extern.slf4j.Slf4j;
import org.carball.stackops.exception.InvalidArgumentException;
import org.carball.stackops.model.preset.PresetKind;
import org.carball.stackops.model.preset.QueryPresetsDateTime;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.util.function.Predicate;

/**
 * Compares how long ago a timestamp property was against a threshold built from
 * days, hours, minutes and seconds. A timestamp exactly at the threshold counts as older.
 * Values the configured format cannot read are retried as ISO-8601 local date-times with
 * optional fraction and offset, read as UTC when the offset is missing (the Cinder and
 * Octavia shape, {@code 2021-07-01T10:00:00.000000}).
 */
@Slf4j
public class ClientSideHandlerDateTime extends ClientSideHandler<QueryPresetsDateTime> {

    public static final String DEFAULT_FORMAT = "yyyy-MM-dd'T'HH:mm:ss'Z'";

    private static final DateTimeFormatter ISO_FALLBACK = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .toFormatter()
            .withZone(ZoneOffset.UTC);

    private final Clock clock;

    public ClientSideHandlerDateTime(PresetPropertyMappings propertyMappings) {
        this(propertyMappings, Clock.systemUTC());
    }

    public ClientSideHandlerDateTime(PresetPropertyMappings propertyMappings, Clock clock) {
        super(propertyMappings);
        this.clock = clock;

        register(QueryPresetsDateTime.OLDER_THAN, args -> elapsed(args, (age, threshold) -> age.compareTo(threshold) >= 0));
        register(QueryPresetsDateTime.OLDER_THAN_OR_EQUAL,
                args -> elapsed(args, (age, threshold) -> age.compareTo(threshold) >= 0));
        register(QueryPresetsDateTime.YOUNGER_THAN, args -> elapsed(args, (age, threshold) -> age.compareTo(threshold) < 0));
        register(QueryPresetsDateTime.YOUNGER_THAN_OR_EQUAL,
                args -> elapsed(args, (age, threshold) -> age.compareTo(threshold) <= 0));
    }

    @Override
    public PresetKind getKind() {
        return PresetKind.DATETIME;
    }

    public Clock getClock() {
        return clock;
    }

    @FunctionalInterface
    private interface AgeComparison {
        boolean test(Duration age, Duration threshold);
    }

    private Predicate<Object> elapsed(FilterArguments args, AgeComparison comparison) {
        Duration threshold = args.requireDuration();
        DateTimeFormatter formatter = formatter(args.optionalString(FilterArguments.FORMAT).orElse(DEFAULT_FORMAT));
        return value -> {
            Instant timestamp = toInstant(value, formatter);
            if (timestamp == null) {
                return false;
            }
            Duration age = Duration.between(timestamp, clock.instant());
            return comparison.test(age, threshold);
        };
    }

    private static DateTimeFormatter formatter(String pattern) {
        try {
            return DateTimeFormatter.ofPattern(pattern).withZone(ZoneOffset.UTC);
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException("Invalid datetime format '" + pattern + "'", e);
        }
    }

    /**
     * Parses a property value as a UTC instant. Null or unparseable values never match.
     */
    static Instant toInstant(Object value, DateTimeFormatter formatter) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant) {
            return (Instant) value;
        }
        try {
            return Instant.from(formatter.parse(value.toString()));
        } catch (DateTimeException e) {
            try {
                return Instant.from(ISO_FALLBACK.parse(value.toString()));
            } catch (DateTimeException fallbackFailure) {
                log.warn("Could not parse timestamp '{}': {}", value, e.getMessage());
                return null;
            }
        }
    }
}
