package org.carball.stackops.query.handler;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Factories for the native filter shapes the OpenStack list APIs understand.
 */
public final class ServerSideFilters {

    private ServerSideFilters() {
    }

    /**
     * {@code EQUAL_TO} on an exact-match field.
     */
    public static ServerSideFilterFunction equalTo(String key) {
        return args -> List.of(filter(key, args.require(FilterArguments.VALUE)));
    }

    /**
     * {@code ANY_IN} on an exact-match field: one alternative per value.
     */
    public static ServerSideFilterFunction anyIn(String key) {
        return args -> args.requireNonEmptyList(FilterArguments.VALUES).stream()
                .distinct()
                .map(value -> filter(key, value))
                .collect(Collectors.toList());
    }

    /**
     * Adds {@code all_tenants=true}; Nova only honours project filters for admins listing every tenant.
     */
    public static ServerSideFilterFunction allTenants(ServerSideFilterFunction delegate) {
        return args -> delegate.apply(args).stream()
                .map(filters -> {
                    Map<String, Object> copy = new LinkedHashMap<>(filters);
                    copy.put("all_tenants", true);
                    return copy;
                })
                .collect(Collectors.toList());
    }

    /**
     * A lower timestamp bound such as {@code changes-since}: now minus the threshold, rounded up to
     * whole seconds so the listing never returns anything updated before the exact bound.
     */
    public static ServerSideFilterFunction lowerTimestampBound(String key, Clock clock) {
        return args -> {
            Instant exact = clock.instant().minus(args.requireDuration());
            Instant bound = exact.truncatedTo(ChronoUnit.SECONDS);
            if (bound.isBefore(exact)) {
                bound = bound.plusSeconds(1);
            }
            return List.of(filter(key, DateTimeFormatter.ISO_INSTANT.format(bound)));
        };
    }

    /**
     * An upper timestamp bound such as {@code changes-before}: now minus the threshold, rounded down
     * to whole seconds.
     */
    public static ServerSideFilterFunction upperTimestampBound(String key, Clock clock) {
        return args -> {
            Instant bound = clock.instant().minus(args.requireDuration()).truncatedTo(ChronoUnit.SECONDS);
            return List.of(filter(key, DateTimeFormatter.ISO_INSTANT.format(bound)));
        };
    }

    private static Map<String, Object> filter(String key, Object value) {
        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put(key, value);
        return filters;
    }
}
