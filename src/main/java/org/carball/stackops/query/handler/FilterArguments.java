package org.carball.stackops.query.handler;

import org.carball.stackops.exception.InvalidArgumentException;
import org.carball.stackops.exception.MissingMandatoryParamException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named filter arguments with typed, validating accessors.
 */
public final class FilterArguments {

    public static final String VALUE = "value";
    public static final String VALUES = "values";
    public static final String REGEX = "regex";
    public static final String DAYS = "days";
    public static final String HOURS = "hours";
    public static final String MINUTES = "minutes";
    public static final String SECONDS = "seconds";
    public static final String FORMAT = "format";

    private final Map<String, Object> arguments;

    private FilterArguments(Map<String, Object> arguments) {
        this.arguments = arguments == null ? Collections.emptyMap() : new LinkedHashMap<>(arguments);
    }

    public static FilterArguments of(Map<String, Object> arguments) {
        return new FilterArguments(arguments);
    }

    public boolean has(String name) {
        return arguments.get(name) != null;
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(arguments);
    }

    public Object require(String name) {
        Object value = arguments.get(name);
        if (value == null) {
            throw new MissingMandatoryParamException("Missing mandatory argument '" + name + "'");
        }
        return value;
    }

    public String requireString(String name) {
        Object value = require(name);
        if (!(value instanceof String)) {
            throw new InvalidArgumentException(
                    String.format("Argument '%s' must be a string, got %s", name, value.getClass().getSimpleName()));
        }
        String text = (String) value;
        if (text.isEmpty()) {
            throw new MissingMandatoryParamException("Argument '" + name + "' must not be empty");
        }
        return text;
    }

    public Optional<String> optionalString(String name) {
        return has(name) ? Optional.of(requireString(name)) : Optional.empty();
    }

    /**
     * Reads a list argument that must contain at least one item to match against.
     */
    public List<Object> requireNonEmptyList(String name) {
        Object value = require(name);
        List<Object> items;
        if (value instanceof Collection) {
            items = new ArrayList<>((Collection<?>) value);
        } else if (value instanceof Object[]) {
            items = new ArrayList<>(Arrays.asList((Object[]) value));
        } else {
            throw new InvalidArgumentException(
                    String.format("Argument '%s' must be a list, got %s", name, value.getClass().getSimpleName()));
        }
        if (items.isEmpty()) {
            throw new MissingMandatoryParamException(
                    "Argument '" + name + "' must contain at least one item to match against");
        }
        return items;
    }

    public List<String> requireNonEmptyStringList(String name) {
        List<String> strings = new ArrayList<>();
        for (Object item : requireNonEmptyList(name)) {
            if (!(item instanceof String)) {
                throw new InvalidArgumentException(
                        String.format("Argument '%s' must only contain strings, found %s", name, item));
            }
            strings.add((String) item);
        }
        return strings;
    }

    public long requireLong(String name) {
        Object value = require(name);
        Long parsed = toLong(value);
        if (parsed == null) {
            throw new InvalidArgumentException(
                    String.format("Argument '%s' must be an integer, got '%s'", name, value));
        }
        return parsed;
    }

    public Optional<Long> optionalLong(String name) {
        return has(name) ? Optional.of(requireLong(name)) : Optional.empty();
    }

    /**
     * Sums the days, hours, minutes and seconds arguments. At least one must be given and the total must be positive.
     */
    public Duration requireDuration() {
        if (!has(DAYS) && !has(HOURS) && !has(MINUTES) && !has(SECONDS)) {
            throw new MissingMandatoryParamException(
                    "One of 'days', 'hours', 'minutes' or 'seconds' must be given");
        }
        Duration total = Duration.ZERO;
        total = total.plusDays(nonNegative(DAYS));
        total = total.plusHours(nonNegative(HOURS));
        total = total.plusMinutes(nonNegative(MINUTES));
        total = total.plusSeconds(nonNegative(SECONDS));
        if (total.isZero()) {
            throw new InvalidArgumentException("Time threshold must be greater than zero");
        }
        return total;
    }

    private long nonNegative(String name) {
        long value = optionalLong(name).orElse(0L);
        if (value < 0) {
            throw new InvalidArgumentException(String.format("Argument '%s' must not be negative, got %d", name, value));
        }
        return value;
    }

    /**
     * Converts integral numbers and integer-formatted strings; returns null for anything else.
     */
    static Long toLong(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return (long) d;
            }
            return null;
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return arguments.toString();
    }
}
