package org.carball.stackops.query.handler;

import lombok.extern.slf4j.Slf4j;
import org.carball.stackops.model.preset.PresetKind;
import org.carball.stackops.model.preset.QueryPresetsInteger;

import java.util.function.LongPredicate;
import java.util.function.Predicate;

/**
 * Numeric ordering against a scalar threshold.
 */
@Slf4j
public class ClientSideHandlerInteger extends ClientSideHandler<QueryPresetsInteger> {

    public ClientSideHandlerInteger(PresetPropertyMappings propertyMappings) {
        super(propertyMappings);

        register(QueryPresetsInteger.LESS_THAN, args -> {
            long threshold = args.requireLong(FilterArguments.VALUE);
            return compare(v -> v < threshold);
        });
        register(QueryPresetsInteger.GREATER_THAN, args -> {
            long threshold = args.requireLong(FilterArguments.VALUE);
            return compare(v -> v > threshold);
        });
        register(QueryPresetsInteger.LESS_OR_EQUAL, args -> {
            long threshold = args.requireLong(FilterArguments.VALUE);
            return compare(v -> v <= threshold);
        });
        register(QueryPresetsInteger.GREATER_OR_EQUAL, args -> {
            long threshold = args.requireLong(FilterArguments.VALUE);
            return compare(v -> v >= threshold);
        });
    }

    @Override
    public PresetKind getKind() {
        return PresetKind.INTEGER;
    }

    private static Predicate<Object> compare(LongPredicate comparison) {
        return value -> {
            if (value == null) {
                return false;
            }
            Long number = FilterArguments.toLong(value);
            if (number == null) {
                log.warn("Property value '{}' is not an integer, treating as no match", value);
                return false;
            }
            return comparison.test(number);
        };
    }
}
