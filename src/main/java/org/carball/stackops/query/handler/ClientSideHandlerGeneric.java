package org.carball.stackops.query.handler;

import org.carball.stackops.model.preset.PresetKind;
import org.carball.stackops.model.preset.QueryPresetsGeneric;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Equality and set membership, usable on properties of any kind.
 */
public class ClientSideHandlerGeneric extends ClientSideHandler<QueryPresetsGeneric> {

    public ClientSideHandlerGeneric(PresetPropertyMappings propertyMappings) {
        super(propertyMappings);

        register(QueryPresetsGeneric.EQUAL_TO, args -> {
            Object expected = args.require(FilterArguments.VALUE);
            return value -> valuesEqual(value, expected);
        });
        register(QueryPresetsGeneric.NOT_EQUAL_TO, args -> {
            Object expected = args.require(FilterArguments.VALUE);
            return value -> !valuesEqual(value, expected);
        });
        register(QueryPresetsGeneric.ANY_IN, args -> {
            List<Object> candidates = args.requireNonEmptyList(FilterArguments.VALUES);
            return value -> anyIn(value, candidates);
        });
        register(QueryPresetsGeneric.NOT_ANY_IN, args -> {
            List<Object> candidates = args.requireNonEmptyList(FilterArguments.VALUES);
            return value -> !anyIn(value, candidates);
        });
    }

    @Override
    public PresetKind getKind() {
        return PresetKind.GENERIC;
    }

    private static boolean anyIn(Object value, List<Object> candidates) {
        return candidates.stream().anyMatch(candidate -> valuesEqual(value, candidate));
    }

    /**
     * Numbers compare by numeric value so that 1 (int, from YAML) equals 1L (long, from JSON).
     * NaN and the infinities have no decimal form and compare as doubles.
     */
    static boolean valuesEqual(Object value, Object expected) {
        if (value instanceof Number && expected instanceof Number) {
            Number left = (Number) value;
            Number right = (Number) expected;
            if (!isFinite(left) || !isFinite(right)) {
                return Double.compare(left.doubleValue(), right.doubleValue()) == 0;
            }
            return new BigDecimal(left.toString()).compareTo(new BigDecimal(right.toString())) == 0;
        }
        return Objects.equals(value, expected);
    }

    private static boolean isFinite(Number number) {
        if (number instanceof Double || number instanceof Float) {
            return Double.isFinite(number.doubleValue());
        }
        return true;
    }
}
