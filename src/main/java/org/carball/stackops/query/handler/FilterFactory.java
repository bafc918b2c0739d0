package org.carball.stackops.query.handler;

import java.util.function.Predicate;

/**
 * Validates arguments and compiles them into a predicate over a single property value.
 */
@FunctionalInterface
public interface FilterFactory {

    Predicate<Object> create(FilterArguments arguments);
}
