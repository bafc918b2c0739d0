package org.carball.stackops.query.handler;

import java.util.List;
import java.util.Map;

/**
 * Translates validated filter arguments into native listing filters. Each map in
 * the returned list is one alternative; the listing call runs once per alternative.
 */
@FunctionalInterface
public interface ServerSideFilterFunction {

    List<Map<String, Object>> apply(FilterArguments arguments);
}
