package org.carball.stackops.cloud;

import java.util.List;
import java.util.Map;

/**
 * Lists one resource type. An empty filter map lists everything; implementations
 * must be side-effect free and report failures as {@link org.carball.stackops.exception.TransportException}.
 */
@FunctionalInterface
public interface ResourceLister<R> {

    List<R> list(Map<String, Object> nativeFilters);
}
