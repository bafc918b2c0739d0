package org.carball.stackops.model.property;

/**
 * A property bound to a concrete resource schema.
 *
 * @param <R> resource type the property is extracted from
 */
public interface ResourceProperty<R> extends QueryProperty {

    Object extract(R resource, AuxiliaryData auxiliaryData);
}
