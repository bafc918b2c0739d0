package org.carball.stackops.model.property;

@FunctionalInterface
public interface PropertyExtractor<R> {

    Object extract(R resource, AuxiliaryData auxiliaryData);

    static <R> PropertyExtractor<R> direct(java.util.function.Function<R, ?> getter) {
        return (resource, auxiliaryData) -> getter.apply(resource);
    }
}
