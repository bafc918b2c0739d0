package org.carball.stackops.exception;

/** A property name does not exist for the resource type being queried. */
public class UnknownPropertyException extends StackOpsException {
    private static final long serialVersionUID = 2953001168347291745L;

    public UnknownPropertyException(String propertyName, String resourceType) {
        super(String.format("Unknown property '%s' for resource type '%s'", propertyName, resourceType));
    }
}
