package org.carball.stackops.exception;

/**
 * Thrown while building a query when a preset is not registered for a property,
 * or when the preset kind does not match the kind the property declares.
 */
public class UnsupportedPresetException extends StackOpsException {
    private static final long serialVersionUID = -2239019516349517106L;

    public UnsupportedPresetException(String message) {
        super(message);
    }
}
