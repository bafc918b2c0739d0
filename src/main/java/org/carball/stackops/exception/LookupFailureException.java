package org.carball.stackops.exception;

/**
 * An auxiliary lookup (project or user by id) failed. The query runner isolates
 * this per record: the affected property becomes {@code null} and the run continues.
 */
public class LookupFailureException extends StackOpsException {
    private static final long serialVersionUID = -1640294510663372215L;

    public LookupFailureException(String message) {
        super(message);
    }

    public LookupFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
