package org.carball.stackops.exception;

/** A filter argument is present but fails type or format validation. */
public class InvalidArgumentException extends StackOpsException {
    private static final long serialVersionUID = -5301762381745922158L;

    public InvalidArgumentException(String message) {
        super(message);
    }

    public InvalidArgumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
