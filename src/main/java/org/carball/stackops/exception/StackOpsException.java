package org.carball.stackops.exception;

/**
 * Base class for every error raised by the query engine and its collaborators.
 */
public class StackOpsException extends RuntimeException {
    private static final long serialVersionUID = 4120847715937721093L;

    public StackOpsException(String message) {
        super(message);
    }

    public StackOpsException(String message, Throwable cause) {
        super(message, cause);
    }
}
