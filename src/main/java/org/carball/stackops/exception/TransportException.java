package org.carball.stackops.exception;

/**
 * Raised by a resource lister when the listing call itself fails. The engine
 * never retries and never wraps it; callers receive it as thrown.
 */
public class TransportException extends StackOpsException {
    private static final long serialVersionUID = 8839204170118837405L;

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
