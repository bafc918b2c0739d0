package org.carball.stackops.exception;

/** A required filter argument is absent or empty. */
public class MissingMandatoryParamException extends StackOpsException {
    private static final long serialVersionUID = 7716304419260658472L;

    public MissingMandatoryParamException(String message) {
        super(message);
    }
}
