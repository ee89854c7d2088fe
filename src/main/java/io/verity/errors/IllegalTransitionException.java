package io.verity.errors;

public final class IllegalTransitionException extends VerityException {
    public IllegalTransitionException(String message) {
        super(ErrorKind.ILLEGAL_TRANSITION, message);
    }
}
