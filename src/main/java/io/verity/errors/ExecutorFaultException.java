package io.verity.errors;

public final class ExecutorFaultException extends VerityException {
    public ExecutorFaultException(String message, Throwable cause) {
        super(ErrorKind.EXECUTOR_FAULT, message, cause);
    }
}
