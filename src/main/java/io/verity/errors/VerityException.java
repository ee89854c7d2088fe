package io.verity.errors;

public class VerityException extends RuntimeException {
    private final ErrorKind kind;

    public VerityException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public VerityException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
