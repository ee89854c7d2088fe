package io.verity.errors;

public final class UnknownSchemaVersionException extends VerityException {
    private final int found;

    public UnknownSchemaVersionException(int found, int supported) {
        super(ErrorKind.UNKNOWN_SCHEMA,
                "Registry schema version " + found + " is not supported (expected " + supported + ")");
        this.found = found;
    }

    public int found() {
        return found;
    }
}
