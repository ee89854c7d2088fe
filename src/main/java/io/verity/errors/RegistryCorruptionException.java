package io.verity.errors;

/**
 * A registry write or read failed validation. {@link #restored()} tells
 * whether the last valid snapshot is still (or again) in place.
 */
public final class RegistryCorruptionException extends VerityException {
    private final boolean restored;

    public RegistryCorruptionException(String message, boolean restored) {
        super(restored ? ErrorKind.REGISTRY_CORRUPTION : ErrorKind.UNRECOVERABLE_REGISTRY, message);
        this.restored = restored;
    }

    public RegistryCorruptionException(String message, boolean restored, Throwable cause) {
        super(restored ? ErrorKind.REGISTRY_CORRUPTION : ErrorKind.UNRECOVERABLE_REGISTRY, message, cause);
        this.restored = restored;
    }

    public boolean restored() {
        return restored;
    }
}
