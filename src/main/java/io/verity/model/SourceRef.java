package io.verity.model;

/**
 * A source file, or an inclusive 1-based line range of it, whose change
 * invalidates the items of the owning feature.
 */
public record SourceRef(
        String path,
        Integer startLine,
        Integer endLine,
        String fingerprint
) {
    public SourceRef {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("source path cannot be empty");
        }
    }

    public boolean ranged() {
        return startLine != null || endLine != null;
    }

    public SourceRef withFingerprint(String value) {
        return new SourceRef(path, startLine, endLine, value);
    }
}
