package io.verity.model;

public record ArtifactCheck(String path, boolean exists, long sizeBytes) {
}
