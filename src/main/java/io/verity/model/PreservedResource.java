package io.verity.model;

/**
 * An externally created resource (a sandbox site, a test server) owned by a
 * scenario run. Resources flagged {@code preserve} survive the run and are
 * reused on resume.
 */
public record PreservedResource(String name, String scenarioId, boolean preserve, String reason) {
}
