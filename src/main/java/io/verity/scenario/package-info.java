/**
 * Integration scenarios: catalog and dependency graph, resumable checkpoints,
 * baselines, fix patterns and confidence scoring.
 */
package io.verity.scenario;
