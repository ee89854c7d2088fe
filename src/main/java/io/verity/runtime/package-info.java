/**
 * Verification runtime package.
 *
 * <p>{@link io.verity.runtime.VerificationEngine} owns cross-cutting behavior:
 * run selection, per-feature fan-out, invalidation scans, scenario runs, badge
 * export, run reports and the history ledger used by the CLI.
 */
package io.verity.runtime;
