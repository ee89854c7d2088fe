package io.verity.verify;

import io.verity.errors.ClassificationConflictException;
import io.verity.exec.CheckExecutor;
import io.verity.exec.CheckResult;
import io.verity.exec.Placeholders;
import io.verity.issues.IssueTracker;
import io.verity.model.CheckSpec;
import io.verity.model.Depth;
import io.verity.model.Item;
import io.verity.model.MachineCheckState;
import io.verity.model.Registry;
import io.verity.observability.AuditLogger;
import io.verity.registry.RegistryStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the checks of one item at one depth and records the machine state.
 */
public final class MachineVerifier {
    private final RegistryStore registryStore;
    private final CheckExecutor executor;
    private final IssueTracker issueTracker;
    private final AuditLogger auditLogger;
    private final Placeholders placeholders;

    public MachineVerifier(
            RegistryStore registryStore,
            CheckExecutor executor,
            IssueTracker issueTracker,
            AuditLogger auditLogger,
            Placeholders placeholders
    ) {
        this.registryStore = registryStore;
        this.executor = executor;
        this.issueTracker = issueTracker;
        this.auditLogger = auditLogger;
        this.placeholders = placeholders == null ? Placeholders.none() : placeholders;
    }

    /**
     * Every check of the depth runs, in declared order, even after a failure.
     *
     * @throws ClassificationConflictException when all checks pass on an item
     *                                         that is not classified automatable
     */
    public MachineVerification verifyItem(String itemId, Depth depth) {
        Item item = registryStore.snapshot().findItem(itemId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown item: " + itemId));
        List<CheckSpec> checks = item.checks().forDepth(depth);
        if (checks.isEmpty()) {
            return new MachineVerification(itemId, depth, MachineOutcome.SKIPPED, item.machine(), List.of(),
                    "no checks defined at depth " + depth.wireName());
        }

        List<CheckResult> results = new ArrayList<>(checks.size());
        long durationMs = 0L;
        boolean allPassed = true;
        String lastOutput = null;
        for (CheckSpec check : checks) {
            CheckResult result = executor.run(check, placeholders);
            results.add(result);
            durationMs += result.durationMs();
            if (!result.passed()) {
                if (allPassed) {
                    lastOutput = result.outputTail();
                }
                allPassed = false;
            } else if (allPassed) {
                lastOutput = result.outputTail();
            }
        }

        if (allPassed && !item.automatableItem()) {
            audit(itemId, depth, "conflict", results.size());
            throw new ClassificationConflictException(itemId, item.automatability().wireName());
        }

        if (!allPassed) {
            MachineCheckState failed = MachineCheckState.failed(depth, durationMs, lastOutput);
            registryStore.atomicUpdate(r -> r.withItem(requireItem(r, itemId).withMachine(failed)));
            audit(itemId, depth, "failed", results.size());
            return new MachineVerification(itemId, depth, MachineOutcome.FAILED, failed, results,
                    failedCount(results) + " of " + results.size() + " checks failed");
        }

        // Blocking issues are read under the registry lock.
        MachineCheckState passed = MachineCheckState.passed(depth, System.currentTimeMillis(), durationMs, lastOutput);
        MachineCheckState held = MachineCheckState.failed(depth, durationMs, lastOutput);
        AtomicReference<List<String>> blocking = new AtomicReference<>(List.of());
        registryStore.atomicUpdate(r -> {
            Item fresh = requireItem(r, itemId);
            List<String> open = issueTracker.blockingIssuesFor(fresh);
            blocking.set(open);
            return r.withItem(open.isEmpty() ? fresh.withMachine(passed).withInvalidated(false) : fresh.withMachine(held));
        });
        MachineOutcome outcome = blocking.get().isEmpty() ? MachineOutcome.VERIFIED : MachineOutcome.BLOCKED;
        MachineCheckState state = outcome == MachineOutcome.VERIFIED ? passed : held;
        String reason = outcome == MachineOutcome.VERIFIED ? null : "blocked by issues: " + String.join(", ", blocking.get());
        audit(itemId, depth, outcome.name().toLowerCase(Locale.ROOT), results.size());
        return new MachineVerification(itemId, depth, outcome, state, results, reason);
    }

    private void audit(String itemId, Depth depth, String result, int checks) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("depth", depth.wireName());
        details.put("checks", checks);
        auditLogger.log(AuditLogger.AuditEvent.of("machine.verify", "engine", "item/" + itemId, result, details));
    }

    private static Item requireItem(Registry registry, String itemId) {
        return registry.findItem(itemId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown item: " + itemId));
    }

    private static int failedCount(List<CheckResult> results) {
        int failed = 0;
        for (CheckResult result : results) {
            if (!result.passed()) {
                failed++;
            }
        }
        return failed;
    }
}
