package io.verity.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A single verifiable claim about one command's behavior.
 */
public record Item(
        String id,
        String featureId,
        String text,
        Automatability automatability,
        String automatabilityReason,
        DepthChecks checks,
        MachineCheckState machine,
        HumanState human,
        List<String> issues,
        boolean invalidated
) {
    public Item {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("item id cannot be empty");
        }
        automatability = automatability == null ? Automatability.AUTOMATABLE : automatability;
        checks = checks == null ? DepthChecks.none() : checks;
        machine = machine == null ? MachineCheckState.unverified() : machine;
        human = human == null ? HumanState.unverified() : human;
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public static Item automatable(String id, String featureId, String text, DepthChecks checks) {
        return new Item(id, featureId, text, Automatability.AUTOMATABLE, null, checks, null, null, List.of(), false);
    }

    public boolean automatableItem() {
        return automatability == Automatability.AUTOMATABLE;
    }

    public CombinedStatus combinedStatus() {
        if (invalidated) {
            return CombinedStatus.INVALIDATED;
        }
        if (human.verified() && (machine.verified() || !automatableItem())) {
            return CombinedStatus.FULLY_VERIFIED;
        }
        if (machine.verified()) {
            return CombinedStatus.MACHINE_ONLY;
        }
        return CombinedStatus.UNTESTED;
    }

    public Item withMachine(MachineCheckState value) {
        return new Item(id, featureId, text, automatability, automatabilityReason, checks, value, human, issues, invalidated);
    }

    public Item withHuman(HumanState value) {
        return new Item(id, featureId, text, automatability, automatabilityReason, checks, machine, value, issues, invalidated);
    }

    public Item withInvalidated(boolean value) {
        return new Item(id, featureId, text, automatability, automatabilityReason, checks, machine, human, issues, value);
    }

    public Item withAutomatability(Automatability value, String reason) {
        return new Item(id, featureId, text, value, reason, checks, machine, human, issues, invalidated);
    }

    public Item withIssueLinked(String issueId) {
        if (issues.contains(issueId)) {
            return this;
        }
        List<String> next = new ArrayList<>(issues);
        next.add(issueId);
        return new Item(id, featureId, text, automatability, automatabilityReason, checks, machine, human, next, invalidated);
    }
}
