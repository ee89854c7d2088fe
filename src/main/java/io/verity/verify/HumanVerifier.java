package io.verity.verify;

import io.verity.errors.BlockedByIssuesException;
import io.verity.issues.IssueTracker;
import io.verity.model.HumanChannel;
import io.verity.model.HumanState;
import io.verity.model.Issue;
import io.verity.model.Item;
import io.verity.model.Registry;
import io.verity.model.TriggerPattern;
import io.verity.observability.AuditLogger;
import io.verity.registry.RegistryStore;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records human confirmations through the manual, auto-logged and
 * opportunistic channels. Every verified write is refused while the item has
 * a blocking issue.
 */
public final class HumanVerifier {
    private final RegistryStore registryStore;
    private final IssueTracker issueTracker;
    private final ConsentStore consentStore;
    private final PromptPreferences promptPreferences;
    private final AuditLogger auditLogger;
    private final PromptMode promptMode;
    private final List<String> testers;
    private final Set<String> sessionSkips = ConcurrentHashMap.newKeySet();

    public HumanVerifier(
            RegistryStore registryStore,
            IssueTracker issueTracker,
            ConsentStore consentStore,
            PromptPreferences promptPreferences,
            AuditLogger auditLogger,
            PromptMode promptMode,
            List<String> testers
    ) {
        this.registryStore = registryStore;
        this.issueTracker = issueTracker;
        this.consentStore = consentStore;
        this.promptPreferences = promptPreferences;
        this.auditLogger = auditLogger;
        this.promptMode = promptMode == null ? PromptMode.UNVERIFIED : promptMode;
        this.testers = testers == null ? List.of() : List.copyOf(testers);
    }

    public HumanState logManual(String itemId, String identity) {
        return confirm(itemId, identity, HumanChannel.MANUAL);
    }

    /**
     * Marks the items a successful command confirms. Nothing is written unless
     * {@code identity} has granted consent; blocked items are reported in the
     * outcome instead of failing the whole call.
     */
    public AutoLogOutcome autoLog(List<String> commandLine, String identity) {
        Registry registry = registryStore.snapshot();
        Set<String> matched = new LinkedHashSet<>();
        for (TriggerPattern trigger : registry.triggers()) {
            if (trigger.matches(commandLine)) {
                matched.addAll(trigger.itemIds());
            }
        }
        boolean consented = consentStore.hasConsented(identity);
        if (matched.isEmpty() || !consented) {
            return new AutoLogOutcome(new ArrayList<>(matched), List.of(), List.of(), consented);
        }
        List<String> logged = new ArrayList<>();
        List<String> blocked = new ArrayList<>();
        HumanState state = HumanState.confirmed(identity, HumanChannel.AUTO_LOGGED, System.currentTimeMillis());
        // Decided under the registry lock so an issue linked meanwhile is honored.
        registryStore.atomicUpdate(r -> {
            logged.clear();
            blocked.clear();
            Registry next = r;
            for (String itemId : matched) {
                Optional<Item> item = next.findItem(itemId);
                if (item.isEmpty()) {
                    continue;
                }
                if (issueTracker.blockingIssuesFor(item.get()).isEmpty()) {
                    next = next.withItem(item.get().withHuman(state).withInvalidated(false));
                    logged.add(itemId);
                } else {
                    blocked.add(itemId);
                }
            }
            return next;
        });
        auditLogger.log(AuditLogger.AuditEvent.of(
                "human.autolog",
                identity,
                "command/" + String.join(" ", commandLine),
                blocked.isEmpty() ? "logged" : "partially_blocked",
                Map.of("logged", logged, "blocked", blocked)
        ));
        return new AutoLogOutcome(new ArrayList<>(matched), logged, blocked, true);
    }

    /**
     * Asks {@code identity} whether the item behaved as described.
     * {@code y} or an empty answer confirms, {@code n} opens an issue with a
     * diagnostics snapshot, {@code s} skips for this session and {@code d}
     * skips permanently.
     */
    public OpportunisticResult promptOpportunistic(String itemId, String identity, int timeoutSec, PromptChannel channel) {
        Item item = registryStore.snapshot().findItem(itemId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown item: " + itemId));
        Optional<String> notPrompted = notPromptedReason(item, identity);
        if (notPrompted.isPresent()) {
            return OpportunisticResult.of(itemId, OpportunisticOutcome.NOT_PROMPTED, notPrompted.get());
        }

        String question = "Did this work as expected? " + item.text() + " [Y/n/s/d]:";
        Optional<String> answer = channel.ask(question, timeoutSec);
        if (answer.isEmpty()) {
            return OpportunisticResult.of(itemId, OpportunisticOutcome.TIMED_OUT, "no answer within " + timeoutSec + "s");
        }
        String choice = answer.get().trim().toLowerCase(Locale.ROOT);
        switch (choice) {
            case "", "y", "yes" -> {
                confirm(itemId, identity, HumanChannel.OPPORTUNISTIC);
                return OpportunisticResult.of(itemId, OpportunisticOutcome.VERIFIED, null);
            }
            case "n", "no" -> {
                String description = channel.ask("What went wrong?", timeoutSec).orElse("");
                Issue issue = issueTracker.create(
                        identity,
                        item.text(),
                        null,
                        itemId,
                        description.isBlank() ? "Reported as not working during an opportunistic prompt" : description,
                        null
                );
                return new OpportunisticResult(itemId, OpportunisticOutcome.ISSUE_CREATED, issue.id(), null);
            }
            case "s", "skip" -> {
                sessionSkips.add(itemId);
                return OpportunisticResult.of(itemId, OpportunisticOutcome.SESSION_SKIPPED, null);
            }
            case "d", "dont", "don't" -> {
                promptPreferences.skipPermanently(itemId, identity);
                return OpportunisticResult.of(itemId, OpportunisticOutcome.PERMANENTLY_SKIPPED, null);
            }
            default -> {
                sessionSkips.add(itemId);
                return OpportunisticResult.of(itemId, OpportunisticOutcome.SESSION_SKIPPED,
                        "unrecognized answer: " + answer.get());
            }
        }
    }

    private Optional<String> notPromptedReason(Item item, String identity) {
        if (promptMode == PromptMode.NEVER) {
            return Optional.of("prompt mode is never");
        }
        if (identity == null || identity.isBlank()) {
            return Optional.of("no identity");
        }
        if (!testers.isEmpty() && !testers.contains(identity.trim())) {
            return Optional.of(identity + " is not a designated tester");
        }
        if (promptMode == PromptMode.UNVERIFIED && item.human().verified()) {
            return Optional.of("already human-verified");
        }
        if (sessionSkips.contains(item.id())) {
            return Optional.of("skipped for this session");
        }
        if (promptPreferences.permanentlySkipped(item.id())) {
            return Optional.of("permanently skipped");
        }
        List<String> blocking = issueTracker.blockingIssuesFor(item);
        if (!blocking.isEmpty()) {
            return Optional.of("blocked by issues: " + String.join(", ", blocking));
        }
        return Optional.empty();
    }

    private HumanState confirm(String itemId, String identity, HumanChannel channel) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("verifying identity cannot be empty");
        }
        if (registryStore.snapshot().findItem(itemId).isEmpty()) {
            throw new IllegalArgumentException("Unknown item: " + itemId);
        }
        List<String> blocking = issueTracker.blockingIssuesFor(itemId);
        if (!blocking.isEmpty()) {
            throw blocked(itemId, identity, blocking);
        }
        HumanState state = HumanState.confirmed(identity, channel, System.currentTimeMillis());
        registryStore.atomicUpdate(r -> {
            Item fresh = r.findItem(itemId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown item: " + itemId));
            // Re-checked under the registry lock: an issue may have been linked meanwhile.
            List<String> late = issueTracker.blockingIssuesFor(fresh);
            if (!late.isEmpty()) {
                throw blocked(itemId, identity, late);
            }
            return r.withItem(fresh.withHuman(state).withInvalidated(false));
        });
        auditLogger.log(AuditLogger.AuditEvent.of(
                "human.verify", identity, "item/" + itemId, "verified", Map.of("channel", channel.wireName())));
        return state;
    }

    private BlockedByIssuesException blocked(String itemId, String identity, List<String> blocking) {
        auditLogger.log(AuditLogger.AuditEvent.of(
                "human.verify", identity, "item/" + itemId, "blocked", Map.of("issues", blocking)));
        return new BlockedByIssuesException(itemId, blocking);
    }
}
