package io.verity.issues;

import io.verity.errors.IllegalTransitionException;
import io.verity.model.DiagnosticsSnapshot;
import io.verity.model.Issue;
import io.verity.model.IssueStatus;
import io.verity.model.Item;
import io.verity.model.Registry;
import io.verity.observability.AuditLogger;
import io.verity.registry.RegistryStore;
import io.verity.security.SensitiveDataMasker;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Lifecycle of problem reports. Issues live in their own documents; the link
 * back to the item goes through the registry update path.
 */
public final class IssueTracker {
    private final IssueStore store;
    private final RegistryStore registryStore;
    private final DiagnosticsCollector diagnostics;
    private final AuditLogger auditLogger;

    public IssueTracker(IssueStore store, RegistryStore registryStore, DiagnosticsCollector diagnostics, AuditLogger auditLogger) {
        this.store = store;
        this.registryStore = registryStore;
        this.diagnostics = diagnostics;
        this.auditLogger = auditLogger;
    }

    public Issue create(String command, Integer exitCode, String itemId, String description, DiagnosticsSnapshot snapshot) {
        return create("cli", command, exitCode, itemId, description, snapshot);
    }

    public Issue create(
            String reporter,
            String command,
            Integer exitCode,
            String itemId,
            String description,
            DiagnosticsSnapshot snapshot
    ) {
        if (itemId == null || itemId.isBlank()) {
            throw new IllegalArgumentException("issue must reference an item");
        }
        Registry registry = registryStore.snapshot();
        if (registry.findItem(itemId).isEmpty()) {
            throw new IllegalArgumentException("Unknown item: " + itemId);
        }
        DiagnosticsSnapshot collected = snapshot != null ? snapshot : diagnostics.collect(registry, itemId);
        long now = System.currentTimeMillis();
        Issue issue = new Issue(
                "iss_" + UUID.randomUUID(),
                now,
                reporter == null || reporter.isBlank() ? "cli" : reporter.trim(),
                SensitiveDataMasker.maskedText(command),
                exitCode,
                itemId,
                description == null ? "" : description.trim(),
                collected,
                IssueStatus.OPEN,
                null,
                List.of()
        );
        store.save(issue);
        registryStore.atomicUpdate(r -> r.withItem(r.findItem(itemId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown item: " + itemId))
                .withIssueLinked(issue.id())));
        auditLogger.log(AuditLogger.AuditEvent.of(
                "issue.create",
                issue.reporter(),
                "issue/" + issue.id(),
                "open",
                Map.of("item", itemId, "exit_code", exitCode == null ? "" : String.valueOf(exitCode))
        ));
        return issue;
    }

    /**
     * Moves an issue along the status graph. Resolving statuses need a
     * remediation note. Never touches the item's verification state.
     */
    public Issue transition(String issueId, IssueStatus next, String note, String actor) {
        Issue current = show(issueId);
        if (!current.status().canTransitionTo(next)) {
            throw new IllegalTransitionException("Issue " + issueId + " cannot move from "
                    + current.status().wireName() + " to " + (next == null ? "null" : next.wireName())
                    + " (allowed: " + current.status().allowedNext() + ")");
        }
        if (next.requiresNote() && (note == null || note.isBlank())) {
            throw new IllegalTransitionException("Moving issue " + issueId + " to " + next.wireName()
                    + " requires a remediation note");
        }
        String who = actor == null || actor.isBlank() ? "cli" : actor.trim();
        Issue updated = current.transitioned(next, note == null ? null : note.trim(), who, System.currentTimeMillis());
        store.save(updated);
        auditLogger.log(AuditLogger.AuditEvent.of(
                "issue.transition",
                who,
                "issue/" + issueId,
                next.wireName(),
                Map.of("from", current.status().wireName(), "item", current.itemId())
        ));
        return updated;
    }

    public List<Issue> list(IssueStatus statusFilter) {
        List<Issue> out = new ArrayList<>();
        for (Issue issue : store.list()) {
            if (statusFilter == null || issue.status() == statusFilter) {
                out.add(issue);
            }
        }
        return out;
    }

    public Issue show(String issueId) {
        return store.find(issueId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown issue: " + issueId));
    }

    public List<String> blockingIssuesFor(String itemId) {
        Optional<Item> item = registryStore.snapshot().findItem(itemId);
        return item.isPresent() ? blockingIssuesFor(item.get()) : blockingDocuments(itemId);
    }

    /**
     * Blocking issue ids for {@code item}. An id linked on the item whose
     * document is missing or unreadable counts as blocking.
     */
    public List<String> blockingIssuesFor(Item item) {
        List<String> out = blockingDocuments(item.id());
        for (String linked : item.issues()) {
            if (!out.contains(linked) && !store.intact(linked)) {
                out.add(linked);
            }
        }
        return out;
    }

    /**
     * Ids of the items that have at least one blocking issue.
     */
    public Set<String> itemsWithBlockingIssues() {
        Set<String> out = new TreeSet<>();
        for (Issue issue : store.list()) {
            if (issue.blocking()) {
                out.add(issue.itemId());
            }
        }
        registryStore.snapshot().allItems()
                .filter(item -> item.issues().stream().anyMatch(id -> !store.intact(id)))
                .forEach(item -> out.add(item.id()));
        return out;
    }

    private List<String> blockingDocuments(String itemId) {
        List<String> out = new ArrayList<>();
        for (Issue issue : store.list()) {
            if (issue.blocking() && itemId.equals(issue.itemId())) {
                out.add(issue.id());
            }
        }
        return out;
    }
}
