package io.verity.registry;

import io.verity.model.Feature;
import io.verity.model.HumanState;
import io.verity.model.Item;
import io.verity.model.MachineCheckState;
import io.verity.model.Registry;
import io.verity.model.SourceRef;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Detects features whose referenced sources changed since their fingerprints
 * were recorded, and invalidates the verification state of their items.
 */
public final class InvalidationScanner {
    private final Path projectDir;

    public InvalidationScanner(Path projectDir) {
        this.projectDir = projectDir;
    }

    public List<SourceChange> scan(Registry registry) {
        List<SourceChange> out = new ArrayList<>();
        for (Feature feature : registry.features()) {
            for (SourceRef source : feature.sources()) {
                String current = SourceFingerprints.fingerprint(projectDir, source);
                String previous = source.fingerprint();
                if (previous != null && !previous.isBlank() && !previous.equals(current)) {
                    out.add(new SourceChange(feature.id(), source.path(), previous, current));
                }
            }
        }
        return out;
    }

    public Set<String> changedFeatures(Registry registry) {
        Set<String> out = new LinkedHashSet<>();
        for (SourceChange change : scan(registry)) {
            out.add(change.featureId());
        }
        return out;
    }

    /**
     * Resets machine and human state of every verified item in a changed
     * feature and marks it invalidated. Fingerprints of every feature are
     * refreshed, so sources seen for the first time get a baseline.
     */
    public Registry invalidate(Registry registry, Set<String> changedFeatureIds) {
        Registry next = registry;
        for (Feature feature : registry.features()) {
            List<SourceRef> refreshed = new ArrayList<>(feature.sources().size());
            for (SourceRef source : feature.sources()) {
                refreshed.add(source.withFingerprint(SourceFingerprints.fingerprint(projectDir, source)));
            }
            Feature updated = feature.withSources(refreshed);
            if (changedFeatureIds.contains(feature.id())) {
                List<Item> items = new ArrayList<>(feature.items().size());
                for (Item item : feature.items()) {
                    if (item.machine().verified() || item.human().verified()) {
                        items.add(item.withMachine(MachineCheckState.unverified())
                                .withHuman(HumanState.unverified())
                                .withInvalidated(true));
                    } else {
                        items.add(item);
                    }
                }
                updated = updated.withItems(items);
            }
            next = next.withFeature(updated);
        }
        return next;
    }

    public record SourceChange(String featureId, String path, String previousFingerprint, String currentFingerprint) {
    }
}
