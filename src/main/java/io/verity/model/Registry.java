package io.verity.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Versioned registry document: features, their items and per-item state, plus
 * the auto-log trigger table. Immutable; mutations return a new instance.
 */
public record Registry(
        int schemaVersion,
        List<Feature> features,
        List<TriggerPattern> triggers
) {
    public Registry {
        features = features == null ? List.of() : List.copyOf(features);
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
    }

    public static Registry empty(int schemaVersion) {
        return new Registry(schemaVersion, List.of(), List.of());
    }

    public Stream<Item> allItems() {
        return features.stream().flatMap(feature -> feature.items().stream());
    }

    public int itemCount() {
        int count = 0;
        for (Feature feature : features) {
            count += feature.items().size();
        }
        return count;
    }

    public Optional<Item> findItem(String itemId) {
        if (itemId == null) {
            return Optional.empty();
        }
        return allItems().filter(item -> itemId.equals(item.id())).findFirst();
    }

    public Optional<Feature> findFeature(String featureId) {
        if (featureId == null) {
            return Optional.empty();
        }
        return features.stream().filter(feature -> featureId.equals(feature.id())).findFirst();
    }

    public Optional<Feature> featureOf(String itemId) {
        return features.stream()
                .filter(feature -> feature.items().stream().anyMatch(item -> item.id().equals(itemId)))
                .findFirst();
    }

    /**
     * Replaces the item with the same id inside its owning feature.
     */
    public Registry withItem(Item item) {
        Feature owner = featureOf(item.id())
                .orElseThrow(() -> new IllegalArgumentException("Unknown item: " + item.id()));
        return withFeature(owner.withItem(item));
    }

    public Registry withFeature(Feature feature) {
        List<Feature> next = new ArrayList<>(features.size() + 1);
        boolean replaced = false;
        for (Feature existing : features) {
            if (existing.id().equals(feature.id())) {
                next.add(feature);
                replaced = true;
            } else {
                next.add(existing);
            }
        }
        if (!replaced) {
            next.add(feature);
        }
        return new Registry(schemaVersion, next, triggers);
    }

    public Registry withTriggers(List<TriggerPattern> value) {
        return new Registry(schemaVersion, features, value);
    }

    public Registry withDerivedSummaries() {
        List<Feature> next = new ArrayList<>(features.size());
        for (Feature feature : features) {
            next.add(feature.withSummary(feature.derivedSummary()));
        }
        return new Registry(schemaVersion, next, triggers);
    }
}
