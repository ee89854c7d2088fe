package io.verity.model;

import java.util.ArrayList;
import java.util.List;

public record Feature(
        String id,
        String name,
        String description,
        List<SourceRef> sources,
        FeatureSummary summary,
        List<Item> items
) {
    public Feature {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("feature id cannot be empty");
        }
        sources = sources == null ? List.of() : List.copyOf(sources);
        summary = summary == null ? FeatureSummary.empty() : summary;
        items = items == null ? List.of() : List.copyOf(items);
    }

    public FeatureSummary derivedSummary() {
        int machine = 0;
        int human = 0;
        int full = 0;
        for (Item item : items) {
            if (item.machine().verified()) machine++;
            if (item.human().verified()) human++;
            if (item.combinedStatus() == CombinedStatus.FULLY_VERIFIED) full++;
        }
        return new FeatureSummary(items.size(), machine, human, full);
    }

    public Feature withItem(Item item) {
        List<Item> next = new ArrayList<>(items.size());
        boolean replaced = false;
        for (Item existing : items) {
            if (existing.id().equals(item.id())) {
                next.add(item);
                replaced = true;
            } else {
                next.add(existing);
            }
        }
        if (!replaced) {
            next.add(item);
        }
        return new Feature(id, name, description, sources, summary, next);
    }

    public Feature withItems(List<Item> value) {
        return new Feature(id, name, description, sources, summary, value);
    }

    public Feature withSources(List<SourceRef> value) {
        return new Feature(id, name, description, value, summary, items);
    }

    public Feature withSummary(FeatureSummary value) {
        return new Feature(id, name, description, sources, value, items);
    }
}
