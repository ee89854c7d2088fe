package io.verity.stats;

import io.verity.errors.InconsistentRegistryException;
import io.verity.model.CombinedStatus;
import io.verity.model.Feature;
import io.verity.model.FeatureSummary;
import io.verity.model.Item;
import io.verity.model.Registry;
import io.verity.registry.RegistryValidator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class StatisticsAggregator {
    private StatisticsAggregator() {
    }

    public static Statistics recompute(Registry registry) {
        return recompute(registry, Set.of());
    }

    /**
     * Derives coverage from {@code registry}. Fails closed when any item
     * breaks the classification invariant; softer problems are listed in
     * {@link Statistics#inconsistencies()}.
     *
     * @param blockedItemIds items that currently have at least one blocking issue
     */
    public static Statistics recompute(Registry registry, Set<String> blockedItemIds) {
        List<String> violations = new ArrayList<>();
        registry.allItems().forEach(item -> violations.addAll(RegistryValidator.classificationViolations(item)));
        if (!violations.isEmpty()) {
            throw new InconsistentRegistryException(violations);
        }

        ClassStats automatable = ClassStats.empty();
        ClassStats environment = ClassStats.empty();
        ClassStats manual = ClassStats.empty();
        int invalidated = 0;
        int blocked = 0;
        List<String> inconsistencies = new ArrayList<>();
        Map<String, FeatureSummary> features = new LinkedHashMap<>();
        for (Feature feature : registry.features()) {
            FeatureSummary derived = feature.derivedSummary();
            features.put(feature.id(), derived);
            if (!derived.equals(feature.summary())) {
                inconsistencies.add("feature " + feature.id() + " has a stale cached summary");
            }
            for (Item item : feature.items()) {
                boolean machine = item.machine().verified();
                boolean human = item.human().verified();
                boolean full = item.combinedStatus() == CombinedStatus.FULLY_VERIFIED;
                switch (item.automatability()) {
                    case AUTOMATABLE -> automatable = automatable.plus(machine, human, full);
                    case ENVIRONMENT_DEPENDENT -> environment = environment.plus(machine, human, full);
                    case MANUAL_ONLY -> manual = manual.plus(machine, human, full);
                }
                if (item.invalidated()) {
                    invalidated++;
                    if (human) {
                        inconsistencies.add("item " + item.id() + " is human-verified but invalidated");
                    }
                }
                if (blockedItemIds.contains(item.id())) {
                    blocked++;
                }
            }
        }
        int total = automatable.total() + environment.total() + manual.total();
        return new Statistics(
                total,
                registry.features().size(),
                automatable,
                environment,
                manual,
                percent(automatable.machineVerified(), automatable.total()),
                percent(automatable.humanVerified() + environment.humanVerified() + manual.humanVerified(), total),
                percent(automatable.fullyVerified() + environment.fullyVerified() + manual.fullyVerified(), total),
                percent(environment.total(), total),
                percent(manual.total(), total),
                invalidated,
                blocked,
                percent(blocked, total),
                features,
                inconsistencies
        );
    }

    static double percent(int part, int whole) {
        if (whole <= 0) {
            return 0.0;
        }
        return Math.round(part * 1000.0 / whole) / 10.0;
    }
}
