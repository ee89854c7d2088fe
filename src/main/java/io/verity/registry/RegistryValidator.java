package io.verity.registry;

import io.verity.config.VerityConfig;
import io.verity.errors.UnknownSchemaVersionException;
import io.verity.model.Feature;
import io.verity.model.Item;
import io.verity.model.Registry;
import io.verity.model.TriggerPattern;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Hard structural checks applied to every registry that is loaded or about to
 * be committed. Soft inconsistencies (stale summaries) are left to statistics.
 */
public final class RegistryValidator {
    private RegistryValidator() {
    }

    public static void requireSupportedSchema(int schemaVersion) {
        if (schemaVersion != VerityConfig.SUPPORTED_SCHEMA_VERSION) {
            throw new UnknownSchemaVersionException(schemaVersion, VerityConfig.SUPPORTED_SCHEMA_VERSION);
        }
    }

    public static List<String> violations(Registry registry) {
        List<String> out = new ArrayList<>();
        Set<String> featureIds = new HashSet<>();
        Set<String> itemIds = new HashSet<>();
        for (Feature feature : registry.features()) {
            if (!featureIds.add(feature.id())) {
                out.add("duplicate feature id: " + feature.id());
            }
            for (Item item : feature.items()) {
                if (!itemIds.add(item.id())) {
                    out.add("duplicate item id: " + item.id());
                }
                if (item.featureId() != null && !item.featureId().equals(feature.id())) {
                    out.add("item " + item.id() + " declares feature " + item.featureId()
                            + " but is stored under " + feature.id());
                }
                if (!item.automatableItem()
                        && (item.automatabilityReason() == null || item.automatabilityReason().isBlank())) {
                    out.add("item " + item.id() + " is " + item.automatability().wireName()
                            + " without an automatability reason");
                }
                out.addAll(classificationViolations(item));
            }
        }
        for (TriggerPattern trigger : registry.triggers()) {
            if (trigger.command() == null || trigger.command().isBlank()) {
                out.add("trigger pattern with empty command");
                continue;
            }
            for (String itemId : trigger.itemIds()) {
                if (!itemIds.contains(itemId)) {
                    out.add("trigger '" + trigger.command() + "' references unknown item: " + itemId);
                }
            }
        }
        return out;
    }

    public static List<String> classificationViolations(Item item) {
        if (!item.automatableItem() && item.machine().verified()) {
            return List.of("item " + item.id() + " is " + item.automatability().wireName()
                    + " but machine-verified");
        }
        return List.of();
    }
}
