package io.verity.runtime;

import io.verity.model.Depth;

/**
 * Selection of a machine run. With neither {@code featureId}, {@code itemId}
 * nor {@code affected} every automatable item is swept.
 */
public record RunRequest(Depth depth, String featureId, String itemId, boolean affected) {
    public RunRequest {
        depth = depth == null ? Depth.STANDARD : depth;
        featureId = blankToNull(featureId);
        itemId = blankToNull(itemId);
        int selectors = (featureId == null ? 0 : 1) + (itemId == null ? 0 : 1) + (affected ? 1 : 0);
        if (selectors > 1) {
            throw new IllegalArgumentException("--feature, --item and --affected are mutually exclusive");
        }
    }

    public static RunRequest sweep(Depth depth) {
        return new RunRequest(depth, null, null, false);
    }

    public static RunRequest item(String itemId, Depth depth) {
        return new RunRequest(depth, null, itemId, false);
    }

    public static RunRequest feature(String featureId, Depth depth) {
        return new RunRequest(depth, featureId, null, false);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
