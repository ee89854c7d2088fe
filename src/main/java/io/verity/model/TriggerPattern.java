package io.verity.model;

import java.util.List;

/**
 * Maps a command signature to the items a successful run of it confirms.
 * {@code command} may span several tokens ({@code "pl backup"}); a command line
 * matches when it starts with those tokens and every {@code requiredArgs} entry
 * appears among the remaining ones.
 */
public record TriggerPattern(
        String command,
        List<String> requiredArgs,
        List<String> itemIds
) {
    public TriggerPattern {
        requiredArgs = requiredArgs == null ? List.of() : List.copyOf(requiredArgs);
        itemIds = itemIds == null ? List.of() : List.copyOf(itemIds);
    }

    public boolean matches(List<String> tokens) {
        if (tokens == null || tokens.isEmpty() || command == null || command.isBlank()) {
            return false;
        }
        List<String> signature = signatureTokens();
        if (tokens.size() < signature.size() || !tokens.subList(0, signature.size()).equals(signature)) {
            return false;
        }
        List<String> args = tokens.subList(signature.size(), tokens.size());
        return args.containsAll(requiredArgs);
    }

    public List<String> signatureTokens() {
        return List.of(command.trim().split("\\s+"));
    }
}
