package io.verity.errors;

import java.util.List;

public final class InconsistentRegistryException extends VerityException {
    private final List<String> violations;

    public InconsistentRegistryException(List<String> violations) {
        super(ErrorKind.INCONSISTENT_REGISTRY,
                "Registry is inconsistent, refusing to compute statistics: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }
}
