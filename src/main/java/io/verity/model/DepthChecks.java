package io.verity.model;

import java.util.List;

/**
 * Per-depth check lists. Each list is authoritative for its depth; a stricter
 * depth does not inherit the checks of a lighter one.
 */
public record DepthChecks(
        List<CheckSpec> basic,
        List<CheckSpec> standard,
        List<CheckSpec> thorough,
        List<CheckSpec> paranoid
) {
    public DepthChecks {
        basic = basic == null ? List.of() : List.copyOf(basic);
        standard = standard == null ? List.of() : List.copyOf(standard);
        thorough = thorough == null ? List.of() : List.copyOf(thorough);
        paranoid = paranoid == null ? List.of() : List.copyOf(paranoid);
    }

    public static DepthChecks none() {
        return new DepthChecks(List.of(), List.of(), List.of(), List.of());
    }

    public static DepthChecks basicOnly(List<CheckSpec> checks) {
        return new DepthChecks(checks, List.of(), List.of(), List.of());
    }

    public List<CheckSpec> forDepth(Depth depth) {
        return switch (depth) {
            case BASIC -> basic;
            case STANDARD -> standard;
            case THOROUGH -> thorough;
            case PARANOID -> paranoid;
        };
    }

    public DepthChecks withDepth(Depth depth, List<CheckSpec> checks) {
        return switch (depth) {
            case BASIC -> new DepthChecks(checks, standard, thorough, paranoid);
            case STANDARD -> new DepthChecks(basic, checks, thorough, paranoid);
            case THOROUGH -> new DepthChecks(basic, standard, checks, paranoid);
            case PARANOID -> new DepthChecks(basic, standard, thorough, checks);
        };
    }

    public int total() {
        return basic.size() + standard.size() + thorough.size() + paranoid.size();
    }
}
