package io.verity.model;

public record HumanState(
        boolean verified,
        long verifiedAtMs,
        String identity,
        HumanChannel channel
) {
    public static HumanState unverified() {
        return new HumanState(false, 0L, null, null);
    }

    public static HumanState confirmed(String identity, HumanChannel channel, long atMs) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("verifying identity cannot be empty");
        }
        return new HumanState(true, atMs, identity.trim(), channel);
    }
}
