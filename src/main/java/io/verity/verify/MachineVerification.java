package io.verity.verify;

import io.verity.exec.CheckResult;
import io.verity.model.Depth;
import io.verity.model.MachineCheckState;

import java.util.List;

public record MachineVerification(
        String itemId,
        Depth depth,
        MachineOutcome outcome,
        MachineCheckState state,
        List<CheckResult> results,
        String reason
) {
    public MachineVerification {
        results = results == null ? List.of() : List.copyOf(results);
    }
}
