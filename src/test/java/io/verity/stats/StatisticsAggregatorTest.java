package io.verity.stats;

import io.verity.errors.InconsistentRegistryException;
import io.verity.model.Automatability;
import io.verity.model.CheckSpec;
import io.verity.model.Depth;
import io.verity.model.DepthChecks;
import io.verity.model.Feature;
import io.verity.model.HumanChannel;
import io.verity.model.HumanState;
import io.verity.model.Item;
import io.verity.model.MachineCheckState;
import io.verity.model.Registry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

final class StatisticsAggregatorTest {

    @Test
    void machineCoverageCountsAutomatableItemsOnly() {
        Item verified = automatable("a-1").withMachine(MachineCheckState.passed(Depth.BASIC, 1L, 5L, "ok"));
        Item full = automatable("a-2")
                .withMachine(MachineCheckState.passed(Depth.BASIC, 1L, 5L, "ok"))
                .withHuman(HumanState.confirmed("alice", HumanChannel.MANUAL, 2L));
        Item untested = automatable("a-3");
        Item dns = classified("env-1", Automatability.ENVIRONMENT_DEPENDENT);
        Item approve = classified("man-1", Automatability.MANUAL_ONLY)
                .withHuman(HumanState.confirmed("bob", HumanChannel.MANUAL, 3L));
        Registry registry = registryOf(verified, full, untested, dns, approve).withDerivedSummaries();

        Statistics stats = StatisticsAggregator.recompute(registry, Set.of("a-3"));
        Assertions.assertEquals(5, stats.totalItems());
        Assertions.assertEquals(3, stats.machineDenominator());
        Assertions.assertEquals(66.7, stats.machineCoverage());
        Assertions.assertEquals(40.0, stats.humanCoverage());
        Assertions.assertEquals(40.0, stats.fullCoverage());
        Assertions.assertEquals(20.0, stats.environmentDependentRatio());
        Assertions.assertEquals(20.0, stats.manualOnlyRatio());
        Assertions.assertEquals(1, stats.itemsWithBlockingIssues());
        Assertions.assertTrue(stats.inconsistencies().isEmpty());
    }

    @Test
    void recomputeIsPureAndRepeatable() {
        Registry registry = registryOf(automatable("a-1"), classified("env-1", Automatability.ENVIRONMENT_DEPENDENT));
        Assertions.assertEquals(StatisticsAggregator.recompute(registry), StatisticsAggregator.recompute(registry));
    }

    @Test
    void machineVerifiedNonAutomatableItemFailsClosed() {
        Item illegal = classified("env-1", Automatability.ENVIRONMENT_DEPENDENT)
                .withMachine(MachineCheckState.passed(Depth.BASIC, 1L, 5L, "ok"));
        Registry registry = registryOf(automatable("a-1"), illegal, automatable("a-2"));

        InconsistentRegistryException error = Assertions.assertThrows(InconsistentRegistryException.class,
                () -> StatisticsAggregator.recompute(registry));
        Assertions.assertEquals(1, error.violations().size());
        Assertions.assertTrue(error.violations().get(0).contains("env-1"));
    }

    @Test
    void softProblemsAreReportedAsInconsistencies() {
        Item stale = automatable("a-1").withMachine(MachineCheckState.passed(Depth.BASIC, 1L, 5L, "ok"));
        Item reverify = automatable("a-2")
                .withHuman(HumanState.confirmed("alice", HumanChannel.MANUAL, 2L))
                .withInvalidated(true);
        Registry registry = registryOf(stale, reverify);

        Statistics stats = StatisticsAggregator.recompute(registry);
        Assertions.assertEquals(1, stats.invalidatedItems());
        Assertions.assertEquals(2, stats.inconsistencies().size());
        Assertions.assertTrue(stats.inconsistencies().get(0).contains("stale cached summary"));
        Assertions.assertTrue(stats.inconsistencies().get(1).contains("a-2"));
    }

    @Test
    void emptyRegistryHasZeroCoverage() {
        Statistics stats = StatisticsAggregator.recompute(Registry.empty(1));
        Assertions.assertEquals(0, stats.totalItems());
        Assertions.assertEquals(0.0, stats.machineCoverage());
        Assertions.assertEquals(0.0, stats.fullCoverage());
    }

    private static Item automatable(String id) {
        return Item.automatable(id, "core", id, DepthChecks.basicOnly(List.of(CheckSpec.of("true"))));
    }

    private static Item classified(String id, Automatability automatability) {
        return new Item(id, "core", id, automatability, "needs a person", DepthChecks.none(), null, null, List.of(), false);
    }

    private static Registry registryOf(Item... items) {
        return Registry.empty(1).withFeature(new Feature("core", "Core", null, List.of(), null, List.of(items)));
    }
}
