package io.verity.verify;

import io.verity.config.VerityConfig;
import io.verity.errors.ClassificationConflictException;
import io.verity.exec.CheckExecutor;
import io.verity.exec.Placeholders;
import io.verity.issues.DiagnosticsCollector;
import io.verity.issues.IssueStore;
import io.verity.issues.IssueTracker;
import io.verity.model.Automatability;
import io.verity.model.CheckSpec;
import io.verity.model.Depth;
import io.verity.model.DepthChecks;
import io.verity.model.Feature;
import io.verity.model.Item;
import io.verity.observability.AuditLogger;
import io.verity.registry.RegistryStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class MachineVerifierTest {

    @Test
    void passingChecksVerifyAndRepeatIdempotently() throws Exception {
        Path root = Files.createTempDirectory("verity-test-machine-pass-");
        try {
            Fixture fx = new Fixture(root);
            fx.seed(Item.automatable("install-1", "install", "Install creates the config",
                    DepthChecks.basicOnly(List.of(CheckSpec.of("echo one"), CheckSpec.of("echo two")))));

            MachineVerification first = fx.verifier.verifyItem("install-1", Depth.BASIC);
            MachineVerification second = fx.verifier.verifyItem("install-1", Depth.BASIC);

            Assertions.assertEquals(MachineOutcome.VERIFIED, first.outcome());
            Assertions.assertEquals(first.outcome(), second.outcome());
            Assertions.assertEquals(first.state().verified(), second.state().verified());
            Assertions.assertEquals(first.state().depth(), second.state().depth());
            Assertions.assertEquals(first.state().lastOutput(), second.state().lastOutput());
            Assertions.assertEquals(2, second.results().size());
            Item stored = fx.store.load().findItem("install-1").orElseThrow();
            Assertions.assertTrue(stored.machine().verified());
            Assertions.assertEquals(Depth.BASIC, stored.machine().depth());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failingCheckDoesNotShortCircuit() throws Exception {
        Path root = Files.createTempDirectory("verity-test-machine-fail-");
        try {
            Fixture fx = new Fixture(root);
            fx.seed(Item.automatable("install-1", "install", "Install creates the config",
                    DepthChecks.basicOnly(List.of(CheckSpec.of("echo first; exit 1"), CheckSpec.of("echo second")))));

            MachineVerification result = fx.verifier.verifyItem("install-1", Depth.BASIC);
            Assertions.assertEquals(MachineOutcome.FAILED, result.outcome());
            Assertions.assertEquals(2, result.results().size());
            Assertions.assertTrue(result.results().get(1).passed());
            Item stored = fx.store.load().findItem("install-1").orElseThrow();
            Assertions.assertFalse(stored.machine().verified());
            Assertions.assertEquals(Depth.BASIC, stored.machine().exercisedDepth());
            Assertions.assertEquals("first", stored.machine().lastOutput());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void depthWithoutChecksIsSkippedWithoutStateChange() throws Exception {
        Path root = Files.createTempDirectory("verity-test-machine-gap-");
        try {
            Fixture fx = new Fixture(root);
            fx.seed(Item.automatable("install-1", "install", "Install creates the config",
                    DepthChecks.basicOnly(List.of(CheckSpec.of("true")))));

            MachineVerification result = fx.verifier.verifyItem("install-1", Depth.THOROUGH);
            Assertions.assertEquals(MachineOutcome.SKIPPED, result.outcome());
            Assertions.assertTrue(result.results().isEmpty());
            Assertions.assertNull(fx.store.load().findItem("install-1").orElseThrow().machine().exercisedDepth());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void passingChecksOnEnvironmentDependentItemAreAConflict() throws Exception {
        Path root = Files.createTempDirectory("verity-test-machine-conflict-");
        try {
            Fixture fx = new Fixture(root);
            fx.seed(new Item("dns-1", "install", "DNS record is created", Automatability.ENVIRONMENT_DEPENDENT,
                    "needs a live DNS provider", DepthChecks.basicOnly(List.of(CheckSpec.of("true"))),
                    null, null, List.of(), false));

            Assertions.assertThrows(ClassificationConflictException.class,
                    () -> fx.verifier.verifyItem("dns-1", Depth.BASIC));
            Assertions.assertFalse(fx.store.load().findItem("dns-1").orElseThrow().machine().verified());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void issueLinkedWhileChecksRunBlocksTheResult() throws Exception {
        Path root = Files.createTempDirectory("verity-test-machine-late-link-");
        try {
            Fixture fx = new Fixture(root);
            fx.seed(Item.automatable("install-1", "install", "Install creates the config",
                    DepthChecks.basicOnly(List.of(CheckSpec.of("true")))));
            new RegistryStore(fx.config, 0).atomicUpdate(
                    r -> r.withItem(r.findItem("install-1").orElseThrow().withIssueLinked("iss_elsewhere")));

            MachineVerification result = fx.verifier.verifyItem("install-1", Depth.BASIC);
            Assertions.assertEquals(MachineOutcome.BLOCKED, result.outcome());
            Assertions.assertTrue(result.reason().contains("iss_elsewhere"));
            Assertions.assertFalse(fx.store.load().findItem("install-1").orElseThrow().machine().verified());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void blockingIssueKeepsItemUnverified() throws Exception {
        Path root = Files.createTempDirectory("verity-test-machine-blocked-");
        try {
            Fixture fx = new Fixture(root);
            fx.seed(Item.automatable("install-1", "install", "Install creates the config",
                    DepthChecks.basicOnly(List.of(CheckSpec.of("true")))));
            fx.tracker.create("pl install", 1, "install-1", "config missing", null);

            MachineVerification result = fx.verifier.verifyItem("install-1", Depth.BASIC);
            Assertions.assertEquals(MachineOutcome.BLOCKED, result.outcome());
            Assertions.assertFalse(fx.store.load().findItem("install-1").orElseThrow().machine().verified());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void successfulRunClearsInvalidation() throws Exception {
        Path root = Files.createTempDirectory("verity-test-machine-invalidated-");
        try {
            Fixture fx = new Fixture(root);
            fx.seed(Item.automatable("install-1", "install", "Install creates the config",
                    DepthChecks.basicOnly(List.of(CheckSpec.of("true")))).withInvalidated(true));

            fx.verifier.verifyItem("install-1", Depth.BASIC);
            Assertions.assertFalse(fx.store.load().findItem("install-1").orElseThrow().invalidated());
        } finally {
            deleteRecursively(root);
        }
    }

    private static final class Fixture {
        final VerityConfig config;
        final RegistryStore store;
        final IssueTracker tracker;
        final MachineVerifier verifier;

        Fixture(Path root) {
            this.config = new VerityConfig(root.resolve(".verification"), root);
            AuditLogger audit = new AuditLogger(config.auditFile(), "");
            this.store = new RegistryStore(config, 0);
            this.tracker = new IssueTracker(new IssueStore(config.issuesDir()), store,
                    new DiagnosticsCollector(root), audit);
            CheckExecutor executor = new CheckExecutor(List.of("/bin/sh", "-c"), 30, 50, 8192, root);
            this.verifier = new MachineVerifier(store, executor, tracker, audit, Placeholders.none());
        }

        void seed(Item item) {
            store.atomicUpdate(r -> r.withFeature(new Feature(item.featureId(), item.featureId(), null,
                    List.of(), null, List.of(item))));
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
