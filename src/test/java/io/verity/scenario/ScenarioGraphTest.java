package io.verity.scenario;

import io.verity.errors.ConfigurationException;
import io.verity.model.Scenario;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class ScenarioGraphTest {

    @Test
    void wavesFollowDependenciesInCatalogOrder() {
        ScenarioGraph graph = ScenarioGraph.of(List.of(
                scenario("report", "deploy", "backup"),
                scenario("install"),
                scenario("deploy", "install"),
                scenario("backup", "install"),
                scenario("lint")
        ));

        List<List<String>> waves = graph.waves().stream()
                .map(wave -> wave.stream().map(Scenario::id).toList())
                .toList();
        Assertions.assertEquals(List.of(
                List.of("install", "lint"),
                List.of("deploy", "backup"),
                List.of("report")
        ), waves);
        Assertions.assertEquals(List.of("deploy", "report"),
                graph.fromScenario("deploy").stream().map(Scenario::id).toList());
    }

    @Test
    void invalidCatalogsAreRejected() {
        Assertions.assertThrows(ConfigurationException.class,
                () -> ScenarioGraph.of(List.of(scenario("a"), scenario("a"))));
        ConfigurationException unknown = Assertions.assertThrows(ConfigurationException.class,
                () -> ScenarioGraph.of(List.of(scenario("a", "ghost"))));
        Assertions.assertTrue(unknown.getMessage().contains("ghost"));
        Assertions.assertThrows(ConfigurationException.class,
                () -> ScenarioGraph.of(List.of(scenario("a", "c"), scenario("b", "a"), scenario("c", "b"))));
        Assertions.assertThrows(ConfigurationException.class,
                () -> ScenarioGraph.of(List.of(scenario("a"))).get("b"));
    }

    private static Scenario scenario(String id, String... dependsOn) {
        return new Scenario(id, id, null, List.of(dependsOn), 1, false, List.of(), List.of(), List.of());
    }
}
