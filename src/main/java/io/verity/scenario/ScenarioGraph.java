package io.verity.scenario;

import io.verity.errors.ConfigurationException;
import io.verity.model.Scenario;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dependency DAG over a scenario catalog. Orders are stable: among scenarios
 * that are ready at the same time, catalog order wins.
 */
public final class ScenarioGraph {
    private final Map<String, Scenario> byId;

    private ScenarioGraph(Map<String, Scenario> byId) {
        this.byId = byId;
    }

    public static ScenarioGraph of(List<Scenario> scenarios) {
        Map<String, Scenario> byId = new LinkedHashMap<>();
        for (Scenario scenario : scenarios) {
            if (byId.put(scenario.id(), scenario) != null) {
                throw new ConfigurationException("Duplicate scenario id: " + scenario.id());
            }
        }
        for (Scenario scenario : scenarios) {
            for (String dep : scenario.dependsOn()) {
                if (!byId.containsKey(dep)) {
                    throw new ConfigurationException("Scenario " + scenario.id() + " depends on unknown scenario: " + dep);
                }
            }
        }
        Set<String> visiting = new HashSet<>();
        Set<String> visited = new HashSet<>();
        for (String id : byId.keySet()) {
            dfsCycleCheck(id, byId, visiting, visited);
        }
        return new ScenarioGraph(byId);
    }

    public Scenario get(String id) {
        Scenario scenario = byId.get(id);
        if (scenario == null) {
            throw new ConfigurationException("Unknown scenario: " + id);
        }
        return scenario;
    }

    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    public List<Scenario> scenarios() {
        return List.copyOf(byId.values());
    }

    /**
     * Dependency waves: every scenario of wave N depends only on scenarios of
     * earlier waves.
     */
    public List<List<Scenario>> waves() {
        Map<String, Integer> level = new HashMap<>();
        List<List<Scenario>> out = new ArrayList<>();
        for (Scenario scenario : byId.values()) {
            int depth = levelOf(scenario.id(), level);
            while (out.size() <= depth) {
                out.add(new ArrayList<>());
            }
            out.get(depth).add(scenario);
        }
        return out;
    }

    public List<Scenario> topologicalOrder() {
        List<Scenario> out = new ArrayList<>();
        for (List<Scenario> wave : waves()) {
            out.addAll(wave);
        }
        return out;
    }

    /**
     * The scenario itself and everything that depends on it, directly or not,
     * in topological order.
     */
    public List<Scenario> fromScenario(String id) {
        get(id);
        Set<String> selected = new LinkedHashSet<>();
        selected.add(id);
        boolean grew = true;
        while (grew) {
            grew = false;
            for (Scenario scenario : byId.values()) {
                if (!selected.contains(scenario.id())
                        && scenario.dependsOn().stream().anyMatch(selected::contains)) {
                    selected.add(scenario.id());
                    grew = true;
                }
            }
        }
        List<Scenario> out = new ArrayList<>();
        for (Scenario scenario : topologicalOrder()) {
            if (selected.contains(scenario.id())) {
                out.add(scenario);
            }
        }
        return out;
    }

    private int levelOf(String id, Map<String, Integer> level) {
        Integer known = level.get(id);
        if (known != null) {
            return known;
        }
        int depth = 0;
        for (String dep : byId.get(id).dependsOn()) {
            depth = Math.max(depth, levelOf(dep, level) + 1);
        }
        level.put(id, depth);
        return depth;
    }

    private static void dfsCycleCheck(String id, Map<String, Scenario> graph, Set<String> visiting, Set<String> visited) {
        if (visited.contains(id)) return;
        if (!visiting.add(id)) {
            throw new ConfigurationException("Scenario dependencies contain a cycle at: " + id);
        }
        for (String dep : graph.get(id).dependsOn()) {
            dfsCycleCheck(dep, graph, visiting, visited);
        }
        visiting.remove(id);
        visited.add(id);
    }
}
