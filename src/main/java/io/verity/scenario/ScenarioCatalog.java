package io.verity.scenario;

import io.verity.errors.ConfigurationException;
import io.verity.model.Scenario;
import io.verity.util.Jsons;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Loads {@code scenarios/*.json}, one scenario per file, in file name order.
 */
public final class ScenarioCatalog {
    private ScenarioCatalog() {
    }

    public static ScenarioGraph load(Path dir) {
        List<Path> files = new ArrayList<>();
        if (Files.isDirectory(dir)) {
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.json")) {
                for (Path file : stream) {
                    files.add(file);
                }
            } catch (IOException e) {
                throw new ConfigurationException("Failed to list scenarios in " + dir, e);
            }
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        List<Scenario> scenarios = new ArrayList<>(files.size());
        for (Path file : files) {
            try {
                scenarios.add(Jsons.read(file, Scenario.class));
            } catch (IOException e) {
                throw new ConfigurationException("Invalid scenario file " + file.getFileName() + ": " + e.getMessage(), e);
            }
        }
        return ScenarioGraph.of(scenarios);
    }
}
