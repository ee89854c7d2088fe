package io.verity.storage;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class HistoryStoreTest {

    @Test
    void peaksOnlyMoveUp() throws Exception {
        Path root = Files.createTempDirectory("verity-test-history-peaks-");
        try {
            HistoryStore history = open(root);

            Assertions.assertEquals(List.of("machine_coverage", "human_coverage"),
                    history.updatePeaks(metrics(60.0, 20.0), "run_1"));
            Assertions.assertEquals(List.of("human_coverage"), history.updatePeaks(metrics(40.0, 25.0), "run_2"));

            Map<String, PeakRow> peaks = history.peaks();
            PeakRow machine = peaks.get("machine_coverage");
            Assertions.assertEquals(40.0, machine.currentValue());
            Assertions.assertEquals(60.0, machine.peakValue());
            Assertions.assertEquals("run_1", machine.peakRunId());
            Assertions.assertEquals("run_2", peaks.get("human_coverage").peakRunId());

            Assertions.assertTrue(history.updatePeaks(metrics(60.0, 25.0), "run_3").isEmpty());
            Assertions.assertEquals("run_1", history.peaks().get("machine_coverage").peakRunId());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void recentRunsAreNewestFirstAndSurviveReopen() throws Exception {
        Path root = Files.createTempDirectory("verity-test-history-runs-");
        try {
            HistoryStore history = open(root);
            history.recordRun(new RunRow("run_a", "machine", 1_000L, 2_000L, 0, 3, 0, 0, 0, 50.0, 10.0, 10.0));
            history.recordRun(new RunRow("run_b", "scenario", 3_000L, 4_000L, 1, 1, 1, 0, 0, 0.0, 0.0, 0.0));
            history.recordRun(new RunRow("run_c", "machine", 5_000L, 6_000L, 2, 0, 0, 0, 0, 55.0, 10.0, 10.0));

            List<RunRow> runs = open(root).recentRuns(2);
            Assertions.assertEquals(List.of("run_c", "run_b"), runs.stream().map(RunRow::runId).toList());
            Assertions.assertEquals("scenario", runs.get(1).kind());
            Assertions.assertEquals(2, runs.get(0).exitCode());
        } finally {
            deleteRecursively(root);
        }
    }

    private static HistoryStore open(Path root) {
        Database database = new Database(root.resolve("history.db"));
        database.init();
        return new HistoryStore(database);
    }

    private static Map<String, Double> metrics(double machine, double human) {
        Map<String, Double> out = new LinkedHashMap<>();
        out.put("machine_coverage", machine);
        out.put("human_coverage", human);
        return out;
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
