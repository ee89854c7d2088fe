package io.verity.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ledger of finished runs and the best value each coverage metric has reached.
 */
public final class HistoryStore {
    private final Database database;

    public HistoryStore(Database database) {
        this.database = database;
    }

    public void recordRun(RunRow run) {
        String sql = """
                INSERT OR REPLACE INTO runs(run_id,kind,started_at_ms,finished_at_ms,exit_code,passed,failed,skipped,blocked,
                                            machine_coverage,human_coverage,full_coverage)
                VALUES(?,?,?,?,?,?,?,?,?,?,?,?)
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, run.runId());
            ps.setString(2, run.kind());
            ps.setLong(3, run.startedAtMs());
            ps.setLong(4, run.finishedAtMs());
            ps.setInt(5, run.exitCode());
            ps.setInt(6, run.passed());
            ps.setInt(7, run.failed());
            ps.setInt(8, run.skipped());
            ps.setInt(9, run.blocked());
            ps.setDouble(10, run.machineCoverage());
            ps.setDouble(11, run.humanCoverage());
            ps.setDouble(12, run.fullCoverage());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record run: " + run.runId(), e);
        }
    }

    /**
     * Stores the current value of every metric and raises its peak when
     * exceeded.
     *
     * @return the metrics that reached a new best in this run
     */
    public List<String> updatePeaks(Map<String, Double> metrics, String runId) {
        List<String> improved = new ArrayList<>();
        long now = System.currentTimeMillis();
        Map<String, PeakRow> existing = peaks();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT OR REPLACE INTO peaks(metric,current_value,peak_value,peak_run_id,peak_at_ms,updated_at_ms)
                    VALUES(?,?,?,?,?,?)
                    """)) {
                for (Map.Entry<String, Double> e : metrics.entrySet()) {
                    double value = e.getValue() == null ? 0.0 : e.getValue();
                    PeakRow before = existing.get(e.getKey());
                    boolean isPeak = before == null || value > before.peakValue();
                    if (isPeak && value > 0.0) {
                        improved.add(e.getKey());
                    }
                    ps.setString(1, e.getKey());
                    ps.setDouble(2, value);
                    ps.setDouble(3, isPeak ? value : before.peakValue());
                    ps.setString(4, isPeak ? runId : before.peakRunId());
                    if (isPeak) {
                        ps.setLong(5, now);
                    } else if (before.peakAtMs() == null) {
                        ps.setNull(5, Types.INTEGER);
                    } else {
                        ps.setLong(5, before.peakAtMs());
                    }
                    ps.setLong(6, now);
                    ps.addBatch();
                }
                ps.executeBatch();
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update peaks for run: " + runId, e);
        }
        return improved;
    }

    public Map<String, PeakRow> peaks() {
        Map<String, PeakRow> out = new LinkedHashMap<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT metric,current_value,peak_value,peak_run_id,peak_at_ms,updated_at_ms FROM peaks ORDER BY metric");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                long peakAt = rs.getLong("peak_at_ms");
                Long peakAtMs = rs.wasNull() ? null : peakAt;
                out.put(rs.getString("metric"), new PeakRow(
                        rs.getString("metric"),
                        rs.getDouble("current_value"),
                        rs.getDouble("peak_value"),
                        rs.getString("peak_run_id"),
                        peakAtMs,
                        rs.getLong("updated_at_ms")
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read peaks", e);
        }
    }

    public List<RunRow> recentRuns(int limit) {
        String sql = """
                SELECT run_id,kind,started_at_ms,finished_at_ms,exit_code,passed,failed,skipped,blocked,
                       machine_coverage,human_coverage,full_coverage
                FROM runs
                ORDER BY started_at_ms DESC, run_id DESC
                LIMIT ?
                """;
        List<RunRow> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new RunRow(
                            rs.getString("run_id"),
                            rs.getString("kind"),
                            rs.getLong("started_at_ms"),
                            rs.getLong("finished_at_ms"),
                            rs.getInt("exit_code"),
                            rs.getInt("passed"),
                            rs.getInt("failed"),
                            rs.getInt("skipped"),
                            rs.getInt("blocked"),
                            rs.getDouble("machine_coverage"),
                            rs.getDouble("human_coverage"),
                            rs.getDouble("full_coverage")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list runs", e);
        }
    }
}
