package io.auditforge.storage;

import io.auditforge.model.EvolutionTag;
import io.auditforge.model.Finding;
import io.auditforge.model.FindingStatus;
import io.auditforge.model.Severity;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Append-only finding history keyed by finding id. Rows are never updated or deleted; the
 * current view of a finding is its most recent event.
 */
public final class FindingLedger {
    private static final String COLUMNS =
            "seq,finding_id,run_id,status,severity,prior_severity,evolution_tag,target_file,title,summary,detail_path,recorded_at_ms";

    private final Database database;

    public FindingLedger(Database database) {
        this.database = database;
    }

    public int append(long runId, Collection<Finding> findings, long nowMs) {
        if (findings == null || findings.isEmpty()) {
            return 0;
        }
        String sql = """
                INSERT INTO finding_events(finding_id,run_id,status,severity,prior_severity,evolution_tag,
                                           target_file,title,summary,detail_path,recorded_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?,?)
                """;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                for (Finding f : findings) {
                    ps.setString(1, f.id());
                    ps.setLong(2, runId);
                    ps.setString(3, f.status().name());
                    ps.setString(4, f.severity().name());
                    ps.setString(5, f.priorSeverity() == null ? null : f.priorSeverity().name());
                    ps.setString(6, (f.evolution() == null ? EvolutionTag.NEW : f.evolution()).name());
                    ps.setString(7, f.targetFile());
                    ps.setString(8, f.title());
                    ps.setString(9, f.summary());
                    ps.setString(10, f.detailPath());
                    ps.setLong(11, nowMs);
                    ps.addBatch();
                }
                ps.executeBatch();
                c.commit();
                return findings.size();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to append findings for run " + runId, e);
        }
    }

    /**
     * Latest event of every finding ever recorded.
     */
    public List<Finding> latest() {
        String sql = "SELECT " + COLUMNS + " FROM finding_events e "
                + "WHERE e.seq = (SELECT MAX(seq) FROM finding_events x WHERE x.finding_id = e.finding_id) "
                + "ORDER BY e.finding_id";
        return query(sql, null).stream().map(LedgerEntry::finding).toList();
    }

    public List<Finding> activeLatest() {
        return latest().stream().filter(Finding::active).toList();
    }

    public List<LedgerEntry> forRun(long runId) {
        return query("SELECT " + COLUMNS + " FROM finding_events WHERE run_id = ? ORDER BY seq", runId);
    }

    public List<LedgerEntry> history(String findingId) {
        return query("SELECT " + COLUMNS + " FROM finding_events WHERE finding_id = ? ORDER BY seq", findingId);
    }

    public Optional<Finding> latest(String findingId) {
        List<LedgerEntry> entries = history(findingId);
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1).finding());
    }

    private List<LedgerEntry> query(String sql, Object param) {
        List<LedgerEntry> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            if (param != null) {
                ps.setObject(1, param);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to query finding ledger", e);
        }
        return out;
    }

    private static LedgerEntry map(ResultSet rs) throws SQLException {
        String prior = rs.getString("prior_severity");
        Finding finding = new Finding(
                rs.getString("finding_id"),
                FindingStatus.valueOf(rs.getString("status")),
                Severity.valueOf(rs.getString("severity")),
                rs.getString("target_file"),
                rs.getString("title"),
                rs.getString("summary"),
                rs.getString("detail_path"),
                EvolutionTag.valueOf(rs.getString("evolution_tag")),
                prior == null ? null : Severity.valueOf(prior)
        );
        return new LedgerEntry(rs.getLong("seq"), rs.getLong("run_id"), finding, rs.getLong("recorded_at_ms"));
    }

    public record LedgerEntry(
            long seq,
            long runId,
            Finding finding,
            long recordedAtMs
    ) {
    }
}
