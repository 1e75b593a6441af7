package io.github.yok.roomlink.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.roomlink.config.ConnectionConfig;
import io.github.yok.roomlink.config.LoadConfig;
import io.github.yok.roomlink.model.ColumnType;
import io.github.yok.roomlink.model.EntityKind;
import io.github.yok.roomlink.util.LogPathUtil;
import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads a JSON file of room or student records into its table.
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>The input is a JSON array of objects; each object becomes one row.</li>
 * <li>Fields are taken by column name. A missing field or JSON {@code null} is inserted as
 * {@code NULL}; extra fields are ignored.</li>
 * <li>Rows whose {@code id} already exists are skipped ({@code ON CONFLICT (id) DO NOTHING}), so
 * loading the same file twice inserts nothing the second time.</li>
 * <li>All rows of one file are committed together. On any failure the transaction is rolled
 * back.</li>
 * <li>An unusable session or an unreadable/malformed file is logged and reported as {@code 0}
 * inserted rows.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DataLoader {

    private final LoadConfig loadConfig;

    private final ConnectionConfig connectionConfig;

    private final ObjectMapper objectMapper = new ObjectMapper();

    // table -> counters of the last load
    private final Map<String, LoadStats> loadSummary = new LinkedHashMap<>();

    /**
     * Counters of one file load.
     */
    @Getter
    @AllArgsConstructor
    static class LoadStats {
        private final int read;
        private final int inserted;
        private final int skipped;
    }

    /**
     * Constructor.
     *
     * @param loadConfig batch settings
     * @param connectionConfig connection settings providing the query timeout
     */
    public DataLoader(LoadConfig loadConfig, ConnectionConfig connectionConfig) {
        this.loadConfig = loadConfig;
        this.connectionConfig = connectionConfig;
    }

    /**
     * Loads the records of a JSON file into the table of the given kind.
     *
     * @param session open session with {@code autoCommit=false}
     * @param source JSON file containing an array of records
     * @param kind kind of the records (selects table and columns)
     * @return number of rows actually inserted
     * @throws SQLException if the insert or the commit fails (the transaction is rolled back)
     * @throws IllegalArgumentException if a field value cannot be converted to its column type
     */
    public int load(Connection session, Path source, EntityKind kind) throws SQLException {
        String table = kind.getTable();
        if (!ConnectionManager.isLive(session)) {
            log.error("[{}] No usable database session; {} was not loaded", table,
                    LogPathUtil.render(source));
            return 0;
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(source.toFile());
        } catch (IOException e) {
            log.error("[{}] Failed to read JSON file {}: {}", table, LogPathUtil.render(source),
                    e.getMessage(), e);
            return 0;
        }
        if (root == null || !root.isArray()) {
            log.error("[{}] JSON file {} does not contain an array of records", table,
                    LogPathUtil.render(source));
            return 0;
        }

        log.info("[{}] Loading {} (records={})", table, LogPathUtil.render(source), root.size());
        int batchSize = Math.max(1, loadConfig.getBatchSize());
        int read = 0;
        int inserted = 0;
        try (PreparedStatement ps = session.prepareStatement(kind.insertSql())) {
            ps.setQueryTimeout(connectionConfig.getQueryTimeoutSeconds());
            int pending = 0;
            for (JsonNode rec : root) {
                read++;
                if (!rec.isObject()) {
                    log.warn("[{}] Record #{} is not a JSON object → skipping", table, read);
                    continue;
                }
                bindRecord(ps, kind, rec);
                ps.addBatch();
                pending++;
                if (pending >= batchSize) {
                    inserted += countInserted(ps.executeBatch());
                    pending = 0;
                }
            }
            if (pending > 0) {
                inserted += countInserted(ps.executeBatch());
            }
            session.commit();
            log.info("[{}] Transaction committed (inserted={})", table, inserted);
        } catch (SQLException | RuntimeException e) {
            rollback(session, table);
            throw e;
        }

        loadSummary.put(table, new LoadStats(read, inserted, read - inserted));
        return inserted;
    }

    /**
     * Outputs a consolidated log of the loads performed by this instance.
     */
    public void logSummary() {
        log.info("===== Summary =====");
        int maxNameLen = loadSummary.keySet().stream().mapToInt(String::length).max().orElse(0);
        String fmt = "  Table[%-" + maxNameLen + "s] Read=%d Inserted=%d Skipped=%d";
        loadSummary.forEach((table, stats) -> log.info(String.format(fmt, table, stats.getRead(),
                stats.getInserted(), stats.getSkipped())));
        log.info("== Data loading has completed ==");
    }

    /**
     * Returns the counters recorded for a table.
     *
     * @param table table name
     * @return counters, or {@code null} if the table has not been loaded
     */
    LoadStats getStats(String table) {
        return loadSummary.get(table);
    }

    private void bindRecord(PreparedStatement ps, EntityKind kind, JsonNode rec)
            throws SQLException {
        int index = 1;
        for (Map.Entry<String, ColumnType> col : kind.getColumns().entrySet()) {
            col.getValue().bind(ps, index++, col.getKey(), rec.get(col.getKey()));
        }
    }

    private static int countInserted(int[] updateCounts) {
        int total = 0;
        for (int c : updateCounts) {
            if (c > 0) {
                total += c;
            }
        }
        return total;
    }

    private static void rollback(Connection session, String table) {
        try {
            session.rollback();
            log.warn("[{}] Transaction rolled back due to error.", table);
        } catch (SQLException rollbackEx) {
            log.warn("[{}] Rollback failed: {}", table, rollbackEx.getMessage(), rollbackEx);
        }
    }
}
