package io.github.yok.roomlink.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.yok.roomlink.config.ConnectionConfig;
import io.github.yok.roomlink.config.ExportConfig;
import io.github.yok.roomlink.config.PathsConfig;
import io.github.yok.roomlink.model.QueryResult;
import io.github.yok.roomlink.util.LogPathUtil;
import io.github.yok.roomlink.util.SqlScriptSplitter;
import io.github.yok.roomlink.writer.ExportFormat;
import io.github.yok.roomlink.writer.ResultWriter;
import io.github.yok.roomlink.writer.ResultWriterFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs semicolon-delimited SQL scripts against the session and writes query results to files.
 *
 * <p>
 * <strong>Responsibilities:</strong>
 * </p>
 * <ul>
 * <li>Builds indexes from the index script, committing after each statement.</li>
 * <li>Runs the report queries strictly in file order and collects every row.</li>
 * <li>Writes the N-th result to {@code <output-dir>/<file-prefix>N.<ext>} in the records (JSON) or
 * markup (XML) format.</li>
 * </ul>
 *
 * <p>
 * A failing statement is logged with its text, the transaction is rolled back and the exception
 * is rethrown; statements after it do not run.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class QueryExporter {

    private final ConnectionConfig connectionConfig;

    private final PathsConfig pathsConfig;

    private final ExportConfig exportConfig;

    /**
     * Executes every statement of the query file in order and collects the results.
     *
     * @param session session to use; when it is not usable nothing is executed
     * @param queryFile semicolon-delimited query script
     * @return one result per statement, in statement order; empty when the session is not usable
     * @throws IOException if the query file cannot be read
     * @throws SQLException if a statement fails (the transaction is rolled back)
     */
    public List<QueryResult> executeBatch(Connection session, Path queryFile)
            throws IOException, SQLException {
        if (!ConnectionManager.isLive(session)) {
            log.error("No usable database session; queries from {} were not executed",
                    LogPathUtil.render(queryFile));
            return ImmutableList.of();
        }
        List<String> statements = SqlScriptSplitter.read(queryFile);
        List<QueryResult> results = new ArrayList<>(statements.size());
        for (String sql : statements) {
            results.add(execute(session, sql));
        }
        session.commit();
        log.info("Executed {} statement(s) from {}", statements.size(),
                LogPathUtil.render(queryFile));
        return results;
    }

    /**
     * Executes every statement of the index file, committing after each one.
     *
     * @param session session to use; when it is not usable no index is built
     * @param indexFile semicolon-delimited index script
     * @throws IOException if the index file cannot be read
     * @throws SQLException if a statement fails; indexes committed before it are kept
     */
    public void buildIndexes(Connection session, Path indexFile) throws IOException, SQLException {
        if (!ConnectionManager.isLive(session)) {
            log.error("No usable database session; indexes from {} were not built",
                    LogPathUtil.render(indexFile));
            return;
        }
        List<String> statements = SqlScriptSplitter.read(indexFile);
        for (String sql : statements) {
            Statement st = null;
            try {
                st = session.createStatement();
                st.setQueryTimeout(connectionConfig.getQueryTimeoutSeconds());
                st.execute(sql);
                session.commit();
                log.info("Index statement executed: {}", sql);
            } catch (SQLException e) {
                log.error("Error executing index statement [{}]: {}", sql, e.getMessage(), e);
                rollback(session);
                throw e;
            } finally {
                closeStatement(st);
            }
        }
        log.info("Indexes created successfully ({} statement(s))", statements.size());
    }

    /**
     * Runs the query file and writes one file per statement in the given format.
     *
     * @param session session to use; when it is not usable nothing is executed or written
     * @param format output format
     * @param queryFile semicolon-delimited query script
     * @return written files in statement order; empty when the session is not usable
     * @throws IOException if the query file cannot be read or an output file cannot be written
     * @throws SQLException if a statement fails
     * @throws IllegalArgumentException if a value cannot be represented in the records format
     */
    public List<Path> exportResult(Connection session, ExportFormat format, Path queryFile)
            throws IOException, SQLException {
        Preconditions.checkNotNull(format, "format must not be null");
        if (!ConnectionManager.isLive(session)) {
            log.error("No usable database session; results were not exported");
            return ImmutableList.of();
        }

        List<QueryResult> results = executeBatch(session, queryFile);
        List<Path> destinations = resolveDestinations(results.size(), format);
        write(ResultWriterFactory.create(format), results, destinations);
        return destinations;
    }

    /**
     * Runs the query file and writes the results in the format with the given name.
     *
     * @param session session to use
     * @param formatName format name such as {@code json} or {@code xml}
     * @param queryFile semicolon-delimited query script
     * @return written files in statement order; empty for an unknown format name
     * @throws IOException if the query file cannot be read or an output file cannot be written
     * @throws SQLException if a statement fails
     */
    public List<Path> exportResult(Connection session, String formatName, Path queryFile)
            throws IOException, SQLException {
        Optional<ExportFormat> format = ExportFormat.fromName(formatName);
        if (format.isEmpty()) {
            log.error("Unknown file format: {}", formatName);
            return ImmutableList.of();
        }
        return exportResult(session, format.get(), queryFile);
    }

    /**
     * Writes each result as a JSON array of row objects.
     *
     * @param results query results
     * @param destinations one destination per result
     * @throws IOException if a file cannot be written
     */
    public void exportAsRecords(List<QueryResult> results, List<Path> destinations)
            throws IOException {
        write(ResultWriterFactory.create(ExportFormat.RECORDS), results, destinations);
    }

    /**
     * Writes each result as an XML document of row elements.
     *
     * @param results query results
     * @param destinations one destination per result
     * @throws IOException if a file cannot be written
     */
    public void exportAsMarkup(List<QueryResult> results, List<Path> destinations)
            throws IOException {
        write(ResultWriterFactory.create(ExportFormat.MARKUP), results, destinations);
    }

    /**
     * Returns the numbered output files for the given number of results.
     *
     * @param count number of results
     * @param format output format providing the extension
     * @return paths {@code <output-dir>/<file-prefix>1.<ext>} to {@code ...<count>.<ext>}
     */
    List<Path> resolveDestinations(int count, ExportFormat format) {
        Path dir = pathsConfig.getOutputPath();
        List<Path> destinations = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            destinations.add(dir.resolve(exportConfig.fileName(i, format.getExtension())));
        }
        return destinations;
    }

    private void write(ResultWriter writer, List<QueryResult> results, List<Path> destinations)
            throws IOException {
        Preconditions.checkArgument(results.size() == destinations.size(),
                "results (%s) and destinations (%s) differ in size", results.size(),
                destinations.size());
        for (int i = 0; i < results.size(); i++) {
            Path dest = destinations.get(i);
            Path parent = dest.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            writer.write(results.get(i), dest);
            log.info("Data has been exported to {} (rows={})", LogPathUtil.render(dest),
                    results.get(i).getRowCount());
        }
    }

    private QueryResult execute(Connection session, String sql) throws SQLException {
        Statement st = null;
        try {
            st = session.createStatement();
            st.setQueryTimeout(connectionConfig.getQueryTimeoutSeconds());
            if (!st.execute(sql)) {
                return new QueryResult(sql, List.of());
            }
            try (ResultSet rs = st.getResultSet()) {
                return collect(sql, rs);
            }
        } catch (SQLException e) {
            log.error("Error executing query [{}]: {}", sql, e.getMessage(), e);
            rollback(session);
            throw e;
        } finally {
            closeStatement(st);
        }
    }

    private static QueryResult collect(String sql, ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();
        List<String> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(meta.getColumnLabel(i));
        }
        QueryResult result = new QueryResult(sql, columns);
        while (rs.next()) {
            List<Object> values = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                values.add(rs.getObject(i));
            }
            result.addRow(values);
        }
        return result;
    }

    private static void rollback(Connection session) {
        try {
            session.rollback();
            log.warn("Transaction rolled back due to error.");
        } catch (SQLException rollbackEx) {
            log.warn("Rollback failed: {}", rollbackEx.getMessage(), rollbackEx);
        }
    }

    private static void closeStatement(Statement st) {
        if (st == null) {
            return;
        }
        try {
            st.close();
        } catch (SQLException e) {
            log.warn("Failed to close statement: {}", e.getMessage(), e);
        }
    }
}
