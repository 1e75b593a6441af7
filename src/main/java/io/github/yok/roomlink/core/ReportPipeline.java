package io.github.yok.roomlink.core;

import io.github.yok.roomlink.config.ConnectionConfig;
import io.github.yok.roomlink.config.ExportConfig;
import io.github.yok.roomlink.config.LoadConfig;
import io.github.yok.roomlink.config.PathsConfig;
import io.github.yok.roomlink.model.EntityKind;
import io.github.yok.roomlink.util.LogPathUtil;
import io.github.yok.roomlink.writer.ExportFormat;
import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a complete report: provision, load, index and export.
 *
 * <ol>
 * <li>Creates the target database through an administrative connection, if missing.</li>
 * <li>Acquires the session and creates the tables from the schema file.</li>
 * <li>Loads rooms, then students (students reference rooms).</li>
 * <li>Builds the indexes.</li>
 * <li>Runs the report queries and writes one file per query.</li>
 * </ol>
 *
 * <p>
 * The session is closed when the run ends, whether it succeeded or not.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ReportPipeline {

    private final ConnectionConfig connectionConfig;
    private final PathsConfig pathsConfig;
    private final ConnectionManager connectionManager;
    private final SchemaProvisioner schemaProvisioner;
    private final DataLoader dataLoader;
    private final QueryExporter queryExporter;

    /**
     * Creates a pipeline whose components are built from the given settings.
     *
     * @param connectionConfig connection settings
     * @param pathsConfig SQL artifact and output locations
     * @param loadConfig load settings
     * @param exportConfig export settings
     */
    public ReportPipeline(ConnectionConfig connectionConfig, PathsConfig pathsConfig,
            LoadConfig loadConfig, ExportConfig exportConfig) {
        this(connectionConfig, pathsConfig, new ConnectionManager(connectionConfig),
                new SchemaProvisioner(connectionConfig),
                new DataLoader(loadConfig, connectionConfig),
                new QueryExporter(connectionConfig, pathsConfig, exportConfig));
    }

    /**
     * Creates a pipeline from prepared components.
     *
     * @param connectionConfig connection settings
     * @param pathsConfig SQL artifact and output locations
     * @param connectionManager session owner
     * @param schemaProvisioner database and table creator
     * @param dataLoader record loader
     * @param queryExporter index builder and report writer
     */
    ReportPipeline(ConnectionConfig connectionConfig, PathsConfig pathsConfig,
            ConnectionManager connectionManager, SchemaProvisioner schemaProvisioner,
            DataLoader dataLoader, QueryExporter queryExporter) {
        this.connectionConfig = connectionConfig;
        this.pathsConfig = pathsConfig;
        this.connectionManager = connectionManager;
        this.schemaProvisioner = schemaProvisioner;
        this.dataLoader = dataLoader;
        this.queryExporter = queryExporter;
    }

    /**
     * Runs the report.
     *
     * @param studentsFile JSON file of student records
     * @param roomsFile JSON file of room records
     * @param format output format
     * @return written report files in query order
     * @throws IOException if an SQL artifact cannot be read or an output file cannot be written
     * @throws SQLException if a database operation fails
     * @throws IllegalStateException if no session could be opened or the tables could not be
     *         created
     */
    public List<Path> execute(Path studentsFile, Path roomsFile, ExportFormat format)
            throws IOException, SQLException {
        log.info("=== Report started (students={}, rooms={}, format={}) ===",
                LogPathUtil.render(studentsFile), LogPathUtil.render(roomsFile), format);

        try (Connection admin = connectionManager.openAdminConnection()) {
            schemaProvisioner.ensureDatabase(admin, connectionConfig.getName());
        }

        try {
            Connection session = connectionManager.acquire();
            if (session == null) {
                log.error("Could not connect to database {}", connectionConfig.getName());
                throw new IllegalStateException(
                        "Could not connect to database " + connectionConfig.getName());
            }
            if (!schemaProvisioner.ensureTables(session, pathsConfig.getSchemaFile())) {
                throw new IllegalStateException("Tables could not be created from "
                        + LogPathUtil.render(pathsConfig.getSchemaFile()));
            }

            dataLoader.load(session, roomsFile, EntityKind.ROOM);
            dataLoader.load(session, studentsFile, EntityKind.STUDENT);
            dataLoader.logSummary();

            queryExporter.buildIndexes(session, pathsConfig.getIndexFile());

            List<Path> written =
                    queryExporter.exportResult(session, format, pathsConfig.getQueryFile());
            log.info("=== Report completed. Files: {} ===", written.stream()
                    .map(LogPathUtil::render).collect(Collectors.toList()));
            return written;
        } finally {
            connectionManager.close();
        }
    }
}
