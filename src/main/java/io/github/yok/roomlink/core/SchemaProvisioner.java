package io.github.yok.roomlink.core;

import com.google.common.base.Preconditions;
import io.github.yok.roomlink.config.ConnectionConfig;
import io.github.yok.roomlink.util.LogPathUtil;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates the target database and its tables when they do not exist yet.
 *
 * <p>
 * Both operations are idempotent: an existing database is left untouched, and the schema file is
 * expected to use {@code CREATE TABLE IF NOT EXISTS}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class SchemaProvisioner {

    // SQLState: duplicate_database
    static final String DUPLICATE_DATABASE = "42P04";
    // SQLState: undefined_table
    static final String UNDEFINED_TABLE = "42P01";

    static final String EXISTS_SQL = "SELECT 1 FROM pg_database WHERE datname = ?";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final ConnectionConfig connectionConfig;

    /**
     * Creates the database unless it already exists.
     *
     * @param admin auto-commit connection to the administrative database
     * @param name database name; must be a plain identifier
     * @throws SQLException if the lookup or the creation fails for a reason other than a
     *         concurrent creation of the same database
     * @throws IllegalArgumentException if {@code name} is not a plain identifier
     */
    public void ensureDatabase(Connection admin, String name) throws SQLException {
        Preconditions.checkArgument(name != null && IDENTIFIER.matcher(name).matches(),
                "Invalid database name: %s", name);
        admin.setAutoCommit(true);

        try (PreparedStatement ps = admin.prepareStatement(EXISTS_SQL)) {
            ps.setQueryTimeout(connectionConfig.getQueryTimeoutSeconds());
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    log.info("Database {} already exists", name);
                    return;
                }
            }
        }

        try (Statement st = admin.createStatement()) {
            st.setQueryTimeout(connectionConfig.getQueryTimeoutSeconds());
            st.execute("CREATE DATABASE \"" + name + "\"");
            log.info("Database {} created successfully", name);
        } catch (SQLException e) {
            if (!DUPLICATE_DATABASE.equals(e.getSQLState())) {
                throw e;
            }
            log.info("Database {} already exists", name);
        }
    }

    /**
     * Executes the schema file as one statement in one transaction.
     *
     * @param session open session with {@code autoCommit=false}
     * @param schemaFile DDL file
     * @return {@code true} when the schema was applied, {@code false} when it referenced a missing
     *         table (the transaction is rolled back)
     * @throws IOException if the schema file cannot be read
     * @throws SQLException if execution fails for another reason (the transaction is rolled back)
     */
    public boolean ensureTables(Connection session, Path schemaFile)
            throws IOException, SQLException {
        String ddl = Files.readString(schemaFile, StandardCharsets.UTF_8);
        try (Statement st = session.createStatement()) {
            st.setQueryTimeout(connectionConfig.getQueryTimeoutSeconds());
            st.execute(ddl);
            session.commit();
            log.info("Tables created successfully from {}", LogPathUtil.render(schemaFile));
            return true;
        } catch (SQLException e) {
            rollback(session);
            if (UNDEFINED_TABLE.equals(e.getSQLState())) {
                log.error("Error creating tables from {}: {}", LogPathUtil.render(schemaFile),
                        e.getMessage(), e);
                return false;
            }
            throw e;
        }
    }

    private static void rollback(Connection session) {
        try {
            session.rollback();
            log.warn("Transaction rolled back due to error.");
        } catch (SQLException rollbackEx) {
            log.warn("Rollback failed: {}", rollbackEx.getMessage(), rollbackEx);
        }
    }
}
