package io.github.yok.roomlink.core;

import io.github.yok.roomlink.config.ConnectionConfig;
import io.github.yok.roomlink.util.MaskingLogUtil;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Owns the single connection (session) to the target database and recovers it when it breaks.
 *
 * <p>
 * <strong>Lifecycle:</strong>
 * </p>
 * <ul>
 * <li>{@link #acquire()} opens the connection on first use and returns the same instance while it
 * passes the {@code SELECT 1} liveness probe.</li>
 * <li>A closed connection or a failed probe triggers exactly one reconnect attempt.</li>
 * <li>When opening fails the error is logged and {@code null} is returned instead of throwing;
 * callers check the result with {@link #isLive(Connection)}.</li>
 * <li>The owner ends the run with {@link #close()}.</li>
 * </ul>
 *
 * <p>
 * Connections to the target database are opened with {@code autoCommit=false}; components commit
 * explicitly.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ConnectionManager implements AutoCloseable {

    // Trivial statement used as liveness probe
    static final String PROBE_SQL = "SELECT 1";

    /**
     * Abstraction for opening a physical JDBC connection.
     */
    @FunctionalInterface
    interface ConnectionOpener {

        /**
         * Opens a connection.
         *
         * @param url JDBC URL
         * @param props driver properties including user and password
         * @return open connection
         * @throws SQLException if the connection cannot be established
         */
        Connection open(String url, Properties props) throws SQLException;
    }

    private final ConnectionConfig config;

    // Replaceable in tests
    private final ConnectionOpener opener;

    // Current session; null until the first successful acquire
    private Connection current;

    /**
     * Creates a manager that opens connections through {@link DriverManager}.
     *
     * @param config connection settings
     */
    public ConnectionManager(ConnectionConfig config) {
        this(config, DriverManager::getConnection);
    }

    /**
     * Creates a manager with a custom connection opener.
     *
     * @param config connection settings
     * @param opener opener of physical connections
     */
    ConnectionManager(ConnectionConfig config, ConnectionOpener opener) {
        this.config = config;
        this.opener = opener;
    }

    /**
     * Returns a live connection to the target database.
     *
     * @return the current or a freshly opened connection, or {@code null} if none could be opened
     */
    public Connection acquire() {
        if (current == null || isClosed(current)) {
            current = openTarget("Connection");
            return current;
        }

        try (Statement st = current.createStatement()) {
            st.setQueryTimeout(config.getQueryTimeoutSeconds());
            st.execute(PROBE_SQL);
            return current;
        } catch (SQLException e) {
            log.warn("Liveness probe failed for {}: {}", config.getName(), e.getMessage());
        }

        closeQuietly(current);
        current = openTarget("Reconnection");
        return current;
    }

    /**
     * Opens a separate auto-commit connection to the administrative database. The caller closes
     * it.
     *
     * @return open connection to {@link ConnectionConfig#getAdminDatabase()}
     * @throws SQLException if the connection cannot be established
     */
    public Connection openAdminConnection() throws SQLException {
        loadDriver();
        String url = config.getAdminUrl();
        Connection conn = opener.open(url, buildProperties());
        conn.setAutoCommit(true);
        log.info("Connection to PostgreSQL admin database successful ({})",
                MaskingLogUtil.describe(url, config));
        return conn;
    }

    /**
     * Tells whether a connection can be used.
     *
     * @param connection connection to check, may be {@code null}
     * @return {@code false} for {@code null} and closed connections
     */
    public static boolean isLive(Connection connection) {
        return connection != null && !isClosed(connection);
    }

    /**
     * Closes the current connection, if any.
     */
    @Override
    public void close() {
        if (current != null) {
            closeQuietly(current);
            log.info("Connection to PostgreSQL {} closed", config.getName());
            current = null;
        }
    }

    private Connection openTarget(String action) {
        try {
            loadDriver();
            Connection conn = opener.open(config.getUrl(), buildProperties());
            conn.setAutoCommit(false);
            log.info("{} to PostgreSQL {} successful", action, config.getName());
            return conn;
        } catch (SQLException e) {
            log.error("{} to PostgreSQL {} failed ({}): {}", action, config.getName(),
                    MaskingLogUtil.describe(config), e.getMessage(), e);
            return null;
        }
    }

    private void loadDriver() throws SQLException {
        try {
            if (StringUtils.isNotBlank(config.getDriverClass())) {
                Class.forName(config.getDriverClass());
            }
        } catch (ClassNotFoundException e) {
            throw new SQLException("JDBC driver class not found: " + config.getDriverClass(), e);
        }
    }

    Properties buildProperties() {
        Properties props = new Properties();
        if (config.getUser() != null) {
            props.setProperty("user", config.getUser());
        }
        if (config.getPassword() != null) {
            props.setProperty("password", config.getPassword());
        }
        props.setProperty("connectTimeout", String.valueOf(config.getConnectTimeoutSeconds()));
        props.setProperty("socketTimeout", String.valueOf(config.getSocketTimeoutSeconds()));
        return props;
    }

    private static boolean isClosed(Connection connection) {
        try {
            return connection.isClosed();
        } catch (SQLException e) {
            return true;
        }
    }

    private static void closeQuietly(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close connection: {}", e.getMessage(), e);
        }
    }
}
