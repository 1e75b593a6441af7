package io.github.yok.roomlink.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that manages the PostgreSQL connection settings loaded from
 * {@code application.yml}.
 *
 * <pre>
 * database:
 *   host: 127.0.0.1
 *   port: 5432
 *   name: db_students
 *   user: postgres
 *   password: secret
 *   admin-database: postgres
 * </pre>
 *
 * <p>
 * Timeouts are given in seconds; {@code 0} disables the corresponding timeout.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "database")
@Data
public class ConnectionConfig {

    // Database server host name or address
    private String host = "127.0.0.1";
    // Database server port
    private int port = 5432;
    // Name of the target database that holds the room/student tables
    private String name;
    // Database user name
    private String user;
    // Database password
    private String password;
    // Bootstrap database used to create the target database
    private String adminDatabase = "postgres";
    // Fully qualified JDBC driver class name; blank relies on JDBC 4 auto-loading
    private String driverClass = "org.postgresql.Driver";
    // Timeout for establishing a connection
    private int connectTimeoutSeconds = 10;
    // Timeout for socket reads once connected
    private int socketTimeoutSeconds;
    // Timeout applied to each statement
    private int queryTimeoutSeconds;

    /**
     * Returns the JDBC URL of the target database.
     *
     * @return JDBC URL such as {@code jdbc:postgresql://127.0.0.1:5432/db_students}
     */
    public String getUrl() {
        return buildUrl(name);
    }

    /**
     * Returns the JDBC URL of the administrative (bootstrap) database.
     *
     * @return JDBC URL of {@link #adminDatabase}
     */
    public String getAdminUrl() {
        return buildUrl(adminDatabase);
    }

    private String buildUrl(String database) {
        return "jdbc:postgresql://" + host + ":" + port + "/" + database;
    }
}
