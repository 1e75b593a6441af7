package io.github.yok.roomlink.util;

import io.github.yok.roomlink.config.ConnectionConfig;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Generated;

/**
 * Utility for masking credentials before connection details are written to the log.
 *
 * <p>
 * Masks plain text secrets and {@code password=} query parameters of JDBC URLs while keeping host,
 * port, database and user visible for troubleshooting.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class MaskingLogUtil {

    /**
     * Pattern that matches password query parameters in JDBC URLs.
     */
    private static final Pattern PASSWORD_QUERY_PATTERN =
            Pattern.compile("(?i)(password=)([^;&]+)");

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private MaskingLogUtil() {}

    /**
     * Masks a secret value.
     *
     * @param value raw text
     * @return {@code ***} for non-empty input, the input itself otherwise
     */
    public static String maskText(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return "***";
    }

    /**
     * Masks password query parameters in a JDBC URL.
     *
     * @param url JDBC URL
     * @return masked URL, or {@code null} when input is {@code null}
     */
    public static String maskJdbcUrl(String url) {
        if (url == null) {
            return null;
        }
        Matcher queryMatcher = PASSWORD_QUERY_PATTERN.matcher(url);
        return queryMatcher.replaceAll("$1***");
    }

    /**
     * Describes the target database connection for logging, without the password.
     *
     * @param config connection settings
     * @return text such as {@code url=jdbc:postgresql://host:5432/db, user=postgres, password=***}
     */
    public static String describe(ConnectionConfig config) {
        if (config == null) {
            return "<null>";
        }
        return describe(config.getUrl(), config);
    }

    /**
     * Describes a connection to the given URL for logging, without the password.
     *
     * @param url JDBC URL actually used
     * @param config connection settings providing user and password
     * @return masked description
     */
    public static String describe(String url, ConnectionConfig config) {
        return "url=" + maskJdbcUrl(url) + ", user=" + config.getUser() + ", password="
                + maskText(config.getPassword());
    }
}
