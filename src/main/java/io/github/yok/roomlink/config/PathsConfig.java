package io.github.yok.roomlink.config;

import java.nio.file.Path;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that reads the {@code paths.*} properties and resolves the SQL artifacts and
 * the output directory used by a run.
 *
 * <ul>
 * <li>{@code paths.schema}: DDL file executed once to create the tables</li>
 * <li>{@code paths.indexes}: semicolon-delimited index statements</li>
 * <li>{@code paths.queries}: semicolon-delimited report queries, one output file each</li>
 * <li>{@code paths.output-dir}: directory receiving {@code output_N.json} or
 * {@code output_N.xml}</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "paths")
@Data
public class PathsConfig {

    private String schema;

    private String indexes;

    private String queries;

    private String outputDir = ".";

    /**
     * Returns the schema file path.
     *
     * @return path of the DDL file
     * @throws IllegalStateException if {@code paths.schema} has not been set
     */
    public Path getSchemaFile() {
        return require(schema, "paths.schema");
    }

    /**
     * Returns the index statement file path.
     *
     * @return path of the index file
     * @throws IllegalStateException if {@code paths.indexes} has not been set
     */
    public Path getIndexFile() {
        return require(indexes, "paths.indexes");
    }

    /**
     * Returns the report query file path.
     *
     * @return path of the query file
     * @throws IllegalStateException if {@code paths.queries} has not been set
     */
    public Path getQueryFile() {
        return require(queries, "paths.queries");
    }

    /**
     * Returns the output directory.
     *
     * @return output directory path
     * @throws IllegalStateException if {@code paths.output-dir} is blank
     */
    public Path getOutputPath() {
        return require(outputDir, "paths.output-dir");
    }

    private static Path require(String value, String key) {
        if (StringUtils.isBlank(value)) {
            throw new IllegalStateException(
                    key + " is not configured. Please set '" + key + "' in application.yml.");
        }
        return Path.of(value);
    }
}
