package io.github.yok.roomlink.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that holds settings related to JSON record loading.
 *
 * <ul>
 * <li>{@code load.batchSize}: number of rows sent to the database per JDBC batch</li>
 * </ul>
 *
 * <p>
 * All batches of one input file are still committed together.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "load")
@Getter
@Setter
@NoArgsConstructor
public class LoadConfig {

    /**
     * Rows per JDBC batch; values below 1 are treated as 1.
     */
    private int batchSize = 1000;
}
