package io.github.yok.roomlink.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that holds settings related to report export.
 *
 * <ul>
 * <li>{@code export.filePrefix}: stem prefix of the numbered output files</li>
 * </ul>
 *
 * <p>
 * The N-th query of the query file is written to {@code <filePrefix><N>.<ext>}, for example
 * {@code output_1.json}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "export")
@Getter
@Setter
@NoArgsConstructor
public class ExportConfig {

    private String filePrefix = "output_";

    /**
     * Returns the file name for the given 1-based query number.
     *
     * @param queryNumber 1-based position of the query in the query file
     * @param extension file extension without the dot
     * @return file name such as {@code output_1.json}
     */
    public String fileName(int queryNumber, String extension) {
        return filePrefix + queryNumber + "." + extension;
    }
}
