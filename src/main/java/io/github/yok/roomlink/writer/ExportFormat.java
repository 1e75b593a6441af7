package io.github.yok.roomlink.writer;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Enumeration of supported export formats.
 *
 * <p>
 * Each format has the extension of the files it produces and the names accepted on the command
 * line. For example, {@link #RECORDS} is selected by both {@code json} and {@code records}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum ExportFormat {

    // One flat JSON object per row.
    RECORDS("json", "json", "records"),

    // One XML element per row with one child element per column.
    MARKUP("xml", "xml", "markup");

    // File extension without the dot.
    private final String extension;

    // Accepted names (all lowercase).
    private final Set<String> names;

    ExportFormat(String extension, String... names) {
        this.extension = extension;
        this.names = Arrays.stream(names).map(n -> n.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    /**
     * Resolves a format from its name.
     *
     * @param name format name (case-insensitive, surrounding blanks ignored)
     * @return the matching format, or empty if {@code name} is {@code null} or unknown
     */
    public static Optional<ExportFormat> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(f -> f.names.contains(key)).findFirst();
    }
}
