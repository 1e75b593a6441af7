package io.github.yok.roomlink.util;

import com.google.common.base.Splitter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.Generated;

/**
 * Splits a semicolon-delimited SQL script into individual statements.
 *
 * <p>
 * Fragments are trimmed and blank fragments are dropped; the order of the remaining statements is
 * the order in the script. Semicolons inside string literals are not recognized.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class SqlScriptSplitter {

    private static final Splitter STATEMENT_SPLITTER =
            Splitter.on(';').trimResults().omitEmptyStrings();

    @Generated
    private SqlScriptSplitter() {}

    /**
     * Splits script text into statements.
     *
     * @param script script text, may be {@code null}
     * @return ordered statements without the trailing delimiter; empty for {@code null}
     */
    public static List<String> split(String script) {
        if (script == null) {
            return List.of();
        }
        return STATEMENT_SPLITTER.splitToList(script);
    }

    /**
     * Reads a UTF-8 script file and splits it into statements.
     *
     * @param scriptFile script file
     * @return ordered statements
     * @throws IOException if the file cannot be read
     */
    public static List<String> read(Path scriptFile) throws IOException {
        return split(Files.readString(scriptFile, StandardCharsets.UTF_8));
    }
}
