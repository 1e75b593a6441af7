package io.github.yok.roomlink.writer;

import io.github.yok.roomlink.model.QueryResult;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Interface for serializing one {@link QueryResult} to a file.
 *
 * @author Yasuharu.Okawauchi
 */
public interface ResultWriter {

    /**
     * Writes the result to the given file, replacing any existing content.
     *
     * @param result query result to serialize
     * @param destination output file
     * @throws IOException if the file cannot be written
     * @throws IllegalArgumentException if a value has a type the format cannot represent
     */
    void write(QueryResult result, Path destination) throws IOException;

    /**
     * Returns the format this writer produces.
     *
     * @return export format
     */
    ExportFormat getFormat();
}
