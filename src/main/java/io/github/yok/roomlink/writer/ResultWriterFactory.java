package io.github.yok.roomlink.writer;

import lombok.Generated;

/**
 * Factory for the {@link ResultWriter} of an {@link ExportFormat}.
 *
 * <ul>
 * <li>{@link ExportFormat#RECORDS} → {@link JsonResultWriter}</li>
 * <li>{@link ExportFormat#MARKUP} → {@link XmlResultWriter}</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public final class ResultWriterFactory {

    @Generated
    private ResultWriterFactory() {}

    /**
     * Creates a writer for the given format.
     *
     * @param format export format
     * @return new writer instance
     */
    public static ResultWriter create(ExportFormat format) {
        switch (format) {
            case RECORDS:
                return new JsonResultWriter();
            case MARKUP:
                return new XmlResultWriter();
            default:
                throw new IllegalArgumentException("Unsupported export format: " + format);
        }
    }
}
