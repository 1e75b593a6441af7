package io.github.yok.roomlink.writer;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.github.yok.roomlink.model.QueryResult;
import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Implementation of {@link ResultWriter} that writes a result as a JSON array with one object per
 * row (the records format).
 *
 * <p>
 * Keys follow the column order. Output is UTF-8, indented by four spaces, and non-ASCII characters
 * are written as-is.
 * </p>
 *
 * <p>
 * <strong>Value mapping:</strong>
 * </p>
 * <ul>
 * <li>{@code null}, {@link String}, {@link Boolean} and the primitive wrapper numbers are written
 * natively; {@link Character} is written as a string.</li>
 * <li>{@link BigDecimal} is widened to {@code double}, so {@code 12.50} becomes {@code 12.5}.</li>
 * <li>Any other type is rejected with {@link IllegalArgumentException}.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public class JsonResultWriter implements ResultWriter {

    private static final String INDENT = "    ";

    private final ObjectWriter writer;

    /**
     * Creates a writer with the records-format pretty printer.
     */
    public JsonResultWriter() {
        DefaultIndenter indenter = new DefaultIndenter(INDENT, "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withSeparators(Separators.createDefaultInstance()
                        .withObjectFieldValueSpacing(Separators.Spacing.AFTER))
                .withObjectIndenter(indenter).withArrayIndenter(indenter);
        this.writer = new ObjectMapper().writer(new RecordsPrettyPrinter(printer));
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void write(QueryResult result, Path destination) throws IOException {
        List<Map<String, Object>> records = toRecords(result);
        try (Writer out = Files.newBufferedWriter(destination, StandardCharsets.UTF_8)) {
            writer.writeValue(out, records);
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public ExportFormat getFormat() {
        return ExportFormat.RECORDS;
    }

    /**
     * Converts the rows of a result into JSON-ready records.
     *
     * @param result query result
     * @return one map per row with converted values, keys in column order
     * @throws IllegalArgumentException if a value has an unsupported type
     */
    static List<Map<String, Object>> toRecords(QueryResult result) {
        List<Map<String, Object>> records = new ArrayList<>(result.getRowCount());
        for (Map<String, Object> row : result.getRows()) {
            Map<String, Object> rec = new LinkedHashMap<>();
            row.forEach((col, val) -> rec.put(col, toJsonValue(val)));
            records.add(rec);
        }
        return records;
    }

    /**
     * Converts one database value into a value Jackson writes as a JSON scalar.
     *
     * @param value value from {@code ResultSet#getObject}
     * @return JSON-ready value
     * @throws IllegalArgumentException if the type has no JSON representation
     */
    static Object toJsonValue(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean
                || value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof Double || value instanceof Float
                || value instanceof BigInteger) {
            return value;
        }
        if (value instanceof Character) {
            return value.toString();
        }
        if (value instanceof BigDecimal) {
            double widened = ((BigDecimal) value).doubleValue();
            if (Double.isInfinite(widened)) {
                throw new IllegalArgumentException(
                        "Decimal value out of double range: " + value);
            }
            return widened;
        }
        throw new IllegalArgumentException(
                "Object of type " + value.getClass().getSimpleName() + " is not JSON serializable");
    }

    /**
     * Pretty printer that closes an empty array without inner whitespace ({@code []}).
     */
    static final class RecordsPrettyPrinter extends DefaultPrettyPrinter {

        private static final long serialVersionUID = 1L;

        RecordsPrettyPrinter(DefaultPrettyPrinter base) {
            super(base);
        }

        @Override
        public RecordsPrettyPrinter createInstance() {
            return new RecordsPrettyPrinter(this);
        }

        @Override
        public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
            if (nrOfValues > 0) {
                super.writeEndArray(g, nrOfValues);
                return;
            }
            if (!_arrayIndenter.isInline()) {
                --_nesting;
            }
            g.writeRaw(']');
        }
    }
}
