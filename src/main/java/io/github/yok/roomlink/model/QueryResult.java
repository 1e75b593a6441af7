package io.github.yok.roomlink.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of one statement of a query file: the column labels reported by the database and the
 * fetched rows.
 *
 * <p>
 * Each row maps column label to value in column order. When two columns share a label the later
 * value wins, which matches how the labels are used as JSON keys and XML element names.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public class QueryResult {

    // SQL text that produced this result
    private final String statement;

    private final List<String> columns;

    private final List<Map<String, Object>> rows = new ArrayList<>();

    /**
     * Creates an empty result for the given statement and columns.
     *
     * @param statement SQL text
     * @param columns column labels in select-list order
     */
    public QueryResult(String statement, List<String> columns) {
        this.statement = statement;
        this.columns = List.copyOf(columns);
    }

    /**
     * Appends a row given as values in column order.
     *
     * @param values one value per column; must have the same size as {@link #getColumns()}
     * @throws IllegalArgumentException if the value count does not match the column count
     */
    public void addRow(List<Object> values) {
        if (values.size() != columns.size()) {
            throw new IllegalArgumentException("Expected " + columns.size() + " values but got "
                    + values.size() + " for statement: " + statement);
        }
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            row.put(columns.get(i), values.get(i));
        }
        rows.add(row);
    }

    /**
     * Returns the rows as an unmodifiable view.
     *
     * @return rows in fetch order
     */
    public List<Map<String, Object>> getRows() {
        return Collections.unmodifiableList(rows);
    }

    /**
     * Returns the number of fetched rows.
     *
     * @return row count
     */
    public int getRowCount() {
        return rows.size();
    }
}
