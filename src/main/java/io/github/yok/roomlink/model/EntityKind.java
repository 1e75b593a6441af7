package io.github.yok.roomlink.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * The two record kinds loaded from JSON files and the table each one is written to.
 *
 * <p>
 * Column order is the order used in the generated {@code INSERT}. Every table uses {@code id} as
 * its primary key; rows whose {@code id} already exists are skipped.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum EntityKind {

    // Grouping entity (container): a room
    ROOM("room", columns("id", ColumnType.INTEGER, "name", ColumnType.VARCHAR)),

    // Individual entity (member): a student referencing a room
    STUDENT("student",
            columns("birthday", ColumnType.TIMESTAMP, "id", ColumnType.INTEGER, "name",
                    ColumnType.VARCHAR, "room", ColumnType.INTEGER, "sex", ColumnType.CHAR));

    // Key column used by the ON CONFLICT clause
    public static final String KEY_COLUMN = "id";

    private final String table;

    // column name -> type, in insert order
    private final Map<String, ColumnType> columns;

    EntityKind(String table, Map<String, ColumnType> columns) {
        this.table = table;
        this.columns = columns;
    }

    /**
     * Returns the column names in insert order.
     *
     * @return column names
     */
    public List<String> getColumnNames() {
        return List.copyOf(columns.keySet());
    }

    /**
     * Builds the idempotent insert statement for this kind.
     *
     * @return parameterized SQL such as
     *         {@code INSERT INTO room (id, name) VALUES (?, ?) ON CONFLICT (id) DO NOTHING}
     */
    public String insertSql() {
        String cols = String.join(", ", columns.keySet());
        String params = columns.keySet().stream().map(c -> "?").collect(Collectors.joining(", "));
        return "INSERT INTO " + table + " (" + cols + ") VALUES (" + params + ") ON CONFLICT ("
                + KEY_COLUMN + ") DO NOTHING";
    }

    private static Map<String, ColumnType> columns(Object... nameTypePairs) {
        Map<String, ColumnType> map = new LinkedHashMap<>();
        for (int i = 0; i < nameTypePairs.length; i += 2) {
            map.put((String) nameTypePairs[i], (ColumnType) nameTypePairs[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
