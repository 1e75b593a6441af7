package io.github.yok.roomlink.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.yok.roomlink.util.TimestampParser;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import lombok.Getter;

/**
 * Column types of the loaded tables and how a JSON field value is bound to a statement parameter.
 *
 * <p>
 * A missing field and an explicit JSON {@code null} are both bound as SQL {@code NULL} of
 * {@link #getSqlType()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum ColumnType {

    INTEGER(Types.INTEGER) {
        @Override
        void bindValue(PreparedStatement ps, int index, String field, JsonNode value)
                throws SQLException {
            if (value.isIntegralNumber() && value.canConvertToInt()) {
                ps.setInt(index, value.intValue());
                return;
            }
            if (value.isTextual()) {
                try {
                    ps.setInt(index, Integer.parseInt(value.textValue().trim()));
                    return;
                } catch (NumberFormatException e) {
                    throw invalid(field, value, e);
                }
            }
            throw invalid(field, value, null);
        }
    },

    VARCHAR(Types.VARCHAR) {
        @Override
        void bindValue(PreparedStatement ps, int index, String field, JsonNode value)
                throws SQLException {
            if (value.isContainerNode()) {
                throw invalid(field, value, null);
            }
            ps.setString(index, value.asText());
        }
    },

    CHAR(Types.CHAR) {
        @Override
        void bindValue(PreparedStatement ps, int index, String field, JsonNode value)
                throws SQLException {
            if (!value.isTextual()) {
                throw invalid(field, value, null);
            }
            ps.setString(index, value.textValue());
        }
    },

    TIMESTAMP(Types.TIMESTAMP) {
        @Override
        void bindValue(PreparedStatement ps, int index, String field, JsonNode value)
                throws SQLException {
            if (!value.isTextual()) {
                throw invalid(field, value, null);
            }
            Timestamp ts;
            try {
                ts = TimestampParser.parse(value.textValue());
            } catch (IllegalArgumentException e) {
                throw invalid(field, value, e);
            }
            if (ts == null) {
                ps.setNull(index, getSqlType());
            } else {
                ps.setTimestamp(index, ts);
            }
        }
    };

    // java.sql.Types constant used for NULL binding
    private final int sqlType;

    ColumnType(int sqlType) {
        this.sqlType = sqlType;
    }

    /**
     * Binds a JSON field value to the given parameter.
     *
     * @param ps target statement
     * @param index 1-based parameter index
     * @param field field name, used in error messages
     * @param value field value; {@code null} when the field is absent
     * @throws SQLException if the driver rejects the parameter
     * @throws IllegalArgumentException if the value cannot be converted to this type
     */
    public void bind(PreparedStatement ps, int index, String field, JsonNode value)
            throws SQLException {
        if (value == null || value.isNull() || value.isMissingNode()) {
            ps.setNull(index, sqlType);
            return;
        }
        bindValue(ps, index, field, value);
    }

    abstract void bindValue(PreparedStatement ps, int index, String field, JsonNode value)
            throws SQLException;

    IllegalArgumentException invalid(String field, JsonNode value, Exception cause) {
        return new IllegalArgumentException(
                "Field '" + field + "' is not convertible to " + name() + ": " + value, cause);
    }
}
