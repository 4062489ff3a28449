package io.github.yok.sheetlink.schema;

import java.sql.Types;

/**
 * Coarse classification of a column's SQL type, used to pick a value coercion.
 *
 * @author Yasuharu.Okawauchi
 */
public enum DataKind {

    // Character data (CHAR, VARCHAR, NVARCHAR, CLOB, ...)
    TEXT,

    // Integral numbers (TINYINT to BIGINT)
    INTEGER,

    // Exact or approximate numbers with a fraction (DECIMAL, NUMERIC, FLOAT, DOUBLE, REAL)
    DECIMAL,

    // Calendar date without time
    DATE,

    // Date with time of day (TIMESTAMP and its time-zone variants)
    DATETIME,

    // Time of day without date
    TIME,

    // BIT / BOOLEAN
    BOOLEAN,

    // Binary data (BINARY, VARBINARY, BLOB)
    BINARY,

    // Anything else; values pass through to the driver
    OTHER;

    /**
     * Classifies a JDBC type code.
     *
     * <p>
     * SQL Server reports {@code datetimeoffset} as vendor code {@code -155}; it is treated as
     * {@link #DATETIME}.
     * </p>
     *
     * @param jdbcType type code from {@link java.sql.DatabaseMetaData#getColumns}
     * @return matching kind, {@link #OTHER} when not recognized
     */
    public static DataKind fromJdbcType(int jdbcType) {
        switch (jdbcType) {
            case Types.CHAR:
            case Types.VARCHAR:
            case Types.LONGVARCHAR:
            case Types.NCHAR:
            case Types.NVARCHAR:
            case Types.LONGNVARCHAR:
            case Types.CLOB:
            case Types.NCLOB:
                return TEXT;
            case Types.TINYINT:
            case Types.SMALLINT:
            case Types.INTEGER:
            case Types.BIGINT:
                return INTEGER;
            case Types.DECIMAL:
            case Types.NUMERIC:
            case Types.FLOAT:
            case Types.REAL:
            case Types.DOUBLE:
                return DECIMAL;
            case Types.DATE:
                return DATE;
            case Types.TIMESTAMP:
            case Types.TIMESTAMP_WITH_TIMEZONE:
            case -155:
                return DATETIME;
            case Types.TIME:
            case Types.TIME_WITH_TIMEZONE:
                return TIME;
            case Types.BIT:
            case Types.BOOLEAN:
                return BOOLEAN;
            case Types.BINARY:
            case Types.VARBINARY:
            case Types.LONGVARBINARY:
            case Types.BLOB:
                return BINARY;
            default:
                return OTHER;
        }
    }
}
