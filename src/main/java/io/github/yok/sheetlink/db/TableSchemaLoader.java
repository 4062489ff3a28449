package io.github.yok.sheetlink.db;

import io.github.yok.sheetlink.schema.ColumnDescriptor;
import io.github.yok.sheetlink.schema.DataKind;
import io.github.yok.sheetlink.schema.SchemaNotFoundException;
import io.github.yok.sheetlink.schema.TableIdentifier;
import io.github.yok.sheetlink.schema.TableSchema;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Reads the description of an existing table from the database catalog.
 *
 * <h2>Identifier handling</h2>
 *
 * <p>
 * The table is first looked up with the spelling the caller gave. When the catalog returns no
 * columns, the lookup is repeated with schema and table normalized to the case the database stores
 * unquoted identifiers in ({@link DatabaseMetaData#storesUpperCaseIdentifiers()},
 * {@link DatabaseMetaData#storesLowerCaseIdentifiers()}), so {@code customers} finds
 * {@code CUSTOMERS} on H2 or Oracle.
 * </p>
 *
 * <p>
 * Without an explicit schema the connection's current schema is used. Products without schemas in
 * table definitions (MySQL) expose databases as catalogs, so a schema part is treated as the
 * catalog there.
 * </p>
 *
 * <p>
 * Nothing is cached: every call reads the catalog again.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TableSchemaLoader {

    /**
     * Loads the schema of a table.
     *
     * @param connection open connection used only for {@link DatabaseMetaData} access
     * @param table table identifier as entered by the user
     * @return table schema with the identifier in catalog spelling
     * @throws SchemaNotFoundException if the table does not exist, has no visible columns, or the
     *         catalog cannot be read
     */
    public TableSchema loadSchema(Connection connection, TableIdentifier table)
            throws SchemaNotFoundException {
        Validate.isTrue(connection != null, "connection must not be null.");
        Validate.isTrue(table != null, "table must not be null.");
        try {
            DatabaseMetaData meta = connection.getMetaData();
            boolean schemasSupported = meta.supportsSchemasInTableDefinitions();

            String catalog = table.getCatalog();
            String schema = table.getSchema();
            if (!schemasSupported) {
                if (catalog == null) {
                    catalog = schema != null ? schema : connection.getCatalog();
                }
                schema = null;
            } else if (schema == null) {
                schema = connection.getSchema();
            }

            List<ColumnRow> rows = readColumns(meta, catalog, schema, table.getTable());
            if (rows.isEmpty()) {
                String normalizedSchema = normalizeIdentifier(meta, schema);
                String normalizedTable = normalizeIdentifier(meta, table.getTable());
                if (!StringUtils.equals(normalizedSchema, schema)
                        || !normalizedTable.equals(table.getTable())) {
                    log.debug("No columns for {}.{}; retrying as {}.{}", schema, table.getTable(),
                            normalizedSchema, normalizedTable);
                    rows = readColumns(meta, catalog, normalizedSchema, normalizedTable);
                }
            }
            if (rows.isEmpty()) {
                throw new SchemaNotFoundException(table,
                        "Table not found or has no visible columns: " + table);
            }

            ColumnRow first = rows.get(0);
            String resolvedCatalog =
                    table.getCatalog() != null || !schemasSupported ? first.catalog : null;
            TableIdentifier resolved =
                    new TableIdentifier(resolvedCatalog, first.schema, first.table);

            List<String> keyNames = readPrimaryKeys(meta, first.catalog, first.schema, first.table);
            Set<String> keySet = new HashSet<>(keyNames);

            rows.sort(Comparator.comparingInt(r -> r.ordinal));
            List<ColumnDescriptor> columns = new ArrayList<>(rows.size());
            for (ColumnRow row : rows) {
                columns.add(ColumnDescriptor.builder().name(row.name).ordinal(row.ordinal)
                        .kind(DataKind.fromJdbcType(row.jdbcType)).jdbcType(row.jdbcType)
                        .typeName(row.typeName).size(row.size).scale(row.scale)
                        .nullable(row.nullable).hasDefault(row.hasDefault)
                        .primaryKey(keySet.contains(row.name)).build());
            }

            TableSchema result = new TableSchema(resolved, columns, keyNames);
            log.info("Loaded schema of {}: {} columns, primary key {}", resolved, columns.size(),
                    keyNames);
            return result;
        } catch (SQLException e) {
            throw new SchemaNotFoundException(table,
                    "Failed to read catalog for " + table + ": " + e.getMessage(), e);
        }
    }

    private List<ColumnRow> readColumns(DatabaseMetaData meta, String catalog, String schema,
            String table) throws SQLException {
        String escape = meta.getSearchStringEscape();
        List<ColumnRow> rows = new ArrayList<>();
        try (ResultSet rs = meta.getColumns(catalog, escapePattern(schema, escape),
                escapePattern(table, escape), null)) {
            Set<String> labels = columnLabels(rs.getMetaData());
            while (rs.next()) {
                // The pattern may still match other tables when the driver ignores the escape
                if (!table.equals(rs.getString("TABLE_NAME"))) {
                    continue;
                }
                if (schema != null && !schema.equals(rs.getString("TABLE_SCHEM"))) {
                    continue;
                }
                ColumnRow row = new ColumnRow();
                row.catalog = rs.getString("TABLE_CAT");
                row.schema = rs.getString("TABLE_SCHEM");
                row.table = rs.getString("TABLE_NAME");
                row.name = rs.getString("COLUMN_NAME");
                row.ordinal = rs.getInt("ORDINAL_POSITION");
                row.jdbcType = rs.getInt("DATA_TYPE");
                row.typeName = rs.getString("TYPE_NAME");
                row.size = rs.getInt("COLUMN_SIZE");
                row.scale = rs.getInt("DECIMAL_DIGITS");
                row.nullable = rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls;
                boolean autoIncrement = labels.contains("IS_AUTOINCREMENT")
                        && "YES".equalsIgnoreCase(rs.getString("IS_AUTOINCREMENT"));
                boolean generated = labels.contains("IS_GENERATEDCOLUMN")
                        && "YES".equalsIgnoreCase(rs.getString("IS_GENERATEDCOLUMN"));
                row.hasDefault = rs.getString("COLUMN_DEF") != null || autoIncrement || generated;
                rows.add(row);
            }
        }
        return rows;
    }

    private List<String> readPrimaryKeys(DatabaseMetaData meta, String catalog, String schema,
            String table) throws SQLException {
        TreeMap<Short, String> bySequence = new TreeMap<>();
        try (ResultSet rs = meta.getPrimaryKeys(catalog, schema, table)) {
            while (rs.next()) {
                bySequence.put(rs.getShort("KEY_SEQ"), rs.getString("COLUMN_NAME"));
            }
        }
        return new ArrayList<>(bySequence.values());
    }

    private static Set<String> columnLabels(ResultSetMetaData rsmd) throws SQLException {
        Set<String> labels = new HashSet<>();
        for (int i = 1; i <= rsmd.getColumnCount(); i++) {
            labels.add(rsmd.getColumnLabel(i).toUpperCase(Locale.ROOT));
        }
        return labels;
    }

    /**
     * Escapes the metadata wildcards {@code _} and {@code %} so that names match literally.
     *
     * @param name identifier; may be {@code null}
     * @param escape search string escape of the driver; may be {@code null} or empty
     * @return escaped pattern, or {@code null} if input is {@code null}
     */
    static String escapePattern(String name, String escape) {
        if (name == null || StringUtils.isEmpty(escape)) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name.length() + 4);
        for (char c : name.toCharArray()) {
            if (c == '_' || c == '%' || escape.indexOf(c) >= 0) {
                sb.append(escape);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private static String normalizeIdentifier(DatabaseMetaData meta, String identifier)
            throws SQLException {
        if (identifier == null) {
            return null;
        }
        if (meta.storesUpperCaseIdentifiers()) {
            return identifier.toUpperCase(Locale.ROOT);
        }
        if (meta.storesLowerCaseIdentifiers()) {
            return identifier.toLowerCase(Locale.ROOT);
        }
        return identifier;
    }

    /**
     * One row of {@link DatabaseMetaData#getColumns}.
     */
    private static final class ColumnRow {
        private String catalog;
        private String schema;
        private String table;
        private String name;
        private int ordinal;
        private int jdbcType;
        private String typeName;
        private int size;
        private int scale;
        private boolean nullable;
        private boolean hasDefault;
    }
}
