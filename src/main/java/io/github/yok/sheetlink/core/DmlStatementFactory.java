package io.github.yok.sheetlink.core;

import io.github.yok.sheetlink.db.DbDialectHandler;
import io.github.yok.sheetlink.db.SqlParameter;
import io.github.yok.sheetlink.db.SqlStatement;
import io.github.yok.sheetlink.mapping.CompiledMapping;
import io.github.yok.sheetlink.mapping.MappedRow;
import io.github.yok.sheetlink.schema.ColumnDescriptor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the parameterized INSERT and UPDATE statements of a compiled mapping.
 *
 * <p>
 * Identifiers are quoted by the dialect; values are never inlined.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class DmlStatementFactory {

    private final DbDialectHandler dialect;
    private final List<ColumnDescriptor> insertColumns;
    private final List<ColumnDescriptor> updateColumns;
    private final ColumnDescriptor keyColumn;
    private final String tableName;
    private final String insertPrefix;
    private final String rowPlaceholders;
    private final String updateSql;

    public DmlStatementFactory(DbDialectHandler dialect, CompiledMapping mapping) {
        this.dialect = dialect;
        this.insertColumns = mapping.getTargetColumns();
        this.updateColumns = mapping.getUpdateColumns();
        this.keyColumn = mapping.getKeyColumn();
        this.tableName = dialect.qualifiedTableName(mapping.getSchema().getIdentifier());
        this.insertPrefix = "INSERT INTO " + tableName + " ("
                + insertColumns.stream().map(c -> dialect.quoteIdentifier(c.getName()))
                        .collect(Collectors.joining(", "))
                + ") VALUES ";
        this.rowPlaceholders =
                "(" + String.join(", ", Collections.nCopies(insertColumns.size(), "?")) + ")";
        this.updateSql = keyColumn == null ? null : buildUpdateSql();
    }

    /**
     * Returns the key column name of an update mapping.
     *
     * @return key column in catalog spelling, {@code null} for insert mappings
     */
    public String getKeyColumnName() {
        return keyColumn == null ? null : keyColumn.getName();
    }

    /**
     * Returns the number of rows one multi-row INSERT may carry.
     *
     * @return rows per statement, at least 1
     */
    public int getRowsPerInsert() {
        if (!dialect.supportsMultiRowInsert()) {
            return 1;
        }
        int byParameters = dialect.getMaxParametersPerStatement() / insertColumns.size();
        return Math.max(1, Math.min(dialect.getMaxRowsPerInsert(), byParameters));
    }

    /**
     * Builds multi-row INSERT statements for a chunk, split to honor the dialect limits.
     *
     * @param rows rows in source order
     * @return statements in source order
     */
    public List<SqlStatement> multiRowInserts(List<MappedRow> rows) {
        int perStatement = getRowsPerInsert();
        List<SqlStatement> statements = new ArrayList<>();
        for (int from = 0; from < rows.size(); from += perStatement) {
            List<MappedRow> slice = rows.subList(from, Math.min(rows.size(), from + perStatement));
            StringBuilder sql = new StringBuilder(insertPrefix);
            List<SqlParameter> parameters = new ArrayList<>(slice.size() * insertColumns.size());
            for (int i = 0; i < slice.size(); i++) {
                if (i > 0) {
                    sql.append(", ");
                }
                sql.append(rowPlaceholders);
                parameters.addAll(insertParameters(slice.get(i)));
            }
            statements.add(new SqlStatement(sql.toString(), parameters));
        }
        return statements;
    }

    /**
     * Returns the single-row INSERT text.
     *
     * @return {@code INSERT INTO t (c1, ...) VALUES (?, ...)}
     */
    public String insertSql() {
        return insertPrefix + rowPlaceholders;
    }

    /**
     * Builds the single-row INSERT of one row.
     *
     * @param row mapped row
     * @return statement
     */
    public SqlStatement insert(MappedRow row) {
        return new SqlStatement(insertSql(), insertParameters(row));
    }

    /**
     * Returns the bind values of one row in INSERT column order.
     *
     * @param row mapped row
     * @return parameters
     */
    public List<SqlParameter> insertParameters(MappedRow row) {
        List<SqlParameter> parameters = new ArrayList<>(insertColumns.size());
        for (ColumnDescriptor column : insertColumns) {
            parameters.add(new SqlParameter(row.getValue(column.getName()), column.getJdbcType()));
        }
        return parameters;
    }

    /**
     * Builds the keyed UPDATE of one row: every mapped column except the key in the SET clause,
     * key equality in the WHERE clause.
     *
     * @param row mapped row with a non-null key value
     * @return statement
     * @throws IllegalStateException if the mapping has no key column
     */
    public SqlStatement update(MappedRow row) {
        if (updateSql == null) {
            throw new IllegalStateException("Mapping for " + tableName + " has no key column");
        }
        List<SqlParameter> parameters = new ArrayList<>(updateColumns.size() + 1);
        for (ColumnDescriptor column : updateColumns) {
            parameters.add(new SqlParameter(row.getValue(column.getName()), column.getJdbcType()));
        }
        parameters.add(new SqlParameter(row.getValue(keyColumn.getName()),
                keyColumn.getJdbcType()));
        return new SqlStatement(updateSql, parameters);
    }

    private String buildUpdateSql() {
        return "UPDATE " + tableName + " SET "
                + updateColumns.stream().map(c -> dialect.quoteIdentifier(c.getName()) + " = ?")
                        .collect(Collectors.joining(", "))
                + " WHERE " + dialect.quoteIdentifier(keyColumn.getName()) + " = ?";
    }
}
