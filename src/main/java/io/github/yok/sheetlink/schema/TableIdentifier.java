package io.github.yok.sheetlink.schema;

import java.util.ArrayList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * Name of a table, optionally qualified by catalog and schema.
 *
 * <p>
 * Accepted forms are {@code table}, {@code schema.table} and {@code catalog.schema.table}. Each
 * part may be wrapped in {@code [brackets]}, {@code "double quotes"} or {@code `backticks`}; the
 * delimiters are removed and dots inside them are kept.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
public final class TableIdentifier {

    private final String catalog;
    private final String schema;
    private final String table;

    /**
     * Creates an identifier from its parts.
     *
     * @param catalog catalog name, or {@code null}
     * @param schema schema name, or {@code null}
     * @param table table name
     * @throws IllegalArgumentException if {@code table} is blank
     */
    public TableIdentifier(String catalog, String schema, String table) {
        if (StringUtils.isBlank(table)) {
            throw new IllegalArgumentException("table name must not be blank");
        }
        this.catalog = StringUtils.trimToNull(catalog);
        this.schema = StringUtils.trimToNull(schema);
        this.table = table.trim();
    }

    /**
     * Parses a possibly qualified table name.
     *
     * @param qualifiedName name such as {@code dbo.Customers} or {@code [dbo].[Order Items]}
     * @return parsed identifier
     * @throws IllegalArgumentException if the name is blank or has more than three parts
     */
    public static TableIdentifier parse(String qualifiedName) {
        if (StringUtils.isBlank(qualifiedName)) {
            throw new IllegalArgumentException("table name must not be blank");
        }
        List<String> parts = split(qualifiedName.trim());
        if (parts.size() == 1) {
            return new TableIdentifier(null, null, parts.get(0));
        }
        if (parts.size() == 2) {
            return new TableIdentifier(null, parts.get(0), parts.get(1));
        }
        if (parts.size() == 3) {
            return new TableIdentifier(parts.get(0), parts.get(1), parts.get(2));
        }
        throw new IllegalArgumentException("Invalid table name: " + qualifiedName);
    }

    private static List<String> split(String value) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char closing = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (closing != 0) {
                if (c == closing) {
                    closing = 0;
                } else {
                    current.append(c);
                }
                continue;
            }
            if (c == '[') {
                closing = ']';
            } else if (c == '"' || c == '`') {
                closing = c;
            } else if (c == '.') {
                parts.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (closing != 0) {
            throw new IllegalArgumentException("Unterminated quoted identifier: " + value);
        }
        parts.add(current.toString().trim());
        for (String part : parts) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("Invalid table name: " + value);
            }
        }
        return parts;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (catalog != null) {
            sb.append(catalog).append('.');
        }
        if (schema != null) {
            sb.append(schema).append('.');
        }
        return sb.append(table).toString();
    }
}
