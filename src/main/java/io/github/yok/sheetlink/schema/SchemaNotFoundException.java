package io.github.yok.sheetlink.schema;

import io.github.yok.sheetlink.ImportSetupException;
import lombok.Getter;

/**
 * Thrown when a target table cannot be described from the catalog.
 *
 * <p>
 * Covers a table that does not exist as well as a catalog that cannot be read (for example, a
 * missing privilege).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class SchemaNotFoundException extends ImportSetupException {

    private static final long serialVersionUID = 1L;

    private final transient TableIdentifier table;

    public SchemaNotFoundException(TableIdentifier table, String message) {
        super(message);
        this.table = table;
    }

    public SchemaNotFoundException(TableIdentifier table, String message, Throwable cause) {
        super(message, cause);
        this.table = table;
    }

    @Override
    public String getErrorCode() {
        return "SCHEMA_NOT_FOUND";
    }
}
