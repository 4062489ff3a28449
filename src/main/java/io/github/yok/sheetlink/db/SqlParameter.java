package io.github.yok.sheetlink.db;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * One bind value together with the JDBC type of its target column.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public final class SqlParameter {

    // Coerced value, may be null
    private final Object value;
    // java.sql.Types code of the column, used to bind null
    private final int jdbcType;
}
