package io.github.yok.sheetlink.db;

import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Parameterized SQL text with its bind values in placeholder order.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public final class SqlStatement {

    private final String sql;
    private final List<SqlParameter> parameters;

    public SqlStatement(String sql, List<SqlParameter> parameters) {
        this.sql = sql;
        this.parameters = parameters == null ? Collections.emptyList()
                : ImmutableList.copyOf(parameters);
    }
}
