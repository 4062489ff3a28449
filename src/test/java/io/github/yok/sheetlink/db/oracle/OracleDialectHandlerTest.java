package io.github.yok.sheetlink.db.oracle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.sheetlink.db.DatabaseProduct;
import io.github.yok.sheetlink.schema.TableIdentifier;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.sql.Types;
import org.junit.jupiter.api.Test;

public class OracleDialectHandlerTest {

    private final OracleDialectHandler handler = new OracleDialectHandler();

    @Test
    void bindValue_正常ケース_Booleanを指定する_1と0で設定されること() throws Exception {
        PreparedStatement ps = mock(PreparedStatement.class);

        handler.bindValue(ps, 1, Boolean.TRUE, Types.NUMERIC);
        handler.bindValue(ps, 2, Boolean.FALSE, Types.NUMERIC);

        verify(ps).setInt(1, 1);
        verify(ps).setInt(2, 0);
    }

    @Test
    void bindValue_正常ケース_その他の値を指定する_共通処理で設定されること() throws Exception {
        PreparedStatement ps = mock(PreparedStatement.class);
        byte[] bytes = {1, 2};

        handler.bindValue(ps, 1, null, Types.VARCHAR);
        handler.bindValue(ps, 2, bytes, Types.BLOB);
        handler.bindValue(ps, 3, BigDecimal.ONE, Types.NUMERIC);

        verify(ps).setNull(1, Types.VARCHAR);
        verify(ps).setBytes(2, bytes);
        verify(ps).setObject(3, BigDecimal.ONE);
    }

    @Test
    void prepareConnection_正常ケース_接続を指定する_数値書式が設定されること() throws Exception {
        Connection connection = mock(Connection.class);
        Statement statement = mock(Statement.class);
        when(connection.createStatement()).thenReturn(statement);

        handler.prepareConnection(connection);

        verify(statement).execute("ALTER SESSION SET NLS_NUMERIC_CHARACTERS = '.,'");
    }

    @Test
    void getters_正常ケース_複数行INSERT非対応であること() {
        assertFalse(handler.supportsMultiRowInsert());
        assertEquals(DatabaseProduct.ORACLE, handler.getProduct());
        assertEquals("Oracle", handler.getErrorCodesDatabaseName());
        assertEquals("\"HR\".\"EMP\"",
                handler.qualifiedTableName(new TableIdentifier(null, "HR", "EMP")));
    }
}
