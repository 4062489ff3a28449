package io.github.yok.sheetlink.db.sqlserver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import io.github.yok.sheetlink.db.DatabaseProduct;
import io.github.yok.sheetlink.schema.TableIdentifier;
import java.sql.Connection;
import org.junit.jupiter.api.Test;

public class SqlServerDialectHandlerTest {

    private final SqlServerDialectHandler handler = new SqlServerDialectHandler();

    @Test
    void quoteIdentifier_正常ケース_閉じ括弧を含む_二重化されて角括弧で囲まれること() {
        assertEquals("[Order Items]", handler.quoteIdentifier("Order Items"));
        assertEquals("[a]]b]", handler.quoteIdentifier("a]b"));
    }

    @Test
    void qualifiedTableName_正常ケース_三部構成名_各部が角括弧で囲まれること() {
        assertEquals("[sales].[dbo].[Customers]",
                handler.qualifiedTableName(new TableIdentifier("sales", "dbo", "Customers")));
    }

    @Test
    void prepareConnection_正常ケース_何も実行されないこと() throws Exception {
        Connection connection = mock(Connection.class);
        handler.prepareConnection(connection);
        verifyNoInteractions(connection);
    }

    @Test
    void getters_正常ケース_パラメータ上限が2000であること() {
        assertEquals(2000, handler.getMaxParametersPerStatement());
        assertEquals("MS-SQL", handler.getErrorCodesDatabaseName());
        assertEquals(DatabaseProduct.SQLSERVER, handler.getProduct());
    }
}
