package io.github.yok.sheetlink.db.h2;

import io.github.yok.sheetlink.db.AbstractDbDialectHandler;
import io.github.yok.sheetlink.db.DatabaseProduct;

/**
 * Dialect handler for H2, used for local trials and embedded targets.
 *
 * @author Yasuharu.Okawauchi
 */
public class H2DialectHandler extends AbstractDbDialectHandler {

    @Override
    public DatabaseProduct getProduct() {
        return DatabaseProduct.H2;
    }

    @Override
    public String getErrorCodesDatabaseName() {
        return "H2";
    }

    @Override
    public int getMaxParametersPerStatement() {
        return 10000;
    }
}
