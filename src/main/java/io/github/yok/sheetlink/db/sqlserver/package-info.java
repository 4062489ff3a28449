/**
 * SQL Server dialect.
 */
package io.github.yok.sheetlink.db.sqlserver;
