/**
 * PostgreSQL dialect.
 */
package io.github.yok.sheetlink.db.postgresql;
