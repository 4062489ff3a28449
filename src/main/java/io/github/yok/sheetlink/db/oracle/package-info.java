/**
 * Oracle dialect.
 */
package io.github.yok.sheetlink.db.oracle;
