/**
 * MySQL dialect.
 */
package io.github.yok.sheetlink.db.mysql;
