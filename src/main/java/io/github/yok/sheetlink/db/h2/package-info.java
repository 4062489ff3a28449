/**
 * H2 dialect.
 */
package io.github.yok.sheetlink.db.h2;
