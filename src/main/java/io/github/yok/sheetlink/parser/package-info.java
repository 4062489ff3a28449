/**
 * Source reader package.
 *
 * <p>
 * Opens spreadsheet sheets ({@code .xlsx}, {@code .xlsm}, {@code .xls}) and delimited text files
 * as forward-only row streams with a normalized header. Entry point is
 * {@link io.github.yok.sheetlink.parser.SourceReaderFactory}.
 * </p>
 */
package io.github.yok.sheetlink.parser;
