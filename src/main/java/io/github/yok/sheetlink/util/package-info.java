/**
 * Utility package for SheetLink.
 *
 * <p>
 * Holds the command-line error reporter shared by the entry point.
 * </p>
 */
package io.github.yok.sheetlink.util;
