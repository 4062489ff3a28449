/**
 * Configuration model package for SheetLink.
 *
 * <p>
 * Defines classes that represent values loaded from {@code application.yml}: named connection
 * settings and import settings such as chunk size and the failure log location.
 * </p>
 *
 * <p>
 * This package primarily holds configuration data; execution logic is implemented in {@code core}
 * and {@code db}.
 * </p>
 */
package io.github.yok.sheetlink.config;
