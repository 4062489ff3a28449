/**
 * Import workflow package.
 *
 * <p>
 * {@link io.github.yok.sheetlink.core.ImportService} prepares a run (connection, schema, source,
 * mapping) and {@link io.github.yok.sheetlink.core.BatchExecutor} writes the rows in chunk-sized
 * transactions with row-by-row recovery. Per-row failures and fatal errors are collected in the
 * {@link io.github.yok.sheetlink.core.BatchResult} and appended to a
 * {@link io.github.yok.sheetlink.core.FailureLog}.
 * </p>
 *
 * <p>
 * Database-specific differences (quoting, statement limits, binding, error codes) are delegated to
 * handlers in {@code db}.
 * </p>
 */
package io.github.yok.sheetlink.core;
