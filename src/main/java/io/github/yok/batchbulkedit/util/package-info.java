/**
 * Utility package for Batch Bulk Edit.
 *
 * <p>
 * Provides reusable helpers used across the project: JAXP DOM access to recipe documents,
 * spreadsheet cell rendering, console step progress, error reporting and log-path rendering.
 * </p>
 *
 * <p>
 * Utilities in this package are stateless, except {@code StepRunner}, which counts the steps of
 * one command.
 * </p>
 */
package io.github.yok.batchbulkedit.util;
