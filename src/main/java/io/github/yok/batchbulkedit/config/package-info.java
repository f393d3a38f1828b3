/**
 * Configuration model package for Batch Bulk Edit.
 *
 * <p>
 * Defines classes that represent values loaded from {@code application.yml}: how recipe documents
 * are read and validated, where updated documents are written, and how exported workbooks look.
 * </p>
 *
 * <p>
 * This package only holds configuration data; execution logic is implemented in {@code parser}
 * and {@code core}.
 * </p>
 */
package io.github.yok.batchbulkedit.config;
