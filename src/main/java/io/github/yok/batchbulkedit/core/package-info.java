/**
 * Core export/import workflow package.
 *
 * <p>
 * Turns recipe trees into a workbook ({@code ExcelExporter}), reconciles an edited workbook with
 * the trees ({@code ExcelImporter}) and writes the updated documents ({@code XmlWriter}).
 * </p>
 *
 * <p>
 * Field-level rules (type exclusivity, canonical order) live in the node classes of {@code model}.
 * </p>
 */
package io.github.yok.batchbulkedit.core;
