/**
 * Root package of Batch Bulk Edit.
 *
 * <p>
 * Provides a command line tool that exports FactoryTalk Batch recipe parameters to an Excel
 * workbook and applies an edited workbook back to the recipe XML.
 * </p>
 *
 * <p>
 * Main responsibilities are separated into the following subpackages:
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.batchbulkedit.model}: recipe trees and their Parameter and FormulaValue
 * nodes</li>
 * <li>{@code io.github.yok.batchbulkedit.parser}: reading recipe documents</li>
 * <li>{@code io.github.yok.batchbulkedit.core}: workbook export, import and XML writing</li>
 * <li>{@code io.github.yok.batchbulkedit.config}: configuration models</li>
 * </ul>
 */
package io.github.yok.batchbulkedit;
