/**
 * Recipe document parser package for Batch Bulk Edit.
 *
 * <p>
 * {@code RecipeParser} reads FactoryTalk Batch procedures, unit procedures and operations through
 * JAXP DOM and follows their step references. {@code RecipeFormat} recognizes the file kinds.
 * </p>
 */
package io.github.yok.batchbulkedit.parser;
