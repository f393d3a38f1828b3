/**
 * Recipe node model package.
 *
 * <p>
 * A {@code RecipeTree} owns one parsed recipe document and the {@code ParameterNode}s and
 * {@code FormulaValueNode}s extracted from it. Nodes project themselves into workbook rows, apply
 * edited rows back onto their DOM element and restore the canonical child order of their variant.
 * </p>
 *
 * <p>
 * Rule violations are reported as subclasses of the unchecked {@code RecipeEditException}.
 * </p>
 */
package io.github.yok.batchbulkedit.model;
