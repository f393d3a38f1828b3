package io.github.yok.batchbulkedit.model;

import java.util.Map;
import org.w3c.dom.Element;

/**
 * One Parameter or FormulaValue extracted from a recipe document.
 *
 * <p>
 * A node wraps a single DOM element owned by its {@link RecipeTree} and is identified by a full
 * path derived from its position in the document. The two variants share this contract:
 * </p>
 * <ul>
 * <li>{@link #project()} flattens the node into one workbook row.</li>
 * <li>{@link #apply(Map)} writes an edited row back onto the element.</li>
 * <li>{@link #canonicalize()} restores the canonical child order of the variant.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 * @see ParameterNode
 * @see FormulaValueNode
 */
public interface RecipeNode {

    /**
     * Returns the variant of this node.
     *
     * @return tag type written to the {@code TagType} column
     */
    TagType getTagType();

    /**
     * Returns the path that identifies this node when rows are matched back.
     *
     * @return full path such as {@code TEST/Parameter[XFER5_TRANSFER_TYPE]}
     */
    String getFullpath();

    /**
     * Returns the identifier of the owning document.
     *
     * @return source identifier (file name of the document)
     */
    String getSource();

    /**
     * Returns the wrapped element.
     *
     * @return DOM element of the node
     */
    Element getElement();

    /**
     * Returns the snapshot of child fields taken when the node was created. A child with element
     * children of its own is included with its flattened text; it is exported but read-only.
     *
     * @return immutable map of child local name to text
     */
    Map<String, String> getOriginalFields();

    /**
     * Projects the node into a workbook row: every fixed column followed by the original fields the
     * fixed schema does not cover.
     *
     * @return ordered map of column name to cell text
     */
    Map<String, String> project();

    /**
     * Applies an edited row to the element and canonicalizes it.
     *
     * <p>
     * The row is validated before anything is written, so a rejected row leaves the node unchanged.
     * </p>
     *
     * @param row column name to edited cell text
     * @throws TypeConflictException when more type fields are populated than allowed
     * @throws ValidationException when a column cannot be written as a child element
     */
    void apply(Map<String, String> row);

    /**
     * Reorders the children of the element into the canonical sequence of the variant.
     *
     * @throws ValidationException when the node has no recognized type
     */
    void canonicalize();
}
