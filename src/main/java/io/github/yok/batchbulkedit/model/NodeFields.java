package io.github.yok.batchbulkedit.model;

import com.google.common.collect.ImmutableMap;
import io.github.yok.batchbulkedit.util.XmlUtils;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

/**
 * Field-level operations shared by {@link ParameterNode} and {@link FormulaValueNode}.
 *
 * <p>
 * Both variants delegate here for snapshotting, type-field validation, writing a single field and
 * rebuilding the child order, so each variant only states its own rules.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
final class NodeFields {

    // Column names that can become XML element names
    private static final Pattern ELEMENT_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9._-]*");

    private NodeFields() {
        // Utility class; do not instantiate.
    }

    /**
     * Captures the children of an element as local name to text.
     *
     * <p>
     * A structural child (one with element children of its own) is captured with its text content,
     * whitespace normalized, so that it still shows up as a column. {@link #applyField} never
     * writes such a child back. When a name occurs more than once, the first occurrence wins,
     * matching {@link XmlUtils#findChild}.
     * </p>
     *
     * @param element node element
     * @return immutable snapshot in document order
     */
    static Map<String, String> snapshot(Element element) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (Element child : XmlUtils.childElements(element)) {
            String text = XmlUtils.hasChildElements(child)
                    ? StringUtils.normalizeSpace(child.getTextContent())
                    : XmlUtils.text(child);
            fields.putIfAbsent(XmlUtils.localName(child), text);
        }
        return ImmutableMap.copyOf(fields);
    }

    /**
     * Counts the type fields that carry a non-blank value in the row.
     *
     * @param row edited row
     * @param typeFields type field columns of the variant
     * @return number of populated type fields
     */
    static long countPopulated(Map<String, String> row, Collection<String> typeFields) {
        return typeFields.stream().filter(f -> StringUtils.isNotBlank(row.get(f))).count();
    }

    /**
     * Validates a row before any of it is written.
     *
     * @param fullpath full path of the node, used in error messages
     * @param row edited row
     * @param typeFields type field columns of the variant
     * @param maxTypeFields maximum number of populated type fields
     * @param ignored columns that are never written as child elements
     * @throws TypeConflictException when too many type fields are populated
     * @throws ValidationException when a non-blank column is not a valid element name
     */
    static void checkRow(String fullpath, Map<String, String> row, Collection<String> typeFields,
            int maxTypeFields, Set<String> ignored) {
        long populated = countPopulated(row, typeFields);
        if (populated > maxTypeFields) {
            throw new TypeConflictException(fullpath + ": must have exactly one data type (found "
                    + populated + " of " + typeFields + ", allowed " + maxTypeFields + ")");
        }
        for (String column : row.keySet()) {
            if (ignored.contains(column) || StringUtils.isBlank(row.get(column))) {
                continue;
            }
            String name = StringUtils.removeStart(column, WorkbookColumns.LIMIT_PREFIX);
            if (!ELEMENT_NAME.matcher(name).matches()) {
                throw new ValidationException(
                        fullpath + ": column '" + column + "' is not a valid XML element name");
            }
        }
    }

    /**
     * Writes one edited field onto the element.
     *
     * <p>
     * A blank value for a field the node did not have originally is skipped, so no empty elements
     * are created for columns the row merely carries. Structural children are never overwritten.
     * </p>
     *
     * @param element node element
     * @param originalFields snapshot taken at construction
     * @param field child local name
     * @param value edited cell text (trimmed before writing)
     */
    static void applyField(Element element, Map<String, String> originalFields, String field,
            String value) {
        String text = StringUtils.trimToEmpty(value);
        if (text.isEmpty() && !originalFields.containsKey(field)) {
            return;
        }
        Element child = XmlUtils.findChild(element, field);
        if (child == null) {
            child = XmlUtils.createElement(element, field);
            element.appendChild(child);
        } else if (XmlUtils.hasChildElements(child)) {
            log.debug("Skipped structural field: {}", field);
            return;
        }
        child.setTextContent(text);
    }

    /**
     * Rebuilds the children of an element in the given order.
     *
     * <ul>
     * <li>Fields listed in {@code order} come first; missing ones are synthesized as empty
     * elements.</li>
     * <li>Known fields outside {@code order} are removed.</li>
     * <li>Unknown fields and comments follow, in their original relative order.</li>
     * <li>Whitespace-only text between children is dropped.</li>
     * </ul>
     *
     * @param element node element
     * @param order canonical field order
     * @param knownFields every field the variant recognizes
     */
    static void reorder(Element element, List<String> order, Set<String> knownFields) {
        Map<String, Element> known = new LinkedHashMap<>();
        List<Node> trailing = new ArrayList<>();
        for (Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                String name = XmlUtils.localName(child);
                if (knownFields.contains(name)) {
                    known.putIfAbsent(name, (Element) child);
                } else {
                    trailing.add(child);
                }
            } else if (child.getNodeType() == Node.COMMENT_NODE) {
                trailing.add(child);
            }
        }
        while (element.getFirstChild() != null) {
            element.removeChild(element.getFirstChild());
        }
        for (String name : order) {
            Element child = known.get(name);
            if (child == null) {
                child = XmlUtils.createElement(element, name);
            }
            element.appendChild(child);
        }
        for (Node child : trailing) {
            element.appendChild(child);
        }
    }

    /**
     * Returns whether the element has a child with the given name and non-blank text.
     *
     * @param element node element
     * @param field child local name
     * @return {@code true} when populated
     */
    static boolean isPopulated(Element element, String field) {
        Element child = XmlUtils.findChild(element, field);
        return child != null && StringUtils.isNotBlank(XmlUtils.text(child));
    }

    /**
     * Returns whether the element has a child with the given name.
     *
     * @param element node element
     * @param field child local name
     * @return {@code true} when present
     */
    static boolean isPresent(Element element, String field) {
        return XmlUtils.findChild(element, field) != null;
    }
}
