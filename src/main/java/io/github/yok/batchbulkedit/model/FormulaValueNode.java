package io.github.yok.batchbulkedit.model;

import static io.github.yok.batchbulkedit.model.WorkbookColumns.DEFER;
import static io.github.yok.batchbulkedit.model.WorkbookColumns.ENUMERATION_MEMBER;
import static io.github.yok.batchbulkedit.model.WorkbookColumns.ENUMERATION_SET;
import static io.github.yok.batchbulkedit.model.WorkbookColumns.FULL_PATH;
import static io.github.yok.batchbulkedit.model.WorkbookColumns.INTEGER;
import static io.github.yok.batchbulkedit.model.WorkbookColumns.LIMIT_ELEMENT;
import static io.github.yok.batchbulkedit.model.WorkbookColumns.LIMIT_PREFIX;
import static io.github.yok.batchbulkedit.model.WorkbookColumns.LIMIT_THRESHOLDS;
import static io.github.yok.batchbulkedit.model.WorkbookColumns.LIMIT_VERIFICATION;
import static io.github.yok.batchbulkedit.model.WorkbookColumns.NAME;
import static io.github.yok.batchbulkedit.model.WorkbookColumns.REAL;
import static io.github.yok.batchbulkedit.model.WorkbookColumns.STRING;
import static io.github.yok.batchbulkedit.model.WorkbookColumns.TAG_TYPE;
import static io.github.yok.batchbulkedit.model.WorkbookColumns.VALUE;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.github.yok.batchbulkedit.util.XmlUtils;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.w3c.dom.Element;

/**
 * A {@code <FormulaValue>} element below a Step of a recipe document.
 *
 * <p>
 * A FormulaValue either stores its own {@code Value} or defers to a parameter of the enclosing
 * recipe through {@code Defer}; the two are mutually exclusive. It may carry a
 * {@code FormulaValueLimit} with a {@code Verification} attribute and six ordered thresholds, which
 * map onto the {@code FormulaValueLimit_*} columns.
 * </p>
 *
 * <p>
 * Canonical order: Name, Display, Defer or Value, the data type(s), EnumerationMember (if present),
 * EngineeringUnits, FormulaValueLimit.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Getter
public final class FormulaValueNode implements RecipeNode {

    static final List<String> TYPE_FIELDS = ImmutableList.of(REAL, INTEGER, STRING,
            ENUMERATION_SET, DEFER);

    // Data types in canonical order
    private static final List<String> DATA_TYPES = ImmutableList.of(INTEGER, REAL, STRING,
            ENUMERATION_SET);

    private static final Set<String> KNOWN_FIELDS = ImmutableSet.of(NAME, "Display", DEFER, VALUE,
            INTEGER, REAL, STRING, ENUMERATION_SET, ENUMERATION_MEMBER, "EngineeringUnits",
            LIMIT_ELEMENT);

    private static final Set<String> IGNORED_COLUMNS = ImmutableSet.of(TAG_TYPE, FULL_PATH);

    private final Element element;
    private final String fullpath;
    private final String source;
    private final Map<String, String> originalFields;

    @Getter(AccessLevel.NONE)
    private final int maxTypeFields;

    /**
     * Wraps a FormulaValue element.
     *
     * @param element {@code <FormulaValue>} element (may be detached while a new node is built)
     * @param fullpath reconciliation key of the node
     * @param source identifier of the owning document
     * @param maxTypeFields maximum number of populated type fields accepted by {@link #apply}
     */
    FormulaValueNode(Element element, String fullpath, String source, int maxTypeFields) {
        this.element = element;
        this.fullpath = fullpath;
        this.source = source;
        this.maxTypeFields = maxTypeFields;
        this.originalFields = NodeFields.snapshot(element);
    }

    @Override
    public TagType getTagType() {
        return TagType.FORMULA_VALUE;
    }

    @Override
    public Map<String, String> project() {
        boolean deferred = StringUtils.isNotBlank(originalFields.get(DEFER));
        Element limit = XmlUtils.findChild(element, LIMIT_ELEMENT);

        Map<String, String> row = new LinkedHashMap<>();
        for (String column : WorkbookColumns.FIXED) {
            if (TAG_TYPE.equals(column)) {
                row.put(column, TagType.FORMULA_VALUE.getLabel());
            } else if (FULL_PATH.equals(column)) {
                row.put(column, fullpath);
            } else if (VALUE.equals(column)) {
                row.put(column, deferred ? "" : originalFields.getOrDefault(VALUE, ""));
            } else if (column.startsWith(LIMIT_PREFIX)) {
                row.put(column, limitValue(limit, column.substring(LIMIT_PREFIX.length())));
            } else {
                row.put(column, originalFields.getOrDefault(column, ""));
            }
        }
        if (limit != null) {
            // Unknown limit children travel as FormulaValueLimit_<name> extras
            for (Element child : XmlUtils.childElements(limit)) {
                row.putIfAbsent(WorkbookColumns.limitColumn(XmlUtils.localName(child)),
                        XmlUtils.text(child));
            }
        }
        originalFields.forEach((field, text) -> {
            if (!LIMIT_ELEMENT.equals(field)) {
                row.putIfAbsent(field, text);
            }
        });
        return row;
    }

    @Override
    public void apply(Map<String, String> row) {
        NodeFields.checkRow(fullpath, row, TYPE_FIELDS, maxTypeFields, IGNORED_COLUMNS);
        boolean deferred = StringUtils.isNotBlank(row.get(DEFER));
        for (Map.Entry<String, String> entry : row.entrySet()) {
            String column = entry.getKey();
            if (IGNORED_COLUMNS.contains(column) || column.startsWith(LIMIT_PREFIX)) {
                continue;
            }
            if (VALUE.equals(column) && deferred) {
                continue;
            }
            if (DEFER.equals(column) && !deferred) {
                removeDefer();
                continue;
            }
            NodeFields.applyField(element, originalFields, column, entry.getValue());
        }
        applyLimit(row);
        canonicalize();
        log.debug("Applied row to {}", fullpath);
    }

    @Override
    public void canonicalize() {
        List<String> order = new ArrayList<>();
        order.add(NAME);
        order.add("Display");
        order.add(NodeFields.isPresent(element, DEFER) ? DEFER : VALUE);
        order.addAll(selectDataTypes());
        if (NodeFields.isPresent(element, ENUMERATION_MEMBER)) {
            order.add(ENUMERATION_MEMBER);
        }
        order.add("EngineeringUnits");
        order.add(LIMIT_ELEMENT);
        NodeFields.reorder(element, order, KNOWN_FIELDS);
    }

    /**
     * Rebuilds {@code FormulaValueLimit} from the {@code FormulaValueLimit_*} columns.
     *
     * <p>
     * Follows the same rule as plain fields: a blank value for an attribute or threshold that did
     * not exist is skipped, and no limit element is created when every limit column is blank.
     * Thresholds end up in canonical order; a threshold that is absent stays absent unless its
     * column carries a value.
     * </p>
     *
     * @param row edited row
     */
    private void applyLimit(Map<String, String> row) {
        List<String> columns = row.keySet().stream().filter(c -> c.startsWith(LIMIT_PREFIX))
                .collect(Collectors.toList());
        if (columns.isEmpty()) {
            return;
        }
        Element limit = XmlUtils.findChild(element, LIMIT_ELEMENT);
        boolean populated = columns.stream().anyMatch(c -> StringUtils.isNotBlank(row.get(c)));
        if (limit == null && !populated) {
            return;
        }
        if (limit == null) {
            limit = XmlUtils.createElement(element, LIMIT_ELEMENT);
            element.appendChild(limit);
        }
        for (String column : columns) {
            String part = column.substring(LIMIT_PREFIX.length());
            String text = StringUtils.trimToEmpty(row.get(column));
            if (LIMIT_VERIFICATION.equals(part)) {
                if (!text.isEmpty() || limit.hasAttribute(LIMIT_VERIFICATION)) {
                    limit.setAttribute(LIMIT_VERIFICATION, text);
                }
                continue;
            }
            Element threshold = XmlUtils.findChild(limit, part);
            if (text.isEmpty() && threshold == null) {
                continue;
            }
            if (threshold == null) {
                threshold = XmlUtils.createElement(limit, part);
                limit.appendChild(threshold);
            }
            threshold.setTextContent(text);
        }
        Element target = limit;
        List<String> present = LIMIT_THRESHOLDS.stream()
                .filter(t -> NodeFields.isPresent(target, t)).collect(Collectors.toList());
        NodeFields.reorder(limit, present, ImmutableSet.copyOf(LIMIT_THRESHOLDS));
    }

    private void removeDefer() {
        Element defer = XmlUtils.findChild(element, DEFER);
        if (defer != null) {
            element.removeChild(defer);
            log.debug("Removed Defer from {}", fullpath);
        }
    }

    /**
     * Returns the data types kept in canonical order: every populated one, or the first present one
     * when none is populated.
     *
     * @return data type field names
     */
    private List<String> selectDataTypes() {
        List<String> populated = DATA_TYPES.stream()
                .filter(t -> NodeFields.isPopulated(element, t)).collect(Collectors.toList());
        if (!populated.isEmpty()) {
            return populated;
        }
        return DATA_TYPES.stream().filter(t -> NodeFields.isPresent(element, t)).limit(1)
                .collect(Collectors.toList());
    }

    private static String limitValue(Element limit, String part) {
        if (limit == null) {
            return "";
        }
        if (LIMIT_VERIFICATION.equals(part)) {
            return limit.getAttribute(LIMIT_VERIFICATION);
        }
        return XmlUtils.childText(limit, part);
    }
}
