package io.github.yok.batchbulkedit.model;

import static io.github.yok.batchbulkedit.model.WorkbookColumns.DEFER;
import static io.github.yok.batchbulkedit.model.WorkbookColumns.ENUMERATION_MEMBER;
import static io.github.yok.batchbulkedit.model.WorkbookColumns.ENUMERATION_SET;
import static io.github.yok.batchbulkedit.model.WorkbookColumns.FULL_PATH;
import static io.github.yok.batchbulkedit.model.WorkbookColumns.HIGH;
import static io.github.yok.batchbulkedit.model.WorkbookColumns.INTEGER;
import static io.github.yok.batchbulkedit.model.WorkbookColumns.LOW;
import static io.github.yok.batchbulkedit.model.WorkbookColumns.NAME;
import static io.github.yok.batchbulkedit.model.WorkbookColumns.REAL;
import static io.github.yok.batchbulkedit.model.WorkbookColumns.STRING;
import static io.github.yok.batchbulkedit.model.WorkbookColumns.TAG_TYPE;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Element;

/**
 * A {@code <Parameter>} element of a recipe document.
 *
 * <p>
 * A Parameter carries exactly one of {@code Real}, {@code Integer}, {@code String} or
 * {@code EnumerationSet}. Its canonical child order depends on that type:
 * </p>
 * <ul>
 * <li>String: Name, ERPAlias, PLCReference, String, EngineeringUnits</li>
 * <li>Integer: Name, ERPAlias, PLCReference, Integer, High, Low, EngineeringUnits, Scale</li>
 * <li>Real: Name, ERPAlias, PLCReference, Real, High, Low, EngineeringUnits, Scale</li>
 * <li>EnumerationSet: Name, ERPAlias, PLCReference, EnumerationSet, EnumerationMember</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Getter
public final class ParameterNode implements RecipeNode {

    static final List<String> TYPE_FIELDS = ImmutableList.of(REAL, INTEGER, STRING,
            ENUMERATION_SET);

    // Precedence used to pick the canonical order when several type fields exist
    private static final List<String> TYPE_PRECEDENCE = ImmutableList.of(STRING, INTEGER, REAL,
            ENUMERATION_SET);

    private static final Map<String, List<String>> CANONICAL_ORDERS =
            ImmutableMap.<String, List<String>>builder()
                    .put(STRING,
                            ImmutableList.of(NAME, "ERPAlias", "PLCReference", STRING,
                                    "EngineeringUnits"))
                    .put(INTEGER,
                            ImmutableList.of(NAME, "ERPAlias", "PLCReference", INTEGER, HIGH, LOW,
                                    "EngineeringUnits", "Scale"))
                    .put(REAL,
                            ImmutableList.of(NAME, "ERPAlias", "PLCReference", REAL, HIGH, LOW,
                                    "EngineeringUnits", "Scale"))
                    .put(ENUMERATION_SET, ImmutableList.of(NAME, "ERPAlias", "PLCReference",
                            ENUMERATION_SET, ENUMERATION_MEMBER))
                    .build();

    private static final Set<String> KNOWN_FIELDS = CANONICAL_ORDERS.values().stream()
            .flatMap(List::stream).collect(ImmutableSet.toImmutableSet());

    // Columns never written as child elements of a Parameter
    private static final Set<String> IGNORED_COLUMNS = ImmutableSet.of(TAG_TYPE, FULL_PATH, DEFER);

    private final Element element;
    private final String fullpath;
    private final String source;
    private final Map<String, String> originalFields;

    @Getter(AccessLevel.NONE)
    private final int maxTypeFields;

    /**
     * Wraps a Parameter element.
     *
     * @param element {@code <Parameter>} element (may be detached while a new node is built)
     * @param fullpath reconciliation key of the node
     * @param source identifier of the owning document
     * @param maxTypeFields maximum number of populated type fields accepted by {@link #apply}
     */
    ParameterNode(Element element, String fullpath, String source, int maxTypeFields) {
        this.element = element;
        this.fullpath = fullpath;
        this.source = source;
        this.maxTypeFields = maxTypeFields;
        this.originalFields = NodeFields.snapshot(element);
    }

    @Override
    public TagType getTagType() {
        return TagType.PARAMETER;
    }

    @Override
    public Map<String, String> project() {
        Map<String, String> row = new LinkedHashMap<>();
        for (String column : WorkbookColumns.FIXED) {
            if (TAG_TYPE.equals(column)) {
                row.put(column, TagType.PARAMETER.getLabel());
            } else if (FULL_PATH.equals(column)) {
                row.put(column, fullpath);
            } else if (column.startsWith(WorkbookColumns.LIMIT_PREFIX)) {
                // Parameters have no limit sub-structure
                row.put(column, "");
            } else {
                row.put(column, originalFields.getOrDefault(column, ""));
            }
        }
        originalFields.forEach(row::putIfAbsent);
        return row;
    }

    @Override
    public void apply(Map<String, String> row) {
        NodeFields.checkRow(fullpath, row, TYPE_FIELDS, maxTypeFields, IGNORED_COLUMNS);
        for (Map.Entry<String, String> entry : row.entrySet()) {
            String column = entry.getKey();
            if (IGNORED_COLUMNS.contains(column)
                    || column.startsWith(WorkbookColumns.LIMIT_PREFIX)) {
                continue;
            }
            NodeFields.applyField(element, originalFields, column, entry.getValue());
        }
        canonicalize();
        log.debug("Applied row to {}", fullpath);
    }

    @Override
    public void canonicalize() {
        String type = selectType();
        NodeFields.reorder(element, CANONICAL_ORDERS.get(type), KNOWN_FIELDS);
    }

    /**
     * Picks the type that drives the canonical order: the first populated type field in
     * precedence order, otherwise the first present one.
     *
     * @return type field name
     * @throws ValidationException when no type field exists
     */
    private String selectType() {
        for (String type : TYPE_PRECEDENCE) {
            if (NodeFields.isPopulated(element, type)) {
                return type;
            }
        }
        for (String type : TYPE_PRECEDENCE) {
            if (NodeFields.isPresent(element, type)) {
                return type;
            }
        }
        throw new ValidationException(fullpath + ": no recognized type");
    }
}
