package io.github.yok.batchbulkedit.model;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Column names of the workbook schema shared by the exporter, the importer and the node model.
 *
 * <p>
 * {@link #FIXED} lists the columns every sheet starts with, in order. Columns discovered at export
 * time that are not part of it ("extras") follow, sorted lexicographically.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class WorkbookColumns {

    public static final String TAG_TYPE = "TagType";
    public static final String NAME = "Name";
    public static final String FULL_PATH = "FullPath";
    public static final String REAL = "Real";
    public static final String INTEGER = "Integer";
    public static final String HIGH = "High";
    public static final String LOW = "Low";
    public static final String STRING = "String";
    public static final String ENUMERATION_SET = "EnumerationSet";
    public static final String ENUMERATION_MEMBER = "EnumerationMember";
    public static final String DEFER = "Defer";
    public static final String VALUE = "Value";

    // Prefix of the columns that map onto the FormulaValueLimit sub-structure.
    public static final String LIMIT_PREFIX = "FormulaValueLimit_";

    // Local name of the limit element and of its verification attribute.
    public static final String LIMIT_ELEMENT = "FormulaValueLimit";
    public static final String LIMIT_VERIFICATION = "Verification";

    /**
     * Threshold children of {@code FormulaValueLimit}, in document order.
     */
    public static final List<String> LIMIT_THRESHOLDS = ImmutableList.of("LowLowLowValue",
            "LowLowValue", "LowValue", "HighValue", "HighHighValue", "HighHighHighValue");

    /**
     * Fixed columns written at the start of every sheet.
     */
    public static final List<String> FIXED = ImmutableList.<String>builder()
            .add(TAG_TYPE, NAME, FULL_PATH, REAL, INTEGER, HIGH, LOW, STRING, ENUMERATION_SET,
                    ENUMERATION_MEMBER, DEFER, VALUE, limitColumn(LIMIT_VERIFICATION))
            .addAll(LIMIT_THRESHOLDS.stream().map(WorkbookColumns::limitColumn).iterator())
            .build();

    private WorkbookColumns() {
        // Constants holder; do not instantiate.
    }

    /**
     * Returns the workbook column that carries the given part of {@code FormulaValueLimit}.
     *
     * @param part threshold element name or {@link #LIMIT_VERIFICATION}
     * @return column name, e.g. {@code FormulaValueLimit_HighValue}
     */
    public static String limitColumn(String part) {
        return LIMIT_PREFIX + part;
    }

    /**
     * Returns whether the column belongs to the fixed schema.
     *
     * @param column column name
     * @return {@code true} for fixed columns
     */
    public static boolean isFixed(String column) {
        return FIXED.contains(column);
    }
}
