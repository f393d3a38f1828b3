package io.github.yok.batchbulkedit.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;

/**
 * Utility class for turning spreadsheet cells into the text a user sees in Excel.
 *
 * <p>
 * Values go through POI's {@link DataFormatter}, so a number typed as {@code 0.} or a date keeps
 * the display form instead of the raw double. Formulas are rendered by their cached result.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class CellValues {

    private CellValues() {
        // Utility class; do not instantiate.
    }

    /**
     * Returns the displayed text of a cell.
     *
     * @param formatter formatter to use
     * @param cell cell to read (may be {@code null})
     * @return displayed text; empty string for a missing cell
     */
    public static String text(DataFormatter formatter, Cell cell) {
        if (cell == null) {
            return "";
        }
        return StringUtils.defaultString(formatter.formatCellValue(cell));
    }

    /**
     * Reads a header row into trimmed column names, one per cell up to the last cell.
     *
     * @param formatter formatter to use
     * @param header header row (may be {@code null})
     * @return column names in cell order; blank names are kept as empty strings
     */
    public static List<String> header(DataFormatter formatter, Row header) {
        List<String> names = new ArrayList<>();
        if (header == null) {
            return names;
        }
        for (int i = 0; i < header.getLastCellNum(); i++) {
            names.add(text(formatter, header.getCell(i)).trim());
        }
        return names;
    }

    /**
     * Reads a data row into an ordered map of column name to cell text.
     *
     * <p>
     * Columns with a blank name are skipped. Missing cells map to empty strings.
     * </p>
     *
     * @param formatter formatter to use
     * @param header column names from {@link #header}
     * @param row data row
     * @return row values keyed by column name
     */
    public static Map<String, String> row(DataFormatter formatter, List<String> header, Row row) {
        Map<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < header.size(); i++) {
            String column = header.get(i);
            if (column.isEmpty()) {
                continue;
            }
            values.putIfAbsent(column, text(formatter, row.getCell(i)));
        }
        return values;
    }

    /**
     * Returns whether every value of a row is blank.
     *
     * @param values row values
     * @return {@code true} for a row that carries no data
     */
    public static boolean isBlank(Map<String, String> values) {
        return values.values().stream().allMatch(StringUtils::isBlank);
    }
}
