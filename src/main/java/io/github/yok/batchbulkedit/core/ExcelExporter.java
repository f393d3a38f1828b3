package io.github.yok.batchbulkedit.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.yok.batchbulkedit.config.WorkbookConfig;
import io.github.yok.batchbulkedit.model.RecipeNode;
import io.github.yok.batchbulkedit.model.RecipeTree;
import io.github.yok.batchbulkedit.model.ValidationException;
import io.github.yok.batchbulkedit.model.WorkbookColumns;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.usermodel.DefaultIndexedColorMap;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFFont;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

/**
 * Exports recipe trees to an {@code .xlsx} workbook, one sheet per tree.
 *
 * <p>
 * Every sheet shares one header: the fixed columns of {@link WorkbookColumns#FIXED} followed by the
 * extra columns found in any tree, sorted by name. Each row is the {@link RecipeNode#project()} of
 * a node, Parameters first, then FormulaValues. All cells are written as text so that values such
 * as {@code 0.} survive a round trip through Excel.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExcelExporter {

    // Excel column widths are measured in 1/256 of a character
    private static final int WIDTH_UNIT = 256;

    // Padding added to the longest value of a column
    private static final int WIDTH_PADDING = 2;

    private final WorkbookConfig workbookConfig;

    /**
     * Writes the workbook.
     *
     * @param trees trees to export; each becomes a sheet named by its source identifier
     * @param destination workbook file (parent directories are created)
     * @throws IOException if the workbook cannot be written
     * @throws ValidationException if two trees share a sheet name or a name is invalid in Excel
     */
    public void export(List<RecipeTree> trees, Path destination) throws IOException {
        Preconditions.checkNotNull(trees, "trees must not be null");
        Preconditions.checkNotNull(destination, "destination must not be null");

        // --- 1) Check sheet names before anything is written ---
        validateSheetNames(trees);

        // --- 2) Project every node and collect extra columns ---
        Map<RecipeTree, List<Map<String, String>>> rowsByTree = new LinkedHashMap<>();
        SortedSet<String> extras = new TreeSet<>();
        for (RecipeTree tree : trees) {
            List<Map<String, String>> rows = new ArrayList<>();
            for (RecipeNode node : tree.getParameters()) {
                rows.add(node.project());
            }
            for (RecipeNode node : tree.getFormulaValues()) {
                rows.add(node.project());
            }
            for (Map<String, String> row : rows) {
                for (String column : row.keySet()) {
                    if (!WorkbookColumns.isFixed(column)) {
                        extras.add(column);
                    }
                }
            }
            rowsByTree.put(tree, rows);
        }
        List<String> header = ImmutableList.<String>builder().addAll(WorkbookColumns.FIXED)
                .addAll(extras).build();
        log.debug("Workbook header: fixed={}, extras={}", WorkbookColumns.FIXED.size(), extras);

        // --- 3) Build and write the workbook ---
        FileUtils.forceMkdirParent(destination.toAbsolutePath().toFile());
        try (XSSFWorkbook workbook = new XSSFWorkbook();
                OutputStream out = Files.newOutputStream(destination)) {
            XSSFCellStyle headerStyle = createHeaderStyle(workbook);
            XSSFCellStyle textStyle = workbook.createCellStyle();
            textStyle.setDataFormat(workbook.createDataFormat().getFormat("@"));

            for (Map.Entry<RecipeTree, List<Map<String, String>>> entry : rowsByTree.entrySet()) {
                writeSheet(workbook, entry.getKey().getSource(), header, entry.getValue(),
                        headerStyle, textStyle);
            }
            workbook.write(out);
        }
        log.info("Exported {} sheet(s) to {}", rowsByTree.size(), destination);
    }

    private void writeSheet(XSSFWorkbook workbook, String name, List<String> header,
            List<Map<String, String>> rows, XSSFCellStyle headerStyle, XSSFCellStyle textStyle) {
        XSSFSheet sheet = workbook.createSheet(name);
        int[] widths = new int[header.size()];

        Row headerRow = sheet.createRow(0);
        for (int c = 0; c < header.size(); c++) {
            Cell cell = headerRow.createCell(c);
            cell.setCellValue(header.get(c));
            cell.setCellStyle(headerStyle);
            widths[c] = header.get(c).length();
        }
        for (int r = 0; r < rows.size(); r++) {
            Row row = sheet.createRow(r + 1);
            Map<String, String> values = rows.get(r);
            for (int c = 0; c < header.size(); c++) {
                String value = values.getOrDefault(header.get(c), "");
                Cell cell = row.createCell(c);
                cell.setCellValue(value);
                cell.setCellStyle(textStyle);
                widths[c] = Math.max(widths[c], value.length());
            }
        }

        if (workbookConfig.isFreezeHeader()) {
            sheet.createFreezePane(0, 1);
        }
        if (workbookConfig.isAutoSizeColumns()) {
            for (int c = 0; c < widths.length; c++) {
                int chars = Math.min(widths[c] + WIDTH_PADDING, workbookConfig.getMaxColumnWidth());
                sheet.setColumnWidth(c, chars * WIDTH_UNIT);
            }
        }
        log.debug("Sheet written: name={}, rows={}", name, rows.size());
    }

    private XSSFCellStyle createHeaderStyle(XSSFWorkbook workbook) {
        XSSFFont font = workbook.createFont();
        font.setFontName(workbookConfig.getHeaderFontName());
        font.setFontHeightInPoints(workbookConfig.getHeaderFontSize());
        font.setBold(true);
        font.setColor(IndexedColors.BLACK.getIndex());

        XSSFCellStyle style = workbook.createCellStyle();
        style.setFont(font);
        byte[] fill = rgb(workbookConfig.getHeaderFillColor());
        style.setFillForegroundColor(new XSSFColor(fill, new DefaultIndexedColorMap()));
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        return style;
    }

    /**
     * Rejects sheet names Excel would refuse and names that collide (Excel compares sheet names
     * case-insensitively).
     */
    private static void validateSheetNames(List<RecipeTree> trees) {
        Set<String> seen = new HashSet<>();
        for (RecipeTree tree : trees) {
            String name = tree.getSource();
            try {
                WorkbookUtil.validateSheetName(name);
            } catch (IllegalArgumentException e) {
                throw new ValidationException(
                        "Invalid sheet name '" + name + "': " + e.getMessage());
            }
            if (!seen.add(name.toLowerCase(Locale.ROOT))) {
                throw new ValidationException("Duplicate sheet name: " + name);
            }
        }
    }

    static byte[] rgb(String hex) {
        Preconditions.checkArgument(hex != null && hex.matches("[0-9A-Fa-f]{6}"),
                "fill color must be six hex digits: %s", hex);
        int value = Integer.parseInt(hex, 16);
        return new byte[] {(byte) (value >> 16), (byte) (value >> 8), (byte) value};
    }
}
