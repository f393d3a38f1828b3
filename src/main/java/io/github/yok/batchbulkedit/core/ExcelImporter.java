package io.github.yok.batchbulkedit.core;

import com.google.common.base.Preconditions;
import io.github.yok.batchbulkedit.config.RecipeConfig;
import io.github.yok.batchbulkedit.model.DeferResolutionException;
import io.github.yok.batchbulkedit.model.FormulaValueNode;
import io.github.yok.batchbulkedit.model.RecipeNode;
import io.github.yok.batchbulkedit.model.RecipeTree;
import io.github.yok.batchbulkedit.model.TagType;
import io.github.yok.batchbulkedit.model.WorkbookColumns;
import io.github.yok.batchbulkedit.util.CellValues;
import io.github.yok.batchbulkedit.util.XmlUtils;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

/**
 * Reconciles an edited workbook against the parsed recipe trees.
 *
 * <p>
 * Each sheet is matched to the tree whose source identifier equals the sheet name. Within a sheet,
 * every row is matched by {@code TagType} and {@code FullPath}:
 * </p>
 * <ul>
 * <li>a matching node is updated with the row;</li>
 * <li>a row without a matching node creates one;</li>
 * <li>a node that existed before the import and has no row any more is deleted.</li>
 * </ul>
 *
 * <p>
 * The workbook is trusted verbatim: every matched row counts as an update whether or not it
 * changed. An exception aborts the import and leaves the mutations done so far in memory.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExcelImporter {

    private final RecipeConfig recipeConfig;

    /**
     * Applies the edited workbook to the trees.
     *
     * @param workbookPath edited {@code .xlsx} file
     * @param trees trees to update in place
     * @return counts aggregated over all trees
     * @throws IOException if the workbook cannot be read
     */
    public ImportResult importChanges(Path workbookPath, List<RecipeTree> trees)
            throws IOException {
        Preconditions.checkNotNull(workbookPath, "workbookPath must not be null");
        Preconditions.checkNotNull(trees, "trees must not be null");

        Map<String, RecipeTree> bySource = new LinkedHashMap<>();
        for (RecipeTree tree : trees) {
            bySource.putIfAbsent(tree.getSource(), tree);
        }

        ImportResult total = ImportResult.EMPTY;
        DataFormatter formatter = new DataFormatter();
        try (InputStream in = Files.newInputStream(workbookPath);
                Workbook workbook = WorkbookFactory.create(in)) {
            for (Sheet sheet : workbook) {
                RecipeTree tree = bySource.get(sheet.getSheetName());
                if (tree == null) {
                    log.warn("No recipe document for sheet '{}', ignored", sheet.getSheetName());
                    continue;
                }
                ImportResult result = reconcile(tree, readRows(formatter, sheet));
                log.info("Imported sheet {}: {}", sheet.getSheetName(), result.summary());
                total = total.plus(result);
            }
        }

        if (recipeConfig.isValidateDeferTargets()) {
            for (RecipeTree tree : trees) {
                validateDeferTargets(tree);
            }
        }
        return total;
    }

    /**
     * Reads the data rows of a sheet. The first row is the header; blank rows are skipped.
     */
    private List<Map<String, String>> readRows(DataFormatter formatter, Sheet sheet) {
        List<Map<String, String>> rows = new ArrayList<>();
        int first = sheet.getFirstRowNum();
        if (first < 0) {
            return rows;
        }
        List<String> header = CellValues.header(formatter, sheet.getRow(first));
        for (int r = first + 1; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row == null) {
                continue;
            }
            Map<String, String> values = CellValues.row(formatter, header, row);
            if (CellValues.isBlank(values)) {
                continue;
            }
            rows.add(values);
        }
        log.debug("Read sheet {}: columns={}, rows={}", sheet.getSheetName(), header.size(),
                rows.size());
        return rows;
    }

    private ImportResult reconcile(RecipeTree tree, List<Map<String, String>> rows) {
        // --- 1) Remember the nodes present before any row is applied ---
        Map<TagType, List<RecipeNode>> before = new EnumMap<>(TagType.class);
        Map<TagType, Set<String>> seen = new EnumMap<>(TagType.class);
        for (TagType type : TagType.values()) {
            before.put(type, new ArrayList<>(tree.nodes(type)));
            seen.put(type, new HashSet<>());
        }

        // --- 2) Update or create one node per row ---
        int created = 0;
        int updated = 0;
        for (Map<String, String> row : rows) {
            String label = row.get(WorkbookColumns.TAG_TYPE);
            Optional<TagType> type = TagType.fromLabel(label);
            if (!type.isPresent()) {
                log.warn("Unknown TagType '{}' in sheet {}, row skipped: {}", label,
                        tree.getSource(), row.get(WorkbookColumns.FULL_PATH));
                continue;
            }
            String fullpath = StringUtils.trimToEmpty(row.get(WorkbookColumns.FULL_PATH));
            seen.get(type.get()).add(fullpath);
            Optional<? extends RecipeNode> existing = tree.find(type.get(), fullpath);
            if (existing.isPresent()) {
                existing.get().apply(row);
                updated++;
            } else {
                RecipeNode node = tree.create(type.get(), row);
                seen.get(type.get()).add(node.getFullpath());
                created++;
            }
        }

        // --- 3) Delete nodes whose rows are gone ---
        int deleted = 0;
        for (TagType type : TagType.values()) {
            for (RecipeNode node : before.get(type)) {
                if (!seen.get(type).contains(node.getFullpath())) {
                    tree.remove(node);
                    deleted++;
                }
            }
        }
        return new ImportResult(created, updated, deleted);
    }

    private void validateDeferTargets(RecipeTree tree) {
        for (FormulaValueNode node : tree.getFormulaValues()) {
            String defer = XmlUtils.childText(node.getElement(), WorkbookColumns.DEFER).trim();
            if (!defer.isEmpty() && !tree.hasParameterNamed(defer)) {
                throw new DeferResolutionException(node.getFullpath() + ": Defer '" + defer
                        + "' names no Parameter of " + tree.getSource());
            }
        }
    }
}
