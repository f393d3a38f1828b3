package io.github.yok.batchbulkedit.model;

import java.util.Arrays;
import java.util.Optional;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Node variants that appear in the {@code TagType} column of the workbook.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum TagType {

    // Recipe level parameter, direct child of the document root.
    PARAMETER("Parameter"),

    // Step level formula value, child of a Step below Steps.
    FORMULA_VALUE("FormulaValue");

    // Value written to the TagType column and local name of the XML element.
    private final String label;

    /**
     * Resolves a {@code TagType} cell value.
     *
     * @param label cell text (surrounding whitespace is ignored, case-sensitive)
     * @return matching tag type, or empty when the text names no known variant
     */
    public static Optional<TagType> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String trimmed = label.trim();
        return Arrays.stream(values()).filter(t -> t.label.equals(trimmed)).findFirst();
    }
}
