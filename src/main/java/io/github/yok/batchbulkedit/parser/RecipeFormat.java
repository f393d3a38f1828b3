package io.github.yok.batchbulkedit.parser;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.apache.commons.io.FilenameUtils;

/**
 * Enumeration of the recipe document kinds and their file extensions.
 *
 * <p>
 * A procedure references unit procedures through its steps, and a unit procedure references
 * operations, so one parent document may pull in documents of every kind.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum RecipeFormat {

    // Procedure (.pxml).
    PROCEDURE("pxml"),

    // Unit procedure (.uxml).
    UNIT_PROCEDURE("uxml"),

    // Operation (.oxml).
    OPERATION("oxml");

    // File extension, lowercase and without dot.
    private final String extension;

    /**
     * Determines whether the given file extension belongs to this format.
     *
     * @param ext file extension to check (case-insensitive, without dot)
     * @return {@code true} if the extension matches this format, {@code false} otherwise
     */
    public boolean matches(String ext) {
        return extension.equalsIgnoreCase(ext);
    }

    /**
     * Detects the format of a file from its extension.
     *
     * @param file recipe file
     * @return matching format, or empty for any other extension
     */
    public static Optional<RecipeFormat> of(Path file) {
        String ext = FilenameUtils.getExtension(file.getFileName().toString());
        return Arrays.stream(values()).filter(f -> f.matches(ext)).findFirst();
    }
}
