package io.github.yok.batchbulkedit.util;

import com.google.common.base.Preconditions;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.extern.slf4j.Slf4j;

/**
 * Utility for rendering file and directory paths for logs.
 *
 * <p>
 * Paths under the current working directory are rendered relative to it, so log lines stay short
 * when the tool runs next to the recipes it edits; any other path is rendered absolute.
 * </p>
 */
@Slf4j
public final class LogPathUtil {

    private LogPathUtil() {
        // Utility class; do not instantiate.
    }

    /**
     * Renders a path for logs.
     *
     * @param path file or directory
     * @return path relative to the working directory when below it, otherwise absolute
     * @throws NullPointerException if {@code path} is {@code null}
     */
    public static String renderDirForLog(Path path) {
        Preconditions.checkNotNull(path, "path must not be null");

        Path base = Paths.get(System.getProperty("user.dir")).toAbsolutePath().normalize();
        Path abs = path.toAbsolutePath().normalize();

        if (abs.startsWith(base) && !abs.equals(base)) {
            String rel = base.relativize(abs).toString();
            log.debug("Rendered relative log path. base={}, abs={}, rel={}", base, abs, rel);
            return rel;
        }
        return abs.toString();
    }
}
