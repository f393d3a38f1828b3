package io.github.yok.batchbulkedit.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that reads the {@code output-dir} property from the application root
 * configuration and decides where updated recipe documents are written.
 *
 * <p>
 * When {@code output-dir} is blank, documents go to an {@code updated} directory next to the
 * source document.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties
@Data
public class PathsConfig {

    // Directory name used when no output directory is configured
    static final String DEFAULT_OUTPUT_DIR_NAME = "updated";

    private String outputDir;

    /**
     * Returns the directory updated documents are written to.
     *
     * @param sourceDocument document the output belongs to
     * @return configured directory, or {@code updated} beside {@code sourceDocument}
     */
    public Path resolveOutputDir(Path sourceDocument) {
        if (StringUtils.isNotBlank(outputDir)) {
            return Paths.get(outputDir).toAbsolutePath().normalize();
        }
        Path parent = sourceDocument.toAbsolutePath().normalize().getParent();
        return parent.resolve(DEFAULT_OUTPUT_DIR_NAME);
    }
}
