package io.github.yok.batchbulkedit.core;

import com.google.common.base.Preconditions;
import io.github.yok.batchbulkedit.config.PathsConfig;
import io.github.yok.batchbulkedit.model.RecipeTree;
import io.github.yok.batchbulkedit.util.LogPathUtil;
import io.github.yok.batchbulkedit.util.XmlUtils;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Component;

/**
 * Writes updated recipe documents.
 *
 * <p>
 * Every tree is written under its own file name into one output directory. Documents are written
 * one after the other; when one fails, the files already written stay in place.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class XmlWriter {

    private final PathsConfig pathsConfig;

    /**
     * Writes the trees into the configured output directory.
     *
     * @param trees trees to write
     * @return output directory
     * @throws IOException if a directory or file cannot be written
     */
    public Path write(List<RecipeTree> trees) throws IOException {
        return write(trees, null);
    }

    /**
     * Writes the trees into the given directory, or the configured one when {@code outputDir} is
     * {@code null}.
     *
     * @param trees trees to write; must not be empty
     * @param outputDir output directory, or {@code null}
     * @return output directory
     * @throws IOException if a directory or file cannot be written
     */
    public Path write(List<RecipeTree> trees, Path outputDir) throws IOException {
        Preconditions.checkArgument(trees != null && !trees.isEmpty(),
                "trees must not be empty");
        Path dir = outputDir != null ? outputDir.toAbsolutePath().normalize()
                : pathsConfig.resolveOutputDir(trees.get(0).getPath());
        FileUtils.forceMkdir(dir.toFile());

        for (RecipeTree tree : trees) {
            Path target = dir.resolve(tree.getSource());
            XmlUtils.write(tree.getDocument(), target);
            log.info("Wrote {}", target.getFileName());
        }
        log.info("Wrote {} document(s) to {}", trees.size(), LogPathUtil.renderDirForLog(dir));
        return dir;
    }
}
