package io.github.yok.batchbulkedit.parser;

import com.google.common.base.Preconditions;
import io.github.yok.batchbulkedit.config.RecipeConfig;
import io.github.yok.batchbulkedit.model.RecipeTree;
import io.github.yok.batchbulkedit.model.TypeFieldLimits;
import io.github.yok.batchbulkedit.util.XmlUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import javax.xml.parsers.ParserConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.xml.sax.SAXException;

/**
 * Reads recipe documents into {@link RecipeTree}s.
 *
 * <p>
 * A parent document is parsed first. When {@code recipe.follow-child-references} is enabled, each
 * {@code Step/StepRecipeID} other than {@code $NULL} is looked up as {@code <id>.<ext>} in the
 * parent's directory and parsed as well, depth-first. A document is parsed at most once per call,
 * which also stops reference cycles. References without a matching file are skipped.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecipeParser {

    // StepRecipeID of a step that references no document
    static final String NULL_REFERENCE = "$NULL";

    private final RecipeConfig recipeConfig;

    /**
     * Parses one parent document and the documents it references.
     *
     * @param file parent document
     * @return trees in parse order, parent first
     * @throws IOException if a document cannot be read
     * @throws SAXException if a document is not well-formed
     * @throws ParserConfigurationException if the XML parser cannot be configured
     */
    public List<RecipeTree> parse(Path file)
            throws IOException, SAXException, ParserConfigurationException {
        List<RecipeTree> trees = new ArrayList<>();
        parseRecursive(file, new HashSet<>(), trees);
        return trees;
    }

    /**
     * Parses several parent documents. A document referenced from more than one parent is parsed
     * once.
     *
     * @param files parent documents
     * @return trees in parse order
     * @throws IOException if a document cannot be read
     * @throws SAXException if a document is not well-formed
     * @throws ParserConfigurationException if the XML parser cannot be configured
     */
    public List<RecipeTree> parse(List<Path> files)
            throws IOException, SAXException, ParserConfigurationException {
        Set<Path> visited = new HashSet<>();
        List<RecipeTree> trees = new ArrayList<>();
        for (Path file : files) {
            parseRecursive(file, visited, trees);
        }
        return trees;
    }

    private void parseRecursive(Path file, Set<Path> visited, List<RecipeTree> trees)
            throws IOException, SAXException, ParserConfigurationException {
        Preconditions.checkNotNull(file, "file must not be null");
        Path normalized = file.toAbsolutePath().normalize();
        if (!visited.add(normalized)) {
            log.debug("Already parsed, skipped: {}", normalized);
            return;
        }
        if (!RecipeFormat.of(normalized).isPresent()) {
            log.warn("Not a recipe file extension, parsing anyway: {}", normalized);
        }
        Document document = XmlUtils.parse(normalized);
        RecipeTree tree = new RecipeTree(normalized, document, typeFieldLimits());
        trees.add(tree);
        log.info("Parsed {}: parameters={}, formulaValues={}", tree.getSource(),
                tree.getParameters().size(), tree.getFormulaValues().size());

        if (!recipeConfig.isFollowChildReferences()) {
            return;
        }
        for (String id : tree.stepRecipeIds()) {
            if (NULL_REFERENCE.equals(id)) {
                continue;
            }
            Optional<Path> child = resolveChild(normalized.getParent(), id);
            if (child.isPresent()) {
                parseRecursive(child.get(), visited, trees);
            } else {
                log.debug("No document for StepRecipeID {} in {}", id, normalized.getParent());
            }
        }
    }

    private Optional<Path> resolveChild(Path dir, String id) {
        for (String ext : recipeConfig.getChildExtensions()) {
            Path candidate = dir.resolve(id + "." + ext);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private TypeFieldLimits typeFieldLimits() {
        return new TypeFieldLimits(recipeConfig.getParameterMaxTypeFields(),
                recipeConfig.getFormulaValueMaxTypeFields());
    }
}
