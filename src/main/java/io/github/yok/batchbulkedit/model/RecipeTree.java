package io.github.yok.batchbulkedit.model;

import com.google.common.base.Preconditions;
import io.github.yok.batchbulkedit.util.XmlUtils;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

/**
 * One parsed recipe document and the Parameter and FormulaValue nodes extracted from it.
 *
 * <p>
 * The tree is identified by {@link #getSource()}, the file name of its document, which is also the
 * workbook sheet name. Nodes are kept in document order and share the tree's DOM; creating or
 * removing a node edits the document directly.
 * </p>
 *
 * <p>
 * Lookups by full path return the first match. Full paths are not guaranteed to be unique when a
 * recipe repeats a name.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class RecipeTree {

    private static final String PARAMETER = "Parameter";
    private static final String FORMULA_VALUE = "FormulaValue";
    private static final String STEPS = "Steps";
    private static final String STEP = "Step";

    // Step name of a FormulaValue path, e.g. TEST/Steps/Step[ACQ_REL:1]/FormulaValue[X]
    private static final Pattern STEP_IN_PATH =
            Pattern.compile(".*/Steps/Step\\[(.*?)\\]/FormulaValue\\[.*\\]$");

    @Getter
    private final Path path;
    @Getter
    private final Document document;
    @Getter
    private final String source;
    @Getter
    private final String recipeId;

    private final TypeFieldLimits limits;
    private final List<ParameterNode> parameters = new ArrayList<>();
    private final List<FormulaValueNode> formulaValues = new ArrayList<>();

    /**
     * Builds a tree over a parsed document and extracts its nodes.
     *
     * <p>
     * Parameters are the direct {@code Parameter} children of the root. FormulaValues are every
     * {@code FormulaValue} below the root {@code Steps} element, depth-first.
     * </p>
     *
     * @param path file the document was read from
     * @param document parsed document
     * @param limits type-field maxima handed to every node
     */
    public RecipeTree(Path path, Document document, TypeFieldLimits limits) {
        this.path = Preconditions.checkNotNull(path, "path must not be null");
        this.document = Preconditions.checkNotNull(document, "document must not be null");
        this.limits = Preconditions.checkNotNull(limits, "limits must not be null");
        this.source = path.getFileName().toString();
        Element root = document.getDocumentElement();
        this.recipeId = XmlUtils.childText(root, "RecipeElementID").trim();
        extractNodes(root);
        log.debug("Extracted nodes: source={}, recipeId={}, parameters={}, formulaValues={}",
                source, recipeId, parameters.size(), formulaValues.size());
    }

    /**
     * Returns the Parameters in document order.
     *
     * @return unmodifiable view
     */
    public List<ParameterNode> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    /**
     * Returns the FormulaValues in document order.
     *
     * @return unmodifiable view
     */
    public List<FormulaValueNode> getFormulaValues() {
        return Collections.unmodifiableList(formulaValues);
    }

    /**
     * Returns the nodes of one kind.
     *
     * @param tagType node kind
     * @return unmodifiable view in document order
     */
    public List<? extends RecipeNode> nodes(TagType tagType) {
        return tagType == TagType.PARAMETER ? getParameters() : getFormulaValues();
    }

    public Optional<ParameterNode> findParameter(String fullpath) {
        return parameters.stream().filter(p -> p.getFullpath().equals(fullpath)).findFirst();
    }

    public Optional<FormulaValueNode> findFormulaValue(String fullpath) {
        return formulaValues.stream().filter(f -> f.getFullpath().equals(fullpath)).findFirst();
    }

    /**
     * Looks up the first node of the given kind with the given full path.
     *
     * @param tagType node kind
     * @param fullpath full path
     * @return matching node
     */
    public Optional<? extends RecipeNode> find(TagType tagType, String fullpath) {
        return tagType == TagType.PARAMETER ? findParameter(fullpath) : findFormulaValue(fullpath);
    }

    /**
     * Returns whether a Parameter with the given {@code Name} exists.
     *
     * @param name parameter name
     * @return {@code true} if found
     */
    public boolean hasParameterNamed(String name) {
        return parameters.stream().anyMatch(
                p -> XmlUtils.childText(p.getElement(), WorkbookColumns.NAME).trim().equals(name));
    }

    /**
     * Creates a node of the given kind from an edited row.
     *
     * @param tagType node kind
     * @param row edited row
     * @return created node
     */
    public RecipeNode create(TagType tagType, Map<String, String> row) {
        return tagType == TagType.PARAMETER ? createParameter(row) : createFormulaValue(row);
    }

    /**
     * Creates a Parameter from an edited row and inserts it after the last Parameter.
     *
     * <p>
     * The row is applied to a detached element first, so a row that fails validation leaves the
     * document unchanged. Without any Parameter the new one goes before {@code Steps}, or last.
     * </p>
     *
     * @param row edited row; {@code Name} is required
     * @return created node
     * @throws ValidationException when the row has no name or no type field
     * @throws TypeConflictException when the row has too many type fields
     */
    public ParameterNode createParameter(Map<String, String> row) {
        String name = StringUtils.trimToEmpty(row.get(WorkbookColumns.NAME));
        if (name.isEmpty()) {
            throw new ValidationException(
                    row.get(WorkbookColumns.FULL_PATH) + ": new Parameter has no Name");
        }
        Element root = document.getDocumentElement();
        Element element = XmlUtils.createElement(root, PARAMETER);
        String fullpath = StringUtils.defaultIfBlank(
                StringUtils.trimToNull(row.get(WorkbookColumns.FULL_PATH)),
                parameterPath(recipeId, name));
        ParameterNode node =
                new ParameterNode(element, fullpath, source, limits.getParameterMax());
        node.apply(row);

        if (!parameters.isEmpty()) {
            insertAfter(parameters.get(parameters.size() - 1).getElement(), element);
        } else {
            Element steps = XmlUtils.findChild(root, STEPS);
            if (steps != null) {
                root.insertBefore(element, steps);
            } else {
                root.appendChild(element);
            }
        }
        parameters.add(node);
        log.debug("Created Parameter: {}", fullpath);
        return node;
    }

    /**
     * Creates a FormulaValue from an edited row under the step named in its full path.
     *
     * <p>
     * The new element goes after the last FormulaValue of that step, or last in the step.
     * </p>
     *
     * @param row edited row; {@code FullPath} must end in
     *        {@code /Steps/Step[<step>]/FormulaValue[<name>]}
     * @return created node
     * @throws ValidationException when the path cannot be parsed or the step does not exist
     * @throws TypeConflictException when the row has too many type fields
     */
    public FormulaValueNode createFormulaValue(Map<String, String> row) {
        String fullpath = StringUtils.trimToEmpty(row.get(WorkbookColumns.FULL_PATH));
        Matcher matcher = STEP_IN_PATH.matcher(fullpath);
        if (!matcher.matches()) {
            throw new ValidationException(fullpath + ": cannot parse step");
        }
        String stepName = matcher.group(1);
        Element step = findStep(stepName);
        if (step == null) {
            throw new ValidationException("Step '" + stepName + "' not found");
        }
        Element element = XmlUtils.createElement(step, FORMULA_VALUE);
        FormulaValueNode node =
                new FormulaValueNode(element, fullpath, source, limits.getFormulaValueMax());
        node.apply(row);

        List<Element> siblings = new ArrayList<>();
        for (Element child : XmlUtils.childElements(step)) {
            if (FORMULA_VALUE.equals(XmlUtils.localName(child))) {
                siblings.add(child);
            }
        }
        if (siblings.isEmpty()) {
            step.appendChild(element);
        } else {
            insertAfter(siblings.get(siblings.size() - 1), element);
        }
        formulaValues.add(node);
        log.debug("Created FormulaValue: {}", fullpath);
        return node;
    }

    /**
     * Detaches the node's element from the document and forgets the node.
     *
     * @param node node owned by this tree
     */
    public void remove(RecipeNode node) {
        Element element = node.getElement();
        Node parent = element.getParentNode();
        if (parent != null) {
            parent.removeChild(element);
        }
        if (node.getTagType() == TagType.PARAMETER) {
            parameters.remove(node);
        } else {
            formulaValues.remove(node);
        }
        log.debug("Removed {}: {}", node.getTagType().getLabel(), node.getFullpath());
    }

    /**
     * Returns the {@code StepRecipeID} of every step, in document order.
     *
     * @return referenced recipe ids (may contain {@code $NULL})
     */
    public List<String> stepRecipeIds() {
        List<String> ids = new ArrayList<>();
        Element steps = XmlUtils.findChild(document.getDocumentElement(), STEPS);
        if (steps == null) {
            return ids;
        }
        for (Element step : XmlUtils.descendants(steps, STEP)) {
            String id = XmlUtils.childText(step, "StepRecipeID").trim();
            if (!id.isEmpty()) {
                ids.add(id);
            }
        }
        return ids;
    }

    public static String parameterPath(String recipeId, String name) {
        return recipeId + "/Parameter[" + name + "]";
    }

    public static String formulaValuePath(String recipeId, String stepName, String name) {
        return recipeId + "/Steps/Step[" + stepName + "]/FormulaValue[" + name + "]";
    }

    private void extractNodes(Element root) {
        for (Element child : XmlUtils.childElements(root)) {
            if (PARAMETER.equals(XmlUtils.localName(child))) {
                String name = XmlUtils.childText(child, WorkbookColumns.NAME).trim();
                parameters.add(new ParameterNode(child, parameterPath(recipeId, name), source,
                        limits.getParameterMax()));
            }
        }
        Element steps = XmlUtils.findChild(root, STEPS);
        if (steps == null) {
            return;
        }
        for (Element fv : XmlUtils.descendants(steps, FORMULA_VALUE)) {
            String name = XmlUtils.childText(fv, WorkbookColumns.NAME).trim();
            String stepName = "";
            if (fv.getParentNode() instanceof Element) {
                stepName = XmlUtils.childText((Element) fv.getParentNode(), WorkbookColumns.NAME)
                        .trim();
            }
            formulaValues.add(new FormulaValueNode(fv, formulaValuePath(recipeId, stepName, name),
                    source, limits.getFormulaValueMax()));
        }
    }

    private Element findStep(String stepName) {
        Element steps = XmlUtils.findChild(document.getDocumentElement(), STEPS);
        if (steps == null) {
            return null;
        }
        for (Element step : XmlUtils.descendants(steps, STEP)) {
            if (XmlUtils.childText(step, WorkbookColumns.NAME).trim().equals(stepName)) {
                return step;
            }
        }
        return null;
    }

    private static void insertAfter(Element anchor, Element element) {
        anchor.getParentNode().insertBefore(element, anchor.getNextSibling());
    }
}
