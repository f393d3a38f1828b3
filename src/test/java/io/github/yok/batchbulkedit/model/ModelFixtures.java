package io.github.yok.batchbulkedit.model;

import io.github.yok.batchbulkedit.TestRecipes;
import io.github.yok.batchbulkedit.util.XmlUtils;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.w3c.dom.Element;

/**
 * Builds recipe trees for model tests.
 */
final class ModelFixtures {

    static final String TRANSFER_TYPE = "TEST/Parameter[XFER5_TRANSFER_TYPE]";
    static final String TARGET_CONC = "TEST/Parameter[XFER5_TARGET_CONC_DB]";
    static final String END_TYPE = "TEST/Steps/Step[ACQ_REL:1]/FormulaValue[X_R_END_TYPE]";
    static final String END_PROMPT =
            "TEST/Steps/Step[ACQ_REL:1]/FormulaValue[X_R_END_PHASE_PROMPT]";

    private ModelFixtures() {
        // Utility class; do not instantiate.
    }

    static RecipeTree load(Path file) throws Exception {
        return new RecipeTree(file, XmlUtils.parse(file), TypeFieldLimits.DEFAULT);
    }

    static RecipeTree testRecipe() throws Exception {
        return load(TestRecipes.resource("TEST.pxml"));
    }

    static RecipeTree fromString(Path dir, String body) throws Exception {
        return load(TestRecipes.write(dir, "SAMPLE.pxml", TestRecipes.recipe("SAMPLE", body)));
    }

    static List<String> childNames(Element element) {
        List<String> names = new ArrayList<>();
        for (Element child : XmlUtils.childElements(element)) {
            names.add(XmlUtils.localName(child));
        }
        return names;
    }
}
