package io.github.yok.batchbulkedit.config;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that holds settings for reading and validating recipe documents.
 *
 * <p>
 * You can specify the following properties in {@code application.yml}.
 * </p>
 * <ul>
 * <li>{@code recipe.follow-child-references}: parse the documents referenced by
 * {@code Step/StepRecipeID} as well</li>
 * <li>{@code recipe.child-extensions}: extensions tried, in order, when resolving a reference</li>
 * <li>{@code recipe.parameter-max-type-fields}: populated type fields a Parameter row may
 * carry</li>
 * <li>{@code recipe.formula-value-max-type-fields}: populated type fields (including
 * {@code Defer}) a FormulaValue row may carry</li>
 * <li>{@code recipe.validate-defer-targets}: fail the import when a {@code Defer} names no
 * Parameter of the same document</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "recipe")
@Getter
@Setter
@NoArgsConstructor
public class RecipeConfig {

    private boolean followChildReferences = true;

    private List<String> childExtensions = ImmutableList.of("pxml", "uxml", "oxml");

    private int parameterMaxTypeFields = 1;

    // A deferred FormulaValue carries Defer next to its data type
    private int formulaValueMaxTypeFields = 2;

    private boolean validateDeferTargets = false;
}
