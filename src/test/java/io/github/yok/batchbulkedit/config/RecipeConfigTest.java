package io.github.yok.batchbulkedit.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class RecipeConfigTest {

    @Test
    void getter_正常ケース_デフォルト値を取得する_既定値が返ること() {
        RecipeConfig config = new RecipeConfig();

        assertTrue(config.isFollowChildReferences());
        assertEquals(Arrays.asList("pxml", "uxml", "oxml"), config.getChildExtensions());
        assertEquals(1, config.getParameterMaxTypeFields());
        assertEquals(2, config.getFormulaValueMaxTypeFields());
        assertFalse(config.isValidateDeferTargets());
    }

    @Test
    void setter_正常ケース_各プロパティを設定して取得する_設定値が返ること() {
        RecipeConfig config = new RecipeConfig();
        config.setFollowChildReferences(false);
        config.setChildExtensions(Arrays.asList("uxml"));
        config.setParameterMaxTypeFields(2);
        config.setFormulaValueMaxTypeFields(3);
        config.setValidateDeferTargets(true);

        assertFalse(config.isFollowChildReferences());
        assertEquals(Arrays.asList("uxml"), config.getChildExtensions());
        assertEquals(2, config.getParameterMaxTypeFields());
        assertEquals(3, config.getFormulaValueMaxTypeFields());
        assertTrue(config.isValidateDeferTargets());
    }
}
