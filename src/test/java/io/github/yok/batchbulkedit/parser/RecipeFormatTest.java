package io.github.yok.batchbulkedit.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.nio.file.Paths;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RecipeFormatTest {

    @Test
    void of_正常ケース_レシピ拡張子を指定する_対応する形式が返ること() {
        assertEquals(Optional.of(RecipeFormat.PROCEDURE),
                RecipeFormat.of(Paths.get("a/TEST.pxml")));
        assertEquals(Optional.of(RecipeFormat.UNIT_PROCEDURE),
                RecipeFormat.of(Paths.get("UP_MIX.UXML")));
        assertEquals(Optional.of(RecipeFormat.OPERATION), RecipeFormat.of(Paths.get("OP.oxml")));
    }

    @Test
    void of_正常ケース_レシピ以外の拡張子を指定する_空が返ること() {
        assertFalse(RecipeFormat.of(Paths.get("TEST.xml")).isPresent());
        assertFalse(RecipeFormat.of(Paths.get("TEST")).isPresent());
    }

    @Test
    void matches_正常ケース_大文字小文字の異なる拡張子を指定する_一致と判定されること() {
        assertTrue(RecipeFormat.PROCEDURE.matches("PXML"));
        assertFalse(RecipeFormat.PROCEDURE.matches("uxml"));
    }
}
