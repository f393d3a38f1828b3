package io.github.yok.batchbulkedit.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.batchbulkedit.TestRecipes;
import io.github.yok.batchbulkedit.config.PathsConfig;
import io.github.yok.batchbulkedit.config.RecipeConfig;
import io.github.yok.batchbulkedit.model.RecipeTree;
import io.github.yok.batchbulkedit.parser.RecipeParser;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class XmlWriterTest {

    @TempDir
    Path tempDir;

    private PathsConfig pathsConfig;
    private XmlWriter writer;
    private RecipeParser parser;

    @BeforeEach
    void setUp() {
        pathsConfig = new PathsConfig();
        writer = new XmlWriter(pathsConfig);
        parser = new RecipeParser(new RecipeConfig());
    }

    @Test
    void write_正常ケース_出力先未設定の場合_元文書の隣のupdatedへ書き出されること() throws Exception {
        List<RecipeTree> trees = parser.parse(TestRecipes.copy(tempDir, "TEST.pxml"));

        Path dir = writer.write(trees);

        assertEquals(tempDir.resolve("updated").toAbsolutePath().normalize(), dir);
        List<RecipeTree> reparsed = parser.parse(dir.resolve("TEST.pxml"));
        assertEquals("TEST", reparsed.get(0).getRecipeId());
        assertEquals(3, reparsed.get(0).getParameters().size());
    }

    @Test
    void write_正常ケース_出力先を指定する_全文書が同じディレクトリへ書き出されること() throws Exception {
        Path proc = TestRecipes.copy(tempDir, "PROC.pxml", "UP_MIX.uxml", "OP_AGITATE.oxml");
        List<RecipeTree> trees = parser.parse(proc);
        Path out = tempDir.resolve("a").resolve("b");

        Path dir = writer.write(trees, out);

        assertEquals(out.toAbsolutePath().normalize(), dir);
        assertTrue(Files.isRegularFile(out.resolve("PROC.pxml")));
        assertTrue(Files.isRegularFile(out.resolve("UP_MIX.uxml")));
        assertTrue(Files.isRegularFile(out.resolve("OP_AGITATE.oxml")));
        assertEquals(3, parser.parse(out.resolve("PROC.pxml")).size());
    }

    @Test
    void write_正常ケース_設定の出力先を使用する_設定したディレクトリへ書き出されること() throws Exception {
        pathsConfig.setOutputDir(tempDir.resolve("configured").toString());
        List<RecipeTree> trees = parser.parse(TestRecipes.copy(tempDir, "TEST.pxml"));

        Path dir = writer.write(trees);

        assertTrue(Files.isRegularFile(dir.resolve("TEST.pxml")));
        assertEquals("configured", dir.getFileName().toString());
    }

    @Test
    void write_異常ケース_空の一覧を指定する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> writer.write(Collections.emptyList()));
    }
}
