package io.github.yok.batchbulkedit.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.batchbulkedit.TestRecipes;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

class XmlUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void parse_正常ケース_名前空間付き文書を指定する_ローカル名で要素を参照できること() throws Exception {
        Document document = XmlUtils.parse(TestRecipes.resource("TEST.pxml"));
        Element root = document.getDocumentElement();

        assertEquals("RecipeElement", XmlUtils.localName(root));
        assertEquals("urn:Rockwell/MasterRecipe", root.getNamespaceURI());
        assertEquals("TEST", XmlUtils.childText(root, "RecipeElementID"));
        assertEquals("", XmlUtils.childText(root, "Missing"));
        assertNull(XmlUtils.findChild(root, "Missing"));
    }

    @Test
    void parse_異常ケース_整形式でない文書を指定する_SAXExceptionが送出されること() throws Exception {
        Path file = TestRecipes.write(tempDir, "BROKEN.pxml", "<RecipeElement><Parameter>");
        assertThrows(SAXException.class, () -> XmlUtils.parse(file));
    }

    @Test
    void parse_異常ケース_DOCTYPE宣言を含む文書を指定する_SAXExceptionが送出されること()
            throws Exception {
        Path file = TestRecipes.write(tempDir, "DTD.pxml",
                "<?xml version=\"1.0\"?><!DOCTYPE r [<!ENTITY x SYSTEM \"file:///etc/passwd\">]>"
                        + "<r>&x;</r>");
        assertThrows(SAXException.class, () -> XmlUtils.parse(file));
    }

    @Test
    void descendants_正常ケース_Steps配下を検索する_深さ優先の文書順で返ること() throws Exception {
        Element root = XmlUtils.parse(TestRecipes.resource("TEST.pxml")).getDocumentElement();

        List<String> names = XmlUtils.descendants(root, "FormulaValue").stream()
                .map(e -> XmlUtils.childText(e, "Name")).collect(Collectors.toList());

        assertEquals(2, names.size());
        assertEquals("X_R_END_PHASE_PROMPT", names.get(0));
        assertEquals("X_R_END_TYPE", names.get(1));
    }

    @Test
    void createElement_正常ケース_接頭辞付き文書を指定する_同じ名前空間と接頭辞で作成されること()
            throws Exception {
        Path file = TestRecipes.write(tempDir, "PREFIX.pxml",
                "<mr:RecipeElement xmlns:mr=\"urn:Rockwell/MasterRecipe\"/>");
        Element root = XmlUtils.parse(file).getDocumentElement();

        Element created = XmlUtils.createElement(root, "Parameter");

        assertEquals("urn:Rockwell/MasterRecipe", created.getNamespaceURI());
        assertEquals("mr:Parameter", created.getTagName());
        assertEquals("Parameter", XmlUtils.localName(created));
        assertNull(created.getParentNode());
    }

    @Test
    void write_正常ケース_文書を書き出す_コメントと名前空間を保持し2スペースで字下げされること()
            throws Exception {
        Document document = XmlUtils.parse(TestRecipes.resource("TEST.pxml"));
        Path out = tempDir.resolve("out.pxml");

        XmlUtils.write(document, out);

        String content = new String(Files.readAllBytes(out), StandardCharsets.UTF_8);
        assertTrue(content.startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\""));
        assertTrue(content.contains("xmlns=\"urn:Rockwell/MasterRecipe\""));
        assertTrue(content.contains("<!-- Three Parameters -->"));
        List<String> lines = content.lines().collect(Collectors.toList());
        assertTrue(lines.contains("  <RecipeElementID>TEST</RecipeElementID>"));
        assertTrue(lines.contains("    <Name>XFER5_TARGET_CONC_DB</Name>"));
        assertEquals("TEST", XmlUtils.childText(XmlUtils.parse(out).getDocumentElement(),
                "RecipeElementID"));
    }

    @Test
    void write_正常ケース_宣言付きの文書を書き出す_宣言とルート要素が別の行に出力されること()
            throws Exception {
        Document document = XmlUtils.parse(TestRecipes.resource("TEST.pxml"));
        Path out = tempDir.resolve("out.pxml");

        XmlUtils.write(document, out);

        List<String> lines = new String(Files.readAllBytes(out), StandardCharsets.UTF_8).lines()
                .collect(Collectors.toList());
        assertEquals("<?xml version=\"1.0\" encoding=\"UTF-8\"?>", lines.get(0));
        assertEquals("<RecipeElement xmlns=\"urn:Rockwell/MasterRecipe\">", lines.get(1));
        assertEquals("</RecipeElement>", lines.get(lines.size() - 1));
    }

    @Test
    void declaration_正常ケース_standalone指定の文書を指定する_standalone属性が出力されること()
            throws Exception {
        Path file = TestRecipes.write(tempDir, "SA.pxml",
                "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?><r/>");
        Document document = XmlUtils.parse(file);

        assertEquals("<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>"
                + System.lineSeparator(), XmlUtils.declaration(document, "UTF-8"));
    }

    @Test
    void write_正常ケース_Shift_JIS宣言の文書を書き出す_宣言された文字コードが維持されること()
            throws Exception {
        Path file = tempDir.resolve("SJIS.pxml");
        Files.write(file, ("<?xml version=\"1.0\" encoding=\"Shift_JIS\"?>"
                + "<RecipeElement><RecipeElementID>日本語</RecipeElementID></RecipeElement>")
                        .getBytes("Shift_JIS"));
        Document document = XmlUtils.parse(file);
        Path out = tempDir.resolve("SJIS_out.pxml");

        XmlUtils.write(document, out);

        String head = new String(Files.readAllBytes(out), "Shift_JIS");
        assertTrue(head.contains("encoding=\"Shift_JIS\""));
        assertEquals("日本語", XmlUtils.childText(XmlUtils.parse(out).getDocumentElement(),
                "RecipeElementID"));
    }

    @Test
    void stripIndentation_正常ケース_葉要素の空白テキストを指定する_葉要素の空白は維持されること()
            throws Exception {
        Path file = TestRecipes.write(tempDir, "WS.pxml", "<r>\n  <a> </a>\n  <b/>\n</r>");
        Element root = XmlUtils.parse(file).getDocumentElement();

        XmlUtils.stripIndentation(root);

        assertEquals(2, root.getChildNodes().getLength());
        assertEquals(" ", XmlUtils.childText(root, "a"));
        assertTrue(XmlUtils.hasChildElements(root));
        assertFalse(XmlUtils.hasChildElements(XmlUtils.findChild(root, "a")));
    }
}
