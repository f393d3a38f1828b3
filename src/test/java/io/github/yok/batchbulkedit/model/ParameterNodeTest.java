package io.github.yok.batchbulkedit.model;

import static io.github.yok.batchbulkedit.model.ModelFixtures.TARGET_CONC;
import static io.github.yok.batchbulkedit.model.ModelFixtures.TRANSFER_TYPE;
import static io.github.yok.batchbulkedit.model.ModelFixtures.childNames;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.batchbulkedit.util.XmlUtils;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Element;

class ParameterNodeTest {

    @TempDir
    Path tempDir;

    @Test
    void project_正常ケース_列挙型パラメータを指定する_固定列と追加列が返ること() throws Exception {
        ParameterNode node = ModelFixtures.testRecipe().findParameter(TRANSFER_TYPE).get();

        Map<String, String> row = node.project();

        List<String> keys = new ArrayList<>(row.keySet());
        assertEquals(WorkbookColumns.FIXED, keys.subList(0, WorkbookColumns.FIXED.size()));
        assertEquals("Parameter", row.get("TagType"));
        assertEquals("XFER5_TRANSFER_TYPE", row.get("Name"));
        assertEquals(TRANSFER_TYPE, row.get("FullPath"));
        assertEquals("N_OPTION", row.get("EnumerationSet"));
        assertEquals("OPTION_1", row.get("EnumerationMember"));
        assertEquals("", row.get("Real"));
        assertEquals("", row.get("Defer"));
        assertEquals("", row.get("FormulaValueLimit_HighValue"));
        assertEquals("", row.get("ERPAlias"));
        assertEquals("1", row.get("PLCReference"));
    }

    @Test
    void project_正常ケース_2回呼び出す_同じ行が返ること() throws Exception {
        ParameterNode node = ModelFixtures.testRecipe().findParameter(TARGET_CONC).get();
        assertEquals(node.project(), node.project());
    }

    @Test
    void apply_正常ケース_High列を変更する_要素の値が更新されること() throws Exception {
        ParameterNode node = ModelFixtures.testRecipe().findParameter(TARGET_CONC).get();
        List<String> before = childNames(node.getElement());

        Map<String, String> row = node.project();
        row.put("High", " 500 ");
        node.apply(row);

        assertEquals("500", XmlUtils.childText(node.getElement(), "High"));
        assertEquals(before, childNames(node.getElement()));
    }

    @Test
    void apply_正常ケース_RealからIntegerへ切り替える_Integerの正規順序になること() throws Exception {
        ParameterNode node = ModelFixtures.testRecipe().findParameter(TARGET_CONC).get();

        Map<String, String> row = node.project();
        row.put("Real", "");
        row.put("Integer", "7");
        node.apply(row);

        assertEquals(Arrays.asList("Name", "ERPAlias", "PLCReference", "Integer", "High", "Low",
                "EngineeringUnits", "Scale"), childNames(node.getElement()));
        assertEquals("7", XmlUtils.childText(node.getElement(), "Integer"));
        assertNull(XmlUtils.findChild(node.getElement(), "Real"));
    }

    @Test
    void apply_異常ケース_型フィールドを2つ指定する_TypeConflictExceptionが送出され要素が変更されないこと()
            throws Exception {
        ParameterNode node = ModelFixtures.testRecipe().findParameter(TARGET_CONC).get();
        List<String> before = childNames(node.getElement());

        Map<String, String> row = node.project();
        row.put("Real", "1");
        row.put("Integer", "2");
        row.put("High", "1");
        TypeConflictException ex = assertThrows(TypeConflictException.class, () -> node.apply(row));

        assertTrue(ex.getMessage().startsWith(TARGET_CONC));
        assertEquals(before, childNames(node.getElement()));
        assertEquals("0", XmlUtils.childText(node.getElement(), "Real"));
        assertEquals("9999", XmlUtils.childText(node.getElement(), "High"));
    }

    @Test
    void apply_異常ケース_要素名にできない列を指定する_ValidationExceptionが送出され要素が変更されないこと()
            throws Exception {
        ParameterNode node = ModelFixtures.testRecipe().findParameter(TARGET_CONC).get();

        Map<String, String> row = node.project();
        row.put("High", "1");
        row.put("Bad Name", "x");

        assertThrows(ValidationException.class, () -> node.apply(row));
        assertEquals("9999", XmlUtils.childText(node.getElement(), "High"));
    }

    @Test
    void apply_正常ケース_Defer列を指定する_Parameterでは無視されること() throws Exception {
        ParameterNode node = ModelFixtures.testRecipe().findParameter(TRANSFER_TYPE).get();

        Map<String, String> row = node.project();
        row.put("Defer", "OTHER");
        node.apply(row);

        assertNull(XmlUtils.findChild(node.getElement(), "Defer"));
    }

    @Test
    void apply_正常ケース_空値で未定義の列を指定する_要素が作成されないこと() throws Exception {
        ParameterNode node = ModelFixtures.testRecipe().findParameter(TRANSFER_TYPE).get();

        Map<String, String> row = node.project();
        row.put("Remark", "  ");
        node.apply(row);

        assertNull(XmlUtils.findChild(node.getElement(), "Remark"));
        assertNull(XmlUtils.findChild(node.getElement(), "Real"));
    }

    @Test
    void apply_正常ケース_未知フィールドを持つパラメータを編集する_未知フィールドが末尾に保持されること()
            throws Exception {
        RecipeTree tree = ModelFixtures.fromString(tempDir,
                "  <Parameter><Name>P1</Name><ERPAlias/><PLCReference>1</PLCReference>"
                        + "<Comment>keep me</Comment><String>abc</String>"
                        + "<EngineeringUnits/></Parameter>\n");
        ParameterNode node = tree.findParameter("SAMPLE/Parameter[P1]").get();

        Map<String, String> row = node.project();
        assertEquals("keep me", row.get("Comment"));
        row.put("String", "xyz");
        node.apply(row);

        assertEquals(Arrays.asList("Name", "ERPAlias", "PLCReference", "String",
                "EngineeringUnits", "Comment"), childNames(node.getElement()));
        assertEquals("xyz", XmlUtils.childText(node.getElement(), "String"));
        assertEquals("keep me", XmlUtils.childText(node.getElement(), "Comment"));
    }

    @Test
    void project_正常ケース_子要素を持つ未知フィールドを指定する_テキストが追加列に出力されること()
            throws Exception {
        RecipeTree tree = ModelFixtures.fromString(tempDir,
                "  <Parameter><Name>P3</Name><Real>2</Real>"
                        + "<Alarm>\n      <Level>2</Level>\n      <Text>too high</Text>\n    </Alarm>"
                        + "</Parameter>\n");
        ParameterNode node = tree.findParameter("SAMPLE/Parameter[P3]").get();

        Map<String, String> row = node.project();

        assertEquals("2 too high", row.get("Alarm"));
        assertEquals("2 too high", node.getOriginalFields().get("Alarm"));
    }

    @Test
    void apply_正常ケース_子要素を持つ未知フィールドの列を変更する_子要素が変更されないこと()
            throws Exception {
        RecipeTree tree = ModelFixtures.fromString(tempDir,
                "  <Parameter><Name>P3</Name><Real>2</Real>"
                        + "<Alarm><Level>2</Level><Text>too high</Text></Alarm></Parameter>\n");
        ParameterNode node = tree.findParameter("SAMPLE/Parameter[P3]").get();

        Map<String, String> row = node.project();
        row.put("Alarm", "overwritten");
        row.put("Real", "3");
        node.apply(row);

        assertEquals("3", XmlUtils.childText(node.getElement(), "Real"));
        Element alarm = XmlUtils.findChild(node.getElement(), "Alarm");
        assertEquals(Arrays.asList("Level", "Text"), childNames(alarm));
        assertEquals("2", XmlUtils.childText(alarm, "Level"));
        assertEquals("too high", XmlUtils.childText(alarm, "Text"));
        assertEquals("Alarm", childNames(node.getElement()).get(8));
    }

    @Test
    void canonicalize_正常ケース_順序が崩れた要素を指定する_正規順序に並び替え不足要素が補われること()
            throws Exception {
        RecipeTree tree = ModelFixtures.fromString(tempDir,
                "  <Parameter><Real>1.5</Real><Name>P2</Name><Low>0</Low></Parameter>\n");
        ParameterNode node = tree.getParameters().get(0);

        node.canonicalize();

        assertEquals(Arrays.asList("Name", "ERPAlias", "PLCReference", "Real", "High", "Low",
                "EngineeringUnits", "Scale"), childNames(node.getElement()));
        assertEquals("", XmlUtils.childText(node.getElement(), "High"));
        assertFalse(XmlUtils.hasChildElements(XmlUtils.findChild(node.getElement(), "Scale")));
    }

    @Test
    void canonicalize_正常ケース_2回呼び出す_結果が変わらないこと() throws Exception {
        ParameterNode node = ModelFixtures.testRecipe().findParameter(TRANSFER_TYPE).get();

        node.canonicalize();
        List<String> first = childNames(node.getElement());
        Map<String, String> firstRow = node.project();
        node.canonicalize();

        assertEquals(first, childNames(node.getElement()));
        assertEquals(Arrays.asList("Name", "ERPAlias", "PLCReference", "EnumerationSet",
                "EnumerationMember"), first);
        assertEquals(firstRow, node.project());
    }

    @Test
    void canonicalize_異常ケース_型フィールドがない要素を指定する_ValidationExceptionが送出されること()
            throws Exception {
        RecipeTree tree = ModelFixtures.fromString(tempDir,
                "  <Parameter><Name>NO_TYPE</Name></Parameter>\n");
        ParameterNode node = tree.getParameters().get(0);

        ValidationException ex = assertThrows(ValidationException.class, node::canonicalize);
        assertEquals("SAMPLE/Parameter[NO_TYPE]: no recognized type", ex.getMessage());
    }

    @Test
    void getOriginalFields_正常ケース_構築後に要素を編集する_スナップショットが変わらないこと()
            throws Exception {
        ParameterNode node = ModelFixtures.testRecipe().findParameter(TARGET_CONC).get();

        Map<String, String> row = node.project();
        row.put("High", "1");
        node.apply(row);

        assertEquals("9999", node.getOriginalFields().get("High"));
        assertEquals(TagType.PARAMETER, node.getTagType());
        assertEquals("TEST.pxml", node.getSource());
    }
}
