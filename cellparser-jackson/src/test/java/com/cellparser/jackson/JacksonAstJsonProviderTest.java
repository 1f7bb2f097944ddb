package com.cellparser.jackson;

import com.cellparser.CellParsing;
import com.cellparser.ast.Cell;
import com.cellparser.ast.CellModule;
import com.cellparser.ast.Span;
import com.cellparser.json.AstJsonProvider;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonAstJsonProviderTest {

    private final ObjectMapper mapper = CellJackson.createObjectMapper();

    private JsonNode toTree(Object value) throws Exception {
        return mapper.readTree(mapper.writeValueAsString(value));
    }

    @Test
    void testProviderIsDiscovered() {
        assertTrue(AstJsonProvider.isProviderAvailable());
        assertEquals("Jackson", AstJsonProvider.getProvider().getName());
        assertInstanceOf(JacksonAstJsonProvider.class, AstJsonProvider.getProvider("jackson"));
        assertThrows(IllegalStateException.class, () -> AstJsonProvider.getProvider("gson"));
    }

    @Test
    void testCellShape() throws Exception {
        JsonNode json = toTree(CellParsing.parseCell("data = FileAttachment(\"a.csv\")"));

        assertEquals("Cell", json.get("type").asText());
        assertEquals(0, json.get("start").asInt());
        assertEquals(30, json.get("end").asInt());
        assertEquals(1, json.get("loc").get("start").get("line").asInt());
        assertFalse(json.has("startLine"));
        assertFalse(json.has("input"));

        assertEquals("Identifier", json.get("id").get("type").asText());
        assertEquals("data", json.get("id").get("name").asText());
        assertFalse(json.get("async").asBoolean());
        assertFalse(json.get("generator").asBoolean());
        assertEquals("CallExpression", json.get("body").get("type").asText());

        JsonNode spans = json.get("fileAttachments").get("a.csv");
        assertEquals(1, spans.size());
        assertEquals(22, spans.get(0).get("start").asInt());
        assertEquals(29, spans.get(0).get("end").asInt());

        assertEquals("FileAttachment", json.get("references").get(0).get("name").asText());
    }

    @Test
    void testNullMembersThatAreAlwaysWritten() throws Exception {
        JsonNode json = toTree(CellParsing.parseCell("x => { if (x) return 1; }"));

        assertTrue(json.get("id").isNull());
        JsonNode arrow = json.get("body");
        assertTrue(arrow.get("id").isNull());
        JsonNode ifStatement = arrow.get("body").get("body").get(0);
        assertEquals("IfStatement", ifStatement.get("type").asText());
        assertTrue(ifStatement.has("alternate"));
        assertTrue(ifStatement.get("alternate").isNull());
    }

    @Test
    void testImportCellHasNoReferences() throws Exception {
        JsonNode json = toTree(CellParsing.parseCell("import {viewof x as y} from \"@a/b\""));

        assertEquals("ImportDeclaration", json.get("body").get("type").asText());
        assertFalse(json.has("references"));
    }

    @Test
    void testStaticMethodFlag() throws Exception {
        JsonNode json = toTree(CellParsing.parseCell("class A { static m() {} n() {} }"));

        JsonNode methods = json.get("body").get("body").get("body");
        assertTrue(methods.get(0).get("static").asBoolean());
        assertFalse(methods.get(1).get("static").asBoolean());
        assertFalse(methods.get(0).has("isStatic"));
    }

    @Test
    void testNumbersAreWrittenTheJavaScriptWay() throws Exception {
        JsonNode json = toTree(CellParsing.parseCell("[10, 1.5, 0x10]"));

        JsonNode elements = json.get("body").get("elements");
        assertTrue(elements.get(0).get("value").isIntegralNumber());
        assertEquals(10, elements.get(0).get("value").asInt());
        assertEquals(1.5, elements.get(1).get("value").asDouble());
        assertEquals(16, elements.get(2).get("value").asInt());
    }

    @Test
    void testModuleSerializesAsProgram() throws Exception {
        CellModule module = CellParsing.parseModule("a = 1\nb = a + 1");

        String json = AstJsonProvider.getProvider().getSerializer().serialize(module);
        JsonNode tree = mapper.readTree(json);

        assertEquals("Program", tree.get("type").asText());
        assertEquals(2, tree.get("cells").size());
        assertEquals("a", tree.get("cells").get(1).get("references").get(0).get("name").asText());
    }

    @Test
    void testPrettyOutputMatchesCompactOutput() throws Exception {
        Cell cell = CellParsing.parseCell("x = y");
        JacksonAstJsonProvider provider = new JacksonAstJsonProvider();

        String compact = provider.getSerializer().serialize(cell);
        String pretty = provider.getSerializer().serializePretty(cell);

        assertTrue(pretty.contains("\n"));
        assertEquals(mapper.readTree(compact), mapper.readTree(pretty));
    }

    @Test
    void testSpanCanBeReadBack() throws Exception {
        Span span = mapper.readValue("{\"start\":3,\"end\":9,\"extra\":true}", Span.class);

        assertEquals(new Span(3, 9), span);
    }
}
