package com.logscale.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logscale.query.QueryParser;
import org.junit.jupiter.api.Test;

class SyntaxTreeDumperTest {

    private final SyntaxTreeDumper dumper = new SyntaxTreeDumper();

    @Test
    void testSexpForFreeText() {
        QueryParser.ParseResult result = new QueryParser().parse("error");
        assertEquals("(query (pipeline (free_text_pattern (identifier \"error\"))))", dumper.toSexp(result));
    }

    @Test
    void testSexpForFunctionCall() {
        QueryParser.ParseResult result = new QueryParser().parse("count(x)");
        assertEquals(
            "(query (pipeline (function_call (identifier \"count\") (unnamed_function_argument (identifier \"x\")))))",
            dumper.toSexp(result));
    }

    @Test
    void testSexpEscapesQuotes() {
        QueryParser.ParseResult result = new QueryParser().parse("\"a\"");
        assertTrue(dumper.toSexp(result).contains("(quoted_string \"\\\"a\\\"\")"));
    }

    @Test
    void testJsonContainsTreeAndDiagnostics() throws Exception {
        QueryParser.ParseResult result = new QueryParser().parse("error | count(");
        JsonNode root = new ObjectMapper().readTree(dumper.toJson(result));

        assertEquals("query", root.get("type").asText());
        assertTrue(root.get("has_error").asBoolean());
        JsonNode diagnostic = root.get("diagnostics").get(0);
        assertEquals("UNTERMINATED_CONSTRUCT", diagnostic.get("kind").asText());
        assertEquals("SYNTAX_ERROR", diagnostic.get("category").asText());
        assertEquals(1, diagnostic.get("range").get("start").get("line").asInt());
        assertEquals(14, diagnostic.get("range").get("start").get("column").asInt());

        JsonNode steps = root.get("children").get(0).get("children");
        assertEquals("free_text_pattern", steps.get(0).get("type").asText());
        assertEquals("ERROR", steps.get(1).get("type").asText());
        assertEquals("count(", steps.get(1).get("text").asText());
    }

    @Test
    void testJsonWithoutErrors() throws Exception {
        JsonNode root = new ObjectMapper().readTree(dumper.toJson(new QueryParser().parse("status=200")));
        assertFalse(root.get("has_error").asBoolean());
        assertEquals(0, root.get("diagnostics").size());
        assertEquals("field_comparison", root.get("children").get(0).get("children").get(0).get("type").asText());
    }
}
