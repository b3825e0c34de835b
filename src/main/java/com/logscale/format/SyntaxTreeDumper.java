package com.logscale.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.logscale.query.Diagnostic;
import com.logscale.query.QueryParser;
import com.logscale.query.SourcePosition;
import com.logscale.query.SourceRange;
import com.logscale.query.SourceText;
import com.logscale.query.SyntaxNode;
import com.logscale.query.SyntaxTrees;

import java.util.List;

/**
 * 语法树的调试输出：S 表达式与 JSON。
 */
public class SyntaxTreeDumper {
    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * 形如 {@code (query (pipeline (free_text_pattern (identifier "error"))))}，叶子节点附带源码文本。
     */
    public String toSexp(QueryParser.ParseResult result) {
        StringBuilder builder = new StringBuilder();
        appendSexp(result.query(), result.source(), builder);
        return builder.toString();
    }

    /**
     * 根对象额外包含 {@code has_error} 与 {@code diagnostics}。
     */
    public String toJson(QueryParser.ParseResult result) throws JsonProcessingException {
        ObjectNode root = toJsonNode(result.query(), result.source());
        root.put("has_error", result.hasErrors());
        ArrayNode diagnostics = root.putArray("diagnostics");
        for (Diagnostic diagnostic : result.diagnostics()) {
            ObjectNode item = diagnostics.addObject();
            item.put("kind", diagnostic.kind().name());
            item.put("category", diagnostic.category().name());
            item.put("message", diagnostic.message());
            item.set("range", rangeNode(diagnostic.range()));
            if (diagnostic.expected() != null) {
                item.put("expected", diagnostic.expected());
                item.put("found", diagnostic.found());
            }
        }
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
    }

    private void appendSexp(SyntaxNode node, SourceText source, StringBuilder builder) {
        builder.append('(').append(SyntaxTrees.nodeName(node));
        List<SyntaxNode> children = SyntaxTrees.children(node);
        if (children.isEmpty()) {
            builder.append(' ').append(quote(source.slice(node.range())));
        }
        for (SyntaxNode child : children) {
            builder.append(' ');
            appendSexp(child, source, builder);
        }
        builder.append(')');
    }

    private ObjectNode toJsonNode(SyntaxNode node, SourceText source) {
        ObjectNode json = mapper.createObjectNode();
        json.put("type", SyntaxTrees.nodeName(node));
        json.set("range", rangeNode(node.range()));
        List<SyntaxNode> children = SyntaxTrees.children(node);
        if (children.isEmpty()) {
            json.put("text", source.slice(node.range()));
        } else {
            ArrayNode array = json.putArray("children");
            for (SyntaxNode child : children) {
                array.add(toJsonNode(child, source));
            }
        }
        return json;
    }

    private ObjectNode rangeNode(SourceRange range) {
        ObjectNode json = mapper.createObjectNode();
        json.set("start", positionNode(range.start()));
        json.set("end", positionNode(range.end()));
        return json;
    }

    private ObjectNode positionNode(SourcePosition position) {
        ObjectNode json = mapper.createObjectNode();
        json.put("line", position.line());
        json.put("column", position.column());
        json.put("offset", position.offset());
        return json;
    }

    private static String quote(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
    }
}
