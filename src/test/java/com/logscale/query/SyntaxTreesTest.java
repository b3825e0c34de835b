package com.logscale.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.logscale.query.SyntaxNode.FunctionCall;
import com.logscale.query.SyntaxNode.Identifier;
import java.util.List;
import org.junit.jupiter.api.Test;

class SyntaxTreesTest {

    @Test
    void testNodeNames() {
        SyntaxNode.Query query = new QueryParser().parse("x := 1 + 2").query();
        SyntaxNode.Pipeline pipeline = query.pipeline();

        assertEquals("query", SyntaxTrees.nodeName(query));
        assertEquals("pipeline", SyntaxTrees.nodeName(pipeline));
        assertEquals("eval_shorthand", SyntaxTrees.nodeName(pipeline.steps().get(0)));
        assertEquals("additive_expression",
            SyntaxTrees.nodeName(((SyntaxNode.EvalShorthand) pipeline.steps().get(0)).value()));
    }

    @Test
    void testChildrenFollowComponentOrder() {
        SyntaxNode.Query query = new QueryParser().parse("count(a, limit=5)").query();
        FunctionCall call = (FunctionCall) query.pipeline().steps().get(0);

        List<SyntaxNode> children = SyntaxTrees.children(call);
        assertEquals(3, children.size());
        assertEquals("identifier", SyntaxTrees.nodeName(children.get(0)));
        assertEquals("unnamed_function_argument", SyntaxTrees.nodeName(children.get(1)));
        assertEquals("named_function_argument", SyntaxTrees.nodeName(children.get(2)));
    }

    @Test
    void testCollectIsPreOrder() {
        SyntaxNode.Query query = new QueryParser().parse("a | b := c(d)").query();

        List<Identifier> identifiers = SyntaxTrees.collect(query, Identifier.class);
        assertEquals(List.of("a", "b", "c", "d"), identifiers.stream().map(Identifier::text).toList());
    }

    @Test
    void testContainsErrors() {
        assertFalse(SyntaxTrees.containsErrors(new QueryParser().parse("error").query()));
        assertTrue(SyntaxTrees.containsErrors(new QueryParser().parse("error | (").query()));
    }

    @Test
    void testMatchArmChildrenIncludeCommentGuardAndBody() {
        SyntaxNode.Query query = new QueryParser()
            .parse("method match {\n  // reads\n  \"GET\" => x := 1;\n  * => x := 0\n}").query();
        SyntaxNode.MatchExpr match = (SyntaxNode.MatchExpr) query.pipeline().steps().get(0);

        List<SyntaxNode> matchChildren = SyntaxTrees.children(match);
        assertEquals(3, matchChildren.size());
        assertEquals("field_name", SyntaxTrees.nodeName(matchChildren.get(0)));

        List<SyntaxNode> firstArm = SyntaxTrees.children(match.arms().get(0));
        assertEquals(List.of("comment", "quoted_string", "pipeline"),
            firstArm.stream().map(SyntaxTrees::nodeName).toList());

        List<SyntaxNode> secondArm = SyntaxTrees.children(match.arms().get(1));
        assertEquals(List.of("wildcard", "pipeline"),
            secondArm.stream().map(SyntaxTrees::nodeName).toList());
    }

    @Test
    void testChildrenSkipAbsentComponents() {
        SyntaxNode.Query unlabelled = new QueryParser().parse("join({ error })").query();
        SyntaxNode.Subquery subquery = SyntaxTrees.collect(unlabelled, SyntaxNode.Subquery.class).get(0);
        assertEquals(List.of("pipeline"),
            SyntaxTrees.children(subquery).stream().map(SyntaxTrees::nodeName).toList());

        assertTrue(SyntaxTrees.children(new QueryParser().parse("").query()).isEmpty());

        SyntaxNode.Query parameter = new QueryParser().parse("x := ?limit").query();
        SyntaxNode.QueryParameter queryParameter =
            SyntaxTrees.collect(parameter, SyntaxNode.QueryParameter.class).get(0);
        assertEquals(1, SyntaxTrees.children(queryParameter).size());
    }

    @Test
    void testLeavesHaveNoChildren() {
        SyntaxNode.Query query = new QueryParser().parse("/err/i \"quoted\" 42").query();
        assertTrue(SyntaxTrees.collect(query, SyntaxNode.Regex.class).stream()
            .allMatch(regex -> SyntaxTrees.children(regex).isEmpty()));
        assertEquals(1, SyntaxTrees.collect(query, SyntaxNode.QuotedString.class).size());
    }
}
