package com.logscale.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DocRendererTest {

    private static Doc list(String... items) {
        List<Doc> docs = List.of(items).stream().map(Doc::text).toList();
        return Doc.group(
            Doc.text("("),
            Doc.indent(Doc.softline(), Doc.join(Doc.concat(Doc.text(","), Doc.line()), docs)),
            Doc.softline(),
            Doc.text(")")
        );
    }

    @Test
    @DisplayName("分组放得下时平铺")
    void testGroupStaysFlatWhenItFits() {
        assertEquals("(a, b, c)", new DocRenderer(80, 2).render(list("a", "b", "c")));
    }

    @Test
    @DisplayName("分组超宽时断行")
    void testGroupBreaksWhenTooWide() {
        String rendered = new DocRenderer(10, 2).render(list("alpha", "beta", "gamma"));
        assertEquals("(\n  alpha,\n  beta,\n  gamma\n)", rendered);
    }

    @Test
    @DisplayName("硬换行强制外层分组断行")
    void testHardLineForcesEnclosingGroupToBreak() {
        Doc doc = Doc.group(Doc.text("{"), Doc.indent(Doc.line(), Doc.text("a"), Doc.hardline(), Doc.text("b")),
            Doc.line(), Doc.text("}"));
        assertTrue(((Doc.Group) doc).forcedBreak());
        assertEquals("{\n  a\n  b\n}", new DocRenderer(80, 2).render(doc));
    }

    @Test
    @DisplayName("分组之后的同行内容计入宽度")
    void testTrailingContentCountsTowardsFit() {
        Doc doc = Doc.concat(list("a", "b"), Doc.text(" and a long trailing tail"));
        String rendered = new DocRenderer(20, 2).render(doc);
        assertTrue(rendered.startsWith("(\n  a,\n"));
    }

    @Test
    @DisplayName("去除行尾空格")
    void testTrailingSpacesAreTrimmed() {
        Doc doc = Doc.concat(Doc.text("a "), Doc.hardline(), Doc.text("b  "));
        assertEquals("a\nb", new DocRenderer(80, 2).render(doc));
    }

    @Test
    @DisplayName("硬换行穿透缩进传播")
    void testContainsHardLinePropagatesThroughIndent() {
        assertTrue(Doc.containsHardLine(Doc.indent(Doc.text("x"), Doc.hardline())));
        assertFalse(Doc.containsHardLine(Doc.concat(Doc.text("x"), Doc.line())));
        assertEquals("", new DocRenderer(80, 2).render(Doc.EMPTY));
    }
}
