package com.logscale.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class QueryLexerTest {

    @Test
    @DisplayName("斜杠: 过滤模式为正则，表达式模式为除号")
    void testSlashDependsOnMode() {
        QueryLexer lexer = new QueryLexer("a /b/");

        LexToken expressionToken = lexer.scan(1, LexMode.EXPRESSION);
        assertEquals(TokenType.SLASH, expressionToken.type());
        assertEquals(2, expressionToken.startOffset());

        LexToken filterToken = lexer.scan(1, LexMode.FILTER);
        assertEquals(TokenType.REGEX_BODY, filterToken.type());
        assertEquals("b", filterToken.value());
        assertEquals(5, filterToken.endOffset());
    }

    @Test
    @DisplayName("双斜杠在两种模式下都是注释")
    void testDoubleSlashIsAlwaysComment() {
        QueryLexer lexer = new QueryLexer("// note\nerror");

        assertEquals(TokenType.COMMENT, lexer.scan(0, LexMode.FILTER).type());
        LexToken comment = lexer.scan(0, LexMode.EXPRESSION);
        assertEquals(TokenType.COMMENT, comment.type());
        assertEquals("// note", comment.value());
        assertEquals(TokenType.IDENTIFIER, lexer.scan(comment.endOffset(), LexMode.FILTER).type());
    }

    @Test
    @DisplayName("正则标志: 仅当相邻字符全为 d/m/i")
    void testRegexFlagsOnlyWhenAllValid() {
        QueryLexer valid = new QueryLexer("/x/im");
        Optional<LexToken> flags = valid.scanRegexFlags(3);
        assertTrue(flags.isPresent());
        assertEquals("im", flags.get().value());
        assertEquals(TokenType.REGEX_FLAGS, flags.get().type());

        assertFalse(new QueryLexer("/x/ix").scanRegexFlags(3).isPresent());
        assertFalse(new QueryLexer("/x/ ").scanRegexFlags(3).isPresent());
    }

    @Test
    @DisplayName("转义斜杠不结束正则")
    void testEscapedSlashDoesNotEndRegex() {
        LexToken token = new QueryLexer("/a\\/b/").scan(0, LexMode.FILTER);
        assertEquals(TokenType.REGEX_BODY, token.type());
        assertEquals("a\\/b", token.value());
    }

    @Test
    @DisplayName("数字优先于标识符")
    void testNumbersAndIdentifiers() {
        assertEquals(TokenType.NUMBER, new QueryLexer("12.5").scan(0, LexMode.EXPRESSION).type());
        assertEquals(TokenType.NUMBER, new QueryLexer("42").scan(0, LexMode.FILTER).type());
        assertEquals(TokenType.IDENTIFIER, new QueryLexer("@timestamp").scan(0, LexMode.FILTER).type());
        assertEquals(TokenType.IDENTIFIER, new QueryLexer("#repo").scan(0, LexMode.FILTER).type());
    }

    @Test
    @DisplayName("关键字区分大小写")
    void testKeywordsAreCaseSensitive() {
        assertEquals(TokenType.AND, new QueryLexer("AND").scan(0, LexMode.FILTER).type());
        assertEquals(TokenType.IDENTIFIER, new QueryLexer("and").scan(0, LexMode.FILTER).type());
        assertEquals(TokenType.CASE, new QueryLexer("case").scan(0, LexMode.FILTER).type());
        assertEquals(TokenType.IDENTIFIER, new QueryLexer("Case").scan(0, LexMode.FILTER).type());
        assertTrue(TokenType.MATCH.isKeyword());
        assertFalse(TokenType.PIPE.isKeyword());
    }

    @Test
    @DisplayName("星号: 过滤模式为模式，表达式模式为乘号")
    void testStarIsPatternInFilterAndOperatorInExpression() {
        LexToken filterStar = new QueryLexer("*").scan(0, LexMode.FILTER);
        assertEquals(TokenType.PATTERN, filterStar.type());
        assertEquals("*", filterStar.value());

        assertEquals(TokenType.STAR, new QueryLexer("*").scan(0, LexMode.EXPRESSION).type());
        assertEquals(TokenType.PATTERN, new QueryLexer("err*r").scan(0, LexMode.FILTER).type());

        LexToken expressionWord = new QueryLexer("err*r").scan(0, LexMode.EXPRESSION);
        assertEquals(TokenType.IDENTIFIER, expressionWord.type());
        assertEquals("err", expressionWord.value());
    }

    @Test
    @DisplayName("冒号不参与贪婪匹配")
    void testColonIsNotPartOfWord() {
        QueryLexer lexer = new QueryLexer("array:contains");
        LexToken first = lexer.scan(0, LexMode.FILTER);
        assertEquals("array", first.value());
        LexToken colon = lexer.scan(first.endOffset(), LexMode.FILTER);
        assertEquals(TokenType.COLON, colon.type());
        assertTrue(colon.startsAt(first.endOffset()));
    }

    @Test
    @DisplayName("多字符运算符")
    void testMultiCharacterOperators() {
        assertEquals(TokenType.EVAL_ASSIGN, new QueryLexer(":=").scan(0, LexMode.EXPRESSION).type());
        assertEquals(TokenType.FIELD_ASSIGN, new QueryLexer("=~").scan(0, LexMode.EXPRESSION).type());
        assertEquals(TokenType.ARROW, new QueryLexer("=>").scan(0, LexMode.EXPRESSION).type());
        assertEquals(TokenType.EQ_EQ, new QueryLexer("==").scan(0, LexMode.EXPRESSION).type());
        assertEquals(TokenType.SPACESHIP, new QueryLexer("<=>").scan(0, LexMode.EXPRESSION).type());
        assertEquals(TokenType.LE, new QueryLexer("<=").scan(0, LexMode.EXPRESSION).type());
        assertEquals(TokenType.NOT_EQ, new QueryLexer("!=").scan(0, LexMode.EXPRESSION).type());
        assertEquals(TokenType.QUESTION_BRACE, new QueryLexer("?{").scan(0, LexMode.FILTER).type());
    }

    @Test
    @DisplayName("词法错误 token")
    void testLexErrors() {
        LexToken unterminatedString = new QueryLexer("\"abc").scan(0, LexMode.FILTER);
        assertEquals(TokenType.UNTERMINATED_STRING, unterminatedString.type());
        assertTrue(unterminatedString.type().isLexError());

        assertEquals(TokenType.UNTERMINATED_REGEX, new QueryLexer("/abc\nx").scan(0, LexMode.FILTER).type());
        assertEquals(TokenType.INVALID_CHARACTER, new QueryLexer("€").scan(0, LexMode.FILTER).type());
    }

    @Test
    @DisplayName("字符串保留转义原文")
    void testQuotedStringKeepsEscapes() {
        LexToken token = new QueryLexer("\"a \\\"b\\\" c\" rest").scan(0, LexMode.FILTER);
        assertEquals(TokenType.QUOTED_STRING, token.type());
        assertEquals("\"a \\\"b\\\" c\"", token.value());
    }

    @Test
    @DisplayName("空白后到达末尾")
    void testEndOfInput() {
        LexToken token = new QueryLexer("  ").scan(0, LexMode.FILTER);
        assertEquals(TokenType.EOF, token.type());
        assertEquals(2, token.startOffset());
    }

    @Test
    @DisplayName("位置换算为行列")
    void testPositionsCountLinesAndColumns() {
        LexToken token = new QueryLexer("a\n  count").scan(1, LexMode.FILTER);
        assertEquals(2, token.range().start().line());
        assertEquals(3, token.range().start().column());
    }

    @Test
    @DisplayName("tokenize: 无解析器上下文时推断斜杠含义")
    void testTokenizeGuessesSlashContext() {
        assertEquals(
            List.of(TokenType.REGEX_BODY, TokenType.REGEX_FLAGS, TokenType.PIPE,
                TokenType.IDENTIFIER, TokenType.LPAREN, TokenType.RPAREN),
            types("/re/i | count()"));
        assertEquals(
            List.of(TokenType.IDENTIFIER, TokenType.EVAL_ASSIGN, TokenType.IDENTIFIER,
                TokenType.SLASH, TokenType.IDENTIFIER),
            types("a := b / c"));
    }

    @Test
    @DisplayName("tokenize: 迭代器耗尽后抛出异常")
    void testTokenizeIteratorExhaustion() {
        Iterator<LexToken> iterator = QueryLexer.tokenize("x");
        assertTrue(iterator.hasNext());
        iterator.next();
        assertFalse(iterator.hasNext());
        assertThrows(NoSuchElementException.class, iterator::next);
    }

    private static List<TokenType> types(String query) {
        List<TokenType> types = new ArrayList<>();
        Iterator<LexToken> iterator = QueryLexer.tokenize(query);
        while (iterator.hasNext()) {
            types.add(iterator.next().type());
        }
        return types;
    }
}
