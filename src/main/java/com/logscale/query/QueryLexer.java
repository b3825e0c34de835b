package com.logscale.query;

import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 基于位置的词法器：每次从给定 offset 读取一个 token。
 *
 * <p>'/' 的含义依赖语法上下文，因此由解析器通过 {@link LexMode} 告知当前位置是否允许正则。
 * 词法器本身不保存游标，同一 offset 可按不同模式重复读取。</p>
 */
public class QueryLexer {
    private static final Pattern NUMBER_PATTERN = Pattern.compile("[0-9]+(\\.[0-9]+)?");
    private static final String REGEX_FLAG_CHARS = "dmi";

    private static final Map<String, TokenType> KEYWORDS = Map.of(
        "AND", TokenType.AND,
        "OR", TokenType.OR,
        "NOT", TokenType.NOT,
        "case", TokenType.CASE,
        "match", TokenType.MATCH,
        "like", TokenType.LIKE,
        "true", TokenType.TRUE,
        "false", TokenType.FALSE
    );

    private final SourceText source;
    private final String text;

    public QueryLexer(String query) {
        this(new SourceText(query));
    }

    public QueryLexer(SourceText source) {
        this.source = source;
        this.text = source.text();
    }

    /**
     * 跳过空白后按指定模式读取一个 token；到达末尾时返回 EOF。
     */
    public LexToken scan(int offset, LexMode mode) {
        int index = skipWhitespace(offset);
        if (index >= text.length()) {
            return token(TokenType.EOF, index, index);
        }

        char currentChar = text.charAt(index);
        char nextChar = charAt(index + 1);
        if (currentChar == '/') {
            if (nextChar == '/') {
                return readComment(index);
            }
            if (mode == LexMode.FILTER) {
                return readRegexBody(index);
            }
            return token(TokenType.SLASH, index, index + 1);
        }
        if (currentChar == '"') {
            return readQuotedString(index);
        }

        LexToken punctuation = readPunctuation(index, currentChar, nextChar);
        if (punctuation != null) {
            return punctuation;
        }
        return readWord(index, mode);
    }

    /**
     * 读取紧跟在正则结束符之后的标志位（d、m、i）。
     */
    public Optional<LexToken> scanRegexFlags(int offset) {
        int end = offset;
        while (end < text.length() && isFieldNameChar(text.charAt(end))) {
            end++;
        }
        if (end == offset) {
            return Optional.empty();
        }
        for (int index = offset; index < end; index++) {
            if (REGEX_FLAG_CHARS.indexOf(text.charAt(index)) < 0) {
                return Optional.empty();
            }
        }
        return Optional.of(token(TokenType.REGEX_FLAGS, offset, end));
    }

    /**
     * 惰性切分整段文本，供 tokenize 展示使用。
     *
     * <p>没有解析器上下文时，'/' 紧跟在标识符、数字、字符串或右括号之后视为除号，其余位置视为正则开始。</p>
     */
    public Iterator<LexToken> tokenize() {
        return new TokenIterator();
    }

    public static Iterator<LexToken> tokenize(String query) {
        return new QueryLexer(query).tokenize();
    }

    public static boolean isFieldNameChar(char ch) {
        return (ch >= 'a' && ch <= 'z')
            || (ch >= 'A' && ch <= 'Z')
            || (ch >= '0' && ch <= '9')
            || ch == '_' || ch == '.' || ch == '#' || ch == '%' || ch == '&'
            || ch == '@' || ch == '\\' || ch == '^'
            || (ch >= '\u00A1' && ch <= '\u00AA')
            || (ch >= '\u00AE' && ch <= '\u00BA')
            || (ch >= '\u00BC' && ch <= '\u00FF');
    }

    public static boolean isPatternExtraChar(char ch) {
        return ch == '*' || ch == '+' || ch == '-' || ch == '~' || ch == '\u00AC';
    }

    public static boolean isPatternChar(char ch) {
        return isFieldNameChar(ch) || isPatternExtraChar(ch);
    }

    private LexToken readPunctuation(int index, char currentChar, char nextChar) {
        return switch (currentChar) {
            case '|' -> token(TokenType.PIPE, index, index + 1);
            case '(' -> token(TokenType.LPAREN, index, index + 1);
            case ')' -> token(TokenType.RPAREN, index, index + 1);
            case '[' -> token(TokenType.LBRACKET, index, index + 1);
            case ']' -> token(TokenType.RBRACKET, index, index + 1);
            case '{' -> token(TokenType.LBRACE, index, index + 1);
            case '}' -> token(TokenType.RBRACE, index, index + 1);
            case ',' -> token(TokenType.COMMA, index, index + 1);
            case ';' -> token(TokenType.SEMICOLON, index, index + 1);
            case '$' -> token(TokenType.DOLLAR, index, index + 1);
            case ':' -> nextChar == '='
                ? token(TokenType.EVAL_ASSIGN, index, index + 2)
                : token(TokenType.COLON, index, index + 1);
            case '=' -> switch (nextChar) {
                case '~' -> token(TokenType.FIELD_ASSIGN, index, index + 2);
                case '>' -> token(TokenType.ARROW, index, index + 2);
                case '=' -> token(TokenType.EQ_EQ, index, index + 2);
                default -> token(TokenType.EQ, index, index + 1);
            };
            case '!' -> nextChar == '='
                ? token(TokenType.NOT_EQ, index, index + 2)
                : token(TokenType.BANG, index, index + 1);
            case '<' -> {
                if (nextChar != '=') {
                    yield token(TokenType.LT, index, index + 1);
                }
                yield charAt(index + 2) == '>'
                    ? token(TokenType.SPACESHIP, index, index + 3)
                    : token(TokenType.LE, index, index + 2);
            }
            case '>' -> nextChar == '='
                ? token(TokenType.GE, index, index + 2)
                : token(TokenType.GT, index, index + 1);
            case '?' -> nextChar == '{'
                ? token(TokenType.QUESTION_BRACE, index, index + 2)
                : token(TokenType.QUESTION, index, index + 1);
            default -> null;
        };
    }

    /**
     * 读取标识符、模式片段或数字。冒号不参与贪婪匹配，由语法层拼接。
     */
    private LexToken readWord(int index, LexMode mode) {
        int end = index;
        while (end < text.length() && acceptsWordChar(text.charAt(end), mode)) {
            end++;
        }

        if (end == index) {
            char currentChar = text.charAt(index);
            if (currentChar == '*') {
                return token(TokenType.STAR, index, index + 1);
            }
            if (currentChar == '+') {
                return token(TokenType.PLUS, index, index + 1);
            }
            if (currentChar == '-') {
                return token(TokenType.MINUS, index, index + 1);
            }
            return token(TokenType.INVALID_CHARACTER, index, index + Character.charCount(text.codePointAt(index)));
        }

        String word = text.substring(index, end);
        if (NUMBER_PATTERN.matcher(word).matches()) {
            return token(TokenType.NUMBER, index, end);
        }
        if (mode == LexMode.EXPRESSION && "%".equals(word)) {
            return token(TokenType.PERCENT, index, end);
        }
        TokenType keyword = KEYWORDS.get(word);
        if (keyword != null) {
            return token(keyword, index, end);
        }
        return token(containsPatternExtra(word) ? TokenType.PATTERN : TokenType.IDENTIFIER, index, end);
    }

    private boolean acceptsWordChar(char ch, LexMode mode) {
        return mode == LexMode.FILTER ? isPatternChar(ch) : isFieldNameChar(ch);
    }

    private boolean containsPatternExtra(String word) {
        for (int index = 0; index < word.length(); index++) {
            if (isPatternExtraChar(word.charAt(index))) {
                return true;
            }
        }
        return false;
    }

    private LexToken readComment(int index) {
        int end = index;
        while (end < text.length() && text.charAt(end) != '\n') {
            end++;
        }
        return token(TokenType.COMMENT, index, end);
    }

    /**
     * 读取正则体，转义的 '/' 不结束正则；换行或文本结束前未闭合时返回错误 token。
     */
    private LexToken readRegexBody(int index) {
        int cursor = index + 1;
        while (cursor < text.length()) {
            char currentChar = text.charAt(cursor);
            if (currentChar == '\n') {
                break;
            }
            if (currentChar == '\\' && cursor + 1 < text.length() && text.charAt(cursor + 1) != '\n') {
                cursor += 2;
                continue;
            }
            if (currentChar == '/') {
                return new LexToken(TokenType.REGEX_BODY, text.substring(index + 1, cursor), source.range(index, cursor + 1));
            }
            cursor++;
        }
        return token(TokenType.UNTERMINATED_REGEX, index, cursor);
    }

    /**
     * 读取双引号字符串，token 值保留引号与转义原文。
     */
    private LexToken readQuotedString(int index) {
        int cursor = index + 1;
        while (cursor < text.length()) {
            char currentChar = text.charAt(cursor);
            if (currentChar == '\n') {
                break;
            }
            if (currentChar == '\\' && cursor + 1 < text.length() && text.charAt(cursor + 1) != '\n') {
                cursor += 2;
                continue;
            }
            if (currentChar == '"') {
                return token(TokenType.QUOTED_STRING, index, cursor + 1);
            }
            cursor++;
        }
        return token(TokenType.UNTERMINATED_STRING, index, cursor);
    }

    private int skipWhitespace(int offset) {
        int index = Math.max(0, offset);
        while (index < text.length() && isWhitespace(text.charAt(index))) {
            index++;
        }
        return index;
    }

    private static boolean isWhitespace(char ch) {
        return ch == ' ' || ch == '\t' || ch == '\n' || ch == '\r' || ch == '\f';
    }

    private char charAt(int index) {
        return index < text.length() ? text.charAt(index) : '\0';
    }

    private LexToken token(TokenType type, int start, int end) {
        return new LexToken(type, text.substring(start, end), source.range(start, end));
    }

    private final class TokenIterator implements Iterator<LexToken> {
        private int offset;
        private LexToken previous;
        private LexToken pending;
        private boolean finished;

        @Override
        public boolean hasNext() {
            if (pending == null && !finished) {
                pending = advance();
            }
            return pending != null;
        }

        @Override
        public LexToken next() {
            if (!hasNext()) {
                throw new NoSuchElementException("token 序列已结束");
            }
            LexToken token = pending;
            pending = null;
            return token;
        }

        private LexToken advance() {
            if (previous != null && previous.type() == TokenType.REGEX_BODY) {
                Optional<LexToken> flags = scanRegexFlags(offset);
                if (flags.isPresent()) {
                    return remember(flags.get());
                }
            }
            LexToken token = scan(offset, modeAt(offset));
            if (token.type() == TokenType.EOF) {
                finished = true;
                return null;
            }
            return remember(token);
        }

        private LexMode modeAt(int position) {
            int index = skipWhitespace(position);
            if (index >= text.length() || text.charAt(index) != '/' || previous == null) {
                return LexMode.FILTER;
            }
            return endsExpression(previous.type()) ? LexMode.EXPRESSION : LexMode.FILTER;
        }

        private boolean endsExpression(TokenType type) {
            return type == TokenType.IDENTIFIER
                || type == TokenType.NUMBER
                || type == TokenType.QUOTED_STRING
                || type == TokenType.RPAREN
                || type == TokenType.RBRACKET;
        }

        private LexToken remember(LexToken token) {
            offset = token.endOffset();
            if (token.type() != TokenType.COMMENT) {
                previous = token;
            }
            return token;
        }
    }
}
