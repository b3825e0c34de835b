package com.logscale.query;

import com.logscale.config.Constants;
import com.logscale.query.SyntaxNode.AndFilter;
import com.logscale.query.SyntaxNode.Argument;
import com.logscale.query.SyntaxNode.ArrayElement;
import com.logscale.query.SyntaxNode.ArrayExpr;
import com.logscale.query.SyntaxNode.AdditiveExpr;
import com.logscale.query.SyntaxNode.BooleanLiteral;
import com.logscale.query.SyntaxNode.CaseExpr;
import com.logscale.query.SyntaxNode.Comment;
import com.logscale.query.SyntaxNode.ComparisonExpr;
import com.logscale.query.SyntaxNode.ErrorNode;
import com.logscale.query.SyntaxNode.EvalFunctionShorthand;
import com.logscale.query.SyntaxNode.EvalShorthand;
import com.logscale.query.SyntaxNode.Expression;
import com.logscale.query.SyntaxNode.FieldComparison;
import com.logscale.query.SyntaxNode.FieldName;
import com.logscale.query.SyntaxNode.FieldOperator;
import com.logscale.query.SyntaxNode.FieldShorthand;
import com.logscale.query.SyntaxNode.Filter;
import com.logscale.query.SyntaxNode.FreeTextPattern;
import com.logscale.query.SyntaxNode.FunctionCall;
import com.logscale.query.SyntaxNode.Guard;
import com.logscale.query.SyntaxNode.Identifier;
import com.logscale.query.SyntaxNode.MatchArm;
import com.logscale.query.SyntaxNode.MatchExpr;
import com.logscale.query.SyntaxNode.MultiplicativeExpr;
import com.logscale.query.SyntaxNode.NamedArg;
import com.logscale.query.SyntaxNode.NotFilter;
import com.logscale.query.SyntaxNode.NumberLiteral;
import com.logscale.query.SyntaxNode.OrFilter;
import com.logscale.query.SyntaxNode.ParenthesizedExpr;
import com.logscale.query.SyntaxNode.ParenthesizedFilter;
import com.logscale.query.SyntaxNode.PatternValue;
import com.logscale.query.SyntaxNode.Pipeline;
import com.logscale.query.SyntaxNode.PipelineElement;
import com.logscale.query.SyntaxNode.Query;
import com.logscale.query.SyntaxNode.QueryParameter;
import com.logscale.query.SyntaxNode.QuotedString;
import com.logscale.query.SyntaxNode.Regex;
import com.logscale.query.SyntaxNode.SavedQuery;
import com.logscale.query.SyntaxNode.SavedQueryArg;
import com.logscale.query.SyntaxNode.StatsShorthand;
import com.logscale.query.SyntaxNode.Step;
import com.logscale.query.SyntaxNode.Subquery;
import com.logscale.query.SyntaxNode.UnaryExpr;
import com.logscale.query.SyntaxNode.UnnamedArg;
import com.logscale.query.SyntaxNode.UnquotedPattern;
import com.logscale.query.SyntaxNode.Wildcard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 递归下降解析器。优先级由低到高：AND、OR、NOT、比较、加减、乘除、一元。
 *
 * <p>解析器从不因输入错误而抛出异常：错误被记录为诊断，出错的步骤以 {@link ErrorNode} 占位，
 * 并跳到下一个 '|'、';' 或所在结构的闭合括号继续解析。</p>
 *
 * <p>实例持有单次解析的状态，不是线程安全的；每个线程各自创建即可。</p>
 */
public class QueryParser {
    private static final Logger logger = LoggerFactory.getLogger(QueryParser.class);

    private static final Set<TokenType> TOP_LEVEL_STOPS = EnumSet.noneOf(TokenType.class);
    private static final Set<TokenType> SUBQUERY_STOPS = EnumSet.of(TokenType.RBRACE);
    private static final Set<TokenType> ARM_STOPS = EnumSet.of(TokenType.SEMICOLON, TokenType.RBRACE);

    /**
     * 解析结果：语法树及按发现顺序排列的诊断。
     */
    public record ParseResult(Query query, List<Diagnostic> diagnostics, SourceText source) {
        public ParseResult {
            diagnostics = List.copyOf(diagnostics);
        }

        public boolean hasErrors() {
            return !diagnostics.isEmpty();
        }
    }

    private SourceText source;
    private QueryLexer lexer;
    private int pos;
    private int lastEnd;
    private int commentWatermark;
    private List<Diagnostic> diagnostics;
    private List<Comment> pendingComments;
    private int nestingDepth;

    /**
     * 解析查询文本；null 视为空查询。
     */
    public ParseResult parse(String query) {
        this.source = new SourceText(query);
        this.lexer = new QueryLexer(source);
        this.pos = 0;
        this.lastEnd = 0;
        this.commentWatermark = 0;
        this.diagnostics = new ArrayList<>();
        this.pendingComments = new ArrayList<>();
        this.nestingDepth = 0;

        Pipeline pipeline = null;
        if (peek().type() != TokenType.EOF) {
            pipeline = parsePipeline(TOP_LEVEL_STOPS);
        } else if (!pendingComments.isEmpty()) {
            List<PipelineElement> elements = new ArrayList<>();
            flushComments(elements);
            pipeline = new Pipeline(elements, spanOf(elements));
        }

        Query result = new Query(pipeline, source.range(0, source.length()));
        logger.debug("解析完成: {} 个字符, {} 条诊断", source.length(), diagnostics.size());
        return new ParseResult(result, diagnostics, source);
    }

    // ==================== 管道与步骤 ====================

    private Pipeline parsePipeline(Set<TokenType> stops) {
        List<PipelineElement> elements = new ArrayList<>();
        while (true) {
            peek();
            flushComments(elements);
            elements.add(parseStepWithRecovery(stops));

            LexToken token = peek();
            if (token.type() == TokenType.PIPE) {
                advance(token);
                continue;
            }
            if (token.type() == TokenType.EOF || stops.contains(token.type())) {
                break;
            }
            diagnostics.add(unexpectedDiagnostic("'|'", token));
            elements.add(skipToBoundary(token.startOffset(), stops));
            LexToken boundary = peek();
            if (boundary.type() != TokenType.PIPE) {
                break;
            }
            advance(boundary);
        }
        flushComments(elements);
        return new Pipeline(elements, spanOf(elements));
    }

    private Step parseStepWithRecovery(Set<TokenType> stops) {
        int start = peek().startOffset();
        int depth = nestingDepth;
        try {
            return parseStep();
        } catch (QueryParseException exception) {
            nestingDepth = depth;
            diagnostics.add(exception.getDiagnostic());
            logger.debug("步骤解析失败，跳至边界继续: {}", exception.getDiagnostic());
            return skipToBoundary(start, stops);
        }
    }

    /**
     * 步骤入口的确定性判定，按顺序：
     * case → 数组统计简写 → 保存的查询 → 字段名后接 match / := / =~ → 紧贴 '(' 的函数调用 → 过滤条件。
     */
    private Step parseStep() {
        LexToken token = peek();
        if (token.type() == TokenType.CASE) {
            return parseCase();
        }
        if (token.type() == TokenType.LBRACKET) {
            ArrayExpr array = parseArray();
            return new StatsShorthand(array, array.range());
        }
        if (token.type() == TokenType.DOLLAR) {
            return parseSavedQuery();
        }
        if (isFieldNameStart(token)) {
            Step shorthand = tryParseFieldStep();
            if (shorthand != null) {
                return shorthand;
            }
        }
        if (isCallStart(token, LexMode.FILTER)) {
            return parseFunctionCall(LexMode.FILTER);
        }
        return parseAndFilter();
    }

    /**
     * 尝试解析以字段名开头的步骤；字段名之后不是 match、:= 或 =~ 时回退并返回 null。
     */
    private Step tryParseFieldStep() {
        int savedPos = pos;
        int savedLastEnd = lastEnd;
        FieldName field = parseFieldName(LexMode.FILTER);
        LexToken operator = peek();
        if (operator.type() == TokenType.MATCH) {
            advance(operator);
            return parseMatch(field);
        }
        if (operator.type() == TokenType.EVAL_ASSIGN) {
            advance(operator);
            return parseEval(field, operator);
        }
        if (operator.type() == TokenType.FIELD_ASSIGN) {
            advance(operator);
            return parseFieldShorthand(field, operator);
        }
        pos = savedPos;
        lastEnd = savedLastEnd;
        return null;
    }

    /**
     * {@code field := call(...)} 且调用之后没有任何延续表达式的运算符时取函数简写形式，
     * 否则（如 {@code f() + 1}）取通用 eval 简写。
     */
    private Step parseEval(FieldName field, LexToken operator) {
        LexToken token = peekExpr();
        if (token.type() == TokenType.EOF || token.type() == TokenType.PIPE) {
            throw abort(Diagnostic.of(DiagnosticKind.MALFORMED_SHORTHAND,
                "':=' must be followed by an expression", operator.range()));
        }
        int start = field.range().startOffset();
        if (isCallStart(token, LexMode.EXPRESSION)) {
            FunctionCall call = parseFunctionCall(LexMode.EXPRESSION);
            Expression value = parseComparisonTail(parseAdditiveTail(parseMultiplicativeTail(call)));
            if (value == call) {
                return new EvalFunctionShorthand(field, call, rangeFrom(start));
            }
            return new EvalShorthand(field, value, rangeFrom(start));
        }
        Expression value = parseExpression();
        return new EvalShorthand(field, value, rangeFrom(start));
    }

    private FieldShorthand parseFieldShorthand(FieldName field, LexToken operator) {
        LexToken token = peekExpr();
        if (!isCallStart(token, LexMode.EXPRESSION)) {
            throw abort(Diagnostic.of(DiagnosticKind.MALFORMED_SHORTHAND,
                "'=~' must be followed by a function call", operator.range()));
        }
        FunctionCall call = parseFunctionCall(LexMode.EXPRESSION);
        return new FieldShorthand(field, call, rangeFrom(field.range().startOffset()));
    }

    private CaseExpr parseCase() {
        LexToken keyword = advance(peek());
        LexToken open = expect(TokenType.LBRACE, "'{'");
        enterNesting(open);
        List<Pipeline> branches = new ArrayList<>();
        branches.add(parsePipeline(ARM_STOPS));
        while (peek().type() == TokenType.SEMICOLON) {
            advance(peek());
            branches.add(parsePipeline(ARM_STOPS));
        }
        expectClose(TokenType.RBRACE, open, LexMode.FILTER);
        nestingDepth--;
        return new CaseExpr(branches, rangeFrom(keyword.startOffset()));
    }

    private MatchExpr parseMatch(FieldName field) {
        LexToken open = expect(TokenType.LBRACE, "'{'");
        enterNesting(open);
        List<MatchArm> arms = new ArrayList<>();
        arms.add(parseMatchArm());
        while (peek().type() == TokenType.SEMICOLON) {
            advance(peek());
            arms.add(parseMatchArm());
        }
        expectClose(TokenType.RBRACE, open, LexMode.FILTER);
        nestingDepth--;
        return new MatchExpr(field, arms, rangeFrom(field.range().startOffset()));
    }

    private MatchArm parseMatchArm() {
        LexToken first = peek();
        List<Comment> comments = List.copyOf(pendingComments);
        pendingComments.clear();
        Guard guard = parseGuard();
        expect(TokenType.ARROW, "'=>'");
        Pipeline body = parsePipeline(ARM_STOPS);
        return new MatchArm(comments, guard, body, rangeFrom(first.startOffset()));
    }

    /**
     * 守卫按顺序尝试：单独的 '*'、函数调用、正则或查询参数、锚定模式。
     */
    private Guard parseGuard() {
        LexToken token = peek();
        if (isCallStart(token, LexMode.FILTER)) {
            return parseFunctionCall(LexMode.FILTER);
        }
        PatternValue value = parseEqualityValue();
        if (value instanceof UnquotedPattern pattern && "*".equals(pattern.text())) {
            return new Wildcard(pattern.range());
        }
        return value;
    }

    private SavedQuery parseSavedQuery() {
        LexToken dollar = advance(peek());
        PatternValue name = parseAnchoredPattern("saved query name");
        LexToken open = expect(TokenType.LPAREN, "'('");
        List<SavedQueryArg> arguments = new ArrayList<>();
        if (!closesOrEnds(peek(), TokenType.RPAREN)) {
            while (true) {
                PatternValue key = parseAnchoredPattern("argument name");
                expect(TokenType.EQ, "'='");
                PatternValue value = parseAnchoredPattern("argument value");
                arguments.add(new SavedQueryArg(key, value, rangeFrom(key.range().startOffset())));
                LexToken separator = peek();
                if (separator.type() != TokenType.COMMA) {
                    break;
                }
                advance(separator);
            }
        }
        expectClose(TokenType.RPAREN, open, LexMode.FILTER);
        return new SavedQuery(name, arguments, rangeFrom(dollar.startOffset()));
    }

    // ==================== 过滤条件 ====================

    /**
     * AND 层：相邻的两个过滤条件之间即使没有 AND 也视为隐式 AND。
     */
    private Filter parseAndFilter() {
        Filter first = parseOrFilter();
        List<Filter> operands = new ArrayList<>();
        List<Boolean> explicit = new ArrayList<>();
        operands.add(first);
        while (true) {
            LexToken token = peek();
            if (token.type() == TokenType.AND) {
                advance(token);
                operands.add(parseOrFilter());
                explicit.add(Boolean.TRUE);
            } else if (beginsFilter(token)) {
                operands.add(parseOrFilter());
                explicit.add(Boolean.FALSE);
            } else {
                break;
            }
        }
        if (operands.size() == 1) {
            return first;
        }
        return new AndFilter(operands, explicit, rangeFrom(first.range().startOffset()));
    }

    private Filter parseOrFilter() {
        Filter first = parseUnaryFilter();
        List<Filter> operands = new ArrayList<>();
        operands.add(first);
        while (peek().type() == TokenType.OR) {
            advance(peek());
            operands.add(parseUnaryFilter());
        }
        if (operands.size() == 1) {
            return first;
        }
        return new OrFilter(operands, rangeFrom(first.range().startOffset()));
    }

    private Filter parseUnaryFilter() {
        LexToken token = peek();
        if (token.type() == TokenType.NOT) {
            advance(token);
            enterNesting(token);
            Filter operand = parseUnaryFilter();
            nestingDepth--;
            return new NotFilter(operand, rangeFrom(token.startOffset()));
        }
        return parsePrimaryFilter();
    }

    private Filter parsePrimaryFilter() {
        LexToken token = peek();
        if (token.type() == TokenType.LPAREN) {
            advance(token);
            enterNesting(token);
            Filter inner = parseAndFilter();
            expectClose(TokenType.RPAREN, token, LexMode.FILTER);
            nestingDepth--;
            return new ParenthesizedFilter(inner, rangeFrom(token.startOffset()));
        }
        if (token.type() == TokenType.TRUE || token.type() == TokenType.FALSE) {
            advance(token);
            return new BooleanLiteral(token.type() == TokenType.TRUE, token.range());
        }
        if (isCallStart(token, LexMode.FILTER)) {
            throw abort(new Diagnostic(DiagnosticKind.UNEXPECTED_TOKEN,
                "function call '" + token.value() + "(...)' is not allowed inside a filter",
                token.range(), "filter", "function call"));
        }
        if (isFieldNameStart(token)) {
            int savedPos = pos;
            int savedLastEnd = lastEnd;
            FieldName field = parseFieldName(LexMode.FILTER);
            LexToken operatorToken = peek();
            FieldOperator operator = fieldOperator(operatorToken.type());
            if (operator != null) {
                advance(operatorToken);
                PatternValue value = parseComparisonValue(operator);
                return new FieldComparison(field, operator, value, rangeFrom(field.range().startOffset()));
            }
            pos = savedPos;
            lastEnd = savedLastEnd;
        }
        return parseFreeText();
    }

    private Filter parseFreeText() {
        LexToken token = peek();
        PatternValue value;
        if (token.type() == TokenType.REGEX_BODY) {
            value = parseRegex(token);
        } else if (token.type() == TokenType.QUESTION || token.type() == TokenType.QUESTION_BRACE) {
            value = parseQueryParameter();
        } else if (token.type() == TokenType.QUOTED_STRING || isPatternSegment(token)) {
            value = parseAnchoredPattern("filter");
            String word = leafText(value);
            if (ReservedWords.isReserved(word)) {
                // 保留字不能作为裸自由文本，记录诊断后继续解析
                diagnostics.add(Diagnostic.of(DiagnosticKind.RESERVED_WORD_MISUSE,
                    "'" + word + "' is a reserved function name; quote it or call it as a function",
                    value.range()));
                value = new ErrorNode(word, value.range());
            }
        } else {
            throw unexpected("filter", token);
        }
        return new FreeTextPattern(value, value.range());
    }

    private PatternValue parseComparisonValue(FieldOperator operator) {
        LexToken token = peek();
        switch (operator) {
            case EQ:
            case NOT_EQ:
                return parseEqualityValue();
            case LIKE:
                if (token.type() == TokenType.QUESTION || token.type() == TokenType.QUESTION_BRACE) {
                    return parseQueryParameter();
                }
                return parseAnchoredPattern("pattern");
            default:
                if (token.type() != TokenType.NUMBER) {
                    throw unexpected("number", token);
                }
                advance(token);
                return new NumberLiteral(token.value(), token.range());
        }
    }

    /**
     * '=' 与 '!=' 右侧以及 match 守卫：正则、查询参数或锚定模式。
     */
    private PatternValue parseEqualityValue() {
        LexToken token = peek();
        if (token.type() == TokenType.REGEX_BODY) {
            return parseRegex(token);
        }
        if (token.type() == TokenType.QUESTION || token.type() == TokenType.QUESTION_BRACE) {
            return parseQueryParameter();
        }
        return parseAnchoredPattern("pattern");
    }

    /**
     * 锚定模式：字符串，或由紧邻冒号拼接的若干片段。含冒号或模式字符时为非引号模式，否则为标识符。
     */
    private PatternValue parseAnchoredPattern(String expected) {
        LexToken first = peek();
        if (first.type() == TokenType.QUOTED_STRING) {
            advance(first);
            return new QuotedString(first.value(), first.range());
        }
        if (!isPatternSegment(first)) {
            throw unexpected(expected, first);
        }
        advance(first);
        boolean pattern = first.type() == TokenType.PATTERN;
        LexToken last = first;
        while (true) {
            LexToken colon = lexer.scan(last.endOffset(), LexMode.FILTER);
            if (colon.type() != TokenType.COLON || !adjacent(last, colon)) {
                break;
            }
            advance(colon);
            pattern = true;
            last = colon;
            LexToken segment = lexer.scan(colon.endOffset(), LexMode.FILTER);
            if (isPatternSegment(segment) && adjacent(colon, segment)) {
                advance(segment);
                last = segment;
            }
        }
        String text = source.text().substring(first.startOffset(), lastEnd);
        SourceRange range = rangeFrom(first.startOffset());
        return pattern ? new UnquotedPattern(text, range) : new Identifier(text, range);
    }

    private Regex parseRegex(LexToken body) {
        advance(body);
        String flags = "";
        Optional<LexToken> flagToken = lexer.scanRegexFlags(body.endOffset());
        if (flagToken.isPresent()) {
            advance(flagToken.get());
            flags = flagToken.get().value();
        }
        return new Regex(body.value(), flags, rangeFrom(body.startOffset()));
    }

    private QueryParameter parseQueryParameter() {
        LexToken open = advance(peek());
        PatternValue name = parseAnchoredPattern("parameter name");
        if (open.type() == TokenType.QUESTION) {
            return new QueryParameter(name, null, rangeFrom(open.startOffset()));
        }
        expect(TokenType.EQ, "'='");
        PatternValue defaultValue = parseAnchoredPattern("parameter default");
        expectClose(TokenType.RBRACE, open, LexMode.FILTER);
        return new QueryParameter(name, defaultValue, rangeFrom(open.startOffset()));
    }

    // ==================== 表达式 ====================

    private Expression parseExpression() {
        return parseComparisonTail(parseAdditive());
    }

    /**
     * 比较运算不可结合，最多吃掉一个比较运算符。
     */
    private Expression parseComparisonTail(Expression left) {
        LexToken token = peekExpr();
        if (!isComparisonOperator(token.type())) {
            return left;
        }
        advance(token);
        Expression right = parseAdditive();
        return new ComparisonExpr(left, token.value(), right, rangeFrom(left.range().startOffset()));
    }

    private Expression parseAdditive() {
        return parseAdditiveTail(parseMultiplicative());
    }

    private Expression parseAdditiveTail(Expression left) {
        Expression result = left;
        while (true) {
            LexToken token = peekExpr();
            if (token.type() != TokenType.PLUS && token.type() != TokenType.MINUS) {
                return result;
            }
            advance(token);
            Expression right = parseMultiplicative();
            result = new AdditiveExpr(result, token.value(), right, rangeFrom(left.range().startOffset()));
        }
    }

    private Expression parseMultiplicative() {
        return parseMultiplicativeTail(parseUnary());
    }

    private Expression parseMultiplicativeTail(Expression left) {
        Expression result = left;
        while (true) {
            LexToken token = peekExpr();
            if (token.type() != TokenType.STAR && token.type() != TokenType.SLASH
                && token.type() != TokenType.PERCENT) {
                return result;
            }
            advance(token);
            Expression right = parseUnary();
            result = new MultiplicativeExpr(result, token.value(), right, rangeFrom(left.range().startOffset()));
        }
    }

    private Expression parseUnary() {
        LexToken token = peekExpr();
        if (token.type() == TokenType.MINUS || token.type() == TokenType.BANG) {
            advance(token);
            enterNesting(token);
            Expression operand = parseUnary();
            nestingDepth--;
            return new UnaryExpr(token.value(), operand, rangeFrom(token.startOffset()));
        }
        return parsePrimary();
    }

    private Expression parsePrimary() {
        LexToken token = peekExpr();
        TokenType type = token.type();
        if (type == TokenType.SLASH) {
            return parseMisplacedRegex(token);
        }
        if (type == TokenType.LPAREN) {
            advance(token);
            enterNesting(token);
            Expression inner = parseExpression();
            expectClose(TokenType.RPAREN, token, LexMode.EXPRESSION);
            nestingDepth--;
            return new ParenthesizedExpr(inner, rangeFrom(token.startOffset()));
        }
        if (type == TokenType.LBRACE || isLabelledSubqueryStart(token)) {
            return parseSubquery();
        }
        if (isCallStart(token, LexMode.EXPRESSION)) {
            return parseFunctionCall(LexMode.EXPRESSION);
        }
        if (type == TokenType.LBRACKET) {
            return parseArray();
        }
        if (type == TokenType.QUESTION || type == TokenType.QUESTION_BRACE) {
            return parseQueryParameter();
        }
        if (type == TokenType.NUMBER) {
            advance(token);
            return new NumberLiteral(token.value(), token.range());
        }
        if (type == TokenType.QUOTED_STRING) {
            advance(token);
            return new QuotedString(token.value(), token.range());
        }
        if (type == TokenType.IDENTIFIER || type == TokenType.TRUE || type == TokenType.FALSE
            || type == TokenType.LIKE || type == TokenType.MATCH || type == TokenType.CASE) {
            advance(token);
            return new Identifier(token.value(), token.range());
        }
        throw unexpected("expression", token);
    }

    /**
     * 表达式位置不允许正则：按过滤模式重读得到完整正则，记录诊断并以错误节点占位。
     */
    private Expression parseMisplacedRegex(LexToken slash) {
        LexToken regexToken = lexer.scan(slash.startOffset(), LexMode.FILTER);
        if (regexToken.type() != TokenType.REGEX_BODY) {
            throw unexpected("expression", regexToken.type().isLexError() ? regexToken : slash);
        }
        Regex regex = parseRegex(regexToken);
        diagnostics.add(Diagnostic.of(DiagnosticKind.INVALID_REGEX_CONTEXT,
            "regex literal is not allowed where an expression is expected", regex.range()));
        return new ErrorNode(source.slice(regex.range()), regex.range());
    }

    private Subquery parseSubquery() {
        LexToken first = peekExpr();
        Identifier label = null;
        if (first.type() == TokenType.IDENTIFIER) {
            advance(first);
            label = new Identifier(first.value(), first.range());
            expect(TokenType.COLON, "':'");
        }
        LexToken open = expect(TokenType.LBRACE, "'{'");
        enterNesting(open);
        Pipeline body = parsePipeline(SUBQUERY_STOPS);
        expectClose(TokenType.RBRACE, open, LexMode.FILTER);
        nestingDepth--;
        return new Subquery(label, body, rangeFrom(first.startOffset()));
    }

    private ArrayExpr parseArray() {
        LexToken open = advance(peekExpr());
        enterNesting(open);
        List<ArrayElement> elements = new ArrayList<>();
        if (!closesOrEnds(peekExpr(), TokenType.RBRACKET)) {
            while (true) {
                elements.add(parseArrayElement());
                LexToken separator = peekExpr();
                if (separator.type() != TokenType.COMMA) {
                    break;
                }
                advance(separator);
            }
        }
        expectClose(TokenType.RBRACKET, open, LexMode.EXPRESSION);
        nestingDepth--;
        return new ArrayExpr(elements, rangeFrom(open.startOffset()));
    }

    private ArrayElement parseArrayElement() {
        LexToken token = peekExpr();
        if (isFieldNameStart(token)) {
            int savedPos = pos;
            int savedLastEnd = lastEnd;
            FieldName field = parseFieldName(LexMode.EXPRESSION);
            LexToken operator = peekExpr();
            if (operator.type() == TokenType.EVAL_ASSIGN) {
                advance(operator);
                if (!isCallStart(peekExpr(), LexMode.EXPRESSION)) {
                    throw abort(Diagnostic.of(DiagnosticKind.MALFORMED_SHORTHAND,
                        "':=' inside an array must be followed by a function call", operator.range()));
                }
                FunctionCall call = parseFunctionCall(LexMode.EXPRESSION);
                return new EvalFunctionShorthand(field, call, rangeFrom(field.range().startOffset()));
            }
            pos = savedPos;
            lastEnd = savedLastEnd;
        }
        return parseExpression();
    }

    // ==================== 函数调用 ====================

    private FunctionCall parseFunctionCall(LexMode mode) {
        Identifier name = parseFunctionName(mode);
        LexToken open = advance(lexer.scan(lastEnd, mode));
        enterNesting(open);
        List<Argument> arguments = new ArrayList<>();
        boolean unnamedSeen = false;
        if (!closesOrEnds(peekExpr(), TokenType.RPAREN)) {
            while (true) {
                Argument argument = parseArgument();
                if (argument instanceof UnnamedArg unnamed) {
                    if (unnamedSeen) {
                        diagnostics.add(Diagnostic.of(DiagnosticKind.DUPLICATE_UNNAMED_ARGUMENT,
                            "function '" + name.text() + "' accepts at most one unnamed argument",
                            unnamed.range()));
                        argument = new ErrorNode(source.slice(unnamed.range()), unnamed.range());
                    }
                    unnamedSeen = true;
                }
                arguments.add(argument);
                LexToken separator = peekExpr();
                if (separator.type() != TokenType.COMMA) {
                    break;
                }
                advance(separator);
            }
        }
        expectClose(TokenType.RPAREN, open, LexMode.EXPRESSION);
        nestingDepth--;
        return new FunctionCall(name, arguments, rangeFrom(name.range().startOffset()));
    }

    /**
     * 函数名为标识符，或紧邻冒号连接的命名空间形式 {@code ns:name}。调用前须已确认 {@link #isCallStart}。
     */
    private Identifier parseFunctionName(LexMode mode) {
        LexToken first = advance(peek(mode));
        LexToken colon = lexer.scan(first.endOffset(), mode);
        if (colon.type() == TokenType.COLON && adjacent(first, colon)) {
            advance(colon);
            advance(lexer.scan(colon.endOffset(), mode));
        }
        return new Identifier(source.text().substring(first.startOffset(), lastEnd), rangeFrom(first.startOffset()));
    }

    /**
     * 字段名后紧跟单个 '=' 时为命名参数，其余情况按表达式解析为匿名参数。
     */
    private Argument parseArgument() {
        LexToken token = peekExpr();
        if (isFieldNameStart(token)) {
            int savedPos = pos;
            int savedLastEnd = lastEnd;
            FieldName name = parseFieldName(LexMode.EXPRESSION);
            LexToken operator = peekExpr();
            if (operator.type() == TokenType.EQ) {
                advance(operator);
                Expression value = parseExpression();
                return new NamedArg(name, value, rangeFrom(name.range().startOffset()));
            }
            pos = savedPos;
            lastEnd = savedLastEnd;
        }
        Expression value = parseExpression();
        return new UnnamedArg(value, value.range());
    }

    private FieldName parseFieldName(LexMode mode) {
        LexToken token = advance(peek(mode));
        if (token.type() == TokenType.QUOTED_STRING) {
            return new FieldName(new QuotedString(token.value(), token.range()), null, token.range());
        }
        String index = null;
        LexToken open = lexer.scan(token.endOffset(), mode);
        if (open.type() == TokenType.LBRACKET && adjacent(token, open)) {
            LexToken digits = lexer.scan(open.endOffset(), mode);
            LexToken close = lexer.scan(digits.endOffset(), mode);
            if (digits.type() == TokenType.NUMBER && isDigits(digits.value()) && adjacent(open, digits)
                && close.type() == TokenType.RBRACKET && adjacent(digits, close)) {
                advance(close);
                index = digits.value();
            }
        }
        return new FieldName(new Identifier(token.value(), token.range()), index, rangeFrom(token.startOffset()));
    }

    // ==================== 前瞻判定 ====================

    private boolean isFieldNameStart(LexToken token) {
        return token.type() == TokenType.IDENTIFIER
            || token.type() == TokenType.NUMBER
            || token.type() == TokenType.QUOTED_STRING;
    }

    /**
     * 函数调用与自由文本在 '(' 之前无法区分，只有函数名与 '(' 之间没有空白时才视为调用。
     */
    private boolean isCallStart(LexToken token, LexMode mode) {
        if (token.type() != TokenType.IDENTIFIER && token.type() != TokenType.MATCH) {
            return false;
        }
        LexToken next = lexer.scan(token.endOffset(), mode);
        if (!adjacent(token, next)) {
            return false;
        }
        if (next.type() == TokenType.LPAREN) {
            return true;
        }
        if (next.type() != TokenType.COLON) {
            return false;
        }
        LexToken member = lexer.scan(next.endOffset(), mode);
        if (member.type() != TokenType.IDENTIFIER || !adjacent(next, member)) {
            return false;
        }
        LexToken open = lexer.scan(member.endOffset(), mode);
        return open.type() == TokenType.LPAREN && adjacent(member, open);
    }

    private boolean isLabelledSubqueryStart(LexToken token) {
        if (token.type() != TokenType.IDENTIFIER) {
            return false;
        }
        LexToken colon = lexer.scan(token.endOffset(), LexMode.EXPRESSION);
        if (colon.type() != TokenType.COLON) {
            return false;
        }
        return lexer.scan(colon.endOffset(), LexMode.EXPRESSION).type() == TokenType.LBRACE;
    }

    /**
     * 隐式 AND 的判定：下一个 token 能开始一个新的过滤条件，且不是紧贴 '(' 的函数名。
     * 词法错误 token 也算作开始，以便在过滤条件内部报告。
     */
    private boolean beginsFilter(LexToken token) {
        if (token.type().isLexError()) {
            return true;
        }
        switch (token.type()) {
            case IDENTIFIER:
            case NUMBER:
            case PATTERN:
            case QUOTED_STRING:
            case REGEX_BODY:
            case QUESTION:
            case QUESTION_BRACE:
            case NOT:
            case TRUE:
            case FALSE:
            case LPAREN:
                return !isCallStart(token, LexMode.FILTER);
            default:
                return false;
        }
    }

    /**
     * 列表为空，或开括号后直接遇到末尾、'|'、';'；后三种交给 {@link #expectClose} 报告未闭合。
     */
    private boolean closesOrEnds(LexToken token, TokenType close) {
        return token.type() == close || isStepBoundary(token.type());
    }

    /** 括号内不可能出现的步骤边界，遇到即说明闭合括号缺失 */
    private boolean isStepBoundary(TokenType type) {
        return type == TokenType.EOF || type == TokenType.PIPE || type == TokenType.SEMICOLON;
    }

    private boolean isPatternSegment(LexToken token) {
        switch (token.type()) {
            case IDENTIFIER:
            case PATTERN:
            case NUMBER:
            case TRUE:
            case FALSE:
            case MATCH:
            case LIKE:
            case CASE:
                return true;
            default:
                return false;
        }
    }

    private boolean isComparisonOperator(TokenType type) {
        return type == TokenType.EQ_EQ
            || type == TokenType.NOT_EQ
            || type == TokenType.LT
            || type == TokenType.LE
            || type == TokenType.GT
            || type == TokenType.GE
            || type == TokenType.SPACESHIP;
    }

    private FieldOperator fieldOperator(TokenType type) {
        switch (type) {
            case EQ:
                return FieldOperator.EQ;
            case NOT_EQ:
                return FieldOperator.NOT_EQ;
            case LIKE:
                return FieldOperator.LIKE;
            case LT:
                return FieldOperator.LT;
            case LE:
                return FieldOperator.LE;
            case GT:
                return FieldOperator.GT;
            case GE:
                return FieldOperator.GE;
            default:
                return null;
        }
    }

    // ==================== token 访问 ====================

    private LexToken peek() {
        return peek(LexMode.FILTER);
    }

    private LexToken peekExpr() {
        return peek(LexMode.EXPRESSION);
    }

    /**
     * 读取当前位置的下一个非注释 token，不移动游标。途经的注释按位置只收集一次。
     */
    private LexToken peek(LexMode mode) {
        int offset = pos;
        while (true) {
            LexToken token = lexer.scan(offset, mode);
            if (token.type() != TokenType.COMMENT) {
                return token;
            }
            if (token.startOffset() >= commentWatermark) {
                pendingComments.add(new Comment(token.value().stripTrailing(), token.range()));
                commentWatermark = token.endOffset();
            }
            offset = token.endOffset();
        }
    }

    private LexToken advance(LexToken token) {
        pos = token.endOffset();
        lastEnd = token.endOffset();
        return token;
    }

    private LexToken expect(TokenType type, String expected) {
        LexToken token = peek(LexMode.FILTER);
        if (token.type() != type) {
            throw unexpected(expected, token);
        }
        return advance(token);
    }

    /**
     * 读取闭合括号；在文本末尾或 '|'、';' 处缺失时报告未闭合结构，并指向开括号。
     */
    private LexToken expectClose(TokenType close, LexToken open, LexMode mode) {
        LexToken token = peek(mode);
        if (token.type() == close) {
            return advance(token);
        }
        if (isStepBoundary(token.type())) {
            throw abort(Diagnostic.of(DiagnosticKind.UNTERMINATED_CONSTRUCT,
                "missing '" + close.label() + "' to close '" + open.value() + "' opened at " + open.range().start(),
                open.range()));
        }
        throw unexpected("'" + close.label() + "'", token);
    }

    /**
     * 进入一层嵌套；超过上限时中止当前步骤，避免深度递归耗尽调用栈。
     */
    private void enterNesting(LexToken open) {
        nestingDepth++;
        if (nestingDepth > Constants.MAX_NESTING_DEPTH) {
            throw abort(Diagnostic.of(DiagnosticKind.NESTING_TOO_DEEP,
                "nesting exceeds " + Constants.MAX_NESTING_DEPTH + " levels", open.range()));
        }
    }

    private ErrorNode skipToBoundary(int start, Set<TokenType> stops) {
        int depth = 0;
        while (true) {
            LexToken token = peek();
            TokenType type = token.type();
            if (type == TokenType.EOF) {
                break;
            }
            if (depth == 0 && (type == TokenType.PIPE || stops.contains(type))) {
                break;
            }
            if (type == TokenType.LPAREN || type == TokenType.LBRACKET
                || type == TokenType.LBRACE || type == TokenType.QUESTION_BRACE) {
                depth++;
            } else if ((type == TokenType.RPAREN || type == TokenType.RBRACKET || type == TokenType.RBRACE)
                && depth > 0) {
                depth--;
            }
            advance(token);
        }
        int end = Math.max(start, lastEnd);
        return new ErrorNode(source.text().substring(start, end), source.range(start, end));
    }

    private void flushComments(List<PipelineElement> elements) {
        elements.addAll(pendingComments);
        pendingComments.clear();
    }

    private QueryParseException abort(Diagnostic diagnostic) {
        return new QueryParseException(diagnostic, source);
    }

    private QueryParseException unexpected(String expected, LexToken found) {
        return abort(unexpectedDiagnostic(expected, found));
    }

    private Diagnostic unexpectedDiagnostic(String expected, LexToken found) {
        if (!found.type().isLexError()) {
            return Diagnostic.unexpected(expected, found);
        }
        String message;
        if (found.type() == TokenType.UNTERMINATED_STRING) {
            message = "unterminated string literal";
        } else if (found.type() == TokenType.UNTERMINATED_REGEX) {
            message = "unterminated regex literal";
        } else {
            message = "invalid character '" + found.value() + "'";
        }
        return Diagnostic.of(DiagnosticKind.fromLexError(found.type()), message, found.range());
    }

    // ==================== 工具方法 ====================

    private boolean adjacent(LexToken previous, LexToken next) {
        return next.startsAt(previous.endOffset());
    }

    private SourceRange rangeFrom(int start) {
        return source.range(start, Math.max(start, lastEnd));
    }

    private SourceRange spanOf(List<PipelineElement> elements) {
        int start = Integer.MAX_VALUE;
        int end = 0;
        for (PipelineElement element : elements) {
            start = Math.min(start, element.range().startOffset());
            end = Math.max(end, element.range().endOffset());
        }
        if (elements.isEmpty()) {
            start = 0;
        }
        return source.range(start, end);
    }

    private static String leafText(PatternValue value) {
        if (value instanceof Identifier identifier) {
            return identifier.text();
        }
        if (value instanceof UnquotedPattern pattern) {
            return pattern.text();
        }
        return null;
    }

    private static boolean isDigits(String text) {
        for (int index = 0; index < text.length(); index++) {
            if (!Character.isDigit(text.charAt(index))) {
                return false;
            }
        }
        return !text.isEmpty();
    }
}
