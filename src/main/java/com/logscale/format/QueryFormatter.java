package com.logscale.format;

import com.logscale.config.Constants;
import com.logscale.config.FormatterConfig;
import com.logscale.query.QueryParser;
import com.logscale.query.SyntaxNode;
import com.logscale.query.SyntaxNode.AndFilter;
import com.logscale.query.SyntaxNode.AdditiveExpr;
import com.logscale.query.SyntaxNode.ArrayExpr;
import com.logscale.query.SyntaxNode.BooleanLiteral;
import com.logscale.query.SyntaxNode.CaseExpr;
import com.logscale.query.SyntaxNode.Comment;
import com.logscale.query.SyntaxNode.ComparisonExpr;
import com.logscale.query.SyntaxNode.ErrorNode;
import com.logscale.query.SyntaxNode.EvalFunctionShorthand;
import com.logscale.query.SyntaxNode.EvalShorthand;
import com.logscale.query.SyntaxNode.FieldComparison;
import com.logscale.query.SyntaxNode.FieldName;
import com.logscale.query.SyntaxNode.FieldShorthand;
import com.logscale.query.SyntaxNode.FreeTextPattern;
import com.logscale.query.SyntaxNode.FunctionCall;
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
import java.util.List;

/**
 * 把语法树渲染为规范文本。每种节点有固定的排版规则，与所在位置无关，只有缩进深度自顶向下传递。
 *
 * <p>实例只持有不可变配置，可在线程间共享。</p>
 */
public class QueryFormatter {
    private static final Logger logger = LoggerFactory.getLogger(QueryFormatter.class);

    private final FormatterConfig config;
    private final DocRenderer renderer;

    public QueryFormatter() {
        this(FormatterConfig.defaults());
    }

    public QueryFormatter(FormatterConfig config) {
        this.config = sanitize(config);
        this.renderer = new DocRenderer(this.config.getMaxLineWidth(), this.config.getIndentWidth());
    }

    /**
     * 解析并格式化；解析产生任何诊断时抛出 {@link QueryFormatException}。
     */
    public String format(String text) {
        QueryParser.ParseResult result = new QueryParser().parse(text);
        if (result.hasErrors()) {
            throw new QueryFormatException(result.diagnostics(), result.source());
        }
        return format(result.query());
    }

    /**
     * 格式化语法树；树中含错误节点时抛出 {@link QueryFormatException}。空查询输出空字符串。
     */
    public String format(Query query) {
        if (query.pipeline() == null) {
            return "";
        }
        String rendered = renderer.render(pipelineDoc(query.pipeline(), ""));
        logger.debug("格式化完成: 输出 {} 个字符", rendered.length());
        return config.isTrailingNewline() ? rendered + "\n" : rendered;
    }

    public FormatterConfig getConfig() {
        return config;
    }

    // ==================== 管道 ====================

    /**
     * 每个元素独占一行，第一个步骤之后的步骤加 "| " 前缀。
     * terminator 追加在最后一个真实步骤之后，使分支分号不落在尾随注释里。
     */
    private Doc pipelineDoc(Pipeline pipeline, String terminator) {
        List<PipelineElement> elements = pipeline.elements();
        int lastStep = -1;
        for (int index = 0; index < elements.size(); index++) {
            if (elements.get(index) instanceof Step) {
                lastStep = index;
            }
        }

        List<Doc> lines = new ArrayList<>();
        boolean stepSeen = false;
        for (int index = 0; index < elements.size(); index++) {
            PipelineElement element = elements.get(index);
            if (element instanceof Comment comment) {
                lines.add(Doc.text(comment.text()));
                continue;
            }
            Doc step = doc(element);
            if (stepSeen) {
                step = Doc.concat(Doc.text("| "), step);
            }
            if (index == lastStep && !terminator.isEmpty()) {
                step = Doc.concat(step, Doc.text(terminator));
            }
            lines.add(step);
            stepSeen = true;
        }
        return Doc.join(Doc.hardline(), lines);
    }

    private Doc caseDoc(CaseExpr caseExpr) {
        List<Doc> arms = new ArrayList<>();
        List<Pipeline> branches = caseExpr.branches();
        for (int index = 0; index < branches.size(); index++) {
            arms.add(pipelineDoc(branches.get(index), index < branches.size() - 1 ? ";" : ""));
        }
        return blockDoc(Doc.text("case {"), arms);
    }

    private Doc matchDoc(MatchExpr matchExpr) {
        List<Doc> arms = new ArrayList<>();
        List<MatchArm> matchArms = matchExpr.arms();
        for (int index = 0; index < matchArms.size(); index++) {
            MatchArm arm = matchArms.get(index);
            List<Doc> parts = new ArrayList<>();
            for (Comment comment : arm.comments()) {
                parts.add(Doc.text(comment.text()));
                parts.add(Doc.hardline());
            }
            parts.add(doc(arm.guard()));
            parts.add(Doc.text(" => "));
            parts.add(pipelineDoc(arm.body(), index < matchArms.size() - 1 ? ";" : ""));
            arms.add(Doc.concat(parts));
        }
        return blockDoc(Doc.concat(fieldDoc(matchExpr.field()), Doc.text(" match {")), arms);
    }

    /**
     * case / match 体：左花括号后硬换行并缩进，每个分支独占一行，右花括号前回退缩进。
     */
    private Doc blockDoc(Doc header, List<Doc> arms) {
        return Doc.concat(
            header,
            Doc.indent(Doc.hardline(), Doc.join(Doc.hardline(), arms)),
            Doc.hardline(),
            Doc.text("}")
        );
    }

    // ==================== 节点分派 ====================

    private Doc doc(SyntaxNode node) {
        if (node instanceof AndFilter andFilter) {
            List<Doc> parts = new ArrayList<>();
            parts.add(doc(andFilter.operands().get(0)));
            for (int index = 1; index < andFilter.operands().size(); index++) {
                parts.add(Doc.text(andFilter.explicit().get(index - 1) ? " AND " : " "));
                parts.add(doc(andFilter.operands().get(index)));
            }
            return Doc.concat(parts);
        }
        if (node instanceof OrFilter orFilter) {
            return Doc.join(Doc.text(" OR "), docs(orFilter.operands()));
        }
        if (node instanceof NotFilter notFilter) {
            return Doc.concat(Doc.text("NOT "), doc(notFilter.operand()));
        }
        if (node instanceof ParenthesizedFilter parenthesized) {
            return Doc.concat(Doc.text("("), doc(parenthesized.inner()), Doc.text(")"));
        }
        if (node instanceof BooleanLiteral literal) {
            return Doc.text(literal.value() ? "true" : "false");
        }
        if (node instanceof FieldComparison comparison) {
            return binary(fieldDoc(comparison.field()), comparison.operator().symbol(), doc(comparison.value()));
        }
        if (node instanceof FreeTextPattern freeText) {
            return doc(freeText.pattern());
        }
        if (node instanceof FieldName fieldName) {
            return fieldDoc(fieldName);
        }
        if (node instanceof Identifier identifier) {
            return Doc.text(identifier.text());
        }
        if (node instanceof UnquotedPattern pattern) {
            return Doc.text(pattern.text());
        }
        if (node instanceof QuotedString quoted) {
            return Doc.text(quoted.text());
        }
        if (node instanceof NumberLiteral number) {
            return Doc.text(number.text());
        }
        if (node instanceof Regex regex) {
            return Doc.text("/" + regex.body() + "/" + regex.flags());
        }
        if (node instanceof QueryParameter parameter) {
            if (parameter.defaultValue() == null) {
                return Doc.concat(Doc.text("?"), doc(parameter.name()));
            }
            return Doc.concat(Doc.text("?{"), doc(parameter.name()), Doc.text("="),
                doc(parameter.defaultValue()), Doc.text("}"));
        }
        if (node instanceof Wildcard) {
            return Doc.text("*");
        }
        if (node instanceof ComparisonExpr comparison) {
            return binary(doc(comparison.left()), comparison.operator(), doc(comparison.right()));
        }
        if (node instanceof AdditiveExpr additive) {
            return binary(doc(additive.left()), additive.operator(), doc(additive.right()));
        }
        if (node instanceof MultiplicativeExpr multiplicative) {
            return binary(doc(multiplicative.left()), multiplicative.operator(), doc(multiplicative.right()));
        }
        if (node instanceof UnaryExpr unary) {
            return Doc.concat(Doc.text(unary.operator()), doc(unary.operand()));
        }
        if (node instanceof ParenthesizedExpr parenthesized) {
            return Doc.concat(Doc.text("("), doc(parenthesized.inner()), Doc.text(")"));
        }
        if (node instanceof FunctionCall call) {
            return Doc.concat(Doc.text(call.name().text()), listDoc("(", docs(call.arguments()), ")"));
        }
        if (node instanceof NamedArg namedArg) {
            return binary(fieldDoc(namedArg.name()), "=", doc(namedArg.value()));
        }
        if (node instanceof UnnamedArg unnamedArg) {
            return doc(unnamedArg.value());
        }
        if (node instanceof EvalShorthand eval) {
            return binary(fieldDoc(eval.field()), ":=", doc(eval.value()));
        }
        if (node instanceof EvalFunctionShorthand eval) {
            return binary(fieldDoc(eval.field()), ":=", doc(eval.call()));
        }
        if (node instanceof FieldShorthand shorthand) {
            return binary(fieldDoc(shorthand.field()), "=~", doc(shorthand.call()));
        }
        if (node instanceof StatsShorthand stats) {
            return doc(stats.array());
        }
        if (node instanceof ArrayExpr array) {
            return listDoc("[", docs(array.elements()), "]");
        }
        if (node instanceof Subquery subquery) {
            return subqueryDoc(subquery);
        }
        if (node instanceof CaseExpr caseExpr) {
            return caseDoc(caseExpr);
        }
        if (node instanceof MatchExpr matchExpr) {
            return matchDoc(matchExpr);
        }
        if (node instanceof SavedQuery savedQuery) {
            return Doc.concat(Doc.text("$"), doc(savedQuery.name()), listDoc("(", docs(savedQuery.arguments()), ")"));
        }
        if (node instanceof SavedQueryArg argument) {
            return binary(doc(argument.name()), "=", doc(argument.value()));
        }
        if (node instanceof Pipeline pipeline) {
            return pipelineDoc(pipeline, "");
        }
        if (node instanceof Comment comment) {
            return Doc.text(comment.text());
        }
        if (node instanceof ErrorNode error) {
            throw new QueryFormatException("cannot format query with syntax errors at "
                + error.range().start() + ": '" + error.text() + "'");
        }
        throw new IllegalArgumentException("无法格式化的节点类型: " + node.getClass().getSimpleName());
    }

    private List<Doc> docs(List<? extends SyntaxNode> nodes) {
        List<Doc> result = new ArrayList<>(nodes.size());
        for (SyntaxNode node : nodes) {
            result.add(doc(node));
        }
        return result;
    }

    private Doc fieldDoc(FieldName fieldName) {
        return Doc.text(fieldName.text());
    }

    /**
     * 二元运算符两侧各一个空格，运算符处不换行。
     */
    private Doc binary(Doc left, String operator, Doc right) {
        return Doc.concat(left, Doc.text(" " + operator + " "), right);
    }

    /**
     * 参数与数组列表：放得下时单行，否则每项一行并缩进；空列表直接输出括号。
     */
    private Doc listDoc(String open, List<Doc> items, String close) {
        if (items.isEmpty()) {
            return Doc.text(open + close);
        }
        return Doc.group(
            Doc.text(open),
            Doc.indent(Doc.softline(), Doc.join(Doc.concat(Doc.text(","), Doc.line()), items)),
            Doc.softline(),
            Doc.text(close)
        );
    }

    /**
     * '{' 前的空格来自上下文（{@code := }、{@code = }、{@code label: }）；紧跟 '(' 或 '[' 时与其他列表项一样不加空格。
     */
    private Doc subqueryDoc(Subquery subquery) {
        Doc body = Doc.group(
            Doc.text("{"),
            Doc.indent(Doc.line(), pipelineDoc(subquery.body(), "")),
            Doc.line(),
            Doc.text("}")
        );
        if (subquery.label() == null) {
            return body;
        }
        return Doc.concat(Doc.text(subquery.label().text() + ": "), body);
    }

    private static FormatterConfig sanitize(FormatterConfig requested) {
        FormatterConfig effective = FormatterConfig.defaults();
        if (requested == null) {
            return effective;
        }
        if (requested.getMaxLineWidth() < Constants.MIN_LINE_WIDTH) {
            logger.warn("行宽 {} 小于下限 {}，已回退为默认值 {}",
                requested.getMaxLineWidth(), Constants.MIN_LINE_WIDTH, Constants.DEFAULT_MAX_LINE_WIDTH);
        } else {
            effective.setMaxLineWidth(requested.getMaxLineWidth());
        }
        if (requested.getIndentWidth() < 0) {
            logger.warn("缩进宽度 {} 非法，已回退为默认值 {}", requested.getIndentWidth(), Constants.DEFAULT_INDENT_WIDTH);
        } else if (requested.getIndentWidth() > Constants.MAX_INDENT_WIDTH) {
            logger.warn("缩进宽度 {} 超过上限 {}，已自动限制", requested.getIndentWidth(), Constants.MAX_INDENT_WIDTH);
            effective.setIndentWidth(Constants.MAX_INDENT_WIDTH);
        } else {
            effective.setIndentWidth(requested.getIndentWidth());
        }
        effective.setTrailingNewline(requested.isTrailingNewline());
        return effective;
    }
}
