package com.logscale.query;

import java.util.List;

/**
 * 查询语法树。每个记录对应一条语法产生式，并携带其源码区间。
 *
 * <p>语法树在一次解析中整体构建，之后只读；子节点列表均为不可变副本。</p>
 */
public sealed interface SyntaxNode {

    SourceRange range();

    /** 管道中的元素：步骤或独立注释 */
    sealed interface PipelineElement extends SyntaxNode {
    }

    /** 管道步骤 */
    sealed interface Step extends PipelineElement {
    }

    /** 过滤条件，本身也可作为步骤 */
    sealed interface Filter extends Step {
    }

    /** 数组元素：表达式或数组内的 eval 函数简写 */
    sealed interface ArrayElement extends SyntaxNode {
    }

    /** 表达式；正则不属于表达式 */
    sealed interface Expression extends ArrayElement {
    }

    /** 函数参数 */
    sealed interface Argument extends SyntaxNode {
    }

    /** match 分支的守卫 */
    sealed interface Guard extends SyntaxNode {
    }

    /** 模式位置上的叶子值：标识符、非引号模式、字符串、数字、正则、查询参数 */
    sealed interface PatternValue extends Guard {
    }

    /** 字段比较运算符 */
    enum FieldOperator {
        EQ("="),
        NOT_EQ("!="),
        LIKE("like"),
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">=");

        private final String symbol;

        FieldOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    /** 空查询时 pipeline 为 null */
    record Query(Pipeline pipeline, SourceRange range) implements SyntaxNode {
    }

    record Pipeline(List<PipelineElement> elements, SourceRange range) implements SyntaxNode {
        public Pipeline {
            elements = List.copyOf(elements);
        }

        /**
         * 只返回真实步骤，跳过注释。
         */
        public List<Step> steps() {
            return elements.stream()
                .filter(Step.class::isInstance)
                .map(Step.class::cast)
                .toList();
        }
    }

    record Comment(String text, SourceRange range) implements PipelineElement {
    }

    // ==================== 过滤条件 ====================

    /**
     * 由显式或隐式 AND 连接的过滤条件。{@code explicit.get(i)} 描述第 i 与第 i+1 个操作数之间是否写了 AND。
     */
    record AndFilter(List<Filter> operands, List<Boolean> explicit, SourceRange range) implements Filter {
        public AndFilter {
            operands = List.copyOf(operands);
            explicit = List.copyOf(explicit);
            if (operands.size() < 2 || explicit.size() != operands.size() - 1) {
                throw new IllegalArgumentException("AND 过滤至少需要两个操作数");
            }
        }
    }

    record OrFilter(List<Filter> operands, SourceRange range) implements Filter {
        public OrFilter {
            operands = List.copyOf(operands);
            if (operands.size() < 2) {
                throw new IllegalArgumentException("OR 过滤至少需要两个操作数");
            }
        }
    }

    record NotFilter(Filter operand, SourceRange range) implements Filter {
    }

    record ParenthesizedFilter(Filter inner, SourceRange range) implements Filter {
    }

    record BooleanLiteral(boolean value, SourceRange range) implements Filter {
    }

    record FieldComparison(FieldName field, FieldOperator operator, PatternValue value, SourceRange range)
        implements Filter {
    }

    record FreeTextPattern(PatternValue pattern, SourceRange range) implements Filter {
    }

    // ==================== 叶子 ====================

    /** 字段名；name 为标识符或字符串，index 为可选的数组下标 */
    record FieldName(PatternValue name, String index, SourceRange range) implements SyntaxNode {

        public String text() {
            String base;
            if (name instanceof Identifier identifier) {
                base = identifier.text();
            } else if (name instanceof QuotedString quoted) {
                base = quoted.text();
            } else {
                throw new IllegalStateException("非法字段名节点: " + name);
            }
            return index == null ? base : base + "[" + index + "]";
        }
    }

    record Identifier(String text, SourceRange range) implements Expression, PatternValue {
    }

    record UnquotedPattern(String text, SourceRange range) implements PatternValue {
    }

    /** text 保留两侧引号与转义原文 */
    record QuotedString(String text, SourceRange range) implements Expression, PatternValue {
    }

    /** text 保留源码中的数字写法 */
    record NumberLiteral(String text, SourceRange range) implements Expression, PatternValue {
    }

    /** flags 为空字符串表示无标志 */
    record Regex(String body, String flags, SourceRange range) implements PatternValue {
    }

    /** defaultValue 为 null 时是 {@code ?name} 形式 */
    record QueryParameter(PatternValue name, PatternValue defaultValue, SourceRange range)
        implements Expression, PatternValue {
    }

    record Wildcard(SourceRange range) implements Guard {
    }

    // ==================== 表达式 ====================

    record ComparisonExpr(Expression left, String operator, Expression right, SourceRange range)
        implements Expression {
    }

    record AdditiveExpr(Expression left, String operator, Expression right, SourceRange range)
        implements Expression {
    }

    record MultiplicativeExpr(Expression left, String operator, Expression right, SourceRange range)
        implements Expression {
    }

    record UnaryExpr(String operator, Expression operand, SourceRange range) implements Expression {
    }

    record ParenthesizedExpr(Expression inner, SourceRange range) implements Expression {
    }

    // ==================== 函数与简写 ====================

    /** name 可带命名空间，如 {@code text:contains} */
    record FunctionCall(Identifier name, List<Argument> arguments, SourceRange range)
        implements Step, Expression, Guard {
        public FunctionCall {
            arguments = List.copyOf(arguments);
        }
    }

    record NamedArg(FieldName name, Expression value, SourceRange range) implements Argument {
    }

    record UnnamedArg(Expression value, SourceRange range) implements Argument {
    }

    record EvalShorthand(FieldName field, Expression value, SourceRange range) implements Step {
    }

    record EvalFunctionShorthand(FieldName field, FunctionCall call, SourceRange range)
        implements Step, ArrayElement {
    }

    record FieldShorthand(FieldName field, FunctionCall call, SourceRange range) implements Step {
    }

    record StatsShorthand(ArrayExpr array, SourceRange range) implements Step {
    }

    record ArrayExpr(List<ArrayElement> elements, SourceRange range) implements Expression {
        public ArrayExpr {
            elements = List.copyOf(elements);
        }
    }

    /** label 为 null 表示无标签子查询 */
    record Subquery(Identifier label, Pipeline body, SourceRange range) implements Expression {
    }

    // ==================== case / match ====================

    record CaseExpr(List<Pipeline> branches, SourceRange range) implements Step {
        public CaseExpr {
            branches = List.copyOf(branches);
        }
    }

    record MatchExpr(FieldName field, List<MatchArm> arms, SourceRange range) implements Step {
        public MatchExpr {
            arms = List.copyOf(arms);
        }
    }

    /** comments 为守卫之前的独立注释 */
    record MatchArm(List<Comment> comments, Guard guard, Pipeline body, SourceRange range) implements SyntaxNode {
        public MatchArm {
            comments = List.copyOf(comments);
        }
    }

    // ==================== 保存的查询 ====================

    record SavedQuery(PatternValue name, List<SavedQueryArg> arguments, SourceRange range) implements Step {
        public SavedQuery {
            arguments = List.copyOf(arguments);
        }
    }

    record SavedQueryArg(PatternValue name, PatternValue value, SourceRange range) implements SyntaxNode {
    }

    /**
     * 无法解析的源码片段，text 为原文。含有该节点的语法树不能被格式化。
     */
    record ErrorNode(String text, SourceRange range)
        implements Step, Filter, Expression, Argument, PatternValue {
    }
}
