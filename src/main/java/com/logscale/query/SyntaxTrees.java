package com.logscale.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 语法树的通用遍历工具。
 */
public final class SyntaxTrees {
    private SyntaxTrees() {
        // 工具类，禁止实例化
    }

    /** 与语法产生式名称不一致的节点名 */
    private static final Map<Class<?>, String> NODE_NAMES = Map.ofEntries(
        Map.entry(SyntaxNode.NumberLiteral.class, "number"),
        Map.entry(SyntaxNode.ComparisonExpr.class, "comparison_expression"),
        Map.entry(SyntaxNode.AdditiveExpr.class, "additive_expression"),
        Map.entry(SyntaxNode.MultiplicativeExpr.class, "multiplicative_expression"),
        Map.entry(SyntaxNode.UnaryExpr.class, "unary_expression"),
        Map.entry(SyntaxNode.ParenthesizedExpr.class, "parenthesized_expression"),
        Map.entry(SyntaxNode.ArrayExpr.class, "array_expression"),
        Map.entry(SyntaxNode.CaseExpr.class, "case_expression"),
        Map.entry(SyntaxNode.MatchExpr.class, "match_expression"),
        Map.entry(SyntaxNode.MatchArm.class, "match_pipeline"),
        Map.entry(SyntaxNode.NamedArg.class, "named_function_argument"),
        Map.entry(SyntaxNode.UnnamedArg.class, "unnamed_function_argument"),
        Map.entry(SyntaxNode.SavedQueryArg.class, "saved_query_argument"),
        Map.entry(SyntaxNode.Wildcard.class, "wildcard"),
        Map.entry(SyntaxNode.ErrorNode.class, "ERROR")
    );

    /**
     * 返回节点的直接子节点，顺序与记录组件的声明顺序一致；null 子节点跳过。
     */
    public static List<SyntaxNode> children(SyntaxNode node) {
        List<SyntaxNode> children = new ArrayList<>();
        if (node instanceof SyntaxNode.Query query) {
            addChild(children, query.pipeline());
        } else if (node instanceof SyntaxNode.Pipeline pipeline) {
            children.addAll(pipeline.elements());
        } else if (node instanceof SyntaxNode.AndFilter andFilter) {
            children.addAll(andFilter.operands());
        } else if (node instanceof SyntaxNode.OrFilter orFilter) {
            children.addAll(orFilter.operands());
        } else if (node instanceof SyntaxNode.NotFilter notFilter) {
            addChild(children, notFilter.operand());
        } else if (node instanceof SyntaxNode.ParenthesizedFilter parenthesized) {
            addChild(children, parenthesized.inner());
        } else if (node instanceof SyntaxNode.FieldComparison comparison) {
            addChild(children, comparison.field());
            addChild(children, comparison.value());
        } else if (node instanceof SyntaxNode.FreeTextPattern freeText) {
            addChild(children, freeText.pattern());
        } else if (node instanceof SyntaxNode.FieldName fieldName) {
            addChild(children, fieldName.name());
        } else if (node instanceof SyntaxNode.QueryParameter parameter) {
            addChild(children, parameter.name());
            addChild(children, parameter.defaultValue());
        } else if (node instanceof SyntaxNode.ComparisonExpr comparison) {
            addChild(children, comparison.left());
            addChild(children, comparison.right());
        } else if (node instanceof SyntaxNode.AdditiveExpr additive) {
            addChild(children, additive.left());
            addChild(children, additive.right());
        } else if (node instanceof SyntaxNode.MultiplicativeExpr multiplicative) {
            addChild(children, multiplicative.left());
            addChild(children, multiplicative.right());
        } else if (node instanceof SyntaxNode.UnaryExpr unary) {
            addChild(children, unary.operand());
        } else if (node instanceof SyntaxNode.ParenthesizedExpr parenthesized) {
            addChild(children, parenthesized.inner());
        } else if (node instanceof SyntaxNode.FunctionCall call) {
            addChild(children, call.name());
            children.addAll(call.arguments());
        } else if (node instanceof SyntaxNode.NamedArg namedArg) {
            addChild(children, namedArg.name());
            addChild(children, namedArg.value());
        } else if (node instanceof SyntaxNode.UnnamedArg unnamedArg) {
            addChild(children, unnamedArg.value());
        } else if (node instanceof SyntaxNode.EvalShorthand eval) {
            addChild(children, eval.field());
            addChild(children, eval.value());
        } else if (node instanceof SyntaxNode.EvalFunctionShorthand evalFunction) {
            addChild(children, evalFunction.field());
            addChild(children, evalFunction.call());
        } else if (node instanceof SyntaxNode.FieldShorthand fieldShorthand) {
            addChild(children, fieldShorthand.field());
            addChild(children, fieldShorthand.call());
        } else if (node instanceof SyntaxNode.StatsShorthand stats) {
            addChild(children, stats.array());
        } else if (node instanceof SyntaxNode.ArrayExpr array) {
            children.addAll(array.elements());
        } else if (node instanceof SyntaxNode.Subquery subquery) {
            addChild(children, subquery.label());
            addChild(children, subquery.body());
        } else if (node instanceof SyntaxNode.CaseExpr caseExpr) {
            children.addAll(caseExpr.branches());
        } else if (node instanceof SyntaxNode.MatchExpr match) {
            addChild(children, match.field());
            children.addAll(match.arms());
        } else if (node instanceof SyntaxNode.MatchArm arm) {
            children.addAll(arm.comments());
            addChild(children, arm.guard());
            addChild(children, arm.body());
        } else if (node instanceof SyntaxNode.SavedQuery savedQuery) {
            addChild(children, savedQuery.name());
            children.addAll(savedQuery.arguments());
        } else if (node instanceof SyntaxNode.SavedQueryArg argument) {
            addChild(children, argument.name());
            addChild(children, argument.value());
        }
        // 其余为叶子节点：注释、布尔值、标识符、模式、字符串、数字、正则、通配符与错误节点
        return children;
    }

    private static void addChild(List<SyntaxNode> children, SyntaxNode child) {
        if (child != null) {
            children.add(child);
        }
    }

    /**
     * 节点的语法名称，如 {@code and_filter}、{@code function_call}。
     */
    public static String nodeName(SyntaxNode node) {
        String name = NODE_NAMES.get(node.getClass());
        if (name != null) {
            return name;
        }
        return toSnakeCase(node.getClass().getSimpleName());
    }

    /**
     * 判断子树中是否存在错误节点。
     */
    public static boolean containsErrors(SyntaxNode node) {
        if (node instanceof SyntaxNode.ErrorNode) {
            return true;
        }
        for (SyntaxNode child : children(node)) {
            if (containsErrors(child)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 先序收集子树中所有指定类型的节点。
     */
    public static <T extends SyntaxNode> List<T> collect(SyntaxNode node, Class<T> type) {
        List<T> result = new ArrayList<>();
        collectInto(node, type, result);
        return result;
    }

    private static <T extends SyntaxNode> void collectInto(SyntaxNode node, Class<T> type, List<T> result) {
        if (type.isInstance(node)) {
            result.add(type.cast(node));
        }
        for (SyntaxNode child : children(node)) {
            collectInto(child, type, result);
        }
    }

    private static String toSnakeCase(String simpleName) {
        StringBuilder builder = new StringBuilder();
        for (int index = 0; index < simpleName.length(); index++) {
            char ch = simpleName.charAt(index);
            if (Character.isUpperCase(ch)) {
                if (index > 0) {
                    builder.append('_');
                }
                builder.append(Character.toLowerCase(ch));
            } else {
                builder.append(ch);
            }
        }
        return builder.toString();
    }
}
