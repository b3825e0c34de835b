package com.logscale.format;

import com.logscale.query.Diagnostic;
import com.logscale.query.SourceText;

import java.util.List;

/**
 * 拒绝格式化含语法错误的查询时抛出。消息取第一条诊断并附带插入符指示。
 */
public class QueryFormatException extends RuntimeException {
    private final transient List<Diagnostic> diagnostics;

    public QueryFormatException(List<Diagnostic> diagnostics, SourceText source) {
        super(buildMessage(diagnostics, source));
        this.diagnostics = List.copyOf(diagnostics);
    }

    public QueryFormatException(String message) {
        super(message);
        this.diagnostics = List.of();
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    private static String buildMessage(List<Diagnostic> diagnostics, SourceText source) {
        if (diagnostics.isEmpty()) {
            return "query contains syntax errors";
        }
        String message = "cannot format query with syntax errors: " + diagnostics.get(0).render(source);
        if (diagnostics.size() > 1) {
            message += System.lineSeparator() + "(" + (diagnostics.size() - 1) + " more diagnostics)";
        }
        return message;
    }
}
