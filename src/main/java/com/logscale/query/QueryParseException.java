package com.logscale.query;

/**
 * 解析器内部的中止信号，携带触发中止的诊断。
 *
 * <p>只在解析器内部抛出并在步骤边界捕获，{@link QueryParser#parse(String)} 不会向外抛出该异常。</p>
 */
public class QueryParseException extends RuntimeException {
    private final transient Diagnostic diagnostic;

    public QueryParseException(Diagnostic diagnostic, SourceText source) {
        super(diagnostic.render(source));
        this.diagnostic = diagnostic;
    }

    public Diagnostic getDiagnostic() {
        return diagnostic;
    }
}
