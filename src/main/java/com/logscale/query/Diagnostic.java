package com.logscale.query;

/**
 * 带源码区间的诊断信息。
 *
 * <p>{@code expected} 与 {@code found} 仅在 UNEXPECTED_TOKEN 一类诊断中有值，其余为 null。</p>
 */
public record Diagnostic(DiagnosticKind kind, String message, SourceRange range, String expected, String found) {

    public static Diagnostic of(DiagnosticKind kind, String message, SourceRange range) {
        return new Diagnostic(kind, message, range, null, null);
    }

    public static Diagnostic unexpected(String expected, LexToken found) {
        String foundText = found.type() == TokenType.EOF ? TokenType.EOF.label() : "'" + found.value() + "'";
        return new Diagnostic(
            DiagnosticKind.UNEXPECTED_TOKEN,
            "expected " + expected + " but found " + foundText,
            found.range(),
            expected,
            foundText
        );
    }

    public DiagnosticKind.Category category() {
        return kind.category();
    }

    /**
     * 生成带行号与插入符指示的多行错误描述。
     */
    public String render(SourceText source) {
        SourcePosition start = range.start();
        String line = source.lineText(start.line());
        int caretColumn = Math.max(0, Math.min(start.column() - 1, line.length()));
        int caretWidth = start.line() == range.end().line()
            ? Math.max(1, Math.min(range.length(), line.length() - caretColumn))
            : 1;
        String pointer = " ".repeat(caretColumn) + "^".repeat(caretWidth);
        return start + ": " + kind.name().toLowerCase() + ": " + message + System.lineSeparator()
            + line + System.lineSeparator() + pointer;
    }

    @Override
    public String toString() {
        return range.start() + ": " + message;
    }
}
