package com.logscale.query;

public record LexToken(TokenType type, String value, SourceRange range) {

    public int startOffset() {
        return range.startOffset();
    }

    public int endOffset() {
        return range.endOffset();
    }

    /**
     * 判断当前 token 是否紧贴在给定 offset 之后（中间没有空白）。
     */
    public boolean startsAt(int offset) {
        return range.startOffset() == offset;
    }
}
