package com.logscale.query;

/**
 * 左闭右开的源文本区间。
 */
public record SourceRange(SourcePosition start, SourcePosition end) {

    public int startOffset() {
        return start.offset();
    }

    public int endOffset() {
        return end.offset();
    }

    public int length() {
        return end.offset() - start.offset();
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
