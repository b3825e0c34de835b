package com.logscale.query;

/**
 * 源文本中的位置，offset 从 0 开始，行列从 1 开始。
 */
public record SourcePosition(int offset, int line, int column) {

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
