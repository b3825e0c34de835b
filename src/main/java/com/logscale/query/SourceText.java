package com.logscale.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 查询源文本及其行首偏移表，用于把 offset 换算为行列。
 */
public final class SourceText {
    private final String text;
    private final int[] lineStarts;

    public SourceText(String text) {
        this.text = text == null ? "" : text;
        this.lineStarts = computeLineStarts(this.text);
    }

    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public SourcePosition positionAt(int offset) {
        int clamped = Math.max(0, Math.min(offset, text.length()));
        int lineIndex = Arrays.binarySearch(lineStarts, clamped);
        if (lineIndex < 0) {
            lineIndex = -lineIndex - 2;
        }
        return new SourcePosition(clamped, lineIndex + 1, clamped - lineStarts[lineIndex] + 1);
    }

    public SourceRange range(int startOffset, int endOffset) {
        return new SourceRange(positionAt(startOffset), positionAt(Math.max(startOffset, endOffset)));
    }

    public String slice(SourceRange range) {
        return text.substring(range.startOffset(), range.endOffset());
    }

    /**
     * 返回指定行（从 1 开始）的内容，不含换行符。
     */
    public String lineText(int line) {
        if (line < 1 || line > lineStarts.length) {
            return "";
        }
        int start = lineStarts[line - 1];
        int end = line < lineStarts.length ? lineStarts[line] - 1 : text.length();
        if (end > start && text.charAt(end - 1) == '\r') {
            end--;
        }
        return text.substring(start, Math.max(start, end));
    }

    private static int[] computeLineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int index = 0; index < text.length(); index++) {
            if (text.charAt(index) == '\n') {
                starts.add(index + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }
}
