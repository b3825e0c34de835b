package com.logscale.config;

/**
 * 格式化运行时配置
 * 
 * 支持从CLI参数注入，覆盖Constants默认值
 */
public class FormatterConfig {
    private int maxLineWidth = Constants.DEFAULT_MAX_LINE_WIDTH;
    private int indentWidth = Constants.DEFAULT_INDENT_WIDTH;
    private boolean trailingNewline = true;

    public int getMaxLineWidth() {
        return maxLineWidth;
    }

    public void setMaxLineWidth(int maxLineWidth) {
        this.maxLineWidth = maxLineWidth;
    }

    public int getIndentWidth() {
        return indentWidth;
    }

    public void setIndentWidth(int indentWidth) {
        this.indentWidth = indentWidth;
    }

    public boolean isTrailingNewline() {
        return trailingNewline;
    }

    public void setTrailingNewline(boolean trailingNewline) {
        this.trailingNewline = trailingNewline;
    }

    /**
     * 使用默认配置创建实例
     */
    public static FormatterConfig defaults() {
        return new FormatterConfig();
    }
}
