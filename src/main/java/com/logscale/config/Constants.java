package com.logscale.config;

/**
 * 全局常量定义
 * 
 * 包含工具版本、排版参数、解析参数和文件约定
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 版本 ====================
    /** 命令行工具版本号 */
    public static final String TOOL_VERSION = "1.0.0";
    /** 保留字表版本，保留字集合变化时递增 */
    public static final int RESERVED_WORDS_VERSION = 1;

    // ==================== 排版参数 ====================
    /** 单行最大宽度，超过后分组换行 */
    public static final int DEFAULT_MAX_LINE_WIDTH = 80;
    /** 每级缩进空格数 */
    public static final int DEFAULT_INDENT_WIDTH = 2;
    /** 缩进宽度上限 */
    public static final int MAX_INDENT_WIDTH = 8;
    /** 行宽下限，低于此值时回退为默认值 */
    public static final int MIN_LINE_WIDTH = 20;

    // ==================== 解析参数 ====================
    /** 括号、子查询、NOT 与一元运算的最大嵌套层数 */
    public static final int MAX_NESTING_DEPTH = 256;

    // ==================== 文件约定 ====================
    /** 标准输入的显示标签 */
    public static final String STDIN_LABEL = "<stdin>";
}
