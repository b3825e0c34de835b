package com.logscale.query;

/**
 * 诊断类型，按词法、语法、结构三类分组。
 */
public enum DiagnosticKind {
    UNTERMINATED_STRING(Category.LEX_ERROR),
    UNTERMINATED_REGEX(Category.LEX_ERROR),
    INVALID_CHARACTER(Category.LEX_ERROR),

    UNEXPECTED_TOKEN(Category.SYNTAX_ERROR),
    UNTERMINATED_CONSTRUCT(Category.SYNTAX_ERROR),
    MALFORMED_SHORTHAND(Category.SYNTAX_ERROR),
    NESTING_TOO_DEEP(Category.SYNTAX_ERROR),

    INVALID_REGEX_CONTEXT(Category.SEMANTIC_SHAPE_ERROR),
    RESERVED_WORD_MISUSE(Category.SEMANTIC_SHAPE_ERROR),
    DUPLICATE_UNNAMED_ARGUMENT(Category.SEMANTIC_SHAPE_ERROR);

    /** 诊断大类 */
    public enum Category {
        LEX_ERROR,
        SYNTAX_ERROR,
        SEMANTIC_SHAPE_ERROR
    }

    private final Category category;

    DiagnosticKind(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }

    /**
     * 由词法错误 token 映射到对应诊断类型。
     */
    public static DiagnosticKind fromLexError(TokenType type) {
        return switch (type) {
            case UNTERMINATED_STRING -> UNTERMINATED_STRING;
            case UNTERMINATED_REGEX -> UNTERMINATED_REGEX;
            case INVALID_CHARACTER -> INVALID_CHARACTER;
            default -> throw new IllegalArgumentException("不是词法错误 token: " + type);
        };
    }
}
