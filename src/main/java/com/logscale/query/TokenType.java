package com.logscale.query;

public enum TokenType {
    IDENTIFIER("identifier"),
    PATTERN("unquoted_pattern"),
    QUOTED_STRING("quoted_string"),
    NUMBER("number"),
    REGEX_BODY("regex_body"),
    REGEX_FLAGS("regex_flags"),
    COMMENT("comment"),

    PIPE("|"),
    LPAREN("("),
    RPAREN(")"),
    LBRACKET("["),
    RBRACKET("]"),
    LBRACE("{"),
    RBRACE("}"),
    COMMA(","),
    SEMICOLON(";"),
    COLON(":"),
    EVAL_ASSIGN(":="),
    FIELD_ASSIGN("=~"),
    ARROW("=>"),
    EQ("="),
    EQ_EQ("=="),
    NOT_EQ("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    SPACESHIP("<=>"),
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    PERCENT("%"),
    BANG("!"),
    DOLLAR("$"),
    QUESTION("?"),
    QUESTION_BRACE("?{"),

    AND("AND"),
    OR("OR"),
    NOT("NOT"),
    CASE("case"),
    MATCH("match"),
    LIKE("like"),
    TRUE("true"),
    FALSE("false"),

    UNTERMINATED_STRING("unterminated_string"),
    UNTERMINATED_REGEX("unterminated_regex"),
    INVALID_CHARACTER("invalid_character"),
    EOF("end of input");

    private final String label;

    TokenType(String label) {
        this.label = label;
    }

    /**
     * 诊断信息与 tokenize 输出使用的名称。
     */
    public String label() {
        return label;
    }

    public boolean isLexError() {
        return this == UNTERMINATED_STRING || this == UNTERMINATED_REGEX || this == INVALID_CHARACTER;
    }

    public boolean isKeyword() {
        return ordinal() >= AND.ordinal() && ordinal() <= FALSE.ordinal();
    }
}
