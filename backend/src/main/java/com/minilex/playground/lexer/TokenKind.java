package com.minilex.playground.lexer;

/**
 * Every distinct token of the grammar plus the two control kinds
 * {@link #INVALID} and {@link #END_OF_INPUT}.
 */
public enum TokenKind {
    INVALID("<Invalid>"),
    IDENTIFIER("<Identifier>"),

    // operators
    ASSIGN("="),
    MULTIPLY("*"),
    DIVIDE("/"),
    PLUS("+"),
    MINUS("-"),
    GREATER(">"),
    GREATER_EQUAL(">="),
    EQUAL("=="),
    LESSER_EQUAL("<="),
    LESSER("<"),

    // punctuation
    BRACE_OPEN("{"),
    BRACE_CLOSE("}"),
    PAREN_OPEN("("),
    PAREN_CLOSE(")"),
    COMMA(","),
    COLON(":"),
    SEMI_COLON(";"),

    // literals
    INTEGER_LITERAL("<Integer Literal>"),
    FLOAT_LITERAL("<Float Literal>"),
    STRING_LITERAL("<String Literal>"),

    // keywords
    INT("int", true),
    DOUBLE("double", true),
    STRING("string", true),
    FUNCTION("function", true),
    RETURN("return", true),
    IF("if", true),
    ELSE("else", true),
    FOR("for", true),
    CONTINUE("continue", true),
    BREAK("break", true),

    END_OF_INPUT("<End-Of-Input>");

    private final String display;
    private final boolean keyword;

    TokenKind(String display) {
        this(display, false);
    }

    TokenKind(String display, boolean keyword) {
        this.display = display;
        this.keyword = keyword;
    }

    /**
     * Canonical spelling for operators, punctuation and keywords, a bracketed
     * category name for everything else.
     */
    public String display() {
        return display;
    }

    public boolean isKeyword() {
        return keyword;
    }
}
