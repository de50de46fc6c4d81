package com.minilex.playground.lexer;

import java.util.Map;

/**
 * Single-pass scanner over an in-memory source. Each call to {@link #next()}
 * skips whitespace and {@code //} comments and returns the next token; once the
 * source is exhausted every further call returns {@link TokenKind#END_OF_INPUT}.
 * <p>
 * Unrecognised input never raises an error, it comes back as an
 * {@link TokenKind#INVALID} token holding the offending text.
 * <p>
 * Instances are not thread safe.
 */
public class Scanner {

    private static final Map<String, TokenKind> KEYWORDS = Map.of(
            "int", TokenKind.INT,
            "double", TokenKind.DOUBLE,
            "string", TokenKind.STRING,
            "function", TokenKind.FUNCTION,
            "return", TokenKind.RETURN,
            "if", TokenKind.IF,
            "else", TokenKind.ELSE,
            "for", TokenKind.FOR,
            "continue", TokenKind.CONTINUE,
            "break", TokenKind.BREAK);

    // characters allowed after a backslash inside a string literal
    private static final String ESCAPES = "\"\\ntr0";

    private static final char NONE = '\0';

    private final String source;
    private final int length;

    // current read position
    private int pos;

    // first character of the token being scanned
    private int start;

    public Scanner(String source) {
        this.source = source;
        this.length = source.length();
    }

    public Token next() {
        if (length == 0) {
            return endOfInput();
        }

        while (pos < length) {
            char ch = source.charAt(pos);
            char next = pos + 1 < length ? source.charAt(pos + 1) : NONE;

            start = pos++;

            if (ch == ' ' || ch == '\t' || ch == '\r' || ch == '\n') {
                continue;
            }

            if (ch == '/' && next == '/') {
                // the newline itself is skipped as whitespace on the next round
                while (pos < length && source.charAt(pos) != '\n') {
                    pos++;
                }
                continue;
            }

            if (isAlpha(ch)) {
                return identifier();
            }

            if (isDigit(ch)) {
                return number();
            }

            if (ch == '"') {
                return string();
            }

            TokenKind kind;
            switch (ch) {
                case '=':
                    kind = next == '=' ? TokenKind.EQUAL : TokenKind.ASSIGN;
                    break;
                case '>':
                    kind = next == '=' ? TokenKind.GREATER_EQUAL : TokenKind.GREATER;
                    break;
                case '<':
                    kind = next == '=' ? TokenKind.LESSER_EQUAL : TokenKind.LESSER;
                    break;
                case '*':
                    kind = TokenKind.MULTIPLY;
                    break;
                case '/':
                    kind = TokenKind.DIVIDE;
                    break;
                case '+':
                    kind = TokenKind.PLUS;
                    break;
                case '-':
                    kind = TokenKind.MINUS;
                    break;
                case '{':
                    kind = TokenKind.BRACE_OPEN;
                    break;
                case '}':
                    kind = TokenKind.BRACE_CLOSE;
                    break;
                case '(':
                    kind = TokenKind.PAREN_OPEN;
                    break;
                case ')':
                    kind = TokenKind.PAREN_CLOSE;
                    break;
                case ',':
                    kind = TokenKind.COMMA;
                    break;
                case ':':
                    kind = TokenKind.COLON;
                    break;
                case ';':
                    kind = TokenKind.SEMI_COLON;
                    break;
                default:
                    kind = TokenKind.INVALID;
                    break;
            }

            if (kind == TokenKind.EQUAL || kind == TokenKind.GREATER_EQUAL || kind == TokenKind.LESSER_EQUAL) {
                pos++;
            }
            return token(kind);
        }

        return endOfInput();
    }

    /**
     * Scans an identifier and resolves it against the keyword table.
     */
    private Token identifier() {
        while (pos < length && isAlphaNumeric(source.charAt(pos))) {
            pos++;
        }
        String lexeme = source.substring(start, pos);
        return new Token(KEYWORDS.getOrDefault(lexeme, TokenKind.IDENTIFIER), lexeme, start);
    }

    /**
     * Scans a digit run, optionally followed by a fraction. The dot is only
     * taken when a digit follows it, so {@code 1.} stays an integer.
     */
    private Token number() {
        skipDigits();

        if (pos + 1 < length && source.charAt(pos) == '.' && isDigit(source.charAt(pos + 1))) {
            pos++;
            skipDigits();
            return token(TokenKind.FLOAT_LITERAL);
        }

        return token(TokenKind.INTEGER_LITERAL);
    }

    /**
     * Scans a double-quoted literal. The token keeps the raw text including
     * quotes and escapes. An unknown escape or a missing closing quote turns
     * the literal into an invalid token; a raw newline is never consumed.
     */
    private Token string() {
        boolean malformed = false;

        while (pos < length) {
            char ch = source.charAt(pos);

            if (ch == '"') {
                pos++;
                return token(malformed ? TokenKind.INVALID : TokenKind.STRING_LITERAL);
            }

            if (ch == '\n') {
                break;
            }

            if (ch == '\\') {
                pos++;
                if (pos >= length || source.charAt(pos) == '\n') {
                    break;
                }
                if (ESCAPES.indexOf(source.charAt(pos)) < 0) {
                    malformed = true;
                }
            }

            pos++;
        }

        // unterminated
        return token(TokenKind.INVALID);
    }

    private void skipDigits() {
        while (pos < length && isDigit(source.charAt(pos))) {
            pos++;
        }
    }

    private Token token(TokenKind kind) {
        return new Token(kind, source.substring(start, pos), start);
    }

    private Token endOfInput() {
        return new Token(TokenKind.END_OF_INPUT, "", length);
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
