package com.minilex.playground.lexer;

/**
 * A classified slice of the scanned source.
 *
 * @param kind   what the slice is
 * @param text   the exact characters of the source, empty for {@link TokenKind#END_OF_INPUT}
 * @param offset index of the first character in the source
 */
public record Token(TokenKind kind, String text, int offset) {

    public int end() {
        return offset + text.length();
    }

    public boolean isEndOfInput() {
        return kind == TokenKind.END_OF_INPUT;
    }

    @Override
    public String toString() {
        return String.format("Token(%s, '%s', offset=%d)", kind, text, offset);
    }
}
