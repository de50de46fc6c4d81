package com.minilex.playground.dto;

import com.minilex.playground.lexer.Token;

public record ScannedToken(
    String kind,
    String display,
    String text,
    int start,
    int end
) {

    public static ScannedToken from(Token token) {
        return new ScannedToken(
                token.kind().name(),
                token.kind().display(),
                token.text(),
                token.offset(),
                token.end());
    }
}
