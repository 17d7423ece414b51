package com.licensenorm.parse;

public record LexToken(TokenType type, String value, int position) {
}

enum TokenType {
    WORD,
    LICENSE_REF,
    DOCUMENT_REF,
    AND,
    OR,
    WITH,
    PLUS,
    LPAREN,
    RPAREN,
    EOF
}
