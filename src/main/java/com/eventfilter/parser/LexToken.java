package com.eventfilter.parser;

public record LexToken(TokenType type, String value, int position) {
}

enum TokenType {
    IDENT,
    QUOTED_IDENT,
    STRING,
    NUMBER,
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    COMMA,
    DOT,
    STAR,
    MINUS,
    EQ,
    NOT_EQ,
    LT,
    GT,
    LT_EQ,
    GT_EQ,
    REGEX,
    IREGEX,
    NOT_REGEX,
    NOT_IREGEX,
    AND,
    OR,
    NOT,
    LIKE,
    ILIKE,
    IN,
    COHORT,
    SELECT,
    FROM,
    WHERE,
    GROUP,
    BY,
    HAVING,
    ORDER,
    ASC,
    DESC,
    LIMIT,
    AS,
    TRUE,
    FALSE,
    NULL,
    EOF
}
