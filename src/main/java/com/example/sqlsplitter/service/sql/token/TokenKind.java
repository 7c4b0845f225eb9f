package com.example.sqlsplitter.service.sql.token;

public enum TokenKind {
    WHITESPACE,
    LINE_COMMENT,
    BLOCK_COMMENT,
    WORD,           // identifier / keyword, schema.object kept together
    QUOTED,         // '..' "..." `..`
    DOLLAR_QUOTED,  // $$..$$
    NUMBER,
    PLACEHOLDER,    // ?
    TERMINATOR,     // ;
    BLOCK_SEPARATOR, // '/' alone on its line
    OPERATOR,
    OTHER;

    public boolean isComment() {
        return this == LINE_COMMENT || this == BLOCK_COMMENT;
    }
}
