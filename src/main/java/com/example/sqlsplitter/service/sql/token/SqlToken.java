package com.example.sqlsplitter.service.sql.token;

import lombok.NonNull;
import lombok.Value;

import java.util.Locale;

/**
 * Một token của script SQL: text giữ nguyên từng ký tự của input, kind do tokenizer gán.
 */
@Value
public class SqlToken {
    @NonNull TokenKind kind;
    @NonNull String text;

    public static SqlToken of(TokenKind kind, String text) {
        return new SqlToken(kind, text);
    }

    public boolean isWhitespace() {
        return kind == TokenKind.WHITESPACE;
    }

    public boolean isComment() {
        return kind.isComment();
    }

    /** Không phải whitespace, không phải comment. */
    public boolean isSignificant() {
        return !isWhitespace() && !isComment();
    }

    public boolean isWord(String word) {
        return kind == TokenKind.WORD && text.equalsIgnoreCase(word);
    }

    public String upper() {
        return text.toUpperCase(Locale.ROOT);
    }

    public boolean containsNewline() {
        return text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0;
    }
}
