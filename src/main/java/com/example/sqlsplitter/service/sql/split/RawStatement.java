package com.example.sqlsplitter.service.sql.split;

import lombok.Value;

/**
 * Statement chưa qua filter/trim. Offset tính trên {@link #text}; -1 nếu không có.
 */
@Value
public class RawStatement {
    String text;
    int placeholders;
    int terminatorStart;
    int terminatorEnd;           // exclusive
    int foldedTerminatorStart;   // ';' đứng trước '/' trong cặp ";\n/"

    public static RawStatement trailing(String text, int placeholders) {
        return new RawStatement(text, placeholders, -1, -1, -1);
    }

    public boolean hasTerminator() {
        return terminatorStart >= 0;
    }
}
