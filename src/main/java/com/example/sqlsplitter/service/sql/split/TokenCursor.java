package com.example.sqlsplitter.service.sql.split;

import com.example.sqlsplitter.service.sql.token.SqlToken;
import com.example.sqlsplitter.service.sql.token.TokenKind;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Con trỏ đọc tuần tự trên danh sách token. Các hàm peek chỉ đọc, không tiêu thụ token.
 */
public final class TokenCursor {
    private final List<SqlToken> tokens;
    private int position;

    public TokenCursor(List<SqlToken> tokens) {
        this.tokens = tokens;
    }

    public boolean hasNext() {
        return position < tokens.size();
    }

    public SqlToken next() {
        return tokens.get(position++);
    }

    public int position() {
        return position;
    }

    public Optional<SqlToken> peekSignificant() {
        return peekSignificant(Collections.emptySet());
    }

    /**
     * Token có nghĩa kế tiếp, bỏ qua whitespace/comment và các word nằm trong {@code skipWords}
     * (so sánh upper case).
     */
    public Optional<SqlToken> peekSignificant(Set<String> skipWords) {
        int i = indexOfSignificant(tokens, position, skipWords);
        return i < 0 ? Optional.empty() : Optional.of(tokens.get(i));
    }

    /**
     * Số token comment (kèm whitespace cùng dòng phía trước) bắt đầu trên cùng dòng với vị trí hiện tại.
     * 0 nếu không có.
     */
    public int sameLineCommentSpan() {
        int span = 0;
        for (int i = position; i < tokens.size(); i++) {
            SqlToken t = tokens.get(i);
            if (t.isComment()) {
                span = i - position + 1;
                if (t.getKind() == TokenKind.LINE_COMMENT || t.containsNewline()) break;
            } else if (!t.isWhitespace() || t.containsNewline()) {
                break;
            }
        }
        return span;
    }

    public static int indexOfSignificant(List<SqlToken> tokens, int from, Set<String> skipWords) {
        for (int i = from; i < tokens.size(); i++) {
            SqlToken t = tokens.get(i);
            if (!t.isSignificant()) continue;
            if (t.getKind() == TokenKind.WORD && skipWords.contains(t.upper())) continue;
            return i;
        }
        return -1;
    }
}
