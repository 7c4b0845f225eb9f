package com.example.sqlsplitter.service.sql.split;

import com.example.sqlsplitter.service.sql.token.SqlToken;
import com.example.sqlsplitter.service.sql.token.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Duyệt token một lượt, cộng dồn text và quyết định terminator nào thật sự kết thúc statement.
 * <p>
 * Kết quả luôn có (số terminator được xác nhận + 1) phần tử; phần tử cuối là đoạn sau
 * terminator cuối cùng (có thể rỗng). Với comment được giữ, nối toàn bộ text sẽ ra đúng input.
 */
public class StatementBoundaryMachine {

    private static final Set<String> TRANSACTION_WORDS = Set.of(
            "WORK", "TRAN", "TRANSACTION", "ISOLATION", "READ",
            "DEFERRED", "IMMEDIATE", "EXCLUSIVE");

    private static final Set<String> CONTINUATION_WORDS = Set.of("IF", "LOOP", "CASE", "WHILE", "REPEAT");

    private static final Set<String> CREATE_MODIFIERS = Set.of("OR", "REPLACE", "EDITIONABLE", "NONEDITIONABLE");

    private static final Set<String> PACKAGE_HEADER_WORDS = Set.of(
            "OR", "REPLACE", "EDITIONABLE", "NONEDITIONABLE", "PACKAGE", "BODY");

    /* ===================== pass ===================== */

    public List<RawStatement> run(List<SqlToken> tokens, SplitOptions options) {
        List<RawStatement> out = new ArrayList<>();
        TokenCursor cursor = new TokenCursor(tokens);
        SplitState state = SplitState.initial();

        StringBuilder statement = new StringBuilder();
        int placeholders = 0;
        int folded = -1;

        while (cursor.hasNext()) {
            SqlToken token = cursor.next();
            int tokenStart = statement.length();
            append(statement, token, options);

            if (token.getKind() == TokenKind.PLACEHOLDER) placeholders++;
            state = transition(state, token, cursor);

            if (!isTerminatorCandidate(token)) continue;
            if (!isTerminator(token, cursor)) {
                // ';' ngay trước '/': cả cặp là một terminator, '/' mới đóng statement
                folded = tokenStart;
                continue;
            }
            if (!state.isAtTopLevel()) {
                folded = -1;
                continue;
            }

            int terminatorEnd = statement.length();
            for (int span = cursor.sameLineCommentSpan(); span > 0; span--) {
                append(statement, cursor.next(), options);
            }
            out.add(new RawStatement(statement.toString(), placeholders, tokenStart, terminatorEnd, folded));

            statement.setLength(0);
            placeholders = 0;
            folded = -1;
            state = state.toBuilder().inCreateOrAlter(false).caseDepth(0).build();
        }
        out.add(RawStatement.trailing(statement.toString(), placeholders));
        return out;
    }

    private static void append(StringBuilder statement, SqlToken token, SplitOptions options) {
        if (token.isComment() && !options.isKeepComments()) return;
        statement.append(token.getText());
    }

    /* ===================== transitions ===================== */

    /**
     * State sau khi đọc {@code token}; {@code cursor} đang đứng ngay sau token đó.
     * Whitespace và comment không làm đổi state.
     */
    static SplitState transition(SplitState state, SqlToken token, TokenCursor cursor) {
        if (!token.isSignificant()) return state;
        SplitState next = step(state, token, cursor);
        String word = token.getKind() == TokenKind.WORD ? token.upper() : null;
        return next.toBuilder().previousWord(word).build();
    }

    private static SplitState step(SplitState state, SqlToken token, TokenCursor cursor) {
        if (isBlockBegin(token, cursor)) {
            return state.toBuilder()
                    .blockDepth(state.getBlockDepth() + 1)
                    .inProceduralHeader(false)
                    .build();
        }
        if (token.isWord("CREATE") || token.isWord("ALTER")) {
            return onCreateOrAlter(state, token, cursor);
        }
        if (isProceduralHeaderStart(token, state)) {
            return state.toBuilder().inProceduralHeader(true).build();
        }
        if (token.isWord("END")) {
            return onEnd(state, cursor);
        }
        if (token.isWord("CASE") && !"END".equals(state.getPreviousWord())) {
            return state.toBuilder().caseDepth(state.getCaseDepth() + 1).build();
        }
        if (token.getKind() == TokenKind.DOLLAR_QUOTED && state.isInProceduralHeader()) {
            // body $$...$$ của routine: không có BEGIN nào để đóng header
            return state.toBuilder().inProceduralHeader(false).build();
        }
        return state;
    }

    private static boolean isBlockBegin(SqlToken token, TokenCursor cursor) {
        if (!token.isWord("BEGIN")) return false;
        Optional<SqlToken> next = cursor.peekSignificant();
        if (next.isEmpty()) return true;

        SqlToken n = next.get();
        if (n.getKind() == TokenKind.TERMINATOR) return false;
        return !(n.getKind() == TokenKind.WORD && TRANSACTION_WORDS.contains(n.upper()));
    }

    private static SplitState onCreateOrAlter(SplitState state, SqlToken token, TokenCursor cursor) {
        SplitState.SplitStateBuilder b = state.toBuilder().inCreateOrAlter(true);
        if (!token.isWord("CREATE")) return b.build();

        Optional<SqlToken> next = cursor.peekSignificant(CREATE_MODIFIERS);
        if (next.isPresent() && next.get().isWord("PACKAGE")) {
            String name = cursor.peekSignificant(PACKAGE_HEADER_WORDS)
                    .map(SqlToken::getText)
                    .orElse(null);
            b.inPackage(true).packageName(name);
        }
        return b.build();
    }

    private static boolean isProceduralHeaderStart(SqlToken token, SplitState state) {
        if (token.isWord("DECLARE")) return true;
        if (!token.isWord("FUNCTION") && !token.isWord("PROCEDURE")) return false;

        // EXECUTE FUNCTION f() trong CREATE TRIGGER, ALTER FUNCTION f COMPILE
        String prev = state.getPreviousWord();
        if ("EXECUTE".equals(prev) || "ALTER".equals(prev)) return false;

        return state.isInCreateOrAlter()
                || state.isInPackage()
                || state.isInProceduralHeader()
                || state.getBlockDepth() > 0;
    }

    private static SplitState onEnd(SplitState state, TokenCursor cursor) {
        Optional<SqlToken> next = cursor.peekSignificant();

        // END IF / END LOOP / END CASE ...: đóng câu lệnh điều khiển, không đóng block
        if (next.isPresent() && next.get().getKind() == TokenKind.WORD
                && CONTINUATION_WORDS.contains(next.get().upper())) {
            if (next.get().isWord("CASE") && state.getCaseDepth() > 0) {
                return state.toBuilder().caseDepth(state.getCaseDepth() - 1).build();
            }
            return state;
        }
        if (state.getCaseDepth() > 0) {
            return state.toBuilder().caseDepth(state.getCaseDepth() - 1).build();
        }

        SplitState.SplitStateBuilder b = state.toBuilder()
                .blockDepth(Math.max(0, state.getBlockDepth() - 1));
        if (state.isInPackage() && next.isPresent()
                && matchesPackage(state.getPackageName(), next.get().getText())) {
            b.inPackage(false).packageName(null).inProceduralHeader(false);
        }
        return b.build();
    }

    /** Khớp chính xác tên package, hoặc phần cuối của tên có schema (hr.emp_pkg ~ emp_pkg). */
    static boolean matchesPackage(String packageName, String candidate) {
        if (packageName == null) return false;
        if (packageName.equals(candidate)) return true;
        int dot = packageName.lastIndexOf('.');
        return dot >= 0 && packageName.substring(dot + 1).equals(candidate);
    }

    /* ===================== terminators ===================== */

    private static boolean isTerminatorCandidate(SqlToken token) {
        return token.getKind() == TokenKind.TERMINATOR || token.getKind() == TokenKind.BLOCK_SEPARATOR;
    }

    /** '/' luôn là terminator; ';' thì không, nếu token có nghĩa kế tiếp là '/'. */
    private static boolean isTerminator(SqlToken token, TokenCursor cursor) {
        if (token.getKind() == TokenKind.BLOCK_SEPARATOR) return true;
        return cursor.peekSignificant()
                .map(n -> n.getKind() != TokenKind.BLOCK_SEPARATOR)
                .orElse(true);
    }
}
