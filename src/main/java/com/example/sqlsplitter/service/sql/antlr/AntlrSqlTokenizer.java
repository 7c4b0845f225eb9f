package com.example.sqlsplitter.service.sql.antlr;

import com.example.sqlsplitter.service.sql.antlr.implement.SqlTokenizerImpl;
import com.example.sqlsplitter.service.sql.token.SqlToken;
import com.example.sqlsplitter.service.sql.token.TokenKind;
import lombok.NonNull;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.Token;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class AntlrSqlTokenizer implements SqlTokenizerImpl {

    /* ===================== tokenize ===================== */

    @Override
    public List<SqlToken> tokenize(@NonNull String sql) {
        CharStream cs = CharStreams.fromString(sql);
        SqlTokenLexer lexer = new SqlTokenLexer(cs);
        lexer.removeErrorListeners();

        List<? extends Token> toks = lexer.getAllTokens();
        List<SqlToken> out = new ArrayList<>(toks.size());
        for (Token t : toks) {
            out.add(SqlToken.of(kindOf(t.getType()), t.getText()));
        }
        markBlockSeparators(out);
        return out;
    }

    /* ===================== utils ===================== */

    private static TokenKind kindOf(int type) {
        return switch (type) {
            case SqlTokenLexer.WHITESPACE -> TokenKind.WHITESPACE;
            case SqlTokenLexer.LINE_COMMENT -> TokenKind.LINE_COMMENT;
            case SqlTokenLexer.BLOCK_COMMENT -> TokenKind.BLOCK_COMMENT;
            case SqlTokenLexer.SINGLE_QUOTED, SqlTokenLexer.DOUBLE_QUOTED, SqlTokenLexer.BACKTICK_QUOTED -> TokenKind.QUOTED;
            case SqlTokenLexer.DOLLAR_QUOTED -> TokenKind.DOLLAR_QUOTED;
            case SqlTokenLexer.NUMBER -> TokenKind.NUMBER;
            case SqlTokenLexer.IDENTIFIER -> TokenKind.WORD;
            case SqlTokenLexer.PLACEHOLDER -> TokenKind.PLACEHOLDER;
            case SqlTokenLexer.SEMICOLON -> TokenKind.TERMINATOR;
            // SLASH: markBlockSeparators() quyết định sau
            case SqlTokenLexer.SLASH, SqlTokenLexer.OPERATOR, SqlTokenLexer.PUNCTUATION -> TokenKind.OPERATOR;
            default -> TokenKind.OTHER;
        };
    }

    /**
     * '/' chỉ là block separator khi đứng một mình trên dòng (kiểu SQL*Plus);
     * còn lại là phép chia.
     */
    private static void markBlockSeparators(List<SqlToken> toks) {
        for (int i = 0; i < toks.size(); i++) {
            SqlToken t = toks.get(i);
            if (t.getKind() != TokenKind.OPERATOR || !"/".equals(t.getText())) continue;

            boolean lineStart = i == 0 || endsLine(toks.get(i - 1));
            boolean lineEnd = i == toks.size() - 1 || startsNewLine(toks.get(i + 1));
            if (lineStart && lineEnd) {
                toks.set(i, SqlToken.of(TokenKind.BLOCK_SEPARATOR, t.getText()));
            }
        }
    }

    private static boolean endsLine(SqlToken prev) {
        if (!prev.isWhitespace()) return false;
        String s = prev.getText();
        int nl = Math.max(s.lastIndexOf('\n'), s.lastIndexOf('\r'));
        return nl >= 0; // sau newline chỉ còn space/tab vì cả token là whitespace
    }

    private static boolean startsNewLine(SqlToken next) {
        return next.isWhitespace() && next.containsNewline();
    }
}
