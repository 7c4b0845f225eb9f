package com.example.sqlsplitter.service.sql.split;

import com.example.sqlsplitter.config.SplitterConfig;
import com.example.sqlsplitter.service.sql.antlr.implement.SqlTokenizerImpl;
import com.example.sqlsplitter.service.sql.split.implement.SqlSplitServiceImpl;
import com.example.sqlsplitter.service.sql.token.SqlToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * SqlSplitService
 * - Luồng: tokenizer (ANTLR) -> StatementBoundaryMachine -> StatementPostProcessor.
 * - Không giữ state giữa các lần gọi; dùng song song an toàn.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SqlSplitService implements SqlSplitServiceImpl {

    private final SqlTokenizerImpl tokenizer;
    private final SplitterConfig splitterConfig;
    private final StatementBoundaryMachine machine = new StatementBoundaryMachine();
    private final StatementPostProcessor postProcessor = new StatementPostProcessor();

    @Override
    public List<String> split(String sql) {
        return split(sql, null);
    }

    @Override
    public List<String> split(String sql, SplitOptions options) {
        return splitWithPlaceholders(sql, options).getStatements();
    }

    @Override
    public SplitResult splitWithPlaceholders(String sql) {
        return splitWithPlaceholders(sql, null);
    }

    @Override
    public SplitResult splitWithPlaceholders(String sql, SplitOptions options) {
        options = options == null ? splitterConfig.defaultOptions() : options;

        List<SqlToken> tokens = tokenizer.tokenize(sql);
        List<RawStatement> raw = machine.run(tokens, options);
        SplitResult result = postProcessor.apply(raw, options);

        log.debug("Split {} token -> {} statement ({} trước khi filter)", tokens.size(), result.size(), raw.size());
        return result;
    }
}
