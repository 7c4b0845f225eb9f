package com.example.sqlsplitter.service.sql.split;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class StatementPostProcessorTest {

    private StatementPostProcessor postProcessor;

    @BeforeEach
    void setUp() {
        postProcessor = new StatementPostProcessor();
    }

    private static RawStatement terminated(String text, int placeholders) {
        int semi = text.lastIndexOf(';');
        return new RawStatement(text, placeholders, semi, semi + 1, -1);
    }

    @Test
    @DisplayName("statement rỗng: chỉ có whitespace, ';' hoặc '/'")
    void empty_detection() {
        assertThat(StatementPostProcessor.isEmpty("")).isTrue();
        assertThat(StatementPostProcessor.isEmpty(" ;\n/\t")).isTrue();
        assertThat(StatementPostProcessor.isEmpty("-- only a comment")).isFalse();
        assertThat(StatementPostProcessor.isEmpty("/* c */")).isFalse();
        assertThat(StatementPostProcessor.isEmpty("x;")).isFalse();
    }

    @Test
    @DisplayName("mặc định: bỏ rỗng, cắt terminator, trim")
    void defaults() {
        List<RawStatement> raw = List.of(
                terminated("  SELECT ? ;", 1),
                terminated("\n;", 0),
                RawStatement.trailing("  ", 0));

        SplitResult result = postProcessor.apply(raw, SplitOptions.defaults());

        assertThat(result.getStatements()).containsExactly("SELECT ?");
        assertThat(result.getPlaceholders()).containsExactly(1);
    }

    @Test
    @DisplayName("filter rỗng dùng text chưa trim, độc lập với các option khác")
    void empty_filter_is_independent() {
        List<RawStatement> raw = List.of(terminated("SELECT 1;", 0), RawStatement.trailing(" ", 0));

        SplitOptions keepEmpty = SplitOptions.builder().keepEmptyStatements(true).build();
        assertThat(postProcessor.apply(raw, keepEmpty).getStatements()).containsExactly("SELECT 1", "");

        SplitOptions keepAllButEmpty = SplitOptions.verbatim().toBuilder().keepEmptyStatements(false).build();
        assertThat(postProcessor.apply(raw, keepAllButEmpty).getStatements()).containsExactly("SELECT 1;");
    }

    @Test
    @DisplayName("cắt terminator trước rồi mới trim space")
    void terminator_then_whitespace() {
        List<RawStatement> raw = List.of(terminated(" SELECT 1 ;", 0));

        assertThat(postProcessor.apply(raw, SplitOptions.defaults()).getStatements())
                .containsExactly("SELECT 1");
        assertThat(postProcessor.apply(raw, SplitOptions.builder().keepExtraSpaces(true).build()).getStatements())
                .containsExactly(" SELECT 1 ");
        assertThat(postProcessor.apply(raw, SplitOptions.builder().keepTerminator(true).build()).getStatements())
                .containsExactly("SELECT 1 ;");
    }

    @Test
    @DisplayName("terminator có comment phía sau")
    void terminator_followed_by_comment() {
        RawStatement raw = new RawStatement("SELECT 1; -- one", 0, 8, 9, -1);
        assertThat(StatementPostProcessor.trimTerminator(raw)).isEqualTo("SELECT 1 -- one");
    }

    @Test
    @DisplayName("cặp ';' + '/'")
    void folded_pair() {
        String text = "END;\n/";
        RawStatement raw = new RawStatement(text, 0, 5, 6, 3);
        assertThat(StatementPostProcessor.trimTerminator(raw)).isEqualTo("END");

        String commented = "END; -- done\n/";
        RawStatement withComment = new RawStatement(commented, 0, commented.length() - 1, commented.length(), 3);
        assertThat(StatementPostProcessor.trimTerminator(withComment)).isEqualTo("END -- done\n");
    }

    @Test
    void statement_without_terminator_is_untouched() {
        assertThat(StatementPostProcessor.trimTerminator(RawStatement.trailing("SELECT 1", 0))).isEqualTo("SELECT 1");
    }

    @Test
    void dto_mapping_keeps_order() {
        SplitResult result = new SplitResult(List.of("a", "b"), List.of(0, 3));
        assertThat(result.toStatementDtos())
                .extracting("index", "content", "placeholders")
                .containsExactly(
                        tuple(0, "a", 0),
                        tuple(1, "b", 3));
    }
}
