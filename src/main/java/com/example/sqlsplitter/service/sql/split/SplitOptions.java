package com.example.sqlsplitter.service.sql.split;

import lombok.Builder;
import lombok.Value;

/**
 * Tuỳ chọn cho một lần split. Mặc định tất cả = false (bỏ terminator, trim space,
 * bỏ comment, bỏ statement rỗng).
 */
@Value
@Builder(toBuilder = true)
public class SplitOptions {
    boolean keepTerminator;
    boolean keepExtraSpaces;
    boolean keepComments;
    boolean keepEmptyStatements;

    public static SplitOptions defaults() {
        return SplitOptions.builder().build();
    }

    /** Giữ lại mọi thứ: nối các statement trả về sẽ ra đúng script gốc. */
    public static SplitOptions verbatim() {
        return SplitOptions.builder()
                .keepTerminator(true)
                .keepExtraSpaces(true)
                .keepComments(true)
                .keepEmptyStatements(true)
                .build();
    }
}
