package com.example.sqlsplitter.dto.request;

import com.example.sqlsplitter.service.sql.split.SplitOptions;
import lombok.AccessLevel;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.experimental.SuperBuilder;

@EqualsAndHashCode(callSuper = true)
@Data
@SuperBuilder
@NoArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class SplitRequest extends APIRequestDto {
    String sql;

    // null -> lấy theo cấu hình splitter.*
    Boolean keepTerminator;
    Boolean keepExtraSpaces;
    Boolean keepComments;
    Boolean keepEmptyStatements;

    public SplitOptions toOptions(SplitOptions defaults) {
        return defaults.toBuilder()
                .keepTerminator(keepTerminator == null ? defaults.isKeepTerminator() : keepTerminator)
                .keepExtraSpaces(keepExtraSpaces == null ? defaults.isKeepExtraSpaces() : keepExtraSpaces)
                .keepComments(keepComments == null ? defaults.isKeepComments() : keepComments)
                .keepEmptyStatements(keepEmptyStatements == null ? defaults.isKeepEmptyStatements() : keepEmptyStatements)
                .build();
    }
}
