package com.example.sqlsplitter.config;

import com.example.sqlsplitter.service.sql.split.SplitOptions;
import lombok.AccessLevel;
import lombok.Data;
import lombok.experimental.FieldDefaults;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
@Data
@FieldDefaults(level = AccessLevel.PRIVATE)
public class SplitterConfig {

    @Value("${splitter.keep-terminator:false}")
    boolean keepTerminator;

    @Value("${splitter.keep-extra-spaces:false}")
    boolean keepExtraSpaces;

    @Value("${splitter.keep-comments:false}")
    boolean keepComments;

    @Value("${splitter.keep-empty-statements:false}")
    boolean keepEmptyStatements;

    public SplitOptions defaultOptions() {
        return SplitOptions.builder()
                .keepTerminator(keepTerminator)
                .keepExtraSpaces(keepExtraSpaces)
                .keepComments(keepComments)
                .keepEmptyStatements(keepEmptyStatements)
                .build();
    }
}
