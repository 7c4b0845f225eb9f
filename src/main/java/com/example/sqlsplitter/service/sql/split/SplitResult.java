package com.example.sqlsplitter.service.sql.split;

import com.example.sqlsplitter.service.sql.dto.SqlStatementDto;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Dạng mở rộng của kết quả split: statements và số placeholder '?' tương ứng, cùng thứ tự.
 */
@Value
public class SplitResult {
    List<String> statements;
    List<Integer> placeholders;

    public int size() {
        return statements.size();
    }

    public List<SqlStatementDto> toStatementDtos() {
        List<SqlStatementDto> out = new ArrayList<>(statements.size());
        for (int i = 0; i < statements.size(); i++) {
            out.add(SqlStatementDto.builder()
                    .index(i)
                    .content(statements.get(i))
                    .placeholders(placeholders.get(i))
                    .build());
        }
        return out;
    }
}
