package com.example.sqlsplitter.dto.response;

import com.example.sqlsplitter.service.sql.dto.SqlStatementDto;
import lombok.AccessLevel;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.experimental.FieldDefaults;
import lombok.experimental.SuperBuilder;

import java.util.List;

@EqualsAndHashCode(callSuper = true)
@Data
@SuperBuilder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class SplitResponse extends APIResponseDto {
    int count;
    List<SqlStatementDto> statements;
}
