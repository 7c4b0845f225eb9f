package com.example.sqlsplitter.service.sql.dto;


import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class SqlStatementDto {

    private int index;         // vị trí trong toàn bộ script (sau khi bỏ statement rỗng)
    private String content;    // nội dung câu
    private int placeholders;  // số '?' trong câu
}
