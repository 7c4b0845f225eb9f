package com.example.sqlsplitter.service.sql.antlr.implement;

import com.example.sqlsplitter.service.sql.token.SqlToken;

import java.util.List;

public interface SqlTokenizerImpl {

    /**
     * Tách script thành token theo thứ tự xuất hiện; KHÔNG bỏ ký tự nào.
     * Nối text của toàn bộ token phải ra đúng chuỗi input.
     */
    List<SqlToken> tokenize(String sql);
}
