package com.example.sqlsplitter.service.sql.split.implement;

import com.example.sqlsplitter.service.sql.split.SplitOptions;
import com.example.sqlsplitter.service.sql.split.SplitResult;

import java.util.List;

public interface SqlSplitServiceImpl {
    /** Split với option mặc định lấy từ cấu hình. */
    List<String> split(String sql);

    /** Tách script thành các statement nguyên tử, đúng thứ tự trong script. */
    List<String> split(String sql, SplitOptions options);

    SplitResult splitWithPlaceholders(String sql);

    /** Như {@link #split(String, SplitOptions)}, kèm số placeholder '?' của từng statement. */
    SplitResult splitWithPlaceholders(String sql, SplitOptions options);
}
