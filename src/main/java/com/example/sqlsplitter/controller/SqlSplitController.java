package com.example.sqlsplitter.controller;

import com.example.sqlsplitter.config.ErrorConfig;
import com.example.sqlsplitter.config.SplitterConfig;
import com.example.sqlsplitter.dto.request.SplitRequest;
import com.example.sqlsplitter.dto.response.SplitResponse;
import com.example.sqlsplitter.exception.AppException;
import com.example.sqlsplitter.service.sql.split.SplitResult;
import com.example.sqlsplitter.service.sql.split.implement.SqlSplitServiceImpl;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class SqlSplitController {
    private final SqlSplitServiceImpl sqlSplitService;
    private final SplitterConfig splitterConfig;

    @PostMapping(value = "/split", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SplitResponse> onSplit(@RequestBody SplitRequest splitRequest, HttpServletRequest request) {
        String sql = splitRequest.getSql();
        if (isBlank(sql)) {
            throw new AppException(ErrorConfig.INVALID_REQUEST, "SQL is empty");
        }

        SplitResult result = sqlSplitService.splitWithPlaceholders(sql, splitRequest.toOptions(splitterConfig.defaultOptions()));
        log.info("Split script {} ký tự thành {} statement", sql.length(), result.size());

        return ResponseEntity.ok(SplitResponse.builder()
                .path(request.getRequestURI())
                .status(HttpStatus.OK.name())
                .count(result.size())
                .statements(result.toStatementDtos())
                .build());
    }

    @PostMapping(value = "/split/text", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<List<String>> onSplitText(@RequestBody(required = false) String sql) {
        if (isBlank(sql)) {
            throw new AppException(ErrorConfig.INVALID_REQUEST, "SQL is empty");
        }
        return ResponseEntity.ok(sqlSplitService.split(sql));
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
