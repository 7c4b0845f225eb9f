package com.example.sqlsplitter.config;

public final class ErrorConfig {
    private ErrorConfig() {}
    public static final String INTERNAL_SERVER_ERROR = "INTERNAL_SERVER_ERROR";
    public static final String INVALID_REQUEST = "INVALID_REQUEST";
}
