package com.example.sqlsplitter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SqlSplitterApplication {

    public static void main(String[] args) {
        SpringApplication.run(SqlSplitterApplication.class, args);
    }

}
