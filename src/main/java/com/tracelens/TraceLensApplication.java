package com.tracelens;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the TraceLens span query engine.
 *
 * TraceLens compiles structured span filters and metric requests into ClickHouse SQL
 * over TTL-tiered span tables and runs them through a pooled JDBC connection.
 */
@SpringBootApplication
public class TraceLensApplication {

    public static void main(String[] args) {
        SpringApplication.run(TraceLensApplication.class, args);
    }
}
