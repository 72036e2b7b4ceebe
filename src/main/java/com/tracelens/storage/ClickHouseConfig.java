package com.tracelens.storage;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Configuration for the ClickHouse JDBC connection that span queries run on
 */
@Configuration
public class ClickHouseConfig {
    private static final Logger logger = LoggerFactory.getLogger(ClickHouseConfig.class);

    @Value("${tracelens.storage.clickhouse.url:jdbc:clickhouse://localhost:8123/observability}")
    private String url;

    @Value("${tracelens.storage.clickhouse.username:default}")
    private String username;

    @Value("${tracelens.storage.clickhouse.password:}")
    private String password;

    @Value("${tracelens.storage.clickhouse.pool.size:10}")
    private int poolSize;

    @Value("${tracelens.storage.clickhouse.max-execution-time-seconds:60}")
    private int maxExecutionTimeSeconds;

    /**
     * ClickHouse DataSource with connection pooling
     */
    @Bean(name = "clickHouseDataSource")
    public DataSource clickHouseDataSource() {
        try {
            HikariConfig config = new HikariConfig();
            config.setJdbcUrl(url);
            config.setUsername(username);
            config.setPassword(password);
            config.setDriverClassName("com.clickhouse.jdbc.ClickHouseDriver");
            config.setPoolName("tracelens-clickhouse");

            config.setMaximumPoolSize(poolSize);
            config.setMinimumIdle(2);
            config.setConnectionTimeout(30000);
            config.setIdleTimeout(600000);
            config.setMaxLifetime(1800000);
            // connections are opened on demand, startup does not wait for the store
            config.setInitializationFailTimeout(-1);

            // socket timeout stays above the server-side execution limit
            config.addDataSourceProperty("socket_timeout", String.valueOf((maxExecutionTimeSeconds + 5) * 1000));
            config.addDataSourceProperty("compress", "true");
            config.addDataSourceProperty("max_execution_time", String.valueOf(maxExecutionTimeSeconds));

            HikariDataSource dataSource = new HikariDataSource(config);

            logger.info("ClickHouse DataSource initialized: {}", url);
            return dataSource;

        } catch (Exception e) {
            logger.error("Failed to initialize ClickHouse DataSource", e);
            throw new IllegalStateException("ClickHouse DataSource initialization failed", e);
        }
    }

    @Bean(name = "clickHouseJdbcTemplate")
    public JdbcTemplate clickHouseJdbcTemplate(@Qualifier("clickHouseDataSource") DataSource clickHouseDataSource) {
        return new JdbcTemplate(clickHouseDataSource);
    }
}
