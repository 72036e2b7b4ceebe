package com.tracelens.query;

import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;
import java.util.Map;

/**
 * A compiled query ready for the column store.
 *
 * Holds the SQL text with placeholders and its bound arguments. {@link #toDebugSql()}
 * inlines the arguments so callers can log exactly what runs.
 */
public class SpanQuery {

    private final SqlFragment statement;
    private final List<String> tables;

    public SpanQuery(SqlFragment statement, List<String> tables) {
        this.statement = statement;
        this.tables = tables;
    }

    public String getSql() {
        return statement.getSql();
    }

    public List<Object> getArgs() {
        return statement.getArgs();
    }

    public List<String> getTables() {
        return tables;
    }

    public String toDebugSql() {
        return statement.render();
    }

    public <T> List<T> query(JdbcOperations jdbc, RowMapper<T> rowMapper) {
        return jdbc.query(getSql(), rowMapper, getArgs().toArray());
    }

    public List<Map<String, Object>> queryForList(JdbcOperations jdbc) {
        return jdbc.queryForList(getSql(), getArgs().toArray());
    }

    @Override
    public String toString() {
        return toDebugSql();
    }
}
