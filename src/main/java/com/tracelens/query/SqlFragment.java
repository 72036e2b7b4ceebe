package com.tracelens.query;

import com.tracelens.domain.QueryAndOr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A piece of SQL text with {@code ?} placeholders and the values bound to them, in order.
 *
 * Only identifiers that passed validation are written into the text; every literal
 * value travels as an argument.
 */
public final class SqlFragment {

    private static final String ALWAYS_TRUE_SQL = "1 = 1";

    private final String sql;
    private final List<Object> args;

    private SqlFragment(String sql, List<Object> args) {
        this.sql = sql;
        this.args = Collections.unmodifiableList(args);
    }

    public static SqlFragment of(String sql, Object... args) {
        return new SqlFragment(sql, new ArrayList<>(Arrays.asList(args)));
    }

    public static SqlFragment of(String sql, List<?> args) {
        return new SqlFragment(sql, new ArrayList<>(args));
    }

    public static SqlFragment alwaysTrue() {
        return new SqlFragment(ALWAYS_TRUE_SQL, new ArrayList<>());
    }

    /**
     * Join fragments with one connective. A single fragment is returned as is,
     * several are wrapped in parentheses.
     */
    public static SqlFragment join(List<SqlFragment> parts, QueryAndOr op) {
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("nothing to join");
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return list(parts, " " + QueryAndOr.orDefault(op).getKeyword() + " ").wrap("(", ")");
    }

    /**
     * Concatenate fragments with a separator, without parentheses
     */
    public static SqlFragment list(List<SqlFragment> parts, String separator) {
        StringBuilder sb = new StringBuilder();
        List<Object> joinedArgs = new ArrayList<>();
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) {
                sb.append(separator);
            }
            sb.append(parts.get(i).sql);
            joinedArgs.addAll(parts.get(i).args);
        }
        return new SqlFragment(sb.toString(), joinedArgs);
    }

    public SqlFragment wrap(String prefix, String suffix) {
        return new SqlFragment(prefix + sql + suffix, new ArrayList<>(args));
    }

    public String getSql() {
        return sql;
    }

    public List<Object> getArgs() {
        return args;
    }

    public boolean isAlwaysTrue() {
        return ALWAYS_TRUE_SQL.equals(sql) && args.isEmpty();
    }

    /**
     * SQL text with every placeholder replaced by its rendered literal.
     * Meant for logs and diagnostics; execution uses {@link #getSql()} with {@link #getArgs()}.
     */
    public String render() {
        StringBuilder sb = new StringBuilder(sql.length() + args.size() * 8);
        int next = 0;
        boolean quoted = false;
        for (char c : sql.toCharArray()) {
            if (c == '\'') {
                quoted = !quoted;
            }
            if (c == '?' && !quoted) {
                if (next >= args.size()) {
                    throw new IllegalStateException("more placeholders than arguments in: " + sql);
                }
                sb.append(SqlLiterals.render(args.get(next++)));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SqlFragment)) {
            return false;
        }
        SqlFragment that = (SqlFragment) o;
        return sql.equals(that.sql) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sql, args);
    }

    @Override
    public String toString() {
        return render();
    }
}
