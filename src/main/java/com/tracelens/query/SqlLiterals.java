package com.tracelens.query;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Identifier validation and literal rendering for ClickHouse SQL text.
 */
public final class SqlLiterals {

    /**
     * Names interpolated into SQL text (tag keys, aliases, columns) must match this
     */
    public static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    /**
     * Table names may be qualified by a database
     */
    public static final Pattern TABLE_NAME =
        Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?$");

    private SqlLiterals() {
    }

    public static boolean isSafeIdentifier(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    public static String requireIdentifier(String name, String what) {
        if (!isSafeIdentifier(name)) {
            throw new InvalidQueryParameterException(what + " " + name + " is not safe");
        }
        return name;
    }

    /**
     * Back-quote an identifier; dots separate qualified parts
     */
    public static String quoteIdentifier(String name) {
        StringBuilder sb = new StringBuilder(name.length() + 2);
        sb.append('`');
        for (char c : name.toCharArray()) {
            switch (c) {
                case '`':
                    sb.append("``");
                    break;
                case '.':
                    sb.append("`.`");
                    break;
                default:
                    sb.append(c);
            }
        }
        sb.append('`');
        return sb.toString();
    }

    public static String quoteTable(String table) {
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new InvalidQueryParameterException("table name " + table + " is not safe");
        }
        return quoteIdentifier(table);
    }

    /**
     * Render a bound value as an inline literal.
     * Strings are single-quoted with quotes and backslashes doubled; numbers are bare.
     */
    public static String render(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof Double || value instanceof Float) {
            return BigDecimal.valueOf(((Number) value).doubleValue()).stripTrailingZeros().toPlainString();
        }
        if (value instanceof Number) {
            return value.toString();
        }
        String text = value.toString();
        StringBuilder sb = new StringBuilder(text.length() + 2);
        sb.append('\'');
        for (char c : text.toCharArray()) {
            if (c == '\'') {
                sb.append("''");
            } else if (c == '\\') {
                sb.append("\\\\");
            } else {
                sb.append(c);
            }
        }
        sb.append('\'');
        return sb.toString();
    }
}
