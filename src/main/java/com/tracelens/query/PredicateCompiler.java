package com.tracelens.query;

import com.tracelens.domain.FieldType;
import com.tracelens.domain.FilterField;
import com.tracelens.domain.FilterFields;
import com.tracelens.domain.QueryType;
import com.tracelens.domain.SpanFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Compiles a span filter tree into one boolean SQL expression.
 *
 * The tree is lowered depth-first. Each {@link FilterFields} list is joined with its
 * own connective; a field carrying a sub-filter is combined with the sub-filter result
 * using the field's connective. Column names come from {@link ColumnResolver} and values
 * from {@link ValueCoercer}; values are always bound as parameters.
 *
 * Stateless and safe for concurrent use.
 */
@Component
public class PredicateCompiler {

    private static final Logger logger = LoggerFactory.getLogger(PredicateCompiler.class);

    public static final int DEFAULT_MAX_DEPTH = 32;

    static final String MANUAL_FEEDBACK_TYPE = "manual_feedback";

    private final ColumnResolver columnResolver;
    private final ValueCoercer valueCoercer;
    private final int maxDepth;

    @Autowired
    public PredicateCompiler(
            ColumnResolver columnResolver,
            ValueCoercer valueCoercer,
            @Value("${tracelens.query.max-filter-depth:32}") int maxDepth) {
        this.columnResolver = columnResolver;
        this.valueCoercer = valueCoercer;
        this.maxDepth = maxDepth;
    }

    public PredicateCompiler(ColumnResolver columnResolver, ValueCoercer valueCoercer) {
        this(columnResolver, valueCoercer, DEFAULT_MAX_DEPTH);
    }

    /**
     * Compile a filter tree that contains no annotation fields
     */
    public SqlFragment compile(FilterFields filters) {
        return compile(filters, null);
    }

    /**
     * Compile a filter tree.
     *
     * @param filters the tree; null or empty means no restriction
     * @param scope annotation context for manual-feedback fields, may be null
     * @return the predicate, {@code 1 = 1} when nothing restricts the result
     * @throws InvalidQueryParameterException when any part of the tree is invalid
     */
    public SqlFragment compile(FilterFields filters, AnnotationScope scope) {
        SqlFragment predicate = compileFilters(filters, scope, 1).orElseGet(SqlFragment::alwaysTrue);
        logger.debug("Compiled span filter: {}", predicate.getSql());
        return predicate;
    }

    private Optional<SqlFragment> compileFilters(FilterFields filters, AnnotationScope scope, int depth) {
        if (filters == null) {
            return Optional.empty();
        }
        if (depth > maxDepth) {
            throw new InvalidQueryParameterException(
                "filter nesting exceeds the maximum depth of " + maxDepth);
        }
        List<SqlFragment> parts = new ArrayList<>(filters.getFilterFields().size());
        for (FilterField field : filters.getFilterFields()) {
            if (field == null) {
                continue;
            }
            compileField(field, scope, depth).ifPresent(parts::add);
        }
        if (parts.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(SqlFragment.join(parts, filters.getQueryAndOr()));
    }

    private Optional<SqlFragment> compileField(FilterField field, AnnotationScope scope, int depth) {
        List<SqlFragment> parts = new ArrayList<>(2);
        if (isAnnotationField(field.getFieldName())) {
            parts.add(compileAnnotation(field, scope));
        } else if (field.hasFieldName()) {
            parts.add(compileCondition(columnResolver.resolve(field), field));
        }
        if (field.getSubFilter() != null) {
            compileFilters(field.getSubFilter(), scope, depth + 1).ifPresent(parts::add);
        }
        if (parts.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(SqlFragment.join(parts, field.getQueryAndOr()));
    }

    /**
     * Render one operator against an already resolved column
     */
    SqlFragment compileCondition(String column, FilterField field) {
        QueryType queryType = field.getQueryType();
        if (queryType == null) {
            throw new InvalidQueryParameterException(
                "query type is required for filter field " + field.getFieldName());
        }
        checkArity(field, queryType);
        List<Object> values = valueCoercer.coerce(field);

        switch (queryType) {
            case MATCH:
                return SqlFragment.of(column + " LIKE ?", "%" + values.get(0) + "%");
            case NOT_MATCH:
                return SqlFragment.of(column + " NOT LIKE ?", "%" + values.get(0) + "%");
            case EQ:
                return SqlFragment.of(column + " = ?", values.get(0));
            case NOT_EQ:
                return SqlFragment.of(column + " != ?", values.get(0));
            case LT:
                return SqlFragment.of(column + " < ?", values.get(0));
            case LTE:
                return SqlFragment.of(column + " <= ?", values.get(0));
            case GT:
                return SqlFragment.of(column + " > ?", values.get(0));
            case GTE:
                return SqlFragment.of(column + " >= ?", values.get(0));
            case EXIST:
                return SqlFragment.of("(" + column + " IS NOT NULL AND " + column + " != ?)",
                    valueCoercer.zeroValue(field.getFieldType()));
            case NOT_EXIST:
                return SqlFragment.of("(" + column + " IS NULL OR " + column + " = ?)",
                    valueCoercer.zeroValue(field.getFieldType()));
            case IN:
                return SqlFragment.of(column + " IN (" + placeholders(values.size()) + ")", values);
            case NOT_IN:
                return SqlFragment.of(column + " NOT IN (" + placeholders(values.size()) + ")", values);
            case ALWAYS_TRUE:
                return SqlFragment.alwaysTrue();
            default:
                throw new InvalidQueryParameterException("query type " + queryType + " not supported");
        }
    }

    private void checkArity(FilterField field, QueryType queryType) {
        int count = field.getValues().size();
        switch (queryType.getArity()) {
            case SINGLE:
                if (count != 1) {
                    throw new InvalidQueryParameterException(
                        "filter field " + field.getFieldName() + " should have one value");
                }
                break;
            case AT_LEAST_ONE:
                if (count < 1) {
                    throw new InvalidQueryParameterException(
                        "filter field " + field.getFieldName() + " should have at least one value");
                }
                break;
            case NONE:
                if (count != 0) {
                    throw new InvalidQueryParameterException(
                        "filter field " + field.getFieldName() + " should have no values for " + queryType.getValue());
                }
                break;
            default:
                break;
        }
    }

    private static boolean isAnnotationField(String fieldName) {
        return fieldName.startsWith(SpanFields.MANUAL_FEEDBACK_PREFIX);
    }

    /**
     * manual_feedback_{tagKeyId} selects spans whose annotation with that key matches
     */
    private SqlFragment compileAnnotation(FilterField field, AnnotationScope scope) {
        String fieldName = field.getFieldName();
        String tagKeyId = fieldName.substring(SpanFields.MANUAL_FEEDBACK_PREFIX.length());
        if (tagKeyId.isEmpty()) {
            throw new InvalidQueryParameterException("invalid manual feedback field name " + fieldName);
        }
        if (scope == null || scope.getAnnotationTable() == null || scope.getAnnotationTable().isEmpty()) {
            throw new InvalidQueryParameterException(
                "no annotation table configured for filter field " + fieldName);
        }

        List<SqlFragment> conditions = new ArrayList<>();
        conditions.add(SqlFragment.of("annotation_type = ?", MANUAL_FEEDBACK_TYPE));
        conditions.add(SqlFragment.of("key = ?", tagKeyId));
        if (field.getQueryType() != null && field.getQueryType() != QueryType.EXIST) {
            conditions.add(compileCondition(annotationValueColumn(field.getFieldType()), field));
        }
        if (scope.getRootFilters() != null) {
            List<FilterField> spaceFilters = new ArrayList<>();
            scope.getRootFilters().traverse(f -> {
                if (SpanFields.SPACE_ID.equals(f.getFieldName())) {
                    spaceFilters.add(f);
                }
            });
            for (FilterField spaceFilter : spaceFilters) {
                conditions.add(compileCondition(columnResolver.resolve(spaceFilter), spaceFilter));
            }
        }
        conditions.add(SqlFragment.of("deleted_at = 0"));
        conditions.add(SqlFragment.of("start_time >= ?", scope.getStartTime()));
        conditions.add(SqlFragment.of("start_time <= ?", scope.getEndTime()));

        return SqlFragment.list(conditions, " AND ").wrap(
            "span_id IN (SELECT span_id FROM " + SqlLiterals.quoteTable(scope.getAnnotationTable()) + " WHERE ",
            " SETTINGS final = 1)");
    }

    private static String annotationValueColumn(FieldType type) {
        switch (FieldType.orDefault(type)) {
            case LONG:
                return "value_long";
            case DOUBLE:
                return "value_float";
            case BOOL:
                return "value_bool";
            default:
                return "value_string";
        }
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }
}
