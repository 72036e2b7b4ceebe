package com.tracelens.query;

import com.tracelens.domain.FieldType;
import com.tracelens.domain.FilterField;
import com.tracelens.domain.FilterFields;
import com.tracelens.domain.QueryAndOr;
import com.tracelens.domain.QueryType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for PredicateCompiler
 */
class PredicateCompilerTest {

    private PredicateCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new PredicateCompiler(new ColumnResolver(), new ValueCoercer());
    }

    private static FilterField custom(String name, FieldType type, QueryType queryType, String... values) {
        return FilterField.builder()
            .fieldName(name)
            .fieldType(type)
            .custom(true)
            .queryType(queryType)
            .values(values)
            .build();
    }

    private static FilterField field(String name, FieldType type, QueryType queryType, String... values) {
        return FilterField.builder()
            .fieldName(name)
            .fieldType(type)
            .queryType(queryType)
            .values(values)
            .build();
    }

    @Test
    void testSuperFieldBypassesTagMaps() {
        // Given: a range filter on the duration super field
        FilterFields filters = FilterFields.and(field("duration", FieldType.LONG, QueryType.GTE, "121"));

        // When: compiling
        SqlFragment predicate = compiler.compile(filters);

        // Then: the fixed column is used and the value is bound as a long
        assertThat(predicate.getSql()).isEqualTo("`duration` >= ?");
        assertThat(predicate.getArgs()).containsExactly(121L);
        assertThat(predicate.render()).isEqualTo("`duration` >= 121");
    }

    @Test
    void testAndListJoinsEveryElementWithAnd() {
        FilterFields filters = FilterFields.and(
            custom("a", FieldType.STRING, QueryType.EQ, "va"),
            custom("b", FieldType.STRING, QueryType.EQ, "vb"));

        assertThat(compiler.compile(filters).render())
            .isEqualTo("(tags_string['a'] = 'va' AND tags_string['b'] = 'vb')");
    }

    @Test
    void testOrListJoinsEveryElementWithOr() {
        FilterFields filters = FilterFields.or(
            custom("a", FieldType.STRING, QueryType.EQ, "va"),
            custom("b", FieldType.STRING, QueryType.EQ, "vb"));

        assertThat(compiler.compile(filters).render())
            .isEqualTo("(tags_string['a'] = 'va' OR tags_string['b'] = 'vb')");
    }

    @Test
    void testMissingConnectiveDefaultsToAnd() {
        FilterFields filters = new FilterFields(null, List.of(
            custom("a", FieldType.STRING, QueryType.EQ, "va"),
            custom("b", FieldType.STRING, QueryType.EQ, "vb")));

        assertThat(compiler.compile(filters).getSql())
            .isEqualTo("(tags_string['a'] = ? AND tags_string['b'] = ?)");
    }

    @Test
    void testExistOnBoolComparesAgainstZero() {
        FilterFields exist = FilterFields.and(custom("flag", FieldType.BOOL, QueryType.EXIST));
        FilterFields notExist = FilterFields.and(custom("flag", FieldType.BOOL, QueryType.NOT_EXIST));

        assertThat(compiler.compile(exist).render())
            .isEqualTo("(tags_bool['flag'] IS NOT NULL AND tags_bool['flag'] != 0)");
        assertThat(compiler.compile(notExist).render())
            .isEqualTo("(tags_bool['flag'] IS NULL OR tags_bool['flag'] = 0)");
    }

    @Test
    void testNotExistUsesPerTypeZeroValue() {
        FilterFields filters = FilterFields.and(
            custom("s", FieldType.STRING, QueryType.NOT_EXIST),
            custom("d", FieldType.DOUBLE, QueryType.NOT_EXIST),
            custom("l", FieldType.LONG, QueryType.NOT_EXIST));

        assertThat(compiler.compile(filters).render()).isEqualTo(
            "((tags_string['s'] IS NULL OR tags_string['s'] = '')"
                + " AND (tags_float['d'] IS NULL OR tags_float['d'] = 0)"
                + " AND (tags_long['l'] IS NULL OR tags_long['l'] = 0))");
    }

    @Test
    void testMatchOperatorsWrapValueInWildcards() {
        SqlFragment match = compiler.compile(FilterFields.and(field("input", FieldType.STRING, QueryType.MATCH, "123")));
        SqlFragment notMatch = compiler.compile(FilterFields.and(field("input", FieldType.STRING, QueryType.NOT_MATCH, "123")));

        assertThat(match.getArgs()).containsExactly("%123%");
        assertThat(match.render()).isEqualTo("`input` LIKE '%123%'");
        assertThat(notMatch.render()).isEqualTo("`input` NOT LIKE '%123%'");
    }

    @Test
    void testComparisonOperators() {
        assertThat(compiler.compile(FilterFields.and(custom("n", FieldType.LONG, QueryType.LT, "5"))).render())
            .isEqualTo("tags_long['n'] < 5");
        assertThat(compiler.compile(FilterFields.and(custom("n", FieldType.LONG, QueryType.LTE, "5"))).render())
            .isEqualTo("tags_long['n'] <= 5");
        assertThat(compiler.compile(FilterFields.and(custom("n", FieldType.LONG, QueryType.GT, "5"))).render())
            .isEqualTo("tags_long['n'] > 5");
        assertThat(compiler.compile(FilterFields.and(custom("n", FieldType.DOUBLE, QueryType.NOT_EQ, "1.5"))).render())
            .isEqualTo("tags_float['n'] != 1.5");
    }

    @Test
    void testInAndNotInBindEveryValue() {
        SqlFragment in = compiler.compile(FilterFields.and(custom("n", FieldType.LONG, QueryType.IN, "123", "-123")));
        SqlFragment notIn = compiler.compile(FilterFields.and(custom("c", FieldType.STRING, QueryType.NOT_IN, "c")));

        assertThat(in.getSql()).isEqualTo("tags_long['n'] IN (?, ?)");
        assertThat(in.getArgs()).containsExactly(123L, -123L);
        assertThat(in.render()).isEqualTo("tags_long['n'] IN (123, -123)");
        assertThat(notIn.render()).isEqualTo("tags_string['c'] NOT IN ('c')");
    }

    @Test
    void testBoolEqualityCompilesToInteger() {
        SqlFragment predicate = compiler.compile(FilterFields.and(custom("flag", FieldType.BOOL, QueryType.EQ, "true")));

        assertThat(predicate.render()).isEqualTo("tags_bool['flag'] = 1");
    }

    @Test
    void testAlwaysTrue() {
        SqlFragment predicate = compiler.compile(FilterFields.and(custom("any", FieldType.STRING, QueryType.ALWAYS_TRUE)));

        assertThat(predicate.getSql()).isEqualTo("1 = 1");
        assertThat(predicate.isAlwaysTrue()).isTrue();
    }

    @Test
    void testNullOrEmptyFilterMeansNoRestriction() {
        assertThat(compiler.compile(null).isAlwaysTrue()).isTrue();
        assertThat(compiler.compile(new FilterFields(QueryAndOr.AND, List.of())).isAlwaysTrue()).isTrue();
    }

    @Test
    void testNullElementsAreSkipped() {
        FilterFields filters = new FilterFields(QueryAndOr.AND, java.util.Arrays.asList(
            null, custom("a", FieldType.STRING, QueryType.EQ, "va")));

        assertThat(compiler.compile(filters).render()).isEqualTo("tags_string['a'] = 'va'");
    }

    @Test
    void testNestedSubFilterMixesConnectives() {
        // a = '1' AND (aa = 'x' OR bb = 'y'), then AND status_code = 200
        FilterField withSub = FilterField.builder()
            .fieldName("a")
            .fieldType(FieldType.STRING)
            .custom(true)
            .queryType(QueryType.EQ)
            .values("1")
            .subFilter(FilterFields.or(
                custom("aa", FieldType.STRING, QueryType.EQ, "x"),
                custom("bb", FieldType.STRING, QueryType.EQ, "y")))
            .build();
        FilterFields filters = FilterFields.and(withSub, field("status_code", FieldType.LONG, QueryType.EQ, "200"));

        assertThat(compiler.compile(filters).render()).isEqualTo(
            "((tags_string['a'] = '1' AND (tags_string['aa'] = 'x' OR tags_string['bb'] = 'y'))"
                + " AND `status_code` = 200)");
    }

    @Test
    void testFieldConnectiveCombinesConditionWithSubFilter() {
        FilterField withSub = FilterField.builder()
            .fieldName("input")
            .fieldType(FieldType.STRING)
            .queryType(QueryType.MATCH)
            .values("err")
            .queryAndOr(QueryAndOr.OR)
            .subFilter(FilterFields.and(field("status_code", FieldType.LONG, QueryType.EQ, "500")))
            .build();

        assertThat(compiler.compile(FilterFields.and(withSub)).render())
            .isEqualTo("(`input` LIKE '%err%' OR `status_code` = 500)");
    }

    @Test
    void testNamelessFieldCompilesToItsSubFilter() {
        FilterField holder = FilterField.builder()
            .subFilter(FilterFields.or(
                custom("a", FieldType.STRING, QueryType.EQ, "x"),
                custom("b", FieldType.STRING, QueryType.EQ, "y")))
            .build();

        assertThat(compiler.compile(FilterFields.and(holder)).render())
            .isEqualTo("(tags_string['a'] = 'x' OR tags_string['b'] = 'y')");
    }

    @Test
    void testStringValuesAreEscapedWhenRendered() {
        SqlFragment predicate = compiler.compile(
            FilterFields.and(field("input", FieldType.STRING, QueryType.NOT_MATCH, "'; DROP TABLE spans; --")));

        assertThat(predicate.getSql()).isEqualTo("`input` NOT LIKE ?");
        assertThat(predicate.render()).isEqualTo("`input` NOT LIKE '%''; DROP TABLE spans; --%'");
    }

    @ParameterizedTest
    @EnumSource(value = QueryType.class, names = {"MATCH", "NOT_MATCH", "EQ", "NOT_EQ", "LT", "LTE", "GT", "GTE"})
    void testSingleValueOperatorsRejectWrongValueCount(QueryType queryType) {
        FilterFields none = FilterFields.and(custom("a", FieldType.STRING, queryType));
        FilterFields two = FilterFields.and(custom("a", FieldType.STRING, queryType, "x", "y"));

        assertThatThrownBy(() -> compiler.compile(none))
            .isInstanceOf(InvalidQueryParameterException.class)
            .hasMessageContaining("should have one value");
        assertThatThrownBy(() -> compiler.compile(two))
            .isInstanceOf(InvalidQueryParameterException.class);
    }

    @ParameterizedTest
    @EnumSource(value = QueryType.class, names = {"IN", "NOT_IN"})
    void testListOperatorsRequireAtLeastOneValue(QueryType queryType) {
        FilterFields filters = FilterFields.and(custom("a", FieldType.STRING, queryType));

        assertThatThrownBy(() -> compiler.compile(filters))
            .isInstanceOf(InvalidQueryParameterException.class)
            .hasMessageContaining("at least one value");
    }

    @ParameterizedTest
    @EnumSource(value = QueryType.class, names = {"EXIST", "NOT_EXIST", "ALWAYS_TRUE"})
    void testValuelessOperatorsRejectValues(QueryType queryType) {
        FilterFields filters = FilterFields.and(custom("a", FieldType.STRING, queryType, "x"));

        assertThatThrownBy(() -> compiler.compile(filters))
            .isInstanceOf(InvalidQueryParameterException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"invalid-name", "a.b", "x'y", "1abc", " a", "tags['k']"})
    void testUnsafeFieldNamesAreRejected(String name) {
        FilterFields filters = FilterFields.and(custom(name, FieldType.STRING, QueryType.EQ, "v"));

        assertThatThrownBy(() -> compiler.compile(filters))
            .isInstanceOf(InvalidQueryParameterException.class)
            .hasMessageContaining("is not safe");
    }

    @Test
    void testUnsafeNameInsideSubFilterFailsWholeTree() {
        FilterField holder = FilterField.builder()
            .subFilter(FilterFields.and(custom("bad name", FieldType.STRING, QueryType.EQ, "v")))
            .build();
        FilterFields filters = FilterFields.and(custom("ok", FieldType.STRING, QueryType.EQ, "v"), holder);

        assertThatThrownBy(() -> compiler.compile(filters))
            .isInstanceOf(InvalidQueryParameterException.class);
    }

    @Test
    void testUnparsableNumberIsRejected() {
        FilterFields filters = FilterFields.and(custom("n", FieldType.LONG, QueryType.EQ, "12a"));

        assertThatThrownBy(() -> compiler.compile(filters))
            .isInstanceOf(InvalidQueryParameterException.class)
            .hasMessageContaining("12a");
    }

    @Test
    void testMissingQueryTypeIsRejected() {
        FilterFields filters = FilterFields.and(FilterField.builder().fieldName("a").values("x").build());

        assertThatThrownBy(() -> compiler.compile(filters))
            .isInstanceOf(InvalidQueryParameterException.class)
            .hasMessageContaining("query type is required");
    }

    @Test
    void testNestingBeyondMaximumDepthFails() {
        PredicateCompiler shallow = new PredicateCompiler(new ColumnResolver(), new ValueCoercer(), 3);

        assertThat(shallow.compile(nest(3)).render()).isEqualTo("tags_string['leaf'] = 'v'");
        assertThatThrownBy(() -> shallow.compile(nest(4)))
            .isInstanceOf(InvalidQueryParameterException.class)
            .hasMessageContaining("maximum depth of 3");
    }

    @Test
    void testDefaultDepthLimitStopsAdversarialTrees() {
        assertThat(compiler.compile(nest(PredicateCompiler.DEFAULT_MAX_DEPTH)).isAlwaysTrue()).isFalse();
        assertThatThrownBy(() -> compiler.compile(nest(PredicateCompiler.DEFAULT_MAX_DEPTH + 1)))
            .isInstanceOf(InvalidQueryParameterException.class);
    }

    @Test
    void testCompilingTwiceYieldsIdenticalSql() {
        FilterFields filters = FilterFields.or(
            custom("a", FieldType.STRING, QueryType.IN, "1", "2"),
            custom("flag", FieldType.BOOL, QueryType.EXIST));

        SqlFragment first = compiler.compile(filters);
        SqlFragment second = compiler.compile(filters);

        assertThat(second).isEqualTo(first);
        assertThat(second.render()).isEqualTo(first.render());
    }

    @Test
    @DisplayName("Manual feedback fields compile to an annotation sub-query")
    void testManualFeedbackFieldCompilesToAnnotationSubQuery() {
        FilterField space = field("space_id", FieldType.STRING, QueryType.EQ, "7");
        FilterField feedback = field("manual_feedback_123", FieldType.STRING, QueryType.EQ, "good");
        FilterFields filters = FilterFields.and(space, feedback);
        AnnotationScope scope = new AnnotationScope("span_annotations", 1L, 2L, filters);

        assertThat(compiler.compile(filters, scope).render()).isEqualTo(
            "(`space_id` = '7' AND span_id IN (SELECT span_id FROM `span_annotations` WHERE"
                + " annotation_type = 'manual_feedback' AND key = '123' AND value_string = 'good'"
                + " AND `space_id` = '7' AND deleted_at = 0 AND start_time >= 1 AND start_time <= 2"
                + " SETTINGS final = 1))");
    }

    @Test
    void testManualFeedbackExistSkipsValueCondition() {
        FilterFields filters = FilterFields.and(field("manual_feedback_9", FieldType.LONG, QueryType.EXIST));
        AnnotationScope scope = new AnnotationScope("span_annotations", 1L, 2L, filters);

        assertThat(compiler.compile(filters, scope).render()).isEqualTo(
            "span_id IN (SELECT span_id FROM `span_annotations` WHERE"
                + " annotation_type = 'manual_feedback' AND key = '9'"
                + " AND deleted_at = 0 AND start_time >= 1 AND start_time <= 2 SETTINGS final = 1)");
    }

    @Test
    void testManualFeedbackNeedsAnnotationTable() {
        FilterFields filters = FilterFields.and(field("manual_feedback_9", FieldType.LONG, QueryType.GT, "3"));

        assertThatThrownBy(() -> compiler.compile(filters))
            .isInstanceOf(InvalidQueryParameterException.class)
            .hasMessageContaining("no annotation table");
    }

    @Test
    void testManualFeedbackNeedsTagKey() {
        FilterFields filters = FilterFields.and(field("manual_feedback_", FieldType.STRING, QueryType.EXIST));
        AnnotationScope scope = new AnnotationScope("span_annotations", 1L, 2L, filters);

        assertThatThrownBy(() -> compiler.compile(filters, scope))
            .isInstanceOf(InvalidQueryParameterException.class)
            .hasMessageContaining("invalid manual feedback field name");
    }

    private static FilterFields nest(int depth) {
        FilterFields filters = FilterFields.and(custom("leaf", FieldType.STRING, QueryType.EQ, "v"));
        for (int i = 1; i < depth; i++) {
            filters = FilterFields.and(FilterField.builder().subFilter(filters).build());
        }
        return filters;
    }
}
