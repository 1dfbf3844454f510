package com.criteria.sql;

import com.criteria.core.Criteria;
import com.criteria.exception.InvalidTableException;
import com.criteria.exception.SqlCompilationException;
import com.criteria.exception.ValueShapeException;
import com.criteria.filter.Filter;
import com.criteria.filter.FilterOperator;
import com.criteria.filter.Order;
import com.criteria.filter.Range;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SqlCompiler.
 */
class SqlCompilerTest {

    private static final List<String> COLUMNS = List.of("id", "name", "email");
    private static final Pattern PLACEHOLDER = Pattern.compile(":(parameter_\\d+)");

    private SqlCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new SqlCompiler();
    }

    // =====================================================================
    // Query shape
    // =====================================================================

    @Test
    @DisplayName("Empty criteria selects all columns without WHERE")
    void emptyCriteriaSelectsAll() {
        SqlQuery query = compiler.compile(Criteria.empty(), "user");

        assertEquals("SELECT * FROM user;", query.sql());
        assertTrue(query.parameters().isEmpty());
    }

    @Test
    @DisplayName("Empty criteria with explicit columns")
    void emptyCriteriaWithColumns() {
        SqlQuery query = compiler.compile(Criteria.empty(), "user", List.of("id", "name"));

        assertEquals("SELECT id, name FROM user;", query.sql());
        assertTrue(query.parameters().isEmpty());
    }

    @ParameterizedTest
    @DisplayName("Single-value operators render one placeholder")
    @CsvSource(delimiterString = " | ", quoteCharacter = '"', value = {
            "EQUAL            | name = :parameter_0",
            "NOT_EQUAL        | name != :parameter_0",
            "GREATER          | name > :parameter_0",
            "GREATER_OR_EQUAL | name >= :parameter_0",
            "LESS             | name < :parameter_0",
            "LESS_OR_EQUAL    | name <= :parameter_0",
            "LIKE             | name LIKE :parameter_0",
            "NOT_LIKE         | name NOT LIKE :parameter_0",
            "CONTAINS         | name LIKE '%%' || :parameter_0 || '%%'",
            "NOT_CONTAINS     | name NOT LIKE '%%' || :parameter_0 || '%%'",
            "STARTS_WITH      | name LIKE :parameter_0 || '%%'",
            "NOT_STARTS_WITH  | name NOT LIKE :parameter_0 || '%%'",
            "ENDS_WITH        | name LIKE '%%' || :parameter_0",
            "NOT_ENDS_WITH    | name NOT LIKE '%%' || :parameter_0"
    })
    void singleValueOperators(FilterOperator operator, String fragment) {
        SqlQuery query = compiler.compile(
                Criteria.of(new Filter("name", operator, "John Doe")), "user", COLUMNS);

        assertEquals("SELECT id, name, email FROM user WHERE " + fragment + ";", query.sql());
        assertEquals(Map.of("parameter_0", "John Doe"), query.parameters());
    }

    @Test
    @DisplayName("IS NULL and IS NOT NULL consume no parameter")
    void nullChecksConsumeNoParameter() {
        SqlQuery isNull = compiler.compile(Criteria.of(Filter.isNull("email")), "user", COLUMNS);
        SqlQuery isNotNull = compiler.compile(Criteria.of(Filter.isNotNull("email")), "user", COLUMNS);

        assertEquals("SELECT id, name, email FROM user WHERE email IS NULL;", isNull.sql());
        assertEquals("SELECT id, name, email FROM user WHERE email IS NOT NULL;", isNotNull.sql());
        assertTrue(isNull.parameters().isEmpty());
        assertTrue(isNotNull.parameters().isEmpty());
    }

    static Stream<Arguments> pairValues() {
        return Stream.of(
                Arguments.of(Range.of(18, 30)),
                Arguments.of(List.of(18, 30)),
                Arguments.of((Object) new Integer[]{18, 30}),
                Arguments.of((Object) new int[]{18, 30})
        );
    }

    @ParameterizedTest
    @DisplayName("BETWEEN binds two parameters whatever the pair type")
    @MethodSource("pairValues")
    void betweenBindsTwoParameters(Object value) {
        SqlQuery query = compiler.compile(
                Criteria.of(new Filter("age", FilterOperator.BETWEEN, value)), "user", COLUMNS);

        assertEquals("SELECT id, name, email FROM user WHERE age BETWEEN :parameter_0 AND :parameter_1;", query.sql());
        assertEquals(Map.of("parameter_0", 18, "parameter_1", 30), query.parameters());
    }

    @ParameterizedTest
    @DisplayName("NOT BETWEEN binds two parameters whatever the pair type")
    @MethodSource("pairValues")
    void notBetweenBindsTwoParameters(Object value) {
        SqlQuery query = compiler.compile(
                Criteria.of(new Filter("age", FilterOperator.NOT_BETWEEN, value)), "user", COLUMNS);

        assertEquals("SELECT id, name, email FROM user WHERE age NOT BETWEEN :parameter_0 AND :parameter_1;",
                query.sql());
        assertEquals(Map.of("parameter_0", 18, "parameter_1", 30), query.parameters());
    }

    @Test
    @DisplayName("IN binds one parameter per element")
    void inBindsEachElement() {
        SqlQuery query = compiler.compile(Criteria.of(Filter.in("status", List.of("NEW", "OPEN", "HOLD"))), "ticket");

        assertEquals("SELECT * FROM ticket WHERE status IN (:parameter_0, :parameter_1, :parameter_2);", query.sql());
        assertEquals(Map.of("parameter_0", "NEW", "parameter_1", "OPEN", "parameter_2", "HOLD"), query.parameters());
    }

    @Test
    @DisplayName("NOT IN binds one parameter per element")
    void notInBindsEachElement() {
        SqlQuery query = compiler.compile(
                Criteria.of(new Filter("status", FilterOperator.NOT_IN, List.of("CLOSED"))), "ticket");

        assertEquals("SELECT * FROM ticket WHERE status NOT IN (:parameter_0);", query.sql());
        assertEquals(Map.of("parameter_0", "CLOSED"), query.parameters());
    }

    // =====================================================================
    // Combinators
    // =====================================================================

    @Test
    @DisplayName("AND renders a parenthesized group, left side numbered first")
    void andCriteria() {
        Criteria name = Criteria.of(Filter.equal("name", "John Doe"));
        Criteria email = Criteria.of(Filter.isNotNull("email"));

        SqlQuery query = compiler.compile(name.and(email), "user", COLUMNS);

        assertEquals("SELECT id, name, email FROM user WHERE (name = :parameter_0 AND email IS NOT NULL);",
                query.sql());
        assertEquals(Map.of("parameter_0", "John Doe"), query.parameters());
    }

    @Test
    @DisplayName("Swapped AND operands keep a single parameter")
    void swappedAndCriteria() {
        Criteria name = Criteria.of(Filter.equal("name", "John Doe"));
        Criteria email = Criteria.of(Filter.isNotNull("email"));

        SqlQuery query = compiler.compile(email.and(name), "user", COLUMNS);

        assertEquals("SELECT id, name, email FROM user WHERE (email IS NOT NULL AND name = :parameter_0);",
                query.sql());
        assertEquals(Map.of("parameter_0", "John Doe"), query.parameters());
    }

    @Test
    @DisplayName("OR renders a parenthesized group")
    void orCriteria() {
        Criteria name = Criteria.of(Filter.equal("name", "John Doe"));
        Criteria age = Criteria.of(Filter.greater("age", 30));

        SqlQuery query = compiler.compile(name.or(age), "user");

        assertEquals("SELECT * FROM user WHERE (name = :parameter_0 OR age > :parameter_1);", query.sql());
        assertEquals(Map.of("parameter_0", "John Doe", "parameter_1", 30), query.parameters());
    }

    @Test
    @DisplayName("NOT wraps its operand")
    void notCriteria() {
        SqlQuery query = compiler.compile(Criteria.of(Filter.equal("name", "John Doe")).not(), "user", COLUMNS);

        assertEquals("SELECT id, name, email FROM user WHERE NOT (name = :parameter_0);", query.sql());
        assertEquals(Map.of("parameter_0", "John Doe"), query.parameters());
    }

    @Test
    @DisplayName("Deep nesting keeps parameters sequential across BETWEEN and IS NULL")
    void deepNesting() {
        Criteria age = Criteria.of(Filter.between("age", 18, 30));
        Criteria deleted = Criteria.of(Filter.isNull("deleted_at"));
        Criteria name = Criteria.of(Filter.equal("name", "John"));
        Criteria email = Criteria.of(new Filter("email", FilterOperator.ENDS_WITH, "@example.com"));

        Criteria criteria = age.and(deleted).or(name.and(email).not());
        SqlQuery query = compiler.compile(criteria, "user");

        assertEquals("SELECT * FROM user WHERE ((age BETWEEN :parameter_0 AND :parameter_1 AND deleted_at IS NULL)"
                + " OR NOT ((name = :parameter_2 AND email LIKE '%%' || :parameter_3)));", query.sql());
        assertEquals(Map.of(
                "parameter_0", 18,
                "parameter_1", 30,
                "parameter_2", "John",
                "parameter_3", "@example.com"), query.parameters());
    }

    @Test
    @DisplayName("Several filters in one leaf are joined with AND")
    void leafWithSeveralFilters() {
        Criteria criteria = Criteria.of(Filter.equal("name", "John"), Filter.greater("age", 18));

        SqlQuery query = compiler.compile(criteria, "user");

        assertEquals("SELECT * FROM user WHERE name = :parameter_0 AND age > :parameter_1;", query.sql());
        assertEquals(Map.of("parameter_0", "John", "parameter_1", 18), query.parameters());
    }

    @Test
    @DisplayName("A side without filters adds no condition")
    void sideWithoutFilters() {
        Criteria ordering = Criteria.leaf(List.of(), List.of(Order.desc("created_at")));
        Criteria name = Criteria.of(Filter.equal("name", "John"));

        SqlQuery query = compiler.compile(ordering.and(name).or(Criteria.empty().not()), "user");

        assertEquals("SELECT * FROM user WHERE name = :parameter_0 ORDER BY created_at DESC;", query.sql());
        assertEquals(Map.of("parameter_0", "John"), query.parameters());
    }

    // =====================================================================
    // Orders and column mapping
    // =====================================================================

    @Test
    @DisplayName("Orders render in depth-first order")
    void ordersRenderDepthFirst() {
        Criteria left = Criteria.leaf(List.of(Filter.equal("name", "John")), List.of(Order.asc("name")));
        Criteria right = Criteria.leaf(List.of(Filter.greater("age", 18)),
                List.of(Order.desc("age"), Order.asc("email")));

        SqlQuery query = compiler.compile(left.or(right), "user");

        assertEquals("SELECT * FROM user WHERE (name = :parameter_0 OR age > :parameter_1)"
                + " ORDER BY name ASC, age DESC, email ASC;", query.sql());
    }

    @Test
    @DisplayName("Orders without filters skip WHERE")
    void ordersWithoutFilters() {
        SqlQuery query = compiler.compile(Criteria.leaf(List.of(), List.of(Order.asc("name"))), "user");

        assertEquals("SELECT * FROM user ORDER BY name ASC;", query.sql());
        assertTrue(query.parameters().isEmpty());
    }

    @Test
    @DisplayName("Column mapping rewrites filter and order fields only")
    void columnMappingRewritesLeafFields() {
        Criteria criteria = Criteria.leaf(
                List.of(Filter.equal("full_name", "John Doe")),
                List.of(Order.asc("full_name")));

        SqlQuery query = compiler.compile(criteria, "user", List.of("id", "full_name"), Map.of("full_name", "name"));

        assertEquals("SELECT id, full_name FROM user WHERE name = :parameter_0 ORDER BY name ASC;", query.sql());
        assertEquals(Map.of("parameter_0", "John Doe"), query.parameters());
    }

    @Test
    @DisplayName("Per-call mapping overrides the default mapping")
    void perCallMappingOverridesDefault() {
        SqlCompiler configured = new SqlCompiler(Map.of("full_name", "name", "mail", "email"), List.of("id"));
        Criteria criteria = Criteria.of(Filter.equal("full_name", "John"), Filter.isNotNull("mail"));

        SqlQuery query = configured.compile(criteria, "user", null, Map.of("full_name", "display_name"));

        assertEquals("SELECT id FROM user WHERE display_name = :parameter_0 AND email IS NOT NULL;", query.sql());
    }

    // =====================================================================
    // Properties
    // =====================================================================

    @Test
    @DisplayName("Compiling twice gives identical output")
    void compileIsIdempotent() {
        Criteria criteria = Criteria.of(Filter.equal("name", "John"))
                .or(Criteria.of(Filter.between("age", 1, 2)));

        SqlQuery first = compiler.compile(criteria, "user");
        SqlQuery second = compiler.compile(criteria, "user");

        assertEquals(first.sql(), second.sql());
        assertEquals(first.parameters(), second.parameters());
    }

    @Test
    @DisplayName("Every placeholder has exactly one parameter entry")
    void placeholdersMatchParameters() {
        Criteria criteria = Criteria.of(Filter.in("status", List.of("A", "B")), Filter.isNull("deleted_at"))
                .and(Criteria.of(Filter.between("age", 18, 65)).not())
                .or(Criteria.of(new Filter("name", FilterOperator.CONTAINS, "oh"), Filter.isNotNull("email")));

        SqlQuery query = compiler.compile(criteria, "user");

        Matcher matcher = PLACEHOLDER.matcher(query.sql());
        Set<String> seen = new HashSet<>();
        int occurrences = 0;
        while (matcher.find()) {
            occurrences++;
            assertTrue(seen.add(matcher.group(1)), "Placeholder used twice: " + matcher.group(1));
        }
        assertEquals(5, occurrences);
        assertEquals(query.parameters().keySet(), seen);
        for (int i = 0; i < occurrences; i++) {
            assertTrue(seen.contains("parameter_" + i));
        }
    }

    @Test
    @DisplayName("Long AND chains compile with one group per link")
    void longAndChain() {
        int links = 3000;
        Criteria criteria = Criteria.of(Filter.equal("f0", 0));
        for (int i = 1; i < links; i++) {
            criteria = criteria.and(Criteria.of(Filter.equal("f" + i, i)));
        }
        Criteria chain = criteria;

        SqlQuery query = assertTimeout(Duration.ofSeconds(10), () -> compiler.compile(chain, "user"));

        assertEquals(links, query.parameters().size());
        assertTrue(query.sql().startsWith("SELECT * FROM user WHERE " + "(".repeat(links - 1)
                + "f0 = :parameter_0 AND f1 = :parameter_1) AND f2 = :parameter_2)"));
        assertTrue(query.sql().endsWith(" AND f2999 = :parameter_2999);"));
        assertEquals(2999, query.parameters().get("parameter_2999"));
    }

    @Test
    @DisplayName("Filter-less links inside a chain are skipped")
    void chainSkipsLinksWithoutFilters() {
        Criteria criteria = Criteria.of(Filter.equal("a", 1))
                .or(Criteria.empty())
                .or(Criteria.of(Filter.equal("b", 2)))
                .or(Criteria.leaf(List.of(), List.of(Order.asc("c"))));

        SqlQuery query = compiler.compile(criteria, "user");

        assertEquals("SELECT * FROM user WHERE (a = :parameter_0 OR b = :parameter_1) ORDER BY c ASC;", query.sql());
    }

    // =====================================================================
    // Errors
    // =====================================================================

    @Test
    @DisplayName("BETWEEN with a scalar is a value-shape error")
    void betweenWithScalarFails() {
        Criteria criteria = Criteria.of(new Filter("age", FilterOperator.BETWEEN, 18));

        assertThrows(ValueShapeException.class, () -> compiler.compile(criteria, "user"));
    }

    @Test
    @DisplayName("BETWEEN with three elements is a value-shape error")
    void betweenWithThreeElementsFails() {
        Criteria criteria = Criteria.of(new Filter("age", FilterOperator.BETWEEN, List.of(1, 2, 3)));

        assertThrows(ValueShapeException.class, () -> compiler.compile(criteria, "user"));
    }

    @Test
    @DisplayName("IN with an empty list is a value-shape error")
    void inWithEmptyListFails() {
        Criteria criteria = Criteria.of(Filter.in("status", List.of()));

        assertThrows(ValueShapeException.class, () -> compiler.compile(criteria, "user"));
    }

    @Test
    @DisplayName("EQUAL with a list is a value-shape error")
    void equalWithListFails() {
        Criteria criteria = Criteria.of(Filter.equal("status", List.of("A")));

        assertThrows(ValueShapeException.class, () -> compiler.compile(criteria, "user"));
    }

    @Test
    @DisplayName("A malformed filter deep in the tree fails the whole compilation")
    void malformedNestedFilterFails() {
        Criteria criteria = Criteria.of(Filter.equal("name", "John"))
                .and(Criteria.of(new Filter("age", FilterOperator.NOT_BETWEEN, "18-30")).not());

        assertThrows(ValueShapeException.class, () -> compiler.compile(criteria, "user"));
    }

    @Test
    @DisplayName("Blank table is rejected")
    void blankTableFails() {
        assertThrows(InvalidTableException.class, () -> compiler.compile(Criteria.empty(), " "));
        assertThrows(InvalidTableException.class, () -> compiler.compile(Criteria.empty(), null));
    }

    @Test
    @DisplayName("Empty column list is rejected")
    void emptyColumnsFail() {
        assertThrows(SqlCompilationException.class, () -> compiler.compile(Criteria.empty(), "user", List.of()));
    }
}
