package com.criteria.sql;

import com.criteria.core.AndCriteria;
import com.criteria.core.Criteria;
import com.criteria.core.CriteriaVisitor;
import com.criteria.core.LeafCriteria;
import com.criteria.core.NotCriteria;
import com.criteria.core.OrCriteria;
import com.criteria.exception.InvalidTableException;
import com.criteria.exception.SqlCompilationException;
import com.criteria.exception.ValueShapeException;
import com.criteria.filter.Filter;
import com.criteria.filter.FilterValues;
import com.criteria.filter.Order;
import com.criteria.filter.Range;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Compiles criteria into a parameterized {@code SELECT} query.
 * <p>
 * Output shape: {@code SELECT <columns> FROM <table>[ WHERE <condition>][ ORDER BY <orders>];}
 * AND/OR render as fully parenthesized groups and NOT as {@code NOT (...)}. Several filters in
 * one leaf are joined with {@code AND}. Placeholders are numbered left to right from
 * {@code parameter_0} on every call, so compiling the same criteria twice gives identical output.
 * <p>
 * Column mapping rewrites logical field names of filters and orders only; the selected column
 * list and the table are used verbatim. A sub-tree without filters renders nothing.
 */
public class SqlCompiler {

    private static final Logger log = LoggerFactory.getLogger(SqlCompiler.class);

    public static final List<String> DEFAULT_COLUMNS = List.of("*");

    private final Map<String, String> defaultColumnMapping;
    private final List<String> defaultColumns;

    public SqlCompiler() {
        this(Map.of(), DEFAULT_COLUMNS);
    }

    public SqlCompiler(Map<String, String> defaultColumnMapping) {
        this(defaultColumnMapping, DEFAULT_COLUMNS);
    }

    /**
     * @param defaultColumnMapping Logical field to physical column mapping applied on every call;
     *                             per-call mappings take precedence
     * @param defaultColumns       Columns selected when a call names none
     */
    public SqlCompiler(Map<String, String> defaultColumnMapping, List<String> defaultColumns) {
        this.defaultColumnMapping = defaultColumnMapping == null ? Map.of() : Map.copyOf(defaultColumnMapping);
        this.defaultColumns = defaultColumns == null || defaultColumns.isEmpty()
                ? DEFAULT_COLUMNS
                : List.copyOf(defaultColumns);
    }

    public SqlQuery compile(Criteria criteria, String table) {
        return compile(criteria, table, null, Map.of());
    }

    public SqlQuery compile(Criteria criteria, String table, List<String> columns) {
        return compile(criteria, table, columns, Map.of());
    }

    /**
     * Compile criteria into a query.
     *
     * @param criteria      Criteria to compile
     * @param table         Table to select from
     * @param columns       Columns to select; null selects the default columns ({@code *} unless configured)
     * @param columnMapping Logical field to physical column mapping; may be null
     * @return Query text and parameters
     * @throws InvalidTableException   if the table is null or blank
     * @throws SqlCompilationException if the column list is empty
     * @throws ValueShapeException     if a filter value does not fit its operator
     */
    public SqlQuery compile(Criteria criteria, String table, List<String> columns,
                            Map<String, String> columnMapping) {
        Objects.requireNonNull(criteria, "Criteria cannot be null");
        if (table == null || table.isBlank()) {
            throw new InvalidTableException("Table name cannot be blank");
        }
        List<String> selected = columns == null ? defaultColumns : columns;
        if (selected.isEmpty()) {
            throw new SqlCompilationException("At least one column must be selected from " + table);
        }

        Map<String, String> mapping = mergeMapping(columnMapping);
        ParameterAccumulator parameters = new ParameterAccumulator();

        StringBuilder sql = new StringBuilder("SELECT ")
                .append(String.join(", ", selected))
                .append(" FROM ")
                .append(table);

        if (criteria.hasFilters()) {
            String condition = criteria.accept(new ConditionRenderer(mapping, parameters));
            sql.append(" WHERE ").append(condition);
        }
        if (criteria.hasOrders()) {
            sql.append(" ORDER BY ").append(renderOrders(criteria.orders(), mapping));
        }
        sql.append(';');

        SqlQuery query = new SqlQuery(sql.toString(), parameters.parameters());
        log.debug("Compiled {} into: {} with {} parameter(s)", criteria, query.sql(), parameters.size());
        return query;
    }

    private Map<String, String> mergeMapping(Map<String, String> columnMapping) {
        if (columnMapping == null || columnMapping.isEmpty()) {
            return defaultColumnMapping;
        }
        Map<String, String> merged = new HashMap<>(defaultColumnMapping);
        merged.putAll(columnMapping);
        return merged;
    }

    private static String column(String field, Map<String, String> mapping) {
        return mapping.getOrDefault(field, field);
    }

    private static String renderOrders(List<Order> orders, Map<String, String> mapping) {
        StringJoiner joiner = new StringJoiner(", ");
        for (Order order : orders) {
            String direction = switch (order.direction()) {
                case ASC -> "ASC";
                case DESC -> "DESC";
            };
            joiner.add(column(order.field(), mapping) + " " + direction);
        }
        return joiner.toString();
    }

    /**
     * Renders the WHERE condition. Only called on sub-trees that hold at least one filter.
     */
    private static final class ConditionRenderer implements CriteriaVisitor<String> {

        private final Map<String, String> mapping;
        private final ParameterAccumulator parameters;

        ConditionRenderer(Map<String, String> mapping, ParameterAccumulator parameters) {
            this.mapping = mapping;
            this.parameters = parameters;
        }

        @Override
        public String visitLeaf(LeafCriteria leaf) {
            List<String> fragments = new ArrayList<>(leaf.filters().size());
            for (Filter filter : leaf.filters()) {
                fragments.add(renderFilter(filter));
            }
            return String.join(" AND ", fragments);
        }

        @Override
        public String visitAnd(AndCriteria and) {
            return chain(and.operands(), "AND");
        }

        @Override
        public String visitOr(OrCriteria or) {
            return chain(or.operands(), "OR");
        }

        @Override
        public String visitNot(NotCriteria not) {
            return "NOT (" + not.criteria().accept(this) + ")";
        }

        /**
         * Renders {@code ((a OP b) OP c)} from {@code [a, b, c]}, skipping operands without filters.
         */
        private String chain(List<Criteria> operands, String connective) {
            List<String> conditions = new ArrayList<>(operands.size());
            for (Criteria operand : operands) {
                if (operand.hasFilters()) {
                    conditions.add(operand.accept(this));
                }
            }

            StringBuilder sql = new StringBuilder("(".repeat(conditions.size() - 1));
            sql.append(conditions.get(0));
            for (int i = 1; i < conditions.size(); i++) {
                sql.append(' ').append(connective).append(' ').append(conditions.get(i)).append(')');
            }
            return sql.toString();
        }

        private String renderFilter(Filter filter) {
            FilterValues.check(filter);
            String field = column(filter.field(), mapping);

            return switch (filter.operator()) {
                case EQUAL -> field + " = " + parameters.bind(filter.value());
                case NOT_EQUAL -> field + " != " + parameters.bind(filter.value());
                case GREATER -> field + " > " + parameters.bind(filter.value());
                case GREATER_OR_EQUAL -> field + " >= " + parameters.bind(filter.value());
                case LESS -> field + " < " + parameters.bind(filter.value());
                case LESS_OR_EQUAL -> field + " <= " + parameters.bind(filter.value());

                case LIKE -> field + " LIKE " + parameters.bind(filter.value());
                case NOT_LIKE -> field + " NOT LIKE " + parameters.bind(filter.value());
                case CONTAINS -> field + " LIKE '%%' || " + parameters.bind(filter.value()) + " || '%%'";
                case NOT_CONTAINS -> field + " NOT LIKE '%%' || " + parameters.bind(filter.value()) + " || '%%'";
                case STARTS_WITH -> field + " LIKE " + parameters.bind(filter.value()) + " || '%%'";
                case NOT_STARTS_WITH -> field + " NOT LIKE " + parameters.bind(filter.value()) + " || '%%'";
                case ENDS_WITH -> field + " LIKE '%%' || " + parameters.bind(filter.value());
                case NOT_ENDS_WITH -> field + " NOT LIKE '%%' || " + parameters.bind(filter.value());

                case IN -> field + " IN (" + bindAll(filter) + ")";
                case NOT_IN -> field + " NOT IN (" + bindAll(filter) + ")";

                case BETWEEN -> field + " BETWEEN " + bindRange(filter);
                case NOT_BETWEEN -> field + " NOT BETWEEN " + bindRange(filter);

                case IS_NULL -> field + " IS NULL";
                case IS_NOT_NULL -> field + " IS NOT NULL";
            };
        }

        private String bindRange(Filter filter) {
            Range range = FilterValues.pair(filter);
            String lower = parameters.bind(range.lower());
            String upper = parameters.bind(range.upper());
            return lower + " AND " + upper;
        }

        private String bindAll(Filter filter) {
            List<?> values = FilterValues.sequence(filter);
            if (values.isEmpty()) {
                throw new ValueShapeException(filter.operator() + " operator on '" + filter.field()
                        + "' requires at least one value");
            }
            StringJoiner joiner = new StringJoiner(", ");
            for (Object value : values) {
                joiner.add(parameters.bind(value));
            }
            return joiner.toString();
        }
    }
}
