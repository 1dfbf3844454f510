package com.criteria.descriptor;

import com.criteria.core.AndCriteria;
import com.criteria.core.Criteria;
import com.criteria.core.CriteriaVisitor;
import com.criteria.core.LeafCriteria;
import com.criteria.core.NotCriteria;
import com.criteria.core.OrCriteria;
import com.criteria.filter.Filter;
import com.criteria.filter.FilterValues;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts criteria into descriptor lists for ORM adapters.
 * <p>
 * The returned list is implicitly ANDed, the way query builders treat a list of filter
 * arguments: a leaf yields one comparison per filter, AND/OR yield one junction over both
 * sides and NOT yields one negation. A side with several filters enters a junction as its own
 * AND group. Sub-trees without filters yield nothing.
 */
public class DescriptorConverter {

    private final Map<String, String> defaultColumnMapping;

    public DescriptorConverter() {
        this(Map.of());
    }

    /**
     * @param defaultColumnMapping Mapping applied on every call; per-call mappings take precedence
     */
    public DescriptorConverter(Map<String, String> defaultColumnMapping) {
        this.defaultColumnMapping = defaultColumnMapping == null ? Map.of() : Map.copyOf(defaultColumnMapping);
    }

    public List<ConditionDescriptor> convert(Criteria criteria) {
        return convert(criteria, Map.of());
    }

    /**
     * @param criteria      Criteria to convert
     * @param columnMapping Logical field to physical column mapping; may be null
     * @return Conditions to apply together
     */
    public List<ConditionDescriptor> convert(Criteria criteria, Map<String, String> columnMapping) {
        Objects.requireNonNull(criteria, "Criteria cannot be null");
        Map<String, String> mapping = defaultColumnMapping;
        if (columnMapping != null && !columnMapping.isEmpty()) {
            mapping = new HashMap<>(defaultColumnMapping);
            mapping.putAll(columnMapping);
        }
        return criteria.accept(new Conversion(mapping));
    }

    private static final class Conversion implements CriteriaVisitor<List<ConditionDescriptor>> {

        private final Map<String, String> mapping;

        Conversion(Map<String, String> mapping) {
            this.mapping = mapping;
        }

        @Override
        public List<ConditionDescriptor> visitLeaf(LeafCriteria leaf) {
            List<ConditionDescriptor> descriptors = new ArrayList<>();
            for (Filter filter : leaf.filters()) {
                FilterValues.check(filter);
                String column = mapping.getOrDefault(filter.field(), filter.field());
                descriptors.add(new ComparisonDescriptor(column, filter.operator(), filter.value()));
            }
            return descriptors;
        }

        @Override
        public List<ConditionDescriptor> visitAnd(AndCriteria and) {
            return junction(JunctionDescriptor.Type.AND, and.operands());
        }

        @Override
        public List<ConditionDescriptor> visitOr(OrCriteria or) {
            return junction(JunctionDescriptor.Type.OR, or.operands());
        }

        @Override
        public List<ConditionDescriptor> visitNot(NotCriteria not) {
            List<ConditionDescriptor> inner = not.criteria().accept(this);
            if (inner.isEmpty()) {
                return List.of();
            }
            return List.of(new NegationDescriptor(inner));
        }

        /**
         * Joins left to right, so {@code [a, b, c]} nests as {@code ((a, b), c)}.
         */
        private List<ConditionDescriptor> junction(JunctionDescriptor.Type type, List<Criteria> operands) {
            List<ConditionDescriptor> joined = List.of();
            for (Criteria operand : operands) {
                List<ConditionDescriptor> conditions = operand.accept(this);
                if (conditions.isEmpty()) {
                    continue;
                }
                joined = joined.isEmpty()
                        ? conditions
                        : List.of(new JunctionDescriptor(type, List.of(single(joined), single(conditions))));
            }
            return joined;
        }

        private static ConditionDescriptor single(List<ConditionDescriptor> conditions) {
            if (conditions.size() == 1) {
                return conditions.get(0);
            }
            return new JunctionDescriptor(JunctionDescriptor.Type.AND, conditions);
        }
    }
}
