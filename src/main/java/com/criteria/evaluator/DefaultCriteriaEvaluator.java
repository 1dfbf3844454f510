package com.criteria.evaluator;

import com.criteria.core.AndCriteria;
import com.criteria.core.Criteria;
import com.criteria.core.CriteriaVisitor;
import com.criteria.core.LeafCriteria;
import com.criteria.core.NotCriteria;
import com.criteria.core.OrCriteria;
import com.criteria.filter.Filter;
import com.criteria.variable.DefaultFieldResolver;
import com.criteria.variable.FieldResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Default implementation of CriteriaEvaluator.
 * <p>
 * A sub-tree without filters places no constraint: an AND or OR with one such side reduces to
 * the other side, and a NOT over one is itself unconstrained. A criteria without any filter
 * holds for every record.
 */
public class DefaultCriteriaEvaluator implements CriteriaEvaluator {

    private static final Logger log = LoggerFactory.getLogger(DefaultCriteriaEvaluator.class);

    private final FieldResolver fieldResolver;

    public DefaultCriteriaEvaluator() {
        this(new DefaultFieldResolver());
    }

    public DefaultCriteriaEvaluator(FieldResolver fieldResolver) {
        this.fieldResolver = Objects.requireNonNull(fieldResolver, "Field resolver cannot be null");
    }

    @Override
    public boolean evaluate(Map<String, ?> record, Criteria criteria) {
        Objects.requireNonNull(criteria, "Criteria cannot be null");
        Map<String, ?> source = record == null ? Map.of() : record;

        boolean result = !criteria.hasFilters() || criteria.accept(new Evaluation(source));
        log.debug("Evaluated {} -> {}", criteria, result);
        return result;
    }

    @Override
    public EvaluationResult validate(Map<String, ?> record, Criteria criteria) {
        Objects.requireNonNull(criteria, "Criteria cannot be null");
        Map<String, ?> source = record == null ? Map.of() : record;

        if (!criteria.hasFilters()) {
            return EvaluationResult.success();
        }
        EvaluationResult result = criteria.accept(new Validation(source));
        log.debug("Validated {} -> valid={}, {} message(s)", criteria, result.valid(), result.messages().size());
        return result;
    }

    private boolean matches(Filter filter, Map<String, ?> record) {
        Object actual = fieldResolver.resolve(filter.field(), record).orElse(null);
        return FilterMatcher.matches(filter, actual);
    }

    private static String defaultMessage(Filter filter) {
        return "Field '" + filter.field() + "' failed " + filter.operator() + " check";
    }

    /**
     * Plain boolean walk. Only called on sub-trees that hold at least one filter.
     */
    private final class Evaluation implements CriteriaVisitor<Boolean> {

        private final Map<String, ?> record;

        Evaluation(Map<String, ?> record) {
            this.record = record;
        }

        @Override
        public Boolean visitLeaf(LeafCriteria leaf) {
            for (Filter filter : leaf.filters()) {
                if (!matches(filter, record)) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public Boolean visitAnd(AndCriteria and) {
            for (Criteria operand : and.operands()) {
                if (operand.hasFilters() && !operand.accept(this)) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public Boolean visitOr(OrCriteria or) {
            for (Criteria operand : or.operands()) {
                if (operand.hasFilters() && operand.accept(this)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public Boolean visitNot(NotCriteria not) {
            return !not.criteria().accept(this);
        }
    }

    /**
     * Walk that keeps the messages of failing filters.
     * Every filter of a leaf is tested so that all its failures are reported.
     */
    private final class Validation implements CriteriaVisitor<EvaluationResult> {

        private final Map<String, ?> record;

        Validation(Map<String, ?> record) {
            this.record = record;
        }

        @Override
        public EvaluationResult visitLeaf(LeafCriteria leaf) {
            List<String> messages = new ArrayList<>();
            for (Filter filter : leaf.filters()) {
                if (!matches(filter, record)) {
                    messages.add(filter.message() != null ? filter.message() : defaultMessage(filter));
                }
            }
            return messages.isEmpty() ? EvaluationResult.success() : EvaluationResult.invalid(messages);
        }

        @Override
        public EvaluationResult visitAnd(AndCriteria and) {
            boolean valid = true;
            List<String> messages = new ArrayList<>();
            for (Criteria operand : and.operands()) {
                if (!operand.hasFilters()) {
                    continue;
                }
                EvaluationResult result = operand.accept(this);
                valid &= result.valid();
                messages.addAll(result.messages());
            }
            return valid ? EvaluationResult.success() : EvaluationResult.invalid(messages);
        }

        @Override
        public EvaluationResult visitOr(OrCriteria or) {
            List<String> messages = new ArrayList<>();
            for (Criteria operand : or.operands()) {
                if (!operand.hasFilters()) {
                    continue;
                }
                EvaluationResult result = operand.accept(this);
                if (result.valid()) {
                    return result;
                }
                messages.addAll(result.messages());
            }
            return EvaluationResult.invalid(messages);
        }

        @Override
        public EvaluationResult visitNot(NotCriteria not) {
            EvaluationResult inner = not.criteria().accept(this);
            if (!inner.valid()) {
                return EvaluationResult.success();
            }
            List<String> fields = not.criteria().filters().stream()
                    .map(Filter::field)
                    .distinct()
                    .toList();
            return EvaluationResult.invalid(List.of("Negated criteria on " + fields + " was satisfied"));
        }
    }
}
