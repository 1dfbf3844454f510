package com.criteria.evaluator;

import com.criteria.core.Criteria;
import com.criteria.variable.RecordFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Evaluates criteria against in-memory records.
 * Orders take no part in evaluation.
 */
public interface CriteriaEvaluator {

    /**
     * Test a record against criteria.
     *
     * @param record   Field values; a missing key reads as a missing value
     * @param criteria Criteria to apply
     * @return true if the record satisfies the criteria
     */
    boolean evaluate(Map<String, ?> record, Criteria criteria);

    /**
     * Test a record and collect the messages of the filters it fails.
     *
     * @param record   Field values
     * @param criteria Criteria to apply
     * @return Validity plus failure messages
     */
    EvaluationResult validate(Map<String, ?> record, Criteria criteria);

    /**
     * Test a JSON object payload; nested objects are addressed with dotted field names.
     */
    default boolean evaluateJson(String jsonPayload, Criteria criteria) {
        return evaluate(RecordFactory.fromJson(jsonPayload), criteria);
    }

    /**
     * Keep the records that satisfy the criteria, in their original order.
     */
    default <T extends Map<String, ?>> List<T> select(Collection<T> records, Criteria criteria) {
        List<T> selected = new ArrayList<>();
        for (T record : records) {
            if (evaluate(record, criteria)) {
                selected.add(record);
            }
        }
        return selected;
    }
}
