package org.dazzle.engine.guard;

import org.dazzle.dsl.definition.InvariantDefinition;
import org.dazzle.engine.eval.EvaluationException;
import org.dazzle.engine.eval.ExpressionEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates entity invariants against record data.
 *
 * An invariant whose expression cannot be evaluated (for example a
 * comparison between incompatible values) counts as violated.
 */
public final class InvariantChecker {

    private static final Logger log = LoggerFactory.getLogger(InvariantChecker.class);

    private final ExpressionEvaluator evaluator;

    public InvariantChecker() {
        this(new ExpressionEvaluator());
    }

    public InvariantChecker(ExpressionEvaluator evaluator) {
        this.evaluator = Objects.requireNonNull(evaluator, "Evaluator cannot be null");
    }

    public boolean holds(InvariantDefinition invariant, Map<String, ?> data) {
        try {
            return evaluator.test(invariant.expression(), data);
        } catch (EvaluationException e) {
            log.debug("Invariant {} failed to evaluate: {}", invariant.expression(), e.getMessage());
            return false;
        }
    }

    /**
     * @return Every invariant that does not hold, in declaration order
     */
    public List<InvariantViolation> violations(List<InvariantDefinition> invariants, Map<String, ?> data) {
        List<InvariantViolation> violations = new ArrayList<>();
        for (InvariantDefinition invariant : invariants) {
            if (!holds(invariant, data)) {
                String message = invariant.message() != null
                        ? invariant.message()
                        : "Invariant violated: " + invariant.expression();
                violations.add(new InvariantViolation(invariant, message, invariant.code()));
            }
        }
        return violations;
    }

    /**
     * @throws InvariantViolationException for the first invariant the new record breaks
     */
    public void checkForCreate(List<InvariantDefinition> invariants, Map<String, ?> data) {
        List<InvariantViolation> violations = violations(invariants, data);
        if (!violations.isEmpty()) {
            throw violations.get(0).toException();
        }
    }

    /**
     * Checks the record as it would be after applying {@code update} to {@code current}.
     *
     * @throws InvariantViolationException for the first invariant the merged record breaks
     */
    public void checkForUpdate(List<InvariantDefinition> invariants, Map<String, ?> current, Map<String, ?> update) {
        Map<String, Object> merged = new HashMap<>(current);
        merged.putAll(update);
        checkForCreate(invariants, merged);
    }
}
