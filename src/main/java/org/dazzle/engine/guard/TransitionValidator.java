package org.dazzle.engine.guard;

import org.dazzle.dsl.definition.Guard;
import org.dazzle.dsl.definition.StateMachine;
import org.dazzle.dsl.definition.Transition;
import org.dazzle.dsl.expression.Expr;
import org.dazzle.dsl.expression.FieldRef;
import org.dazzle.dsl.expression.FuncCall;
import org.dazzle.engine.eval.EvaluationException;
import org.dazzle.engine.eval.ExpressionEvaluator;
import org.dazzle.engine.eval.Values;
import org.dazzle.engine.guard.TransitionError.GuardNotSatisfied;
import org.dazzle.engine.guard.TransitionError.GuardType;
import org.dazzle.engine.guard.TransitionError.InvalidTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Checks requested state changes against an entity's state machine.
 *
 * A change is allowed when a transition (exact or wildcard) leads from the
 * current state to the target and every guard of that transition passes.
 * Guards are checked in declaration order; the first failure is reported.
 */
public final class TransitionValidator {

    private static final Logger log = LoggerFactory.getLogger(TransitionValidator.class);

    static final String CURRENT_USER = "current_user";
    static final String DEFAULT_GUARD_MESSAGE = "Guard condition not met";

    private final StateMachine stateMachine;
    private final ExpressionEvaluator evaluator;

    public TransitionValidator(StateMachine stateMachine) {
        this(stateMachine, new ExpressionEvaluator());
    }

    public TransitionValidator(StateMachine stateMachine, ExpressionEvaluator evaluator) {
        this.stateMachine = Objects.requireNonNull(stateMachine, "State machine cannot be null");
        this.evaluator = Objects.requireNonNull(evaluator, "Evaluator cannot be null");
    }

    public StateMachine stateMachine() {
        return stateMachine;
    }

    public TransitionResult validateTransition(String from, String to, Map<String, ?> data) {
        return validateTransition(from, to, data, null, null);
    }

    /**
     * Validates moving a record from one state to another.
     *
     * @param from        The current state, null when the record has none yet
     * @param to          The requested state
     * @param data        The record's field values after the change
     * @param userRoles   The caller's roles; null skips role guards
     * @param currentUser Bound as {@code current_user} in guard expressions when non-null
     */
    public TransitionResult validateTransition(String from, String to, Map<String, ?> data,
                                               Collection<String> userRoles, Object currentUser) {
        if (Objects.equals(from, to)) {
            return TransitionResult.allowed(null);
        }
        if (from == null) {
            // Initial state: any legal state may be set.
            if (stateMachine.states().contains(to)) {
                return TransitionResult.allowed(null);
            }
            return TransitionResult.rejected(null, new InvalidTransition(null, to, stateMachine.states()));
        }

        Optional<Transition> match = stateMachine.findTransition(from, to);
        if (match.isEmpty()) {
            return TransitionResult.rejected(null, new InvalidTransition(from, to, allowedTargets(from)));
        }

        Transition transition = match.get();
        Map<String, Object> context = new HashMap<>(data);
        if (currentUser != null) {
            context.put(CURRENT_USER, currentUser);
        }
        for (Guard guard : transition.guards()) {
            GuardNotSatisfied failure = check(guard, transition, context, userRoles);
            if (failure != null) {
                return TransitionResult.rejected(transition, failure);
            }
        }
        return TransitionResult.allowed(transition);
    }

    /**
     * Validates an update that may change the status field. Guards see the
     * current record merged with the update.
     *
     * @return Empty when the update does not change the status
     */
    public Optional<TransitionResult> validateStatusUpdate(Map<String, ?> current, Map<String, ?> update,
                                                           Collection<String> userRoles, Object currentUser) {
        String field = stateMachine.statusField();
        if (!update.containsKey(field)) {
            return Optional.empty();
        }
        String from = asState(current.get(field));
        String to = asState(update.get(field));
        if (Objects.equals(from, to)) {
            return Optional.empty();
        }
        Map<String, Object> merged = new HashMap<>(current);
        merged.putAll(update);
        return Optional.of(validateTransition(from, to, merged, userRoles, currentUser));
    }

    public Optional<TransitionResult> validateStatusUpdate(Map<String, ?> current, Map<String, ?> update) {
        return validateStatusUpdate(current, update, null, null);
    }

    private List<String> allowedTargets(String from) {
        Set<String> targets = new LinkedHashSet<>();
        for (Transition transition : stateMachine.transitionsFrom(from)) {
            targets.add(transition.toState());
        }
        return new ArrayList<>(targets);
    }

    private GuardNotSatisfied check(Guard guard, Transition transition, Map<String, Object> context,
                                    Collection<String> userRoles) {
        String label = "'" + transition.fromState() + "' -> '" + transition.toState() + "'";
        if (guard instanceof Guard.RequiresField requires) {
            Object value = context.get(requires.field());
            if (value == null || (value instanceof String s && s.isBlank())) {
                return new GuardNotSatisfied(GuardType.REQUIRES, requires.field(),
                        "Field '" + requires.field() + "' is required for transition " + label);
            }
            return null;
        }
        if (guard instanceof Guard.RequiresRole role) {
            if (userRoles != null && !userRoles.contains(role.role())) {
                return new GuardNotSatisfied(GuardType.ROLE, role.role(),
                        "Role '" + role.role() + "' is required for transition " + label);
            }
            return null;
        }
        Guard.ExpressionGuard expression = (Guard.ExpressionGuard) guard;
        if (passes(expression.expression(), context)) {
            return null;
        }
        String message = expression.message() != null
                ? expression.message()
                : defaultMessage(expression.expression(), context);
        return new GuardNotSatisfied(GuardType.EXPRESSION, expression.expression().toString(), message);
    }

    private boolean passes(Expr expr, Map<String, Object> context) {
        try {
            return evaluator.test(expr, context);
        } catch (EvaluationException e) {
            log.debug("Guard {} failed to evaluate: {}", expr, e.getMessage());
            return false;
        }
    }

    /**
     * For {@code all_true(...)} checklists, names the items that are not
     * checked; otherwise a generic message.
     */
    private String defaultMessage(Expr expr, Map<String, Object> context) {
        if (expr instanceof FuncCall call && call.name().equals("all_true")) {
            List<String> unchecked = new ArrayList<>();
            for (Expr arg : call.args()) {
                if (arg instanceof FieldRef ref && !Values.isTruthy(evaluateQuietly(ref, context))) {
                    unchecked.add(ref.dotted());
                }
            }
            if (!unchecked.isEmpty()) {
                return "Checklist incomplete. Unchecked items: " + String.join(", ", unchecked);
            }
        }
        return DEFAULT_GUARD_MESSAGE;
    }

    private Object evaluateQuietly(Expr expr, Map<String, Object> context) {
        try {
            return evaluator.evaluate(expr, context);
        } catch (EvaluationException e) {
            log.debug("Could not evaluate {}: {}", expr, e.getMessage());
            return null;
        }
    }

    private static String asState(Object value) {
        if (value == null) {
            return null;
        }
        return value instanceof Enum<?> e ? e.name() : value.toString();
    }
}
