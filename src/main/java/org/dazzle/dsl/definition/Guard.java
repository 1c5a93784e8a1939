package org.dazzle.dsl.definition;

import org.dazzle.dsl.expression.Expr;

import java.util.Objects;

/**
 * Precondition on a state transition. A transition is permitted only when
 * every one of its guards passes.
 */
public sealed interface Guard permits Guard.RequiresField, Guard.RequiresRole, Guard.ExpressionGuard {

    /**
     * {@code requires field}: the field must hold a value.
     */
    record RequiresField(String field) implements Guard {
        public RequiresField {
            Objects.requireNonNull(field, "Field cannot be null");
        }
    }

    /**
     * {@code role(name)}: the acting user must hold the role. Enforcement
     * belongs to the authorization layer; the guard only carries the requirement.
     */
    record RequiresRole(String role) implements Guard {
        public RequiresRole {
            Objects.requireNonNull(role, "Role cannot be null");
        }
    }

    /**
     * {@code guard: expr} with an optional failure message.
     */
    record ExpressionGuard(Expr expression, String message) implements Guard {
        public ExpressionGuard {
            Objects.requireNonNull(expression, "Expression cannot be null");
        }
    }
}
