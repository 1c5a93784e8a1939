package org.dazzle.dsl.expression;

import java.util.List;
import java.util.Objects;

/**
 * Call of a built-in function.
 *
 * The parser accepts any name; whether the name belongs to the closed
 * function set is decided when the call is evaluated.
 *
 * @param name The function name
 * @param args The arguments, in order
 */
public record FuncCall(String name, List<Expr> args) implements Expr {

    /** Internal constructor used to materialize {@code in (a, b, c)} lists. */
    public static final String LIST_CONSTRUCTOR = "__list__";

    public FuncCall {
        Objects.requireNonNull(name, "Function name cannot be null");
        Objects.requireNonNull(args, "Arguments cannot be null");
        args = List.copyOf(args);
    }

    public static FuncCall of(String name, Expr... args) {
        return new FuncCall(name, List.of(args));
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitFuncCall(this);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append('(');
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(args.get(i));
        }
        return sb.append(')').toString();
    }
}
