package io.tupla.query;

import io.tupla.core.ErrorReason;
import io.tupla.core.Result;
import io.tupla.kernel.Tuple;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Compiles patterns and match specs into closure trees, once per call.
 * <p>
 * A spec is rejected with {@link ErrorReason#INVALID_SELECT_SPEC} when it has no clauses, a
 * clause has an empty body, a guard or body uses a variable its head does not bind, or a call
 * passes the wrong number of arguments.
 */
public final class PatternCompiler {

    private PatternCompiler() {
    }

    public static Result<CompiledPattern> compile(Pattern pattern) {
        if (pattern == null) {
            return Result.err(ErrorReason.INVALID_SELECT_SPEC);
        }
        return Result.ok(compilePattern(pattern));
    }

    public static Result<CompiledSpec> compile(MatchSpec spec) {
        if (spec == null || spec.clauses().isEmpty()) {
            return Result.err(ErrorReason.INVALID_SELECT_SPEC);
        }
        var clauses = new ArrayList<CompiledSpec.Clause>(spec.clauses().size());
        for (var clause : spec.clauses()) {
            if (clause.body().isEmpty()) {
                return Result.err(ErrorReason.INVALID_SELECT_SPEC);
            }
            var head = compilePattern(clause.head());
            var guards = new ArrayList<CompiledSpec.Eval>(clause.guards().size());
            var body = new ArrayList<CompiledSpec.Eval>(clause.body().size());
            for (var guard : clause.guards()) {
                var compiled = compileExpr(guard, head);
                if (compiled == null) {
                    return Result.err(ErrorReason.INVALID_SELECT_SPEC);
                }
                guards.add(compiled);
            }
            for (var expr : clause.body()) {
                var compiled = compileExpr(expr, head);
                if (compiled == null) {
                    return Result.err(ErrorReason.INVALID_SELECT_SPEC);
                }
                body.add(compiled);
            }
            clauses.add(new CompiledSpec.Clause(head, guards, body));
        }
        return Result.ok(new CompiledSpec(clauses));
    }

    private static CompiledPattern compilePattern(Pattern pattern) {
        var numbers = new TreeSet<Integer>();
        collectVariables(pattern, numbers);
        var variables = numbers.stream().mapToInt(Integer::intValue).toArray();
        var seen = new HashSet<Integer>();
        var root = compileMatcher(pattern, variables, seen);
        return new CompiledPattern(root, variables);
    }

    private static void collectVariables(Pattern pattern, Set<Integer> into) {
        if (pattern instanceof Pattern.Bind bind) {
            into.add(bind.variable());
        } else if (pattern instanceof Pattern.Nested nested) {
            for (var element : nested.elements()) {
                collectVariables(element, into);
            }
        }
    }

    private static CompiledPattern.Matcher compileMatcher(Pattern pattern, int[] variables, Set<Integer> seen) {
        if (pattern instanceof Pattern.Ignore) {
            return (value, slots) -> true;
        }
        if (pattern instanceof Pattern.Literal literal) {
            var expected = literal.value();
            return (value, slots) -> Objects.deepEquals(expected, value);
        }
        if (pattern instanceof Pattern.Bind bind) {
            var slot = Arrays.binarySearch(variables, bind.variable());
            if (seen.add(bind.variable())) {
                return (value, slots) -> {
                    slots[slot] = value;
                    return true;
                };
            }
            return (value, slots) -> Objects.deepEquals(slots[slot], value);
        }
        var nested = (Pattern.Nested) pattern;
        var children = new CompiledPattern.Matcher[nested.elements().size()];
        for (var i = 0; i < children.length; i++) {
            children[i] = compileMatcher(nested.elements().get(i), variables, seen);
        }
        var arity = children.length;
        return (value, slots) -> {
            if (!(value instanceof Tuple tuple) || tuple.arity() != arity) {
                return false;
            }
            for (var i = 0; i < arity; i++) {
                if (!children[i].match(tuple.element(i + 1), slots)) {
                    return false;
                }
            }
            return true;
        };
    }

    /**
     * @return the compiled expression, or null when it is invalid for {@code head}
     */
    private static CompiledSpec.Eval compileExpr(Expr expr, CompiledPattern head) {
        if (expr instanceof Expr.Const constant) {
            var value = constant.value();
            return (record, slots) -> value;
        }
        if (expr instanceof Expr.Var variable) {
            var slot = head.slotOf(variable.variable());
            if (slot < 0) {
                return null;
            }
            return (record, slots) -> slots[slot];
        }
        if (expr instanceof Expr.WholeRecord) {
            return (record, slots) -> record;
        }
        if (expr instanceof Expr.AllBindings) {
            return (record, slots) -> CompiledPattern.bindings(slots.clone());
        }
        if (expr instanceof Expr.TupleOf tupleOf) {
            var elements = compileAll(tupleOf.elements(), head);
            if (elements == null) {
                return null;
            }
            return (record, slots) -> {
                var values = new Object[elements.size()];
                for (var i = 0; i < values.length; i++) {
                    values[i] = elements.get(i).eval(record, slots);
                }
                return Tuple.of(values);
            };
        }
        var call = (Expr.Call) expr;
        var op = call.op();
        if (call.args().size() != op.arity()) {
            return null;
        }
        var args = compileAll(call.args(), head);
        if (args == null) {
            return null;
        }
        return switch (op) {
            case ANDALSO -> (record, slots) -> {
                var left = args.get(0).eval(record, slots);
                if (Boolean.FALSE.equals(left)) {
                    return false;
                }
                return ExprEvaluator.apply(Op.AND, new Object[]{left, args.get(1).eval(record, slots)});
            };
            case ORELSE -> (record, slots) -> {
                var left = args.get(0).eval(record, slots);
                if (Boolean.TRUE.equals(left)) {
                    return true;
                }
                return ExprEvaluator.apply(Op.OR, new Object[]{left, args.get(1).eval(record, slots)});
            };
            default -> (record, slots) -> {
                var values = new Object[args.size()];
                for (var i = 0; i < values.length; i++) {
                    values[i] = args.get(i).eval(record, slots);
                }
                return ExprEvaluator.apply(op, values);
            };
        };
    }

    private static List<CompiledSpec.Eval> compileAll(List<Expr> exprs, CompiledPattern head) {
        var compiled = new ArrayList<CompiledSpec.Eval>(exprs.size());
        for (var expr : exprs) {
            var eval = compileExpr(expr, head);
            if (eval == null) {
                return null;
            }
            compiled.add(eval);
        }
        return compiled;
    }
}
