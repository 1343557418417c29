package com.vidnyan.hdlint.domain.flow;

import com.vidnyan.hdlint.domain.model.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Structural recognition of edge-detection predicates:
 * {@code rising_edge(s)}, {@code falling_edge(s)}, and {@code s'event and s = '1'}
 * (or {@code '0'}) with the operands in either order.
 */
public final class EdgePredicates {

    private EdgePredicates() {
    }

    /**
     * Match a whole condition against the edge predicate forms.
     */
    public static Optional<ClockGuard> match(Expression condition) {
        if (condition instanceof Expression.Call call && call.arguments().size() == 1
                && call.arguments().get(0) instanceof Expression.Name signal) {
            return switch (call.name().toLowerCase(Locale.ROOT)) {
                case "rising_edge" -> Optional.of(new ClockGuard(signal.identifier(), EdgeKind.RISING));
                case "falling_edge" -> Optional.of(new ClockGuard(signal.identifier(), EdgeKind.FALLING));
                default -> Optional.empty();
            };
        }
        if (condition instanceof Expression.Binary binary && "and".equals(binary.operator())) {
            Optional<ClockGuard> guard = eventAndLevel(binary.left(), binary.right());
            return guard.isPresent() ? guard : eventAndLevel(binary.right(), binary.left());
        }
        return Optional.empty();
    }

    /**
     * All edge predicates occurring anywhere inside an expression.
     */
    public static List<ClockGuard> findAll(Expression expression) {
        List<ClockGuard> found = new ArrayList<>();
        collect(expression, found);
        return found;
    }

    private static void collect(Expression expression, List<ClockGuard> into) {
        Optional<ClockGuard> direct = match(expression);
        if (direct.isPresent()) {
            into.add(direct.get());
            return;
        }
        switch (expression.kind()) {
            case UNARY -> collect(((Expression.Unary) expression).operand(), into);
            case BINARY -> {
                Expression.Binary binary = (Expression.Binary) expression;
                collect(binary.left(), into);
                collect(binary.right(), into);
            }
            case CALL -> ((Expression.Call) expression).arguments().forEach(a -> collect(a, into));
            default -> { }
        }
    }

    private static Optional<ClockGuard> eventAndLevel(Expression event, Expression level) {
        if (!(event instanceof Expression.Attribute attribute)
                || !"event".equalsIgnoreCase(attribute.attribute())) {
            return Optional.empty();
        }
        if (!(level instanceof Expression.Binary comparison) || !"=".equals(comparison.operator())) {
            return Optional.empty();
        }
        Optional<Character> bit = levelOf(attribute.prefix(), comparison.left(), comparison.right());
        if (bit.isEmpty()) {
            bit = levelOf(attribute.prefix(), comparison.right(), comparison.left());
        }
        return bit.map(b -> new ClockGuard(attribute.prefix(), b == '1' ? EdgeKind.RISING : EdgeKind.FALLING));
    }

    private static Optional<Character> levelOf(String signal, Expression name, Expression literal) {
        if (name instanceof Expression.Name n && n.identifier().equals(signal)
                && literal instanceof Expression.Literal l && l.type() == Expression.LiteralType.BIT
                && ("0".equals(l.text()) || "1".equals(l.text()))) {
            return Optional.of(l.text().charAt(0));
        }
        return Optional.empty();
    }
}
