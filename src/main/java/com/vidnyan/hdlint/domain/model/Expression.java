package com.vidnyan.hdlint.domain.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Expression tree of signal references, constants and operators.
 * Traversals dispatch on {@link #kind()}.
 */
public sealed interface Expression permits
        Expression.Name,
        Expression.Literal,
        Expression.Unary,
        Expression.Binary,
        Expression.Call,
        Expression.Attribute,
        Expression.Aggregate {

    enum Kind {
        NAME,
        LITERAL,
        UNARY,
        BINARY,
        CALL,
        ATTRIBUTE,
        AGGREGATE
    }

    Kind kind();

    /**
     * Reference to a signal, port, generic, constant or loop variable.
     */
    record Name(String identifier) implements Expression {
        @Override
        public Kind kind() {
            return Kind.NAME;
        }

        @Override
        public String toString() {
            return identifier;
        }
    }

    record Literal(LiteralType type, String text) implements Expression {
        @Override
        public Kind kind() {
            return Kind.LITERAL;
        }

        @Override
        public String toString() {
            return switch (type) {
                case BIT -> "'" + text + "'";
                case BIT_STRING -> "\"" + text + "\"";
                default -> text;
            };
        }
    }

    enum LiteralType {
        INTEGER,
        BIT,
        BIT_STRING,
        BOOLEAN
    }

    record Unary(String operator, Expression operand) implements Expression {
        @Override
        public Kind kind() {
            return Kind.UNARY;
        }

        @Override
        public String toString() {
            return Character.isLetter(operator.charAt(0))
                    ? operator + " " + operand
                    : operator + operand;
        }
    }

    record Binary(String operator, Expression left, Expression right) implements Expression {
        @Override
        public Kind kind() {
            return Kind.BINARY;
        }

        @Override
        public String toString() {
            return wrap(left) + " " + operator + " " + wrap(right);
        }

        private static String wrap(Expression e) {
            return e.kind() == Kind.BINARY ? "(" + e + ")" : e.toString();
        }
    }

    /**
     * Function call or indexed name, e.g. {@code rising_edge(clk)} or {@code data(i)}.
     * Which of the two it is depends on whether {@code name} is a signal in scope.
     */
    record Call(String name, List<Expression> arguments) implements Expression {
        public Call {
            arguments = List.copyOf(arguments);
        }

        @Override
        public Kind kind() {
            return Kind.CALL;
        }

        @Override
        public String toString() {
            return name + arguments.stream()
                    .map(Expression::toString)
                    .collect(Collectors.joining(", ", "(", ")"));
        }
    }

    /**
     * Predefined attribute such as {@code clk'event}.
     */
    record Attribute(String prefix, String attribute) implements Expression {
        @Override
        public Kind kind() {
            return Kind.ATTRIBUTE;
        }

        @Override
        public String toString() {
            return prefix + "'" + attribute;
        }
    }

    /**
     * Aggregate such as {@code (others => '0')}; only the element values are kept.
     */
    record Aggregate(List<Expression> elements) implements Expression {
        public Aggregate {
            elements = List.copyOf(elements);
        }

        @Override
        public Kind kind() {
            return Kind.AGGREGATE;
        }

        @Override
        public String toString() {
            return elements.stream()
                    .map(Expression::toString)
                    .collect(Collectors.joining(", ", "(", ")"));
        }
    }

    static Name name(String identifier) {
        return new Name(identifier);
    }

    static Literal integer(long value) {
        return new Literal(LiteralType.INTEGER, Long.toString(value));
    }

    static Literal bit(char value) {
        return new Literal(LiteralType.BIT, String.valueOf(value));
    }

    static Binary binary(String operator, Expression left, Expression right) {
        return new Binary(operator, left, right);
    }

    static Call call(String name, Expression... arguments) {
        return new Call(name, List.of(arguments));
    }
}
