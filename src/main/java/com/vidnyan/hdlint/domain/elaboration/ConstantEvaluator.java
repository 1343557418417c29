package com.vidnyan.hdlint.domain.elaboration;

import com.vidnyan.hdlint.domain.model.Expression;

import java.util.Map;
import java.util.Set;

/**
 * Evaluates elaboration-time expressions (generic values, widths, generate bounds and
 * conditions) against an environment of resolved constants.
 * Booleans are stored in the environment as 1 and 0.
 */
public final class ConstantEvaluator {

    private static final Set<String> RELATIONAL = Set.of("=", "/=", "<", "<=", ">", ">=");
    private static final Set<String> LOGICAL = Set.of("and", "or", "xor", "nand", "nor", "xnor");

    private final Map<String, Long> environment;

    public ConstantEvaluator(Map<String, Long> environment) {
        this.environment = environment;
    }

    /**
     * Raised when an expression has no constant value of the requested type.
     * {@link #getUnresolvedName()} is set when the cause is a name missing from the environment.
     */
    public static class NotConstantException extends RuntimeException {
        private final String unresolvedName;

        NotConstantException(String message, String unresolvedName) {
            super(message);
            this.unresolvedName = unresolvedName;
        }

        public String getUnresolvedName() {
            return unresolvedName;
        }

        public boolean isUnresolvedName() {
            return unresolvedName != null;
        }
    }

    /**
     * Integer value of an arithmetic expression.
     */
    public long integerValue(Expression expression) {
        switch (expression.kind()) {
            case LITERAL -> {
                Expression.Literal literal = (Expression.Literal) expression;
                if (literal.type() != Expression.LiteralType.INTEGER) {
                    throw notConstant(expression, "is not an integer");
                }
                return parseInteger(literal);
            }
            case NAME -> {
                return lookup((Expression.Name) expression);
            }
            case UNARY -> {
                Expression.Unary unary = (Expression.Unary) expression;
                long operand = integerValue(unary.operand());
                try {
                    return switch (unary.operator()) {
                        case "-" -> Math.negateExact(operand);
                        case "+" -> operand;
                        case "abs" -> Math.absExact(operand);
                        default -> throw notConstant(expression, "is not an integer");
                    };
                } catch (ArithmeticException e) {
                    throw notConstant(expression, "cannot be evaluated: " + e.getMessage());
                }
            }
            case BINARY -> {
                return arithmetic((Expression.Binary) expression);
            }
            default -> throw notConstant(expression, "is not a constant expression");
        }
    }

    /**
     * Truth value of a condition.
     */
    public boolean booleanValue(Expression expression) {
        switch (expression.kind()) {
            case LITERAL -> {
                Expression.Literal literal = (Expression.Literal) expression;
                if (literal.type() != Expression.LiteralType.BOOLEAN) {
                    throw notConstant(expression, "is not a boolean");
                }
                return Boolean.parseBoolean(literal.text());
            }
            case NAME -> {
                return lookup((Expression.Name) expression) != 0;
            }
            case UNARY -> {
                Expression.Unary unary = (Expression.Unary) expression;
                if (!"not".equals(unary.operator())) {
                    throw notConstant(expression, "is not a boolean");
                }
                return !booleanValue(unary.operand());
            }
            case BINARY -> {
                Expression.Binary binary = (Expression.Binary) expression;
                if (RELATIONAL.contains(binary.operator())) {
                    return compare(binary);
                }
                if (LOGICAL.contains(binary.operator())) {
                    return logical(binary);
                }
                throw notConstant(expression, "is not a boolean");
            }
            default -> throw notConstant(expression, "is not a constant expression");
        }
    }

    /**
     * Value of a generic actual or default. Bit and bit-string literals are taken as their
     * unsigned value and conditions as 1 or 0.
     */
    public long genericValue(Expression expression) {
        if (expression instanceof Expression.Literal literal) {
            return switch (literal.type()) {
                case INTEGER -> parseInteger(literal);
                case BIT -> "1".equals(literal.text()) ? 1 : 0;
                case BIT_STRING -> parseBits(literal);
                case BOOLEAN -> Boolean.parseBoolean(literal.text()) ? 1 : 0;
            };
        }
        if (isCondition(expression)) {
            return booleanValue(expression) ? 1 : 0;
        }
        return integerValue(expression);
    }

    private static boolean isCondition(Expression expression) {
        if (expression instanceof Expression.Binary binary) {
            return RELATIONAL.contains(binary.operator()) || LOGICAL.contains(binary.operator());
        }
        return expression instanceof Expression.Unary unary && "not".equals(unary.operator());
    }

    private long lookup(Expression.Name name) {
        Long value = environment.get(name.identifier());
        if (value == null) {
            throw new NotConstantException("'" + name.identifier() + "' has no constant value",
                    name.identifier());
        }
        return value;
    }

    private long arithmetic(Expression.Binary binary) {
        String op = binary.operator();
        if (RELATIONAL.contains(op) || LOGICAL.contains(op)) {
            throw notConstant(binary, "is a condition, not an integer");
        }
        long left = integerValue(binary.left());
        long right = integerValue(binary.right());
        try {
            return switch (op) {
                case "+" -> Math.addExact(left, right);
                case "-" -> Math.subtractExact(left, right);
                case "*" -> Math.multiplyExact(left, right);
                case "/" -> left / right;
                case "mod" -> Math.floorMod(left, right);
                case "rem" -> left % right;
                case "**" -> power(left, right);
                default -> throw notConstant(binary, "uses operator '" + op + "' outside integer arithmetic");
            };
        } catch (ArithmeticException e) {
            throw notConstant(binary, "cannot be evaluated: " + e.getMessage());
        }
    }

    private long power(long base, long exponent) {
        if (exponent < 0) {
            throw new ArithmeticException("negative exponent");
        }
        if (base == 0 || base == 1) {
            return exponent == 0 ? 1 : base;
        }
        if (base == -1) {
            return exponent % 2 == 0 ? 1 : -1;
        }
        // |base| >= 2 overflows a long beyond 63 multiplications
        if (exponent > Long.SIZE) {
            throw new ArithmeticException("long overflow");
        }
        long result = 1;
        for (long i = 0; i < exponent; i++) {
            result = Math.multiplyExact(result, base);
        }
        return result;
    }

    private boolean compare(Expression.Binary binary) {
        long left = integerValue(binary.left());
        long right = integerValue(binary.right());
        return switch (binary.operator()) {
            case "=" -> left == right;
            case "/=" -> left != right;
            case "<" -> left < right;
            case "<=" -> left <= right;
            case ">" -> left > right;
            default -> left >= right;
        };
    }

    private boolean logical(Expression.Binary binary) {
        boolean left = booleanValue(binary.left());
        boolean right = booleanValue(binary.right());
        return switch (binary.operator()) {
            case "and" -> left && right;
            case "or" -> left || right;
            case "xor" -> left ^ right;
            case "nand" -> !(left && right);
            case "nor" -> !(left || right);
            default -> left == right;
        };
    }

    private long parseInteger(Expression.Literal literal) {
        try {
            return Long.parseLong(literal.text().replace("_", ""));
        } catch (NumberFormatException e) {
            throw notConstant(literal, "is out of range");
        }
    }

    private long parseBits(Expression.Literal literal) {
        String bits = literal.text().replace("_", "");
        if (bits.isEmpty() || bits.length() > 63 || !bits.matches("[01]+")) {
            throw notConstant(literal, "is not a binary value");
        }
        return Long.parseLong(bits, 2);
    }

    private NotConstantException notConstant(Expression expression, String reason) {
        return new NotConstantException("'" + expression + "' " + reason, null);
    }
}
