package com.vidnyan.hdlint.adapter.out.loader;

import com.vidnyan.hdlint.application.port.out.DesignLoader.DesignLoadException;
import com.vidnyan.hdlint.domain.model.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Recursive descent parser for expressions written in source form, e.g.
 * {@code rising_edge(clk)}, {@code clk'event and clk = '1'} or {@code WIDTH * 2 - 1}.
 *
 * Precedence, loosest first: logical operators, relational operators, adding operators
 * ({@code + - &}), multiplying operators ({@code * / mod rem}), then {@code ** abs not}.
 * Keywords are case-insensitive and normalized to lower case; identifiers keep their spelling.
 */
public final class ExpressionParser {

    private static final Set<String> LOGICAL = Set.of("and", "or", "xor", "nand", "nor", "xnor");
    private static final Set<String> RELATIONAL = Set.of("=", "/=", "<", "<=", ">", ">=");
    private static final Set<String> MULTIPLYING = Set.of("*", "/", "mod", "rem");
    private static final Set<String> KEYWORDS = Set.of(
            "and", "or", "xor", "nand", "nor", "xnor", "not", "mod", "rem", "abs", "others", "true", "false");

    private final String source;
    private final List<Token> tokens;
    private int position;

    private ExpressionParser(String source) {
        this.source = source;
        this.tokens = new Lexer(source).tokenize();
    }

    /**
     * Parse one complete expression.
     * @throws DesignLoadException if the text is not a well-formed expression
     */
    public static Expression parse(String text) {
        if (text == null || text.isBlank()) {
            throw new DesignLoadException("Empty expression");
        }
        ExpressionParser parser = new ExpressionParser(text);
        Expression expression = parser.expression();
        if (parser.peek().type != TokenType.END) {
            throw parser.error("unexpected '" + parser.peek().text + "'");
        }
        return expression;
    }

    private Expression expression() {
        Expression left = relation();
        while (peek().type == TokenType.KEYWORD && LOGICAL.contains(peek().text)) {
            String operator = next().text;
            left = Expression.binary(operator, left, relation());
        }
        return left;
    }

    private Expression relation() {
        Expression left = simpleExpression();
        if (peek().type == TokenType.SYMBOL && RELATIONAL.contains(peek().text)) {
            String operator = next().text;
            return Expression.binary(operator, left, simpleExpression());
        }
        return left;
    }

    private Expression simpleExpression() {
        Expression left;
        if (isSymbol("-") || isSymbol("+")) {
            String sign = next().text;
            left = new Expression.Unary(sign, term());
        } else {
            left = term();
        }
        while (isSymbol("+") || isSymbol("-") || isSymbol("&")) {
            String operator = next().text;
            left = Expression.binary(operator, left, term());
        }
        return left;
    }

    private Expression term() {
        Expression left = factor();
        while (MULTIPLYING.contains(peek().text) && peek().type != TokenType.IDENTIFIER) {
            String operator = next().text;
            left = Expression.binary(operator, left, factor());
        }
        return left;
    }

    private Expression factor() {
        if (isKeyword("abs") || isKeyword("not")) {
            String operator = next().text;
            return new Expression.Unary(operator, primary());
        }
        Expression base = primary();
        if (isSymbol("**")) {
            next();
            return Expression.binary("**", base, primary());
        }
        return base;
    }

    private Expression primary() {
        Token token = next();
        switch (token.type) {
            case INTEGER -> {
                return new Expression.Literal(Expression.LiteralType.INTEGER, token.text);
            }
            case BIT -> {
                return new Expression.Literal(Expression.LiteralType.BIT, token.text);
            }
            case BIT_STRING -> {
                return new Expression.Literal(Expression.LiteralType.BIT_STRING, token.text);
            }
            case KEYWORD -> {
                if (token.text.equals("true") || token.text.equals("false")) {
                    return new Expression.Literal(Expression.LiteralType.BOOLEAN, token.text);
                }
                throw error("unexpected keyword '" + token.text + "'");
            }
            case IDENTIFIER -> {
                return name(token.text);
            }
            case SYMBOL -> {
                if (token.text.equals("(")) {
                    return parenthesized();
                }
                throw error("unexpected '" + token.text + "'");
            }
            default -> throw error("unexpected end of expression");
        }
    }

    /**
     * Name, optionally followed by an argument list and an attribute.
     */
    private Expression name(String identifier) {
        Expression result = Expression.name(identifier);
        if (isSymbol("(")) {
            next();
            List<Expression> arguments = new ArrayList<>();
            arguments.add(expression());
            while (isSymbol(",")) {
                next();
                arguments.add(expression());
            }
            expect(")");
            result = new Expression.Call(identifier, arguments);
        }
        if (isSymbol("'")) {
            next();
            Token attribute = next();
            if (attribute.type != TokenType.IDENTIFIER) {
                throw error("attribute name expected after '");
            }
            result = new Expression.Attribute(identifier, attribute.text.toLowerCase(Locale.ROOT));
        }
        return result;
    }

    /**
     * Parenthesized expression or aggregate. Aggregates keep only their element values.
     */
    private Expression parenthesized() {
        List<Expression> elements = new ArrayList<>();
        boolean aggregate = false;
        do {
            if (!elements.isEmpty() || aggregate) {
                next();
            }
            if (isKeyword("others")) {
                next();
                expect("=>");
                elements.add(expression());
                aggregate = true;
                continue;
            }
            Expression element = expression();
            if (isSymbol("=>")) {
                next();
                element = expression();
                aggregate = true;
            }
            elements.add(element);
        } while (isSymbol(","));
        expect(")");
        if (elements.size() == 1 && !aggregate) {
            return elements.get(0);
        }
        return new Expression.Aggregate(elements);
    }

    private boolean isSymbol(String text) {
        return peek().type == TokenType.SYMBOL && peek().text.equals(text);
    }

    private boolean isKeyword(String text) {
        return peek().type == TokenType.KEYWORD && peek().text.equals(text);
    }

    private void expect(String symbol) {
        if (!isSymbol(symbol)) {
            throw error("expected '" + symbol + "'");
        }
        next();
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token next() {
        Token token = tokens.get(position);
        if (token.type != TokenType.END) {
            position++;
        }
        return token;
    }

    private DesignLoadException error(String reason) {
        return new DesignLoadException(String.format("Malformed expression '%s' at column %d: %s",
                source, peek().column + 1, reason));
    }

    private enum TokenType {
        IDENTIFIER,
        KEYWORD,
        INTEGER,
        BIT,
        BIT_STRING,
        SYMBOL,
        END
    }

    private record Token(TokenType type, String text, int column) {}

    private static final class Lexer {

        private final String text;
        private final List<Token> tokens = new ArrayList<>();
        private int index;

        private Lexer(String text) {
            this.text = text;
        }

        List<Token> tokenize() {
            while (index < text.length()) {
                char c = text.charAt(index);
                int start = index;
                if (Character.isWhitespace(c)) {
                    index++;
                } else if (Character.isLetter(c)) {
                    word(start);
                } else if (Character.isDigit(c)) {
                    while (index < text.length() && (Character.isDigit(text.charAt(index)) || text.charAt(index) == '_')) {
                        index++;
                    }
                    tokens.add(new Token(TokenType.INTEGER, text.substring(start, index).replace("_", ""), start));
                } else if (c == '\'') {
                    tick(start);
                } else if (c == '"') {
                    tokens.add(new Token(TokenType.BIT_STRING, bitString('b', start), start));
                } else {
                    symbol(start);
                }
            }
            tokens.add(new Token(TokenType.END, "<end>", text.length()));
            return tokens;
        }

        private void word(int start) {
            while (index < text.length()
                    && (Character.isLetterOrDigit(text.charAt(index)) || text.charAt(index) == '_')) {
                index++;
            }
            String word = text.substring(start, index);
            String lower = word.toLowerCase(Locale.ROOT);
            if (index < text.length() && text.charAt(index) == '"' && lower.length() == 1 && "bxo".contains(lower)) {
                tokens.add(new Token(TokenType.BIT_STRING, bitString(lower.charAt(0), start), start));
            } else if (KEYWORDS.contains(lower)) {
                tokens.add(new Token(TokenType.KEYWORD, lower, start));
            } else {
                tokens.add(new Token(TokenType.IDENTIFIER, word, start));
            }
        }

        /**
         * A tick right after a name or closing parenthesis starts an attribute; anywhere else
         * it opens a character literal.
         */
        private void tick(int start) {
            Token previous = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
            boolean attribute = previous != null
                    && (previous.type == TokenType.IDENTIFIER || (previous.type == TokenType.SYMBOL && previous.text.equals(")")));
            if (attribute) {
                index++;
                tokens.add(new Token(TokenType.SYMBOL, "'", start));
                return;
            }
            if (index + 2 >= text.length() || text.charAt(index + 2) != '\'') {
                throw new DesignLoadException(String.format(
                        "Malformed expression '%s' at column %d: unterminated character literal", text, start + 1));
            }
            tokens.add(new Token(TokenType.BIT, String.valueOf(text.charAt(index + 1)), start));
            index += 3;
        }

        /**
         * Reads a quoted bit string at {@code index} and returns its value as binary digits.
         */
        private String bitString(char base, int start) {
            int close = text.indexOf('"', index + 1);
            if (close < 0) {
                throw new DesignLoadException(String.format(
                        "Malformed expression '%s' at column %d: unterminated string", text, start + 1));
            }
            String digits = text.substring(index + 1, close).replace("_", "");
            index = close + 1;
            int bitsPerDigit = switch (base) {
                case 'x' -> 4;
                case 'o' -> 3;
                default -> 1;
            };
            StringBuilder bits = new StringBuilder();
            for (char digit : digits.toCharArray()) {
                int value = Character.digit(digit, 1 << bitsPerDigit);
                if (value < 0) {
                    if (bitsPerDigit == 1) {
                        // std_logic strings such as "ZZZZ" are kept verbatim
                        bits.append(digit);
                        continue;
                    }
                    throw new DesignLoadException(String.format(
                            "Malformed expression '%s' at column %d: invalid digit '%c'", text, start + 1, digit));
                }
                String binary = Integer.toBinaryString(value);
                bits.append("0".repeat(bitsPerDigit - binary.length())).append(binary);
            }
            return bits.toString();
        }

        private void symbol(int start) {
            String two = index + 1 < text.length() ? text.substring(index, index + 2) : "";
            if (two.equals("**") || two.equals("/=") || two.equals("<=") || two.equals(">=") || two.equals("=>")) {
                tokens.add(new Token(TokenType.SYMBOL, two, start));
                index += 2;
                return;
            }
            char c = text.charAt(index);
            if ("+-*/&=<>(),".indexOf(c) < 0) {
                throw new DesignLoadException(String.format(
                        "Malformed expression '%s' at column %d: unexpected character '%c'", text, start + 1, c));
            }
            tokens.add(new Token(TokenType.SYMBOL, String.valueOf(c), start));
            index++;
        }
    }
}
