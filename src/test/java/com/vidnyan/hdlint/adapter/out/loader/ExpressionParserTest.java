package com.vidnyan.hdlint.adapter.out.loader;

import com.vidnyan.hdlint.application.port.out.DesignLoader.DesignLoadException;
import com.vidnyan.hdlint.domain.model.Expression;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionParserTest {

    @Test
    void parse_ShouldBindLogicalOperatorsLooserThanRelational() {
        Expression e = ExpressionParser.parse("clk'event and clk = '1'");

        Expression.Binary and = assertInstanceOf(Expression.Binary.class, e);
        assertEquals("and", and.operator());
        assertEquals(new Expression.Attribute("clk", "event"), and.left());
        assertEquals(Expression.binary("=", Expression.name("clk"), Expression.bit('1')), and.right());
    }

    @Test
    void parse_ShouldRespectArithmeticPrecedence() {
        Expression e = ExpressionParser.parse("WIDTH * 2 - 1");

        assertEquals(Expression.binary("-",
                Expression.binary("*", Expression.name("WIDTH"), Expression.integer(2)),
                Expression.integer(1)), e);
    }

    @Test
    void parse_ShouldReadCallsAndIndexedNames() {
        Expression e = ExpressionParser.parse("rising_edge(clk)");
        assertEquals(Expression.call("rising_edge", Expression.name("clk")), e);

        Expression indexed = ExpressionParser.parse("data(i + 1)");
        Expression.Call call = assertInstanceOf(Expression.Call.class, indexed);
        assertEquals("data", call.name());
        assertEquals(1, call.arguments().size());
    }

    @Test
    void parse_ShouldNormalizeKeywordsButKeepIdentifiers() {
        Expression e = ExpressionParser.parse("NOT Enable OR Reset");

        Expression.Binary or = assertInstanceOf(Expression.Binary.class, e);
        assertEquals("or", or.operator());
        assertEquals(new Expression.Unary("not", Expression.name("Enable")), or.left());
        assertEquals(Expression.name("Reset"), or.right());
    }

    @Test
    void parse_ShouldConvertBasedBitStringsToBinary() {
        assertEquals(new Expression.Literal(Expression.LiteralType.BIT_STRING, "11110000"),
                ExpressionParser.parse("x\"F0\""));
        assertEquals(new Expression.Literal(Expression.LiteralType.BIT_STRING, "0101"),
                ExpressionParser.parse("\"01_01\""));
        assertEquals(new Expression.Literal(Expression.LiteralType.BIT_STRING, "111"),
                ExpressionParser.parse("o\"7\""));
    }

    @Test
    void parse_ShouldReadBooleansAndAggregates() {
        assertEquals(new Expression.Literal(Expression.LiteralType.BOOLEAN, "true"),
                ExpressionParser.parse("TRUE"));
        assertEquals(new Expression.Aggregate(List.of(Expression.bit('0'))),
                ExpressionParser.parse("(others => '0')"));
        assertEquals(Expression.name("a"), ExpressionParser.parse("((a))"));
    }

    @Test
    void parse_ShouldRejectMalformedInput() {
        DesignLoadException e = assertThrows(DesignLoadException.class, () -> ExpressionParser.parse("a +"));
        assertTrue(e.getMessage().contains("a +"));
        assertThrows(DesignLoadException.class, () -> ExpressionParser.parse("f(a"));
        assertThrows(DesignLoadException.class, () -> ExpressionParser.parse("a b"));
        assertThrows(DesignLoadException.class, () -> ExpressionParser.parse("a # b"));
        assertThrows(DesignLoadException.class, () -> ExpressionParser.parse(" "));
    }
}
