package com.cmdlang.compiler.expr;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 表达式解析器单元测试
 */
class ExprParserTest {

    private String arithmetic(String source) {
        return ExprParser.parse(source, ExpressionContext.ARITHMETIC).toString();
    }

    private String condition(String source) {
        return ExprParser.parse(source, ExpressionContext.CONDITION).toString();
    }

    @Nested
    @DisplayName("优先级")
    class PrecedenceTests {

        @Test
        @DisplayName("乘除高于加减")
        void testArithmeticPrecedence() {
            assertEquals("(1 + (2 * 3))", arithmetic("1 + 2 * 3"));
            assertEquals("((1 - 2) - 3)", arithmetic("1 - 2 - 3"));
        }

        @Test
        @DisplayName("括号改变优先级")
        void testParentheses() {
            assertEquals("((1 + 2) * 3)", arithmetic("(1 + 2) * 3"));
        }

        @Test
        @DisplayName("一元负号")
        void testUnary() {
            assertEquals("((-x) * 2)", arithmetic("-x * 2"));
        }

        @Test
        @DisplayName("and 高于 or，not 高于 and")
        void testBooleanPrecedence() {
            assertEquals("(a or (b and (not c)))", condition("a or b and not c"));
        }

        @Test
        @DisplayName("链式比较展开为 and")
        void testChainedComparison() {
            assertEquals("((1 < x) and (x < 5))", condition("1 < x < 5"));
        }
    }

    @Nested
    @DisplayName("字面量")
    class LiteralTests {

        @Test
        @DisplayName("整数和实数")
        void testNumbers() {
            Literal i = (Literal) ExprParser.parse("42", ExpressionContext.ARITHMETIC);
            assertEquals(42L, i.getValue());
            Literal d = (Literal) ExprParser.parse("2.5", ExpressionContext.ARITHMETIC);
            assertEquals(2.5, d.getValue());
            Literal e = (Literal) ExprParser.parse("1e3", ExpressionContext.ARITHMETIC);
            assertEquals(1000.0, e.getValue());
        }

        @Test
        @DisplayName("单双引号字符串")
        void testStrings() {
            Literal a = (Literal) ExprParser.parse("\"hi there\"", ExpressionContext.CONDITION);
            assertEquals("hi there", a.getValue());
            Literal b = (Literal) ExprParser.parse("'x'", ExpressionContext.CONDITION);
            assertEquals("x", b.getValue());
        }

        @Test
        @DisplayName("字符串中的单词不是标识符")
        void testIdentifierInsideString() {
            Expression expr = ExprParser.parse("name = \"bob\"", ExpressionContext.CONDITION);
            BinaryExpr eq = (BinaryExpr) expr;
            assertInstanceOf(Identifier.class, eq.getLeft());
            assertInstanceOf(Literal.class, eq.getRight());
        }
    }

    @Nested
    @DisplayName("单个等号")
    class AssignTests {

        @Test
        @DisplayName("条件中单个 = 是相等比较")
        void testConditionEquals() {
            BinaryExpr expr = (BinaryExpr) ExprParser.parse("x = 7", ExpressionContext.CONDITION);
            assertEquals(BinaryExpr.BinaryOp.EQ, expr.getOperator());
        }

        @Test
        @DisplayName("算术上下文中单个 = 是语法错误")
        void testArithmeticAssignRejected() {
            assertThrows(ExprParseException.class,
                    () -> ExprParser.parse("y = 3", ExpressionContext.ARITHMETIC));
        }
    }

    @Nested
    @DisplayName("错误")
    class ErrorTests {

        @Test
        @DisplayName("括号不匹配")
        void testUnbalanced() {
            assertThrows(ExprParseException.class, () -> arithmetic("(1 + 2"));
            assertThrows(ExprParseException.class, () -> arithmetic("1 + 2)"));
        }

        @Test
        @DisplayName("不支持函数调用")
        void testFunctionCall() {
            ExprParseException e = assertThrows(ExprParseException.class, () -> arithmetic("len(x)"));
            assertTrue(e.getMessage().contains("Function calls"));
        }

        @Test
        @DisplayName("不支持成员访问")
        void testAttributeAccess() {
            assertThrows(ExprParseException.class, () -> arithmetic("x.y"));
        }

        @Test
        @DisplayName("未闭合字符串")
        void testUnterminatedString() {
            assertThrows(ExprParseException.class, () -> condition("\"abc"));
        }

        @Test
        @DisplayName("空表达式")
        void testEmpty() {
            assertThrows(ExprParseException.class, () -> arithmetic("   "));
        }
    }
}
