package cmdl.runtime.interpreter;

import cmdl.runtime.CmdlBoolean;
import cmdl.runtime.CmdlNumber;
import cmdl.runtime.CmdlText;
import cmdl.runtime.CmdlValue;
import com.cmdlang.compiler.expr.ExprParseException;
import com.cmdlang.compiler.expr.ExpressionContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ExpressionEvaluator 单元测试
 */
class ExpressionEvaluatorTest {

    private ExpressionEvaluator evaluator;
    private VariableStore vars;

    @BeforeEach
    void setUp() {
        evaluator = new ExpressionEvaluator(64);
        vars = new VariableStore();
    }

    private CmdlValue math(String text) {
        return evaluator.evaluate(text, ExpressionContext.ARITHMETIC, vars);
    }

    private CmdlValue cond(String text) {
        return evaluator.evaluate(text, ExpressionContext.CONDITION, vars);
    }

    @Nested
    @DisplayName("算术")
    class ArithmeticTests {

        @Test
        @DisplayName("优先级和括号")
        void testPrecedence() {
            assertEquals(CmdlNumber.of(7), math("1 + 2 * 3"));
            assertEquals(CmdlNumber.of(9), math("(1 + 2) * 3"));
            assertEquals(CmdlNumber.of(5), math("-(-5)"));
        }

        @Test
        @DisplayName("除法总是得到实数")
        void testTrueDivision() {
            assertEquals("3.5", math("7 / 2").asDisplayString());
            assertEquals("3.0", math("6 / 2").asDisplayString());
        }

        @Test
        @DisplayName("取模与除数同号")
        void testFloorModulo() {
            assertEquals(CmdlNumber.of(2), math("-7 % 3"));
            assertEquals(CmdlNumber.of(-2), math("7 % -3"));
            assertEquals("1.5", math("7.5 % 2").asDisplayString());
        }

        @Test
        @DisplayName("实数输出形式")
        void testRealDisplay() {
            assertEquals("0.30000000000000004", math("0.1 + 0.2").asDisplayString());
            assertEquals("2.5", math("1 + 1.5").asDisplayString());
        }

        @Test
        @DisplayName("布尔参与算术视为 1 / 0")
        void testBooleanArithmetic() {
            assertEquals(CmdlNumber.of(2), math("(3 > 2) + 1"));
        }

        @Test
        @DisplayName("文本拼接")
        void testConcatenation() {
            assertEquals(CmdlText.of("ab"), math("'a' + \"b\""));
        }

        @Test
        @DisplayName("除零和溢出报错")
        void testArithmeticErrors() {
            ExpressionException div = assertThrows(ExpressionException.class, () -> math("1 / 0"));
            assertEquals("1 / 0", div.getExpression());
            assertTrue(div.getMessage().contains("division by zero"));
            assertThrows(ExpressionException.class, () -> math("5 % 0"));
            assertThrows(ExpressionException.class, () -> math("9223372036854775807 + 1"));
        }

        @Test
        @DisplayName("类型不匹配报错")
        void testTypeErrors() {
            assertThrows(ExpressionException.class, () -> math("'a' + 1"));
            assertThrows(ExpressionException.class, () -> math("'a' * 2"));
            assertThrows(ExpressionException.class, () -> math("-'a'"));
        }
    }

    @Nested
    @DisplayName("变量替换")
    class VariableTests {

        @Test
        @DisplayName("未定义变量为 0")
        void testUndefinedIsZero() {
            assertEquals(CmdlNumber.of(1), math("missing + 1"));
        }

        @Test
        @DisplayName("算术中数字文本按数字处理，条件中保持文本")
        void testNumericTextByContext() {
            vars.set("s", CmdlText.of("3"));
            assertEquals(CmdlNumber.of(4), math("s + 1"));
            assertEquals(CmdlBoolean.FALSE, cond("s == 3"));
            assertEquals(CmdlBoolean.TRUE, cond("s == '3'"));
        }
    }

    @Nested
    @DisplayName("比较和逻辑")
    class LogicTests {

        @Test
        @DisplayName("链式比较")
        void testChained() {
            assertEquals(CmdlBoolean.TRUE, cond("2 < 3 < 4"));
            assertEquals(CmdlBoolean.FALSE, cond("3 < 2 < 4"));
        }

        @Test
        @DisplayName("and / or 返回决定结果的操作数")
        void testShortCircuitOperand() {
            assertEquals(CmdlNumber.of(0), cond("1 and 0"));
            assertEquals(CmdlNumber.of(5), cond("0 or 5"));
            assertEquals(CmdlBoolean.TRUE, cond("not 0"));
        }

        @Test
        @DisplayName("短路时不求值右侧")
        void testShortCircuitSkipsRight() {
            assertEquals(CmdlNumber.of(0), cond("0 and 1 / 0"));
            assertEquals(CmdlNumber.of(1), cond("1 or 1 / 0"));
        }

        @Test
        @DisplayName("条件中单个 = 是相等比较")
        void testSingleEquals() {
            vars.set("x", CmdlNumber.of(1));
            assertEquals(CmdlBoolean.TRUE, cond("x = 1"));
            assertThrows(ExpressionException.class, () -> math("x = 1"));
        }

        @Test
        @DisplayName("不同类型不相等，不能比较大小")
        void testMixedTypes() {
            assertEquals(CmdlBoolean.FALSE, cond("1 == 'a'"));
            assertEquals(CmdlBoolean.TRUE, cond("1 != 'a'"));
            assertThrows(ExpressionException.class, () -> cond("'a' < 1"));
        }

        @Test
        @DisplayName("文本按字典序比较")
        void testTextOrdering() {
            assertEquals(CmdlBoolean.TRUE, cond("'apple' < 'banana'"));
        }

        @Test
        @DisplayName("整数与实数比较")
        void testNumericEquality() {
            assertEquals(CmdlBoolean.TRUE, cond("2 == 2.0"));
            assertTrue(evaluator.test("3 >= 3", vars));
        }
    }

    @Nested
    @DisplayName("错误和缓存")
    class ParseAndCacheTests {

        @Test
        @DisplayName("语法错误包装解析异常")
        void testParseError() {
            ExpressionException e = assertThrows(ExpressionException.class, () -> math("1 +"));
            assertInstanceOf(ExprParseException.class, e.getCause());
            assertEquals("1 +", e.getExpression());
        }

        @Test
        @DisplayName("不支持函数调用")
        void testNoFunctionCalls() {
            assertThrows(ExpressionException.class, () -> math("foo(1)"));
        }

        @Test
        @DisplayName("相同表达式只解析一次")
        void testCacheHit() {
            vars.set("x", CmdlNumber.of(1));
            math("x + 1");
            vars.set("x", CmdlNumber.of(5));
            assertEquals(CmdlNumber.of(6), math("x + 1"));
            assertEquals(1L, evaluator.getCacheStats().getHitCount());
        }

        @Test
        @DisplayName("缓存按上下文区分")
        void testCacheKeyIncludesContext() {
            assertEquals(CmdlBoolean.TRUE, cond("1 = 1"));
            assertThrows(ExpressionException.class, () -> math("1 = 1"));
        }
    }
}
