package cmdl.runtime.interpreter;

import cmdl.runtime.CmdlBoolean;
import cmdl.runtime.CmdlNumber;
import cmdl.runtime.CmdlText;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Numerals 与数字输出测试
 */
class NumeralsTest {

    @Test
    @DisplayName("识别数字文本")
    void testIsNumber() {
        assertTrue(Numerals.isNumber("5"));
        assertTrue(Numerals.isNumber(" -1.5 "));
        assertTrue(Numerals.isNumber(".5"));
        assertTrue(Numerals.isNumber("1e3"));
        assertFalse(Numerals.isNumber("abc"));
        assertFalse(Numerals.isNumber(""));
        assertFalse(Numerals.isNumber("1.2.3"));
    }

    @Test
    @DisplayName("有小数点或指数得到实数")
    void testParse() {
        assertTrue(Numerals.parse("42").isInteger());
        assertFalse(Numerals.parse("42.0").isInteger());
        assertEquals("1000.0", Numerals.parse("1e3").asDisplayString());
    }

    @Test
    @DisplayName("数字值视图")
    void testIsNumeric() {
        assertTrue(Numerals.isNumeric(CmdlNumber.of(1)));
        assertTrue(Numerals.isNumeric(CmdlBoolean.TRUE));
        assertTrue(Numerals.isNumeric(CmdlText.of("2")));
        assertFalse(Numerals.isNumeric(CmdlText.of("two")));
        assertFalse(Numerals.isNumeric(null));
        assertEquals(CmdlNumber.of(1), Numerals.toNumber(CmdlBoolean.TRUE));
    }

    @Test
    @DisplayName("布尔输出为 True / False")
    void testBooleanDisplay() {
        assertEquals("True", CmdlBoolean.TRUE.asDisplayString());
        assertEquals("False", CmdlBoolean.FALSE.asDisplayString());
    }
}
