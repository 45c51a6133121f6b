package cmdl.runtime;

import cmdl.runtime.interpreter.ConsoleTerminal;
import cmdl.runtime.interpreter.ExecutionPolicy;
import cmdl.runtime.interpreter.ExecutionSignal;
import cmdl.runtime.interpreter.RunResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Cmdl 便捷 API 测试
 */
class CmdlTest {

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private Cmdl cmdl;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        ConsoleTerminal terminal = new ConsoleTerminal(
                new PrintStream(out, true),
                new PrintStream(err, true),
                new ByteArrayInputStream(new byte[0]));
        cmdl = new Cmdl(ExecutionPolicy.standard(), terminal);
    }

    private String stdout() {
        return new String(out.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    @Test
    @DisplayName("Java 值传入变量表")
    void testSetAndGet() {
        cmdl.set("name", "Alice").set("n", 2);
        cmdl.eval("text \"Hi \", name\nmath n = n * 10\n");
        assertEquals("Hi Alice\n", stdout());
        assertEquals(20L, cmdl.get("n"));
        assertNull(cmdl.get("missing"));
    }

    @Test
    @DisplayName("变量在多次运行之间保留")
    void testStatePersists() {
        cmdl.eval("set x = 1\n");
        cmdl.eval("math x = x + 1\n");
        assertEquals(2L, cmdl.get("x"));
        assertEquals(1, cmdl.getAll().size());
    }

    @Test
    @DisplayName("实数和布尔导出为 Java 值")
    void testJavaValues() {
        cmdl.eval("math r = 1 / 4\nmath b = 1 < 2\n");
        assertEquals(0.25, cmdl.get("r"));
        assertEquals(Boolean.TRUE, cmdl.get("b"));
    }

    @Test
    @DisplayName("不支持的 Java 类型被拒绝")
    void testUnsupportedValue() {
        assertThrows(CmdlException.class, () -> cmdl.set("o", new Object()));
    }

    @Test
    @DisplayName("宿主命令")
    void testDefineCommand() {
        StringBuilder log = new StringBuilder();
        cmdl.defineCommand("log", (interp, call) -> {
            log.append(call.getArguments());
            return ExecutionSignal.CONTINUE;
        });
        cmdl.eval("log(hello)\n");
        assertEquals("hello", log.toString());
    }

    @Test
    @DisplayName("从文件执行")
    void testEvalFile(@TempDir Path dir) throws Exception {
        Path script = dir.resolve("hello.cmdl");
        Files.write(script, "text \"from file\"\nexit\ntext \"no\"\n".getBytes(StandardCharsets.UTF_8));
        assertEquals(RunResult.EXITED, cmdl.evalFile(script));
        assertEquals("from file\n", stdout());
    }

    @Test
    @DisplayName("颜色和清屏输出 ANSI 序列")
    void testAnsiOutput() {
        cmdl.eval("color red\nclear\n");
        assertEquals("\u001b[31m\u001b[H\u001b[2J", stdout());
    }

    @Test
    @DisplayName("未知命令写到错误流")
    void testDiagnosticToStderr() {
        cmdl.eval("bogus\n");
        assertTrue(new String(err.toByteArray(), StandardCharsets.UTF_8).startsWith("Unknown command: bogus"));
    }
}
