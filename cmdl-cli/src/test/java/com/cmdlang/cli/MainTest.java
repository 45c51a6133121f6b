package com.cmdlang.cli;

import cmdl.runtime.interpreter.ConsoleTerminal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * CLI 端到端测试
 */
class MainTest {

    @TempDir
    Path dir;

    private ByteArrayOutputStream terminalOut;
    private ByteArrayOutputStream terminalErr;
    private StringWriter out;
    private StringWriter err;
    private String stdin;

    @BeforeEach
    void setUp() {
        terminalOut = new ByteArrayOutputStream();
        terminalErr = new ByteArrayOutputStream();
        out = new StringWriter();
        err = new StringWriter();
        stdin = "";
    }

    private int run(String... args) {
        Main main = new Main(() -> new ConsoleTerminal(
                new PrintStream(terminalOut, true),
                new PrintStream(terminalErr, true),
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8))));
        CommandLine cmd = new CommandLine(main);
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    private String terminalText() {
        return new String(terminalOut.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private Path script(String name, String source) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, source.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Nested
    @DisplayName("脚本文件")
    class ScriptFileTests {

        @Test
        @DisplayName("执行脚本并返回 0")
        void testRunScript() throws IOException {
            Path file = script("hello.cmdl", "set x = 5\nmath x = x + 2\ntext \"x = \", x\n");
            assertThat(run(file.toString())).isEqualTo(0);
            assertThat(terminalText()).isEqualTo("x = 7\n");
        }

        @Test
        @DisplayName("exit 也返回 0")
        void testExitCode() throws IOException {
            Path file = script("exit.cmdl", "text \"a\"\nexit\ntext \"b\"\n");
            assertThat(run(file.toString())).isEqualTo(0);
            assertThat(terminalText()).isEqualTo("a\n");
        }

        @Test
        @DisplayName("文件不存在时输出用法并返回 1")
        void testMissingFile() {
            String missing = dir.resolve("nope.cmdl").toString();
            assertThat(run(missing)).isEqualTo(1);
            assertThat(err.toString())
                    .startsWith("File not found: " + missing)
                    .contains("Usage: cmdl");
        }

        @Test
        @DisplayName("运行时错误输出 ERROR 并返回 1")
        void testRuntimeError() throws IOException {
            Path file = script("bad.cmdl", "text \"before\"\ngoto nowhere\n");
            assertThat(run(file.toString())).isEqualTo(1);
            assertThat(err.toString()).startsWith("ERROR: Unknown label: nowhere");
            assertThat(terminalText()).isEqualTo("before\n");
        }

        @Test
        @DisplayName("解析错误输出 ERROR 并返回 1")
        void testParseError() throws IOException {
            Path file = script("orphan.cmdl", "else:\n    text \"x\"\n");
            assertThat(run(file.toString())).isEqualTo(1);
            assertThat(err.toString()).startsWith("ERROR: ");
            assertThat(terminalText()).isEmpty();
        }

        @Test
        @DisplayName("--max-steps 限制无出口循环")
        void testMaxSteps() throws IOException {
            Path file = script("forever.cmdl", "loop:\n    set x = 1\n");
            assertThat(run("--max-steps", "50", file.toString())).isEqualTo(1);
            assertThat(err.toString()).startsWith("ERROR: Step limit exceeded (50 steps");
        }

        @Test
        @DisplayName("负的 --max-steps 被拒绝")
        void testNegativeMaxSteps() throws IOException {
            Path file = script("ok.cmdl", "text \"ok\"\n");
            assertThat(run("--max-steps", "-1", file.toString())).isEqualTo(2);
            assertThat(terminalText()).isEmpty();
        }

        @Test
        @DisplayName("--hold 结束后等待回车")
        void testHold() throws IOException {
            stdin = "\n";
            Path file = script("hold.cmdl", "text \"done\"\n");
            assertThat(run("--hold", file.toString())).isEqualTo(0);
            assertThat(terminalText()).isEqualTo("done\n" + ScriptRunner.HOLD_PROMPT);
        }
    }

    @Nested
    @DisplayName("示例脚本")
    class DemoTests {

        @Test
        @DisplayName("无参数运行示例")
        void testNoArguments() {
            assertThat(run("--no-sleep")).isEqualTo(0);
            assertThat(out.toString()).startsWith("Running demo script...");
            assertThat(terminalText())
                    .contains("Inside loop, counting\nInside loop, counting\nInside loop, counting\n")
                    .contains("x is now: 7\n")
                    .contains("If statement works!\n")
                    .doesNotContain("If failed!")
                    .endsWith("Screen was cleared!\nDemo finished.\n");
        }

        @Test
        @DisplayName("--demo 忽略脚本参数")
        void testDemoFlag() {
            assertThat(run("-d", "--no-sleep", "ignored.cmdl")).isEqualTo(0);
            assertThat(out.toString()).startsWith("Running demo script...");
            assertThat(err.toString()).doesNotContain("File not found");
        }
    }

    @Test
    @DisplayName("--version")
    void testVersion() {
        assertThat(run("--version")).isEqualTo(0);
        assertThat(out.toString()).contains("cmdl 0.1.0");
    }
}
