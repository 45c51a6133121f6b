package cmdl.runtime;

import cmdl.runtime.interpreter.CommandHandler;
import cmdl.runtime.interpreter.ConsoleTerminal;
import cmdl.runtime.interpreter.ExecutionPolicy;
import cmdl.runtime.interpreter.Interpreter;
import cmdl.runtime.interpreter.RunResult;
import cmdl.runtime.interpreter.TerminalEffects;
import cmdl.runtime.interpreter.VariableStore;
import com.cmdlang.compiler.ast.Program;
import com.cmdlang.compiler.parser.Parser;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * cmdl 便捷 API，一行代码执行脚本。
 *
 * <p>静态调用（每次创建临时实例，输出到控制台）：</p>
 * <pre>
 * Cmdl.run("text \"hello\"");
 * Cmdl.runFile("demo.cmdl");
 * </pre>
 *
 * <p>实例调用（变量表在多次运行之间保留）：</p>
 * <pre>
 * Cmdl cmdl = new Cmdl(ExecutionPolicy.standard(), terminal);
 * cmdl.set("name", "Alice");
 * cmdl.eval("text \"Hello, \", name");
 * Object x = cmdl.get("x");
 * </pre>
 */
public final class Cmdl {

    private final Interpreter interpreter;
    private final VariableStore variables = new VariableStore();

    public Cmdl() {
        this(ExecutionPolicy.standard(), new ConsoleTerminal());
    }

    public Cmdl(ExecutionPolicy policy, TerminalEffects terminal) {
        this.interpreter = new Interpreter(policy, terminal);
    }

    // ── 静态便捷方法 ─────────────────────────────────────

    public static RunResult run(String source) {
        return new Cmdl().eval(source);
    }

    public static RunResult runFile(String path) {
        return new Cmdl().evalFile(Paths.get(path));
    }

    // ── 变量操作 ─────────────────────────────────────────

    /** 设置变量，Java 值按 {@link CmdlValue#fromJava(Object)} 转换 */
    public Cmdl set(String name, Object value) {
        variables.setJava(name, value);
        return this;
    }

    /**
     * @return 变量的 Java 值，未定义返回 null
     */
    public Object get(String name) {
        CmdlValue value = variables.lookup(name);
        return value == null ? null : value.toJavaValue();
    }

    public Map<String, Object> getAll() {
        return variables.toJavaMap();
    }

    public VariableStore getVariables() {
        return variables;
    }

    /** 注册宿主命令 */
    public Cmdl defineCommand(String name, CommandHandler handler) {
        interpreter.registerCommand(name, handler);
        return this;
    }

    public Interpreter getInterpreter() {
        return interpreter;
    }

    // ── 执行 ────────────────────────────────────────────

    public RunResult eval(String source) {
        return eval(source, "<script>");
    }

    public RunResult eval(String source, String fileName) {
        return execute(Parser.parse(source, fileName));
    }

    public RunResult evalFile(Path path) {
        String source;
        try {
            source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read script: " + path, e);
        }
        return eval(source, path.getFileName().toString());
    }

    /** 执行已解析的程序，变量表沿用本实例的 */
    public RunResult execute(Program program) {
        return interpreter.run(program, variables);
    }
}
