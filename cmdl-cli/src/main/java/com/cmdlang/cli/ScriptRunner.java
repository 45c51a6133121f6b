package com.cmdlang.cli;

import cmdl.runtime.CmdlException;
import cmdl.runtime.interpreter.ExecutionPolicy;
import cmdl.runtime.interpreter.Interpreter;
import cmdl.runtime.interpreter.RunResult;
import cmdl.runtime.interpreter.TerminalEffects;
import com.cmdlang.compiler.parser.ParseException;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * 脚本执行器，返回进程退出码
 */
public class ScriptRunner {

    private static final Logger LOG = Logger.getLogger(ScriptRunner.class.getName());

    static final String HOLD_PROMPT = "Script finished. Press Enter to exit...";

    private final ExecutionPolicy policy;
    private final TerminalEffects terminal;
    private final PrintWriter err;

    public ScriptRunner(ExecutionPolicy policy, TerminalEffects terminal, PrintWriter err) {
        this.policy = policy;
        this.terminal = terminal;
        this.err = err;
    }

    /**
     * 执行脚本文件
     *
     * @return 0 正常结束或 exit；1 出错
     */
    public int runScript(Path path) {
        String source;
        try {
            source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return fail("Cannot read " + path + ": " + e.getMessage());
        }
        return runSource(source, path.toString());
    }

    public int runDemo() {
        return runSource(DemoScript.SOURCE, DemoScript.FILE_NAME);
    }

    int runSource(String source, String fileName) {
        try {
            RunResult result = new Interpreter(policy, terminal).run(source, fileName);
            LOG.fine(() -> fileName + " finished: " + result);
            return 0;
        } catch (ParseException | CmdlException | UncheckedIOException e) {
            return fail(e.getMessage());
        }
    }

    /** {@code --hold}：结束后等待回车 */
    public void hold() {
        terminal.readLine(HOLD_PROMPT);
    }

    private int fail(String message) {
        err.println("ERROR: " + message);
        err.flush();
        return 1;
    }
}
