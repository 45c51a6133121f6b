package com.cmdlang.cli;

import cmdl.runtime.CmdlException;
import cmdl.runtime.interpreter.ConsoleTerminal;
import cmdl.runtime.interpreter.TerminalColor;
import cmdl.runtime.interpreter.TerminalEffects;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.InfoCmp;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 基于 jline 的终端：清屏使用终端能力，读行支持行编辑。
 */
public class JLineTerminal implements TerminalEffects, AutoCloseable {

    private static final Logger LOG = Logger.getLogger(JLineTerminal.class.getName());

    private final Terminal terminal;
    private final LineReader reader;
    private final PrintWriter writer;
    private final PrintStream err;

    JLineTerminal(Terminal terminal, PrintStream err) {
        this.terminal = terminal;
        this.reader = LineReaderBuilder.builder().terminal(terminal).build();
        this.writer = terminal.writer();
        this.err = err;
    }

    /**
     * 打开系统终端；jline 初始化失败时回退到标准流
     */
    static TerminalEffects open() {
        try {
            return new JLineTerminal(TerminalBuilder.builder().system(true).build(), System.err);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Terminal initialisation failed, falling back to standard streams", e);
            return new ConsoleTerminal();
        }
    }

    @Override
    public void write(String line) {
        writer.println(line);
        writer.flush();
    }

    @Override
    public void setColor(TerminalColor color) {
        writer.print(color.toAnsi());
        writer.flush();
    }

    @Override
    public void clearScreen() {
        terminal.puts(InfoCmp.Capability.clear_screen);
        terminal.flush();
    }

    @Override
    public String readLine(String prompt) {
        try {
            return reader.readLine(prompt);
        } catch (EndOfFileException e) {
            return null;
        } catch (UserInterruptException e) {
            throw new CmdlException("Interrupted", e);
        }
    }

    @Override
    public void sleep(double seconds) {
        ConsoleTerminal.sleepSeconds(seconds);
    }

    @Override
    public void diagnostic(String message) {
        err.println(message);
    }

    @Override
    public void close() throws IOException {
        writer.print(TerminalColor.RESET.toAnsi());
        writer.flush();
        terminal.close();
    }
}
