package cmdl.runtime.interpreter;

import cmdl.runtime.CmdlException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * 基于标准流的终端：ANSI 转义设置颜色和清屏。
 */
public class ConsoleTerminal implements TerminalEffects {

    private static final String CLEAR_SCREEN = "\u001b[H\u001b[2J";

    private final PrintStream out;
    private final PrintStream err;
    private final BufferedReader in;

    public ConsoleTerminal() {
        this(System.out, System.err, System.in);
    }

    public ConsoleTerminal(PrintStream out, PrintStream err, InputStream in) {
        this.out = out;
        this.err = err;
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    @Override
    public void write(String line) {
        out.println(line);
    }

    @Override
    public void setColor(TerminalColor color) {
        out.print(color.toAnsi());
        out.flush();
    }

    @Override
    public void clearScreen() {
        out.print(CLEAR_SCREEN);
        out.flush();
    }

    @Override
    public String readLine(String prompt) {
        out.print(prompt);
        out.flush();
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read from console", e);
        }
    }

    @Override
    public void sleep(double seconds) {
        sleepSeconds(seconds);
    }

    /** 阻塞当前线程。被中断时恢复中断标志并抛出 {@link CmdlException} */
    public static void sleepSeconds(double seconds) {
        long millis = (long) (seconds * 1000);
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CmdlException("Interrupted while pausing", e);
        }
    }

    @Override
    public void diagnostic(String message) {
        err.println(message);
    }
}
