package cmdl.script;

import cmdl.runtime.interpreter.ConsoleTerminal;
import cmdl.runtime.interpreter.TerminalColor;
import cmdl.runtime.interpreter.TerminalEffects;

import javax.script.ScriptContext;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * 把终端副作用转到当前 {@link ScriptContext} 的 writer / errorWriter / reader。
 */
class ScriptContextTerminal implements TerminalEffects {

    private static final String CLEAR_SCREEN = "\u001b[H\u001b[2J";

    private ScriptContext context;
    private Reader rawReader;
    private BufferedReader reader;

    void attach(ScriptContext context) {
        this.context = context;
    }

    @Override
    public void write(String line) {
        print(context.getWriter(), line + "\n");
    }

    @Override
    public void setColor(TerminalColor color) {
        print(context.getWriter(), color.toAnsi());
    }

    @Override
    public void clearScreen() {
        print(context.getWriter(), CLEAR_SCREEN);
    }

    @Override
    public String readLine(String prompt) {
        print(context.getWriter(), prompt);
        Reader current = context.getReader();
        if (current == null) {
            return null;
        }
        // 同一个 Reader 复用缓冲，避免丢失已读入缓冲区的行
        if (current != rawReader) {
            rawReader = current;
            reader = current instanceof BufferedReader ? (BufferedReader) current : new BufferedReader(current);
        }
        try {
            return reader.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read from script context", e);
        }
    }

    @Override
    public void sleep(double seconds) {
        ConsoleTerminal.sleepSeconds(seconds);
    }

    @Override
    public void diagnostic(String message) {
        print(context.getErrorWriter(), message + "\n");
    }

    private static void print(Writer writer, String text) {
        if (writer == null) {
            return;
        }
        try {
            writer.write(text);
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write to script context", e);
        }
    }
}
