package cmdl.runtime.interpreter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 记录所有终端副作用的测试替身。readLine 从预置输入中取行。
 */
class RecordingTerminal implements TerminalEffects {

    final List<String> lines = new ArrayList<>();
    final List<TerminalColor> colors = new ArrayList<>();
    final List<String> prompts = new ArrayList<>();
    final List<Double> sleeps = new ArrayList<>();
    final List<String> diagnostics = new ArrayList<>();
    final Deque<String> input = new ArrayDeque<>();
    int clears;

    @Override
    public void write(String line) {
        lines.add(line);
    }

    @Override
    public void setColor(TerminalColor color) {
        colors.add(color);
    }

    @Override
    public void clearScreen() {
        clears++;
    }

    @Override
    public String readLine(String prompt) {
        prompts.add(prompt);
        return input.poll();
    }

    @Override
    public void sleep(double seconds) {
        sleeps.add(seconds);
    }

    @Override
    public void diagnostic(String message) {
        diagnostics.add(message);
    }
}
