package cmdl.runtime.interpreter;

import cmdl.runtime.CmdlText;
import cmdl.runtime.CmdlValue;
import com.cmdlang.compiler.expr.ExpressionContext;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 内置命令注册
 */
public final class Builtins {

    public static final String PAUSE_PROMPT = "Press Enter to continue...";

    private static final Pattern ASSIGNMENT = Pattern.compile("^([A-Za-z_]\\w*)\\s*=\\s*(.+)$");
    private static final Pattern OPERATOR = Pattern.compile("[+\\-*/()]");
    private static final Pattern TRAILING_CALL = Pattern.compile("\\(\\)\\s*$");

    private Builtins() {}

    /**
     * 注册所有内置命令
     */
    public static void register(CommandRegistry registry) {
        // ============ 输出 ============

        // text "a", x, 'b' - 拼接引号文本和变量值后输出一行
        registry.register("text", (interp, call) -> {
            StringBuilder sb = new StringBuilder();
            for (String part : TextArguments.split(call.getArguments())) {
                if (part.isEmpty()) continue;
                if (TextArguments.isQuoted(part)) {
                    sb.append(TextArguments.unquote(part));
                } else {
                    sb.append(interp.getVariables().resolvePlain(part).asDisplayString());
                }
            }
            interp.getTerminal().write(sb.toString());
            return ExecutionSignal.CONTINUE;
        });

        // echo ... - 原样输出
        registry.register("echo", (interp, call) -> {
            interp.getTerminal().write(call.getArguments());
            return ExecutionSignal.CONTINUE;
        });

        // ============ 变量 ============

        // set name = value
        registry.register("set", (interp, call) -> {
            Matcher m = matchAssignment("set", call);
            String name = m.group(1);
            String value = m.group(2).trim();
            VariableStore vars = interp.getVariables();
            if (TextArguments.isQuoted(value)) {
                vars.set(name, CmdlText.of(TextArguments.unquote(value)));
            } else if (Numerals.isNumber(value)) {
                vars.set(name, Numerals.parse(value));
            } else if (OPERATOR.matcher(value).find()) {
                vars.set(name, interp.evaluate(value, ExpressionContext.ARITHMETIC));
            } else {
                CmdlValue existing = vars.lookup(value);
                vars.set(name, existing != null ? existing : CmdlText.of(value));
            }
            return ExecutionSignal.CONTINUE;
        });

        // math name = expr
        registry.register("math", (interp, call) -> {
            Matcher m = matchAssignment("math", call);
            interp.getVariables().set(m.group(1), interp.evaluate(m.group(2), ExpressionContext.ARITHMETIC));
            return ExecutionSignal.CONTINUE;
        });

        // ============ 控制流 ============

        // goto label / goto label()
        registry.register("goto", (interp, call) -> {
            String label = TRAILING_CALL.matcher(call.getArguments().trim()).replaceFirst("");
            return interp.jumpTo(label);
        });

        // exit - 立即结束运行
        registry.register("exit", (interp, call) -> {
            throw ScriptExit.INSTANCE;
        });

        // pause / pause 1.5 / pause seconds
        registry.register("pause", (interp, call) -> {
            String arg = call.getArguments().trim();
            if (arg.isEmpty()) {
                interp.getTerminal().readLine(PAUSE_PROMPT);
            } else if (Numerals.isNumber(arg)) {
                interp.sleep(Numerals.parse(arg).doubleValue());
            } else {
                CmdlValue value = interp.getVariables().lookup(arg);
                if (Numerals.isNumeric(value)) {
                    interp.sleep(Numerals.toNumber(value).doubleValue());
                } else {
                    interp.getTerminal().readLine(PAUSE_PROMPT);
                }
            }
            return ExecutionSignal.CONTINUE;
        });

        // ============ 终端 ============

        registry.register("clear", (interp, call) -> {
            interp.getTerminal().clearScreen();
            return ExecutionSignal.CONTINUE;
        });

        // color red / color rgb(255, 128, 0)
        registry.register("color", (interp, call) -> {
            interp.getTerminal().setColor(TerminalColor.parse(call.getArguments()));
            return ExecutionSignal.CONTINUE;
        });
    }

    private static Matcher matchAssignment(String command, StatementCall call) {
        Matcher m = ASSIGNMENT.matcher(call.getArguments());
        if (!m.matches()) {
            throw new ScriptSyntaxException("Bad " + command + " syntax", call.getRaw());
        }
        return m;
    }
}
