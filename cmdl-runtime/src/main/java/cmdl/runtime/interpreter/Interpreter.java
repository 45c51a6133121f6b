package cmdl.runtime.interpreter;

import cmdl.runtime.CmdlValue;
import com.cmdlang.compiler.analysis.JumpTarget;
import com.cmdlang.compiler.analysis.LabelIndex;
import com.cmdlang.compiler.analysis.LabelTable;
import com.cmdlang.compiler.ast.Block;
import com.cmdlang.compiler.ast.ConditionalArm;
import com.cmdlang.compiler.ast.ConditionalNode;
import com.cmdlang.compiler.ast.LabelNode;
import com.cmdlang.compiler.ast.LoopNode;
import com.cmdlang.compiler.ast.Node;
import com.cmdlang.compiler.ast.NodeVisitor;
import com.cmdlang.compiler.ast.Program;
import com.cmdlang.compiler.ast.StatementNode;
import com.cmdlang.compiler.expr.ExpressionContext;
import com.cmdlang.compiler.parser.Parser;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * cmdl 树遍历解释器
 *
 * <p>每个节点的执行结果是一个 {@link ExecutionSignal}。循环和条件把子块产生的
 * JUMP / RETURN_TO_CALLER 原样向上传递，由 {@link #run(Program, VariableStore)}
 * 的运行循环把游标 (块, 下标) 移到跳转目标。</p>
 *
 * <p>步数计数：顶层运行循环中每个正常完成的节点计一步，无限 {@code loop:}
 * 的每次迭代及其循环体内完成的节点也计步；跳转本身不计步，也不清零。
 * 计数循环只受次数约束。超过 {@link ExecutionPolicy#getMaxSteps()} 抛出
 * {@link StepLimitExceededException}。</p>
 *
 * <p>实例不是线程安全的。</p>
 */
public class Interpreter implements NodeVisitor<ExecutionSignal, Void> {

    private static final Logger LOG = Logger.getLogger(Interpreter.class.getName());

    private final ExecutionPolicy policy;
    private final TerminalEffects terminal;
    private final ExpressionEvaluator evaluator;
    private final CommandRegistry commands = new CommandRegistry();

    // 单次运行的状态
    private VariableStore variables = new VariableStore();
    private LabelTable labels;
    private long steps;
    private int infiniteLoopDepth;

    public Interpreter() {
        this(ExecutionPolicy.standard(), new ConsoleTerminal());
    }

    public Interpreter(ExecutionPolicy policy, TerminalEffects terminal) {
        this.policy = policy;
        this.terminal = terminal;
        this.evaluator = new ExpressionEvaluator(policy.getExpressionCacheSize());
        Builtins.register(commands);
    }

    // ============ 宿主 API ============

    /** 注册或覆盖命令 */
    public void registerCommand(String name, CommandHandler handler) {
        commands.register(name, handler);
    }

    public CommandRegistry getCommands() {
        return commands;
    }

    public ExecutionPolicy getPolicy() {
        return policy;
    }

    public TerminalEffects getTerminal() {
        return terminal;
    }

    /** 当前（或最近一次）运行的变量表 */
    public VariableStore getVariables() {
        return variables;
    }

    public ExpressionEvaluator getEvaluator() {
        return evaluator;
    }

    /**
     * 解析并以新的变量表运行源码
     */
    public RunResult run(String source, String fileName) {
        return run(Parser.parse(source, fileName), new VariableStore());
    }

    public RunResult run(Program program) {
        return run(program, new VariableStore());
    }

    /**
     * 在给定变量表上运行程序。标签在执行前统一建立索引，向前跳转也能解析。
     *
     * @return COMPLETED 执行到末尾；EXITED 被 {@code exit} 终止
     * @throws com.cmdlang.compiler.parser.ParseException 标签重复
     * @throws CmdlRuntimeException 运行时错误
     */
    public RunResult run(Program program, VariableStore store) {
        this.variables = store;
        this.labels = LabelIndex.build(program);
        this.steps = 0;
        this.infiniteLoopDepth = 0;
        LOG.fine(() -> "Running " + program.getFileName() + " (" + labels.size() + " labels, " + policy + ")");

        Block block = program.getRoot();
        int index = 0;
        try {
            while (true) {
                // 游标越过当前块末尾即结束，跳入的嵌套块也一样
                if (index >= block.size()) {
                    break;
                }
                Node node = block.get(index);
                ExecutionSignal signal = execute(node);
                if (signal.isJump()) {
                    JumpTarget target = signal.getTarget();
                    block = target.getBlock();
                    index = target.getIndex();
                    continue;
                }
                // 顶层的 RETURN_TO_CALLER 按 CONTINUE 处理
                index++;
                countStep(node);
            }
        } catch (ScriptExit exit) {
            LOG.fine(() -> "Script " + program.getFileName() + " exited");
            return RunResult.EXITED;
        }
        LOG.fine(() -> "Script " + program.getFileName() + " completed");
        return RunResult.COMPLETED;
    }

    // ============ 命令使用的服务 ============

    /**
     * 在当前变量表上求值表达式
     */
    public CmdlValue evaluate(String expression, ExpressionContext context) {
        return evaluator.evaluate(expression, context, variables);
    }

    /**
     * 构造跳转到标签的信号
     *
     * @throws UnknownLabelException 标签不存在
     */
    public ExecutionSignal jumpTo(String label) {
        JumpTarget target = labels == null ? null : labels.lookup(label);
        if (target == null) {
            throw new UnknownLabelException(label);
        }
        LOG.fine(() -> "goto " + label);
        return ExecutionSignal.jump(target);
    }

    /** 按策略睡眠，负数按 0 处理 */
    public void sleep(double seconds) {
        if (!policy.isSleepAllowed()) {
            LOG.fine(() -> "Skipping pause of " + seconds + "s (sleep disabled)");
            return;
        }
        terminal.sleep(Math.max(0.0, seconds));
    }

    // ============ 节点执行 ============

    private ExecutionSignal execute(Node node) {
        try {
            return node.accept(this, null);
        } catch (CmdlRuntimeException e) {
            e.attachLocation(node.getLocation(), node.getSourceText());
            throw e;
        }
    }

    /** 顺序执行块，遇到非 CONTINUE 信号立即返回 */
    private ExecutionSignal executeBlock(Block body) {
        for (int i = 0; i < body.size(); i++) {
            Node node = body.get(i);
            ExecutionSignal signal = execute(node);
            if (!signal.isContinue()) {
                return signal;
            }
            if (infiniteLoopDepth > 0) {
                countStep(node);
            }
        }
        return ExecutionSignal.CONTINUE;
    }

    private void countStep(Node node) {
        steps++;
        if (policy.isStepLimited() && steps > policy.getMaxSteps()) {
            LOG.fine(() -> "Step limit " + policy.getMaxSteps() + " exceeded at " + node.getLocation());
            StepLimitExceededException e = new StepLimitExceededException(policy.getMaxSteps(), node.getSourceText());
            e.attachLocation(node.getLocation(), node.getSourceText());
            throw e;
        }
    }

    @Override
    public ExecutionSignal visitLabel(LabelNode node, Void context) {
        return ExecutionSignal.CONTINUE;
    }

    @Override
    public ExecutionSignal visitStatement(StatementNode node, Void context) {
        StatementCall call = StatementCall.parse(node.getRaw());
        if (call == null) {
            reportUnknown(node, node.getRaw());
            return ExecutionSignal.CONTINUE;
        }
        CommandHandler handler = commands.lookup(call.getCommand());
        if (handler == null) {
            reportUnknown(node, call.getCommand());
            return ExecutionSignal.CONTINUE;
        }
        return handler.execute(this, call);
    }

    private void reportUnknown(StatementNode node, String command) {
        String message = "Unknown command: " + command + " (raw: " + node.getRaw() + ")";
        LOG.log(Level.WARNING, "{0} at {1}", new Object[]{message, node.getLocation()});
        terminal.diagnostic(message);
    }

    @Override
    public ExecutionSignal visitLoop(LoopNode node, Void context) {
        if (node.isInfinite()) {
            infiniteLoopDepth++;
            try {
                while (true) {
                    ExecutionSignal signal = executeBlock(node.getBody());
                    if (!signal.isContinue()) {
                        return signal;
                    }
                    countStep(node);
                }
            } finally {
                infiniteLoopDepth--;
            }
        }
        long times = resolveLoopCount(node.getCountSpec());
        for (long i = 0; i < times; i++) {
            ExecutionSignal signal = executeBlock(node.getBody());
            if (!signal.isContinue()) {
                return signal;
            }
        }
        return ExecutionSignal.CONTINUE;
    }

    /** 数字字面量、变量值或算术表达式，截断为整数 */
    private long resolveLoopCount(String spec) {
        String text = spec.trim();
        CmdlValue value;
        if (Numerals.isNumber(text)) {
            value = Numerals.parse(text);
        } else {
            value = evaluate(text, ExpressionContext.ARITHMETIC);
        }
        if (!Numerals.isNumeric(value)) {
            throw new ExpressionException(text, "loop count is not a number: " + value.getTypeName());
        }
        double count = Numerals.toNumber(value).doubleValue();
        if (Double.isNaN(count) || Double.isInfinite(count)) {
            throw new ExpressionException(text, "loop count is not finite");
        }
        return Numerals.toNumber(value).longValue();
    }

    @Override
    public ExecutionSignal visitConditional(ConditionalNode node, Void context) {
        for (ConditionalArm arm : node.getArms()) {
            if (!arm.hasCondition() || evaluator.test(arm.getCondition(), variables)) {
                return executeBlock(arm.getBody());
            }
        }
        return ExecutionSignal.CONTINUE;
    }
}
