package cmdl.script;

import cmdl.runtime.Cmdl;
import cmdl.runtime.CmdlException;
import cmdl.runtime.CmdlValue;
import cmdl.runtime.interpreter.CmdlRuntimeException;
import cmdl.runtime.interpreter.ExecutionPolicy;
import cmdl.runtime.interpreter.RunResult;
import com.cmdlang.compiler.ast.Program;
import com.cmdlang.compiler.ast.SourceLocation;
import com.cmdlang.compiler.parser.ParseException;
import com.cmdlang.compiler.parser.Parser;

import javax.script.AbstractScriptEngine;
import javax.script.Bindings;
import javax.script.Compilable;
import javax.script.CompiledScript;
import javax.script.ScriptContext;
import javax.script.ScriptEngine;
import javax.script.ScriptEngineFactory;
import javax.script.ScriptException;
import javax.script.SimpleBindings;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.logging.Logger;

/**
 * cmdl 的 JSR-223 ScriptEngine 实现。
 *
 * <p>委托 {@link Cmdl} 实现核心功能：</p>
 * <ul>
 *   <li>{@code eval()} 解析并执行，返回 {@link RunResult}</li>
 *   <li>{@code compile()} 只解析一次，之后可多次执行</li>
 * </ul>
 *
 * <p>每次执行前变量表被清空并载入 ENGINE_SCOPE 中的数字、文本和布尔；
 * 执行结束后整个变量表写回 ENGINE_SCOPE。输出写到上下文的 writer。</p>
 */
public class CmdlScriptEngine extends AbstractScriptEngine implements Compilable {

    private static final Logger LOG = Logger.getLogger(CmdlScriptEngine.class.getName());
    private static final String DEFAULT_FILE_NAME = "<script>";

    private final CmdlScriptEngineFactory factory;
    private final ScriptContextTerminal terminal = new ScriptContextTerminal();
    private final Cmdl cmdl;

    public CmdlScriptEngine(CmdlScriptEngineFactory factory) {
        this(factory, ExecutionPolicy.standard());
    }

    public CmdlScriptEngine(CmdlScriptEngineFactory factory, ExecutionPolicy policy) {
        this.factory = factory;
        this.cmdl = new Cmdl(policy, terminal);
    }

    @Override
    public Object eval(String script, ScriptContext context) throws ScriptException {
        return execute(parse(script, fileName(context)), context);
    }

    @Override
    public Object eval(Reader reader, ScriptContext context) throws ScriptException {
        return eval(readAll(reader), context);
    }

    @Override
    public Bindings createBindings() {
        return new SimpleBindings();
    }

    @Override
    public ScriptEngineFactory getFactory() {
        return factory;
    }

    // ---- Compilable ----

    @Override
    public CompiledScript compile(String script) throws ScriptException {
        return new CmdlCompiledScript(this, parse(script, fileName(context)));
    }

    @Override
    public CompiledScript compile(Reader reader) throws ScriptException {
        return compile(readAll(reader));
    }

    /** 指定文件名解析，错误信息中显示该文件名 */
    public CompiledScript compileFile(String source, String fileName) throws ScriptException {
        return new CmdlCompiledScript(this, parse(source, fileName));
    }

    Cmdl getCmdl() {
        return cmdl;
    }

    // ---- 内部方法 ----

    Object execute(Program program, ScriptContext context) throws ScriptException {
        terminal.attach(context);
        injectBindings(context);
        try {
            RunResult result = cmdl.execute(program);
            exportBindings(context);
            return result;
        } catch (ParseException e) {
            throw toScriptException(e);
        } catch (CmdlException | UncheckedIOException e) {
            throw toScriptException(e);
        }
    }

    private Program parse(String source, String fileName) throws ScriptException {
        try {
            return Parser.parse(source, fileName);
        } catch (ParseException e) {
            throw toScriptException(e);
        }
    }

    private void injectBindings(ScriptContext context) {
        cmdl.getVariables().clear();
        Bindings bindings = context.getBindings(ScriptContext.ENGINE_SCOPE);
        if (bindings == null) return;
        for (Map.Entry<String, Object> entry : bindings.entrySet()) {
            if (CmdlValue.isConvertible(entry.getValue())) {
                cmdl.set(entry.getKey(), entry.getValue());
            } else {
                LOG.fine(() -> "Skipping binding '" + entry.getKey() + "' of unsupported type");
            }
        }
    }

    private void exportBindings(ScriptContext context) {
        Bindings bindings = context.getBindings(ScriptContext.ENGINE_SCOPE);
        if (bindings == null) return;
        bindings.putAll(cmdl.getAll());
    }

    private static String fileName(ScriptContext context) {
        Object name = context == null ? null : context.getAttribute(ScriptEngine.FILENAME);
        return name != null ? name.toString() : DEFAULT_FILE_NAME;
    }

    static ScriptException toScriptException(ParseException e) {
        ScriptException se = new ScriptException(e.getRawMessage(), e.getFileName(), e.getLine());
        se.initCause(e);
        return se;
    }

    static ScriptException toScriptException(RuntimeException e) {
        ScriptException se;
        if (e instanceof CmdlRuntimeException && ((CmdlRuntimeException) e).getLocation() != null) {
            CmdlRuntimeException re = (CmdlRuntimeException) e;
            SourceLocation loc = re.getLocation();
            se = new ScriptException(re.getRawMessage(), loc.getFile(), loc.getLine(), loc.getColumn());
        } else {
            se = new ScriptException(e.getMessage());
        }
        se.initCause(e);
        return se;
    }

    private static String readAll(Reader reader) throws ScriptException {
        try {
            StringBuilder sb = new StringBuilder();
            char[] buf = new char[4096];
            int n;
            while ((n = reader.read(buf)) != -1) {
                sb.append(buf, 0, n);
            }
            return sb.toString();
        } catch (IOException e) {
            throw new ScriptException(e);
        }
    }
}
