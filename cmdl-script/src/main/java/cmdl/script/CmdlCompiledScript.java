package cmdl.script;

import com.cmdlang.compiler.ast.Program;

import javax.script.CompiledScript;
import javax.script.ScriptContext;
import javax.script.ScriptEngine;
import javax.script.ScriptException;

/**
 * 预解析的 cmdl 脚本，可以在不同的 ScriptContext 中多次执行。
 */
public class CmdlCompiledScript extends CompiledScript {

    private final CmdlScriptEngine engine;
    private final Program program;

    CmdlCompiledScript(CmdlScriptEngine engine, Program program) {
        this.engine = engine;
        this.program = program;
    }

    @Override
    public Object eval(ScriptContext context) throws ScriptException {
        return engine.execute(program, context);
    }

    @Override
    public ScriptEngine getEngine() {
        return engine;
    }

    public Program getProgram() {
        return program;
    }
}
