package cmdl.script;

import cmdl.runtime.interpreter.RunResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.script.*;
import java.io.StringReader;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.*;

/**
 * cmdl JSR-223 ScriptEngine 集成测试
 */
class CmdlScriptEngineTest {

    private ScriptEngineManager manager;

    @BeforeEach
    void setUp() {
        manager = new ScriptEngineManager();
    }

    private ScriptEngine engineWithOutput(StringWriter out) {
        ScriptEngine engine = manager.getEngineByName("cmdl");
        engine.getContext().setWriter(out);
        return engine;
    }

    // ======== 引擎发现 ========

    @Test
    void discoverByName_cmdl() {
        ScriptEngine engine = manager.getEngineByName("cmdl");
        assertThat(engine).isNotNull();
        assertThat(engine).isInstanceOf(CmdlScriptEngine.class);
    }

    @Test
    void discoverByName_cmdlang() {
        assertThat(manager.getEngineByName("cmdlang")).isNotNull();
    }

    @Test
    void discoverByExtension() {
        assertThat(manager.getEngineByExtension("cmdl")).isNotNull();
    }

    @Test
    void discoverByMimeType() {
        assertThat(manager.getEngineByMimeType("application/x-cmdl")).isNotNull();
    }

    // ======== Factory 属性 ========

    @Test
    void factoryMetadata() {
        ScriptEngineFactory factory = manager.getEngineByName("cmdl").getFactory();
        assertThat(factory.getEngineName()).isEqualTo("cmdlang");
        assertThat(factory.getLanguageName()).isEqualTo("cmdl");
        assertThat(factory.getExtensions()).containsExactly("cmdl");
        assertThat(factory.getNames()).contains("cmdl", "cmdlang");
        assertThat(factory.getParameter(ScriptEngine.NAME)).isEqualTo("cmdl");
    }

    @Test
    void factoryOutputStatement() {
        ScriptEngineFactory factory = manager.getEngineByName("cmdl").getFactory();
        assertThat(factory.getOutputStatement("hello")).isEqualTo("echo hello");
        assertThat(factory.getProgram("set x = 1", "text x")).isEqualTo("set x = 1\ntext x\n");
    }

    // ======== eval ========

    @Test
    void evalWritesToContextWriter() throws ScriptException {
        StringWriter out = new StringWriter();
        ScriptEngine engine = engineWithOutput(out);
        Object result = engine.eval("loop(2):\n    text \"hi\"\n");
        assertThat(result).isEqualTo(RunResult.COMPLETED);
        assertThat(out.toString()).isEqualTo("hi\nhi\n");
    }

    @Test
    void evalFromReader() throws ScriptException {
        StringWriter out = new StringWriter();
        ScriptEngine engine = engineWithOutput(out);
        engine.eval(new StringReader("echo from reader\n"));
        assertThat(out.toString()).isEqualTo("from reader\n");
    }

    @Test
    void evalExitResult() throws ScriptException {
        ScriptEngine engine = engineWithOutput(new StringWriter());
        assertThat(engine.eval("exit\n")).isEqualTo(RunResult.EXITED);
    }

    // ======== Bindings ========

    @Test
    void bindingsAreVisibleToScript() throws ScriptException {
        StringWriter out = new StringWriter();
        ScriptEngine engine = engineWithOutput(out);
        engine.put("name", "World");
        engine.put("n", 4);
        engine.eval("text \"Hello, \", name\nmath n = n * 2\n");
        assertThat(out.toString()).isEqualTo("Hello, World\n");
        assertThat(engine.get("n")).isEqualTo(8L);
    }

    @Test
    void variablesExportedToBindings() throws ScriptException {
        ScriptEngine engine = engineWithOutput(new StringWriter());
        engine.eval("set greeting = \"hey\"\nmath ok = 1 < 2\nmath half = 1 / 2\n");
        assertThat(engine.get("greeting")).isEqualTo("hey");
        assertThat(engine.get("ok")).isEqualTo(true);
        assertThat(engine.get("half")).isEqualTo(0.5);
    }

    @Test
    void customBindingsPerEval() throws ScriptException {
        ScriptEngine engine = engineWithOutput(new StringWriter());
        Bindings bindings = engine.createBindings();
        bindings.put("x", 10);
        engine.eval("math y = x + 1\n", bindings);
        assertThat(bindings.get("y")).isEqualTo(11L);
    }

    @Test
    void unsupportedBindingIsSkipped() throws ScriptException {
        StringWriter out = new StringWriter();
        ScriptEngine engine = engineWithOutput(out);
        engine.put("thing", new Object());
        engine.eval("math v = thing + 1\n");
        assertThat(engine.get("v")).isEqualTo(1L);
    }

    // ======== Compilable ========

    @Test
    void compiledScriptRunsRepeatedly() throws ScriptException {
        StringWriter out = new StringWriter();
        ScriptEngine engine = engineWithOutput(out);
        CompiledScript compiled = ((Compilable) engine).compile("math x = x + 1\ntext x\n");

        engine.put("x", 1);
        compiled.eval();
        engine.put("x", 41);
        compiled.eval();

        assertThat(out.toString()).isEqualTo("2\n42\n");
        assertThat(compiled.getEngine()).isSameAs(engine);
    }

    @Test
    void compileFromReader() throws ScriptException {
        ScriptEngine engine = engineWithOutput(new StringWriter());
        CompiledScript compiled = ((Compilable) engine).compile(new StringReader("set a = 3\n"));
        compiled.eval();
        assertThat(engine.get("a")).isEqualTo(3L);
    }

    // ======== 错误处理 ========

    @Test
    void parseErrorHasLineNumber() {
        ScriptEngine engine = engineWithOutput(new StringWriter());
        assertThatThrownBy(() -> engine.eval("text \"ok\"\nelse:\n    text \"x\"\n"))
                .isInstanceOf(ScriptException.class)
                .satisfies(e -> assertThat(((ScriptException) e).getLineNumber()).isEqualTo(2));
    }

    @Test
    void runtimeErrorHasLineNumber() {
        ScriptEngine engine = engineWithOutput(new StringWriter());
        assertThatThrownBy(() -> engine.eval("text \"a\"\ngoto missing\n"))
                .isInstanceOf(ScriptException.class)
                .hasMessageContaining("Unknown label: missing")
                .satisfies(e -> assertThat(((ScriptException) e).getLineNumber()).isEqualTo(2));
    }

    @Test
    void compileErrorIsScriptException() {
        ScriptEngine engine = engineWithOutput(new StringWriter());
        assertThatThrownBy(() -> ((Compilable) engine).compile("if :\n"))
                .isInstanceOf(ScriptException.class);
    }

    @Test
    void unknownCommandGoesToErrorWriter() throws ScriptException {
        StringWriter err = new StringWriter();
        ScriptEngine engine = engineWithOutput(new StringWriter());
        engine.getContext().setErrorWriter(err);
        engine.eval("wobble\n");
        assertThat(err.toString()).startsWith("Unknown command: wobble");
    }

    @Test
    void pauseReadsFromContextReader() throws ScriptException {
        StringWriter out = new StringWriter();
        ScriptEngine engine = engineWithOutput(out);
        engine.getContext().setReader(new StringReader("\n"));
        engine.eval("pause\ntext \"resumed\"\n");
        assertThat(out.toString()).isEqualTo("Press Enter to continue...resumed\n");
    }
}
