package com.cmdlang.cli;

import cmdl.runtime.interpreter.ExecutionPolicy;
import cmdl.runtime.interpreter.TerminalEffects;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * cmdl CLI 入口点（picocli）
 */
@Command(name = "cmdl", version = "cmdl 0.1.0",
         mixinStandardHelpOptions = true,
         description = "Runs a cmdl script. Without a script the built-in demo is run.")
public class Main implements Callable<Integer> {

    @Option(names = {"-d", "--demo"}, description = "Run the built-in demo script")
    boolean demo;

    @Option(names = "--hold", description = "Wait for Enter after the script finishes")
    boolean hold;

    @Option(names = "--max-steps", paramLabel = "N",
            description = "Maximum steps per run, 0 for no limit (default: ${DEFAULT-VALUE})")
    long maxSteps = ExecutionPolicy.DEFAULT_MAX_STEPS;

    @Option(names = "--no-sleep", description = "Skip timed pauses")
    boolean noSleep;

    @Option(names = "--verbose", description = "Log interpreter activity to stderr")
    boolean verbose;

    @Parameters(arity = "0..1", paramLabel = "script.cmdl", description = "Script file to run")
    String script;

    @Spec
    CommandSpec spec;

    private final Supplier<TerminalEffects> terminals;

    public Main() {
        this(JLineTerminal::open);
    }

    Main(Supplier<TerminalEffects> terminals) {
        this.terminals = terminals;
    }

    @Override
    public Integer call() throws Exception {
        if (maxSteps < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "--max-steps must not be negative: " + maxSteps);
        }
        LoggingSetup.configure(verbose);
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Path path = null;
        if (!demo && script != null) {
            path = Paths.get(script);
            if (!Files.exists(path)) {
                err.println("File not found: " + script);
                spec.commandLine().usage(err);
                err.flush();
                return 1;
            }
        }

        ExecutionPolicy policy = ExecutionPolicy.custom()
                .maxSteps(maxSteps)
                .allowSleep(!noSleep)
                .build();

        TerminalEffects terminal = terminals.get();
        try {
            ScriptRunner runner = new ScriptRunner(policy, terminal, err);
            int exitCode;
            if (path == null) {
                out.println("Running demo script...");
                out.println();
                out.flush();
                exitCode = runner.runDemo();
            } else {
                exitCode = runner.runScript(path);
            }
            if (hold && exitCode == 0) {
                runner.hold();
            }
            return exitCode;
        } finally {
            if (terminal instanceof AutoCloseable) {
                ((AutoCloseable) terminal).close();
            }
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
