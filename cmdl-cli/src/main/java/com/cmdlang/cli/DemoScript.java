package com.cmdlang.cli;

/**
 * 不带脚本参数或使用 {@code --demo} 时运行的示例脚本
 */
final class DemoScript {

    static final String FILE_NAME = "<demo>";

    static final String SOURCE =
            "# demo script\n" +
            "text \"Starting demo...\"\n" +
            "text \"This line should appear.\"\n" +
            "\n" +
            "loop(3):\n" +
            "    text \"Inside loop, counting\"\n" +
            "\n" +
            "set x = 5\n" +
            "math x = x + 2\n" +
            "text \"x is now: \", x\n" +
            "\n" +
            "if x = 7:\n" +
            "    text \"If statement works!\"\n" +
            "else:\n" +
            "    text \"If failed!\"\n" +
            "\n" +
            "text \"Pausing 1.5 seconds...\"\n" +
            "pause(1.5)\n" +
            "\n" +
            "text \"Clearing screen in 1 second...\"\n" +
            "pause(1)\n" +
            "clear\n" +
            "text \"Screen was cleared!\"\n" +
            "text \"Demo finished.\"\n";

    private DemoScript() {}
}
