package cmdl.runtime.interpreter;

/**
 * 脚本可见的终端副作用：输出、颜色、清屏、读行和睡眠。
 *
 * <p>CLI 使用 JLine 实现，宿主程序和测试可以注入自己的实现。</p>
 */
public interface TerminalEffects {

    /** 输出一行 */
    void write(String line);

    void setColor(TerminalColor color);

    void clearScreen();

    /**
     * 显示提示并阻塞读取一行
     *
     * @return 读到的行，输入结束时返回 null
     */
    String readLine(String prompt);

    void sleep(double seconds);

    /** 非致命诊断信息，例如未知命令 */
    void diagnostic(String message);
}
