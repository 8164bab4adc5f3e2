package io.leavesfly.switchboard.ui.shell.output;

import org.jline.terminal.Terminal;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStyle;

/**
 * 终端输出格式化器
 * 统一各类信息的颜色
 */
public class OutputFormatter {

    private final Terminal terminal;

    public OutputFormatter(Terminal terminal) {
        this.terminal = terminal;
    }

    public void println() {
        println("");
    }

    public void println(String text) {
        terminal.writer().println(text);
        terminal.flush();
    }

    /**
     * 打印成功信息（绿色）
     */
    public void printSuccess(String text) {
        print(text, AttributedStyle.DEFAULT.foreground(AttributedStyle.GREEN));
    }

    /**
     * 打印错误信息（红色）
     */
    public void printError(String text) {
        print(text, AttributedStyle.DEFAULT.foreground(AttributedStyle.RED));
    }

    /**
     * 打印信息（蓝色）
     */
    public void printInfo(String text) {
        print(text, AttributedStyle.DEFAULT.foreground(AttributedStyle.BLUE));
    }

    /**
     * 打印状态信息（黄色）
     */
    public void printStatus(String text) {
        print(text, AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW));
    }

    private void print(String text, AttributedStyle style) {
        terminal.writer().println(new AttributedString(text, style).toAnsi());
        terminal.flush();
    }
}
