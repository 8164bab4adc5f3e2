package io.leavesfly.switchboard.ui.shell.input;

import io.leavesfly.switchboard.ui.shell.ShellContext;

/**
 * 输入处理器
 * ShellUI 按优先级（数值越小越先）选择第一个能处理输入的处理器
 */
public interface InputProcessor {

    boolean canProcess(String input);

    int getPriority();

    /**
     * 处理输入
     *
     * @return 是否继续运行
     */
    boolean process(String input, ShellContext context) throws Exception;
}
