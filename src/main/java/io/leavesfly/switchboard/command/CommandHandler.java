package io.leavesfly.switchboard.command;

import java.util.List;

/**
 * 元命令处理器
 * 实现类标注 @Component 后由 Spring 自动注册到 {@link CommandRegistry}
 */
public interface CommandHandler {

    /**
     * 命令名称（不含 / 前缀）
     */
    String getName();

    /**
     * 命令描述
     */
    String getDescription();

    /**
     * 命令别名
     */
    default List<String> getAliases() {
        return List.of();
    }

    /**
     * 用法说明，用于 /help
     */
    default String getUsage() {
        return "/" + getName();
    }

    /**
     * 执行命令
     */
    void execute(CommandContext context) throws Exception;
}
