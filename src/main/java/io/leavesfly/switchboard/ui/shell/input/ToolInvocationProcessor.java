package io.leavesfly.switchboard.ui.shell.input;

import io.leavesfly.switchboard.command.CommandContext;
import io.leavesfly.switchboard.command.CommandHandler;
import io.leavesfly.switchboard.command.CommandRegistry;
import io.leavesfly.switchboard.ui.shell.ShellContext;

import java.util.Optional;

/**
 * 工具调用输入处理器
 * 处理其他所有输入，格式为 {@code <name> [json-args]}，等价于 /call
 */
public class ToolInvocationProcessor implements InputProcessor {

    private final CommandRegistry commandRegistry;

    public ToolInvocationProcessor(CommandRegistry commandRegistry) {
        this.commandRegistry = commandRegistry;
    }

    @Override
    public boolean canProcess(String input) {
        // 默认处理器
        return true;
    }

    @Override
    public int getPriority() {
        return 100;
    }

    @Override
    public boolean process(String input, ShellContext context) throws Exception {
        Optional<CommandHandler> call = commandRegistry.find("call");
        if (call.isEmpty()) {
            context.getOutputFormatter().printError("无法处理输入: " + input);
            return true;
        }
        String[] parts = input.split("\\s+");
        call.get().execute(CommandContext.builder()
                .router(context.getRouter())
                .rawInput(input)
                .commandName("call")
                .argsString(input)
                .args(parts)
                .outputFormatter(context.getOutputFormatter())
                .objectMapper(context.getObjectMapper())
                .commandRegistry(commandRegistry)
                .build());
        return true;
    }
}
