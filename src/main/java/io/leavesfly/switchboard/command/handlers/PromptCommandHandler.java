package io.leavesfly.switchboard.command.handlers;

import io.leavesfly.switchboard.command.CommandContext;
import io.leavesfly.switchboard.command.CommandHandler;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * /prompt 命令处理器
 */
@Component
public class PromptCommandHandler implements CommandHandler {

    @Override
    public String getName() {
        return "prompt";
    }

    @Override
    public String getDescription() {
        return "获取提示词";
    }

    @Override
    public String getUsage() {
        return "/prompt <name> [json-args]";
    }

    @Override
    public void execute(CommandContext context) {
        String name = context.getArg(0);
        if (name == null) {
            context.getOutputFormatter().printError("用法: " + getUsage());
            return;
        }
        Map<String, Object> args = context.parseJsonArgs(context.getRestAfterFirstArg());
        InvocationSupport.run(context, name, context.getRouter().getPrompt(name, args, null));
    }
}
