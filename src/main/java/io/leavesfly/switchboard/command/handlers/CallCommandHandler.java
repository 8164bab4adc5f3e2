package io.leavesfly.switchboard.command.handlers;

import io.leavesfly.switchboard.command.CommandContext;
import io.leavesfly.switchboard.command.CommandHandler;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * /call 命令处理器
 * 按公开名称调用工具
 */
@Component
public class CallCommandHandler implements CommandHandler {

    @Override
    public String getName() {
        return "call";
    }

    @Override
    public String getDescription() {
        return "调用工具";
    }

    @Override
    public String getUsage() {
        return "/call <name> [json-args]";
    }

    @Override
    public void execute(CommandContext context) {
        String name = context.getArg(0);
        if (name == null) {
            context.getOutputFormatter().printError("用法: " + getUsage());
            return;
        }
        Map<String, Object> args = context.parseJsonArgs(context.getRestAfterFirstArg());
        InvocationSupport.run(context, name, context.getRouter().invoke(name, args));
    }
}
