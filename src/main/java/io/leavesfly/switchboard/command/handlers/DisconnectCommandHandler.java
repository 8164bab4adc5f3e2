package io.leavesfly.switchboard.command.handlers;

import io.leavesfly.switchboard.command.CommandContext;
import io.leavesfly.switchboard.command.CommandHandler;
import io.leavesfly.switchboard.ui.shell.output.OutputFormatter;
import org.springframework.stereotype.Component;

/**
 * /disconnect 命令处理器
 */
@Component
public class DisconnectCommandHandler implements CommandHandler {

    @Override
    public String getName() {
        return "disconnect";
    }

    @Override
    public String getDescription() {
        return "断开并移除后端";
    }

    @Override
    public String getUsage() {
        return "/disconnect <id>";
    }

    @Override
    public void execute(CommandContext context) {
        OutputFormatter out = context.getOutputFormatter();
        String identifier = context.getArg(0);
        if (identifier == null) {
            out.printError("用法: " + getUsage());
            return;
        }
        if (context.getRouter().getBackend(identifier).isEmpty()) {
            out.printError("未注册的后端: " + identifier);
            return;
        }
        context.getRouter().removeBackend(identifier).block();
        out.printSuccess("✓ 已移除: " + identifier);
    }
}
