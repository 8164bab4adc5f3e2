package io.leavesfly.switchboard.command.handlers;

import io.leavesfly.switchboard.command.CommandContext;
import io.leavesfly.switchboard.command.CommandHandler;
import org.springframework.stereotype.Component;

/**
 * /read 命令处理器
 */
@Component
public class ReadCommandHandler implements CommandHandler {

    @Override
    public String getName() {
        return "read";
    }

    @Override
    public String getDescription() {
        return "读取资源";
    }

    @Override
    public String getUsage() {
        return "/read <uri>";
    }

    @Override
    public void execute(CommandContext context) {
        String uri = context.getArg(0);
        if (uri == null) {
            context.getOutputFormatter().printError("用法: " + getUsage());
            return;
        }
        InvocationSupport.run(context, uri, context.getRouter().readResource(uri, null));
    }
}
