package io.leavesfly.switchboard.command.handlers;

import io.leavesfly.switchboard.command.CommandContext;
import io.leavesfly.switchboard.command.CommandHandler;
import io.leavesfly.switchboard.ui.shell.output.OutputFormatter;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * /help 命令处理器
 * 显示帮助信息
 */
@Component
public class HelpCommandHandler implements CommandHandler {

    @Override
    public String getName() {
        return "help";
    }

    @Override
    public String getDescription() {
        return "显示帮助信息";
    }

    @Override
    public List<String> getAliases() {
        return List.of("h", "?");
    }

    @Override
    public void execute(CommandContext context) {
        OutputFormatter out = context.getOutputFormatter();

        out.println();
        out.printSuccess("基本命令:");
        out.println("  exit, quit                 - 退出");
        out.println("  <name> [json-args]         - 直接调用工具（需审批）");
        out.println();

        out.printSuccess("元命令 (Meta Commands):");
        for (CommandHandler handler : context.getCommandRegistry().getAll()) {
            String usage = handler.getUsage();
            if (!handler.getAliases().isEmpty()) {
                usage += ", /" + String.join(", /", handler.getAliases());
            }
            out.println(String.format("  %-26s - %s", usage, handler.getDescription()));
        }
        out.println();

        out.printSuccess("审批:");
        out.println("  y - 批准    n - 拒绝    a - 批准并记住");
        out.println();
    }
}
