package io.leavesfly.switchboard.command.handlers;

import io.leavesfly.switchboard.command.CommandContext;
import io.leavesfly.switchboard.command.CommandHandler;
import io.leavesfly.switchboard.ui.shell.output.OutputFormatter;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * /prompts 命令处理器
 */
@Component
public class PromptsCommandHandler implements CommandHandler {

    @Override
    public String getName() {
        return "prompts";
    }

    @Override
    public String getDescription() {
        return "显示可用提示词列表";
    }

    @Override
    public void execute(CommandContext context) {
        OutputFormatter out = context.getOutputFormatter();
        List<String> prompts = context.getRouter().listAllPrompts();

        out.println();
        if (prompts.isEmpty()) {
            out.printInfo("没有可用的提示词");
            return;
        }
        out.printSuccess("可用提示词 (" + prompts.size() + "):");
        prompts.forEach(name -> out.println("  • " + name));
        out.println();
    }
}
