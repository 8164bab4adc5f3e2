package io.leavesfly.switchboard.command.handlers;

import io.leavesfly.switchboard.command.CommandContext;
import io.leavesfly.switchboard.command.CommandHandler;
import io.leavesfly.switchboard.transport.ToolDescriptor;
import io.leavesfly.switchboard.ui.shell.output.OutputFormatter;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * /tools 命令处理器
 * 按公开名称列出全部工具
 */
@Component
public class ToolsCommandHandler implements CommandHandler {

    @Override
    public String getName() {
        return "tools";
    }

    @Override
    public String getDescription() {
        return "显示可用工具列表";
    }

    @Override
    public void execute(CommandContext context) {
        OutputFormatter out = context.getOutputFormatter();
        Map<String, ToolDescriptor> tools = context.getRouter().listAllTools();

        out.println();
        if (tools.isEmpty()) {
            out.printInfo("没有可用的工具");
            return;
        }
        out.printSuccess("可用工具 (" + tools.size() + "):");
        tools.forEach((name, tool) -> {
            String description = tool.getDescription();
            out.println("  • " + name + (description == null || description.isBlank() ? "" : "  - " + description));
        });
        out.println();
    }
}
