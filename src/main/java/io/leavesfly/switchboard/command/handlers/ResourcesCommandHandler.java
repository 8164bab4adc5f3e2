package io.leavesfly.switchboard.command.handlers;

import io.leavesfly.switchboard.command.CommandContext;
import io.leavesfly.switchboard.command.CommandHandler;
import io.leavesfly.switchboard.ui.shell.output.OutputFormatter;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * /resources 命令处理器
 */
@Component
public class ResourcesCommandHandler implements CommandHandler {

    @Override
    public String getName() {
        return "resources";
    }

    @Override
    public String getDescription() {
        return "显示可用资源列表";
    }

    @Override
    public void execute(CommandContext context) {
        OutputFormatter out = context.getOutputFormatter();
        List<String> resources = context.getRouter().listAllResources();

        out.println();
        if (resources.isEmpty()) {
            out.printInfo("没有可用的资源");
            return;
        }
        out.printSuccess("可用资源 (" + resources.size() + "):");
        resources.forEach(uri -> out.println("  • " + uri));
        out.println();
    }
}
