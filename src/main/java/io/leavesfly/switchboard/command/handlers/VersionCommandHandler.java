package io.leavesfly.switchboard.command.handlers;

import io.leavesfly.switchboard.command.CommandContext;
import io.leavesfly.switchboard.command.CommandHandler;
import io.leavesfly.switchboard.ui.shell.output.OutputFormatter;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * /version 命令处理器
 */
@Component
public class VersionCommandHandler implements CommandHandler {

    public static final String VERSION = "0.1.0";

    @Override
    public String getName() {
        return "version";
    }

    @Override
    public String getDescription() {
        return "显示版本信息";
    }

    @Override
    public List<String> getAliases() {
        return List.of("v");
    }

    @Override
    public void execute(CommandContext context) {
        OutputFormatter out = context.getOutputFormatter();

        out.println();
        out.printSuccess("Switchboard");
        out.println("  Version: " + VERSION);
        out.println("  Qualified name delimiter: " + context.getRouter().getIndex().getDelimiter());
        out.println("  Java Version: " + System.getProperty("java.version"));
        out.println();
    }
}
