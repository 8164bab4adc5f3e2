package io.leavesfly.switchboard.command.handlers;

import io.leavesfly.switchboard.capability.Backend;
import io.leavesfly.switchboard.command.CommandContext;
import io.leavesfly.switchboard.command.CommandHandler;
import io.leavesfly.switchboard.ui.shell.output.OutputFormatter;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * /servers 命令处理器
 * 显示已连接与连接失败的后端
 */
@Component
public class ServersCommandHandler implements CommandHandler {

    @Override
    public String getName() {
        return "servers";
    }

    @Override
    public String getDescription() {
        return "显示后端连接状态";
    }

    @Override
    public void execute(CommandContext context) {
        OutputFormatter out = context.getOutputFormatter();
        Map<String, Backend> backends = context.getRouter().getClients();
        Map<String, String> failed = context.getRouter().getFailedConnections();

        out.println();
        out.printSuccess("已注册的后端 (" + backends.size() + "):");
        backends.values().forEach(backend -> {
            String state = backend.isConnected() ? "connected" : "disconnected";
            if (!backend.isConnected() && backend.getLastError() != null) {
                state += " (" + backend.getLastError() + ")";
            }
            String prefix = backend.getSanitizedIdentifier().equals(backend.getIdentifier())
                    ? ""
                    : " [" + backend.getSanitizedIdentifier() + "]";
            out.println("  • " + backend.getIdentifier() + prefix + " - " + state);
        });

        if (!failed.isEmpty()) {
            out.println();
            out.printError("连接失败 (" + failed.size() + "):");
            failed.forEach((id, error) -> out.println("  • " + id + " - " + error));
        }
        out.println();
    }
}
