package io.leavesfly.switchboard.command.handlers;

import io.leavesfly.switchboard.capability.Backend;
import io.leavesfly.switchboard.command.CommandContext;
import io.leavesfly.switchboard.command.CommandHandler;
import io.leavesfly.switchboard.config.BackendConfig;
import io.leavesfly.switchboard.config.ConfigLoader;
import io.leavesfly.switchboard.exception.SwitchboardException;
import io.leavesfly.switchboard.ui.shell.output.OutputFormatter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * /connect 命令处理器
 * 运行时动态添加一个后端
 */
@Slf4j
@Component
public class ConnectCommandHandler implements CommandHandler {

    private final ConfigLoader configLoader;

    @Autowired
    public ConnectCommandHandler(ConfigLoader configLoader) {
        this.configLoader = configLoader;
    }

    @Override
    public String getName() {
        return "connect";
    }

    @Override
    public String getDescription() {
        return "连接新的后端";
    }

    @Override
    public String getUsage() {
        return "/connect <id> <json-config>";
    }

    @Override
    public void execute(CommandContext context) {
        OutputFormatter out = context.getOutputFormatter();
        String identifier = context.getArg(0);
        String json = context.getRestAfterFirstArg();
        if (identifier == null || json.isEmpty()) {
            out.printError("用法: " + getUsage());
            out.printInfo("例如: /connect fs {\"type\":\"stdio\",\"command\":\"npx\",\"args\":[\"-y\",\"@modelcontextprotocol/server-filesystem\",\".\"]}");
            return;
        }

        try {
            BackendConfig config = configLoader.parseBackendConfig(identifier, json);
            Backend backend = context.getRouter().connectOne(identifier, config).block();
            out.printSuccess("✓ 已连接: " + (backend != null ? backend.getIdentifier() : identifier));
        } catch (SwitchboardException e) {
            out.printError(e.getMessage());
        }
    }
}
