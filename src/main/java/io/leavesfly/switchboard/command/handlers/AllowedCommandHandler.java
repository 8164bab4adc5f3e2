package io.leavesfly.switchboard.command.handlers;

import io.leavesfly.switchboard.command.CommandContext;
import io.leavesfly.switchboard.command.CommandHandler;
import io.leavesfly.switchboard.confirmation.ConfirmationGate;
import io.leavesfly.switchboard.confirmation.allowlist.AllowListProvider;
import io.leavesfly.switchboard.ui.shell.output.OutputFormatter;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * /allowed 命令处理器
 * 显示或撤销已记住的批准
 */
@Component
public class AllowedCommandHandler implements CommandHandler {

    @Override
    public String getName() {
        return "allowed";
    }

    @Override
    public String getDescription() {
        return "显示已记住的批准，或撤销其中一项";
    }

    @Override
    public String getUsage() {
        return "/allowed [revoke <name>]";
    }

    @Override
    public void execute(CommandContext context) {
        OutputFormatter out = context.getOutputFormatter();
        if (!(context.getRouter().getConfirmationProvider() instanceof ConfirmationGate)) {
            out.printInfo("当前审批模式不使用批准名单");
            return;
        }
        AllowListProvider allowList = ((ConfirmationGate) context.getRouter().getConfirmationProvider()).getAllowList();

        if ("revoke".equals(context.getArg(0)) && context.getArg(1) != null) {
            allowList.disallow(context.getArg(1), null).block();
            out.printSuccess("✓ 已撤销: " + context.getArg(1));
            return;
        }

        Set<String> allowed = allowList.getAllowed(null).block();
        out.println();
        if (allowed == null || allowed.isEmpty()) {
            out.printInfo("批准名单为空");
            return;
        }
        out.printSuccess("已记住的批准 (" + allowed.size() + "):");
        allowed.forEach(name -> out.println("  • " + name));
        out.println();
    }
}
