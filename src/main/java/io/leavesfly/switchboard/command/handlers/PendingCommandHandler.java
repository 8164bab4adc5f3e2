package io.leavesfly.switchboard.command.handlers;

import io.leavesfly.switchboard.command.CommandContext;
import io.leavesfly.switchboard.command.CommandHandler;
import io.leavesfly.switchboard.confirmation.ConfirmationGate;
import io.leavesfly.switchboard.confirmation.ConfirmationRequest;
import io.leavesfly.switchboard.ui.shell.output.OutputFormatter;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * /pending 命令处理器
 * 显示等待中的审批
 */
@Component
public class PendingCommandHandler implements CommandHandler {

    @Override
    public String getName() {
        return "pending";
    }

    @Override
    public String getDescription() {
        return "显示等待中的审批";
    }

    @Override
    public void execute(CommandContext context) {
        OutputFormatter out = context.getOutputFormatter();
        if (!(context.getRouter().getConfirmationProvider() instanceof ConfirmationGate)) {
            out.printInfo("当前审批模式不需要人工确认");
            return;
        }
        ConfirmationGate gate = (ConfirmationGate) context.getRouter().getConfirmationProvider();
        List<ConfirmationRequest> pending = gate.getPendingConfirmations();

        out.println();
        if (pending.isEmpty()) {
            out.printInfo("没有等待中的审批");
            return;
        }
        out.printSuccess("等待中的审批 (" + pending.size() + "):");
        for (ConfirmationRequest request : pending) {
            out.println("  • " + request.getExecutionId() + "  " + request.getToolName()
                    + "  (" + request.getTimestamp() + ")");
        }
        out.println();
    }
}
