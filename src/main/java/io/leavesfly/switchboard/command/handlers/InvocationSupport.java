package io.leavesfly.switchboard.command.handlers;

import com.fasterxml.jackson.databind.JsonNode;
import io.leavesfly.switchboard.command.CommandContext;
import io.leavesfly.switchboard.exception.CapabilityNotFoundException;
import io.leavesfly.switchboard.exception.ConfirmationCancelledException;
import io.leavesfly.switchboard.exception.ConfirmationTimeoutException;
import io.leavesfly.switchboard.exception.ExecutionDeniedException;
import io.leavesfly.switchboard.ui.shell.output.OutputFormatter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * /call、/prompt、/read 的共用执行与错误展示
 */
@Slf4j
final class InvocationSupport {

    private InvocationSupport() {
    }

    static void run(CommandContext context, String label, Mono<JsonNode> invocation) {
        OutputFormatter out = context.getOutputFormatter();
        out.printInfo("执行: " + label);
        try {
            JsonNode result = invocation.block();
            out.println(result == null ? "(no result)" : context.formatJson(result));
            out.printSuccess("✓ 完成");
        } catch (CapabilityNotFoundException e) {
            out.printError("未找到: " + e.getMessage());
            out.printInfo("使用 /tools、/prompts、/resources 查看可用名称");
        } catch (ExecutionDeniedException e) {
            out.printError("已拒绝: " + e.getMessage());
        } catch (ConfirmationTimeoutException e) {
            out.printError("审批超时: " + e.getMessage());
        } catch (ConfirmationCancelledException e) {
            out.printError("审批已取消: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Invocation of {} failed", label, e);
            out.printError("错误: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
        }
    }
}
