package io.leavesfly.switchboard.ui.shell;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.leavesfly.switchboard.router.CapabilityRouter;
import io.leavesfly.switchboard.ui.shell.output.OutputFormatter;
import lombok.Builder;
import lombok.Getter;

/**
 * 输入处理上下文
 */
@Getter
@Builder
public class ShellContext {

    private final CapabilityRouter router;

    /**
     * 原始输入字符串
     */
    private final String rawInput;

    private final OutputFormatter outputFormatter;

    private final ObjectMapper objectMapper;
}
