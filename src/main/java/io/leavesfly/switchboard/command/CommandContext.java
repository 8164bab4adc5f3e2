package io.leavesfly.switchboard.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.leavesfly.switchboard.router.CapabilityRouter;
import io.leavesfly.switchboard.ui.shell.output.OutputFormatter;
import lombok.Builder;
import lombok.Getter;

import java.util.Map;

/**
 * 命令执行上下文
 * 包含命令执行所需的所有信息和依赖
 */
@Getter
@Builder
public class CommandContext {

    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {
    };

    /**
     * 路由器实例
     */
    private final CapabilityRouter router;

    /**
     * 原始输入字符串
     */
    private final String rawInput;

    /**
     * 命令名称（不含 / 前缀）
     */
    private final String commandName;

    /**
     * 命令名之后的原始参数串
     */
    private final String argsString;

    /**
     * 命令参数数组（按空白切分）
     */
    private final String[] args;

    private final OutputFormatter outputFormatter;

    private final ObjectMapper objectMapper;

    /**
     * 命令注册表（/help 使用）
     */
    private final CommandRegistry commandRegistry;

    /**
     * 获取指定索引的参数
     *
     * @return 参数值，索引越界返回 null
     */
    public String getArg(int index) {
        if (args == null || index < 0 || index >= args.length) {
            return null;
        }
        return args[index];
    }

    public int getArgCount() {
        return args == null ? 0 : args.length;
    }

    /**
     * 第一个参数之后的剩余参数串（例如 /call 的 JSON 参数）
     */
    public String getRestAfterFirstArg() {
        if (argsString == null) {
            return "";
        }
        String trimmed = argsString.trim();
        int space = indexOfWhitespace(trimmed);
        return space < 0 ? "" : trimmed.substring(space).trim();
    }

    /**
     * 将 JSON 对象文本解析为参数，空串返回空参数
     *
     * @throws IllegalArgumentException 不是合法的 JSON 对象
     */
    public Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, ARGS_TYPE);
            return parsed == null ? Map.of() : parsed;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Arguments must be a JSON object: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * 格式化结果为缩进的 JSON
     */
    public String formatJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
