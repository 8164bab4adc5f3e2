package io.leavesfly.switchboard.transport;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 后端声明的工具定义
 * 参数 schema 由后端决定，保持为不透明的 JSON
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ToolDescriptor {

    private String name;

    private String description;

    /**
     * 输入参数的 JSON Schema
     */
    private JsonNode inputSchema;
}
