package io.leavesfly.switchboard.confirmation;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * 向外发布的审批请求
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConfirmationRequest {

    private String executionId;

    private String toolName;

    private Map<String, Object> args;

    private String description;

    private Instant timestamp;

    private String scopeId;
}
