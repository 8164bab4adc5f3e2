package io.leavesfly.switchboard.confirmation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 外部返回的审批结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfirmationResponse {

    private String executionId;

    private boolean approved;

    /**
     * 批准并记住，之后同名请求不再询问
     */
    private boolean rememberChoice;

    /**
     * 记住时使用的范围，为 null 时沿用请求的范围
     */
    private String scopeId;

    public static ConfirmationResponse approve(String executionId) {
        return new ConfirmationResponse(executionId, true, false, null);
    }

    public static ConfirmationResponse approveAndRemember(String executionId) {
        return new ConfirmationResponse(executionId, true, true, null);
    }

    public static ConfirmationResponse deny(String executionId) {
        return new ConfirmationResponse(executionId, false, false, null);
    }
}
