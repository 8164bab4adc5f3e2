package io.leavesfly.switchboard.capability;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 公开名称表中的一项
 */
@Getter
@ToString
@AllArgsConstructor
public class CapabilityEntry {

    /**
     * 公开名称（无冲突时为原始名，冲突时为限定名）
     */
    private final String publicName;

    /**
     * 后端上的原始名称
     */
    private final String rawName;

    private final Backend owner;

    private final CapabilityKind kind;

    public boolean isQualified() {
        return !publicName.equals(rawName);
    }
}
