package io.leavesfly.switchboard.capability;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 限定名解析结果：所属后端 + 原始名称
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class ResolvedName {

    private final Backend backend;

    private final String rawName;
}
