package io.leavesfly.switchboard.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CommandContext 参数解析测试
 */
class CommandContextTest {

    private CommandContext context(String argsString) {
        return CommandContext.builder()
                .argsString(argsString)
                .args(argsString.isBlank() ? new String[0] : argsString.trim().split("\\s+"))
                .objectMapper(new ObjectMapper())
                .build();
    }

    @Test
    void testRestAfterFirstArgKeepsJsonIntact() {
        CommandContext context = context("alpha::search  {\"q\": \"a b\", \"n\": 2}");

        assertEquals("alpha::search", context.getArg(0));
        assertEquals("{\"q\": \"a b\", \"n\": 2}", context.getRestAfterFirstArg());
        assertNull(context.getArg(10));
    }

    @Test
    void testParseJsonArgs() {
        CommandContext context = context("");

        Map<String, Object> args = context.parseJsonArgs("{\"q\": \"x\", \"n\": 2}");

        assertEquals("x", args.get("q"));
        assertEquals(2, args.get("n"));
        assertTrue(context.parseJsonArgs("  ").isEmpty());
        assertEquals("", context.getRestAfterFirstArg());
        assertThrows(IllegalArgumentException.class, () -> context.parseJsonArgs("[1, 2]"));
    }
}
