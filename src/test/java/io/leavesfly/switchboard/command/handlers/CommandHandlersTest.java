package io.leavesfly.switchboard.command.handlers;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.leavesfly.switchboard.command.CommandContext;
import io.leavesfly.switchboard.command.CommandHandler;
import io.leavesfly.switchboard.confirmation.AutoConfirmationProvider;
import io.leavesfly.switchboard.connection.ConnectionOrchestrator;
import io.leavesfly.switchboard.router.CapabilityRouter;
import io.leavesfly.switchboard.transport.FakeTransportClient;
import io.leavesfly.switchboard.transport.FakeTransportClientFactory;
import io.leavesfly.switchboard.ui.shell.output.OutputFormatter;
import org.jline.terminal.Terminal;
import org.jline.terminal.impl.DumbTerminal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 命令处理器测试，输出写入内存终端
 */
class CommandHandlersTest {

    private ByteArrayOutputStream output;
    private Terminal terminal;
    private CapabilityRouter router;
    private ConnectionOrchestrator orchestrator;

    @BeforeEach
    void setUp() throws Exception {
        output = new ByteArrayOutputStream();
        terminal = new DumbTerminal("test", Terminal.TYPE_DUMB,
                new ByteArrayInputStream(new byte[0]), output, StandardCharsets.UTF_8);
        orchestrator = new ConnectionOrchestrator(new FakeTransportClientFactory());
        router = new CapabilityRouter(orchestrator, new AutoConfirmationProvider(true));
    }

    @AfterEach
    void tearDown() throws Exception {
        terminal.close();
    }

    private String run(CommandHandler handler, String argsString) throws Exception {
        String trimmed = argsString.trim();
        CommandContext context = CommandContext.builder()
                .router(router)
                .rawInput("/" + handler.getName() + " " + argsString)
                .commandName(handler.getName())
                .argsString(argsString)
                .args(trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+"))
                .outputFormatter(new OutputFormatter(terminal))
                .objectMapper(new ObjectMapper())
                .build();
        handler.execute(context);
        return output.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testCallPrintsResult() throws Exception {
        FakeTransportClient alpha = FakeTransportClient.connected("alpha", "toolA");
        router.registerBackend("alpha", alpha).block();

        String text = run(new CallCommandHandler(), "toolA {\"q\": 1}");

        assertTrue(text.contains("\"argCount\" : 1"), text);
        assertTrue(text.contains("完成"), text);
        assertEquals(List.of("tool:toolA"), alpha.getCalls());
    }

    @Test
    void testCallReportsUnknownName() throws Exception {
        String text = run(new CallCommandHandler(), "nothing");

        assertTrue(text.contains("未找到"), text);
    }

    @Test
    void testServersListsFailures() throws Exception {
        router.registerBackend("my server", FakeTransportClient.connected("alpha", "toolA")).block();
        orchestrator.recordFailure("beta", "refused");

        String text = run(new ServersCommandHandler(), "");

        assertTrue(text.contains("my server [my_server] - connected"), text);
        assertTrue(text.contains("beta - refused"), text);
    }

    @Test
    void testToolsShowsQualifiedNames() throws Exception {
        router.registerBackend("alpha", FakeTransportClient.connected("alpha", "shared")).block();
        router.registerBackend("beta", FakeTransportClient.connected("beta", "shared")).block();

        String text = run(new ToolsCommandHandler(), "");

        assertTrue(text.contains("alpha::shared  - shared from alpha (via alpha)"), text);
        assertTrue(text.contains("beta::shared"), text);
    }
}
