package io.leavesfly.switchboard.router;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.leavesfly.switchboard.config.BackendConfig;
import io.leavesfly.switchboard.config.ConfirmationConfig;
import io.leavesfly.switchboard.config.SwitchboardConfig;
import io.leavesfly.switchboard.confirmation.AutoConfirmationProvider;
import io.leavesfly.switchboard.confirmation.ConfirmationGate;
import io.leavesfly.switchboard.connection.ConnectionMode;
import io.leavesfly.switchboard.exception.BatchConnectionPolicyException;
import io.leavesfly.switchboard.transport.FakeTransportClient;
import io.leavesfly.switchboard.transport.FakeTransportClientFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.LinkedHashMap;
import java.util.Map;

import static io.leavesfly.switchboard.transport.FakeTransportClientFactory.stdio;
import static org.junit.jupiter.api.Assertions.*;

/**
 * SwitchboardFactory 组装测试
 */
class SwitchboardFactoryTest {

    private FakeTransportClientFactory clientFactory;
    private SwitchboardFactory factory;

    @BeforeEach
    void setUp() {
        clientFactory = new FakeTransportClientFactory();
        factory = new SwitchboardFactory();
        ReflectionTestUtils.setField(factory, "objectMapper", new ObjectMapper());
        ReflectionTestUtils.setField(factory, "transportClientFactory", clientFactory);
    }

    @Test
    void testConfirmationModeSelectsProvider() {
        SwitchboardConfig eventBased = SwitchboardConfig.builder().build();
        SwitchboardConfig autoDeny = SwitchboardConfig.builder()
                .confirmation(ConfirmationConfig.builder().mode(ConfirmationConfig.Mode.AUTO_DENY).build())
                .build();

        CapabilityRouter gated = factory.createRouter(eventBased);
        CapabilityRouter denying = factory.createRouter(autoDeny);

        ConfirmationGate gate = assertInstanceOf(ConfirmationGate.class, gated.getConfirmationProvider());
        assertEquals(ConfirmationConfig.DEFAULT_TIMEOUT_MS, gate.getTimeoutMs());
        AutoConfirmationProvider auto = assertInstanceOf(AutoConfirmationProvider.class,
                denying.getConfirmationProvider());
        assertFalse(auto.isApprove());
    }

    @Test
    void testCreateConnectsConfiguredServers() {
        clientFactory.register("alpha", new FakeTransportClient("alpha").withTools("shared"));
        clientFactory.register("beta", new FakeTransportClient("beta").withTools("shared"));

        Map<String, BackendConfig> backends = new LinkedHashMap<>();
        backends.put("alpha", stdio());
        backends.put("beta", stdio());
        SwitchboardConfig config = SwitchboardConfig.builder()
                .backends(backends)
                .qualifiedNameDelimiter("__")
                .build();

        CapabilityRouter router = factory.create(config).block();

        assertEquals("__", router.getIndex().getDelimiter());
        assertEquals(2, router.getClients().size());
        assertTrue(router.listAllTools().containsKey("alpha__shared"));
        assertTrue(router.listAllTools().containsKey("beta__shared"));
    }

    @Test
    void testCreateHonoursConnectionMode() {
        clientFactory.register("alpha", new FakeTransportClient("alpha").failingConnect("refused"));

        SwitchboardConfig config = SwitchboardConfig.builder()
                .backends(new LinkedHashMap<>(Map.of("alpha", stdio())))
                .connectionMode(ConnectionMode.LENIENT)
                .build();

        BatchConnectionPolicyException e = assertThrows(BatchConnectionPolicyException.class,
                () -> factory.create(config).block());

        assertTrue(e.getMessage().startsWith("Failed to connect to at least one server"));
    }
}
