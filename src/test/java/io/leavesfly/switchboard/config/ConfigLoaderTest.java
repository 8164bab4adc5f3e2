package io.leavesfly.switchboard.config;

import io.leavesfly.switchboard.connection.ConnectionMode;
import io.leavesfly.switchboard.exception.ConfigException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ConfigLoader 单元测试
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private ConfigLoader loader;

    @BeforeEach
    void setUp() {
        SwitchboardConfiguration configuration = new SwitchboardConfiguration();
        loader = new ConfigLoader(configuration.objectMapper(), configuration.yamlObjectMapper(),
                Map.of("API_TOKEN", "secret", "WORKDIR", "/srv/data"));
    }

    @Test
    void testLoadYamlExpandsEnvironmentPlaceholders() throws Exception {
        Path file = tempDir.resolve("config.yml");
        Files.writeString(file, """
                connection_mode: strict
                qualified_name_delimiter: "__"
                mcp_servers:
                  files:
                    type: stdio
                    command: fs-server
                    args: ["--root", "${WORKDIR}"]
                    env:
                      TOKEN: "${API_TOKEN}"
                  search:
                    type: http
                    url: http://localhost:8080/mcp
                    headers:
                      Authorization: "Bearer ${API_TOKEN}"
                    timeout: 5000
                    connection_mode: strict
                tool_confirmation:
                  mode: auto-approve
                  timeout_ms: 1000
                """);

        SwitchboardConfig config = loader.loadConfig(file);

        assertEquals(ConnectionMode.STRICT, config.getConnectionMode());
        assertEquals("__", config.getQualifiedNameDelimiter());
        assertEquals(List.of("files", "search"), List.copyOf(config.getBackends().keySet()));

        BackendConfig files = config.getBackends().get("files");
        assertEquals(BackendConfig.TransportType.STDIO, files.getType());
        assertEquals(List.of("--root", "/srv/data"), files.getArgs());
        assertEquals("secret", files.getEnv().get("TOKEN"));
        assertEquals(BackendConfig.DEFAULT_TIMEOUT_MS, files.getTimeout());
        assertEquals(ConnectionMode.LENIENT, files.getConnectionMode());

        BackendConfig search = config.getBackends().get("search");
        assertEquals("Bearer secret", search.getHeaders().get("Authorization"));
        assertEquals(5000, search.getTimeout());
        assertEquals(ConnectionMode.STRICT, search.getConnectionMode());

        assertEquals(ConfirmationConfig.Mode.AUTO_APPROVE, config.getConfirmation().getMode());
        assertEquals(1000, config.getConfirmation().getTimeoutMs());
    }

    @Test
    void testLoadJsonWithDefaults() throws Exception {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, "{\"mcp_servers\": {\"remote\": {\"type\": \"sse\", \"url\": \"http://host/sse\"}}}");

        SwitchboardConfig config = loader.loadConfig(file);

        assertEquals(ConnectionMode.LENIENT, config.getConnectionMode());
        assertEquals("::", config.getQualifiedNameDelimiter());
        assertEquals(ConfirmationConfig.Mode.EVENT_BASED, config.getConfirmation().getMode());
        assertEquals(ConfirmationConfig.DEFAULT_TIMEOUT_MS, config.getConfirmation().getTimeoutMs());
        assertEquals("http://host/sse", config.getBackends().get("remote").getUrl());
    }

    @Test
    void testUnknownPlaceholderIsLeftAsIs() throws Exception {
        Path file = tempDir.resolve("config.yml");
        Files.writeString(file, """
                mcp_servers:
                  files:
                    type: stdio
                    command: "${MISSING_VAR}/bin/server"
                """);

        SwitchboardConfig config = loader.loadConfig(file);

        assertEquals("${MISSING_VAR}/bin/server", config.getBackends().get("files").getCommand());
    }

    @Test
    void testMissingCustomFileFails() {
        ConfigException e = assertThrows(ConfigException.class,
                () -> loader.loadConfig(tempDir.resolve("absent.yml")));

        assertTrue(e.getMessage().contains("Config file not found"));
    }

    @Test
    void testInvalidServerIsRejected() throws Exception {
        Path file = tempDir.resolve("config.yml");
        Files.writeString(file, """
                mcp_servers:
                  broken:
                    type: stdio
                """);

        ConfigException e = assertThrows(ConfigException.class, () -> loader.loadConfig(file));

        assertTrue(e.getMessage().contains("broken"), "错误信息应包含后端标识");
    }

    @Test
    void testEmptyDelimiterIsRejected() throws Exception {
        Path file = tempDir.resolve("config.yml");
        Files.writeString(file, "qualified_name_delimiter: \"\"\n");

        ConfigException e = assertThrows(ConfigException.class, () -> loader.loadConfig(file));

        assertTrue(e.getMessage().startsWith("Invalid configuration"));
    }

    @Test
    void testParseBackendConfig() {
        BackendConfig config = loader.parseBackendConfig("docs",
                "{\"type\": \"stdio\", \"command\": \"docs-server\", \"args\": [\"${WORKDIR}\"]}");

        assertEquals("docs-server", config.getCommand());
        assertEquals(List.of("/srv/data"), config.getArgs());

        assertThrows(ConfigException.class, () -> loader.parseBackendConfig("docs", "{not json"));
        assertThrows(ConfigException.class, () -> loader.parseBackendConfig("docs", "{\"type\": \"http\"}"));
    }
}
