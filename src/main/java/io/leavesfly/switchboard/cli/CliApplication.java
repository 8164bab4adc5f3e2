package io.leavesfly.switchboard.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.leavesfly.switchboard.config.ConfigLoader;
import io.leavesfly.switchboard.config.ConfirmationConfig;
import io.leavesfly.switchboard.config.SwitchboardConfig;
import io.leavesfly.switchboard.confirmation.ConfirmationGate;
import io.leavesfly.switchboard.confirmation.ConfirmationRequest;
import io.leavesfly.switchboard.confirmation.ConfirmationResponse;
import io.leavesfly.switchboard.connection.ConnectionMode;
import io.leavesfly.switchboard.exception.SwitchboardException;
import io.leavesfly.switchboard.router.CapabilityRouter;
import io.leavesfly.switchboard.router.SwitchboardFactory;
import io.leavesfly.switchboard.ui.shell.ShellUI;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import reactor.core.Disposable;
import reactor.core.scheduler.Schedulers;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;

/**
 * CLI 应用入口
 * 使用 Picocli 实现命令行参数解析
 */
@Slf4j
@Component
@Command(
        name = "switchboard",
        description = "Route tool, prompt and resource calls across multiple MCP servers",
        mixinStandardHelpOptions = true,
        version = "0.1.0"
)
public class CliApplication implements CommandLineRunner, Runnable {

    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {
    };

    private final ConfigLoader configLoader;
    private final ObjectMapper objectMapper;
    private final ApplicationContext applicationContext;
    private final SwitchboardFactory switchboardFactory;

    @Autowired
    public CliApplication(ConfigLoader configLoader, ObjectMapper objectMapper,
                          ApplicationContext applicationContext, SwitchboardFactory switchboardFactory) {
        this.configLoader = configLoader;
        this.objectMapper = objectMapper;
        this.applicationContext = applicationContext;
        this.switchboardFactory = switchboardFactory;
    }

    @Option(names = {"--verbose"}, description = "Print verbose information")
    private boolean verbose;

    @Option(names = {"--debug"}, description = "Log debug information")
    private boolean debug;

    @Option(names = {"--config-file"}, description = "Configuration file (YAML or JSON), default ~/.switchboard/config.yml")
    private Path configFile;

    @Option(names = {"--connection-mode"}, description = "Batch connection policy: strict or lenient")
    private String connectionMode;

    @Option(names = {"--confirmation-mode"}, description = "Tool confirmation: event-based, auto-approve or auto-deny")
    private String confirmationMode;

    @Option(names = {"--confirmation-timeout"}, description = "Confirmation timeout in milliseconds")
    private Long confirmationTimeout;

    @Option(names = {"-y", "--yes"}, description = "Automatically approve all invocations")
    private boolean yes;

    @Option(names = {"-c", "--call"}, description = "Invoke one tool and exit: \"<name> [json-args]\"")
    private String call;

    /**
     * 主逻辑设置的退出码，在断开全部后端之后才退出
     */
    private int exitStatus;

    @Override
    public void run(String... args) throws Exception {
        CommandLine commandLine = new CommandLine(this);
        int exitCode = commandLine.execute(args);
        if (exitCode == 0) {
            exitCode = exitStatus;
        }

        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Picocli 的 Runnable 接口实现
     * 当命令行参数解析完成后，Picocli 会调用此方法执行主逻辑
     */
    @Override
    public void run() {
        executeMain();
    }

    private void executeMain() {
        CapabilityRouter router = null;
        try {
            if (debug) {
                LoggingSystem loggingSystem = applicationContext.getBean(LoggingSystem.class);
                loggingSystem.setLogLevel("io.leavesfly.switchboard", LogLevel.DEBUG);
            }

            SwitchboardConfig config = configLoader.loadConfig(configFile);
            applyOverrides(config);

            if (verbose) {
                System.out.println("Loaded config: " + config);
            }

            router = switchboardFactory.create(config).block();
            if (router == null) {
                System.err.println("Failed to create router");
                exitStatus = 1;
                return;
            }

            System.out.println("✓ Connected servers: " + router.getClients().keySet());
            if (!router.getFailedConnections().isEmpty()) {
                System.out.println("✗ Failed servers: " + router.getFailedConnections());
            }

            // 如果有调用，直接执行
            if (call != null && !call.isBlank()) {
                executeCall(router, call.trim());
                return;
            }

            try (ShellUI shellUI = new ShellUI(router, applicationContext)) {
                shellUI.run().block();
            }

        } catch (Exception e) {
            log.error("Error executing Switchboard", e);
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            exitStatus = 1;
        } finally {
            if (router != null) {
                router.disconnectAll().block();
            }
        }
    }

    /**
     * 命令行参数覆盖配置文件
     */
    private void applyOverrides(SwitchboardConfig config) {
        if (connectionMode != null) {
            config.setConnectionMode(ConnectionMode.fromValue(connectionMode));
        }
        ConfirmationConfig confirmation = config.getConfirmation();
        if (confirmationMode != null) {
            confirmation.setMode(ConfirmationConfig.Mode.fromValue(confirmationMode));
        }
        if (yes) {
            confirmation.setMode(ConfirmationConfig.Mode.AUTO_APPROVE);
        }
        if (confirmationTimeout != null) {
            if (confirmationTimeout <= 0) {
                throw new IllegalArgumentException("--confirmation-timeout must be positive");
            }
            confirmation.setTimeoutMs(confirmationTimeout);
        }
    }

    private void executeCall(CapabilityRouter router, String invocation) throws Exception {
        int space = invocation.indexOf(' ');
        String name = space < 0 ? invocation : invocation.substring(0, space);
        String json = space < 0 ? "" : invocation.substring(space + 1).trim();
        Map<String, Object> args = json.isEmpty() ? Map.of() : objectMapper.readValue(json, ARGS_TYPE);

        System.out.println("\n[INFO] Invoking: " + name);
        Disposable prompts = null;
        if (router.getConfirmationProvider() instanceof ConfirmationGate gate) {
            prompts = gate.asFlux()
                    .publishOn(Schedulers.boundedElastic())
                    .subscribe(request -> answerFromStdin(gate, request));
        }
        try {
            JsonNode result = router.invoke(name, args).block();
            System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
            System.out.println("\n✓ Call completed");
        } catch (SwitchboardException e) {
            System.err.println("✗ " + e.getMessage());
            exitStatus = 2;
        } finally {
            if (prompts != null) {
                prompts.dispose();
            }
        }
    }

    /**
     * 一次性调用时从标准输入读取审批结果
     */
    private void answerFromStdin(ConfirmationGate gate, ConfirmationRequest request) {
        System.out.print("Approve " + request.getToolName() + "? [y/N] ");
        System.out.flush();
        String answer;
        try {
            BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            answer = reader.readLine();
        } catch (IOException e) {
            log.warn("Failed to read confirmation answer: {}", e.getMessage());
            answer = null;
        }
        boolean approved = answer != null && answer.trim().equalsIgnoreCase("y");
        gate.handleConfirmationResponse(approved
                        ? ConfirmationResponse.approve(request.getExecutionId())
                        : ConfirmationResponse.deny(request.getExecutionId()))
                .block();
    }
}
