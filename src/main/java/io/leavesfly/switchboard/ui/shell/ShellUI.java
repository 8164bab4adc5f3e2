package io.leavesfly.switchboard.ui.shell;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.leavesfly.switchboard.command.CommandRegistry;
import io.leavesfly.switchboard.confirmation.ConfirmationGate;
import io.leavesfly.switchboard.confirmation.ConfirmationRequest;
import io.leavesfly.switchboard.confirmation.ConfirmationResponse;
import io.leavesfly.switchboard.router.CapabilityRouter;
import io.leavesfly.switchboard.ui.shell.input.InputProcessor;
import io.leavesfly.switchboard.ui.shell.input.MetaCommandProcessor;
import io.leavesfly.switchboard.ui.shell.input.ToolInvocationProcessor;
import io.leavesfly.switchboard.ui.shell.output.OutputFormatter;
import lombok.extern.slf4j.Slf4j;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.completer.StringsCompleter;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStyle;
import org.springframework.context.ApplicationContext;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shell UI - 基于 JLine 的交互式命令行界面
 * <p>
 * 采用插件化架构：
 * - CommandHandler: 元命令处理器
 * - InputProcessor: 输入处理器
 * - CommandRegistry: 命令注册表
 * <p>
 * 事件驱动审批模式下订阅审批请求流，在终端内联询问 y/n/a。
 */
@Slf4j
public class ShellUI implements AutoCloseable {

    private final Terminal terminal;
    private final LineReader lineReader;
    private final CapabilityRouter router;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean running;
    private Disposable confirmationSubscription;

    // 插件化组件
    private final OutputFormatter outputFormatter;
    private final CommandRegistry commandRegistry;
    private final List<InputProcessor> inputProcessors;

    /**
     * 创建 Shell UI
     *
     * @param router             路由器实例
     * @param applicationContext Spring 应用上下文（用于获取 CommandRegistry）
     * @throws IOException 终端初始化失败
     */
    public ShellUI(CapabilityRouter router, ApplicationContext applicationContext) throws IOException {
        this.router = router;
        this.running = new AtomicBoolean(false);
        this.objectMapper = applicationContext.getBean(ObjectMapper.class);

        // 初始化 Terminal
        this.terminal = TerminalBuilder.builder()
                .system(true)
                .encoding("UTF-8")
                .build();

        // 从 Spring 容器获取 CommandRegistry（已自动注册所有命令）
        this.commandRegistry = applicationContext.getBean(CommandRegistry.class);
        log.info("Loaded CommandRegistry with {} commands from Spring context", commandRegistry.size());

        List<String> completions = new ArrayList<>();
        commandRegistry.getAll().forEach(handler -> completions.add("/" + handler.getName()));
        completions.addAll(router.listAllTools().keySet());

        this.lineReader = LineReaderBuilder.builder()
                .terminal(terminal)
                .appName("Switchboard")
                .completer(new StringsCompleter(completions))
                // 禁用事件扩展（!字符）
                .option(LineReader.Option.DISABLE_EVENT_EXPANSION, true)
                .option(LineReader.Option.AUTO_LIST, true)
                .option(LineReader.Option.CASE_INSENSITIVE, true)
                .build();

        this.outputFormatter = new OutputFormatter(terminal);

        this.inputProcessors = new ArrayList<>();
        registerInputProcessors();

        subscribeConfirmations();
    }

    /**
     * 注册所有输入处理器
     */
    private void registerInputProcessors() {
        inputProcessors.add(new MetaCommandProcessor(commandRegistry));
        inputProcessors.add(new ToolInvocationProcessor(commandRegistry));

        // 按优先级排序
        inputProcessors.sort(Comparator.comparingInt(InputProcessor::getPriority));
    }

    /**
     * 订阅审批请求
     * 请求在独立线程处理，主线程此时阻塞在调用上
     */
    private void subscribeConfirmations() {
        if (!(router.getConfirmationProvider() instanceof ConfirmationGate)) {
            return;
        }
        ConfirmationGate gate = (ConfirmationGate) router.getConfirmationProvider();
        confirmationSubscription = gate.asFlux()
                .publishOn(Schedulers.boundedElastic())
                .subscribe(request -> handleConfirmationRequest(gate, request),
                        e -> log.error("Confirmation stream failed", e));
    }

    /**
     * 运行 Shell UI
     */
    public Mono<Boolean> run() {
        return Mono.defer(() -> {
            running.set(true);

            printWelcome();

            while (running.get()) {
                try {
                    String input = readLine();

                    if (input == null) {
                        // EOF (Ctrl-D)
                        outputFormatter.printInfo("Bye!");
                        break;
                    }

                    if (!processInput(input.trim())) {
                        break;
                    }

                } catch (UserInterruptException e) {
                    // Ctrl-C
                    outputFormatter.printInfo("Tip: press Ctrl-D or type 'exit' to quit");
                } catch (Exception e) {
                    log.error("Error in shell UI", e);
                    outputFormatter.printError("Error: " + e.getMessage());
                }
            }

            return Mono.just(true);
        });
    }

    private String readLine() {
        try {
            String prompt = new AttributedString("switchboard> ",
                    AttributedStyle.DEFAULT.foreground(AttributedStyle.GREEN)).toAnsi();
            return lineReader.readLine(prompt);
        } catch (EndOfFileException e) {
            return null;
        }
    }

    /**
     * 处理用户输入
     *
     * @return 是否继续运行
     */
    private boolean processInput(String input) {
        if (input.isEmpty()) {
            return true;
        }

        if (input.equals("exit") || input.equals("quit")) {
            outputFormatter.printInfo("Bye!");
            return false;
        }

        ShellContext context = ShellContext.builder()
                .router(router)
                .rawInput(input)
                .outputFormatter(outputFormatter)
                .objectMapper(objectMapper)
                .build();

        for (InputProcessor processor : inputProcessors) {
            if (processor.canProcess(input)) {
                try {
                    return processor.process(input, context);
                } catch (Exception e) {
                    log.error("Error processing input with {}", processor.getClass().getSimpleName(), e);
                    outputFormatter.printError("处理输入失败: " + e.getMessage());
                    return true;
                }
            }
        }

        outputFormatter.printError("无法处理输入: " + input);
        return true;
    }

    private void printWelcome() {
        outputFormatter.println();
        AttributedStyle style = AttributedStyle.DEFAULT.foreground(AttributedStyle.CYAN).bold();
        terminal.writer().println(new AttributedString("Switchboard", style).toAnsi());
        terminal.flush();
        outputFormatter.printSuccess("Connected servers: " + router.getClients().size()
                + ", tools: " + router.listAllTools().size());
        if (!router.getFailedConnections().isEmpty()) {
            outputFormatter.printError("Failed servers: " + String.join(", ", router.getFailedConnections().keySet()));
        }
        outputFormatter.printInfo("Type /help for available commands");
        outputFormatter.println();
    }

    /**
     * 处理审批请求
     * 读取 y/n/a 并回复，出错或中断时视为拒绝
     */
    private void handleConfirmationRequest(ConfirmationGate gate, ConfirmationRequest request) {
        // 订阅前缓存的请求可能已经结束
        boolean stillPending = gate.getPendingConfirmations().stream()
                .anyMatch(p -> p.getExecutionId().equals(request.getExecutionId()));
        if (!stillPending) {
            log.debug("Skipping finished confirmation {}", request.getExecutionId());
            return;
        }

        ConfirmationResponse response;
        try {
            outputFormatter.println();
            outputFormatter.printStatus("⚠️  需要审批:");
            outputFormatter.printInfo("  名称: " + request.getToolName());
            if (request.getDescription() != null) {
                outputFormatter.printInfo("  描述: " + request.getDescription());
            }
            if (request.getArgs() != null && !request.getArgs().isEmpty()) {
                outputFormatter.printInfo("  参数: " + objectMapper.writeValueAsString(request.getArgs()));
            }

            String prompt = new AttributedString("❓ 是否批准？[y/n/a] (y=批准, n=拒绝, a=批准并记住): ",
                    AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW).bold())
                    .toAnsi();
            String answer = lineReader.readLine(prompt).trim().toLowerCase();

            switch (answer) {
                case "y":
                case "yes":
                    response = ConfirmationResponse.approve(request.getExecutionId());
                    outputFormatter.printSuccess("✅ 已批准");
                    break;
                case "a":
                case "all":
                    response = ConfirmationResponse.approveAndRemember(request.getExecutionId());
                    outputFormatter.printSuccess("✅ 已批准（之后不再询问）");
                    break;
                case "n":
                case "no":
                default:
                    response = ConfirmationResponse.deny(request.getExecutionId());
                    outputFormatter.printError("❌ 已拒绝");
                    break;
            }
        } catch (UserInterruptException e) {
            log.info("Confirmation interrupted by user");
            outputFormatter.printError("❌ 审批已取消");
            gate.cancelConfirmation(request.getExecutionId(), "Interrupted by user");
            return;
        } catch (Exception e) {
            log.error("Error handling confirmation request", e);
            response = ConfirmationResponse.deny(request.getExecutionId());
        }

        gate.handleConfirmationResponse(response)
                .doOnError(e -> log.error("Failed to deliver confirmation response", e))
                .onErrorResume(e -> Mono.empty())
                .block();
    }

    /**
     * 停止 Shell UI
     */
    public void stop() {
        running.set(false);
    }

    @Override
    public void close() throws Exception {
        if (confirmationSubscription != null) {
            confirmationSubscription.dispose();
        }
        if (router.getConfirmationProvider() instanceof ConfirmationGate) {
            ((ConfirmationGate) router.getConfirmationProvider()).cancelAll();
        }
        if (terminal != null) {
            terminal.close();
        }
    }
}
