package io.leavesfly.switchboard.ui.shell.input;

import io.leavesfly.switchboard.command.CommandContext;
import io.leavesfly.switchboard.command.CommandHandler;
import io.leavesfly.switchboard.command.CommandRegistry;
import io.leavesfly.switchboard.ui.shell.ShellContext;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * 元命令输入处理器
 * 处理以 / 开头的输入
 */
@Slf4j
public class MetaCommandProcessor implements InputProcessor {

    private final CommandRegistry commandRegistry;

    public MetaCommandProcessor(CommandRegistry commandRegistry) {
        this.commandRegistry = commandRegistry;
    }

    @Override
    public boolean canProcess(String input) {
        return input.startsWith("/");
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    public boolean process(String input, ShellContext context) throws Exception {
        String body = input.substring(1).trim();
        int space = body.indexOf(' ');
        String name = space < 0 ? body : body.substring(0, space);
        String argsString = space < 0 ? "" : body.substring(space + 1).trim();

        if (name.equals("quit") || name.equals("exit")) {
            context.getOutputFormatter().printInfo("Bye!");
            return false;
        }

        Optional<CommandHandler> handler = commandRegistry.find(name);
        if (handler.isEmpty()) {
            context.getOutputFormatter().printError("未知命令: /" + name + "，输入 /help 查看可用命令");
            return true;
        }

        CommandContext commandContext = CommandContext.builder()
                .router(context.getRouter())
                .rawInput(input)
                .commandName(name)
                .argsString(argsString)
                .args(argsString.isEmpty() ? new String[0] : argsString.split("\\s+"))
                .outputFormatter(context.getOutputFormatter())
                .objectMapper(context.getObjectMapper())
                .commandRegistry(commandRegistry)
                .build();

        log.debug("Executing meta command: /{}", name);
        handler.get().execute(commandContext);
        return true;
    }
}
