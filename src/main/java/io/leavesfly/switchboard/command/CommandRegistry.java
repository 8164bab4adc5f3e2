package io.leavesfly.switchboard.command;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 命令注册表
 * Spring 注入全部 CommandHandler，按名称与别名查找
 */
@Slf4j
@Component
public class CommandRegistry {

    private final Map<String, CommandHandler> handlers = new HashMap<>();
    private final Map<String, String> aliases = new HashMap<>();

    @Autowired
    public CommandRegistry(List<CommandHandler> commandHandlers) {
        commandHandlers.forEach(this::register);
        log.debug("Registered {} command handlers", handlers.size());
    }

    public void register(CommandHandler handler) {
        String name = handler.getName().toLowerCase();
        if (handlers.containsKey(name)) {
            log.warn("Command '/{}' registered twice, keeping the latest", name);
        }
        handlers.put(name, handler);
        for (String alias : handler.getAliases()) {
            aliases.put(alias.toLowerCase(), name);
        }
    }

    /**
     * 按名称或别名查找
     */
    public Optional<CommandHandler> find(String nameOrAlias) {
        if (nameOrAlias == null) {
            return Optional.empty();
        }
        String key = nameOrAlias.toLowerCase();
        CommandHandler handler = handlers.get(key);
        if (handler == null && aliases.containsKey(key)) {
            handler = handlers.get(aliases.get(key));
        }
        return Optional.ofNullable(handler);
    }

    /**
     * 全部命令（按名称排序）
     */
    public List<CommandHandler> getAll() {
        List<CommandHandler> all = new ArrayList<>(handlers.values());
        all.sort(Comparator.comparing(CommandHandler::getName));
        return all;
    }

    public int size() {
        return handlers.size();
    }
}
