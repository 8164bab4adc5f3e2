package io.leavesfly.switchboard.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.leavesfly.switchboard.exception.ConfigException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.text.StringSubstitutor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 配置加载服务
 * 负责从 YAML / JSON 配置文件加载后端定义，并展开其中的 ${VAR} 环境变量占位符
 */
@Slf4j
@Service
public class ConfigLoader {

    private static final String CONFIG_FILE_NAME = "config.yml";
    private static final String SWITCHBOARD_DIR = ".switchboard";

    private final ObjectMapper objectMapper;
    private final ObjectMapper yamlObjectMapper;
    private final StringSubstitutor substitutor;

    @Autowired
    public ConfigLoader(ObjectMapper objectMapper,
                        @Qualifier("yamlObjectMapper") ObjectMapper yamlObjectMapper) {
        this(objectMapper, yamlObjectMapper, System.getenv());
    }

    public ConfigLoader(ObjectMapper objectMapper, ObjectMapper yamlObjectMapper, Map<String, String> environment) {
        this.objectMapper = objectMapper;
        this.yamlObjectMapper = yamlObjectMapper;
        this.substitutor = new StringSubstitutor(environment);
    }

    /**
     * 获取默认配置文件路径
     */
    public Path getConfigFilePath() {
        return getSwitchboardDir().resolve(CONFIG_FILE_NAME);
    }

    /**
     * 获取 Switchboard 数据目录
     */
    public Path getSwitchboardDir() {
        String userHome = System.getProperty("user.home");
        return Paths.get(userHome, SWITCHBOARD_DIR);
    }

    /**
     * 加载配置
     * 优先使用自定义配置文件；未指定时使用默认路径，默认文件不存在则返回空配置
     *
     * @param customConfigFile 自定义配置文件（可为 null）
     */
    public SwitchboardConfig loadConfig(Path customConfigFile) {
        Path configFile = customConfigFile != null ? customConfigFile : getConfigFilePath();

        SwitchboardConfig config;
        if (Files.exists(configFile)) {
            log.debug("Loading config from file: {}", configFile);
            try {
                config = mapperFor(configFile).readValue(configFile.toFile(), SwitchboardConfig.class);
            } catch (IOException e) {
                throw new ConfigException("Failed to load config from file: " + configFile, e);
            }
            if (config == null) {
                config = getDefaultConfig();
            }
        } else if (customConfigFile != null) {
            throw new ConfigException("Config file not found: " + customConfigFile);
        } else {
            log.debug("No config file found at {}, using default config", configFile);
            config = getDefaultConfig();
        }

        expandPlaceholders(config);

        try {
            config.validate();
        } catch (IllegalStateException e) {
            throw new ConfigException("Invalid configuration: " + e.getMessage(), e);
        }

        log.info("Loaded config with {} server(s), connection mode {}",
                config.getBackends().size(), config.getConnectionMode());
        return config;
    }

    /**
     * 解析单个后端配置（JSON 字符串），用于运行时动态添加后端
     */
    public BackendConfig parseBackendConfig(String identifier, String json) {
        BackendConfig backendConfig;
        try {
            backendConfig = objectMapper.readValue(json, BackendConfig.class);
        } catch (IOException e) {
            throw new ConfigException("Invalid server config for '" + identifier + "': " + e.getMessage(), e);
        }
        expandPlaceholders(backendConfig);
        backendConfig.validate(identifier);
        return backendConfig;
    }

    /**
     * 获取默认配置
     */
    public SwitchboardConfig getDefaultConfig() {
        return SwitchboardConfig.builder()
                .backends(new LinkedHashMap<>())
                .confirmation(ConfirmationConfig.builder().build())
                .build();
    }

    private ObjectMapper mapperFor(Path configFile) {
        String fileName = configFile.getFileName().toString().toLowerCase();
        return fileName.endsWith(".yml") || fileName.endsWith(".yaml") ? yamlObjectMapper : objectMapper;
    }

    private void expandPlaceholders(SwitchboardConfig config) {
        if (config.getBackends() == null) {
            return;
        }
        config.getBackends().values().forEach(this::expandPlaceholders);
        ConfirmationConfig confirmation = config.getConfirmation();
        if (confirmation != null && confirmation.getAllowedToolsFile() != null) {
            confirmation.setAllowedToolsFile(substitutor.replace(confirmation.getAllowedToolsFile()));
        }
    }

    private void expandPlaceholders(BackendConfig backend) {
        backend.setCommand(substitutor.replace(backend.getCommand()));
        backend.setUrl(substitutor.replace(backend.getUrl()));

        List<String> args = new ArrayList<>();
        for (String arg : backend.getArgs()) {
            args.add(substitutor.replace(arg));
        }
        backend.setArgs(args);
        backend.setEnv(expandValues(backend.getEnv()));
        backend.setHeaders(expandValues(backend.getHeaders()));
    }

    private Map<String, String> expandValues(Map<String, String> values) {
        Map<String, String> expanded = new LinkedHashMap<>();
        values.forEach((key, value) -> expanded.put(key, substitutor.replace(value)));
        return expanded;
    }
}
