package com.branchlifecycle.reconciler.service;

import com.branchlifecycle.reconciler.model.RepositoryConfig;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.File;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
public class ConfigLoaderService {

    @Value("${reconciler.config.path:config/repositories}")
    private String configPath = "config/repositories";

    private final Map<String, RepositoryConfig> configsByPath = new ConcurrentHashMap<>();
    private final ObjectMapper yamlMapper;

    public ConfigLoaderService() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.yamlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    }

    public void setConfigPath(String path) {
        this.configPath = path;
    }

    @PostConstruct
    public void loadConfigs() {
        configsByPath.clear();
        File configDir = new File(configPath);

        if (!configDir.exists() || !configDir.isDirectory()) {
            log.info("Repository config directory not found: {}", configPath);
            return;
        }

        File[] yamlFiles = configDir.listFiles((dir, name) -> name.endsWith(".yaml") || name.endsWith(".yml"));
        if (yamlFiles == null) return;
        Arrays.sort(yamlFiles);

        Set<String> names = new HashSet<>();
        for (File file : yamlFiles) {
            try {
                RepositoryConfig config = yamlMapper.readValue(file, RepositoryConfig.class);
                List<String> problems = config.validate();
                if (!problems.isEmpty()) {
                    log.error("Rejected {}: {}", file.getName(), String.join("; ", problems));
                    continue;
                }
                if (!names.add(config.getName())) {
                    log.error("Rejected {}: duplicate repository name {}", file.getName(), config.getName());
                    continue;
                }
                config.setPath(normalize(config.getPath()));
                configsByPath.put(config.getPath(), config);
                log.info("Loaded config for repository {} at {}", config.getName(), config.getPath());
            } catch (Exception e) {
                log.error("Failed to load config from {}: {}", file.getName(), e.getMessage());
            }
        }
    }

    public Optional<RepositoryConfig> getConfigByName(String name) {
        return configsByPath.values().stream()
            .filter(config -> config.getName().equals(name))
            .findFirst();
    }

    /**
     * Falls back to documented defaults for repositories without a config file.
     */
    public RepositoryConfig getConfigForPath(String repoPath) {
        String normalized = normalize(repoPath);
        return configsByPath.getOrDefault(normalized, RepositoryConfig.defaults(normalized));
    }

    public Collection<RepositoryConfig> getAllConfigs() {
        return List.copyOf(configsByPath.values());
    }

    private static String normalize(String path) {
        return Path.of(path).toAbsolutePath().normalize().toString();
    }
}
