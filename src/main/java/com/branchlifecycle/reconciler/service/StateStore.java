package com.branchlifecycle.reconciler.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.function.Supplier;

@Slf4j
@Service
public class StateStore {

    @Value("${reconciler.data.path:data}")
    private String dataPath = "data";

    private final ObjectMapper mapper;

    public StateStore() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public void setDataPath(String path) {
        this.dataPath = path;
    }

    public synchronized <T> T get(String key, TypeReference<T> type, Supplier<T> defaultValue) {
        Path file = fileFor(key);
        if (!Files.exists(file)) {
            return defaultValue.get();
        }
        try {
            T value = mapper.readValue(file.toFile(), type);
            return value != null ? value : defaultValue.get();
        } catch (IOException e) {
            log.warn("Unreadable state for key {} ({}), using default: {}", key, file, e.getMessage());
            return defaultValue.get();
        }
    }

    public synchronized void put(String key, Object value) {
        Path file = fileFor(key);
        try {
            Files.createDirectories(file.getParent());
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writeValue(temp.toFile(), value);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist state for key " + key, e);
        }
    }

    private Path fileFor(String key) {
        String digest = DigestUtils.md5DigestAsHex(key.getBytes(StandardCharsets.UTF_8));
        return Paths.get(dataPath, digest + ".json");
    }
}
