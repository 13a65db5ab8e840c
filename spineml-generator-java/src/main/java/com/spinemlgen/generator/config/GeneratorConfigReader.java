package com.spinemlgen.generator.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

public class GeneratorConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes a generator configuration file.
     *
     * @throws ConfigReadException if the file is missing, malformed or holds a non-positive dt
     */
    public GeneratorConfig read(Path configPath) {
        if (!Files.exists(configPath)) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        GeneratorConfig config;
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            config = GSON.fromJson(reader, GeneratorConfig.class);
        } catch (NoSuchFileException e) {
            throw new ConfigReadException("Config file not found: " + configPath, e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new ConfigReadException("Config file is not valid JSON: " + configPath + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigReadException("Config file is empty or invalid JSON: " + configPath);
        }
        if (!(config.getDt() > 0)) {
            throw new ConfigReadException("Config file " + configPath + ": dt must be positive, got " + config.getDt());
        }
        return config;
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
