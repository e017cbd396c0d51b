package com.ssau.auditor.utils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public final class ConfigLoader {

    public static final String DEFAULT_FILE = "auditor.properties";

    private ConfigLoader() {}

    public static Properties loadDefault() throws IOException {
        return load(DEFAULT_FILE);
    }

    /**
     * Loads {@code fileName} from the working directory, then from {@code config/},
     * then from the classpath.
     */
    public static Properties load(String fileName) throws IOException {
        Properties props = new Properties();

        Path externalPath = Paths.get(fileName);
        if (!Files.exists(externalPath)) {
            externalPath = Paths.get("config", fileName);
        }

        if (Files.isRegularFile(externalPath)) {
            try (InputStream fis = Files.newInputStream(externalPath)) {
                props.load(fis);
                log.info("Configuration loaded from external file: {}", externalPath.toAbsolutePath());
                return props;
            } catch (IOException ex) {
                log.warn("Failed to load configuration from external file: {}, trying classpath", externalPath, ex);
            }
        }

        try (InputStream input = ConfigLoader.class.getClassLoader().getResourceAsStream(fileName)) {
            if (input == null) {
                throw new IOException("Configuration file '" + fileName + "' not found in classpath or external directory");
            }
            props.load(input);
            log.info("Configuration loaded from classpath: {}", fileName);
        } catch (IOException ex) {
            log.error("Error loading configuration file '{}': {}", fileName, ex.getMessage());
            throw ex;
        }
        return props;
    }
}
