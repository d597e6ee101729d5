package com.deerbot.server.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Engine settings read from {@code /deerbot_config.json}.
 */
public class GenerationSettings {
    private static final Logger logger = LoggerFactory.getLogger(GenerationSettings.class);

    public static final String CONFIG_RESOURCE = "/deerbot_config.json";

    public int sentenceLength = 50;
    public int sampleCount = 1000;
    public double alpha = 2.0;
    public double beta = 1.5;
    public int graphOrder = 4;
    public int minInputLength = 20;
    public List<String> languages = new ArrayList<>(List.of("en", "fi"));
    public boolean persistenceEnabled = true;
    public String data_directory;

    public GenerationSettings() {
    }

    public static GenerationSettings defaults() {
        return new GenerationSettings();
    }

    public static GenerationSettings loadOrDefault() {
        return loadOrDefault(CONFIG_RESOURCE);
    }

    public static GenerationSettings loadOrDefault(String resource) {
        try (InputStream is = GenerationSettings.class.getResourceAsStream(resource)) {
            if (is == null) {
                logger.warn("{} not found on classpath, using default settings", resource);
                return defaults();
            }
            GenerationSettings settings = new ObjectMapper().readValue(is, GenerationSettings.class);
            logger.info("Loaded settings from {}: order={}, length={}, samples={}, alpha={}, beta={}",
                    resource, settings.graphOrder, settings.sentenceLength, settings.sampleCount,
                    settings.alpha, settings.beta);
            return settings;
        } catch (Exception e) {
            logger.warn("Failed to read {}, using default settings", resource, e);
            return defaults();
        }
    }

    public boolean supportsLanguage(String language) {
        return languages != null && languages.contains(language);
    }
}
