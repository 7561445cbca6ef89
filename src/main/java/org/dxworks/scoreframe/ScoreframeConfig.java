package org.dxworks.scoreframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.scoreframe.convert.ConversionContext;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class ScoreframeConfig {

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final String CONFIG_FILE_NAME = "scoreframe-config.yml";
    private static final String DEFAULT_ID_PREFIX = ConversionContext.DEFAULT_ID_PREFIX;
    private static final boolean DEFAULT_FAIL_ON_WARNINGS = false;

    private final int maxFileLines;
    private final String idPrefix;
    private final boolean failOnWarnings;

    private ScoreframeConfig(int maxFileLines, String idPrefix, boolean failOnWarnings) {
        this.maxFileLines = maxFileLines;
        this.idPrefix = idPrefix;
        this.failOnWarnings = failOnWarnings;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public String getIdPrefix() {
        return idPrefix;
    }

    public boolean isFailOnWarnings() {
        return failOnWarnings;
    }

    public static ScoreframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static ScoreframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                Integer maxFileLines = yamlConfig.maxFileLines;
                String idPrefix = yamlConfig.idPrefix;
                Boolean failOnWarnings = yamlConfig.failOnWarnings;

                int effectiveMaxFileLines = (maxFileLines != null && maxFileLines > 0)
                        ? maxFileLines
                        : DEFAULT_MAX_FILE_LINES;
                String effectiveIdPrefix = (idPrefix != null && !idPrefix.isBlank())
                        ? idPrefix
                        : DEFAULT_ID_PREFIX;
                boolean effectiveFailOnWarnings = (failOnWarnings != null)
                        ? failOnWarnings
                        : DEFAULT_FAIL_ON_WARNINGS;

                return new ScoreframeConfig(effectiveMaxFileLines, effectiveIdPrefix, effectiveFailOnWarnings);
            }
        } catch (IOException e) {
            System.err.println("Could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    public static ScoreframeConfig defaults() {
        return new ScoreframeConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_ID_PREFIX, DEFAULT_FAIL_ON_WARNINGS);
    }

    public static ScoreframeConfig with(int maxFileLines, String idPrefix, boolean failOnWarnings) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        String effectiveIdPrefix = (idPrefix != null && !idPrefix.isBlank()) ? idPrefix : DEFAULT_ID_PREFIX;
        return new ScoreframeConfig(effectiveMaxFileLines, effectiveIdPrefix, failOnWarnings);
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public String idPrefix;
        public Boolean failOnWarnings;
    }
}
