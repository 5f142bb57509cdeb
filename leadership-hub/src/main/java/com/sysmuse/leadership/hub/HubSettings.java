package com.sysmuse.leadership.hub;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sysmuse.util.LoggingUtil;

import java.io.File;
import java.io.IOException;

/**
 * HubSettings - settings for one roster conversion run, read from a JSON hub config.
 * Missing file or missing keys fall back to the defaults below.
 */
public class HubSettings {

    // Input / output
    private String inputPath = "";
    private String outputPath = "";

    // Optional catalogue override; empty means the classpath default
    private String hierarchyConfigPath = "";

    // Account enrichment
    private boolean enrichmentEnabled = false;
    private String directoryFile = "";
    private int maxWorkers = AccountLookupService.DEFAULT_MAX_WORKERS;
    private int maxRetries = AccountLookupService.DEFAULT_MAX_RETRIES;
    private long initialBackoffMillis = AccountLookupService.DEFAULT_INITIAL_BACKOFF_MILLIS;

    // Logging
    private String loggingLevel = "INFO";
    private boolean consoleLoggingEnabled = true;
    private String consoleMode = "SPLIT_SEVERE_TO_ERR";
    private boolean fileLoggingEnabled = false;
    private String logFileName = "leadership-hub.log";

    public HubSettings() {
    }

    public HubSettings(String configFilePath) throws IOException {
        loadFromFile(configFilePath);
    }

    public void loadFromFile(String configFilePath) throws IOException {
        File configFile = new File(configFilePath);
        if (!configFile.exists()) {
            LoggingUtil.warn("Hub config file not found: " + configFilePath);
            LoggingUtil.info("Using default hub settings");
            return;
        }
        apply(new ObjectMapper().readTree(configFile));
        LoggingUtil.info("Loaded hub settings from " + configFilePath);
    }

    void apply(JsonNode root) {
        if (root == null || !root.isObject()) {
            return;
        }

        JsonNode input = root.path("input");
        inputPath = input.path("path").asText(inputPath);

        JsonNode output = root.path("output");
        outputPath = output.path("path").asText(outputPath);

        JsonNode hierarchy = root.path("hierarchy");
        hierarchyConfigPath = hierarchy.path("configPath").asText(hierarchyConfigPath);

        if (root.has("enrichment")) {
            JsonNode enrichment = root.get("enrichment");
            enrichmentEnabled = enrichment.path("enabled").asBoolean(enrichmentEnabled);
            directoryFile = enrichment.path("directoryFile").asText(directoryFile);
            maxWorkers = enrichment.path("maxWorkers").asInt(maxWorkers);
            maxRetries = enrichment.path("maxRetries").asInt(maxRetries);
            initialBackoffMillis = enrichment.path("initialBackoffMillis").asLong(initialBackoffMillis);
        }

        if (root.has("logging")) {
            JsonNode logging = root.get("logging");
            loggingLevel = logging.path("level").asText(loggingLevel);
            consoleLoggingEnabled = logging.path("console").asBoolean(consoleLoggingEnabled);
            consoleMode = logging.path("consoleMode").asText(consoleMode);
            fileLoggingEnabled = logging.path("file").asBoolean(fileLoggingEnabled);
            logFileName = logging.path("fileName").asText(logFileName);
        }
    }

    public void printDebug() {
        LoggingUtil.debug("Hub settings:");
        LoggingUtil.debug("  input.path = " + inputPath);
        LoggingUtil.debug("  output.path = " + outputPath);
        LoggingUtil.debug("  hierarchy.configPath = " + (hierarchyConfigPath.isEmpty() ? "<default>" : hierarchyConfigPath));
        LoggingUtil.debug("  enrichment.enabled = " + enrichmentEnabled + ", directoryFile = " + directoryFile
                + ", maxWorkers = " + maxWorkers + ", maxRetries = " + maxRetries
                + ", initialBackoffMillis = " + initialBackoffMillis);
        LoggingUtil.debug("  logging.level = " + loggingLevel + ", consoleMode = " + consoleMode);
    }

    public String getInputPath() {
        return inputPath;
    }

    public void setInputPath(String inputPath) {
        this.inputPath = inputPath;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public void setOutputPath(String outputPath) {
        this.outputPath = outputPath;
    }

    public String getHierarchyConfigPath() {
        return hierarchyConfigPath;
    }

    public boolean isEnrichmentEnabled() {
        return enrichmentEnabled;
    }

    public String getDirectoryFile() {
        return directoryFile;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public long getInitialBackoffMillis() {
        return initialBackoffMillis;
    }

    public String getLoggingLevel() {
        return loggingLevel;
    }

    public boolean isConsoleLoggingEnabled() {
        return consoleLoggingEnabled;
    }

    public String getConsoleMode() {
        return consoleMode;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    public String getLogFileName() {
        return logFileName;
    }
}
