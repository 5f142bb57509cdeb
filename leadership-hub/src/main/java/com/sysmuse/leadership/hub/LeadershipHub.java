package com.sysmuse.leadership.hub;

import com.sysmuse.leadership.config.HierarchyConfig;
import com.sysmuse.leadership.config.HierarchyConfigLoader;
import com.sysmuse.leadership.model.CompletenessAnalyzer;
import com.sysmuse.leadership.model.CompletenessReport;
import com.sysmuse.leadership.model.LeadershipHierarchy;
import com.sysmuse.leadership.parse.LeadershipRosterParser;
import com.sysmuse.util.LoggingUtil;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Properties;

/**
 * Command-line driver: roster CSV in, leadership hierarchy JSON out.
 *
 * <pre>
 * LeadershipHub &lt;input.csv&gt; [output.json] [hubconfig.json]
 * </pre>
 *
 * Without arguments the input and output come from the hub config named in
 * application.properties.
 */
public class LeadershipHub {

    private Properties properties = new Properties();
    private HubSettings settings = new HubSettings();

    public static void main(String[] args) {
        System.exit(new LeadershipHub().run(args));
    }

    /**
     * @return process exit status, 0 on success
     */
    public int run(String[] args) {
        try {
            properties = loadDefaultProperties();

            String inputArg = args.length > 0 ? args[0] : null;
            String outputArg = args.length > 1 ? args[1] : null;
            String hubConfigPath = args.length > 2 ? args[2] : defaultHubConfigPath();

            settings = new HubSettings(hubConfigPath);
            if (inputArg != null) {
                settings.setInputPath(inputArg);
            }
            if (outputArg != null) {
                settings.setOutputPath(outputArg);
            }

            // settings loading may already have logged at the default level
            LoggingUtil.reset();
            LoggingUtil.setConsoleOutputMode(LoggingUtil.parseConsoleOutputMode(settings.getConsoleMode()));
            LoggingUtil.initialize(settings.getLoggingLevel(), settings.isConsoleLoggingEnabled(),
                    settings.isFileLoggingEnabled(), settings.getLogFileName());
            settings.printDebug();

            if (settings.getInputPath().isEmpty()) {
                LoggingUtil.error("No input roster specified");
                LoggingUtil.info("Usage: LeadershipHub <input.csv> [output.json] [hubconfig.json]");
                return 2;
            }

            process(settings);
            return 0;
        } catch (Exception e) {
            LoggingUtil.error("Error during processing: " + e.getMessage(), e);
            return 1;
        }
    }

    /**
     * Parse, optionally enrich, report and write one roster.
     */
    public LeadershipHierarchy process(HubSettings settings) throws IOException {
        HierarchyConfig config = settings.getHierarchyConfigPath().isEmpty()
                ? HierarchyConfigLoader.getDefault()
                : new HierarchyConfigLoader().load(Paths.get(settings.getHierarchyConfigPath()));

        List<List<String>> rows = new RosterCsvReader().read(Paths.get(settings.getInputPath()));
        LeadershipHierarchy hierarchy = new LeadershipRosterParser(config).parse(rows);

        if (settings.isEnrichmentEnabled()) {
            hierarchy = enrich(hierarchy, settings);
        }

        HierarchyJsonWriter writer = new HierarchyJsonWriter();
        CompletenessReport report = new CompletenessAnalyzer().analyze(hierarchy);
        LoggingUtil.info("Run report:\n" + writer.reportJson(hierarchy.getSummary(), report));
        for (String path : report.getMissingRequired()) {
            LoggingUtil.warn("Required position not listed: " + path);
        }
        for (String path : report.getIncomplete()) {
            LoggingUtil.warn("Position missing name or email: " + path);
        }

        Path output = Paths.get(settings.getOutputPath().isEmpty()
                ? defaultOutputPath(settings.getInputPath())
                : settings.getOutputPath());
        writer.write(hierarchy, output);
        return hierarchy;
    }

    private LeadershipHierarchy enrich(LeadershipHierarchy hierarchy, HubSettings settings) throws IOException {
        if (settings.getDirectoryFile().isEmpty()) {
            LoggingUtil.warn("Enrichment enabled but no directory file configured, skipping");
            return hierarchy;
        }
        AccountDirectory directory = JsonAccountDirectory.load(Paths.get(settings.getDirectoryFile()));
        AccountLookupService lookupService = new AccountLookupService(directory,
                settings.getMaxWorkers(), settings.getMaxRetries(), settings.getInitialBackoffMillis());
        return new AccountEnrichmentService(lookupService).enrich(hierarchy);
    }

    static String defaultOutputPath(String inputPath) {
        int dot = inputPath.lastIndexOf('.');
        int slash = Math.max(inputPath.lastIndexOf('/'), inputPath.lastIndexOf('\\'));
        String base = dot > slash ? inputPath.substring(0, dot) : inputPath;
        return base + "_hierarchy.json";
    }

    private String defaultHubConfigPath() {
        String directory = properties.getProperty("hubconfig.directory", "");
        String filename = properties.getProperty("hubconfig.filename", "hubconfig.json");
        return Paths.get(directory, filename).toString();
    }

    private static Properties loadDefaultProperties() {
        Properties defaults = new Properties();
        try (InputStream in = LeadershipHub.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null) {
                defaults.load(in);
                LoggingUtil.debug("Loaded default properties");
            } else {
                LoggingUtil.info("Default properties file not found, using built-in defaults");
            }
        } catch (IOException e) {
            LoggingUtil.error("Error loading default properties: " + e.getMessage());
        }
        return defaults;
    }

    public HubSettings getSettings() {
        return settings;
    }
}
