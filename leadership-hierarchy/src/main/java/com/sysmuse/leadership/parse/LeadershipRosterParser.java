package com.sysmuse.leadership.parse;

import com.sysmuse.leadership.config.HierarchyConfig;
import com.sysmuse.leadership.config.HierarchyConfigException;
import com.sysmuse.leadership.config.HierarchyConfigLoader;
import com.sysmuse.leadership.model.LeadershipHierarchy;
import com.sysmuse.util.LoggingUtil;

import java.util.List;

/**
 * Entry point for turning roster rows into a {@link LeadershipHierarchy}.
 * Instances hold no per-parse state and can be shared.
 */
public class LeadershipRosterParser {

    private final HierarchyConfig config;
    private final HeaderLocator headerLocator;
    private final LeadershipHierarchyBuilder builder;

    /**
     * Parser over the default classpath catalogue.
     */
    public LeadershipRosterParser() throws HierarchyConfigException {
        this(HierarchyConfigLoader.getDefault());
    }

    public LeadershipRosterParser(HierarchyConfig config) {
        this.config = config;
        this.headerLocator = new HeaderLocator();
        this.builder = new LeadershipHierarchyBuilder(config);
    }

    public HierarchyConfig getConfig() {
        return config;
    }

    /**
     * @param rows the raw export, header row(s) included
     * @throws RosterParseException if the input is empty or its header row cannot be resolved
     */
    public LeadershipHierarchy parse(List<List<String>> rows) {
        LoggingUtil.info("Parsing leadership roster (" + (rows == null ? 0 : rows.size()) + " rows, config "
                + config.getVersion() + ")");
        HeaderLocation columns = headerLocator.locate(rows);
        return builder.build(rows, columns);
    }
}
