package com.sysmuse.leadership.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A top-level section of the roster. Every section is either a role-keyed
 * tree ({@link TreeSectionConfig}) or a flat member list ({@link ListSectionConfig});
 * the kind is fixed when the catalogue is loaded.
 */
public abstract class SectionConfig {

    private final String key;
    private final String name;
    private final List<String> csvSectionHeaders;

    protected SectionConfig(String key, String name, List<String> csvSectionHeaders) {
        this.key = key;
        this.name = name;
        this.csvSectionHeaders = Collections.unmodifiableList(new ArrayList<>(csvSectionHeaders));
    }

    public String getKey() {
        return key;
    }

    public String getName() {
        return name;
    }

    /**
     * Marker strings that open this section in the roster, in declared order.
     */
    public List<String> getCsvSectionHeaders() {
        return csvSectionHeaders;
    }

    public abstract boolean isList();

    /**
     * Positions in declared order. Empty for list sections.
     */
    public abstract List<PositionConfig> getPositions();
}
