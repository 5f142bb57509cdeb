package com.sysmuse.leadership.config;

import java.util.Collections;
import java.util.List;

/**
 * Flat roster section such as general committee members: every data row is kept,
 * keyed by its own title rather than matched against positions.
 */
public class ListSectionConfig extends SectionConfig {

    public ListSectionConfig(String key, String name, List<String> csvSectionHeaders) {
        super(key, name, csvSectionHeaders);
    }

    @Override
    public boolean isList() {
        return true;
    }

    @Override
    public List<PositionConfig> getPositions() {
        return Collections.emptyList();
    }
}
