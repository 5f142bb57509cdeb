package com.sysmuse.leadership.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

public class TreeSectionConfig extends SectionConfig {

    private final List<PositionConfig> positions;
    private final List<PositionConfig> matchOrder;

    public TreeSectionConfig(String key, String name, List<String> csvSectionHeaders,
                             List<PositionConfig> positions) {
        super(key, name, csvSectionHeaders);
        this.positions = Collections.unmodifiableList(new ArrayList<>(positions));

        List<PositionConfig> ordered = new ArrayList<>(positions);
        ordered.sort(Comparator.comparingInt(PositionConfig::getPriority)
                .thenComparingInt(PositionConfig::getDeclarationIndex));
        this.matchOrder = Collections.unmodifiableList(ordered);
    }

    @Override
    public boolean isList() {
        return false;
    }

    @Override
    public List<PositionConfig> getPositions() {
        return positions;
    }

    /**
     * Positions in the order the matcher tries them: ascending priority, then declaration order.
     */
    public List<PositionConfig> getMatchOrder() {
        return matchOrder;
    }

    public PositionConfig getPosition(String roleKey) {
        for (PositionConfig position : positions) {
            if (position.getRoleKey().equals(roleKey)) {
                return position;
            }
        }
        return null;
    }
}
