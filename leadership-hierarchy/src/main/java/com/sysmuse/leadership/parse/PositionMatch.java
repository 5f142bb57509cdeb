package com.sysmuse.leadership.parse;

import com.sysmuse.leadership.config.PositionConfig;
import com.sysmuse.leadership.model.HierarchyPath;

/**
 * Result of resolving a position title inside a section.
 */
public final class PositionMatch {

    private final String sectionKey;
    private final PositionConfig position;
    private final boolean exact;

    public PositionMatch(String sectionKey, PositionConfig position, boolean exact) {
        this.sectionKey = sectionKey;
        this.position = position;
        this.exact = exact;
    }

    public String getSectionKey() {
        return sectionKey;
    }

    public PositionConfig getPosition() {
        return position;
    }

    public String getSubSection() {
        return position.getSubSection();
    }

    public String getTeam() {
        return position.getTeam();
    }

    public String getRole() {
        return position.getRole();
    }

    public String getRoleKey() {
        return position.getRoleKey();
    }

    /**
     * True when the exact title matched rather than keywords.
     */
    public boolean isExact() {
        return exact;
    }

    public HierarchyPath getPath() {
        return new HierarchyPath(sectionKey, position.getSubSection(), position.getTeam(), position.getRole());
    }

    @Override
    public String toString() {
        return getPath() + (exact ? " (exact)" : " (keywords)");
    }
}
