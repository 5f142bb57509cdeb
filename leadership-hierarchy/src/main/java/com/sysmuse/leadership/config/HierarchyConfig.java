package com.sysmuse.leadership.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loaded leadership catalogue. Immutable once built by {@link HierarchyConfigLoader}.
 * Section iteration order is the order sections are declared in the document.
 */
public class HierarchyConfig {

    private final String version;
    private final Map<String, SectionConfig> sections;
    private final List<String> sports;

    public HierarchyConfig(String version, Map<String, SectionConfig> sections, List<String> sports) {
        this.version = version;
        this.sections = Collections.unmodifiableMap(new LinkedHashMap<>(sections));
        this.sports = Collections.unmodifiableList(new ArrayList<>(sports));
    }

    public String getVersion() {
        return version;
    }

    public Map<String, SectionConfig> getSections() {
        return sections;
    }

    public Set<String> getSectionKeys() {
        return sections.keySet();
    }

    public SectionConfig getSection(String sectionKey) {
        return sections.get(sectionKey);
    }

    /**
     * Valid sport keys shared with anything else that needs the sport list.
     */
    public List<String> getSports() {
        return sports;
    }

    /**
     * Position config for a section and role key, or null when either is unknown
     * or the section is a list section.
     */
    public PositionConfig getPosition(String sectionKey, String roleKey) {
        SectionConfig section = sections.get(sectionKey);
        if (section instanceof TreeSectionConfig) {
            return ((TreeSectionConfig) section).getPosition(roleKey);
        }
        return null;
    }

    /**
     * Every tree position flagged required, keyed by dot path
     * ({@code section.role_key}), in declaration order.
     */
    public Map<String, PositionConfig> getRequiredPositions() {
        Map<String, PositionConfig> required = new LinkedHashMap<>();
        for (SectionConfig section : sections.values()) {
            for (PositionConfig position : section.getPositions()) {
                if (position.isRequired()) {
                    required.put(section.getKey() + "." + position.getRoleKey(), position);
                }
            }
        }
        return required;
    }
}
