package com.sysmuse.leadership.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Address of a seat: {@code section[.sub_section][.team].role}.
 */
public final class HierarchyPath implements Comparable<HierarchyPath> {

    private final String section;
    private final String subSection;
    private final String team;
    private final String role;

    public HierarchyPath(String section, String subSection, String team, String role) {
        if (section == null || role == null) {
            throw new IllegalArgumentException("Section and role are required");
        }
        if (team != null && subSection == null) {
            throw new IllegalArgumentException("Team requires a sub-section: " + section + "." + team + "." + role);
        }
        this.section = section;
        this.subSection = subSection;
        this.team = team;
        this.role = role;
    }

    public static HierarchyPath parse(String dotPath) {
        String[] parts = dotPath.split("\\.");
        switch (parts.length) {
            case 2:
                return new HierarchyPath(parts[0], null, null, parts[1]);
            case 3:
                return new HierarchyPath(parts[0], parts[1], null, parts[2]);
            case 4:
                return new HierarchyPath(parts[0], parts[1], parts[2], parts[3]);
            default:
                throw new IllegalArgumentException("Not a hierarchy path: " + dotPath);
        }
    }

    public String getSection() {
        return section;
    }

    public String getSubSection() {
        return subSection;
    }

    public String getTeam() {
        return team;
    }

    public String getRole() {
        return role;
    }

    public List<String> segments() {
        List<String> segments = new ArrayList<>(4);
        segments.add(section);
        if (subSection != null) {
            segments.add(subSection);
        }
        if (team != null) {
            segments.add(team);
        }
        segments.add(role);
        return segments;
    }

    /**
     * Role key relative to the section, e.g. {@code sunday.director}.
     */
    public String roleKey() {
        List<String> segments = segments();
        return String.join(".", segments.subList(1, segments.size()));
    }

    public String toDotPath() {
        return String.join(".", segments());
    }

    /**
     * Human readable form, e.g. "Bowling - Sunday - Director".
     */
    public String getDisplayName() {
        List<String> words = new ArrayList<>();
        for (String segment : segments()) {
            words.add(humanize(segment));
        }
        return String.join(" - ", words);
    }

    static String humanize(String key) {
        StringBuilder out = new StringBuilder();
        for (String word : key.split("_")) {
            if (word.isEmpty()) {
                continue;
            }
            if (out.length() > 0) {
                out.append(' ');
            }
            if ("wtnb".equals(word) || "dei".equals(word)) {
                out.append(word.toUpperCase(Locale.ROOT));
            } else if ("ops".equals(word)) {
                out.append("Operations");
            } else {
                out.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
            }
        }
        return out.toString();
    }

    @Override
    public int compareTo(HierarchyPath other) {
        return toDotPath().compareTo(other.toDotPath());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HierarchyPath)) {
            return false;
        }
        return toDotPath().equals(((HierarchyPath) o).toDotPath());
    }

    @Override
    public int hashCode() {
        return toDotPath().hashCode();
    }

    @Override
    public String toString() {
        return toDotPath();
    }
}
