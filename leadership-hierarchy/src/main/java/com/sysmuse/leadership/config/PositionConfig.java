package com.sysmuse.leadership.config;

/**
 * One canonical seat in a tree section.
 * The role key is dot-separated: "commissioner", "sunday.director" or
 * "small_ball.advanced.director" for role, sub-section + role and
 * sub-section + team + role.
 */
public class PositionConfig {

    private final String roleKey;
    private final String title;
    private final MatchPattern matchPattern;
    private final boolean required;
    private final int priority;
    private final int declarationIndex;

    private final String subSection;
    private final String team;
    private final String role;

    public PositionConfig(String roleKey, String title, MatchPattern matchPattern,
                          boolean required, int priority, int declarationIndex) {
        this.roleKey = roleKey;
        this.title = title;
        this.matchPattern = matchPattern;
        this.required = required;
        this.priority = priority;
        this.declarationIndex = declarationIndex;

        String[] parts = roleKey.split("\\.");
        if (parts.length == 1) {
            this.subSection = null;
            this.team = null;
            this.role = parts[0];
        } else if (parts.length == 2) {
            this.subSection = parts[0];
            this.team = null;
            this.role = parts[1];
        } else if (parts.length == 3) {
            this.subSection = parts[0];
            this.team = parts[1];
            this.role = parts[2];
        } else {
            throw new IllegalArgumentException("Role key has too many levels: " + roleKey);
        }
    }

    public String getRoleKey() {
        return roleKey;
    }

    public String getTitle() {
        return title;
    }

    public MatchPattern getMatchPattern() {
        return matchPattern;
    }

    public boolean isRequired() {
        return required;
    }

    /**
     * Lower is tried first. Positions with equal priority keep declaration order.
     */
    public int getPriority() {
        return priority;
    }

    public int getDeclarationIndex() {
        return declarationIndex;
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

    @Override
    public String toString() {
        return roleKey + " (" + title + ")";
    }
}
