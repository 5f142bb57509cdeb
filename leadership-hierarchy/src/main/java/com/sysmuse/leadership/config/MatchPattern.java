package com.sysmuse.leadership.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * How a configured position is recognised in free-text titles.
 * Either side may be empty but not both: an exact title, and/or a list of
 * keyword alternatives where every term of one alternative must be present.
 */
public class MatchPattern {

    private final String exact;
    private final List<List<String>> keywordAlternatives;

    public MatchPattern(String exact, List<List<String>> keywordAlternatives) {
        this.exact = exact;
        List<List<String>> copy = new ArrayList<>();
        if (keywordAlternatives != null) {
            for (List<String> group : keywordAlternatives) {
                copy.add(Collections.unmodifiableList(new ArrayList<>(group)));
            }
        }
        this.keywordAlternatives = Collections.unmodifiableList(copy);
    }

    public static MatchPattern exact(String value) {
        return new MatchPattern(value, null);
    }

    public static MatchPattern keywords(List<List<String>> alternatives) {
        return new MatchPattern(null, alternatives);
    }

    /**
     * @return exact title or null when the position is keyword-matched only
     */
    public String getExact() {
        return exact;
    }

    public boolean hasExact() {
        return exact != null && !exact.isEmpty();
    }

    public List<List<String>> getKeywordAlternatives() {
        return keywordAlternatives;
    }

    @Override
    public String toString() {
        return hasExact() ? "exact(" + exact + ")" + (keywordAlternatives.isEmpty() ? "" : "|" + keywordAlternatives)
                : "keywords" + keywordAlternatives;
    }
}
