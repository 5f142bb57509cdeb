package com.sysmuse.leadership.parse;

import com.sysmuse.leadership.config.HierarchyConfig;
import com.sysmuse.leadership.config.MatchPattern;
import com.sysmuse.leadership.config.PositionConfig;
import com.sysmuse.leadership.config.SectionConfig;
import com.sysmuse.leadership.config.TreeSectionConfig;
import com.sysmuse.leadership.text.TextNormalizer;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves free-text position titles against the positions of a tree section.
 *
 * <p>Positions are tried in match order (priority, then declaration). For each one the
 * exact title is checked first, then its keyword alternatives. The first hit wins; there
 * is no scoring, so a qualified variant such as a WTNB seat must come before the generic
 * seat whose keywords it also satisfies.</p>
 *
 * <p>Keyword matching is token-set containment: the title is split into lower-case words
 * and every term of one alternative must be among them, in any order. A term with
 * several words ("operations manager") needs each of its words present.</p>
 */
public class PositionMatcher {

    private static final String POSITION_LITERAL = "position";

    private final HierarchyConfig config;

    public PositionMatcher(HierarchyConfig config) {
        this.config = config;
    }

    /**
     * Best position in {@code sectionKey} for the given title. Empty for list sections,
     * unknown sections, blank titles, the literal header "position", and unmatched titles.
     */
    public Optional<PositionMatch> match(String positionText, String sectionKey) {
        SectionConfig section = config.getSection(sectionKey);
        if (!(section instanceof TreeSectionConfig)) {
            return Optional.empty();
        }
        String normalized = TextNormalizer.normalize(positionText);
        if (normalized.isEmpty() || POSITION_LITERAL.equals(normalized)) {
            return Optional.empty();
        }
        Set<String> tokens = TextNormalizer.tokenize(normalized);

        for (PositionConfig position : ((TreeSectionConfig) section).getMatchOrder()) {
            MatchPattern pattern = position.getMatchPattern();
            if (pattern.hasExact() && exactMatch(normalized, pattern.getExact())) {
                return Optional.of(new PositionMatch(sectionKey, position, true));
            }
            if (matchesTokens(tokens, pattern.getKeywordAlternatives())) {
                return Optional.of(new PositionMatch(sectionKey, position, false));
            }
        }
        return Optional.empty();
    }

    /**
     * Case-insensitive, trimmed equality.
     */
    public static boolean exactMatch(String text, String exact) {
        if (text == null || exact == null) {
            return false;
        }
        String normalized = TextNormalizer.normalize(text);
        return !normalized.isEmpty() && normalized.equals(TextNormalizer.normalize(exact));
    }

    /**
     * True when at least one alternative has all of its terms among the text's tokens.
     */
    public static boolean fuzzyMatch(String text, List<List<String>> alternatives) {
        return matchesTokens(TextNormalizer.tokenize(text), alternatives);
    }

    private static boolean matchesTokens(Set<String> tokens, List<List<String>> alternatives) {
        if (tokens.isEmpty() || alternatives == null) {
            return false;
        }
        for (List<String> terms : alternatives) {
            if (containsAll(tokens, terms)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsAll(Set<String> tokens, List<String> terms) {
        if (terms.isEmpty()) {
            return false;
        }
        for (String term : terms) {
            List<String> termTokens = TextNormalizer.termTokens(term);
            if (termTokens.isEmpty() || !tokens.containsAll(termTokens)) {
                return false;
            }
        }
        return true;
    }
}
