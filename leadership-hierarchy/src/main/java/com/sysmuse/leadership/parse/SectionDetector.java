package com.sysmuse.leadership.parse;

import com.sysmuse.leadership.config.HierarchyConfig;
import com.sysmuse.leadership.config.SectionConfig;
import com.sysmuse.leadership.text.TextNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recognises section marker rows using the catalogue's section headers.
 * A marker occupies the leading cell only; the name cell must be empty.
 *
 * <p>Headers ending in "leadership team" also match with a trailing qualifier
 * ("Kickball Leadership Team (2024)"); every other header must match exactly.</p>
 */
public class SectionDetector {

    private static final String POSITION_LITERAL = "position";
    private static final String TEAM_SUFFIX = "leadership team";

    private final List<String[]> markers = new ArrayList<>();

    public SectionDetector(HierarchyConfig config) {
        for (SectionConfig section : config.getSections().values()) {
            for (String header : section.getCsvSectionHeaders()) {
                markers.add(new String[]{TextNormalizer.normalize(header), section.getKey()});
            }
        }
    }

    /**
     * @param markerCell candidate marker (position column)
     * @param nameCell   the same row's name cell
     * @return section key when the row is a section marker
     */
    public Optional<String> detect(String markerCell, String nameCell) {
        if (!TextNormalizer.isBlank(nameCell)) {
            return Optional.empty();
        }
        String text = TextNormalizer.normalize(markerCell);
        if (text.isEmpty() || POSITION_LITERAL.equals(text)) {
            return Optional.empty();
        }
        for (String[] marker : markers) {
            if (matches(text, marker[0])) {
                return Optional.of(marker[1]);
            }
        }
        return Optional.empty();
    }

    static boolean matches(String normalizedCell, String header) {
        if (header.endsWith(TEAM_SUFFIX)) {
            return HeaderLocator.matchesLabel(normalizedCell, header);
        }
        return normalizedCell.equals(header);
    }
}
