package com.sysmuse.leadership.parse;

import com.sysmuse.leadership.config.HierarchyConfig;
import com.sysmuse.leadership.config.SectionConfig;
import com.sysmuse.leadership.model.LeadershipHierarchy;
import com.sysmuse.leadership.model.PersonInfo;
import com.sysmuse.leadership.model.RosterEntry;
import com.sysmuse.leadership.text.TextNormalizer;
import com.sysmuse.util.LoggingUtil;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single forward pass over roster rows that threads the active section and fills a
 * {@link LeadershipHierarchy}.
 *
 * <p>No section is active until the first marker row. Each row is classified and handled:</p>
 * <ul>
 *   <li>the header row, blank rows and repeated "position" header rows are skipped</li>
 *   <li>rows missing either the position or the name are skipped</li>
 *   <li>a section marker makes its section active</li>
 *   <li>data rows before any marker are dropped</li>
 *   <li>in a list section every row with a position is appended, vacant or not</li>
 *   <li>in a tree section the title is matched; unmatched titles are dropped, vacant
 *       seats go to the vacant set and everything else is written at its path</li>
 * </ul>
 */
public class LeadershipHierarchyBuilder {

    enum RowKind {
        HEADER,
        SECTION_MARKER,
        BLANK,
        REPEATED_HEADER,
        NO_POSITION,
        NO_NAME,
        ORPHAN,
        LIST_MEMBER,
        UNMATCHED,
        VACANT,
        FILLED
    }

    private final HierarchyConfig config;
    private final SectionDetector sectionDetector;
    private final PositionMatcher positionMatcher;

    public LeadershipHierarchyBuilder(HierarchyConfig config) {
        this(config, new SectionDetector(config), new PositionMatcher(config));
    }

    public LeadershipHierarchyBuilder(HierarchyConfig config, SectionDetector sectionDetector,
                                      PositionMatcher positionMatcher) {
        this.config = config;
        this.sectionDetector = sectionDetector;
        this.positionMatcher = positionMatcher;
    }

    public LeadershipHierarchy build(List<List<String>> rows, HeaderLocation columns) {
        LeadershipHierarchy hierarchy = new LeadershipHierarchy(config);
        PersonExtractor extractor = new PersonExtractor(columns);
        Map<RowKind, Integer> counts = new EnumMap<>(RowKind.class);

        String currentSection = null;
        for (int i = 0; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            RowKind kind;

            if (i == columns.getHeaderRowIndex()) {
                kind = RowKind.HEADER;
            } else if (isBlankRow(row)) {
                kind = RowKind.BLANK;
            } else {
                String positionText = PersonExtractor.cell(row, columns.getPositionColumn());
                String nameText = PersonExtractor.cell(row, columns.getNameColumn());
                Optional<String> section = sectionDetector.detect(positionText, nameText);

                if (section.isPresent()) {
                    currentSection = section.get();
                    LoggingUtil.debug("Row " + i + ": entering section " + currentSection);
                    kind = RowKind.SECTION_MARKER;
                } else if ("position".equals(TextNormalizer.normalize(positionText))) {
                    kind = RowKind.REPEATED_HEADER;
                } else if (positionText.isEmpty()) {
                    LoggingUtil.debug("Row " + i + ": no position text, skipped");
                    kind = RowKind.NO_POSITION;
                } else if (nameText.isEmpty()) {
                    LoggingUtil.debug("Row " + i + ": '" + positionText + "' has no name, skipped");
                    kind = RowKind.NO_NAME;
                } else if (currentSection == null) {
                    LoggingUtil.debug("Row " + i + ": '" + positionText + "' before any section, dropped");
                    kind = RowKind.ORPHAN;
                } else {
                    kind = handleDataRow(hierarchy, extractor, currentSection, row, positionText, i);
                }
            }
            counts.merge(kind, 1, Integer::sum);
        }

        hierarchy.freeze();
        LoggingUtil.info("Parsed " + rows.size() + " roster rows: " + counts + ", " + hierarchy.getSummary());
        return hierarchy;
    }

    private RowKind handleDataRow(LeadershipHierarchy hierarchy, PersonExtractor extractor,
                                  String sectionKey, List<String> row, String positionText, int rowIndex) {
        SectionConfig section = config.getSection(sectionKey);

        if (section.isList()) {
            PersonInfo person = extractor.extract(row, positionText);
            hierarchy.addMember(sectionKey, new RosterEntry(TextNormalizer.toSnakeCase(positionText), person));
            return RowKind.LIST_MEMBER;
        }

        Optional<PositionMatch> match = positionMatcher.match(positionText, sectionKey);
        if (!match.isPresent()) {
            LoggingUtil.debug("Row " + rowIndex + ": no position in " + sectionKey + " matches '" + positionText + "'");
            return RowKind.UNMATCHED;
        }

        PositionMatch resolved = match.get();
        PersonInfo person = extractor.extract(row, positionText);
        if (person.isVacant()) {
            if (!hierarchy.addVacant(sectionKey, resolved.getPosition())) {
                LoggingUtil.warn("Row " + rowIndex + ": " + resolved.getPath()
                        + " marked vacant but already filled, keeping the existing person");
            }
            return RowKind.VACANT;
        }

        PersonInfo previous = hierarchy.addPosition(sectionKey, resolved.getPosition(), person);
        if (previous != null) {
            LoggingUtil.warn("Row " + rowIndex + ": " + resolved.getPath() + " already held by "
                    + previous.getName() + ", replaced by " + person.getName());
        }
        if (!person.isComplete()) {
            LoggingUtil.debug("Row " + rowIndex + ": " + resolved.getPath() + " is missing a name or email");
        }
        return RowKind.FILLED;
    }

    private static boolean isBlankRow(List<String> row) {
        if (row == null) {
            return true;
        }
        for (String cell : row) {
            if (!TextNormalizer.isBlank(cell)) {
                return false;
            }
        }
        return true;
    }
}
