package com.sysmuse.leadership.parse;

import com.sysmuse.leadership.text.TextNormalizer;
import com.sysmuse.util.LoggingUtil;

import java.util.Arrays;
import java.util.List;

/**
 * Finds the column header row of a roster and the columns the parser reads.
 */
public class HeaderLocator {

    static final List<String> POSITION_HEADERS = Arrays.asList("position", "title");
    static final List<String> BARS_EMAIL_HEADERS = Arrays.asList("bars email", "bars_email");
    static final List<String> NAME_HEADERS = Arrays.asList("name", "full name");
    static final List<String> PERSONAL_EMAIL_HEADERS = Arrays.asList("personal email", "personal_email");
    static final List<String> PHONE_HEADERS = Arrays.asList("phone", "phone number");
    static final List<String> BIRTHDAY_HEADERS = Arrays.asList("birthday", "date of birth");

    /**
     * @throws RosterParseException when the input is empty, no row looks like a header,
     *                              or a header row lacks the position or primary email column
     */
    public HeaderLocation locate(List<List<String>> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new RosterParseException(RosterParseException.Reason.EMPTY_INPUT);
        }

        int headerRow = findHeaderRow(rows);
        if (headerRow < 0) {
            int partial = findPartialHeaderRow(rows);
            if (partial >= 0) {
                throw new RosterParseException(RosterParseException.Reason.MISSING_REQUIRED_COLUMNS,
                        "header-like row " + partial + " " + rows.get(partial));
            }
            throw new RosterParseException(RosterParseException.Reason.HEADER_NOT_FOUND);
        }

        List<String> header = rows.get(headerRow);
        int positionCol = findColumn(header, POSITION_HEADERS);
        int barsEmailCol = findEmailColumn(header);

        int nameCol = findColumn(header, NAME_HEADERS);
        if (nameCol < 0 || nameCol == positionCol) {
            nameCol = positionCol + 1;
            LoggingUtil.debug("No NAME header, using column " + nameCol + " after POSITION");
        }

        HeaderLocation location = new HeaderLocation(headerRow, positionCol, nameCol, barsEmailCol,
                findColumn(header, PERSONAL_EMAIL_HEADERS),
                findColumn(header, PHONE_HEADERS),
                findColumn(header, BIRTHDAY_HEADERS));
        LoggingUtil.debug("Located roster header: " + location);
        return location;
    }

    /**
     * Index of the first row holding both a position-like and a primary-email-like header, or -1.
     */
    public static int findHeaderRow(List<List<String>> rows) {
        for (int i = 0; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            if (findColumn(row, POSITION_HEADERS) >= 0 && findEmailColumn(row) >= 0) {
                return i;
            }
        }
        return -1;
    }

    private static int findPartialHeaderRow(List<List<String>> rows) {
        for (int i = 0; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            if (findColumn(row, POSITION_HEADERS) >= 0 || findEmailColumn(row) >= 0
                    || findColumn(row, NAME_HEADERS) >= 0) {
                return i;
            }
        }
        return -1;
    }

    /**
     * First cell that equals one of the candidates, or starts with one followed by a non-letter
     * ("POSITION / TITLE"). -1 when none does.
     */
    public static int findColumn(List<String> row, List<String> candidates) {
        if (row == null) {
            return -1;
        }
        for (int i = 0; i < row.size(); i++) {
            String cell = TextNormalizer.normalize(row.get(i));
            for (String candidate : candidates) {
                if (matchesLabel(cell, candidate)) {
                    return i;
                }
            }
        }
        return -1;
    }

    static boolean matchesLabel(String normalizedCell, String label) {
        if (normalizedCell.equals(label)) {
            return true;
        }
        return normalizedCell.startsWith(label)
                && !Character.isLetter(normalizedCell.charAt(label.length()));
    }

    private static int findEmailColumn(List<String> row) {
        if (row == null) {
            return -1;
        }
        for (int i = 0; i < row.size(); i++) {
            String cell = TextNormalizer.normalize(row.get(i));
            for (String candidate : BARS_EMAIL_HEADERS) {
                if (cell.contains(candidate)) {
                    return i;
                }
            }
        }
        return -1;
    }
}
