package com.sysmuse.leadership.parse;

import com.sysmuse.leadership.model.PersonInfo;
import com.sysmuse.leadership.text.TextNormalizer;
import com.sysmuse.util.LoggingUtil;

import java.util.List;

/**
 * Reads a data row into a {@link PersonInfo} using the located columns.
 */
public class PersonExtractor {

    private final HeaderLocation columns;

    public PersonExtractor(HeaderLocation columns) {
        this.columns = columns;
    }

    /**
     * A vacant name stops extraction: nothing past the name column is read.
     *
     * @param positionLabel cleaned position text, kept on the record
     */
    public PersonInfo extract(List<String> row, String positionLabel) {
        String name = cell(row, columns.getNameColumn());
        if (PersonInfo.isVacantName(name)) {
            LoggingUtil.trace("Vacant seat: " + positionLabel);
            return PersonInfo.vacant(positionLabel, name);
        }

        return new PersonInfo(
                positionLabel,
                name,
                cell(row, columns.getBarsEmailColumn()),
                cell(row, columns.getPersonalEmailColumn()),
                cell(row, columns.getPhoneColumn()),
                cell(row, columns.getBirthdayColumn()),
                null);
    }

    /**
     * Cleaned cell text; empty for absent columns and short rows.
     */
    static String cell(List<String> row, int index) {
        if (row == null || index < 0 || index >= row.size()) {
            return "";
        }
        return TextNormalizer.clean(row.get(index));
    }
}
