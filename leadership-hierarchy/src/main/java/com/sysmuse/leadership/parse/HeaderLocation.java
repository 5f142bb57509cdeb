package com.sysmuse.leadership.parse;

/**
 * Header row index and the column indices read from each data row.
 * Optional columns that are not present are -1.
 */
public final class HeaderLocation {

    public static final int ABSENT = -1;

    private final int headerRowIndex;
    private final int positionColumn;
    private final int nameColumn;
    private final int barsEmailColumn;
    private final int personalEmailColumn;
    private final int phoneColumn;
    private final int birthdayColumn;

    public HeaderLocation(int headerRowIndex, int positionColumn, int nameColumn, int barsEmailColumn,
                          int personalEmailColumn, int phoneColumn, int birthdayColumn) {
        this.headerRowIndex = headerRowIndex;
        this.positionColumn = positionColumn;
        this.nameColumn = nameColumn;
        this.barsEmailColumn = barsEmailColumn;
        this.personalEmailColumn = personalEmailColumn;
        this.phoneColumn = phoneColumn;
        this.birthdayColumn = birthdayColumn;
    }

    public int getHeaderRowIndex() {
        return headerRowIndex;
    }

    public int getPositionColumn() {
        return positionColumn;
    }

    public int getNameColumn() {
        return nameColumn;
    }

    public int getBarsEmailColumn() {
        return barsEmailColumn;
    }

    public int getPersonalEmailColumn() {
        return personalEmailColumn;
    }

    public int getPhoneColumn() {
        return phoneColumn;
    }

    public int getBirthdayColumn() {
        return birthdayColumn;
    }

    @Override
    public String toString() {
        return "HeaderLocation{row=" + headerRowIndex + ", position=" + positionColumn + ", name=" + nameColumn
                + ", barsEmail=" + barsEmailColumn + ", personalEmail=" + personalEmailColumn
                + ", phone=" + phoneColumn + ", birthday=" + birthdayColumn + "}";
    }
}
