package com.sysmuse.leadership.hub;

import com.sysmuse.util.LoggingUtil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a roster export into rows of cells. Handles quoted cells containing commas,
 * doubled quotes and line breaks, CRLF line endings and a leading byte order mark.
 * Every physical row is kept, blank ones included.
 */
public class RosterCsvReader {

    public List<List<String>> read(Path csvFile) throws IOException {
        LoggingUtil.info("Reading roster CSV: " + csvFile);
        String content = new String(Files.readAllBytes(csvFile), StandardCharsets.UTF_8);
        List<List<String>> rows = parse(content);
        LoggingUtil.info("Read " + rows.size() + " rows from " + csvFile.getFileName());
        return rows;
    }

    public List<List<String>> parse(String content) {
        // Remove BOM if present
        if (content.length() > 0 && content.charAt(0) == '\uFEFF') {
            content = content.substring(1);
            LoggingUtil.debug("Removed BOM from roster content");
        }

        List<String> rowStrings = splitRows(content);
        List<List<String>> rows = new ArrayList<>(rowStrings.size());
        for (String rowString : rowStrings) {
            rows.add(parseRow(rowString));
        }
        return rows;
    }

    /**
     * Split on line breaks outside quotes.
     */
    private List<String> splitRows(String content) {
        List<String> rowStrings = new ArrayList<>();
        boolean inQuotes = false;
        int rowStart = 0;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '"') {
                inQuotes = !inQuotes;
            } else if (c == '\n' && !inQuotes) {
                rowStrings.add(stripCarriageReturn(content.substring(rowStart, i)));
                rowStart = i + 1;
            }
        }
        if (rowStart < content.length()) {
            rowStrings.add(stripCarriageReturn(content.substring(rowStart)));
        }
        return rowStrings;
    }

    private static String stripCarriageReturn(String row) {
        return row.endsWith("\r") ? row.substring(0, row.length() - 1) : row;
    }

    /**
     * Parse a CSV row considering quoted fields. A trailing comma yields a trailing empty cell.
     */
    List<String> parseRow(String rowData) {
        List<String> values = new ArrayList<>();
        StringBuilder currentValue = new StringBuilder();
        boolean inQuotes = false;

        for (int i = 0; i < rowData.length(); i++) {
            char c = rowData.charAt(i);

            if (c == '"') {
                if (inQuotes && i + 1 < rowData.length() && rowData.charAt(i + 1) == '"') {
                    currentValue.append('"');
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
                continue;
            }

            if (c == ',' && !inQuotes) {
                values.add(currentValue.toString());
                currentValue = new StringBuilder();
                continue;
            }

            currentValue.append(c);
        }
        values.add(currentValue.toString());
        return values;
    }
}
