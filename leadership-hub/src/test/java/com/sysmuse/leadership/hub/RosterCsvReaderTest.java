package com.sysmuse.leadership.hub;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RosterCsvReaderTest {

    private final RosterCsvReader reader = new RosterCsvReader();

    @Test
    public void testQuotedCommasAndEscapedQuotes() {
        List<List<String>> rows = reader.parse("\"Director of Bowling, Sunday\",\"Jordan \"\"JJ\"\" Smith\",jj@bars.org\n");

        assertEquals(1, rows.size());
        assertEquals(Arrays.asList("Director of Bowling, Sunday", "Jordan \"JJ\" Smith", "jj@bars.org"), rows.get(0));
    }

    @Test
    public void testLineBreakInsideQuotes() {
        List<List<String>> rows = reader.parse("POSITION,NAME\r\n\"Operations\nManager\",Drew\r\n");

        assertEquals(2, rows.size());
        assertEquals(Arrays.asList("POSITION", "NAME"), rows.get(0));
        assertEquals(Arrays.asList("Operations\nManager", "Drew"), rows.get(1));
    }

    @Test
    public void testBomAndTrailingEmptyCells() {
        List<List<String>> rows = reader.parse("\uFEFFEXECUTIVE BOARD,,,\n,,,\nlast,row");

        assertEquals(3, rows.size());
        assertEquals(Arrays.asList("EXECUTIVE BOARD", "", "", ""), rows.get(0));
        assertEquals(Arrays.asList("", "", "", ""), rows.get(1));
        assertEquals(Arrays.asList("last", "row"), rows.get(2));
    }

    @Test
    public void testReadSampleFile() throws Exception {
        List<List<String>> rows = reader.read(Paths.get("src/test/resources/rosters/sample_roster.csv"));

        assertEquals(17, rows.size());
        assertEquals("BARS Leadership Roster", rows.get(0).get(0));
        assertEquals("POSITION", rows.get(1).get(0));
        assertEquals("Commissioner of Diversity, Equity & Inclusion", rows.get(5).get(0));
        assertEquals(6, rows.get(3).size());
    }
}
