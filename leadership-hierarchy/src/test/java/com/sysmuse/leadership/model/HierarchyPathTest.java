package com.sysmuse.leadership.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.*;

public class HierarchyPathTest {

    @Test
    public void testDotPaths() {
        assertEquals("executive_board.commissioner",
                new HierarchyPath("executive_board", null, null, "commissioner").toDotPath());
        assertEquals("bowling.sunday.director", new HierarchyPath("bowling", "sunday", null, "director").toDotPath());
        assertEquals("dodgeball.small_ball.advanced.director",
                new HierarchyPath("dodgeball", "small_ball", "advanced", "director").toDotPath());
    }

    @Test
    public void testParse() {
        HierarchyPath path = HierarchyPath.parse("dodgeball.small_ball.advanced.director");
        assertEquals(Arrays.asList("dodgeball", "small_ball", "advanced", "director"), path.segments());
        assertEquals("small_ball.advanced.director", path.roleKey());

        assertEquals("commissioner", HierarchyPath.parse("executive_board.commissioner").roleKey());
        assertThrows(IllegalArgumentException.class, () -> HierarchyPath.parse("bowling"));
    }

    @Test
    public void testTeamNeedsSubSection() {
        assertThrows(IllegalArgumentException.class, () -> new HierarchyPath("dodgeball", null, "advanced", "director"));
    }

    @Test
    public void testDisplayName() {
        assertEquals("Bowling - Sunday - Director", HierarchyPath.parse("bowling.sunday.director").getDisplayName());
        assertEquals("Bowling - Monday WTNB - Operations Manager",
                HierarchyPath.parse("bowling.monday_wtnb.ops_manager").getDisplayName());
        assertEquals("Executive Board - DEI Commissioner",
                HierarchyPath.parse("executive_board.dei_commissioner").getDisplayName());
    }

    @Test
    public void testOrderingAndEquality() {
        HierarchyPath a = HierarchyPath.parse("bowling.sunday.director");
        HierarchyPath b = new HierarchyPath("bowling", "sunday", null, "director");
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertTrue(a.compareTo(HierarchyPath.parse("executive_board.commissioner")) < 0);
    }

    @Test
    public void testEqualPathsHashAlikeWhateverTheSplit() {
        HierarchyPath nested = new HierarchyPath("bowling", "sunday", null, "director");
        HierarchyPath flat = new HierarchyPath("bowling", null, null, "sunday.director");

        assertEquals(nested, flat);
        assertEquals(nested.hashCode(), flat.hashCode());
        assertEquals(1, new HashSet<>(Arrays.asList(nested, flat)).size());
    }
}
