package com.sysmuse.leadership.model;

import com.sysmuse.leadership.config.HierarchyConfig;
import com.sysmuse.leadership.config.HierarchyConfigLoader;
import com.sysmuse.leadership.config.PositionConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class LeadershipHierarchyTest {

    private HierarchyConfig config;
    private LeadershipHierarchy hierarchy;

    private static PersonInfo person(String position, String name, String email) {
        return new PersonInfo(position, name, email, null, null, null, null);
    }

    @BeforeEach
    public void setUp() throws Exception {
        config = new HierarchyConfigLoader().loadFromClasspath("leadership/test-hierarchy.json");
        hierarchy = new LeadershipHierarchy(config);
    }

    private PositionConfig position(String section, String roleKey) {
        return config.getPosition(section, roleKey);
    }

    @Test
    public void testEverySectionHasASlot() {
        assertEquals(Arrays.asList("executive_board", "dodgeball", "committee_members"),
                Arrays.asList(hierarchy.getSections().keySet().toArray(new String[0])));
        assertTrue(hierarchy.getSection("committee_members").isList());
        assertFalse(hierarchy.getSection("dodgeball").isList());
        assertTrue(hierarchy.getSection("dodgeball").isEmpty());
    }

    @Test
    public void testSectionKindIsEnforced() {
        assertThrows(IllegalArgumentException.class, () -> hierarchy.getListSection("dodgeball"));
        assertThrows(IllegalArgumentException.class, () -> hierarchy.getTreeSection("committee_members"));
        assertThrows(IllegalArgumentException.class, () -> hierarchy.getSection("curling"));
        assertFalse(hierarchy.getPosition("committee_members", "anything").isPresent());
        assertFalse(hierarchy.getPosition("curling", "director").isPresent());
    }

    @Test
    public void testVacantPersonCannotBeWrittenIntoTree() {
        assertThrows(IllegalArgumentException.class, () -> hierarchy.addPosition("executive_board",
                position("executive_board", "treasurer"), PersonInfo.vacant("Treasurer", "Vacant")));
    }

    @Test
    public void testPositionLookupByPath() {
        hierarchy.addPosition("dodgeball", position("dodgeball", "small_ball.advanced.director"),
                person("Small Ball Advanced Director", "Drew Fox", "drew@bars.org"));

        assertEquals("Drew Fox",
                hierarchy.getPosition(HierarchyPath.parse("dodgeball.small_ball.advanced.director")).get().getName());
        assertFalse(hierarchy.getPosition(HierarchyPath.parse("dodgeball.small_ball.social.director")).isPresent());
    }

    @Test
    public void testWithAccountIdsReturnsEnrichedCopy() {
        hierarchy.addPosition("executive_board", position("executive_board", "commissioner"),
                person("Commissioner", "Alex Rivera", "alex@bars.org"));
        hierarchy.addPosition("executive_board", position("executive_board", "treasurer"),
                person("Treasurer", "Sam Patel", "sam@bars.org"));
        hierarchy.addMember("committee_members",
                new RosterEntry("photographer", person("Photographer", "Avery Jones", "alex@bars.org")));
        hierarchy.addVacant("executive_board", position("executive_board", "vice_commissioner"));
        hierarchy.freeze();

        Map<String, String> ids = new HashMap<>();
        ids.put("alex@bars.org", "U123");
        LeadershipHierarchy enriched = hierarchy.withAccountIds(ids);

        assertEquals("U123", enriched.getPosition("executive_board", "commissioner").get().getSlackUserId());
        assertNull(enriched.getPosition("executive_board", "treasurer").get().getSlackUserId());
        assertEquals("U123", enriched.getListSection("committee_members").getMembers().get(0)
                .getPerson().getSlackUserId());
        assertNull(hierarchy.getPosition("executive_board", "commissioner").get().getSlackUserId(),
                "original is untouched");

        HierarchySummary summary = enriched.getSummary();
        assertEquals(3, summary.getTotalPositions());
        assertEquals(2, summary.getWithSlackUserId());
        assertEquals(1, summary.getVacantCount());
        assertEquals(hierarchy.getVacantPositions(), enriched.getVacantPositions());
        assertTrue(enriched.isFrozen());

        @SuppressWarnings("unchecked")
        Map<String, Object> record = (Map<String, Object>) ((Map<String, Object>) enriched.toMap()
                .get("executive_board")).get("commissioner");
        assertEquals("U123", record.get("slack_user_id"));
    }

    @Test
    public void testWithAccountIdsKeepsExistingIds() {
        hierarchy.addPosition("executive_board", position("executive_board", "commissioner"),
                person("Commissioner", "Alex Rivera", "alex@bars.org").withSlackUserId("U999"));

        LeadershipHierarchy enriched = hierarchy.withAccountIds(Collections.emptyMap());
        assertEquals("U999", enriched.getPosition("executive_board", "commissioner").get().getSlackUserId());
    }

    @Test
    public void testExtractEmailsSkipsBlankAndDuplicates() {
        hierarchy.addPosition("executive_board", position("executive_board", "commissioner"),
                person("Commissioner", "Alex Rivera", "alex@bars.org"));
        hierarchy.addPosition("executive_board", position("executive_board", "treasurer"),
                person("Treasurer", "Sam Patel", ""));
        hierarchy.addMember("committee_members",
                new RosterEntry("photographer", person("Photographer", "Alex Rivera", "alex@bars.org")));
        hierarchy.addMember("committee_members",
                new RosterEntry("videographer", PersonInfo.vacant("Videographer", "Vacant")));

        assertEquals(Collections.singletonList("alex@bars.org"), hierarchy.extractEmails());
    }

    @Test
    public void testEmailsDifferingOnlyInCaseAreOneLookup() {
        hierarchy.addPosition("executive_board", position("executive_board", "commissioner"),
                person("Commissioner", "Alex Rivera", "Alex@BARS.org"));
        hierarchy.addMember("committee_members",
                new RosterEntry("photographer", person("Photographer", "Alex Rivera", " alex@bars.org")));

        assertEquals(Collections.singletonList("alex@bars.org"), hierarchy.extractEmails());

        Map<String, String> ids = new HashMap<>();
        ids.put("alex@bars.org", "U123");
        LeadershipHierarchy enriched = hierarchy.withAccountIds(ids);
        assertEquals("U123", enriched.getPosition("executive_board", "commissioner").get().getSlackUserId());
        assertEquals("U123", enriched.getListSection("committee_members").getMembers().get(0)
                .getPerson().getSlackUserId());
        assertEquals("Alex@BARS.org", enriched.getPosition("executive_board", "commissioner").get().getBarsEmail(),
                "record keeps the email as written");
    }

    @Test
    public void testSummaryIgnoresVacantListMembers() {
        hierarchy.addMember("committee_members",
                new RosterEntry("photographer", PersonInfo.vacant("Photographer", "VACANT")));
        hierarchy.addMember("committee_members",
                new RosterEntry("host", person("Host", "Lee", "lee@bars.org")));

        assertEquals(1, hierarchy.getSummary().getTotalPositions());
        assertEquals(0, hierarchy.getSummary().getVacantCount());
    }

    @Test
    public void testPersonRecordKeepsNullOptionals() {
        Map<String, Object> record = person("Secretary", "Sam", "sam@bars.org").toRecord();
        assertTrue(record.containsKey("personal_email"));
        assertNull(record.get("personal_email"));
        assertNull(record.get("phone"));
        assertNull(record.get("birthday"));
        assertEquals("sam@bars.org", record.get("bars_email"));
    }
}
